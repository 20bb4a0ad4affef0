package com.tau.backend.global.security;

import java.io.IOException;
import java.util.List;

import com.tau.backend.global.error.ProblemResponseWriter;
import com.tau.backend.modules.auth.application.AuthException;
import com.tau.backend.modules.auth.application.AuthenticationResult;
import com.tau.backend.modules.auth.application.AuthenticationService;
import com.tau.backend.modules.auth.application.PasswordHashException;
import com.tau.backend.modules.auth.domain.AuthenticatedUser;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates every request that carries an {@code Authorization} header or a session cookie.
 * Requests with neither pass through unauthenticated and are rejected later by
 * {@link RestAuthenticationEntryPoint} if the endpoint needs a caller.
 */
@Component
public class SessionAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(SessionAuthenticationFilter.class);

    public static final String INFRASTRUCTURE_ADMIN_AUTHORITY = "INFRASTRUCTURE_ADMIN";

    private final AuthenticationService authenticationService;
    private final SessionCookieFactory sessionCookieFactory;
    private final ProblemResponseWriter problemResponseWriter;

    public SessionAuthenticationFilter(
            AuthenticationService authenticationService,
            SessionCookieFactory sessionCookieFactory,
            ProblemResponseWriter problemResponseWriter
    ) {
        this.authenticationService = authenticationService;
        this.sessionCookieFactory = sessionCookieFactory;
        this.problemResponseWriter = problemResponseWriter;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        String cookie = sessionCookieFactory.readToken(request);
        if (authorization == null && (cookie == null || cookie.isEmpty())) {
            filterChain.doFilter(request, response);
            return;
        }

        AuthenticationResult result;
        try {
            result = authenticationService.authenticate(authorization, cookie);
        } catch (AuthException ex) {
            SecurityContextHolder.clearContext();
            problemResponseWriter.write(request, response, ex);
            return;
        } catch (DataAccessException | PasswordHashException ex) {
            log.error("Authentication failed internally for {} {}", request.getMethod(), request.getRequestURI(), ex);
            SecurityContextHolder.clearContext();
            problemResponseWriter.writeInternalError(request, response);
            return;
        }

        AuthenticatedUser user = result.user();
        List<GrantedAuthority> authorities = user.infrastructureAdmin()
                ? List.of(new SimpleGrantedAuthority(INFRASTRUCTURE_ADMIN_AUTHORITY))
                : List.of();
        UsernamePasswordAuthenticationToken authentication =
                new UsernamePasswordAuthenticationToken(user, null, authorities);
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(authentication);

        result.renewedSessionToken().ifPresent(token ->
                response.addHeader(HttpHeaders.SET_COOKIE, sessionCookieFactory.sessionCookie(token).toString()));

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getServletPath();
        if (request.getMethod().equalsIgnoreCase("OPTIONS")) {
            return true;
        }
        return path.startsWith("/auth/") || path.equals("/health") || path.startsWith("/actuator/health");
    }
}
