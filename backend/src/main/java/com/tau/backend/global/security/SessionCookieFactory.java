package com.tau.backend.global.security;

import java.time.Duration;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;

/**
 * Builds and reads the session cookie. The cookie is never readable from scripts and is
 * only sent on same-site requests.
 */
@Component
public class SessionCookieFactory {

    private final String cookieName;
    private final boolean secure;
    private final Duration sessionLifetime;

    public SessionCookieFactory(
            @Value("${tau.auth.cookie-name:tausession}") String cookieName,
            @Value("${tau.auth.cookie-secure:true}") boolean secure,
            @Value("${tau.auth.session-lifetime:P7D}") Duration sessionLifetime
    ) {
        this.cookieName = cookieName;
        this.secure = secure;
        this.sessionLifetime = sessionLifetime;
    }

    public ResponseCookie sessionCookie(String rawToken) {
        return baseCookie(rawToken).maxAge(sessionLifetime).build();
    }

    public ResponseCookie clearedCookie() {
        return baseCookie("").maxAge(Duration.ZERO).build();
    }

    public String readToken(HttpServletRequest request) {
        Cookie[] cookies = request.getCookies();
        if (cookies == null) {
            return null;
        }
        for (Cookie cookie : cookies) {
            if (cookieName.equals(cookie.getName())) {
                return cookie.getValue();
            }
        }
        return null;
    }

    private ResponseCookie.ResponseCookieBuilder baseCookie(String value) {
        return ResponseCookie.from(cookieName, value)
                .httpOnly(true)
                .secure(secure)
                .sameSite("Strict")
                .path("/");
    }
}
