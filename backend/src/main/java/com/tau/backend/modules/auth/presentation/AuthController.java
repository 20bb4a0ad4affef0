package com.tau.backend.modules.auth.presentation;

import com.tau.backend.global.security.SessionCookieFactory;
import com.tau.backend.modules.auth.application.AuthenticationService;
import com.tau.backend.modules.auth.application.IssuedSession;
import com.tau.backend.modules.auth.application.LoginLinkService;
import com.tau.backend.modules.auth.presentation.dto.LoginRequest;
import com.tau.backend.modules.auth.presentation.dto.SessionTokenResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth")
public class AuthController {

    private final AuthenticationService authenticationService;
    private final LoginLinkService loginLinkService;
    private final SessionCookieFactory sessionCookieFactory;

    public AuthController(
            AuthenticationService authenticationService,
            LoginLinkService loginLinkService,
            SessionCookieFactory sessionCookieFactory
    ) {
        this.authenticationService = authenticationService;
        this.loginLinkService = loginLinkService;
        this.sessionCookieFactory = sessionCookieFactory;
    }

    @Operation(summary = "Log in with a password", description = "Opens a session and sets the session cookie.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Session created"),
            @ApiResponse(responseCode = "401", description = "Invalid credentials")
    })
    @PostMapping("/login")
    public ResponseEntity<SessionTokenResponse> login(@Valid @RequestBody LoginRequest request) {
        IssuedSession issued = authenticationService.login(request.login(), request.password());
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, sessionCookieFactory.sessionCookie(issued.rawToken()).toString())
                .body(SessionTokenResponse.from(issued));
    }

    @Operation(summary = "Redeem a login link", description = "Consumes a single-use login token and returns a session token.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Session created; body is the raw session token"),
            @ApiResponse(responseCode = "401", description = "Token invalid, expired or already used")
    })
    @GetMapping("/login/{token}")
    public ResponseEntity<String> redeemLoginLink(@PathVariable("token") String token) {
        IssuedSession issued = loginLinkService.redeemForSession(token);
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, sessionCookieFactory.sessionCookie(issued.rawToken()).toString())
                .body(issued.rawToken());
    }

    @Operation(summary = "Log out", description = "Destroys the session named by the Bearer header or the session cookie.")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Session destroyed"),
            @ApiResponse(responseCode = "400", description = "No session token, or conflicting tokens"),
            @ApiResponse(responseCode = "401", description = "Unknown session token")
    })
    @GetMapping("/clear")
    public ResponseEntity<Void> clear(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            HttpServletRequest request
    ) {
        authenticationService.logout(authorization, sessionCookieFactory.readToken(request));
        return ResponseEntity.noContent()
                .header(HttpHeaders.SET_COOKIE, sessionCookieFactory.clearedCookie().toString())
                .build();
    }
}
