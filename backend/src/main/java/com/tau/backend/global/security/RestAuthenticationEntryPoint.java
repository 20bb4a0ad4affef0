package com.tau.backend.global.security;

import java.io.IOException;

import com.tau.backend.global.error.ProblemResponseWriter;
import com.tau.backend.modules.auth.application.AuthErrorCode;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

@Component
public class RestAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final ProblemResponseWriter problemResponseWriter;

    public RestAuthenticationEntryPoint(ProblemResponseWriter problemResponseWriter) {
        this.problemResponseWriter = problemResponseWriter;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authException)
            throws IOException {
        AuthErrorCode code = AuthErrorCode.NO_CREDENTIALS;
        problemResponseWriter.write(request, response, code.status(), code.name(), code.detail());
    }
}
