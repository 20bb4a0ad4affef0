package com.tau.backend.global.error;

import java.io.IOException;

import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

/**
 * Writes problem bodies for failures raised outside the MVC dispatch, where
 * {@link RestExceptionHandler} cannot see them (security filters, entry points).
 */
@Component
public class ProblemResponseWriter {

    private final ObjectMapper objectMapper;

    public ProblemResponseWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void write(HttpServletRequest request, HttpServletResponse response, HttpStatus status, String code, String detail)
            throws IOException {
        ProblemResponse body = ProblemResponse.of(status, code, detail, request.getRequestURI());

        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }

    public void write(HttpServletRequest request, HttpServletResponse response, ProblemException problem)
            throws IOException {
        write(request, response, problem.getHttpStatus(), problem.getCode(), problem.getDetailMessage());
    }

    /** Same opaque 500 body that {@link RestExceptionHandler} returns for unexpected failures. */
    public void writeInternalError(HttpServletRequest request, HttpServletResponse response) throws IOException {
        write(request, response, HttpStatus.INTERNAL_SERVER_ERROR,
                RestExceptionHandler.INTERNAL_ERROR_CODE, RestExceptionHandler.INTERNAL_ERROR_DETAIL);
    }
}
