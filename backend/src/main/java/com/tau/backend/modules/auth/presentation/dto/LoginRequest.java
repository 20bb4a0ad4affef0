package com.tau.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record LoginRequest(
        @NotBlank(message = "login is required") String login,
        @NotBlank(message = "password is required") String password
) {

    @Override
    public String toString() {
        return "LoginRequest[login=" + login + ", password=****]";
    }
}
