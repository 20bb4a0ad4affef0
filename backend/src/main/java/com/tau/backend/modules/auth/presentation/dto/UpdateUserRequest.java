package com.tau.backend.modules.auth.presentation.dto;

import com.tau.backend.modules.auth.domain.PhotoUrl;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/** Partial user update; absent fields keep their stored value. */
public record UpdateUserRequest(
        @Size(min = 1, max = 100, message = "handle must be 1-100 characters")
        @Pattern(regexp = "^\\S+$", message = "handle must not contain whitespace") String handle,
        PhotoUrl profilePicture,
        @Size(min = 8, max = 256, message = "password must be 8-256 characters") String password
) {

    @Override
    public String toString() {
        return "UpdateUserRequest[handle=" + handle + ", profilePicture=" + profilePicture
                + ", password=" + (password == null ? "null" : "****") + "]";
    }
}
