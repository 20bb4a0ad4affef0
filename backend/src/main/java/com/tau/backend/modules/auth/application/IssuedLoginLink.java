package com.tau.backend.modules.auth.application;

import com.tau.backend.modules.auth.domain.LoginToken;

public record IssuedLoginLink(LoginToken token, String rawToken, String path) {
}
