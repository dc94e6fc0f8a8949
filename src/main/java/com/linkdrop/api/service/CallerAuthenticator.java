package com.linkdrop.api.service;

import jakarta.servlet.http.HttpServletRequest;

/**
 * The one question the share API asks about identity. The login flow that answers it lives elsewhere.
 */
public interface CallerAuthenticator {

    boolean isAuthenticated(HttpServletRequest request);
}
