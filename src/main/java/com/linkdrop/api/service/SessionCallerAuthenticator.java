package com.linkdrop.api.service;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpSession;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Treats a caller as authenticated when the login flow left a {@code user} attribute in the session. With
 * {@code app.auth.enabled=false} everybody is.
 */
@Component
public class SessionCallerAuthenticator implements CallerAuthenticator {

    public static final String USER_ATTRIBUTE = "user";

    private final boolean enabled;

    public SessionCallerAuthenticator(@Value("${app.auth.enabled:false}") boolean enabled) {
        this.enabled = enabled;
    }

    @Override
    public boolean isAuthenticated(HttpServletRequest request) {
        if (!enabled) {
            return true;
        }
        HttpSession session = request.getSession(false);
        return session != null && session.getAttribute(USER_ATTRIBUTE) != null;
    }
}
