package com.example.bugretention.http;

/**
 * Identity headers set by the upstream gateway after authentication.
 */
final class CallerHeaders {

    static final String USER_ID = "X-User-Id";
    static final String USER_ROLE = "X-User-Role";
    static final String ADMIN_ROLE = "admin";

    private CallerHeaders() {
    }

    static boolean isAdmin(String role) {
        return role != null && ADMIN_ROLE.equalsIgnoreCase(role.trim());
    }
}
