package com.example.userload.client;

import java.util.Objects;

/**
 * Credentials of a user the service accepted, kept so the login path can be exercised later.
 */
public final class CreatedUser {

    private final String email;
    private final String password;
    private final String username;
    private final String userId;

    public CreatedUser(String email, String password, String username, String userId) {
        this.email = Objects.requireNonNull(email, "email");
        this.password = Objects.requireNonNull(password, "password");
        this.username = Objects.requireNonNull(username, "username");
        this.userId = Objects.requireNonNull(userId, "userId");
    }

    public String getEmail() {
        return email;
    }

    public String getPassword() {
        return password;
    }

    public String getUsername() {
        return username;
    }

    public String getUserId() {
        return userId;
    }

    @Override
    public String toString() {
        return "CreatedUser{email=" + email + ", username=" + username + ", userId=" + userId + "}";
    }
}
