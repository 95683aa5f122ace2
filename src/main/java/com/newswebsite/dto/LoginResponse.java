package com.newswebsite.dto;

import com.newswebsite.entity.User;

/**
 * Data part of a successful login. The token itself travels in the envelope and the cookie.
 */
public class LoginResponse {
    private UserSummary user;

    public LoginResponse() {}

    public static LoginResponse of(User user) {
        LoginResponse response = new LoginResponse();
        response.user = new UserSummary(user.getId(), user.getName(), user.getEmail(), user.getRole().name());
        return response;
    }

    public UserSummary getUser() { return user; }
    public void setUser(UserSummary user) { this.user = user; }

    public record UserSummary(Long id, String name, String email, String role) {}
}
