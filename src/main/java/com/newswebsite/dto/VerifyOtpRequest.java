package com.newswebsite.dto;

public class VerifyOtpRequest {
    private String email;
    private String token;

    public VerifyOtpRequest() {}

    public VerifyOtpRequest(String email, String token) {
        this.email = email;
        this.token = token;
    }

    public String getEmail() { return email; }
    public void setEmail(String email) { this.email = email; }

    public String getToken() { return token; }
    public void setToken(String token) { this.token = token; }
}
