package com.newswebsite.service;

import com.newswebsite.entity.User;

public record LoginResult(String token, User user) {
}
