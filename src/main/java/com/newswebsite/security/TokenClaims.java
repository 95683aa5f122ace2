package com.newswebsite.security;

/**
 * Verified content of a session token.
 */
public record TokenClaims(Long userId, String role) {
}
