package com.newswebsite.security;

import com.newswebsite.entity.Role;
import com.newswebsite.entity.User;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

import java.util.List;

/**
 * Identity attached to the security context once a session token checks out.
 */
public class AuthenticatedUser extends AbstractAuthenticationToken {

    private final Long id;
    private final String email;
    private final Role role;

    public AuthenticatedUser(User user) {
        super(List.of(new SimpleGrantedAuthority("ROLE_" + user.getRole().name())));
        this.id = user.getId();
        this.email = user.getEmail();
        this.role = user.getRole();
        setAuthenticated(true);
    }

    public Long getId() {
        return id;
    }

    public String getEmail() {
        return email;
    }

    public Role getRole() {
        return role;
    }

    @Override
    public Object getCredentials() {
        return null;
    }

    @Override
    public Object getPrincipal() {
        return this;
    }

    @Override
    public String getName() {
        return String.valueOf(id);
    }
}
