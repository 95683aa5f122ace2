package com.newswebsite.security;

import com.newswebsite.entity.Role;
import com.newswebsite.entity.User;
import com.newswebsite.exception.InvalidTokenException;
import com.newswebsite.repository.UserRepository;
import jakarta.servlet.FilterChain;
import jakarta.servlet.http.Cookie;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JwtAuthenticationFilterTest {

    private JwtService jwtService;
    private UserRepository userRepository;
    private JwtAuthenticationFilter filter;
    private MockHttpServletRequest request;
    private MockHttpServletResponse response;
    private FilterChain chain;

    @BeforeEach
    void setUp() {
        jwtService = mock(JwtService.class);
        userRepository = mock(UserRepository.class);
        filter = new JwtAuthenticationFilter(jwtService, userRepository);
        request = new MockHttpServletRequest("GET", "/api/v1/news");
        response = new MockHttpServletResponse();
        chain = mock(FilterChain.class);
        SecurityContextHolder.clearContext();
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
        ThreadContext.clearAll();
    }

    @Test
    void missingTokenLeavesCallerAnonymous() throws Exception {
        filter.doFilter(request, response, chain);

        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
        assertThat(request.getAttribute(JwtAuthenticationFilter.AUTH_FAILURE_ATTRIBUTE))
                .isEqualTo(JwtAuthenticationFilter.NOT_LOGGED_IN);
        verify(chain).doFilter(request, response);
    }

    @Test
    void cookieTokenAuthenticatesActiveUser() throws Exception {
        request.setCookies(new Cookie("jwt", "cookie-token"));
        when(jwtService.parse("cookie-token")).thenReturn(new TokenClaims(7L, "ADMIN"));
        when(userRepository.findById(7L)).thenReturn(Optional.of(user(7L, Role.ADMIN, true)));

        filter.doFilter(request, response, chain);

        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        assertThat(authentication).isInstanceOf(AuthenticatedUser.class);
        assertThat(((AuthenticatedUser) authentication).getId()).isEqualTo(7L);
        assertThat(authentication.getAuthorities()).extracting("authority").containsExactly("ROLE_ADMIN");
        verify(chain).doFilter(request, response);
    }

    @Test
    void bearerHeaderIsUsedWhenNoCookie() throws Exception {
        request.addHeader("Authorization", "Bearer header-token");
        when(jwtService.parse("header-token")).thenReturn(new TokenClaims(3L, "EDITOR"));
        when(userRepository.findById(3L)).thenReturn(Optional.of(user(3L, Role.EDITOR, true)));

        filter.doFilter(request, response, chain);

        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNotNull();
    }

    @Test
    void loggedOutCookieDoesNotShadowBearerHeader() throws Exception {
        request.setCookies(new Cookie("jwt", JwtAuthenticationFilter.LOGGED_OUT_VALUE));
        request.addHeader("Authorization", "Bearer header-token");
        when(jwtService.parse("header-token")).thenReturn(new TokenClaims(4L, "ADMIN"));
        when(userRepository.findById(4L)).thenReturn(Optional.of(user(4L, Role.ADMIN, true)));

        filter.doFilter(request, response, chain);

        assertThat(SecurityContextHolder.getContext().getAuthentication()).isInstanceOf(AuthenticatedUser.class);
        assertThat(request.getAttribute(JwtAuthenticationFilter.AUTH_FAILURE_ATTRIBUTE)).isNull();
    }

    @Test
    void loggedOutCookieAloneCountsAsNotLoggedIn() throws Exception {
        request.setCookies(new Cookie("jwt", JwtAuthenticationFilter.LOGGED_OUT_VALUE));

        filter.doFilter(request, response, chain);

        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
        assertThat(request.getAttribute(JwtAuthenticationFilter.AUTH_FAILURE_ATTRIBUTE))
                .isEqualTo(JwtAuthenticationFilter.NOT_LOGGED_IN);
    }

    @Test
    void invalidTokenRecordsReasonAndContinues() throws Exception {
        request.addHeader("Authorization", "Bearer broken");
        when(jwtService.parse("broken"))
                .thenThrow(new InvalidTokenException("bad", new IllegalArgumentException("bad signature")));

        filter.doFilter(request, response, chain);

        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
        assertThat(request.getAttribute(JwtAuthenticationFilter.AUTH_FAILURE_ATTRIBUTE))
                .isEqualTo(JwtAuthenticationFilter.TOKEN_INVALID);
        verify(chain).doFilter(request, response);
    }

    @Test
    void deletedUserIsNotAuthenticated() throws Exception {
        request.addHeader("Authorization", "Bearer orphan");
        when(jwtService.parse("orphan")).thenReturn(new TokenClaims(99L, "EDITOR"));
        when(userRepository.findById(99L)).thenReturn(Optional.empty());

        filter.doFilter(request, response, chain);

        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
        assertThat(request.getAttribute(JwtAuthenticationFilter.AUTH_FAILURE_ATTRIBUTE))
                .isEqualTo(JwtAuthenticationFilter.USER_GONE);
    }

    @Test
    void inactiveUserIsNotAuthenticated() throws Exception {
        request.addHeader("Authorization", "Bearer inactive");
        when(jwtService.parse("inactive")).thenReturn(new TokenClaims(5L, "EDITOR"));
        when(userRepository.findById(5L)).thenReturn(Optional.of(user(5L, Role.EDITOR, false)));

        filter.doFilter(request, response, chain);

        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
        assertThat(request.getAttribute(JwtAuthenticationFilter.AUTH_FAILURE_ATTRIBUTE))
                .isEqualTo(JwtAuthenticationFilter.USER_INACTIVE);
    }

    private static User user(Long id, Role role, boolean active) {
        User user = new User();
        user.setId(id);
        user.setEmail("user" + id + "@example.com");
        user.setRole(role);
        user.setIsActive(active);
        user.setIsVerified(true);
        return user;
    }
}
