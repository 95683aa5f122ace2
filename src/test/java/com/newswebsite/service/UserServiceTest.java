package com.newswebsite.service;

import com.newswebsite.dto.BlogRequest;
import com.newswebsite.dto.PageQuery;
import com.newswebsite.dto.UserRequest;
import com.newswebsite.entity.Blog;
import com.newswebsite.entity.Role;
import com.newswebsite.entity.User;
import com.newswebsite.exception.ResourceNotFoundException;
import com.newswebsite.exception.ValidationException;
import com.newswebsite.repository.BlogRepository;
import com.newswebsite.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class UserServiceTest {

    @Autowired
    private UserService userService;

    @Autowired
    private BlogService blogService;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private BlogRepository blogRepository;

    @Autowired
    private PasswordEncoder passwordEncoder;

    @MockBean
    private NotificationService notificationService;

    @MockBean
    private MediaStorage mediaStorage;

    @BeforeEach
    void setUp() {
        blogRepository.deleteAll();
        userRepository.deleteAll();
    }

    @Test
    void createdUserIsVerifiedWithHashedPassword() {
        User user = userService.create(new UserRequest("admin@example.se", "pass-1234", "Ada", "ADMIN", null, null));

        assertThat(user.getRole()).isEqualTo(Role.ADMIN);
        assertThat(user.getIsVerified()).isTrue();
        assertThat(user.getIsActive()).isTrue();
        assertThat(passwordEncoder.matches("pass-1234", user.getPassword())).isTrue();
    }

    @Test
    void unknownRoleIsRejected() {
        assertThatThrownBy(() -> userService.create(new UserRequest("x@example.se", "pass", null, "READER", null, null)))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Role must be either EDITOR or ADMIN");
    }

    @Test
    void duplicateEmailIsRejected() {
        userService.create(new UserRequest("x@example.se", "pass", null, null, null, null));

        assertThatThrownBy(() -> userService.create(new UserRequest("x@example.se", "pass", null, null, null, null)))
                .isInstanceOf(ValidationException.class)
                .hasMessage("User with this email already exists");
    }

    @Test
    void updateToTakenEmailIsRejected() {
        userService.create(new UserRequest("a@example.se", "pass", null, null, null, null));
        User b = userService.create(new UserRequest("b@example.se", "pass", null, null, null, null));

        assertThatThrownBy(() -> userService.update(b.getId(), new UserRequest("a@example.se", null, null, null, null, null)))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Email is already taken by another user");
    }

    @Test
    void listFiltersByRole() {
        userService.create(new UserRequest("a@example.se", "pass", null, "ADMIN", null, null));
        userService.create(new UserRequest("e@example.se", "pass", null, "EDITOR", null, null));

        assertThat(userService.list(PageQuery.of(1, 10), "ADMIN", null).getItems())
                .extracting(User::getEmail).containsExactly("a@example.se");
    }

    @Test
    void passwordChangeRehashes() {
        User user = userService.create(new UserRequest("a@example.se", "old-pass", null, null, null, null));

        Map<String, Object> result = userService.updatePassword(user.getId(), "new-pass");

        assertThat(result).containsEntry("id", user.getId());
        assertThat(passwordEncoder.matches("new-pass", userRepository.findById(user.getId()).orElseThrow().getPassword()))
                .isTrue();
    }

    @Test
    void toggleFlipsActiveOnly() {
        User user = userService.create(new UserRequest("a@example.se", "pass", null, "ADMIN", null, null));

        User toggled = userService.toggleActive(user.getId());

        assertThat(toggled.getIsActive()).isFalse();
        assertThat(toggled.getRole()).isEqualTo(Role.ADMIN);
        assertThat(toggled.getIsVerified()).isTrue();
    }

    @Test
    void deletingAuthorKeepsTheirBlogs() {
        User author = userService.create(new UserRequest("writer@example.se", "pass", "Writer", null, null, null));
        Blog blog = blogService.create(new BlogRequest("Notes", "Body", "Travel", null, null), null, author.getId());
        assertThat(blog.getAuthorId()).isEqualTo(author.getId());

        Map<String, Object> deleted = userService.delete(author.getId());

        assertThat(deleted).containsEntry("email", "writer@example.se").containsEntry("name", "Writer");
        assertThat(userRepository.existsById(author.getId())).isFalse();
        assertThat(blogRepository.findById(blog.getId()).orElseThrow().getAuthor()).isNull();
    }

    @Test
    void deletingUnknownUserIsNotFound() {
        assertThatThrownBy(() -> userService.delete(424242L))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("User not found");
    }
}
