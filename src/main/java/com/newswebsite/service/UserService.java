package com.newswebsite.service;

import com.newswebsite.dto.PageQuery;
import com.newswebsite.dto.PageResult;
import com.newswebsite.dto.UserRequest;
import com.newswebsite.entity.Role;
import com.newswebsite.entity.User;
import com.newswebsite.exception.ResourceNotFoundException;
import com.newswebsite.exception.ValidationException;
import com.newswebsite.repository.BlogRepository;
import com.newswebsite.repository.UserRepository;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Dashboard user administration.
 */
@Service
public class UserService {

    private static final Logger LOG = LogManager.getLogger(UserService.class);

    private static final String RESOURCE = "User";
    private static final String INVALID_ROLE = "Role must be either EDITOR or ADMIN";
    private static final String INVALID_EMAIL = "Please provide a valid email address";

    private final UserRepository userRepository;
    private final BlogRepository blogRepository;
    private final PasswordEncoder passwordEncoder;

    public UserService(UserRepository userRepository, BlogRepository blogRepository, PasswordEncoder passwordEncoder) {
        this.userRepository = userRepository;
        this.blogRepository = blogRepository;
        this.passwordEncoder = passwordEncoder;
    }

    /**
     * Users created here skip e-mail verification.
     */
    @Transactional
    public User create(UserRequest request) {
        Inputs.requireAll("Email and password are required", request.getEmail(), request.getPassword());
        String email = request.getEmail().trim();
        if (!Inputs.isValidEmail(email)) {
            throw new ValidationException(INVALID_EMAIL);
        }
        Role role = parseRole(request.getRole());
        if (userRepository.findByEmail(email).isPresent()) {
            throw new ValidationException("User with this email already exists");
        }

        User user = new User();
        user.setEmail(email);
        user.setName(Inputs.isBlank(request.getName()) ? null : request.getName());
        user.setPassword(passwordEncoder.encode(request.getPassword()));
        user.setRole(role != null ? role : Role.EDITOR);
        user.setIsVerified(true);
        user.setIsActive(request.getIsActive() != null ? request.getIsActive() : Boolean.TRUE);
        try {
            User saved = userRepository.saveAndFlush(user);
            LOG.info("Created user {} with role {}", saved.getId(), saved.getRole());
            return saved;
        } catch (DataIntegrityViolationException e) {
            // lost a race with a concurrent create for the same address
            throw new ValidationException("User with this email already exists");
        }
    }

    public PageResult<User> list(PageQuery query, String role, String isActive) {
        Role roleFilter = Inputs.isBlank(role) ? null : parseRole(role);
        Specification<User> spec = Specification.allOf(
                Specs.containsAny(query.getSearch(), "email", "name"),
                Specs.equal("role", roleFilter),
                Specs.equal("isActive", Specs.flag(isActive)));
        return PageResult.of("users",
                userRepository.findAll(spec, query.toPageable(Map.of(), "createdAt", Sort.Direction.DESC)), query);
    }

    public User get(Long id) {
        return userRepository.findById(id).orElseThrow(() -> new ResourceNotFoundException(RESOURCE));
    }

    @Transactional
    public User update(Long id, UserRequest request) {
        User user = get(id);
        if (!Inputs.isBlank(request.getName())) {
            user.setName(request.getName());
        }
        if (!Inputs.isBlank(request.getEmail())) {
            String email = request.getEmail().trim();
            if (!Inputs.isValidEmail(email)) {
                throw new ValidationException(INVALID_EMAIL);
            }
            if (userRepository.existsByEmailAndIdNot(email, id)) {
                throw new ValidationException("Email is already taken by another user");
            }
            user.setEmail(email);
        }
        if (!Inputs.isBlank(request.getPassword())) {
            user.setPassword(passwordEncoder.encode(request.getPassword()));
        }
        if (!Inputs.isBlank(request.getRole())) {
            user.setRole(parseRole(request.getRole()));
        }
        if (request.getIsActive() != null) {
            user.setIsActive(request.getIsActive());
        }
        if (request.getIsVerified() != null) {
            user.setIsVerified(request.getIsVerified());
        }
        return userRepository.save(user);
    }

    @Transactional
    public Map<String, Object> updatePassword(Long id, String password) {
        if (Inputs.isBlank(password)) {
            throw new ValidationException("Password is required");
        }
        User user = get(id);
        user.setPassword(passwordEncoder.encode(password));
        userRepository.save(user);
        LOG.info("Password changed for user {}", id);
        return Map.of("id", user.getId());
    }

    @Transactional
    public User toggleActive(Long id) {
        if (userRepository.toggleActive(id, LocalDateTime.now()) == 0) {
            throw new ResourceNotFoundException(RESOURCE);
        }
        return get(id);
    }

    /**
     * Blogs written by the user stay, without an author.
     */
    @Transactional
    public Map<String, Object> delete(Long id) {
        User user = get(id);
        blogRepository.clearAuthor(id);
        userRepository.deleteById(id);
        LOG.info("Deleted user {}", id);
        Map<String, Object> deleted = new LinkedHashMap<>();
        deleted.put("id", user.getId());
        deleted.put("email", user.getEmail());
        deleted.put("name", user.getName());
        return deleted;
    }

    private static Role parseRole(String value) {
        if (value == null) {
            return null;
        }
        Role role = Role.fromName(value);
        if (role == null) {
            throw new ValidationException(INVALID_ROLE);
        }
        return role;
    }
}
