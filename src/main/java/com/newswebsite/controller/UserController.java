package com.newswebsite.controller;

import com.newswebsite.dto.ApiResponse;
import com.newswebsite.dto.PageQuery;
import com.newswebsite.dto.PageResult;
import com.newswebsite.dto.PasswordRequest;
import com.newswebsite.dto.UserRequest;
import com.newswebsite.entity.User;
import com.newswebsite.service.UserService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Dashboard user management, ADMIN only.
 */
@RestController
@RequestMapping("/api/v1/users")
public class UserController {

    private final UserService userService;

    public UserController(UserService userService) {
        this.userService = userService;
    }

    @PostMapping
    public ResponseEntity<ApiResponse<User>> create(@RequestBody UserRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("User created successfully", userService.create(request)));
    }

    @GetMapping
    public ResponseEntity<ApiResponse<PageResult<User>>> list(@RequestParam(required = false) Integer page,
                                                              @RequestParam(required = false) Integer limit,
                                                              @RequestParam(required = false) String search,
                                                              @RequestParam(required = false) String role,
                                                              @RequestParam(required = false) String isActive) {
        PageQuery query = new PageQuery(page, limit, search, null, null);
        return ResponseEntity.ok(ApiResponse.success("Users retrieved successfully",
                userService.list(query, role, isActive)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<User>> get(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success("User retrieved successfully", userService.get(id)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<User>> update(@PathVariable Long id, @RequestBody UserRequest request) {
        return ResponseEntity.ok(ApiResponse.success("User updated successfully", userService.update(id, request)));
    }

    @PatchMapping("/{id}/password")
    public ResponseEntity<ApiResponse<Map<String, Object>>> updatePassword(@PathVariable Long id,
                                                                           @RequestBody PasswordRequest request) {
        return ResponseEntity.ok(ApiResponse.success("Password updated successfully",
                userService.updatePassword(id, request.getPassword())));
    }

    @PatchMapping("/{id}/toggle-status")
    public ResponseEntity<ApiResponse<User>> toggleStatus(@PathVariable Long id) {
        User user = userService.toggleActive(id);
        return ResponseEntity.ok(ApiResponse.success(
                "User " + (Boolean.TRUE.equals(user.getIsActive()) ? "activated" : "deactivated") + " successfully",
                user));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Map<String, Object>>> delete(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success("User deleted successfully", userService.delete(id)));
    }
}
