package com.newswebsite.controller;

import com.newswebsite.dto.ApiResponse;
import com.newswebsite.dto.BlogRequest;
import com.newswebsite.dto.PageQuery;
import com.newswebsite.dto.PageResult;
import com.newswebsite.entity.Blog;
import com.newswebsite.security.AuthenticatedUser;
import com.newswebsite.service.BlogService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.Map;

/**
 * Writes accept either multipart form data (with an optional {@code pdfFile}) or plain JSON.
 */
@RestController
@RequestMapping("/api/v1/blogs")
public class BlogController {

    private final BlogService blogService;

    public BlogController(BlogService blogService) {
        this.blogService = blogService;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<PageResult<Blog>>> list(@RequestParam(required = false) Integer page,
                                                              @RequestParam(required = false) Integer limit,
                                                              @RequestParam(required = false) String search,
                                                              @RequestParam(required = false) String active,
                                                              @RequestParam(required = false) String category,
                                                              @RequestParam(required = false) String featured,
                                                              @RequestParam(required = false) String sortBy,
                                                              @RequestParam(required = false) String sortOrder) {
        PageQuery query = new PageQuery(page, limit, search, sortBy, sortOrder);
        return ResponseEntity.ok(ApiResponse.success("Blogs retrieved successfully",
                blogService.list(query, active, category, featured)));
    }

    @GetMapping("/public")
    public ResponseEntity<ApiResponse<PageResult<Blog>>> listPublic(@RequestParam(required = false) Integer page,
                                                                    @RequestParam(required = false) Integer limit,
                                                                    @RequestParam(required = false) String category,
                                                                    @RequestParam(required = false) String featured) {
        return ResponseEntity.ok(ApiResponse.success("Public blogs retrieved successfully",
                blogService.listPublic(PageQuery.of(page, limit), category, featured)));
    }

    @GetMapping("/featured")
    public ResponseEntity<ApiResponse<List<Blog>>> featured() {
        return ResponseEntity.ok(ApiResponse.success("Featured blogs retrieved successfully", blogService.featured()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<Blog>> get(@PathVariable Long id,
                                                 @AuthenticationPrincipal AuthenticatedUser caller) {
        return ResponseEntity.ok(ApiResponse.success("Blog retrieved successfully", blogService.get(id, caller != null)));
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<Blog>> createMultipart(@ModelAttribute BlogRequest request,
                                                             @RequestParam(required = false) MultipartFile pdfFile,
                                                             @AuthenticationPrincipal AuthenticatedUser caller) {
        return created(blogService.create(request, pdfFile, caller.getId()));
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ApiResponse<Blog>> create(@RequestBody BlogRequest request,
                                                    @AuthenticationPrincipal AuthenticatedUser caller) {
        return created(blogService.create(request, null, caller.getId()));
    }

    @PutMapping(path = "/{id}", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<Blog>> updateMultipart(@PathVariable Long id,
                                                             @ModelAttribute BlogRequest request,
                                                             @RequestParam(required = false) MultipartFile pdfFile) {
        return ResponseEntity.ok(ApiResponse.success("Blog updated successfully", blogService.update(id, request, pdfFile)));
    }

    @PutMapping(path = "/{id}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ApiResponse<Blog>> update(@PathVariable Long id, @RequestBody BlogRequest request) {
        return ResponseEntity.ok(ApiResponse.success("Blog updated successfully", blogService.update(id, request, null)));
    }

    @PatchMapping("/{id}/toggle-status")
    public ResponseEntity<ApiResponse<Blog>> toggleStatus(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success("Blog status toggled successfully", blogService.toggleActive(id)));
    }

    @PatchMapping("/{id}/toggle-featured")
    public ResponseEntity<ApiResponse<Blog>> toggleFeatured(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success("Blog featured status toggled successfully",
                blogService.toggleFeatured(id)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Map<String, Object>>> delete(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success("Blog deleted successfully", blogService.delete(id)));
    }

    private ResponseEntity<ApiResponse<Blog>> created(Blog blog) {
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success("Blog created successfully", blog));
    }
}
