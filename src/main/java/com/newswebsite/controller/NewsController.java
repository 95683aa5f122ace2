package com.newswebsite.controller;

import com.newswebsite.dto.ApiResponse;
import com.newswebsite.dto.NewsRequest;
import com.newswebsite.dto.PageQuery;
import com.newswebsite.dto.PageResult;
import com.newswebsite.entity.News;
import com.newswebsite.security.AuthenticatedUser;
import com.newswebsite.service.NewsService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.Map;

/**
 * Writes accept either multipart form data (with an optional {@code imageFile}) or plain JSON.
 */
@RestController
@RequestMapping("/api/v1/news")
public class NewsController {

    private final NewsService newsService;

    public NewsController(NewsService newsService) {
        this.newsService = newsService;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<PageResult<News>>> list(@RequestParam(required = false) Integer page,
                                                              @RequestParam(required = false) Integer limit,
                                                              @RequestParam(required = false) String search,
                                                              @RequestParam(required = false) String active,
                                                              @RequestParam(required = false) String category,
                                                              @RequestParam(required = false) String trending,
                                                              @RequestParam(required = false) String sortBy,
                                                              @RequestParam(required = false) String sortOrder) {
        PageQuery query = new PageQuery(page, limit, search, sortBy, sortOrder);
        return ResponseEntity.ok(ApiResponse.success("News retrieved successfully",
                newsService.list(query, active, category, trending)));
    }

    @GetMapping("/public")
    public ResponseEntity<ApiResponse<PageResult<News>>> listPublic(@RequestParam(required = false) Integer page,
                                                                    @RequestParam(required = false) Integer limit,
                                                                    @RequestParam(required = false) String category,
                                                                    @RequestParam(required = false) String trending) {
        return ResponseEntity.ok(ApiResponse.success("Public news retrieved successfully",
                newsService.listPublic(PageQuery.of(page, limit), category, trending)));
    }

    @GetMapping("/trending")
    public ResponseEntity<ApiResponse<List<News>>> trending() {
        return ResponseEntity.ok(ApiResponse.success("Trending news retrieved successfully", newsService.trending()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<News>> get(@PathVariable Long id,
                                                 @AuthenticationPrincipal AuthenticatedUser caller) {
        return ResponseEntity.ok(ApiResponse.success("News retrieved successfully", newsService.get(id, caller != null)));
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<News>> createMultipart(@ModelAttribute NewsRequest request,
                                                             @RequestParam(required = false) MultipartFile imageFile) {
        return created(newsService.create(request, imageFile));
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ApiResponse<News>> create(@RequestBody NewsRequest request) {
        return created(newsService.create(request, null));
    }

    @PutMapping(path = "/{id}", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<News>> updateMultipart(@PathVariable Long id,
                                                             @ModelAttribute NewsRequest request,
                                                             @RequestParam(required = false) MultipartFile imageFile) {
        return ResponseEntity.ok(ApiResponse.success("News updated successfully", newsService.update(id, request, imageFile)));
    }

    @PutMapping(path = "/{id}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ApiResponse<News>> update(@PathVariable Long id, @RequestBody NewsRequest request) {
        return ResponseEntity.ok(ApiResponse.success("News updated successfully", newsService.update(id, request, null)));
    }

    @PatchMapping("/{id}/toggle-status")
    public ResponseEntity<ApiResponse<News>> toggleStatus(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success("News status toggled successfully", newsService.toggleActive(id)));
    }

    @PatchMapping("/{id}/toggle-trending")
    public ResponseEntity<ApiResponse<News>> toggleTrending(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success("News trending status toggled successfully",
                newsService.toggleTrending(id)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Map<String, Object>>> delete(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success("News deleted successfully", newsService.delete(id)));
    }

    private ResponseEntity<ApiResponse<News>> created(News news) {
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success("News created successfully", news));
    }
}
