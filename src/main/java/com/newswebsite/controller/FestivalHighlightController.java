package com.newswebsite.controller;

import com.newswebsite.dto.ApiResponse;
import com.newswebsite.dto.FestivalHighlightRequest;
import com.newswebsite.dto.PageQuery;
import com.newswebsite.dto.PageResult;
import com.newswebsite.entity.FestivalHighlight;
import com.newswebsite.security.AuthenticatedUser;
import com.newswebsite.service.FestivalHighlightService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/festival-highlights")
public class FestivalHighlightController {

    private final FestivalHighlightService highlightService;

    public FestivalHighlightController(FestivalHighlightService highlightService) {
        this.highlightService = highlightService;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<PageResult<FestivalHighlight>>> list(@RequestParam(required = false) Integer page,
                                                                           @RequestParam(required = false) Integer limit,
                                                                           @RequestParam(required = false) String search,
                                                                           @RequestParam(required = false) String isActive,
                                                                           @RequestParam(required = false) String sort) {
        PageQuery query = new PageQuery(page, limit, search, null, null);
        return ResponseEntity.ok(ApiResponse.success("Festival highlights retrieved successfully",
                highlightService.list(query, isActive, sort)));
    }

    @GetMapping("/public")
    public ResponseEntity<ApiResponse<List<FestivalHighlight>>> listPublic() {
        return ResponseEntity.ok(ApiResponse.success("Public festival highlights retrieved successfully",
                highlightService.listPublic()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<FestivalHighlight>> get(@PathVariable Long id,
                                                              @AuthenticationPrincipal AuthenticatedUser caller) {
        return ResponseEntity.ok(ApiResponse.success("Festival highlight retrieved successfully",
                highlightService.get(id, caller != null)));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<FestivalHighlight>> create(@RequestBody FestivalHighlightRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Festival highlight created successfully", highlightService.create(request)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<FestivalHighlight>> update(@PathVariable Long id,
                                                                 @RequestBody FestivalHighlightRequest request) {
        return ResponseEntity.ok(ApiResponse.success("Festival highlight updated successfully",
                highlightService.update(id, request)));
    }

    @PatchMapping("/{id}/toggle-status")
    public ResponseEntity<ApiResponse<FestivalHighlight>> toggleStatus(@PathVariable Long id) {
        FestivalHighlight highlight = highlightService.toggleActive(id);
        return ResponseEntity.ok(ApiResponse.success(
                "Festival highlight " + (Boolean.TRUE.equals(highlight.getIsActive()) ? "activated" : "deactivated")
                        + " successfully", highlight));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Map<String, Object>>> delete(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success("Festival highlight deleted successfully",
                highlightService.delete(id)));
    }
}
