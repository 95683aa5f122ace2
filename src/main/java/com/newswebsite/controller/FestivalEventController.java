package com.newswebsite.controller;

import com.newswebsite.dto.ApiResponse;
import com.newswebsite.dto.EventRequest;
import com.newswebsite.dto.PageQuery;
import com.newswebsite.dto.PageResult;
import com.newswebsite.entity.FestivalEvent;
import com.newswebsite.security.AuthenticatedUser;
import com.newswebsite.service.FestivalEventService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/festival-events")
public class FestivalEventController {

    private final FestivalEventService festivalEventService;

    public FestivalEventController(FestivalEventService festivalEventService) {
        this.festivalEventService = festivalEventService;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<PageResult<FestivalEvent>>> list(@RequestParam(required = false) Integer page,
                                                                       @RequestParam(required = false) Integer limit,
                                                                       @RequestParam(required = false) String search,
                                                                       @RequestParam(required = false) String active,
                                                                       @RequestParam(required = false) String upcoming,
                                                                       @RequestParam(required = false) String past,
                                                                       @RequestParam(required = false) String dateFrom,
                                                                       @RequestParam(required = false) String dateTo,
                                                                       @RequestParam(required = false) String sortBy,
                                                                       @RequestParam(required = false) String sortOrder) {
        PageQuery query = new PageQuery(page, limit, search, sortBy, sortOrder);
        return ResponseEntity.ok(ApiResponse.success("Festival events retrieved successfully",
                festivalEventService.list(query, active, upcoming, past, dateFrom, dateTo)));
    }

    @GetMapping("/public")
    public ResponseEntity<ApiResponse<List<FestivalEvent>>> listPublic(@RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(ApiResponse.success("Public festival events retrieved successfully",
                festivalEventService.listPublic(limit)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<FestivalEvent>> get(@PathVariable Long id,
                                                          @AuthenticationPrincipal AuthenticatedUser caller) {
        return ResponseEntity.ok(ApiResponse.success("Festival event retrieved successfully",
                festivalEventService.get(id, caller != null)));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<FestivalEvent>> create(@RequestBody EventRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Festival event created successfully", festivalEventService.create(request)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<FestivalEvent>> update(@PathVariable Long id, @RequestBody EventRequest request) {
        return ResponseEntity.ok(ApiResponse.success("Festival event updated successfully",
                festivalEventService.update(id, request)));
    }

    @PatchMapping("/{id}/toggle-status")
    public ResponseEntity<ApiResponse<FestivalEvent>> toggleStatus(@PathVariable Long id) {
        FestivalEvent event = festivalEventService.toggleActive(id);
        return ResponseEntity.ok(ApiResponse.success(
                "Festival event " + (Boolean.TRUE.equals(event.getIsActive()) ? "activated" : "deactivated")
                        + " successfully", event));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Map<String, Object>>> delete(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success("Festival event deleted successfully",
                festivalEventService.delete(id)));
    }
}
