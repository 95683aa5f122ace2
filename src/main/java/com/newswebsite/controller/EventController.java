package com.newswebsite.controller;

import com.newswebsite.dto.ApiResponse;
import com.newswebsite.dto.EventRequest;
import com.newswebsite.dto.PageQuery;
import com.newswebsite.dto.PageResult;
import com.newswebsite.entity.Event;
import com.newswebsite.security.AuthenticatedUser;
import com.newswebsite.service.EventService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/events")
public class EventController {

    private final EventService eventService;

    public EventController(EventService eventService) {
        this.eventService = eventService;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<PageResult<Event>>> list(@RequestParam(required = false) Integer page,
                                                               @RequestParam(required = false) Integer limit,
                                                               @RequestParam(required = false) String search,
                                                               @RequestParam(required = false) String active,
                                                               @RequestParam(required = false) String upcoming,
                                                               @RequestParam(required = false) String past,
                                                               @RequestParam(required = false) String sortBy,
                                                               @RequestParam(required = false) String sortOrder) {
        PageQuery query = new PageQuery(page, limit, search, sortBy, sortOrder);
        return ResponseEntity.ok(ApiResponse.success("Events retrieved successfully",
                eventService.list(query, active, upcoming, past)));
    }

    @GetMapping("/public")
    public ResponseEntity<ApiResponse<PageResult<Event>>> listPublic(@RequestParam(required = false) Integer page,
                                                                     @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(ApiResponse.success("Public events retrieved successfully",
                eventService.listPublic(PageQuery.of(page, limit))));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<Event>> get(@PathVariable Long id,
                                                  @AuthenticationPrincipal AuthenticatedUser caller) {
        return ResponseEntity.ok(ApiResponse.success("Event retrieved successfully", eventService.get(id, caller != null)));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<Event>> create(@RequestBody EventRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Event created successfully", eventService.create(request)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<Event>> update(@PathVariable Long id, @RequestBody EventRequest request) {
        return ResponseEntity.ok(ApiResponse.success("Event updated successfully", eventService.update(id, request)));
    }

    @PatchMapping("/{id}/toggle-status")
    public ResponseEntity<ApiResponse<Event>> toggleStatus(@PathVariable Long id) {
        Event event = eventService.toggleActive(id);
        return ResponseEntity.ok(ApiResponse.success(
                "Event " + (Boolean.TRUE.equals(event.getIsActive()) ? "activated" : "deactivated") + " successfully",
                event));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Map<String, Object>>> delete(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success("Event deleted successfully", eventService.delete(id)));
    }
}
