package com.newswebsite.controller;

import com.newswebsite.dto.ApiResponse;
import com.newswebsite.dto.PageQuery;
import com.newswebsite.dto.PageResult;
import com.newswebsite.dto.TransportationRequest;
import com.newswebsite.entity.Transportation;
import com.newswebsite.security.AuthenticatedUser;
import com.newswebsite.service.TransportationService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/transportations")
public class TransportationController {

    private final TransportationService transportationService;

    public TransportationController(TransportationService transportationService) {
        this.transportationService = transportationService;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<PageResult<Transportation>>> list(@RequestParam(required = false) Integer page,
                                                                        @RequestParam(required = false) Integer limit,
                                                                        @RequestParam(required = false) String search,
                                                                        @RequestParam(required = false) String active,
                                                                        @RequestParam(required = false) String sortBy,
                                                                        @RequestParam(required = false) String sortOrder) {
        PageQuery query = new PageQuery(page, limit, search, sortBy, sortOrder);
        return ResponseEntity.ok(ApiResponse.success("Transportation options retrieved successfully",
                transportationService.list(query, active)));
    }

    @GetMapping("/public")
    public ResponseEntity<ApiResponse<List<Transportation>>> listPublic() {
        return ResponseEntity.ok(ApiResponse.success("Public transportation options retrieved successfully",
                transportationService.listPublic()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<Transportation>> get(@PathVariable Long id,
                                                           @AuthenticationPrincipal AuthenticatedUser caller) {
        return ResponseEntity.ok(ApiResponse.success("Transportation option retrieved successfully",
                transportationService.get(id, caller != null)));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<Transportation>> create(@RequestBody TransportationRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(
                "Transportation option created successfully", transportationService.create(request)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<Transportation>> update(@PathVariable Long id,
                                                              @RequestBody TransportationRequest request) {
        return ResponseEntity.ok(ApiResponse.success("Transportation option updated successfully",
                transportationService.update(id, request)));
    }

    @PatchMapping("/{id}/toggle-status")
    public ResponseEntity<ApiResponse<Transportation>> toggleStatus(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success("Transportation status toggled successfully",
                transportationService.toggleActive(id)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Map<String, Object>>> delete(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success("Transportation option deleted successfully",
                transportationService.delete(id)));
    }
}
