package com.newswebsite.dto;

import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

import java.util.Map;

/**
 * Paging, free-text search and sort parameters shared by every list endpoint.
 * Page numbers are 1-based. Missing page and limit default to 1 and 10; values below 1
 * are clamped to 1.
 */
public class PageQuery {

    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_LIMIT = 10;

    private final int page;
    private final int limit;
    private final String search;
    private final String sortBy;
    private final String sortOrder;

    public PageQuery(Integer page, Integer limit, String search, String sortBy, String sortOrder) {
        this.page = page == null ? DEFAULT_PAGE : Math.max(1, page);
        this.limit = limit == null ? DEFAULT_LIMIT : Math.max(1, limit);
        this.search = search == null || search.isBlank() ? null : search.trim();
        this.sortBy = sortBy;
        this.sortOrder = sortOrder;
    }

    public static PageQuery of(Integer page, Integer limit) {
        return new PageQuery(page, limit, null, null, null);
    }

    public int getPage() { return page; }
    public int getLimit() { return limit; }
    public String getSearch() { return search; }
    public boolean hasSearch() { return search != null; }
    public String getSortBy() { return sortBy; }
    public String getSortOrder() { return sortOrder; }

    /** Number of records skipped before this page. */
    public long getSkip() {
        return (long) (page - 1) * limit;
    }

    /**
     * Builds the page request, mapping the requested sort field through {@code sortFields}
     * (API name to entity attribute). Unknown fields fall back to the default.
     */
    public Pageable toPageable(Map<String, String> sortFields, String defaultField, Sort.Direction defaultDirection) {
        return PageRequest.of(page - 1, limit, toSort(sortFields, defaultField, defaultDirection));
    }

    public Sort toSort(Map<String, String> sortFields, String defaultField, Sort.Direction defaultDirection) {
        String attribute = sortBy != null ? sortFields.get(sortBy) : null;
        if (attribute == null) {
            return Sort.by(defaultDirection, defaultField);
        }
        Sort.Direction direction = sortOrder != null
                ? Sort.Direction.fromOptionalString(sortOrder).orElse(defaultDirection)
                : defaultDirection;
        return Sort.by(direction, attribute);
    }
}
