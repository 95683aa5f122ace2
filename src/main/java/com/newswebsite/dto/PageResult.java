package com.newswebsite.dto;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import org.springframework.data.domain.Page;

import java.util.List;
import java.util.Map;

/**
 * One page of records plus pagination metadata, serialized as
 * {@code { <itemsKey>: [...], pagination: {page, limit, total, pages} }}.
 */
public class PageResult<T> {

    private final String itemsKey;
    private final List<T> items;
    private final Pagination pagination;

    public PageResult(String itemsKey, List<T> items, Pagination pagination) {
        this.itemsKey = itemsKey;
        this.items = items;
        this.pagination = pagination;
    }

    public static <T> PageResult<T> of(String itemsKey, Page<T> page, PageQuery query) {
        return new PageResult<>(itemsKey, page.getContent(),
                Pagination.of(query.getPage(), query.getLimit(), page.getTotalElements()));
    }

    @JsonAnyGetter
    public Map<String, List<T>> itemsByKey() {
        return Map.of(itemsKey, items);
    }

    @JsonIgnore
    public List<T> getItems() {
        return items;
    }

    public Pagination getPagination() {
        return pagination;
    }

    public record Pagination(int page, int limit, long total, int pages) {

        public static Pagination of(int page, int limit, long total) {
            return new Pagination(page, limit, total, (int) Math.ceil((double) total / limit));
        }
    }
}
