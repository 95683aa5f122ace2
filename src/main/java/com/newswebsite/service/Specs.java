package com.newswebsite.service;

import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;

import java.time.LocalDateTime;
import java.util.Locale;

/**
 * Building blocks for list filters. Each returns null when its input is absent,
 * which {@link Specification#and} treats as "no constraint".
 */
final class Specs {

    private static final char LIKE_ESCAPE = '\\';

    private Specs() {
    }

    /**
     * Case-insensitive substring match on any of the given attributes. {@code %} and {@code _}
     * in the search text match themselves.
     */
    static <T> Specification<T> containsAny(String search, String... attributes) {
        if (search == null || search.isBlank()) {
            return null;
        }
        String pattern = "%" + escapeLike(search.trim().toLowerCase(Locale.ROOT)) + "%";
        return (root, query, cb) -> {
            Predicate[] predicates = new Predicate[attributes.length];
            for (int i = 0; i < attributes.length; i++) {
                predicates[i] = cb.like(cb.lower(root.<String>get(attributes[i])), pattern, LIKE_ESCAPE);
            }
            return cb.or(predicates);
        };
    }

    static String escapeLike(String text) {
        StringBuilder escaped = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == LIKE_ESCAPE || c == '%' || c == '_') {
                escaped.append(LIKE_ESCAPE);
            }
            escaped.append(c);
        }
        return escaped.toString();
    }

    static <T> Specification<T> contains(String attribute, String value) {
        return containsAny(value, attribute);
    }

    static <T> Specification<T> equal(String attribute, Object value) {
        if (value == null) {
            return null;
        }
        return (root, query, cb) -> cb.equal(root.get(attribute), value);
    }

    static <T> Specification<T> onOrAfter(String attribute, LocalDateTime value) {
        if (value == null) {
            return null;
        }
        return (root, query, cb) -> cb.greaterThanOrEqualTo(root.<LocalDateTime>get(attribute), value);
    }

    static <T> Specification<T> before(String attribute, LocalDateTime value) {
        if (value == null) {
            return null;
        }
        return (root, query, cb) -> cb.lessThan(root.<LocalDateTime>get(attribute), value);
    }

    static <T> Specification<T> onOrBefore(String attribute, LocalDateTime value) {
        if (value == null) {
            return null;
        }
        return (root, query, cb) -> cb.lessThanOrEqualTo(root.<LocalDateTime>get(attribute), value);
    }

    /** "true"/"false" to a Boolean; anything else means the filter is not set. */
    static Boolean flag(String value) {
        if ("true".equalsIgnoreCase(value)) {
            return Boolean.TRUE;
        }
        if ("false".equalsIgnoreCase(value)) {
            return Boolean.FALSE;
        }
        return null;
    }

    /** Only "true" is honoured; used by public lists. */
    static Boolean onlyTrue(String value) {
        return "true".equalsIgnoreCase(value) ? Boolean.TRUE : null;
    }
}
