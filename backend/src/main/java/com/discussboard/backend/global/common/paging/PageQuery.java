package com.discussboard.backend.global.common.paging;

import java.util.Locale;
import java.util.Set;

import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

/**
 * Normalizes 1-based page/limit input and whitelisted sort fields into a {@link Pageable}.
 */
public final class PageQuery {

    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT = 100;
    private static final String DEFAULT_SORT_FIELD = "createdAt";

    private PageQuery() {
    }

    public static int page(Integer page) {
        return page == null || page < 1 ? 1 : page;
    }

    public static int limit(Integer limit) {
        return limit(limit, MAX_LIMIT);
    }

    public static int limit(Integer limit, int maxLimit) {
        if (limit == null || limit < 1) {
            return Math.min(DEFAULT_LIMIT, maxLimit);
        }
        return Math.min(limit, maxLimit);
    }

    public static Pageable of(Integer page, Integer limit, String sortField, String direction,
                              Set<String> allowedFields) {
        return of(page, limit, MAX_LIMIT, sortField, direction, allowedFields);
    }

    public static Pageable of(Integer page, Integer limit, int maxLimit, String sortField, String direction,
                              Set<String> allowedFields) {
        return PageRequest.of(page(page) - 1, limit(limit, maxLimit), sort(sortField, direction, allowedFields));
    }

    /**
     * Parses a combined sort expression such as {@code "createdAt desc"} or {@code "status:asc"}.
     */
    public static Pageable ofExpression(Integer page, Integer limit, int maxLimit, String expression,
                                        Set<String> allowedFields) {
        String field = null;
        String direction = null;
        if (expression != null && !expression.isBlank()) {
            String[] parts = expression.trim().split("[\\s:]+");
            field = parts[0];
            direction = parts.length > 1 ? parts[1] : null;
        }
        return of(page, limit, maxLimit, field, direction, allowedFields);
    }

    public static Sort sort(String sortField, String direction, Set<String> allowedFields) {
        String field = sortField != null && allowedFields.contains(sortField) ? sortField : DEFAULT_SORT_FIELD;
        Sort.Direction dir = direction != null && direction.trim().toLowerCase(Locale.ROOT).equals("asc")
                ? Sort.Direction.ASC
                : Sort.Direction.DESC;
        return Sort.by(dir, field);
    }

    /**
     * Case-insensitive "contains" pattern. Queries must declare {@code escape '\'} so that
     * {@code %} and {@code _} in the keyword match literally.
     */
    public static String likePattern(String keyword) {
        if (keyword == null || keyword.isBlank()) {
            return null;
        }
        String escaped = keyword.trim().toLowerCase(Locale.ROOT)
                .replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
        return "%" + escaped + "%";
    }
}
