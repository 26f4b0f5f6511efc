package com.discussboard.backend.global.common.paging;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

class PageQueryTest {

    private static final Set<String> FIELDS = Set.of("createdAt", "title");

    @Test
    @DisplayName("missing or non-positive page and limit fall back to the first page of twenty")
    void defaultsPageAndLimit() {
        Pageable pageable = PageQuery.of(null, 0, null, null, FIELDS);

        assertThat(pageable.getPageNumber()).isZero();
        assertThat(pageable.getPageSize()).isEqualTo(PageQuery.DEFAULT_LIMIT);
        assertThat(pageable.getSort().getOrderFor("createdAt").getDirection()).isEqualTo(Sort.Direction.DESC);
    }

    @Test
    @DisplayName("limit is capped by the endpoint maximum")
    void capsLimit() {
        assertThat(PageQuery.of(3, 500, "title", "asc", FIELDS).getPageSize()).isEqualTo(PageQuery.MAX_LIMIT);
        assertThat(PageQuery.of(3, 5000, 1000, "title", "asc", FIELDS).getPageSize()).isEqualTo(1000);
        assertThat(PageQuery.of(3, 10, "title", "asc", FIELDS).getPageNumber()).isEqualTo(2);
    }

    @Test
    @DisplayName("unknown sort fields are replaced by createdAt")
    void rejectsUnknownSortField() {
        Sort sort = PageQuery.sort("password", "asc", FIELDS);

        assertThat(sort.getOrderFor("password")).isNull();
        assertThat(sort.getOrderFor("createdAt").getDirection()).isEqualTo(Sort.Direction.ASC);
    }

    @Test
    @DisplayName("combined sort expressions accept space and colon separators")
    void parsesSortExpression() {
        assertThat(PageQuery.ofExpression(1, 10, 100, "title asc", FIELDS).getSort().getOrderFor("title"))
                .extracting(Sort.Order::getDirection)
                .isEqualTo(Sort.Direction.ASC);
        assertThat(PageQuery.ofExpression(1, 10, 100, "title:desc", FIELDS).getSort().getOrderFor("title"))
                .extracting(Sort.Order::getDirection)
                .isEqualTo(Sort.Direction.DESC);
    }

    @Test
    void likePatternLowercasesAndSkipsBlank() {
        assertThat(PageQuery.likePattern("  Hello ")).isEqualTo("%hello%");
        assertThat(PageQuery.likePattern("   ")).isNull();
        assertThat(PageQuery.likePattern(null)).isNull();
    }

    @Test
    @DisplayName("like wildcards in keywords match literally")
    void likePatternEscapesWildcards() {
        assertThat(PageQuery.likePattern("100%_Off")).isEqualTo("%100\\%\\_off%");
        assertThat(PageQuery.likePattern("a\\b")).isEqualTo("%a\\\\b%");
    }
}
