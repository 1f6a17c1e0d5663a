package com.microblog.domain.model;

import java.util.List;
import java.util.function.Function;

/**
 * One 1-indexed page of an ordered result.
 *
 * <p>{@code hasPrev} is true whenever {@code page > 1}; {@code hasNext} is true only when rows
 * exist after this page's window. Out-of-range pages carry empty {@code items}.
 */
public record NumberedPage<T>(
    List<T> items,
    int page,
    int pageSize,
    boolean hasNext,
    boolean hasPrev
) {
    public Integer nextPage() {
        return hasNext ? Math.max(page, 0) + 1 : null;
    }

    public Integer prevPage() {
        return hasPrev ? page - 1 : null;
    }

    public <U> NumberedPage<U> map(Function<T, U> mapper) {
        return new NumberedPage<>(items.stream().map(mapper).toList(), page, pageSize, hasNext, hasPrev);
    }

    /**
     * Builds a page from a fetch of up to {@code pageSize + 1} rows starting at the page's offset.
     */
    public static <T> NumberedPage<T> fromLookahead(List<T> rows, int page, int pageSize) {
        boolean hasNext = rows.size() > pageSize;
        List<T> items = hasNext ? List.copyOf(rows.subList(0, pageSize)) : List.copyOf(rows);
        return new NumberedPage<>(items, page, pageSize, hasNext, page > 1);
    }

    /**
     * Page numbers below 1 hold no rows; {@code anyRows} tells whether page 1 would.
     */
    public static <T> NumberedPage<T> beforeFirst(int page, int pageSize, boolean anyRows) {
        return new NumberedPage<>(List.of(), page, pageSize, anyRows, false);
    }
}
