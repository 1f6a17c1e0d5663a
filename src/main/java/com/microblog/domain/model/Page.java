package com.microblog.domain.model;

import java.util.List;

/**
 * Cursor-paginated slice, used for follower and following lists.
 */
public record Page<T>(
    List<T> data,
    String nextCursor,
    boolean hasMore
) {
    public static <T> Page<T> of(List<T> data, String nextCursor) {
        return new Page<>(data, nextCursor, nextCursor != null);
    }
}
