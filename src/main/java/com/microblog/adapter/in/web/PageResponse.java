package com.microblog.adapter.in.web;

import com.microblog.domain.model.Page;
import com.microblog.domain.model.User;

import java.util.List;

/**
 * One page of a follower or following list. Pass {@code nextCursor} back to get the next page.
 */
public record PageResponse(
    List<UserResponse> data,
    Pagination pagination
) {
    public static PageResponse ofUsers(Page<User> page) {
        return new PageResponse(
            page.data().stream().map(UserResponse::from).toList(),
            new Pagination(page.nextCursor(), page.hasMore())
        );
    }

    public record Pagination(
        String nextCursor,
        boolean hasMore
    ) {}
}
