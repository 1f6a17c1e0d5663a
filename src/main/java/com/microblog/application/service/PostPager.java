package com.microblog.application.service;

import com.microblog.domain.model.NumberedPage;
import com.microblog.domain.model.Post;

import java.util.List;

/**
 * Offset paging over an ordered post query. Fetches one row past the window to learn
 * whether a next page exists.
 */
final class PostPager {

    @FunctionalInterface
    interface Window {
        List<Post> fetch(long offset, int limit);
    }

    private PostPager() {}

    static NumberedPage<Post> page(Window window, int page, int pageSize) {
        if (page < 1) {
            return NumberedPage.beforeFirst(page, pageSize, !window.fetch(0, 1).isEmpty());
        }
        long offset = (long) (page - 1) * pageSize;
        return NumberedPage.fromLookahead(window.fetch(offset, pageSize + 1), page, pageSize);
    }
}
