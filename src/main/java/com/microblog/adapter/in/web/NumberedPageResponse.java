package com.microblog.adapter.in.web;

import com.microblog.domain.model.NumberedPage;

import java.util.List;
import java.util.function.Function;

public record NumberedPageResponse<T>(
    List<T> data,
    Pagination pagination
) {
    public static <S, T> NumberedPageResponse<T> from(NumberedPage<S> page, Function<S, T> mapper) {
        List<T> data = page.items().stream().map(mapper).toList();
        Pagination pagination = new Pagination(
            page.page(),
            page.pageSize(),
            page.hasNext(),
            page.hasPrev(),
            page.nextPage(),
            page.prevPage()
        );
        return new NumberedPageResponse<>(data, pagination);
    }

    public record Pagination(
        int page,
        int pageSize,
        boolean hasNext,
        boolean hasPrev,
        Integer nextPage,
        Integer prevPage
    ) {}
}
