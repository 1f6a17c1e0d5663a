package com.microblog.application.port.in;

import com.microblog.domain.model.NumberedPage;
import com.microblog.domain.model.Post;

public interface GetExploreUseCase {
    NumberedPage<Post> getExplore(int page);
}
