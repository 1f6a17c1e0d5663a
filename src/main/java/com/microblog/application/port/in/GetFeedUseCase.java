package com.microblog.application.port.in;

import com.microblog.domain.model.NumberedPage;
import com.microblog.domain.model.Post;
import com.microblog.domain.model.UserId;

public interface GetFeedUseCase {
    /**
     * Posts by the user and by everyone the user follows, newest first.
     */
    NumberedPage<Post> getFeed(UserId userId, int page);
}
