package com.microblog.application.port.in;

import com.microblog.domain.model.NumberedPage;
import com.microblog.domain.model.Post;
import com.microblog.domain.model.UserId;

public interface GetUserPostsUseCase {
    NumberedPage<Post> getUserPosts(UserId authorId, int page);
}
