package com.microblog.application.port.in;

import com.microblog.domain.error.PostError;
import com.microblog.domain.model.Post;
import com.microblog.domain.model.Result;
import com.microblog.domain.model.UserId;

public interface CreatePostUseCase {
    Result<Post, PostError> createPost(UserId authorId, String body);
}
