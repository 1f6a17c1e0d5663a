package com.microblog.application.port.in;

import com.microblog.domain.model.UserId;

public interface RecordActivityUseCase {

    /**
     * Sets the user's last-seen time to now. Unknown ids are ignored.
     */
    void touchLastSeen(UserId userId);
}
