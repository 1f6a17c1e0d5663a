package com.microblog.application.port.out;

import java.util.List;

/**
 * Outbound notifications (password reset mail). Fire-and-forget: implementations return
 * without waiting for delivery and log failures instead of throwing them.
 */
public interface NotificationSender {
    void send(String subject, List<String> recipients, String textBody, String htmlBody);
}
