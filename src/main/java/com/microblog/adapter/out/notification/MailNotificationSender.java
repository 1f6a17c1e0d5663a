package com.microblog.adapter.out.notification;

import com.microblog.application.port.out.MetricsPort;
import com.microblog.application.port.out.NotificationSender;
import com.microblog.infrastructure.config.AppProperties;
import com.microblog.infrastructure.config.AsyncConfig;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Sends notifications as multipart (plain text + HTML) mail on the notification pool.
 * Delivery failures are logged and counted, never rethrown.
 */
@Component
public class MailNotificationSender implements NotificationSender {

    private static final Logger log = LoggerFactory.getLogger(MailNotificationSender.class);

    private final JavaMailSender mailSender;
    private final AppProperties appProperties;
    private final MetricsPort metrics;

    public MailNotificationSender(JavaMailSender mailSender, AppProperties appProperties, MetricsPort metrics) {
        this.mailSender = mailSender;
        this.appProperties = appProperties;
        this.metrics = metrics;
    }

    @Override
    @Async(AsyncConfig.NOTIFICATION_EXECUTOR)
    public void send(String subject, List<String> recipients, String textBody, String htmlBody) {
        if (recipients.isEmpty()) {
            log.warn("Notification '{}' has no recipients, skipping", subject);
            return;
        }
        try {
            MimeMessage message = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(message, true, StandardCharsets.UTF_8.name());
            helper.setFrom(appProperties.getMail().getFrom());
            helper.setTo(recipients.toArray(new String[0]));
            helper.setSubject(subject);
            helper.setText(textBody, htmlBody);

            mailSender.send(message);
            metrics.incrementNotifications(true);
            log.info("Notification sent: subject='{}', recipients={}", subject, recipients.size());
        } catch (MailException | MessagingException e) {
            metrics.incrementNotifications(false);
            log.error("Notification failed: subject='{}', recipients={}: {}", subject, recipients.size(), e.getMessage(), e);
        }
    }
}
