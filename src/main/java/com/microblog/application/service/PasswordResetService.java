package com.microblog.application.service;

import com.microblog.application.port.in.CredentialUseCase;
import com.microblog.application.port.in.RequestPasswordResetUseCase;
import com.microblog.application.port.in.ResetPasswordUseCase;
import com.microblog.application.port.out.MetricsPort;
import com.microblog.application.port.out.NotificationSender;
import com.microblog.application.port.out.UserRepository;
import com.microblog.domain.error.AuthError;
import com.microblog.domain.model.Result;
import com.microblog.domain.model.User;
import com.microblog.domain.model.UserId;
import com.microblog.infrastructure.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.util.HtmlUtils;

import java.util.List;
import java.util.Optional;

@Service
public class PasswordResetService implements RequestPasswordResetUseCase, ResetPasswordUseCase {

    private static final Logger log = LoggerFactory.getLogger(PasswordResetService.class);

    static final String RESET_SUBJECT = "[Microblog] Reset Your Password";

    private final UserRepository userRepository;
    private final CredentialUseCase credentials;
    private final NotificationSender notificationSender;
    private final AppProperties appProperties;
    private final MetricsPort metrics;

    public PasswordResetService(
            UserRepository userRepository,
            CredentialUseCase credentials,
            NotificationSender notificationSender,
            AppProperties appProperties,
            MetricsPort metrics) {
        this.userRepository = userRepository;
        this.credentials = credentials;
        this.notificationSender = notificationSender;
        this.appProperties = appProperties;
        this.metrics = metrics;
    }

    @Override
    public void requestPasswordReset(String email) {
        if (email == null || email.isBlank()) {
            return;
        }
        Optional<User> user = userRepository.findByEmail(email.trim());
        if (user.isEmpty()) {
            log.debug("Password reset requested for unknown email");
            return;
        }

        String token = credentials.issueResetToken(user.get(), appProperties.getSecurity().getResetTokenTtl());
        String link = appProperties.getMail().getResetUrlTemplate().replace("{token}", token);

        notificationSender.send(
            RESET_SUBJECT,
            List.of(user.get().email()),
            textBody(user.get(), link),
            htmlBody(user.get(), link)
        );
        log.info("Password reset mail queued: user={}", user.get().id());
    }

    @Override
    @Transactional
    public Result<User, AuthError> resetPassword(String token, String newPassword) {
        Optional<UserId> subject = credentials.verifyResetToken(token);
        if (subject.isEmpty()) {
            log.warn("Password reset rejected: token did not verify");
            return Result.failure(AuthError.VerificationFailed.INSTANCE);
        }

        Optional<User> user = userRepository.findById(subject.get());
        if (user.isEmpty()) {
            log.warn("Password reset rejected: user={} no longer exists", subject.get());
            return Result.failure(AuthError.VerificationFailed.INSTANCE);
        }

        if (newPassword == null || newPassword.isBlank()) {
            return Result.failure(new AuthError.InvalidPassword("Password cannot be empty"));
        }

        User updated = credentials.setPassword(user.get(), newPassword);
        userRepository.updatePassword(updated.id(), updated.passwordHash());
        metrics.incrementPasswordResets();
        log.info("Password reset completed: user={}", updated.id());
        return Result.success(updated);
    }

    private static String textBody(User user, String link) {
        return "Dear " + user.username() + ",\n\n"
            + "To reset your password click on the following link:\n\n"
            + link + "\n\n"
            + "If you have not requested a password reset simply ignore this message.\n\n"
            + "Sincerely,\n\nThe Microblog Team\n";
    }

    private static String htmlBody(User user, String link) {
        String href = HtmlUtils.htmlEscape(link);
        return "<p>Dear " + HtmlUtils.htmlEscape(user.username()) + ",</p>"
            + "<p>To reset your password <a href=\"" + href + "\">click here</a>.</p>"
            + "<p>Alternatively, you can paste the following link in your browser's address bar:</p>"
            + "<p>" + href + "</p>"
            + "<p>If you have not requested a password reset simply ignore this message.</p>"
            + "<p>Sincerely,</p><p>The Microblog Team</p>";
    }
}
