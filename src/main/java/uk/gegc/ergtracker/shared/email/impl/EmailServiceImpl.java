package uk.gegc.ergtracker.shared.email.impl;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import uk.gegc.ergtracker.shared.email.EmailService;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

import static uk.gegc.ergtracker.shared.email.EmailMasking.maskEmail;

/**
 * SMTP-based email service built on Spring's {@link JavaMailSender}.
 * Activated when {@code app.email.provider=smtp}. Sends run on the mail executor and
 * failures are logged, never rethrown, so callers cannot learn whether an address exists.
 */
@Slf4j
@Service
@Primary
@ConditionalOnProperty(name = "app.email.provider", havingValue = "smtp")
@RequiredArgsConstructor
public class EmailServiceImpl implements EmailService {

    private final JavaMailSender mailSender;

    @Value("${spring.mail.username:}")
    private String fromEmail;

    @Value("${app.email.password-reset.subject:Password Reset - ErgTracker}")
    private String passwordResetSubject;

    @Value("${app.frontend.base-url:http://localhost:3000}")
    private String baseUrl;

    @Value("${app.auth.reset-token-ttl-minutes:60}")
    private long resetTokenTtlMinutes;

    @PostConstruct
    void verifyEmailConfiguration() {
        if (fromEmail == null || fromEmail.isBlank()) {
            log.warn("Email service disabled: spring.mail.username is not configured");
        } else {
            log.info("Email service enabled with sender: {}", fromEmail);
        }
    }

    @Override
    @Async("mailTaskExecutor")
    public void sendPasswordResetEmail(String email, String resetToken) {
        send(email, passwordResetSubject, createPasswordResetEmailContent(resetToken), "password reset");
    }

    private void send(String to, String subject, String body, String kind) {
        if (fromEmail == null || fromEmail.isBlank()) {
            log.warn("Email service disabled - skipping {} email to: {}", kind, maskEmail(to));
            return;
        }

        try {
            SimpleMailMessage message = new SimpleMailMessage();
            message.setFrom(fromEmail);
            message.setTo(to);
            message.setSubject(subject);
            message.setText(body);

            mailSender.send(message);
            log.info("{} email sent to: {}", kind, maskEmail(to));
        } catch (Exception e) {
            log.error("Failed to send {} email to: {}", kind, maskEmail(to), e);
        }
    }

    private String createPasswordResetEmailContent(String resetToken) {
        String encodedToken = URLEncoder.encode(resetToken, StandardCharsets.UTF_8);
        String resetUrl = baseUrl + "/reset-password?token=" + encodedToken;
        return String.format("""
                Hello,

                We received a request to reset the password of your ErgTracker account.

                Open the link below to choose a new password:
                %s

                The link expires in %d minutes and can be used only once.

                If you did not ask for a reset, you can ignore this email.

                The ErgTracker team
                """, resetUrl, resetTokenTtlMinutes);
    }
}
