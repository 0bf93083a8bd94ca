package uk.gegc.ergtracker.features.auth.domain.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import uk.gegc.ergtracker.features.auth.application.AuthService;

import static uk.gegc.ergtracker.shared.email.EmailMasking.maskEmail;

/**
 * Issues and mails the reset token for a {@link PasswordResetRequestedEvent} on the mail executor.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PasswordResetRequestedEventListener {

    private final AuthService authService;

    @Async("mailTaskExecutor")
    @EventListener
    public void handlePasswordResetRequested(PasswordResetRequestedEvent event) {
        try {
            authService.generatePasswordResetToken(event.getEmail());
        } catch (Exception e) {
            // The HTTP request has already completed
            log.warn("Failed to issue password reset token for {}: {}", maskEmail(event.getEmail()), e.getMessage());
        }
    }
}
