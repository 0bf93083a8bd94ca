package uk.gegc.ergtracker.shared.email.impl;

import lombok.extern.slf4j.Slf4j;
import uk.gegc.ergtracker.shared.email.EmailService;

import static uk.gegc.ergtracker.shared.email.EmailMasking.maskEmail;
import static uk.gegc.ergtracker.shared.email.EmailMasking.maskToken;

/**
 * Logs email send attempts without sending anything.
 * Activated when {@code app.email.provider=noop} (default in dev and tests).
 */
@Slf4j
public class NoopEmailService implements EmailService {

    public NoopEmailService() {
        log.info("NoopEmailService initialized - emails will be logged but not sent");
    }

    @Override
    public void sendPasswordResetEmail(String email, String resetToken) {
        log.info("[NOOP] Would send password reset email to: {} with token: {}",
                maskEmail(email), maskToken(resetToken));
    }
}
