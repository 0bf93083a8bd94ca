package uk.gegc.ergtracker.features.auth.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import uk.gegc.ergtracker.features.auth.application.AuthService;

@Slf4j
@Component
@RequiredArgsConstructor
public class TokenCleanupScheduler {

    private final AuthService authService;

    @Scheduled(cron = "${app.auth.token-cleanup-cron:0 */10 * * * *}")
    public void purgeExpiredTokens() {
        try {
            int deleted = authService.sweepExpiredResetTokens();
            log.debug("Scheduled cleanup removed {} expired password reset tokens", deleted);
        } catch (Exception e) {
            log.error("Failed to clean up expired password reset tokens", e);
        }
    }
}
