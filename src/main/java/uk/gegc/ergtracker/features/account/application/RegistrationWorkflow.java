package uk.gegc.ergtracker.features.account.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.ergtracker.features.account.config.BootstrapProperties;
import uk.gegc.ergtracker.features.account.domain.model.Account;
import uk.gegc.ergtracker.features.account.domain.model.ApprovalStatus;
import uk.gegc.ergtracker.features.account.domain.repository.AccountRepository;
import uk.gegc.ergtracker.shared.exception.ConflictException;
import uk.gegc.ergtracker.shared.exception.ResourceNotFoundException;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Registration approval lifecycle. Callers authorize before invoking {@link #approve} or {@link #reject}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RegistrationWorkflow {

    private final AccountRepository accountRepository;
    private final BootstrapProperties bootstrapProperties;
    @Qualifier("utcClock")
    private final Clock utcClock;

    /**
     * APPROVED only for the configured bootstrap email registering into an empty store.
     */
    @Transactional(readOnly = true)
    public ApprovalStatus initialStatus(String email) {
        if (bootstrapProperties.isBootstrapEmail(email) && accountRepository.count() == 0) {
            log.info("Bootstrap registration approved automatically");
            return ApprovalStatus.APPROVED;
        }
        return ApprovalStatus.PENDING;
    }

    @Transactional
    public Account approve(UUID accountId) {
        return transition(accountId, ApprovalStatus.APPROVED);
    }

    @Transactional
    public Account reject(UUID accountId) {
        return transition(accountId, ApprovalStatus.REJECTED);
    }

    private Account transition(UUID accountId, ApprovalStatus target) {
        Account account = accountRepository.findById(accountId)
                .orElseThrow(() -> new ResourceNotFoundException("Account " + accountId + " not found"));
        if (account.getStatus() != ApprovalStatus.PENDING) {
            throw new ConflictException("Account is already " + account.getStatus().name().toLowerCase());
        }

        int updated = accountRepository.transitionStatus(accountId, ApprovalStatus.PENDING, target, Instant.now(utcClock));
        if (updated == 0) {
            throw new ConflictException("Account was processed concurrently");
        }

        log.info("Account {} moved to {}", accountId, target);
        return accountRepository.findById(accountId)
                .orElseThrow(() -> new ResourceNotFoundException("Account " + accountId + " not found"));
    }
}
