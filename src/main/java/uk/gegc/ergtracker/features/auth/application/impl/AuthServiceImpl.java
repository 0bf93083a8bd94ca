package uk.gegc.ergtracker.features.auth.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.security.authentication.AuthenticationManager;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.ergtracker.features.account.api.dto.AccountDto;
import uk.gegc.ergtracker.features.account.application.RegistrationWorkflow;
import uk.gegc.ergtracker.features.account.domain.model.Account;
import uk.gegc.ergtracker.features.account.domain.model.AccountRole;
import uk.gegc.ergtracker.features.account.domain.repository.AccountRepository;
import uk.gegc.ergtracker.features.account.domain.service.CategoryCalculator;
import uk.gegc.ergtracker.features.account.infra.mapping.AccountMapper;
import uk.gegc.ergtracker.features.auth.api.dto.LoginRequest;
import uk.gegc.ergtracker.features.auth.api.dto.LoginResponse;
import uk.gegc.ergtracker.features.auth.api.dto.RegisterRequest;
import uk.gegc.ergtracker.features.auth.application.AuthService;
import uk.gegc.ergtracker.features.auth.config.PasswordRecoveryProperties;
import uk.gegc.ergtracker.features.auth.domain.event.PasswordResetRequestedEvent;
import uk.gegc.ergtracker.features.auth.domain.model.PasswordResetToken;
import uk.gegc.ergtracker.features.auth.domain.repository.PasswordResetTokenRepository;
import uk.gegc.ergtracker.features.auth.infra.security.JwtTokenService;
import uk.gegc.ergtracker.features.society.domain.repository.SocietyRepository;
import uk.gegc.ergtracker.shared.email.EmailService;
import uk.gegc.ergtracker.shared.exception.ConflictException;
import uk.gegc.ergtracker.shared.exception.ForbiddenException;
import uk.gegc.ergtracker.shared.exception.UnauthorizedException;
import uk.gegc.ergtracker.shared.exception.ValidationException;
import uk.gegc.ergtracker.shared.security.AccessControlEngine;
import uk.gegc.ergtracker.shared.security.CallerResolver;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.Year;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static uk.gegc.ergtracker.shared.email.EmailMasking.maskEmail;

@Service
@RequiredArgsConstructor
@Slf4j
public class AuthServiceImpl implements AuthService {

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final AccountRepository accountRepository;
    private final SocietyRepository societyRepository;
    private final PasswordEncoder passwordEncoder;
    private final AccountMapper accountMapper;
    private final AuthenticationManager authManager;
    private final JwtTokenService jwtTokenService;
    private final RegistrationWorkflow registrationWorkflow;
    private final CategoryCalculator categoryCalculator;
    private final PasswordResetTokenRepository passwordResetTokenRepository;
    private final PasswordRecoveryProperties passwordRecoveryProperties;
    private final EmailService emailService;
    private final AccessControlEngine accessControlEngine;
    private final CallerResolver callerResolver;
    private final Clock clock;
    @Qualifier("utcClock")
    private final Clock utcClock;
    private final ApplicationEventPublisher eventPublisher;

    @Override
    @Transactional
    public AccountDto register(RegisterRequest request) {
        String email = request.email().trim();
        if (accountRepository.existsByEmailIgnoreCase(email)) {
            throw new ConflictException("Email already in use");
        }

        AccountRole role = AccountRole.fromWire(request.role());
        List<UUID> societyIds = request.societyIds() == null ? List.of() : request.societyIds();
        for (UUID societyId : societyIds) {
            if (societyId == null || !societyRepository.existsById(societyId)) {
                throw new ValidationException("Unknown society: " + societyId);
            }
        }

        Account account = new Account();
        account.setEmail(email);
        account.setHashedPassword(passwordEncoder.encode(request.password()));
        account.setPasswordChangedAt(utcClock.instant());
        account.setName(request.name().trim());
        account.setRole(role);
        account.setStatus(registrationWorkflow.initialStatus(email));
        account.setSocietyIds(societyIds);
        account.setBirthYear(request.birthYear());
        if (request.birthYear() != null) {
            account.setCategory(categoryCalculator.label(request.birthYear(), Year.now(clock).getValue()));
        }
        account.setWeight(request.weight());
        account.setHeight(request.height());

        Account saved = accountRepository.save(account);
        log.info("Registered account {} as {} with status {}", saved.getId(), role, saved.getStatus());
        return accountMapper.toDto(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public LoginResponse login(LoginRequest request) {
        try {
            authManager.authenticate(new UsernamePasswordAuthenticationToken(request.email(), request.password()));
        } catch (AuthenticationException ex) {
            throw new UnauthorizedException("Invalid email or password");
        }

        Account account = accountRepository.findByEmailIgnoreCase(request.email().trim())
                .orElseThrow(() -> new UnauthorizedException("Invalid email or password"));

        switch (account.getStatus()) {
            case PENDING -> throw new ForbiddenException("Account is awaiting approval");
            case REJECTED -> throw new ForbiddenException("Account registration was rejected");
            case APPROVED -> log.debug("Account {} logged in", account.getId());
        }

        return LoginResponse.bearer(
                jwtTokenService.generateAccessToken(account),
                jwtTokenService.getAccessTokenValidityInMs(),
                accountMapper.toDto(account)
        );
    }

    @Override
    @Transactional(readOnly = true)
    public AccountDto getCurrentAccount(Authentication authentication) {
        return accountMapper.toDto(callerResolver.loadAccount(authentication));
    }

    @Override
    public void requestPasswordReset(String email) {
        eventPublisher.publishEvent(new PasswordResetRequestedEvent(this, email));
    }

    @Override
    @Transactional
    public void generatePasswordResetToken(String email) {
        Optional<Account> accountOpt = accountRepository.findByEmailIgnoreCase(email.trim());
        if (accountOpt.isEmpty()) {
            log.debug("Password reset requested for unknown email {}", maskEmail(email));
            return;
        }
        Account account = accountOpt.get();

        passwordResetTokenRepository.invalidateAccountTokens(account.getId());

        String token = generateSecureToken();
        PasswordResetToken resetToken = new PasswordResetToken();
        resetToken.setTokenHash(hashToken(token));
        resetToken.setAccountId(account.getId());
        resetToken.setEmail(account.getEmail());

        LocalDateTime now = LocalDateTime.now(utcClock);
        resetToken.setCreatedAt(now);
        resetToken.setExpiresAt(now.plusMinutes(passwordRecoveryProperties.getResetTokenTtlMinutes()));
        passwordResetTokenRepository.save(resetToken);

        emailService.sendPasswordResetEmail(account.getEmail(), token);
    }

    @Override
    @Transactional
    public void resetPassword(String token, String newPassword) {
        LocalDateTime now = LocalDateTime.now(utcClock);
        PasswordResetToken resetToken = passwordResetTokenRepository
                .findByTokenHashAndUsedFalseAndExpiresAtAfter(hashToken(token), now)
                .orElseThrow(() -> new ValidationException("Invalid or expired reset token"));

        if (passwordResetTokenRepository.markUsedIfValid(resetToken.getId(), now) == 0) {
            throw new ValidationException("Invalid or expired reset token");
        }

        Account account = accountRepository.findById(resetToken.getAccountId())
                .orElseThrow(() -> new ValidationException("Invalid reset token"));
        account.setHashedPassword(passwordEncoder.encode(newPassword));
        account.setPasswordChangedAt(utcClock.instant());
        accountRepository.save(account);
        log.info("Password reset completed for account {}", account.getId());
    }

    @Override
    @Transactional
    public int sweepExpiredResetTokens() {
        return passwordResetTokenRepository.deleteExpiredTokens(LocalDateTime.now(utcClock));
    }

    @Override
    @Transactional
    public int sweepExpiredResetTokens(Authentication authentication) {
        accessControlEngine.requireSuperAdmin(callerResolver.resolve(authentication));
        int deleted = sweepExpiredResetTokens();
        log.info("Removed {} expired password reset tokens on request", deleted);
        return deleted;
    }

    private String generateSecureToken() {
        byte[] bytes = new byte[32];
        SECURE_RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    private String hashToken(String token) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest((passwordRecoveryProperties.getResetTokenPepper() + token)
                    .getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
