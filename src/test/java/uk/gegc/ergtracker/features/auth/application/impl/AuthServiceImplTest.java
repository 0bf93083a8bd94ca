package uk.gegc.ergtracker.features.auth.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.security.authentication.AuthenticationManager;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.core.Authentication;
import org.springframework.security.crypto.password.PasswordEncoder;
import uk.gegc.ergtracker.features.account.api.dto.AccountDto;
import uk.gegc.ergtracker.features.account.application.RegistrationWorkflow;
import uk.gegc.ergtracker.features.account.domain.model.Account;
import uk.gegc.ergtracker.features.account.domain.model.AccountRole;
import uk.gegc.ergtracker.features.account.domain.model.ApprovalStatus;
import uk.gegc.ergtracker.features.account.domain.repository.AccountRepository;
import uk.gegc.ergtracker.features.account.domain.service.CategoryCalculator;
import uk.gegc.ergtracker.features.account.infra.mapping.AccountMapper;
import uk.gegc.ergtracker.features.auth.api.dto.LoginRequest;
import uk.gegc.ergtracker.features.auth.api.dto.LoginResponse;
import uk.gegc.ergtracker.features.auth.api.dto.RegisterRequest;
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
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static uk.gegc.ergtracker.testsupport.Fixtures.account;
import static uk.gegc.ergtracker.testsupport.Fixtures.callerOf;

@ExtendWith(MockitoExtension.class)
@DisplayName("AuthServiceImpl")
class AuthServiceImplTest {

    private static final Instant NOW = Instant.parse("2024-02-10T09:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);
    private static final String PEPPER = "test-pepper";

    @Mock
    private AccountRepository accountRepository;
    @Mock
    private SocietyRepository societyRepository;
    @Mock
    private PasswordEncoder passwordEncoder;
    @Mock
    private AuthenticationManager authManager;
    @Mock
    private JwtTokenService jwtTokenService;
    @Mock
    private RegistrationWorkflow registrationWorkflow;
    @Mock
    private PasswordResetTokenRepository passwordResetTokenRepository;
    @Mock
    private EmailService emailService;
    @Mock
    private CallerResolver callerResolver;
    @Mock
    private ApplicationEventPublisher eventPublisher;

    private AuthServiceImpl authService;

    @BeforeEach
    void setUp() {
        CategoryCalculator calculator = new CategoryCalculator();
        PasswordRecoveryProperties properties = new PasswordRecoveryProperties();
        properties.setResetTokenPepper(PEPPER);
        authService = new AuthServiceImpl(
                accountRepository,
                societyRepository,
                passwordEncoder,
                new AccountMapper(calculator, CLOCK),
                authManager,
                jwtTokenService,
                registrationWorkflow,
                calculator,
                passwordResetTokenRepository,
                properties,
                emailService,
                new AccessControlEngine(),
                callerResolver,
                CLOCK,
                CLOCK,
                eventPublisher
        );
    }

    private static RegisterRequest registerRequest(String role, List<UUID> societies) {
        return new RegisterRequest("Rower@Example.com", "secret1", "Giulia Rossi", role, societies, 2007, 68.0, 175.0);
    }

    @Nested
    @DisplayName("register")
    class Register {

        @Test
        @DisplayName("creates a pending account with a hashed password and stored category")
        void register_createsPendingAccount() {
            UUID society = UUID.randomUUID();
            when(accountRepository.existsByEmailIgnoreCase("Rower@Example.com")).thenReturn(false);
            when(societyRepository.existsById(society)).thenReturn(true);
            when(passwordEncoder.encode("secret1")).thenReturn("hashed");
            when(registrationWorkflow.initialStatus("Rower@Example.com")).thenReturn(ApprovalStatus.PENDING);
            when(accountRepository.save(any(Account.class))).thenAnswer(inv -> inv.getArgument(0));

            AccountDto result = authService.register(registerRequest("athlete", List.of(society, society)));

            ArgumentCaptor<Account> saved = ArgumentCaptor.forClass(Account.class);
            verify(accountRepository).save(saved.capture());
            assertThat(saved.getValue().getHashedPassword()).isEqualTo("hashed");
            assertThat(saved.getValue().getCategory()).isEqualTo("JUNIOR");
            assertThat(saved.getValue().getPasswordChangedAt()).isEqualTo(NOW);
            assertThat(result.status()).isEqualTo(ApprovalStatus.PENDING);
            assertThat(result.role()).isEqualTo(AccountRole.ATHLETE);
            assertThat(result.societyIds()).containsExactly(society);
            assertThat(result.primarySocietyId()).isEqualTo(society);
        }

        @Test
        @DisplayName("bootstrap registration is approved")
        void register_bootstrap_approved() {
            when(accountRepository.existsByEmailIgnoreCase(anyString())).thenReturn(false);
            when(passwordEncoder.encode(anyString())).thenReturn("hashed");
            when(registrationWorkflow.initialStatus("Rower@Example.com")).thenReturn(ApprovalStatus.APPROVED);
            when(accountRepository.save(any(Account.class))).thenAnswer(inv -> inv.getArgument(0));

            AccountDto result = authService.register(registerRequest("super_admin", null));

            assertThat(result.status()).isEqualTo(ApprovalStatus.APPROVED);
            assertThat(result.societyIds()).isEmpty();
        }

        @Test
        @DisplayName("duplicate email is a conflict")
        void register_duplicateEmail_conflict() {
            when(accountRepository.existsByEmailIgnoreCase("Rower@Example.com")).thenReturn(true);

            assertThatThrownBy(() -> authService.register(registerRequest("athlete", List.of())))
                    .isInstanceOf(ConflictException.class);
            verify(accountRepository, never()).save(any());
        }

        @Test
        @DisplayName("unknown role is invalid")
        void register_unknownRole_invalid() {
            when(accountRepository.existsByEmailIgnoreCase(anyString())).thenReturn(false);

            assertThatThrownBy(() -> authService.register(registerRequest("captain", List.of())))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("unknown society is invalid")
        void register_unknownSociety_invalid() {
            UUID society = UUID.randomUUID();
            when(accountRepository.existsByEmailIgnoreCase(anyString())).thenReturn(false);
            when(societyRepository.existsById(society)).thenReturn(false);

            assertThatThrownBy(() -> authService.register(registerRequest("coach", List.of(society))))
                    .isInstanceOf(ValidationException.class);
        }
    }

    @Nested
    @DisplayName("login")
    class Login {

        @Test
        @DisplayName("bad credentials are unauthorized")
        void login_badCredentials_unauthorized() {
            when(authManager.authenticate(any())).thenThrow(new BadCredentialsException("bad"));

            assertThatThrownBy(() -> authService.login(new LoginRequest("a@example.com", "wrong")))
                    .isInstanceOf(UnauthorizedException.class);
        }

        @Test
        @DisplayName("pending account is forbidden")
        void login_pending_forbidden() {
            Account pending = account(AccountRole.ATHLETE);
            pending.setStatus(ApprovalStatus.PENDING);
            when(accountRepository.findByEmailIgnoreCase(pending.getEmail())).thenReturn(Optional.of(pending));

            assertThatThrownBy(() -> authService.login(new LoginRequest(pending.getEmail(), "secret1")))
                    .isInstanceOf(ForbiddenException.class);
            verifyNoInteractions(jwtTokenService);
        }

        @Test
        @DisplayName("rejected account is forbidden")
        void login_rejected_forbidden() {
            Account rejected = account(AccountRole.COACH);
            rejected.setStatus(ApprovalStatus.REJECTED);
            when(accountRepository.findByEmailIgnoreCase(rejected.getEmail())).thenReturn(Optional.of(rejected));

            assertThatThrownBy(() -> authService.login(new LoginRequest(rejected.getEmail(), "secret1")))
                    .isInstanceOf(ForbiddenException.class);
        }

        @Test
        @DisplayName("approved account gets a bearer token")
        void login_approved_returnsToken() {
            Account approved = account(AccountRole.COACH);
            when(accountRepository.findByEmailIgnoreCase(approved.getEmail())).thenReturn(Optional.of(approved));
            when(jwtTokenService.generateAccessToken(approved)).thenReturn("jwt");
            when(jwtTokenService.getAccessTokenValidityInMs()).thenReturn(604_800_000L);

            LoginResponse response = authService.login(new LoginRequest(approved.getEmail(), "secret1"));

            assertThat(response.accessToken()).isEqualTo("jwt");
            assertThat(response.tokenType()).isEqualTo("Bearer");
            assertThat(response.expiresInMs()).isEqualTo(604_800_000L);
            assertThat(response.account().id()).isEqualTo(approved.getId());
        }
    }

    @Nested
    @DisplayName("password recovery")
    class PasswordRecovery {

        @Test
        @DisplayName("requestPasswordReset only publishes an event, whatever the address")
        void request_publishesEventWithoutTouchingStore() {
            authService.requestPasswordReset("nobody@example.com");
            authService.requestPasswordReset("Rower@Example.com");

            ArgumentCaptor<PasswordResetRequestedEvent> events = ArgumentCaptor.forClass(PasswordResetRequestedEvent.class);
            verify(eventPublisher, times(2)).publishEvent(events.capture());
            assertThat(events.getAllValues())
                    .extracting(PasswordResetRequestedEvent::getEmail)
                    .containsExactly("nobody@example.com", "Rower@Example.com");
            verifyNoInteractions(accountRepository, passwordResetTokenRepository, emailService);
        }

        @Test
        @DisplayName("unknown email issues nothing")
        void generate_unknownEmail_silent() {
            when(accountRepository.findByEmailIgnoreCase("nobody@example.com")).thenReturn(Optional.empty());

            authService.generatePasswordResetToken("nobody@example.com");

            verify(passwordResetTokenRepository, never()).save(any());
            verifyNoInteractions(emailService);
        }

        @Test
        @DisplayName("known email stores only the peppered hash and mails the raw token")
        void generate_knownEmail_storesHashAndMailsToken() throws Exception {
            Account account = account(AccountRole.ATHLETE);
            when(accountRepository.findByEmailIgnoreCase(account.getEmail())).thenReturn(Optional.of(account));

            authService.generatePasswordResetToken(account.getEmail());

            verify(passwordResetTokenRepository).invalidateAccountTokens(account.getId());
            ArgumentCaptor<PasswordResetToken> stored = ArgumentCaptor.forClass(PasswordResetToken.class);
            verify(passwordResetTokenRepository).save(stored.capture());
            ArgumentCaptor<String> mailed = ArgumentCaptor.forClass(String.class);
            verify(emailService).sendPasswordResetEmail(eq(account.getEmail()), mailed.capture());

            assertThat(stored.getValue().getTokenHash()).isEqualTo(hash(mailed.getValue()));
            assertThat(stored.getValue().getTokenHash()).isNotEqualTo(mailed.getValue());
            assertThat(stored.getValue().getExpiresAt())
                    .isEqualTo(LocalDateTime.ofInstant(NOW, ZoneOffset.UTC).plusMinutes(60));
        }

        @Test
        @DisplayName("reset with an unknown or expired token is invalid")
        void reset_invalidToken_invalid() {
            when(passwordResetTokenRepository.findByTokenHashAndUsedFalseAndExpiresAtAfter(anyString(), any()))
                    .thenReturn(Optional.empty());

            assertThatThrownBy(() -> authService.resetPassword("bogus", "newSecret"))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("reset losing the consumption race is invalid")
        void reset_alreadyConsumed_invalid() {
            PasswordResetToken token = new PasswordResetToken();
            token.setId(UUID.randomUUID());
            when(passwordResetTokenRepository.findByTokenHashAndUsedFalseAndExpiresAtAfter(anyString(), any()))
                    .thenReturn(Optional.of(token));
            when(passwordResetTokenRepository.markUsedIfValid(eq(token.getId()), any())).thenReturn(0);

            assertThatThrownBy(() -> authService.resetPassword("raw", "newSecret"))
                    .isInstanceOf(ValidationException.class);
            verify(accountRepository, never()).save(any());
        }

        @Test
        @DisplayName("successful reset changes the password and bumps passwordChangedAt")
        void reset_success_updatesPassword() throws Exception {
            Account account = account(AccountRole.ATHLETE);
            account.setPasswordChangedAt(NOW.minusSeconds(3600));
            PasswordResetToken token = new PasswordResetToken();
            token.setId(UUID.randomUUID());
            token.setAccountId(account.getId());
            when(passwordResetTokenRepository.findByTokenHashAndUsedFalseAndExpiresAtAfter(eq(hash("raw")), any()))
                    .thenReturn(Optional.of(token));
            when(passwordResetTokenRepository.markUsedIfValid(eq(token.getId()), any())).thenReturn(1);
            when(accountRepository.findById(account.getId())).thenReturn(Optional.of(account));
            when(passwordEncoder.encode("newSecret")).thenReturn("new-hash");

            authService.resetPassword("raw", "newSecret");

            assertThat(account.getHashedPassword()).isEqualTo("new-hash");
            assertThat(account.getPasswordChangedAt()).isEqualTo(NOW);
            verify(accountRepository).save(account);
        }
    }

    @Test
    @DisplayName("getCurrentAccount maps the caller's stored account")
    void getCurrentAccount_mapsAccount() {
        Account account = account(AccountRole.COACH);
        Authentication authentication = mock(Authentication.class);
        when(callerResolver.loadAccount(authentication)).thenReturn(account);

        assertThat(authService.getCurrentAccount(authentication).email()).isEqualTo(account.getEmail());
    }

    @Test
    @DisplayName("sweepExpiredResetTokens is reserved to super admins")
    void sweep_requiresSuperAdmin() {
        Authentication authentication = mock(Authentication.class);
        when(callerResolver.resolve(authentication)).thenReturn(callerOf(account(AccountRole.COACH)));

        assertThatThrownBy(() -> authService.sweepExpiredResetTokens(authentication))
                .isInstanceOf(ForbiddenException.class);
        verifyNoInteractions(passwordResetTokenRepository);
    }

    @Test
    @DisplayName("sweepExpiredResetTokens reports the deleted count")
    void sweep_superAdmin_reportsCount() {
        Authentication authentication = mock(Authentication.class);
        when(callerResolver.resolve(authentication)).thenReturn(callerOf(account(AccountRole.SUPER_ADMIN)));
        when(passwordResetTokenRepository.deleteExpiredTokens(LocalDateTime.ofInstant(NOW, ZoneOffset.UTC))).thenReturn(4);

        assertThat(authService.sweepExpiredResetTokens(authentication)).isEqualTo(4);
    }

    private static String hash(String token) throws Exception {
        MessageDigest digest = MessageDigest.getInstance("SHA-256");
        return Base64.getEncoder().encodeToString(digest.digest((PEPPER + token).getBytes(StandardCharsets.UTF_8)));
    }
}
