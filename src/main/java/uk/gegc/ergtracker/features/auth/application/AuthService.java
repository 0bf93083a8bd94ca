package uk.gegc.ergtracker.features.auth.application;

import org.springframework.security.core.Authentication;
import uk.gegc.ergtracker.features.account.api.dto.AccountDto;
import uk.gegc.ergtracker.features.auth.api.dto.LoginRequest;
import uk.gegc.ergtracker.features.auth.api.dto.LoginResponse;
import uk.gegc.ergtracker.features.auth.api.dto.RegisterRequest;

public interface AuthService {

    AccountDto register(RegisterRequest request);

    LoginResponse login(LoginRequest request);

    AccountDto getCurrentAccount(Authentication authentication);

    /**
     * Hands the recovery trigger to a background listener. Does the same work for known and unknown
     * addresses, so the response reveals nothing about account existence.
     */
    void requestPasswordReset(String email);

    /**
     * Issues a reset token and emails it when the address belongs to an account. Silent otherwise.
     */
    void generatePasswordResetToken(String email);

    void resetPassword(String token, String newPassword);

    int sweepExpiredResetTokens();

    int sweepExpiredResetTokens(Authentication authentication);
}
