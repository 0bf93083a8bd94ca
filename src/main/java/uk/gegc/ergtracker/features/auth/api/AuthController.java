package uk.gegc.ergtracker.features.auth.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;
import uk.gegc.ergtracker.features.account.api.dto.AccountDto;
import uk.gegc.ergtracker.features.auth.api.dto.*;
import uk.gegc.ergtracker.features.auth.application.AuthService;
import uk.gegc.ergtracker.features.auth.config.PasswordRecoveryProperties;
import uk.gegc.ergtracker.shared.rate_limit.RateLimitService;

import java.util.Locale;

@Tag(name = "Authentication", description = "Registration, login, current account and password recovery")
@RestController
@RequestMapping("/api/v1/auth")
@RequiredArgsConstructor
public class AuthController {

    private final AuthService authService;
    private final RateLimitService rateLimitService;
    private final PasswordRecoveryProperties passwordRecoveryProperties;

    @Operation(
            summary = "Register a new account",
            description = "Creates a pending account. The configured bootstrap email is approved immediately when no account exists yet."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Account registered"),
            @ApiResponse(responseCode = "400", description = "Validation errors, unknown role or society",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Email already in use",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/register")
    public ResponseEntity<AccountDto> register(
            @io.swagger.v3.oas.annotations.parameters.RequestBody(
                    description = "Registration information",
                    required = true,
                    content = @Content(schema = @Schema(implementation = RegisterRequest.class))
            )
            @Valid @RequestBody RegisterRequest request
    ) {
        AccountDto account = authService.register(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(account);
    }

    @Operation(summary = "Log in", description = "Returns a bearer token for an approved account.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Authenticated"),
            @ApiResponse(responseCode = "401", description = "Bad credentials",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "403", description = "Account pending or rejected",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(authService.login(request));
    }

    @Operation(summary = "Get the current account")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Current account"),
            @ApiResponse(responseCode = "401", description = "Missing, invalid or revoked token",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/me")
    public ResponseEntity<AccountDto> me(Authentication authentication) {
        return ResponseEntity.ok(authService.getCurrentAccount(authentication));
    }

    @Operation(
            summary = "Request a password reset",
            description = "Always answers 202 so callers cannot discover which emails are registered."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "Reset email sent if the account exists"),
            @ApiResponse(responseCode = "400", description = "Invalid email",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "429", description = "Rate limit exceeded",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/forgot-password")
    public ResponseEntity<ForgotPasswordResponse> forgotPassword(@Valid @RequestBody ForgotPasswordRequest request) {
        rateLimitService.checkRateLimit(
                "forgot-password",
                request.email().trim().toLowerCase(Locale.ROOT),
                passwordRecoveryProperties.getForgotPasswordLimit(),
                passwordRecoveryProperties.getForgotPasswordWindow()
        );

        authService.requestPasswordReset(request.email());

        return ResponseEntity.accepted()
                .body(new ForgotPasswordResponse("If the email exists, a reset link was sent."));
    }

    @Operation(summary = "Reset password", description = "Consumes a reset token and sets a new password. Older sessions stop working.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Password reset"),
            @ApiResponse(responseCode = "400", description = "Invalid, used or expired token",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/reset-password")
    public ResponseEntity<ResetPasswordResponse> resetPassword(@Valid @RequestBody ResetPasswordRequest request) {
        authService.resetPassword(request.token(), request.newPassword());
        return ResponseEntity.ok(new ResetPasswordResponse("Password has been reset"));
    }
}
