package uk.gegc.ergtracker.features.auth.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@Component
@ConfigurationProperties(prefix = "app.auth")
public class PasswordRecoveryProperties {

    /**
     * Secret mixed into reset-token hashes so a leaked table cannot be matched against guessed tokens.
     */
    @NotBlank(message = "app.auth.reset-token-pepper is not configured")
    private String resetTokenPepper;

    @Min(1)
    private long resetTokenTtlMinutes = 60;

    /**
     * Forgot-password attempts allowed per email within {@link #forgotPasswordWindow}.
     */
    @Min(1)
    private int forgotPasswordLimit = 3;

    @NotNull
    private Duration forgotPasswordWindow = Duration.ofHours(1);
}
