package uk.gegc.ergtracker.features.account.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Component
@ConfigurationProperties(prefix = "app.bootstrap")
public class BootstrapProperties {

    /**
     * Email that is approved automatically when it registers into an empty account store.
     * Leave blank to require approval for every registration.
     */
    private String adminEmail;

    public boolean isBootstrapEmail(String email) {
        return adminEmail != null && !adminEmail.isBlank()
                && email != null && adminEmail.trim().equalsIgnoreCase(email.trim());
    }
}
