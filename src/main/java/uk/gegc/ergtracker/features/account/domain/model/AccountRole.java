package uk.gegc.ergtracker.features.account.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import uk.gegc.ergtracker.shared.exception.ValidationException;

import java.util.Arrays;
import java.util.Locale;

public enum AccountRole {
    SUPER_ADMIN("super_admin"),
    COACH("coach"),
    ATHLETE("athlete");

    private final String wireValue;

    AccountRole(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    /**
     * Parses the lower-case wire form ({@code super_admin}, {@code coach}, {@code athlete}).
     *
     * @throws ValidationException for blank or unknown values
     */
    @JsonCreator
    public static AccountRole fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Role is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(role -> role.wireValue.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new ValidationException("Unknown role: " + value));
    }
}
