package uk.gegc.ergtracker.features.auth.domain.event;

import org.springframework.context.ApplicationEvent;

/**
 * Published by the forgot-password endpoint. Carries the address exactly as submitted; whether it
 * belongs to an account is decided by the listener, off the request thread.
 */
public class PasswordResetRequestedEvent extends ApplicationEvent {

    private final String email;

    public PasswordResetRequestedEvent(Object source, String email) {
        super(source);
        this.email = email;
    }

    public String getEmail() {
        return email;
    }
}
