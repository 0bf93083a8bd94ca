package uk.gegc.ergtracker.shared.email;

public interface EmailService {
    void sendPasswordResetEmail(String email, String resetToken);
}
