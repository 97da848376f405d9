package dev.aparikh.emailtriage.search;

public class EmailNotFoundException extends RuntimeException {

    private final String emailId;

    public EmailNotFoundException(String emailId) {
        super("Email not found: " + emailId);
        this.emailId = emailId;
    }

    public String getEmailId() {
        return emailId;
    }
}
