package dev.aparikh.emailtriage.conversation;

/**
 * Whether the contact a conversation was looked up for sent the email or received it.
 */
public enum Direction {
    FROM_CONTACT,
    TO_CONTACT
}
