package dev.aparikh.emailtriage.conversation;

import java.util.List;
import java.util.Map;

/**
 * Everything exchanged with one contact. {@code threads} maps thread id to its emails oldest first,
 * in the order threads first appear; {@code emails} is the same set as one chronological list.
 */
public record ConversationHistory(
        String contact,
        int totalEmails,
        int threadCount,
        Map<String, List<ConversationEntry>> threads,
        List<ConversationEntry> emails
) {
    public static ConversationHistory empty(String contact) {
        return new ConversationHistory(contact, 0, 0, Map.of(), List.of());
    }
}
