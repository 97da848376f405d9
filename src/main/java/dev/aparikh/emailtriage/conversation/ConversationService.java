package dev.aparikh.emailtriage.conversation;

import dev.aparikh.emailtriage.model.EmailDocument;
import dev.aparikh.emailtriage.search.EmailQueryBuilder;
import dev.aparikh.emailtriage.search.EmailSearchService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Rebuilds the conversations held with one contact from the emails they sent or received.
 */
@Service
public class ConversationService {

    public static final int DEFAULT_MAX_RESULTS = 100;

    private static final Logger log = LoggerFactory.getLogger(ConversationService.class);

    private static final Comparator<ConversationEntry> CHRONOLOGICAL = Comparator
            .comparing((ConversationEntry e) -> e.email().sentAt(), Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))
            .thenComparing(e -> e.email().id(), Comparator.nullsLast(Comparator.<String>naturalOrder()));

    private final EmailSearchService searchService;
    private final EmailQueryBuilder queryBuilder;

    public ConversationService(EmailSearchService searchService, EmailQueryBuilder queryBuilder) {
        this.searchService = searchService;
        this.queryBuilder = queryBuilder;
    }

    public ConversationHistory history(String contact) {
        return history(contact, null, DEFAULT_MAX_RESULTS);
    }

    /**
     * @param contact   address or address fragment, matched against from, to, cc and bcc
     * @param threadId  optional, narrows the lookup to one thread
     * @param maxResults upper bound on emails fetched
     */
    public ConversationHistory history(String contact, String threadId, int maxResults) {
        if (contact == null || contact.isBlank()) {
            throw new IllegalArgumentException("contact must be provided");
        }
        if (maxResults <= 0) {
            throw new IllegalArgumentException("maxResults must be > 0");
        }
        String trimmed = contact.trim();
        List<EmailDocument> emails = searchService.execute(queryBuilder.buildConversation(trimmed, threadId, maxResults));
        if (emails.isEmpty()) {
            return ConversationHistory.empty(trimmed);
        }

        List<ConversationEntry> entries = emails.stream()
                .map(email -> new ConversationEntry(email, directionOf(email, trimmed)))
                .toList();

        Map<String, List<ConversationEntry>> threads = new LinkedHashMap<>();
        for (ConversationEntry entry : entries) {
            threads.computeIfAbsent(threadKey(entry.email()), k -> new ArrayList<>()).add(entry);
        }
        Map<String, List<ConversationEntry>> ordered = new LinkedHashMap<>();
        threads.forEach((thread, members) -> {
            members.sort(CHRONOLOGICAL);
            ordered.put(thread, List.copyOf(members));
        });

        log.debug("Contact {} has {} emails in {} threads", trimmed, entries.size(), ordered.size());
        return new ConversationHistory(trimmed, entries.size(), ordered.size(),
                Collections.unmodifiableMap(ordered), entries);
    }

    static Direction directionOf(EmailDocument email, String contact) {
        String from = email.from();
        boolean sent = from != null && from.toLowerCase(Locale.ROOT).contains(contact.toLowerCase(Locale.ROOT));
        return sent ? Direction.FROM_CONTACT : Direction.TO_CONTACT;
    }

    // An email without a thread id is its own conversation.
    private static String threadKey(EmailDocument email) {
        return email.threadId() != null && !email.threadId().isBlank() ? email.threadId() : email.id();
    }
}
