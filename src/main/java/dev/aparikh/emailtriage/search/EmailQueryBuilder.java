package dev.aparikh.emailtriage.search;

import dev.aparikh.emailtriage.model.EmailDocument;
import org.apache.solr.client.solrj.SolrQuery;
import org.apache.solr.client.solrj.util.ClientUtils;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Translates search criteria into Solr queries.
 * <p>
 * Each criterion becomes its own filter query, so Solr intersects them; with no criteria the query
 * is {@code *:*}. Output depends only on the input and the clock, which keeps queries reproducible.
 */
@Component
public class EmailQueryBuilder {

    private static final Pattern WORD_BREAK = Pattern.compile("[^\\p{L}\\p{N}_]+");

    static final String TEXT_FIELDS = EmailDocument.FIELD_SUBJECT + "^3 "
            + EmailDocument.FIELD_BODY + "^2 "
            + EmailDocument.FIELD_SNIPPET;

    static final String ATTACHMENT_TEXT_FIELDS = EmailDocument.FIELD_ATTACHMENT_FILENAME + "^2 "
            + EmailDocument.FIELD_ATTACHMENT_CONTENT + " "
            + EmailDocument.FIELD_SUBJECT + " "
            + EmailDocument.FIELD_BODY;

    private static final List<String> PARTICIPANT_FIELDS = List.of(
            EmailDocument.FIELD_FROM, EmailDocument.FIELD_TO, EmailDocument.FIELD_CC, EmailDocument.FIELD_BCC);

    private final RelativeDateNormalizer dateNormalizer;
    private final ZoneId zone;

    public EmailQueryBuilder(RelativeDateNormalizer dateNormalizer, Clock clock) {
        this.dateNormalizer = dateNormalizer;
        this.zone = clock.getZone();
    }

    public SolrQuery build(SearchQuery query) {
        SolrQuery q = new SolrQuery();
        if (query.textOpt().isPresent()) {
            setFuzzyText(q, query.textOpt().get(), TEXT_FIELDS);
        } else {
            q.setQuery("*:*");
        }

        query.senderOpt().ifPresent(sender -> q.addFilterQuery(senderFilter(sender)));
        query.recipientOpt().ifPresent(recipient -> q.addFilterQuery(anyOf(
                List.of(EmailDocument.FIELD_TO, EmailDocument.FIELD_CC, EmailDocument.FIELD_BCC), recipient)));
        query.categoryOpt().ifPresent(category -> q.addFilterQuery(
                EmailDocument.FIELD_CATEGORY + ":" + ClientUtils.escapeQueryChars(category)));

        String range = dateRange(query.dateFrom(), query.dateTo());
        if (range != null) {
            q.addFilterQuery(range);
        }

        if (query.hasAttachments() != null) {
            q.addFilterQuery(EmailDocument.FIELD_HAS_ATTACHMENTS + ":" + query.hasAttachments());
        }
        for (String label : query.labelsNonEmpty()) {
            q.addFilterQuery(EmailDocument.FIELD_LABELS + ":"
                    + ClientUtils.escapeQueryChars(label.toUpperCase(Locale.ROOT)));
        }
        if (query.read() != null) {
            q.addFilterQuery(EmailDocument.FIELD_IS_READ + ":" + query.read());
        }

        applySort(q, query.sort());
        q.setRows(query.maxResults());
        return q;
    }

    /**
     * Every email the contact sent or received (to, cc or bcc), oldest first, optionally narrowed
     * to one thread.
     */
    public SolrQuery buildConversation(String contact, String threadId, int maxResults) {
        SolrQuery q = new SolrQuery("*:*");
        q.addFilterQuery(anyOf(PARTICIPANT_FIELDS, contact));
        if (threadId != null && !threadId.isBlank()) {
            q.addFilterQuery(EmailDocument.FIELD_THREAD_ID + ":\"" + ClientUtils.escapeQueryChars(threadId.trim()) + "\"");
        }
        applySort(q, SortOrder.OLDEST_FIRST);
        q.setRows(maxResults);
        return q;
    }

    /**
     * Candidate emails for an attachment search: they must carry attachments and the text may hit
     * attachment names, attachment content, subject or body. Attachment-level filtering happens
     * after the fetch.
     */
    public SolrQuery buildAttachmentSearch(String text, String sender, String dateFrom, int rows) {
        SolrQuery q = new SolrQuery();
        setFuzzyText(q, text, ATTACHMENT_TEXT_FIELDS);
        q.addFilterQuery(EmailDocument.FIELD_HAS_ATTACHMENTS + ":true");
        if (sender != null && !sender.isBlank()) {
            q.addFilterQuery(senderFilter(sender.trim()));
        }
        String range = dateRange(dateFrom, null);
        if (range != null) {
            q.addFilterQuery(range);
        }
        applySort(q, SortOrder.NEWEST_FIRST);
        q.setRows(rows);
        return q;
    }

    String dateRange(String dateFrom, String dateTo) {
        String from = boundary(dateFrom, false);
        String to = boundary(dateTo, true);
        if (from == null && to == null) return null;
        return EmailDocument.FIELD_SENT_AT + ":[" + (from == null ? "*" : from)
                + " TO " + (to == null ? "*" : to) + "]";
    }

    private String boundary(String raw, boolean endOfDay) {
        String normalized = dateNormalizer.normalize(raw);
        if (normalized == null) return null;
        try {
            LocalDate date = LocalDate.parse(normalized);
            Instant instant = endOfDay
                    ? date.plusDays(1).atStartOfDay(zone).toInstant().minusMillis(1)
                    : date.atStartOfDay(zone).toInstant();
            return instant.toString();
        } catch (DateTimeException notADate) {
            // fall through to instant parsing
        }
        try {
            return Instant.parse(normalized).toString();
        } catch (DateTimeException notAnInstant) {
            // Solr decides whether it can read it; a rejected value surfaces as a store error
            return ClientUtils.escapeQueryChars(normalized);
        }
    }

    private static String senderFilter(String sender) {
        String phrase = ClientUtils.escapeQueryChars(sender);
        return "(" + EmailDocument.FIELD_FROM + ":" + wildcard(sender)
                + " OR " + EmailDocument.FIELD_FROM_NAME + ":\"" + phrase + "\")";
    }

    private static String anyOf(List<String> fields, String term) {
        String pattern = wildcard(term);
        return "(" + String.join(" OR ", fields.stream().map(f -> f + ":" + pattern).toList()) + ")";
    }

    // Address fields are indexed lower-cased as single tokens, so substring match is a wildcard query.
    private static String wildcard(String term) {
        return "*" + ClientUtils.escapeQueryChars(term.trim().toLowerCase(Locale.ROOT)) + "*";
    }

    // Fuzzy terms bypass the field analyzer, so text is split where text_general would split it
    // ("invoice-1042.pdf" indexes as invoice, 1042, pdf) and each word is made fuzzy on its own.
    private static void setFuzzyText(SolrQuery q, String text, String fields) {
        List<String> terms = new ArrayList<>();
        for (String word : words(text)) {
            terms.add(fuzzy(word));
        }
        q.setQuery(terms.isEmpty() ? "*:*" : String.join(" ", terms));
        q.set("defType", "edismax");
        q.set("qf", fields);
    }

    static List<String> words(String text) {
        return Arrays.stream(WORD_BREAK.split(text.trim()))
                .filter(word -> !word.isEmpty())
                .toList();
    }

    // Same edit-distance steps as "AUTO" fuzziness: exact up to 2 chars, 1 edit up to 5, then 2.
    static String fuzzy(String token) {
        String escaped = ClientUtils.escapeQueryChars(token);
        int length = token.codePointCount(0, token.length());
        if (length <= 2) return escaped;
        return escaped + (length <= 5 ? "~1" : "~2");
    }

    private static void applySort(SolrQuery q, SortOrder sort) {
        SolrQuery.ORDER order = sort == SortOrder.OLDEST_FIRST ? SolrQuery.ORDER.asc : SolrQuery.ORDER.desc;
        q.setSort(EmailDocument.FIELD_SENT_AT, order);
        q.addSort(EmailDocument.FIELD_ID, SolrQuery.ORDER.asc);
    }
}
