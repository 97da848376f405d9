package dev.aparikh.emailtriage.attachment;

import dev.aparikh.emailtriage.config.TriageProperties;
import dev.aparikh.emailtriage.model.Attachment;
import dev.aparikh.emailtriage.model.EmailDocument;
import dev.aparikh.emailtriage.search.EmailQueryBuilder;
import dev.aparikh.emailtriage.search.EmailSearchService;
import org.apache.solr.client.solrj.SolrQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Finds emails by the content of their attachments, ignoring signature images and logos.
 * <p>
 * Solr only narrows the candidates: it fetches {@code maxResults * overFetchFactor} emails with
 * attachments whose text fields loosely match, then the exact case-insensitive match against each
 * relevant attachment decides. Candidates beyond the over-fetch window are not considered.
 */
@Service
public class AttachmentSearchService {

    private static final Logger log = LoggerFactory.getLogger(AttachmentSearchService.class);

    private static final Comparator<AttachmentSearchHit> RANKING = Comparator
            .comparing(AttachmentSearchHit::matchReason)
            .thenComparing(hit -> hit.email().sentAt(), Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
            .thenComparing(hit -> hit.email().id(), Comparator.nullsLast(Comparator.<String>naturalOrder()));

    private final EmailSearchService searchService;
    private final EmailQueryBuilder queryBuilder;
    private final TriageProperties.AttachmentSearch settings;

    public AttachmentSearchService(EmailSearchService searchService, EmailQueryBuilder queryBuilder,
                                   TriageProperties properties) {
        this.searchService = searchService;
        this.queryBuilder = queryBuilder;
        this.settings = properties.getAttachmentSearch();
    }

    public List<AttachmentSearchHit> search(AttachmentSearchQuery query) {
        int rows = query.maxResults() * settings.getOverFetchFactor();
        SolrQuery solrQuery = queryBuilder.buildAttachmentSearch(query.text(), query.sender(), query.dateFrom(), rows);
        List<EmailDocument> candidates = searchService.execute(solrQuery);

        List<AttachmentSearchHit> hits = new ArrayList<>();
        for (EmailDocument email : candidates) {
            AttachmentSearchHit hit = match(email, query);
            if (hit != null) {
                hits.add(hit);
            }
        }
        log.debug("Attachment search '{}' kept {} of {} candidates", query.text(), hits.size(), candidates.size());

        return hits.stream()
                .sorted(RANKING)
                .limit(query.maxResults())
                .toList();
    }

    AttachmentSearchHit match(EmailDocument email, AttachmentSearchQuery query) {
        String needle = query.text().toLowerCase(Locale.ROOT);
        List<Attachment> relevant = email.attachments().stream()
                .filter(a -> AttachmentRelevanceFilter.isRelevant(a.filename(), a.mimeType()))
                .filter(a -> query.fileTypeOpt().map(type -> hasFileType(a, type)).orElse(true))
                .toList();
        if (relevant.isEmpty()) return null;

        List<AttachmentMatch> matches = new ArrayList<>();
        for (Attachment attachment : relevant) {
            AttachmentMatch match = matchAttachment(attachment, query.text(), needle);
            if (match != null) {
                matches.add(match);
            }
        }
        if (!matches.isEmpty()) {
            MatchReason best = matches.stream()
                    .map(AttachmentMatch::matchReason)
                    .min(Comparator.naturalOrder())
                    .orElseThrow();
            return new AttachmentSearchHit(email, best, List.copyOf(matches));
        }
        if (query.includeBodyMatches() && (containsIgnoreCase(email.subject(), needle) || containsIgnoreCase(email.body(), needle))) {
            return new AttachmentSearchHit(email, MatchReason.NONE, List.of());
        }
        return null;
    }

    private AttachmentMatch matchAttachment(Attachment attachment, String phrase, String needle) {
        if (attachment.hasParsedContent()) {
            int at = indexOfIgnoreCase(attachment.parsedContent(), phrase);
            if (at >= 0) {
                String context = contextWindow(attachment.parsedContent(), at, phrase.length(), settings.getContextWindow());
                return new AttachmentMatch(attachment.filename(), attachment.mimeType(), attachment.size(),
                        MatchReason.CONTENT, context);
            }
        }
        if (containsIgnoreCase(attachment.filename(), needle)) {
            return new AttachmentMatch(attachment.filename(), attachment.mimeType(), attachment.size(),
                    MatchReason.FILENAME, null);
        }
        return null;
    }

    /**
     * Up to {@code window} characters either side of the match, with "..." where text was cut.
     */
    static String contextWindow(String content, int matchStart, int matchLength, int window) {
        int start = Math.max(0, matchStart - window);
        int end = Math.min(content.length(), matchStart + matchLength + window);
        StringBuilder context = new StringBuilder();
        if (start > 0) context.append("...");
        context.append(content, start, end);
        if (end < content.length()) context.append("...");
        return context.toString().replaceAll("\\s+", " ").trim();
    }

    /**
     * Position of the first case-insensitive occurrence of {@code phrase} in {@code content}, or -1.
     * Offsets refer to {@code content} itself, never to a lower-cased copy whose length may differ.
     */
    static int indexOfIgnoreCase(String content, String phrase) {
        int last = content.length() - phrase.length();
        for (int i = 0; i <= last; i++) {
            if (content.regionMatches(true, i, phrase, 0, phrase.length())) {
                return i;
            }
        }
        return -1;
    }

    private static boolean hasFileType(Attachment attachment, String fileType) {
        String type = fileType.toLowerCase(Locale.ROOT);
        if (AttachmentRelevanceFilter.extension(attachment.filename()).equals(type)) return true;
        return attachment.mimeType() != null && attachment.mimeType().toLowerCase(Locale.ROOT).contains(type);
    }

    private static boolean containsIgnoreCase(String haystack, String lowerNeedle) {
        return haystack != null && haystack.toLowerCase(Locale.ROOT).contains(lowerNeedle);
    }
}
