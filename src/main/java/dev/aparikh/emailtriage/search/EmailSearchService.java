package dev.aparikh.emailtriage.search;

import dev.aparikh.emailtriage.model.AttachmentsJson;
import dev.aparikh.emailtriage.model.EmailDocument;
import org.apache.solr.client.solrj.SolrClient;
import org.apache.solr.client.solrj.SolrQuery;
import org.apache.solr.client.solrj.SolrServerException;
import org.apache.solr.client.solrj.response.QueryResponse;
import org.apache.solr.common.SolrDocument;
import org.apache.solr.common.SolrException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Read side of the Solr-backed email store.
 */
@Service
public class EmailSearchService {

    private static final Logger LOG = LoggerFactory.getLogger(EmailSearchService.class);

    private final SolrClient solr;
    private final EmailQueryBuilder queryBuilder;

    public EmailSearchService(SolrClient solr, EmailQueryBuilder queryBuilder) {
        this.solr = solr;
        this.queryBuilder = queryBuilder;
    }

    private static List<String> toList(Collection<?> values) {
        if (values == null) return List.of();
        return values.stream()
                .filter(Objects::nonNull)
                .map(Object::toString)
                .toList();
    }

    private static String getFieldAsString(SolrDocument d, String fieldName) {
        Object value = d.getFieldValue(fieldName);
        if (value == null) return null;
        if (value instanceof String) return (String) value;
        if (value instanceof Collection<?> collection && !collection.isEmpty()) {
            return String.valueOf(collection.iterator().next());
        }
        return String.valueOf(value);
    }

    private static boolean getFieldAsBoolean(SolrDocument d, String fieldName) {
        Object value = d.getFieldValue(fieldName);
        if (value instanceof Boolean b) return b;
        return value != null && Boolean.parseBoolean(String.valueOf(value));
    }

    public List<EmailDocument> search(SearchQuery query) {
        return execute(queryBuilder.build(query));
    }

    public long count(SearchQuery query) {
        SolrQuery q = queryBuilder.build(query);
        q.setRows(0); // We only want the count, no documents
        return query(q).getResults().getNumFound();
    }

    public Optional<EmailDocument> findById(String id) {
        try {
            SolrDocument doc = solr.getById(id);
            return Optional.ofNullable(doc).map(EmailSearchService::fromSolrDoc);
        } catch (SolrServerException | IOException | SolrException e) {
            throw new EmailStoreException("Search failed", e);
        }
    }

    public EmailDocument getById(String id) {
        return findById(id).orElseThrow(() -> new EmailNotFoundException(id));
    }

    /**
     * Runs a query produced by {@link EmailQueryBuilder} and maps the hits in the order Solr
     * returned them.
     */
    public List<EmailDocument> execute(SolrQuery query) {
        return query(query).getResults().stream().map(EmailSearchService::fromSolrDoc).toList();
    }

    private QueryResponse query(SolrQuery q) {
        try {
            LOG.debug("Solr query q={} fq={}", q.getQuery(), q.getFilterQueries());
            return solr.query(q);
        } catch (SolrServerException | IOException | SolrException e) {
            LOG.warn("Solr query failed: {}", e.getMessage());
            throw new EmailStoreException("Search failed", e);
        }
    }

    static EmailDocument fromSolrDoc(SolrDocument d) {
        try {
            return toEmail(d);
        } catch (IllegalArgumentException | DateTimeException e) {
            String id = getFieldAsString(d, EmailDocument.FIELD_ID);
            LOG.warn("Stored email {} cannot be read: {}", id, e.getMessage());
            throw new EmailStoreException("Stored email " + id + " is unreadable", e);
        }
    }

    private static EmailDocument toEmail(SolrDocument d) {
        Object dateObj = d.getFieldValue(EmailDocument.FIELD_SENT_AT);
        Instant sentAt = null;
        if (dateObj instanceof java.util.Date date) {
            sentAt = date.toInstant();
        } else if (dateObj instanceof String s) {
            sentAt = Instant.parse(s);
        }
        return EmailDocument.builder()
                .id(getFieldAsString(d, EmailDocument.FIELD_ID))
                .threadId(getFieldAsString(d, EmailDocument.FIELD_THREAD_ID))
                .from(getFieldAsString(d, EmailDocument.FIELD_FROM))
                .fromName(getFieldAsString(d, EmailDocument.FIELD_FROM_NAME))
                .to(toList(d.getFieldValues(EmailDocument.FIELD_TO)))
                .cc(toList(d.getFieldValues(EmailDocument.FIELD_CC)))
                .bcc(toList(d.getFieldValues(EmailDocument.FIELD_BCC)))
                .subject(getFieldAsString(d, EmailDocument.FIELD_SUBJECT))
                .body(getFieldAsString(d, EmailDocument.FIELD_BODY))
                .bodyHtml(getFieldAsString(d, EmailDocument.FIELD_BODY_HTML))
                .snippet(getFieldAsString(d, EmailDocument.FIELD_SNIPPET))
                .sentAt(sentAt)
                .labels(new LinkedHashSet<>(toList(d.getFieldValues(EmailDocument.FIELD_LABELS))))
                .read(getFieldAsBoolean(d, EmailDocument.FIELD_IS_READ))
                .starred(getFieldAsBoolean(d, EmailDocument.FIELD_IS_STARRED))
                .important(getFieldAsBoolean(d, EmailDocument.FIELD_IS_IMPORTANT))
                .attachments(AttachmentsJson.read(getFieldAsString(d, EmailDocument.FIELD_ATTACHMENTS_JSON)))
                .category(getFieldAsString(d, EmailDocument.FIELD_CATEGORY))
                .priority(getFieldAsString(d, EmailDocument.FIELD_PRIORITY))
                .build();
    }
}
