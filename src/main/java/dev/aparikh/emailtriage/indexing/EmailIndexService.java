package dev.aparikh.emailtriage.indexing;

import dev.aparikh.emailtriage.model.Attachment;
import dev.aparikh.emailtriage.model.AttachmentsJson;
import dev.aparikh.emailtriage.model.EmailDocument;
import dev.aparikh.emailtriage.search.EmailNotFoundException;
import dev.aparikh.emailtriage.search.EmailStoreException;
import org.apache.solr.client.solrj.SolrClient;
import org.apache.solr.client.solrj.SolrServerException;
import org.apache.solr.common.SolrException;
import org.apache.solr.common.SolrInputDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Write side of the Solr-backed email store: ingestion and single-document partial updates.
 */
@Service
public class EmailIndexService {

    private static final Logger log = LoggerFactory.getLogger(EmailIndexService.class);

    // Solr optimistic concurrency: a positive _version_ means "only if the document exists"
    private static final String FIELD_VERSION = "_version_";
    private static final int VERSION_CONFLICT = 409;

    private final SolrClient solr;

    public EmailIndexService(SolrClient solr) {
        this.solr = solr;
    }

    public void index(EmailDocument email) {
        indexAll(Collections.singletonList(email));
    }

    public void indexAll(List<EmailDocument> emails) {
        if (emails == null || emails.isEmpty()) return;
        try {
            List<SolrInputDocument> docs = emails.stream()
                    .map(EmailIndexService::toSolrDoc)
                    .toList();
            solr.add(docs);
            solr.commit();
            log.debug("Indexed {} emails", docs.size());
        } catch (SolrServerException | IOException | SolrException e) {
            throw new EmailStoreException("Failed to index emails", e);
        }
    }

    /**
     * Applies an atomic update to one existing email and commits it.
     *
     * @throws EmailNotFoundException if no email has this id
     * @throws IllegalArgumentException if the update carries no fields
     */
    public void update(String id, EmailUpdate update) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must be provided");
        }
        if (update == null || update.isEmpty()) {
            throw new IllegalArgumentException("update must change at least one field");
        }
        SolrInputDocument doc = new SolrInputDocument();
        doc.addField(EmailDocument.FIELD_ID, id);
        doc.addField(FIELD_VERSION, 1L);
        for (Map.Entry<String, Object> field : update.fieldValues().entrySet()) {
            doc.addField(field.getKey(), Collections.singletonMap("set", field.getValue()));
        }
        try {
            solr.add(doc);
            solr.commit();
            log.debug("Updated email {} fields {}", id, update.fieldValues().keySet());
        } catch (SolrException e) {
            if (e.code() == VERSION_CONFLICT) {
                throw new EmailNotFoundException(id);
            }
            throw new EmailStoreException("Failed to update email " + id, e);
        } catch (SolrServerException | IOException e) {
            throw new EmailStoreException("Failed to update email " + id, e);
        }
    }

    static SolrInputDocument toSolrDoc(EmailDocument e) {
        SolrInputDocument d = new SolrInputDocument();
        d.addField(EmailDocument.FIELD_ID, e.id());
        if (e.threadId() != null) d.addField(EmailDocument.FIELD_THREAD_ID, e.threadId());
        if (e.from() != null) d.addField(EmailDocument.FIELD_FROM, lower(e.from()));
        if (e.fromName() != null) d.addField(EmailDocument.FIELD_FROM_NAME, e.fromName());
        addAll(d, EmailDocument.FIELD_TO, e.to());
        addAll(d, EmailDocument.FIELD_CC, e.cc());
        addAll(d, EmailDocument.FIELD_BCC, e.bcc());
        if (e.subject() != null) d.addField(EmailDocument.FIELD_SUBJECT, e.subject());
        if (e.body() != null) d.addField(EmailDocument.FIELD_BODY, e.body());
        if (e.bodyHtml() != null) d.addField(EmailDocument.FIELD_BODY_HTML, e.bodyHtml());
        if (e.snippet() != null) d.addField(EmailDocument.FIELD_SNIPPET, e.snippet());
        if (e.sentAt() != null) d.addField(EmailDocument.FIELD_SENT_AT, java.util.Date.from(e.sentAt()));
        e.labels().stream()
                .filter(label -> label != null && !label.isBlank())
                .map(label -> label.trim().toUpperCase(Locale.ROOT))
                .distinct()
                .sorted()
                .forEach(label -> d.addField(EmailDocument.FIELD_LABELS, label));
        d.addField(EmailDocument.FIELD_IS_READ, e.read());
        d.addField(EmailDocument.FIELD_IS_STARRED, e.starred());
        d.addField(EmailDocument.FIELD_IS_IMPORTANT, e.important());
        d.addField(EmailDocument.FIELD_HAS_ATTACHMENTS, e.hasAttachments());
        d.addField(EmailDocument.FIELD_ATTACHMENT_COUNT, e.attachments().size());
        if (e.hasAttachments()) {
            d.addField(EmailDocument.FIELD_ATTACHMENTS_JSON, AttachmentsJson.write(e.attachments()));
            for (Attachment attachment : e.attachments()) {
                if (attachment.filename() != null) d.addField(EmailDocument.FIELD_ATTACHMENT_FILENAME, attachment.filename());
                if (attachment.hasParsedContent()) d.addField(EmailDocument.FIELD_ATTACHMENT_CONTENT, attachment.parsedContent());
            }
        }
        if (e.category() != null) d.addField(EmailDocument.FIELD_CATEGORY, e.category());
        if (e.priority() != null) d.addField(EmailDocument.FIELD_PRIORITY, e.priority());
        return d;
    }

    private static void addAll(SolrInputDocument d, String field, Collection<String> values) {
        if (values == null) return;
        for (String v : values) {
            if (v != null && !v.isBlank()) d.addField(field, lower(v));
        }
    }

    private static String lower(String s) {
        return s == null ? null : s.toLowerCase(Locale.ROOT);
    }
}
