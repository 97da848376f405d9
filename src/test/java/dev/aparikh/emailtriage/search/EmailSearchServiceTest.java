package dev.aparikh.emailtriage.search;

import dev.aparikh.emailtriage.model.Attachment;
import dev.aparikh.emailtriage.model.AttachmentsJson;
import dev.aparikh.emailtriage.model.EmailDocument;
import org.apache.solr.client.solrj.SolrClient;
import org.apache.solr.client.solrj.SolrQuery;
import org.apache.solr.client.solrj.SolrServerException;
import org.apache.solr.client.solrj.response.QueryResponse;
import org.apache.solr.common.SolrDocument;
import org.apache.solr.common.SolrDocumentList;
import org.apache.solr.common.SolrException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EmailSearchServiceTest {

    @Mock
    private SolrClient solrClient;

    @Mock
    private QueryResponse queryResponse;

    private EmailSearchService searchService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-03-12T12:00:00Z"), ZoneOffset.UTC);
        searchService = new EmailSearchService(solrClient, new EmailQueryBuilder(new RelativeDateNormalizer(clock), clock));
    }

    @Test
    void searchMapsSolrDocumentsInReturnedOrder() throws Exception {
        setupMockResponse(solrDoc("2", "Newer"), solrDoc("1", "Older"));

        List<EmailDocument> emails = searchService.search(SearchQuery.builder().text("invoice").build());

        assertThat(emails).extracting(EmailDocument::id).containsExactly("2", "1");
        assertThat(emails.get(0).subject()).isEqualTo("Newer");
    }

    @Test
    void searchSendsBuiltQuery() throws Exception {
        setupMockResponse();

        searchService.search(SearchQuery.builder().sender("acme.com").maxResults(5).build());

        ArgumentCaptor<SolrQuery> captor = ArgumentCaptor.forClass(SolrQuery.class);
        verify(solrClient).query(captor.capture());
        assertThat(captor.getValue().getFilterQueries())
                .containsExactly("(from_addr:*acme.com* OR from_name:\"acme.com\")");
        assertThat(captor.getValue().getRows()).isEqualTo(5);
    }

    @Test
    void countRequestsNoRowsAndReturnsNumFound() throws Exception {
        SolrDocumentList results = new SolrDocumentList();
        results.setNumFound(42);
        when(queryResponse.getResults()).thenReturn(results);
        when(solrClient.query(any(SolrQuery.class))).thenReturn(queryResponse);

        long count = searchService.count(SearchQuery.builder().build());

        ArgumentCaptor<SolrQuery> captor = ArgumentCaptor.forClass(SolrQuery.class);
        verify(solrClient).query(captor.capture());
        assertThat(captor.getValue().getRows()).isZero();
        assertThat(count).isEqualTo(42);
    }

    @Test
    void emptyResultIsEmptyList() throws Exception {
        setupMockResponse();

        assertThat(searchService.search(SearchQuery.builder().build())).isEmpty();
    }

    @Test
    void serverErrorBecomesStoreException() throws Exception {
        when(solrClient.query(any(SolrQuery.class))).thenThrow(new SolrServerException("down"));

        assertThatThrownBy(() -> searchService.search(SearchQuery.builder().build()))
                .isInstanceOf(EmailStoreException.class)
                .hasMessage("Search failed")
                .hasCauseInstanceOf(SolrServerException.class);
    }

    @Test
    void rejectedQueryBecomesStoreException() throws Exception {
        when(solrClient.query(any(SolrQuery.class)))
                .thenThrow(new SolrException(SolrException.ErrorCode.BAD_REQUEST, "Invalid Date String"));

        assertThatThrownBy(() -> searchService.count(SearchQuery.builder().dateFrom("next tuesday").build()))
                .isInstanceOf(EmailStoreException.class)
                .hasCauseInstanceOf(SolrException.class);
    }

    @Test
    void findByIdReturnsEmptyWhenMissing() throws Exception {
        when(solrClient.getById("missing")).thenReturn(null);

        assertThat(searchService.findById("missing")).isEmpty();
        assertThatThrownBy(() -> searchService.getById("missing"))
                .isInstanceOf(EmailNotFoundException.class)
                .hasMessage("Email not found: missing");
    }

    @Test
    void findByIdWrapsIoFailure() throws Exception {
        when(solrClient.getById("1")).thenThrow(new IOException("connection reset"));

        assertThatThrownBy(() -> searchService.findById("1"))
                .isInstanceOf(EmailStoreException.class);
    }

    @Test
    void fromSolrDocMapsEveryField() {
        SolrDocument doc = solrDoc("1", "Invoice 42");
        doc.setField(EmailDocument.FIELD_THREAD_ID, "t-1");
        doc.setField(EmailDocument.FIELD_FROM_NAME, "Acme Billing");
        doc.setField(EmailDocument.FIELD_CC, List.of("cc@acme.com"));
        doc.setField(EmailDocument.FIELD_SNIPPET, "Please find attached");
        doc.setField(EmailDocument.FIELD_LABELS, List.of("IMPORTANT", "UNREAD"));
        doc.setField(EmailDocument.FIELD_IS_READ, false);
        doc.setField(EmailDocument.FIELD_IS_STARRED, true);
        doc.setField(EmailDocument.FIELD_IS_IMPORTANT, "true");
        doc.setField(EmailDocument.FIELD_ATTACHMENTS_JSON, AttachmentsJson.write(List.of(
                new Attachment("invoice.pdf", "application/pdf", 2048, "Total due: 100 EUR"))));
        doc.setField(EmailDocument.FIELD_CATEGORY, "payment_request_external");
        doc.setField(EmailDocument.FIELD_PRIORITY, "high");

        EmailDocument email = EmailSearchService.fromSolrDoc(doc);

        assertThat(email.threadId()).isEqualTo("t-1");
        assertThat(email.from()).isEqualTo("billing@acme.com");
        assertThat(email.fromName()).isEqualTo("Acme Billing");
        assertThat(email.to()).containsExactly("me@example.com");
        assertThat(email.cc()).containsExactly("cc@acme.com");
        assertThat(email.sentAt()).isEqualTo(Instant.parse("2025-03-10T09:00:00Z"));
        assertThat(email.labels()).containsExactlyInAnyOrder("IMPORTANT", "UNREAD");
        assertThat(email.read()).isFalse();
        assertThat(email.starred()).isTrue();
        assertThat(email.important()).isTrue();
        assertThat(email.attachments()).containsExactly(
                new Attachment("invoice.pdf", "application/pdf", 2048, "Total due: 100 EUR"));
        assertThat(email.category()).isEqualTo("payment_request_external");
        assertThat(email.priority()).isEqualTo("high");
    }

    @Test
    void corruptStoredAttachmentsAreAStoreFailure() throws Exception {
        SolrDocument corrupt = solrDoc("7", "Broken");
        corrupt.setField(EmailDocument.FIELD_ATTACHMENTS_JSON, "[{\"filename\": ");
        setupMockResponse(solrDoc("1", "Fine"), corrupt);

        assertThatThrownBy(() -> searchService.search(SearchQuery.builder().build()))
                .isInstanceOf(EmailStoreException.class)
                .hasMessage("Stored email 7 is unreadable");
    }

    @Test
    void unparseableStoredDateIsAStoreFailure() {
        SolrDocument doc = solrDoc("8", "Bad date");
        doc.setField(EmailDocument.FIELD_SENT_AT, "yesterday-ish");

        assertThatThrownBy(() -> EmailSearchService.fromSolrDoc(doc))
                .isInstanceOf(EmailStoreException.class)
                .hasMessage("Stored email 8 is unreadable");
    }

    @Test
    void fromSolrDocToleratesMissingOptionalFields() {
        SolrDocument doc = new SolrDocument();
        doc.setField(EmailDocument.FIELD_ID, "bare");

        EmailDocument email = EmailSearchService.fromSolrDoc(doc);

        assertThat(email.id()).isEqualTo("bare");
        assertThat(email.sentAt()).isNull();
        assertThat(email.to()).isEmpty();
        assertThat(email.labels()).isEmpty();
        assertThat(email.attachments()).isEmpty();
        assertThat(email.read()).isFalse();
    }

    private void setupMockResponse(SolrDocument... docs) throws Exception {
        SolrDocumentList results = new SolrDocumentList();
        results.addAll(List.of(docs));
        results.setNumFound(docs.length);
        when(queryResponse.getResults()).thenReturn(results);
        when(solrClient.query(any(SolrQuery.class))).thenReturn(queryResponse);
    }

    private static SolrDocument solrDoc(String id, String subject) {
        SolrDocument doc = new SolrDocument();
        doc.setField(EmailDocument.FIELD_ID, id);
        doc.setField(EmailDocument.FIELD_SUBJECT, subject);
        doc.setField(EmailDocument.FIELD_BODY, "Body of " + id);
        doc.setField(EmailDocument.FIELD_FROM, "billing@acme.com");
        doc.setField(EmailDocument.FIELD_TO, List.of("me@example.com"));
        doc.setField(EmailDocument.FIELD_SENT_AT, Date.from(Instant.parse("2025-03-10T09:00:00Z")));
        return doc;
    }
}
