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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EmailIndexServiceTest {

    @Mock
    private SolrClient solrClient;

    private EmailIndexService indexService;

    @BeforeEach
    void setUp() {
        indexService = new EmailIndexService(solrClient);
    }

    @Test
    void indexSingleEmailAddsAndCommits() throws Exception {
        EmailDocument email = createTestEmail();

        indexService.index(email);

        ArgumentCaptor<List<SolrInputDocument>> captor = ArgumentCaptor.forClass(List.class);
        verify(solrClient).add(captor.capture());
        verify(solrClient).commit();

        List<SolrInputDocument> docs = captor.getValue();
        assertThat(docs).hasSize(1);
        SolrInputDocument doc = docs.get(0);
        assertThat(doc.getFieldValue("id")).isEqualTo("test-id");
        assertThat(doc.getFieldValue("thread_id")).isEqualTo("thread-1");
        assertThat(doc.getFieldValue("subject")).isEqualTo("Test Subject");
        assertThat(doc.getFieldValue("sent_at")).isEqualTo(Date.from(email.sentAt()));
        assertThat(doc.getFieldValue("is_read")).isEqualTo(false);
        assertThat(doc.getFieldValue("is_starred")).isEqualTo(true);
        assertThat(doc.getFieldValue("has_attachments")).isEqualTo(false);
        assertThat(doc.getFieldValue("attachment_count")).isEqualTo(0);
    }

    @Test
    void indexAllWithNullListDoesNothing() throws Exception {
        indexService.indexAll(null);

        verify(solrClient, never()).add(anyList());
        verify(solrClient, never()).commit();
    }

    @Test
    void indexAllWithEmptyListDoesNothing() throws Exception {
        indexService.indexAll(List.of());

        verify(solrClient, never()).add(anyList());
        verify(solrClient, never()).commit();
    }

    @Test
    void indexAllWithMultipleEmailsProcessesAll() throws Exception {
        EmailDocument email1 = createTestEmail().toBuilder().id("1").build();
        EmailDocument email2 = createTestEmail().toBuilder().id("2").build();

        indexService.indexAll(List.of(email1, email2));

        ArgumentCaptor<List<SolrInputDocument>> captor = ArgumentCaptor.forClass(List.class);
        verify(solrClient).add(captor.capture());
        verify(solrClient).commit();
        assertThat(captor.getValue()).hasSize(2);
    }

    @Test
    void indexNormalizesAddressesAndLabels() throws Exception {
        EmailDocument email = createTestEmail().toBuilder()
                .from("FROM@TEST.COM")
                .to(List.of("TO@TEST.COM", "", "  "))
                .cc(List.of("CC@TEST.COM"))
                .bcc(List.of("BCC@TEST.COM"))
                .labels(Set.of("starred", " Important ", ""))
                .build();

        indexService.index(email);

        SolrInputDocument doc = capturedSingleDoc();
        assertThat(doc.getFieldValue("from_addr")).isEqualTo("from@test.com");
        assertThat(doc.getFieldValues("to_addr")).containsExactly("to@test.com");
        assertThat(doc.getFieldValues("cc_addr")).containsExactly("cc@test.com");
        assertThat(doc.getFieldValues("bcc_addr")).containsExactly("bcc@test.com");
        assertThat(doc.getFieldValues("labels")).containsExactly("IMPORTANT", "STARRED");
    }

    @Test
    void indexHandlesNullFields() throws Exception {
        EmailDocument email = EmailDocument.builder().id("1").build();

        indexService.index(email);

        SolrInputDocument doc = capturedSingleDoc();
        assertThat(doc.getFieldValue("id")).isEqualTo("1");
        assertThat(doc.getFieldValue("subject")).isNull();
        assertThat(doc.getFieldValue("from_addr")).isNull();
        assertThat(doc.getFieldValues("to_addr")).isNull();
        assertThat(doc.getFieldValue("sent_at")).isNull();
        assertThat(doc.getFieldValue("attachments_json")).isNull();
        assertThat(doc.getFieldValue("category")).isNull();
    }

    @Test
    void indexStoresAttachmentsAsJsonAndIndexesTheirText() throws Exception {
        List<Attachment> attachments = List.of(
                new Attachment("contract.pdf", "application/pdf", 1024, "Payment terms: net 30"),
                new Attachment("image001.png", "image/png", 200, null));
        EmailDocument email = createTestEmail().toBuilder().attachments(attachments).build();

        indexService.index(email);

        SolrInputDocument doc = capturedSingleDoc();
        assertThat(doc.getFieldValue("has_attachments")).isEqualTo(true);
        assertThat(doc.getFieldValue("attachment_count")).isEqualTo(2);
        assertThat(doc.getFieldValues("att_filename")).containsExactly("contract.pdf", "image001.png");
        assertThat(doc.getFieldValues("att_content")).containsExactly("Payment terms: net 30");
        assertThat(AttachmentsJson.read((String) doc.getFieldValue("attachments_json"))).isEqualTo(attachments);
    }

    @Test
    void indexWrapsExceptionFromSolr() throws Exception {
        when(solrClient.add(anyList())).thenThrow(new SolrServerException("Solr error"));

        assertThatThrownBy(() -> indexService.index(createTestEmail()))
                .isInstanceOf(EmailStoreException.class)
                .hasMessage("Failed to index emails")
                .hasCauseInstanceOf(SolrServerException.class);
    }

    @Test
    void indexWrapsExceptionFromCommit() throws Exception {
        doThrow(new IOException("Commit error")).when(solrClient).commit();

        assertThatThrownBy(() -> indexService.index(createTestEmail()))
                .isInstanceOf(EmailStoreException.class)
                .hasMessage("Failed to index emails")
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void updateSendsAtomicSetGuardedByExistence() throws Exception {
        indexService.update("42", new EmailUpdate(true, null, null, Set.of("follow_up"), null, null));

        ArgumentCaptor<SolrInputDocument> captor = ArgumentCaptor.forClass(SolrInputDocument.class);
        verify(solrClient).add(captor.capture());
        verify(solrClient).commit();

        SolrInputDocument doc = captor.getValue();
        assertThat(doc.getFieldValue("id")).isEqualTo("42");
        assertThat(doc.getFieldValue("_version_")).isEqualTo(1L);
        assertThat(doc.getFieldValue("is_read")).isEqualTo(Map.of("set", true));
        assertThat(doc.getFieldValue("labels")).isEqualTo(Map.of("set", List.of("FOLLOW_UP")));
        assertThat(doc.getFieldNames()).containsExactlyInAnyOrder("id", "_version_", "is_read", "labels");
    }

    @Test
    void triageUpdateWritesCategoryAndPriority() throws Exception {
        indexService.update("42", EmailUpdate.triage("service_request", "high"));

        ArgumentCaptor<SolrInputDocument> captor = ArgumentCaptor.forClass(SolrInputDocument.class);
        verify(solrClient).add(captor.capture());
        assertThat(captor.getValue().getFieldValue("category")).isEqualTo(Map.of("set", "service_request"));
        assertThat(captor.getValue().getFieldValue("priority")).isEqualTo(Map.of("set", "high"));
    }

    @Test
    void updateOfMissingEmailIsNotFound() throws Exception {
        when(solrClient.add(any(SolrInputDocument.class)))
                .thenThrow(new SolrException(SolrException.ErrorCode.CONFLICT, "Document not found for update"));

        assertThatThrownBy(() -> indexService.update("nope", EmailUpdate.triage("spam", null)))
                .isInstanceOf(EmailNotFoundException.class)
                .hasMessage("Email not found: nope");
        verify(solrClient, never()).commit();
    }

    @Test
    void updateStoreFailureIsStoreException() throws Exception {
        when(solrClient.add(any(SolrInputDocument.class))).thenThrow(new IOException("refused"));

        assertThatThrownBy(() -> indexService.update("42", EmailUpdate.triage("spam", null)))
                .isInstanceOf(EmailStoreException.class)
                .hasMessage("Failed to update email 42");
    }

    @Test
    void updateRejectsEmptyUpdateAndBlankId() {
        assertThatThrownBy(() -> indexService.update("42", new EmailUpdate(null, null, null, null, null, null)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> indexService.update(" ", EmailUpdate.triage("spam", null)))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(solrClient);
    }

    private SolrInputDocument capturedSingleDoc() throws Exception {
        ArgumentCaptor<List<SolrInputDocument>> captor = ArgumentCaptor.forClass(List.class);
        verify(solrClient).add(captor.capture());
        return captor.getValue().get(0);
    }

    private EmailDocument createTestEmail() {
        return EmailDocument.builder()
                .id("test-id")
                .threadId("thread-1")
                .subject("Test Subject")
                .body("Test Body")
                .from("from@test.com")
                .to(List.of("to@test.com"))
                .sentAt(Instant.parse("2025-01-01T10:00:00Z"))
                .starred(true)
                .build();
    }
}
