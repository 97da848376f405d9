package dev.aparikh.emailtriage.triage;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.aparikh.emailtriage.config.TriageProperties;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ResponseFormatType;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LlmEmailClassifierTest {

    private static final ClassificationRequest REQUEST = new ClassificationRequest(
            "Acme Billing <billing@acme.com>", "billing@acme.com", "Invoice #42", "Your invoice is ready",
            "Please pay 1,200 EUR by March 31.");

    @Mock
    private ChatModel chatModel;

    private LlmEmailClassifier classifier;

    @BeforeEach
    void setUp() {
        TriageProperties.OwnOrganization org = new TriageProperties.OwnOrganization();
        org.setName("Example Corp");
        org.setDomains(List.of("example.com"));
        classifier = new LlmEmailClassifier(chatModel, new ObjectMapper(), org);
    }

    @Test
    void parsesValidAnswer() {
        answer("""
                {"category": "payment_request_external", "is_payment_request": true, "is_from_own_org": false,
                 "urgency": "high", "needs_response": true, "summary": "Vendor invoice due end of month."}
                """);

        CategoryResult result = classifier.classify(REQUEST);

        assertThat(result.category()).isEqualTo(Category.PAYMENT_REQUEST_EXTERNAL);
        assertThat(result.paymentRequest()).isTrue();
        assertThat(result.fromOwnOrganization()).isFalse();
        assertThat(result.urgency()).isEqualTo(Urgency.HIGH);
        assertThat(result.needsResponse()).isTrue();
        assertThat(result.rationale()).isEqualTo("Vendor invoice due end of month.");
        assertThat(result.isFallback()).isFalse();
    }

    @Test
    void sendsSystemAndUserMessagesWithJsonSchema() {
        answer("""
                {"category": "general_correspondence", "is_payment_request": false, "is_from_own_org": false,
                 "urgency": "low", "needs_response": false, "summary": "FYI"}
                """);

        classifier.classify(REQUEST);

        ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
        verify(chatModel).chat(captor.capture());
        ChatRequest request = captor.getValue();
        assertThat(request.messages()).hasSize(2);
        assertThat(request.messages().get(0)).isInstanceOf(SystemMessage.class);
        assertThat(((SystemMessage) request.messages().get(0)).text())
                .contains("Example Corp")
                .contains("example.com")
                .contains("payment_request_external");
        assertThat(((UserMessage) request.messages().get(1)).singleText())
                .contains("From: Acme Billing <billing@acme.com>")
                .contains("Subject: Invoice #42");
        assertThat(request.parameters().responseFormat().type()).isEqualTo(ResponseFormatType.JSON);
        assertThat(request.parameters().responseFormat().jsonSchema().name()).isEqualTo("email_classification");
    }

    @Test
    void paymentCategoryFollowsOwnOrganizationFlag() {
        answer("""
                {"category": "payment_request_external", "is_payment_request": true, "is_from_own_org": true,
                 "urgency": "medium", "needs_response": false, "summary": "Our own invoice."}
                """);

        assertThat(classifier.classify(REQUEST).category()).isEqualTo(Category.PAYMENT_REQUEST_INTERNAL);
    }

    @Test
    void acceptsAnswerWrappedInCodeFence() {
        answer("""
                ```json
                {"category": "spam", "is_payment_request": false, "is_from_own_org": false,
                 "urgency": "low", "needs_response": false, "summary": "Junk."}
                ```
                """);

        assertThat(classifier.classify(REQUEST).category()).isEqualTo(Category.SPAM);
    }

    @Test
    void unknownCategoryIsRejected() {
        answer("""
                {"category": "urgent_stuff", "is_payment_request": false, "is_from_own_org": false,
                 "urgency": "low", "needs_response": false, "summary": ""}
                """);

        assertThatThrownBy(() -> classifier.classify(REQUEST))
                .isInstanceOf(ClassificationException.class)
                .hasMessageContaining("Unknown category");
    }

    @Test
    void unknownUrgencyIsRejected() {
        answer("""
                {"category": "spam", "is_payment_request": false, "is_from_own_org": false,
                 "urgency": "asap", "needs_response": false, "summary": ""}
                """);

        assertThatThrownBy(() -> classifier.classify(REQUEST))
                .isInstanceOf(ClassificationException.class)
                .hasMessageContaining("Unknown urgency");
    }

    @Test
    void nonBooleanFlagIsRejected() {
        answer("""
                {"category": "spam", "is_payment_request": "no", "is_from_own_org": false,
                 "urgency": "low", "needs_response": false, "summary": ""}
                """);

        assertThatThrownBy(() -> classifier.classify(REQUEST))
                .isInstanceOf(ClassificationException.class)
                .hasMessageContaining("is_payment_request");
    }

    @Test
    void nonJsonAndEmptyAnswersAreRejected() {
        answer("I think this is an invoice.");
        assertThatThrownBy(() -> classifier.classify(REQUEST)).isInstanceOf(ClassificationException.class);

        answer("   ");
        assertThatThrownBy(() -> classifier.classify(REQUEST)).isInstanceOf(ClassificationException.class);

        answer("[1, 2, 3]");
        assertThatThrownBy(() -> classifier.classify(REQUEST)).isInstanceOf(ClassificationException.class);
    }

    @Test
    void modelFailureBecomesClassificationException() {
        when(chatModel.chat(any(ChatRequest.class))).thenThrow(new RuntimeException("rate limited"));

        assertThatThrownBy(() -> classifier.classify(REQUEST))
                .isInstanceOf(ClassificationException.class)
                .hasMessageContaining("rate limited");
    }

    @Test
    void stripCodeFenceLeavesPlainJsonAlone() {
        assertThat(LlmEmailClassifier.stripCodeFence(" {\"a\":1} ")).isEqualTo("{\"a\":1}");
        assertThat(LlmEmailClassifier.stripCodeFence("```\n{\"a\":1}\n```")).isEqualTo("{\"a\":1}");
    }

    private void answer(String text) {
        when(chatModel.chat(any(ChatRequest.class)))
                .thenReturn(ChatResponse.builder().aiMessage(AiMessage.from(text)).build());
    }
}
