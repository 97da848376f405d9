package dev.aparikh.emailtriage.triage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.aparikh.emailtriage.config.TriageProperties;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ChatRequestParameters;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.request.ResponseFormatType;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Classifies emails with a chat model constrained to a JSON schema, and validates the answer
 * before trusting it.
 */
public class LlmEmailClassifier implements EmailClassifier {

    private static final Logger log = LoggerFactory.getLogger(LlmEmailClassifier.class);

    static final String FIELD_CATEGORY = "category";
    static final String FIELD_PAYMENT_REQUEST = "is_payment_request";
    static final String FIELD_OWN_ORGANIZATION = "is_from_own_org";
    static final String FIELD_URGENCY = "urgency";
    static final String FIELD_NEEDS_RESPONSE = "needs_response";
    static final String FIELD_SUMMARY = "summary";

    static final ResponseFormat RESPONSE_FORMAT = ResponseFormat.builder()
            .type(ResponseFormatType.JSON)
            .jsonSchema(JsonSchema.builder()
                    .name("email_classification")
                    .rootElement(JsonObjectSchema.builder()
                            .addEnumProperty(FIELD_CATEGORY, Category.tags())
                            .addBooleanProperty(FIELD_PAYMENT_REQUEST)
                            .addBooleanProperty(FIELD_OWN_ORGANIZATION)
                            .addEnumProperty(FIELD_URGENCY, List.of("high", "medium", "low"))
                            .addBooleanProperty(FIELD_NEEDS_RESPONSE)
                            .addStringProperty(FIELD_SUMMARY)
                            .required(FIELD_CATEGORY, FIELD_PAYMENT_REQUEST, FIELD_OWN_ORGANIZATION,
                                    FIELD_URGENCY, FIELD_NEEDS_RESPONSE, FIELD_SUMMARY)
                            .additionalProperties(false)
                            .build())
                    .build())
            .build();

    private final ChatModel chatModel;
    private final ObjectMapper objectMapper;
    private final String systemPrompt;

    public LlmEmailClassifier(ChatModel chatModel, ObjectMapper objectMapper,
                              TriageProperties.OwnOrganization ownOrganization) {
        this.chatModel = chatModel;
        this.objectMapper = objectMapper;
        this.systemPrompt = systemPrompt(ownOrganization);
    }

    static String systemPrompt(TriageProperties.OwnOrganization ownOrganization) {
        String name = ownOrganization.getName() == null || ownOrganization.getName().isBlank()
                ? "the user's company" : ownOrganization.getName();
        String domains = ownOrganization.getDomains().isEmpty()
                ? "(no domains configured)" : String.join(", ", ownOrganization.getDomains());
        return """
                You categorize emails for a user who works at %s (email domains: %s).
                Answer with JSON only, using exactly these fields:
                - category: one of %s
                  payment_request_external: an invoice, bill or payment demand sent BY an outside party (vendor, supplier, client) that the user may have to pay
                  payment_request_internal: an invoice or payment notice issued by %s itself, usually outgoing
                  service_request: someone asks the user to do work, fix something or deliver a service
                  general_correspondence: ordinary conversation that fits no other category
                  promotional: marketing, newsletters, offers
                  spam: unsolicited junk or phishing
                  automated_notification: machine-generated notices, receipts, alerts
                - is_payment_request: true if the email asks for or announces a payment
                - is_from_own_org: true if the sender belongs to %s
                - urgency: high, medium or low
                - needs_response: true if the user is expected to reply or act
                - summary: one sentence explaining the decision
                """.formatted(name, domains, String.join(", ", Category.tags()), name, name);
    }

    static String userPrompt(ClassificationRequest request) {
        return """
                From: %s
                Subject: %s
                Snippet: %s
                Body:
                %s
                """.formatted(request.sender(), request.subject(), request.snippet(), request.bodyExcerpt());
    }

    @Override
    public CategoryResult classify(ClassificationRequest request) {
        ChatRequest chatRequest = ChatRequest.builder()
                .messages(SystemMessage.from(systemPrompt), UserMessage.from(userPrompt(request)))
                .parameters(ChatRequestParameters.builder()
                        .responseFormat(RESPONSE_FORMAT)
                        .build())
                .build();

        ChatResponse response;
        try {
            response = chatModel.chat(chatRequest);
        } catch (RuntimeException e) {
            throw new ClassificationException("Classification call failed: " + e.getMessage(), e);
        }
        String text = response == null || response.aiMessage() == null ? null : response.aiMessage().text();
        log.debug("Classifier answered {} chars for '{}'", text == null ? 0 : text.length(), request.subject());
        return parse(text);
    }

    CategoryResult parse(String text) {
        if (text == null || text.isBlank()) {
            throw new ClassificationException("Classifier returned an empty answer");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(stripCodeFence(text));
        } catch (JsonProcessingException e) {
            throw new ClassificationException("Classifier answer is not JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new ClassificationException("Classifier answer is not a JSON object");
        }

        Category category = Category.fromTag(requiredText(root, FIELD_CATEGORY))
                .orElseThrow(() -> new ClassificationException("Unknown category: " + root.get(FIELD_CATEGORY)));
        Urgency urgency = Urgency.fromTag(requiredText(root, FIELD_URGENCY))
                .orElseThrow(() -> new ClassificationException("Unknown urgency: " + root.get(FIELD_URGENCY)));
        boolean payment = requiredBoolean(root, FIELD_PAYMENT_REQUEST);
        boolean ownOrganization = requiredBoolean(root, FIELD_OWN_ORGANIZATION);
        boolean needsResponse = requiredBoolean(root, FIELD_NEEDS_RESPONSE);
        JsonNode summary = root.get(FIELD_SUMMARY);

        // payment categories follow the sender flag so the two never contradict each other
        if (category.isPaymentRequest()) {
            category = ownOrganization ? Category.PAYMENT_REQUEST_INTERNAL : Category.PAYMENT_REQUEST_EXTERNAL;
        }
        return CategoryResult.of(category, payment, ownOrganization, urgency, needsResponse,
                summary != null && summary.isTextual() ? summary.asText().trim() : "");
    }

    private static String requiredText(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || !node.isTextual()) {
            throw new ClassificationException("Missing or non-text field: " + field);
        }
        return node.asText();
    }

    private static boolean requiredBoolean(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || !node.isBoolean()) {
            throw new ClassificationException("Missing or non-boolean field: " + field);
        }
        return node.booleanValue();
    }

    // Some models wrap JSON in a markdown fence even in JSON mode.
    static String stripCodeFence(String text) {
        String trimmed = text.trim();
        if (!trimmed.startsWith("```")) return trimmed;
        int firstNewline = trimmed.indexOf('\n');
        int closing = trimmed.lastIndexOf("```");
        if (firstNewline < 0 || closing <= firstNewline) return trimmed;
        return trimmed.substring(firstNewline + 1, closing).trim();
    }
}
