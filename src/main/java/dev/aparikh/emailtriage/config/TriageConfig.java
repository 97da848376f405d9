package dev.aparikh.emailtriage.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.aparikh.emailtriage.triage.EmailClassifier;
import dev.aparikh.emailtriage.triage.KeywordEmailClassifier;
import dev.aparikh.emailtriage.triage.LlmEmailClassifier;
import dev.langchain4j.model.chat.Capability;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(TriageProperties.class)
class TriageConfig {

    private static final Logger log = LoggerFactory.getLogger(TriageConfig.class);

    private final TriageProperties properties;

    TriageConfig(TriageProperties properties) {
        this.properties = properties;
    }

    @Bean
    @ConditionalOnMissingBean
    Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    @ConditionalOnProperty(prefix = "triage.classification.openai", name = "api-key")
    ChatModel classificationChatModel() {
        TriageProperties.OpenAi openai = properties.getClassification().getOpenai();
        OpenAiChatModel.OpenAiChatModelBuilder builder = OpenAiChatModel.builder()
                .apiKey(openai.getApiKey())
                .modelName(openai.getModelName())
                .temperature(openai.getTemperature())
                .supportedCapabilities(Capability.RESPONSE_FORMAT_JSON_SCHEMA)
                .strictJsonSchema(true)
                .timeout(properties.getClassification().getTimeout());
        if (openai.getBaseUrl() != null && !openai.getBaseUrl().isBlank()) {
            builder.baseUrl(openai.getBaseUrl());
        }
        return builder.build();
    }

    @Bean
    @ConditionalOnMissingBean(EmailClassifier.class)
    EmailClassifier emailClassifier(ObjectProvider<ChatModel> chatModel, ObjectMapper objectMapper) {
        ChatModel model = chatModel.getIfAvailable();
        if (model == null) {
            log.warn("No chat model configured; categorizing with payment keywords only");
            return new KeywordEmailClassifier(properties.getOwnOrganization());
        }
        return new LlmEmailClassifier(model, objectMapper, properties.getOwnOrganization());
    }
}
