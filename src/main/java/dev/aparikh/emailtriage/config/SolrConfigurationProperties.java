package dev.aparikh.emailtriage.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * Typed configuration properties for the Solr core holding the email corpus.
 */
@Validated
@ConfigurationProperties(prefix = "solr")
class SolrConfigurationProperties {

    @NotBlank
    private String baseUrl;

    @NotBlank
    private String core;

    @Positive
    private int connectTimeoutMs = 5_000;

    @Positive
    private int socketTimeoutMs = 30_000;

    String getBaseUrl() {
        return baseUrl;
    }

    void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    String getCore() {
        return core;
    }

    void setCore(String core) {
        this.core = core;
    }

    int getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    void setConnectTimeoutMs(int connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    int getSocketTimeoutMs() {
        return socketTimeoutMs;
    }

    void setSocketTimeoutMs(int socketTimeoutMs) {
        this.socketTimeoutMs = socketTimeoutMs;
    }
}
