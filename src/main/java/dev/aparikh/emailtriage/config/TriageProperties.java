package dev.aparikh.emailtriage.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Typed configuration for categorization, scoring and attachment search.
 * <p>
 * Defaults reproduce the weights the scorer was calibrated with; override them under
 * {@code triage.scoring.*} when recalibrating.
 */
@Validated
@ConfigurationProperties(prefix = "triage")
public class TriageProperties {

    @Valid
    private OwnOrganization ownOrganization = new OwnOrganization();

    @Valid
    private Classification classification = new Classification();

    @Valid
    private Scoring scoring = new Scoring();

    @Valid
    private AttachmentSearch attachmentSearch = new AttachmentSearch();

    @Valid
    private PriorityInbox priorityInbox = new PriorityInbox();

    public OwnOrganization getOwnOrganization() {
        return ownOrganization;
    }

    public void setOwnOrganization(OwnOrganization ownOrganization) {
        this.ownOrganization = ownOrganization;
    }

    public Classification getClassification() {
        return classification;
    }

    public void setClassification(Classification classification) {
        this.classification = classification;
    }

    public Scoring getScoring() {
        return scoring;
    }

    public void setScoring(Scoring scoring) {
        this.scoring = scoring;
    }

    public AttachmentSearch getAttachmentSearch() {
        return attachmentSearch;
    }

    public void setAttachmentSearch(AttachmentSearch attachmentSearch) {
        this.attachmentSearch = attachmentSearch;
    }

    public PriorityInbox getPriorityInbox() {
        return priorityInbox;
    }

    public void setPriorityInbox(PriorityInbox priorityInbox) {
        this.priorityInbox = priorityInbox;
    }

    /**
     * Identity of the user's own company. Domains are matched as substrings of the sender address,
     * names are handed to the classifier as context.
     */
    public static class OwnOrganization {

        private String name = "";

        private List<String> domains = new ArrayList<>();

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public List<String> getDomains() {
            return domains;
        }

        public void setDomains(List<String> domains) {
            this.domains = domains;
        }

        public boolean matchesAddress(String address) {
            if (address == null || address.isBlank()) return false;
            String lower = address.toLowerCase(Locale.ROOT);
            return domains.stream()
                    .filter(d -> d != null && !d.isBlank())
                    .anyMatch(d -> lower.contains(d.toLowerCase(Locale.ROOT)));
        }
    }

    public static class Classification {

        @NotNull
        private Duration timeout = Duration.ofSeconds(10);

        @Positive
        private int bodyExcerptLength = 1500;

        @Min(1)
        @Max(64)
        private int parallelism = 4;

        @Valid
        private OpenAi openai = new OpenAi();

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public int getBodyExcerptLength() {
            return bodyExcerptLength;
        }

        public void setBodyExcerptLength(int bodyExcerptLength) {
            this.bodyExcerptLength = bodyExcerptLength;
        }

        public int getParallelism() {
            return parallelism;
        }

        public void setParallelism(int parallelism) {
            this.parallelism = parallelism;
        }

        public OpenAi getOpenai() {
            return openai;
        }

        public void setOpenai(OpenAi openai) {
            this.openai = openai;
        }
    }

    public static class OpenAi {

        private String apiKey;

        private String baseUrl;

        private String modelName = "gpt-4o-mini";

        private double temperature = 0.0;

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getModelName() {
            return modelName;
        }

        public void setModelName(String modelName) {
            this.modelName = modelName;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }
    }

    /**
     * Additive score adjustments applied on top of {@link #getBase()}.
     */
    public static class Scoring {

        private int base = 50;
        private int serviceRequest = 30;
        private int externalPaymentRequest = 20;
        private int highUrgency = 25;
        private int lowUrgency = -10;
        private int needsResponse = 15;
        private int important = 10;
        private int starred = 10;
        private int unread = 5;
        private int lowValueCategory = -40;

        public int getBase() {
            return base;
        }

        public void setBase(int base) {
            this.base = base;
        }

        public int getServiceRequest() {
            return serviceRequest;
        }

        public void setServiceRequest(int serviceRequest) {
            this.serviceRequest = serviceRequest;
        }

        public int getExternalPaymentRequest() {
            return externalPaymentRequest;
        }

        public void setExternalPaymentRequest(int externalPaymentRequest) {
            this.externalPaymentRequest = externalPaymentRequest;
        }

        public int getHighUrgency() {
            return highUrgency;
        }

        public void setHighUrgency(int highUrgency) {
            this.highUrgency = highUrgency;
        }

        public int getLowUrgency() {
            return lowUrgency;
        }

        public void setLowUrgency(int lowUrgency) {
            this.lowUrgency = lowUrgency;
        }

        public int getNeedsResponse() {
            return needsResponse;
        }

        public void setNeedsResponse(int needsResponse) {
            this.needsResponse = needsResponse;
        }

        public int getImportant() {
            return important;
        }

        public void setImportant(int important) {
            this.important = important;
        }

        public int getStarred() {
            return starred;
        }

        public void setStarred(int starred) {
            this.starred = starred;
        }

        public int getUnread() {
            return unread;
        }

        public void setUnread(int unread) {
            this.unread = unread;
        }

        public int getLowValueCategory() {
            return lowValueCategory;
        }

        public void setLowValueCategory(int lowValueCategory) {
            this.lowValueCategory = lowValueCategory;
        }
    }

    public static class AttachmentSearch {

        // rows fetched per requested result, since irrelevant attachments are discarded afterwards
        @Min(1)
        @Max(10)
        private int overFetchFactor = 2;

        @Positive
        private int contextWindow = 100;

        public int getOverFetchFactor() {
            return overFetchFactor;
        }

        public void setOverFetchFactor(int overFetchFactor) {
            this.overFetchFactor = overFetchFactor;
        }

        public int getContextWindow() {
            return contextWindow;
        }

        public void setContextWindow(int contextWindow) {
            this.contextWindow = contextWindow;
        }
    }

    public static class PriorityInbox {

        @Positive
        private int candidatePoolSize = 100;

        public int getCandidatePoolSize() {
            return candidatePoolSize;
        }

        public void setCandidatePoolSize(int candidatePoolSize) {
            this.candidatePoolSize = candidatePoolSize;
        }
    }
}
