package dev.aparikh.emailtriage.config;

import org.apache.solr.client.solrj.SolrClient;
import org.apache.solr.client.solrj.impl.HttpSolrClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

@Configuration
@EnableConfigurationProperties(SolrConfigurationProperties.class)
class SolrConfig {

    private static final Logger log = LoggerFactory.getLogger(SolrConfig.class);

    private final SolrConfigurationProperties properties;

    SolrConfig(SolrConfigurationProperties properties) {
        this.properties = properties;
    }

    static String coreUrl(String baseUrl, String core) {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        String name = core.startsWith("/") ? core.substring(1) : core;
        return base + "/" + name; // e.g., http://host:8983/solr/emails
    }

    @Bean
    SolrClient solrClient() {
        String url = coreUrl(properties.getBaseUrl(), properties.getCore());
        log.info("Using Solr core at {}", url);
        return new HttpSolrClient.Builder(url)
                .withConnectionTimeout(properties.getConnectTimeoutMs(), TimeUnit.MILLISECONDS)
                .withSocketTimeout(properties.getSocketTimeoutMs(), TimeUnit.MILLISECONDS)
                .build();
    }
}
