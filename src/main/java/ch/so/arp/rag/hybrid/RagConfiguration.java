package ch.so.arp.rag.hybrid;

import java.nio.file.Path;
import java.time.Clock;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.web.client.RestClient;

import ch.so.arp.rag.hybrid.store.MetadataStore;
import ch.so.arp.rag.hybrid.store.VectorDatabase;
import ch.so.arp.rag.hybrid.store.VectorStoreEngine;

/**
 * Central configuration wiring the retrieval and generation components
 * together. {@code rag.mock-openai} decides whether the OpenAI-compatible
 * clients or the offline stand-ins are used.
 */
@Configuration
@EnableConfigurationProperties({ RagProperties.class, OpenAiClientProperties.class })
public class RagConfiguration {

    @Bean
    @ConditionalOnProperty(name = "rag.mock-openai", havingValue = "true", matchIfMissing = true)
    public Generator mockGenerator() {
        return new MockGenerator();
    }

    @Bean
    @ConditionalOnProperty(name = "rag.mock-openai", havingValue = "false")
    public Generator openAiGenerator(OpenAiClientProperties properties) {
        return new OpenAiGenerator(properties, RestClient.builder());
    }

    @Bean
    @ConditionalOnProperty(name = "rag.mock-openai", havingValue = "true", matchIfMissing = true)
    public Embedder deterministicEmbedder(RagProperties properties) {
        return new DeterministicEmbedder(properties.getEmbedding().getDimensions());
    }

    @Bean
    @ConditionalOnProperty(name = "rag.mock-openai", havingValue = "false")
    public Embedder openAiEmbedder(OpenAiClientProperties properties) {
        return new OpenAiEmbedder(properties, RestClient.builder());
    }

    @Bean
    @ConditionalOnMissingBean
    public MetadataStore metadataStore(JdbcClient jdbcClient) {
        return new MetadataStore(jdbcClient);
    }

    @Bean
    @ConditionalOnMissingBean
    public VectorDatabase vectorDatabase(MetadataStore metadataStore, RagProperties properties) {
        return new VectorStoreEngine(metadataStore, Path.of(properties.getStore().getIndexPath()));
    }

    @Bean
    @ConditionalOnMissingBean
    public Tracer tracer() {
        return new LoggingTracer();
    }

    @Bean
    @ConditionalOnMissingBean
    public AdmissionControl admissionControl() {
        return new SlidingWindowAdmissionControl(Clock.systemUTC());
    }
}
