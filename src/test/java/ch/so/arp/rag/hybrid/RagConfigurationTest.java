package ch.so.arp.rag.hybrid;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

import javax.sql.DataSource;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import ch.so.arp.rag.hybrid.store.IndexState;
import ch.so.arp.rag.hybrid.store.VectorDatabase;
import ch.so.arp.rag.hybrid.store.VectorStoreEngine;

class RagConfigurationTest {

    @TempDir
    Path tempDir;

    private ApplicationContextRunner contextRunner() {
        return new ApplicationContextRunner()
                .withUserConfiguration(RagConfiguration.class, InfrastructureConfiguration.class)
                .withPropertyValues("rag.store.index-path=" + tempDir.resolve("vector.index"));
    }

    @Test
    void usesOfflineCollaboratorsByDefault() {
        contextRunner().run(context -> {
            assertThat(context).hasSingleBean(Generator.class);
            assertThat(context).getBean(Generator.class).isInstanceOf(MockGenerator.class);
            assertThat(context).hasSingleBean(Embedder.class);
            assertThat(context).getBean(Embedder.class).isInstanceOf(DeterministicEmbedder.class);
            assertThat(context).hasSingleBean(VectorDatabase.class);
            assertThat(context).getBean(VectorDatabase.class).isInstanceOf(VectorStoreEngine.class);
            assertThat(context.getBean(VectorStoreEngine.class).state()).isEqualTo(IndexState.ABSENT);
            assertThat(context).hasSingleBean(Tracer.class);
            assertThat(context).hasSingleBean(AdmissionControl.class);
        });
    }

    @Test
    void bindsConfiguredEmbeddingDimension() {
        contextRunner()
                .withPropertyValues("rag.embedding.dimensions=16")
                .run(context -> assertThat(context.getBean(Embedder.class).embed(List.of("text")).get(0))
                        .hasSize(16));
    }

    @Test
    void createsOpenAiClientsWhenMocksDisabled() {
        contextRunner()
                .withPropertyValues(
                        "rag.mock-openai=false",
                        "spring.ai.openai.api-key=test-key",
                        "rag.openai.base-url=https://example.com/v1",
                        "rag.openai.chat-model=gpt-4o")
                .run(context -> {
                    assertThat(context).getBean(Generator.class).isInstanceOf(OpenAiGenerator.class);
                    assertThat(context).getBean(Embedder.class).isInstanceOf(OpenAiEmbedder.class);
                    OpenAiClientProperties properties = context.getBean(OpenAiClientProperties.class);
                    assertThat(properties.getApiKey()).isEqualTo("test-key");
                    assertThat(properties.getChatModel()).isEqualTo("gpt-4o");
                    assertThat(properties.getEmbeddingModel()).isEqualTo("text-embedding-3-small");
                });
    }

    @Test
    void failsFastWithoutApiKeyWhenMocksDisabled() {
        contextRunner()
                .withPropertyValues("rag.mock-openai=false")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void bindsFeatureAndAdmissionSettings() {
        contextRunner()
                .withPropertyValues("rag.features.planning=true", "rag.admission.query-limit=3",
                        "rag.admission.query-window=10m")
                .run(context -> {
                    RagProperties properties = context.getBean(RagProperties.class);
                    assertThat(properties.getFeatures().isPlanning()).isTrue();
                    assertThat(properties.getFeatures().isFollowups()).isTrue();
                    assertThat(properties.getAdmission().getQueryLimit()).isEqualTo(3);
                    assertThat(properties.getAdmission().getQueryWindow()).hasMinutes(10);
                    assertThat(properties.getAdmission().getIngestLimit()).isEqualTo(1);
                });
    }

    @Configuration(proxyBeanMethods = false)
    static class InfrastructureConfiguration {

        @Bean
        JdbcClient jdbcClient(DataSource dataSource) {
            return JdbcClient.create(dataSource);
        }

        @Bean
        DataSource dataSource() {
            DriverManagerDataSource dataSource = new DriverManagerDataSource();
            dataSource.setDriverClassName("org.h2.Driver");
            dataSource.setUrl("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
            dataSource.setUsername("sa");
            dataSource.setPassword("");
            return dataSource;
        }
    }
}
