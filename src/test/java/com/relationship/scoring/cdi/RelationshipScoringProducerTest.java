package com.relationship.scoring.cdi;

import com.relationship.scoring.api.RelationshipScoringEngine;
import com.relationship.scoring.core.model.Record;
import com.relationship.scoring.judgment.JudgmentProvider;
import com.relationship.scoring.judgment.NoOpJudgmentProvider;
import com.relationship.scoring.judgment.OpenAiJudgmentProvider;
import com.relationship.scoring.source.InMemoryRecordSource;
import com.relationship.scoring.source.RecordSource;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.enterprise.inject.Instance;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class RelationshipScoringProducerTest {

    private RelationshipScoringProducer producer;
    private Instance<RecordSource> recordSources;
    private Instance<MeterRegistry> meterRegistries;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        recordSources = mock(Instance.class);
        meterRegistries = mock(Instance.class);

        producer = new RelationshipScoringProducer();
        producer.badDomainsPath = Optional.empty();
        producer.identifierPrefix = "001";
        producer.directWeight = 0.7;
        producer.crossWeight = 0.3;
        producer.maxBatchSize = 50;
        producer.maxConcurrency = 4;
        producer.recordTimeoutSeconds = 30;
        producer.cacheEnabled = true;
        producer.cacheMaxSize = 100;
        producer.cacheTtlSeconds = 60;
        producer.judgmentEnabled = false;
        producer.judgmentProviderType = "openai";
        producer.openAiBaseUrl = "https://api.openai.com/v1";
        producer.openAiModel = "gpt-4o";
        producer.openAiApiKey = Optional.empty();
        producer.openAiTimeoutSeconds = 60;
        producer.recordSources = recordSources;
        producer.meterRegistries = meterRegistries;
    }

    @Nested
    @DisplayName("Engine production")
    class EngineTests {

        @Test
        @DisplayName("Options come from config properties")
        void optionsFromConfig() {
            when(recordSources.isResolvable()).thenReturn(false);
            when(meterRegistries.isResolvable()).thenReturn(false);

            try (RelationshipScoringEngine engine = producer.relationshipScoringEngine()) {
                assertEquals(50, engine.getOptions().getMaxBatchSize());
                assertEquals(4, engine.getOptions().getMaxConcurrency());
                assertEquals(Duration.ofSeconds(30), engine.getOptions().getRecordTimeout());
                assertFalse(engine.getOptions().isJudgmentEnabled());
                assertFalse(engine.getBadDomains().isEmpty());
                assertEquals(2, engine.getHealthCheckRegistry().size());
            }
        }

        @Test
        @DisplayName("Uses the application's record source")
        void usesRecordSourceBean() {
            Record parent = Record.builder().identifier("001xx00000000PA").name("Acme").build();
            when(recordSources.isResolvable()).thenReturn(true);
            when(recordSources.get()).thenReturn(new InMemoryRecordSource().add(parent));
            when(meterRegistries.isResolvable()).thenReturn(false);

            try (RelationshipScoringEngine engine = producer.relationshipScoringEngine()) {
                Record customer = Record.builder()
                        .identifier("001xx000000000A")
                        .name("Acme")
                        .parentIdentifier("001xx00000000PA")
                        .build();
                assertTrue(engine.assess(customer).getShellRecord().isPresent());
            }
            verify(recordSources).get();
        }

        @Test
        @DisplayName("Registers Micrometer metrics when a registry bean exists")
        void micrometerWhenRegistryPresent() {
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            when(recordSources.isResolvable()).thenReturn(false);
            when(meterRegistries.isResolvable()).thenReturn(true);
            when(meterRegistries.get()).thenReturn(registry);

            try (RelationshipScoringEngine engine = producer.relationshipScoringEngine()) {
                assertNotNull(registry.find("relationship.bad_domain").counter());
            }
        }

        @Test
        @DisplayName("Judgment enabled adds the provider health check")
        void judgmentEnabled() {
            producer.judgmentEnabled = true;
            when(recordSources.isResolvable()).thenReturn(false);
            when(meterRegistries.isResolvable()).thenReturn(false);

            try (RelationshipScoringEngine engine = producer.relationshipScoringEngine()) {
                assertEquals(3, engine.getHealthCheckRegistry().size());
                assertTrue(engine.health().isDegraded() || engine.health().isDown());
            }
        }

        @Test
        @DisplayName("Health registry is taken from the engine")
        void healthRegistry() {
            when(recordSources.isResolvable()).thenReturn(false);
            when(meterRegistries.isResolvable()).thenReturn(false);

            try (RelationshipScoringEngine engine = producer.relationshipScoringEngine()) {
                assertSame(engine.getHealthCheckRegistry(), producer.healthCheckRegistry(engine));
            }
        }
    }

    @Nested
    @DisplayName("Judgment provider selection")
    class ProviderTests {

        @Test
        @DisplayName("openai builds an OpenAI provider")
        void openAi() {
            producer.openAiApiKey = Optional.of("sk-test");
            producer.openAiModel = "gpt-4o-mini";

            JudgmentProvider provider = producer.createJudgmentProvider();

            assertInstanceOf(OpenAiJudgmentProvider.class, provider);
            assertEquals("OpenAI/gpt-4o-mini", provider.getProviderName());
            assertTrue(provider.isAvailable());
        }

        @Test
        @DisplayName("Unknown provider falls back to NoOp")
        void unknownProvider() {
            producer.judgmentProviderType = "other";
            assertInstanceOf(NoOpJudgmentProvider.class, producer.createJudgmentProvider());
        }
    }
}
