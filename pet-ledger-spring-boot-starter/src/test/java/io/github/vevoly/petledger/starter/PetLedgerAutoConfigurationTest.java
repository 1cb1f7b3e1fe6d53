package io.github.vevoly.petledger.starter;

import io.github.vevoly.petledger.api.IdempotencyStrategy;
import io.github.vevoly.petledger.api.LedgerTransport;
import io.github.vevoly.petledger.api.crypto.Ed25519;
import io.github.vevoly.petledger.api.crypto.Signer;
import io.github.vevoly.petledger.api.model.PetRecord;
import io.github.vevoly.petledger.api.model.Species;
import io.github.vevoly.petledger.client.ConfirmationOutcome;
import io.github.vevoly.petledger.client.ConfirmationWatcher;
import io.github.vevoly.petledger.client.PetLedgerClient;
import io.github.vevoly.petledger.core.idempotency.BloomIdempotencyStrategy;
import io.github.vevoly.petledger.core.node.PetLedgerNode;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class PetLedgerAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(PetLedgerAutoConfiguration.class))
            .withPropertyValues("pet-ledger.block-interval=20ms", "pet-ledger.finality-depth=0");

    @Test
    void defaults_startLocalNodeAndWatcher() {
        runner.run(context -> {
            assertThat(context).hasSingleBean(PetLedgerNode.class);
            assertThat(context).hasSingleBean(ConfirmationWatcher.class);
            assertThat(context).doesNotHaveBean(PetLedgerClient.class);

            PetLedgerNode node = context.getBean(PetLedgerNode.class);
            assertThat(node.isRunning()).isTrue();
            assertThat(node.getIdempotencyStrategyName()).isEqualTo("LRU");
        });
    }

    @Test
    void properties_bindToNode() {
        runner.withPropertyValues(
                        "pet-ledger.node-name=pets-a",
                        "pet-ledger.idempotency=BLOOM",
                        "pet-ledger.idempotency-capacity=5000",
                        "pet-ledger.bloom-fpp=0.01",
                        "pet-ledger.client.status-timeout=5s")
                .run(context -> {
                    PetLedgerProperties props = context.getBean(PetLedgerProperties.class);
                    assertThat(props.getBlockInterval()).isEqualTo(Duration.ofMillis(20));
                    assertThat(props.getClient().getStatusTimeout()).isEqualTo(Duration.ofSeconds(5));

                    PetLedgerNode node = context.getBean(PetLedgerNode.class);
                    assertThat(node.getNodeName()).isEqualTo("pets-a");
                    assertThat(node.getIdempotencyStrategyName()).isEqualTo("BLOOM");
                    BloomIdempotencyStrategy bloom = (BloomIdempotencyStrategy) context.getBean(IdempotencyStrategy.class);
                    assertThat(bloom.getExpectedInsertions()).isEqualTo(5000);
                    assertThat(bloom.getFpp()).isEqualTo(0.01);
                });
    }

    @Test
    void signerBean_enablesClient() {
        runner.withUserConfiguration(SignerConfig.class).run(context -> {
            assertThat(context).hasSingleBean(PetLedgerClient.class);

            PetLedgerClient client = context.getBean(PetLedgerClient.class);
            ConfirmationWatcher watcher = context.getBean(ConfirmationWatcher.class);
            ConfirmationOutcome outcome = watcher.await(client.mint("Bun", Species.RABBIT, 3));

            assertThat(outcome.isSuccess()).isTrue();
            assertThat(client.myPet()).contains(PetRecord.of(3, "Bun", Species.RABBIT));
        });
    }

    @Test
    void customTransport_replacesLocalNode() {
        runner.withUserConfiguration(RemoteTransportConfig.class).run(context -> {
            assertThat(context).doesNotHaveBean(PetLedgerNode.class);
            assertThat(context).hasSingleBean(ConfirmationWatcher.class);
        });
    }

    @Test
    void customIdempotencyStrategy_isUsed() {
        runner.withUserConfiguration(CustomIdempotencyConfig.class).run(context -> {
            assertThat(context.getBean(IdempotencyStrategy.class).getName()).isEqualTo("CUSTOM");
            assertThat(context.getBean(PetLedgerNode.class).getIdempotencyStrategyName()).isEqualTo("CUSTOM");
        });
    }

    @Test
    void meterRegistryBean_receivesNodeMetrics() {
        runner.withUserConfiguration(MetricsConfig.class).run(context -> {
            MeterRegistry registry = context.getBean(MeterRegistry.class);
            assertThat(registry.find("pet-ledger.ring.remaining").gauge()).isNotNull();
        });
    }

    @Configuration(proxyBeanMethods = false)
    static class SignerConfig {
        @Bean
        Signer signer() {
            return Ed25519.generateSigner();
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class RemoteTransportConfig {
        @Bean
        LedgerTransport remoteTransport() {
            return mock(LedgerTransport.class);
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class MetricsConfig {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class CustomIdempotencyConfig {
        @Bean
        IdempotencyStrategy idempotencyStrategy() {
            return new IdempotencyStrategy() {
                private final Set<String> seen = ConcurrentHashMap.newKeySet();

                @Override
                public boolean contains(String key) {
                    return seen.contains(key);
                }

                @Override
                public void add(String key) {
                    seen.add(key);
                }

                @Override
                public String getName() {
                    return "CUSTOM";
                }
            };
        }
    }
}
