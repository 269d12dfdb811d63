package fr.lapetina.dispatch;

import fr.lapetina.dispatch.dispatcher.Dispatcher;
import fr.lapetina.dispatch.domain.exception.MissingBindingException;
import fr.lapetina.dispatch.domain.exception.StrategyNotFoundException;
import fr.lapetina.dispatch.domain.strategy.Strategy;
import fr.lapetina.dispatch.domain.strategy.StrategyFactory;
import fr.lapetina.dispatch.domain.strategy.discount.DiscountStrategies;
import fr.lapetina.dispatch.domain.strategy.discount.PercentageDiscountStrategy;
import fr.lapetina.dispatch.infrastructure.config.ConfigLoader.ConfigurationException;
import fr.lapetina.dispatch.infrastructure.config.DispatchConfig;
import fr.lapetina.dispatch.infrastructure.metrics.MeteredStrategy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DispatchFactoryTest {

    @TempDir
    static Path tempDir;

    @Nested
    @DisplayName("Wiring from configuration")
    class WiringTests {

        @Test
        @DisplayName("should register every enabled strategy")
        void shouldRegisterEnabledStrategies() {
            try (DispatchFactory factory = DispatchFactory.create("dispatch-test.yaml")) {
                assertThat(factory.getRegistry().keys())
                        .containsExactlyInAnyOrder("percentage", "percentage-lenient", "fixed");
                assertThat(factory.getRegistry().contains("retired")).isFalse();
            }
        }

        @Test
        @DisplayName("should wrap strategies with metrics when enabled")
        void shouldWrapWithMetrics() {
            try (DispatchFactory factory = DispatchFactory.create("dispatch-test.yaml")) {
                Strategy<Double, Double> strategy = factory.getRegistry().resolve("percentage");

                assertThat(strategy).isInstanceOf(MeteredStrategy.class);
                assertThat(((MeteredStrategy<Double, Double>) strategy).getDelegate())
                        .isInstanceOf(PercentageDiscountStrategy.class);

                factory.getKeyedDispatcher().process("percentage", 100.0);
                assertThat(factory.getMetricsRegistry().scrape())
                        .contains("dispatch_test_strategy_invocations_total")
                        .contains("dispatch_test_registered_strategies 3.0");
            }
        }

        @Test
        @DisplayName("should bind the default dispatcher to the default strategy")
        void shouldBindDefaultDispatcher() {
            try (DispatchFactory factory = DispatchFactory.create("dispatch-test.yaml")) {
                Dispatcher<Double, Double> dispatcher = factory.getDispatcher();

                assertThat(dispatcher.getStrategy()).isSameAs(factory.getRegistry().resolve("percentage"));
                assertThat(dispatcher.process(100.0)).isEqualTo(10.0);
            }
        }

        @Test
        @DisplayName("should use plain strategies and no default dispatcher when configured so")
        void shouldSkipMetricsAndDefault() throws IOException {
            Path file = write("""
                    strategies:
                      - key: fixed
                        type: fixed
                        parameters:
                          amount: 15
                    metrics:
                      enabled: false
                    """);

            try (DispatchFactory factory = DispatchFactory.create(file.toString())) {
                assertThat(factory.getRegistry().resolve("fixed")).isNotInstanceOf(MeteredStrategy.class);
                assertThatThrownBy(factory::getDispatcher).isInstanceOf(MissingBindingException.class);
            }
        }

        @Test
        @DisplayName("should accept caller-supplied strategy types")
        void shouldAcceptCustomTypes() throws IOException {
            Path file = write("""
                    defaultStrategy: none
                    strategies:
                      - key: none
                        type: zero
                    """);
            StrategyFactory<Double, Double> types = DiscountStrategies.factory()
                    .register("zero", params -> Strategy.named("zero", amount -> 0.0));

            try (DispatchFactory factory = DispatchFactory.create(file.toString(), types)) {
                assertThat(factory.getDispatcher().process(100.0)).isEqualTo(0.0);
            }
        }
    }

    @Nested
    @DisplayName("Configuration errors")
    class ErrorTests {

        @Test
        @DisplayName("should reject an unknown strategy type")
        void shouldRejectUnknownType() {
            assertThatThrownBy(() -> DispatchFactory.create("dispatch-unknown-type.yaml"))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("loyalty-points");
        }

        @Test
        @DisplayName("should reject a default key that is not configured")
        void shouldRejectUnknownDefault() throws IOException {
            Path file = write("""
                    defaultStrategy: missing
                    strategies:
                      - key: fixed
                        type: fixed
                        parameters:
                          amount: 15
                    """);

            assertThatThrownBy(() -> DispatchFactory.create(file.toString()))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("missing");
        }

        @Test
        @DisplayName("should reject invalid parameters and duplicate keys")
        void shouldRejectInvalidEntries() throws IOException {
            Path badRate = write("""
                    strategies:
                      - key: percentage
                        type: percentage
                        parameters:
                          rate: 3
                    """);
            assertThatThrownBy(() -> DispatchFactory.create(badRate.toString()))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("percentage");

            Path duplicate = write("""
                    strategies:
                      - key: fixed
                        type: fixed
                        parameters:
                          amount: 15
                      - key: fixed
                        type: fixed
                        parameters:
                          amount: 20
                    """);
            assertThatThrownBy(() -> DispatchFactory.create(duplicate.toString()))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("Duplicate");
        }
    }

    @Nested
    @DisplayName("Reload")
    class ReloadTests {

        @Test
        @DisplayName("should re-register, unregister and rebind on reload")
        void shouldApplyReload() throws IOException {
            Path file = write("""
                    defaultStrategy: percentage
                    strategies:
                      - key: percentage
                        type: percentage
                        parameters:
                          rate: 0.10
                      - key: fixed
                        type: fixed
                        parameters:
                          amount: 15
                    """);

            try (DispatchFactory factory = DispatchFactory.create(file.toString())) {
                Dispatcher<Double, Double> dispatcher = factory.getDispatcher();
                Double before = dispatcher.process(100.0);

                Files.writeString(file, """
                        defaultStrategy: seasonal
                        strategies:
                          - key: percentage
                            type: percentage
                            parameters:
                              rate: 0.20
                          - key: seasonal
                            type: fixed
                            parameters:
                              amount: 30
                        """);
                factory.getConfigLoader().reload();

                assertThat(before).isEqualTo(10.0);
                assertThat(factory.getRegistry().keys()).containsExactlyInAnyOrder("percentage", "seasonal");
                assertThatThrownBy(() -> factory.getRegistry().resolve("fixed"))
                        .isInstanceOf(StrategyNotFoundException.class);
                assertThat(factory.getKeyedDispatcher().process("percentage", 100.0)).isEqualTo(20.0);
                assertThat(factory.getDispatcher()).isSameAs(dispatcher);
                assertThat(dispatcher.process(100.0)).isEqualTo(30.0);
                assertThat(factory.getConfig().getDefaultStrategy()).isEqualTo("seasonal");
            }
        }

        @Test
        @DisplayName("should keep current wiring when the reloaded configuration is invalid")
        void shouldKeepWiringOnInvalidReload() throws IOException {
            Path file = write("""
                    defaultStrategy: fixed
                    strategies:
                      - key: fixed
                        type: fixed
                        parameters:
                          amount: 15
                    """);

            try (DispatchFactory factory = DispatchFactory.create(file.toString())) {
                Files.writeString(file, """
                        defaultStrategy: fixed
                        strategies:
                          - key: fixed
                            type: unknown-type
                        """);
                DispatchConfig reloaded = factory.getConfigLoader().reload();

                assertThat(factory.getRegistry().keys()).containsExactly("fixed");
                assertThat(factory.getDispatcher().process(100.0)).isEqualTo(15.0);
                assertThat(factory.getConfig().getStrategies().get(0).getType()).isEqualTo("fixed");
                assertThat(reloaded).isSameAs(factory.getConfig());
                assertThat(factory.getConfigLoader().getCurrentConfig()).isSameAs(factory.getConfig());
            }
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("should release metrics when the initial configuration is rejected")
        void shouldCloseOnRejectedInitialConfig() {
            AtomicBoolean closed = new AtomicBoolean();
            AtomicBoolean metricsClosed = new AtomicBoolean();

            assertThatThrownBy(() -> new DispatchFactory("dispatch-unknown-type.yaml", DiscountStrategies.factory()) {
                @Override
                public void close() {
                    super.close();
                    closed.set(true);
                    metricsClosed.set(getMetricsRegistry().getRegistry().isClosed());
                }
            }).isInstanceOf(ConfigurationException.class);

            assertThat(closed).isTrue();
            assertThat(metricsClosed).isTrue();
        }

        @Test
        @DisplayName("should keep the original metrics prefix across reloads")
        void shouldKeepMetricsPrefixOnReload() throws IOException {
            Path file = write("""
                    strategies:
                      - key: fixed
                        type: fixed
                        parameters:
                          amount: 15
                    metrics:
                      prefix: first_prefix
                    """);

            try (DispatchFactory factory = DispatchFactory.create(file.toString())) {
                Files.writeString(file, """
                        strategies:
                          - key: fixed
                            type: fixed
                            parameters:
                              amount: 20
                        metrics:
                          prefix: second_prefix
                        """);
                factory.getConfigLoader().reload();

                assertThat(factory.getKeyedDispatcher().process("fixed", 100.0)).isEqualTo(20.0);
                assertThat(factory.getMetricsRegistry().getPrefix()).isEqualTo("first_prefix");
                assertThat(factory.getMetricsRegistry().scrape())
                        .contains("first_prefix_strategy_invocations_total")
                        .doesNotContain("second_prefix");
            }
        }
    }

    private Path write(String yaml) throws IOException {
        Path file = Files.createTempFile(tempDir, "dispatch", ".yaml");
        Files.writeString(file, yaml);
        return file;
    }
}
