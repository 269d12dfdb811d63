package fr.lapetina.dispatch.integration;

import fr.lapetina.dispatch.DispatchFactory;
import fr.lapetina.dispatch.dispatcher.Dispatcher;
import fr.lapetina.dispatch.domain.exception.InvalidInputException;
import fr.lapetina.dispatch.domain.exception.StrategyNotFoundException;
import fr.lapetina.dispatch.domain.strategy.StrategyRegistry;
import fr.lapetina.dispatch.domain.strategy.discount.FixedDiscountStrategy;
import fr.lapetina.dispatch.domain.strategy.discount.PercentageDiscountStrategy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Discount scenario run twice: wired by hand, then from test-resource YAML.
 */
class DiscountDispatchScenarioTest {

    @Test
    @DisplayName("hand-wired registry should resolve, dispatch and reject as expected")
    void handWiredScenario() {
        StrategyRegistry<Double, Double> registry = new StrategyRegistry<>();
        registry.register("percentage", PercentagePolicies.strict());
        registry.register("fixed", new FixedDiscountStrategy(15));

        assertThat(new Dispatcher<>(registry.resolve("percentage")).process(100.0)).isEqualTo(10.0);
        assertThat(new Dispatcher<>(registry.resolve("fixed")).process(100.0)).isEqualTo(15.0);
        assertThatThrownBy(() -> registry.resolve("unknown"))
                .isInstanceOf(StrategyNotFoundException.class);

        Dispatcher<Double, Double> fresh = new Dispatcher<>(registry.resolve("percentage"));
        assertThatThrownBy(() -> fresh.process(-5.0)).isInstanceOf(InvalidInputException.class);

        registry.register("percentage", PercentagePolicies.lenient());
        Dispatcher<Double, Double> lenient = new Dispatcher<>(registry.resolve("percentage"));
        assertThat(lenient.process(-5.0)).isCloseTo(-0.5, within(1e-9));
    }

    @Test
    @DisplayName("configured registry should behave like the hand-wired one")
    void configuredScenario() {
        try (DispatchFactory factory = DispatchFactory.create("dispatch-test.yaml")) {
            StrategyRegistry<Double, Double> registry = factory.getRegistry();

            assertThat(new Dispatcher<>(registry.resolve("percentage")).process(100.0)).isEqualTo(10.0);
            assertThat(new Dispatcher<>(registry.resolve("fixed")).process(100.0)).isEqualTo(15.0);
            assertThatThrownBy(() -> registry.resolve("unknown"))
                    .isInstanceOf(StrategyNotFoundException.class);
            assertThatThrownBy(() -> factory.getDispatcher().process(-5.0))
                    .isInstanceOf(InvalidInputException.class);
            assertThat(factory.getKeyedDispatcher().process("percentage-lenient", -5.0))
                    .isCloseTo(-0.5, within(1e-9));
        }
    }

    private static final class PercentagePolicies {

        static PercentageDiscountStrategy strict() {
            return new PercentageDiscountStrategy(0.10, true);
        }

        static PercentageDiscountStrategy lenient() {
            return new PercentageDiscountStrategy(0.10, false);
        }
    }
}
