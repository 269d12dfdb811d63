package fr.lapetina.dispatch.domain.strategy.discount;

import fr.lapetina.dispatch.domain.exception.InvalidInputException;
import fr.lapetina.dispatch.domain.strategy.StrategyFactory;

import java.util.Map;

/**
 * Built-in discount types and their parameter parsing.
 *
 * <table border="1">
 *   <tr><th>Type</th><th>Parameters</th></tr>
 *   <tr><td>{@code percentage}</td><td>{@code rate} (0..1, required), {@code rejectNegative} (default true)</td></tr>
 *   <tr><td>{@code fixed}</td><td>{@code amount} (&gt;= 0, required), {@code rejectNegative} (default true)</td></tr>
 * </table>
 */
public final class DiscountStrategies {

    public static final String PERCENTAGE = "percentage";
    public static final String FIXED = "fixed";

    private DiscountStrategies() {
        // Utility class
    }

    /**
     * Registers the built-in discount types with the given factory.
     */
    public static StrategyFactory<Double, Double> registerBuiltIns(StrategyFactory<Double, Double> factory) {
        return factory
                .register(PERCENTAGE, params -> new PercentageDiscountStrategy(
                        requireNumber(params, "rate"),
                        optionalBoolean(params, "rejectNegative", true)))
                .register(FIXED, params -> new FixedDiscountStrategy(
                        requireNumber(params, "amount"),
                        optionalBoolean(params, "rejectNegative", true)));
    }

    /**
     * Creates a factory holding only the built-in discount types.
     */
    public static StrategyFactory<Double, Double> factory() {
        return registerBuiltIns(new StrategyFactory<>());
    }

    static void validate(Double amount, boolean rejectNegative) {
        if (amount == null) {
            throw new InvalidInputException(null, "amount is required");
        }
        if (amount.isNaN()) {
            throw new InvalidInputException(amount, "amount must be a number");
        }
        if (rejectNegative && amount < 0) {
            throw new InvalidInputException(amount, "amount must not be negative");
        }
    }

    private static double requireNumber(Map<String, Object> params, String name) {
        Object value = params.get(name);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value == null) {
            throw new IllegalArgumentException("Missing required parameter: " + name);
        }
        throw new IllegalArgumentException("Parameter '" + name + "' must be a number, got: " + value);
    }

    private static boolean optionalBoolean(Map<String, Object> params, String name, boolean defaultValue) {
        Object value = params.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        throw new IllegalArgumentException("Parameter '" + name + "' must be a boolean, got: " + value);
    }
}
