package fr.lapetina.dispatch.domain.strategy.discount;

import fr.lapetina.dispatch.domain.exception.InvalidInputException;
import fr.lapetina.dispatch.domain.strategy.Strategy;

/**
 * Discount worth a fixed share of the amount.
 *
 * With {@code rejectNegative} enabled a negative amount is an
 * {@link InvalidInputException}; otherwise the product is returned as is,
 * so {@code -5} at 10% yields {@code -0.5}.
 */
public final class PercentageDiscountStrategy implements Strategy<Double, Double> {

    private final double rate;
    private final boolean rejectNegative;

    public PercentageDiscountStrategy(double rate) {
        this(rate, true);
    }

    public PercentageDiscountStrategy(double rate, boolean rejectNegative) {
        if (!(rate >= 0.0 && rate <= 1.0)) {
            throw new IllegalArgumentException("Rate must be between 0 and 1, got " + rate);
        }
        this.rate = rate;
        this.rejectNegative = rejectNegative;
    }

    @Override
    public String getName() {
        return "percentage";
    }

    @Override
    public Double apply(Double amount) {
        DiscountStrategies.validate(amount, rejectNegative);
        return amount * rate;
    }

    public double getRate() {
        return rate;
    }

    public boolean isRejectNegative() {
        return rejectNegative;
    }

    @Override
    public String toString() {
        return "PercentageDiscountStrategy{rate=" + rate + ", rejectNegative=" + rejectNegative + "}";
    }
}
