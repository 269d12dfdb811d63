package fr.lapetina.dispatch.domain.strategy.discount;

import fr.lapetina.dispatch.domain.strategy.Strategy;

/**
 * Discount worth a constant amount whatever the order value.
 */
public final class FixedDiscountStrategy implements Strategy<Double, Double> {

    private final double amount;
    private final boolean rejectNegative;

    public FixedDiscountStrategy(double amount) {
        this(amount, true);
    }

    public FixedDiscountStrategy(double amount, boolean rejectNegative) {
        if (!(amount >= 0.0) || Double.isInfinite(amount)) {
            throw new IllegalArgumentException("Fixed discount must be a non-negative finite amount, got " + amount);
        }
        this.amount = amount;
        this.rejectNegative = rejectNegative;
    }

    @Override
    public String getName() {
        return "fixed";
    }

    @Override
    public Double apply(Double orderAmount) {
        DiscountStrategies.validate(orderAmount, rejectNegative);
        return amount;
    }

    public double getAmount() {
        return amount;
    }

    public boolean isRejectNegative() {
        return rejectNegative;
    }

    @Override
    public String toString() {
        return "FixedDiscountStrategy{amount=" + amount + ", rejectNegative=" + rejectNegative + "}";
    }
}
