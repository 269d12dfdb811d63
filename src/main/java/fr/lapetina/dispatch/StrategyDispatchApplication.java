package fr.lapetina.dispatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line entry point.
 *
 * <pre>
 * strategy-dispatch &lt;config.yaml&gt; &lt;amount&gt; [strategy-key]
 * </pre>
 *
 * Without a key the configured default strategy is used.
 */
public final class StrategyDispatchApplication {

    private static final Logger log = LoggerFactory.getLogger(StrategyDispatchApplication.class);

    private StrategyDispatchApplication() {
    }

    /**
     * Processes one amount with the given factory.
     *
     * @return The strategy result, null if a custom strategy produced none
     */
    static Double run(DispatchFactory factory, double amount, String key) {
        Double result = key != null
                ? factory.getKeyedDispatcher().process(key, amount)
                : factory.getDispatcher().process(amount);
        log.info("Processed amount {} with strategy {}: {}",
                amount, key != null ? key : factory.getConfig().getDefaultStrategy(), result);
        return result;
    }

    public static void main(String[] args) {
        if (args.length < 2) {
            System.err.println("Usage: strategy-dispatch <config.yaml> <amount> [strategy-key]");
            System.exit(2);
        }

        try (DispatchFactory factory = DispatchFactory.create(args[0])) {
            double amount = Double.parseDouble(args[1]);
            String key = args.length > 2 ? args[2] : null;
            System.out.println(run(factory, amount, key));
        } catch (Exception e) {
            log.error("Strategy dispatch failed", e);
            System.exit(1);
        }
    }
}
