package in.mesbridge.infrastructure.broker.subscription;

import java.util.List;
import java.util.Locale;

/**
 * An acknowledged market-data subscription.
 *
 * @param symbol normalized (trimmed, upper-case) symbol
 * @param dataTypes requested data types, e.g. {@code quotes}, {@code trades}
 */
public record Subscription(String symbol, List<String> dataTypes) {

    public Subscription {
        symbol = normalize(symbol);
        dataTypes = dataTypes == null ? List.of() : List.copyOf(dataTypes);
    }

    public static String normalize(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Symbol cannot be empty");
        }
        return symbol.trim().toUpperCase(Locale.ROOT);
    }
}
