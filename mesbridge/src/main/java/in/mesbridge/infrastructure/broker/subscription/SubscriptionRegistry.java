package in.mesbridge.infrastructure.broker.subscription;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Local record of what the broker believes is subscribed.
 *
 * Entries are added only once the broker acknowledged the subscribe, and removed once it
 * acknowledged the unsubscribe. After a reconnect the registry is replayed as-is, since
 * the new connection starts with no subscriptions. Keyed by symbol, so adding the same
 * symbol twice leaves one entry.
 */
public class SubscriptionRegistry {

    private final Map<String, Subscription> subscriptions = new LinkedHashMap<>();

    /**
     * @return true if the symbol was not registered before
     */
    public synchronized boolean add(Subscription subscription) {
        return subscriptions.put(subscription.symbol(), subscription) == null;
    }

    /**
     * @return true if the symbol was registered
     */
    public synchronized boolean remove(String symbol) {
        return subscriptions.remove(Subscription.normalize(symbol)) != null;
    }

    public synchronized boolean contains(String symbol) {
        return subscriptions.containsKey(Subscription.normalize(symbol));
    }

    /**
     * @return immutable snapshot of subscribed symbols, in subscription order
     */
    public synchronized Set<String> current() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(subscriptions.keySet()));
    }

    /**
     * @return snapshot of the full entries, in subscription order
     */
    public synchronized List<Subscription> snapshot() {
        return List.copyOf(new ArrayList<>(subscriptions.values()));
    }

    public synchronized int size() {
        return subscriptions.size();
    }

    public synchronized void clear() {
        subscriptions.clear();
    }
}
