package in.mesbridge.infrastructure.broker.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Routes push events to the handlers registered for their kind.
 *
 * Handlers run on the read-loop thread, in registration order. Each invocation is
 * isolated: an exception is logged and the remaining handlers still run. Handlers
 * must not block; hand long work off to an executor.
 */
public class EventDispatcher {
    private static final Logger log = LoggerFactory.getLogger(EventDispatcher.class);

    private final Map<EventKind, List<Consumer<InboundEvent>>> handlers;

    public EventDispatcher() {
        Map<EventKind, List<Consumer<InboundEvent>>> table = new EnumMap<>(EventKind.class);
        for (EventKind kind : EventKind.values()) {
            table.put(kind, new CopyOnWriteArrayList<>());
        }
        this.handlers = Collections.unmodifiableMap(table);
    }

    public void register(EventKind kind, Consumer<InboundEvent> handler) {
        if (kind == null || handler == null) {
            throw new IllegalArgumentException("Event kind and handler are required");
        }
        handlers.get(kind).add(handler);
    }

    /**
     * @return true if the handler was registered for this kind
     */
    public boolean unregister(EventKind kind, Consumer<InboundEvent> handler) {
        return handlers.get(kind).remove(handler);
    }

    /**
     * Deliver an event to every handler of its kind.
     *
     * @return number of handlers that completed without throwing
     */
    public int dispatch(InboundEvent event) {
        int delivered = 0;
        for (Consumer<InboundEvent> handler : handlers.get(event.kind())) {
            try {
                handler.accept(event);
                delivered++;
            } catch (Exception e) {
                log.warn("Handler for {} failed (symbol={}): {}", event.kind(), event.symbol(), e.getMessage(), e);
            }
        }
        return delivered;
    }

    public int handlerCount(EventKind kind) {
        return handlers.get(kind).size();
    }
}
