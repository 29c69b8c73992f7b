package com.capitalallocator.market;

import com.capitalallocator.domain.model.MarketSnapshot;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * In-memory latest-snapshot store, keyed by upper-cased symbol. Collaborators call
 * {@link #update} as new features arrive; a newer snapshot replaces the older one.
 */
@Component
public class SnapshotMarketDataProvider implements MarketDataProvider {

    private static final Logger log = LoggerFactory.getLogger(SnapshotMarketDataProvider.class);

    private final Map<String, MarketSnapshot> snapshots = new ConcurrentHashMap<>();

    public void update(MarketSnapshot snapshot) {
        if (snapshot.getSymbol() == null || snapshot.getPrice() == null || snapshot.getPrice().signum() <= 0) {
            log.warn("Ignoring snapshot without symbol or positive price: {}", snapshot);
            return;
        }
        snapshots.merge(key(snapshot.getSymbol()), snapshot, (current, incoming) -> isOlder(incoming, current)
                ? current
                : incoming);
    }

    @Override
    public Optional<MarketSnapshot> getSnapshot(String symbol) {
        if (symbol == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(snapshots.get(key(symbol)));
    }

    public void clear() {
        snapshots.clear();
    }

    private static boolean isOlder(MarketSnapshot incoming, MarketSnapshot current) {
        return incoming.getAsOf() != null
                && current.getAsOf() != null
                && incoming.getAsOf().isBefore(current.getAsOf());
    }

    private static String key(String symbol) {
        return symbol.toUpperCase();
    }
}
