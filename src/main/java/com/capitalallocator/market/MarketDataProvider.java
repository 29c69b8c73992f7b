package com.capitalallocator.market;

import com.capitalallocator.domain.model.MarketSnapshot;
import java.util.Optional;

/**
 * Source of already-fetched market inputs. The allocator never fetches prices itself; the
 * feature pipeline pushes snapshots into an implementation of this port.
 */
public interface MarketDataProvider {

    Optional<MarketSnapshot> getSnapshot(String symbol);
}
