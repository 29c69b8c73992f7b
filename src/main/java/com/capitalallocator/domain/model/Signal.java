package com.capitalallocator.domain.model;

import com.capitalallocator.domain.enums.Direction;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * A ranked trading signal from the signal generator. Immutable.
 *
 * <p>{@code edgeEstimate} is the expected move in percent (4.0 = 4%). A signal with an
 * {@code originatingEventId} is event-driven and goes through the catalyst freshness check.
 */
@Getter
@ToString
@Builder
public class Signal {

    private final String id;
    private final String symbol;
    private final Direction direction;
    private final BigDecimal edgeEstimate;
    private final double confidence;
    private final int horizonDays;
    private final String sector;
    private final String strategy;

    private final String originatingEventId;
    private final LocalDateTime eventTimestamp;

    @Builder.Default
    private final List<PlaybookOverride> overrides = List.of();

    public boolean isEventDriven() {
        return originatingEventId != null;
    }
}
