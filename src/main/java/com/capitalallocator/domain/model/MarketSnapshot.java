package com.capitalallocator.domain.model;

import com.capitalallocator.domain.enums.RegimeLevel;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Already-fetched market inputs for one symbol, pushed by the market data collaborator.
 * Any field other than symbol and price may be null when the feature pipeline has no value.
 */
@Getter
@ToString
@Builder
public class MarketSnapshot {

    private final String symbol;
    private final BigDecimal price;
    private final BigDecimal atr;

    /** Trailing 20-day average daily traded value, in currency. */
    private final BigDecimal averageDailyValue20;

    private final RegimeLevel volatilityRegime;
    private final RegimeLevel liquidityRegime;

    /** Next (or most recent) earnings/corporate-action date. */
    private final LocalDate nextCorporateEventDate;

    private final String corporateEventType;

    /** When the catalyst behind an event-driven signal happened. */
    private final LocalDateTime catalystTimestamp;

    private final LocalDateTime asOf;
}
