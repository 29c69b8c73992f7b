package com.capitalallocator.domain.enums;

/**
 * Classified volatility or liquidity regime for a symbol, supplied by the market data
 * collaborator.
 */
public enum RegimeLevel {
    LOW,
    MEDIUM,
    HIGH
}
