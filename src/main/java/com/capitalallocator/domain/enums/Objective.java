package com.capitalallocator.domain.enums;

/**
 * The investment objective of an account. Drives signal ranking in
 * {@link com.capitalallocator.allocation.ObjectiveRanker} and regime compatibility
 * in the guardrail checks.
 */
public enum Objective {

    /** Edge-first ranking with the highest tolerance for volatility. */
    MAX_PROFIT,

    /** Confidence-first ranking, penalized by volatility. */
    RISK_MINIMIZED,

    /** Geometric midpoint of the other two. */
    BALANCED
}
