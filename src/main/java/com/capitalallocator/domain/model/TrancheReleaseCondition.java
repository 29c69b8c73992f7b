package com.capitalallocator.domain.model;

/**
 * When a staged tranche may be released: {@code delayDays} after the first tranche fills.
 */
public record TrancheReleaseCondition(int delayDays) {}
