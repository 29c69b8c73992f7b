package com.capitalallocator.domain.enums;

public enum Direction {
    LONG,
    SHORT
}
