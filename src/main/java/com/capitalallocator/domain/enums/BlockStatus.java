package com.capitalallocator.domain.enums;

public enum BlockStatus {
    OPEN,
    RESOLVED
}
