package com.capitalallocator.domain.enums;

public enum PositionStatus {
    OPEN,
    CLOSED
}
