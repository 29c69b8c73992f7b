package com.capitalallocator.domain.enums;

public enum ReservationStatus {
    PENDING,
    DEPLOYED,
    RELEASED,
    EXPIRED
}
