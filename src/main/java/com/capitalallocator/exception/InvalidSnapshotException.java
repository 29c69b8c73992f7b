package com.capitalallocator.exception;

/**
 * A malformed account or mandate snapshot (negative capital, inverted horizon range,
 * out-of-range percentages). The engine refuses to allocate for the account rather
 * than guess.
 */
public class InvalidSnapshotException extends BaseException {

    public InvalidSnapshotException(String message) {
        super(ErrorCode.INVALID_CONFIGURATION, message);
    }
}
