package com.capitalallocator.exception;

import java.util.Map;

/**
 * A ledger call that breaks the capital state machine contract, e.g. deploying more
 * than is reserved. Indicates a programming error in the caller and is never retried.
 */
public class LedgerContractException extends BaseException {

    public LedgerContractException(String message) {
        super(ErrorCode.LEDGER_CONTRACT_VIOLATION, message);
    }

    public LedgerContractException(String message, Map<String, Object> details) {
        super(ErrorCode.LEDGER_CONTRACT_VIOLATION, message, details);
    }
}
