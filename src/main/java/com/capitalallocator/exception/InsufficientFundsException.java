package com.capitalallocator.exception;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Thrown by ledger operations that cannot report insufficient cash through a return
 * value, such as inter-account transfers. Reservations return
 * {@link com.capitalallocator.ledger.ReserveResult#INSUFFICIENT_FUNDS} instead.
 */
public class InsufficientFundsException extends BaseException {

    public InsufficientFundsException(String accountId, BigDecimal requested, BigDecimal available) {
        super(
                ErrorCode.INSUFFICIENT_FUNDS,
                "Insufficient available cash in account " + accountId + ": requested " + requested + ", available "
                        + available,
                Map.of("accountId", accountId, "requested", requested, "available", available));
    }
}
