package com.capitalallocator.domain.enums;

/**
 * Type of a {@link com.capitalallocator.domain.model.CapitalTransaction} ledger entry.
 *
 * <p>Effect of each type on the account's cash buckets:
 * <ul>
 *   <li>DEPOSIT, SIP_CONTRIBUTION, TRANSFER_IN: total capital and available cash increase</li>
 *   <li>TRANSFER_OUT: total capital and available cash decrease</li>
 *   <li>RESERVE: available to reserved</li>
 *   <li>RELEASE: reserved back to available (rejected or expired proposal)</li>
 *   <li>DEPLOY: reserved to deployed (fill)</li>
 *   <li>RETURN: deployed back to available, plus the realized P&L of the close</li>
 * </ul>
 */
public enum TransactionType {
    DEPOSIT,
    RESERVE,
    RELEASE,
    DEPLOY,
    RETURN,
    TRANSFER_IN,
    TRANSFER_OUT,
    SIP_CONTRIBUTION
}
