package com.flagship.margin_ledger.external;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Balance of one account as the external ledger reports it.
 */
@Value
public class ExternalAccountBalance {
    String accountId;
    BigDecimal netBalance;
    String currency;
}
