package com.flagship.fiscal_ledger.period;

import lombok.Value;

/**
 * Result of one atomic counter increment: the prefix and the value the counter
 * now holds.
 */
@Value
public class IssuedNumber {
    String prefix;
    long counter;

    public String format() {
        return DocumentType.format(prefix, counter);
    }
}
