package com.flagship.fiscal_ledger.period;

import com.flagship.fiscal_ledger.exception.ValidationException;

import java.util.Locale;

/**
 * Business documents numbered per fiscal period. Each type has its own code
 * (the first segment of the number) and its own counter column.
 */
public enum DocumentType {
    INVOICE("INV", "last_invoice_num", "invoice_prefix"),
    PURCHASE("PUR", "last_purchase_num", "purchase_prefix"),
    VOUCHER("JV", "last_voucher_num", "voucher_prefix");

    private static final int COUNTER_WIDTH = 4;

    private final String code;
    private final String counterColumn;
    private final String prefixColumn;

    DocumentType(String code, String counterColumn, String prefixColumn) {
        this.code = code;
        this.counterColumn = counterColumn;
        this.prefixColumn = prefixColumn;
    }

    public String getCode() {
        return code;
    }

    String counterColumn() {
        return counterColumn;
    }

    String prefixColumn() {
        return prefixColumn;
    }

    /**
     * {@code INV-8283-} for year code {@code 8283}.
     */
    public String prefixFor(String yearCode) {
        return code + "-" + yearCode + "-";
    }

    /**
     * {@code INV-8283-0001}. Counters beyond 9999 simply widen.
     */
    public static String format(String prefix, long counter) {
        return prefix + String.format(Locale.ROOT, "%0" + COUNTER_WIDTH + "d", counter);
    }

    public static DocumentType fromPath(String value) {
        if (value != null) {
            String normalized = value.trim().toUpperCase(Locale.ROOT);
            for (DocumentType type : values()) {
                if (type.name().equals(normalized) || type.code.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new ValidationException("Unknown document type: " + value);
    }
}
