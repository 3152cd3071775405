package com.flagship.fiscal_ledger.journal;

/**
 * DRAFT entries are editable bookkeeping proposals; POSTED entries are final and
 * the only ones that reach the ledger. There is no transition back to DRAFT.
 */
public enum JournalStatus {
    DRAFT,
    POSTED
}
