package com.xrplmcp.models.requests;

import com.xrplmcp.models.AnyOf;
import com.xrplmcp.models.ModelDoc;
import com.xrplmcp.models.ModelField;
import com.xrplmcp.models.ModelValidationException;

@ModelDoc("Retrieves the transactions that affected an account.")
public record AccountTx(
    @ModelField("Address of the account") String account,
    @ModelField(value = "Earliest ledger to include, -1 for the earliest available", defaultValue = "") Long ledgerIndexMin,
    @ModelField(value = "Latest ledger to include, -1 for the most recent validated", defaultValue = "") Long ledgerIndexMax,
    @ModelField(value = "Single ledger index or shortcut to use", defaultValue = "")
    @AnyOf({LedgerShortcut.class, Long.class}) Object ledgerIndex,
    @ModelField(value = "Return transactions as hex blobs", defaultValue = "false") Boolean binary,
    @ModelField(value = "Return oldest transactions first", defaultValue = "false") Boolean forward,
    @ModelField(value = "Maximum number of transactions to return", defaultValue = "") Integer limit,
    @ModelField(value = "Pagination marker from a previous response", defaultValue = "") Object marker,
    @ModelField(value = "Identifier echoed in the response", defaultValue = "") Object id
) implements Request {

    public AccountTx {
        ModelValidationException.check(ledgerIndexMin == null || ledgerIndexMax == null
                || ledgerIndexMin == -1 || ledgerIndexMax == -1 || ledgerIndexMin <= ledgerIndexMax,
            "LedgerIndexMin must not be greater than LedgerIndexMax");
        ModelValidationException.check(ledgerIndex == null || (ledgerIndexMin == null && ledgerIndexMax == null),
            "LedgerIndex cannot be combined with LedgerIndexMin or LedgerIndexMax");
    }
}
