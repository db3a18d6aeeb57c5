package com.xrplmcp.models.requests;

import com.xrplmcp.models.AnyOf;
import com.xrplmcp.models.ModelDoc;
import com.xrplmcp.models.ModelField;
import com.xrplmcp.models.ModelValidationException;

@ModelDoc("Retrieves the trust lines of an account.")
public record AccountLines(
    @ModelField("Address of the account whose trust lines to list") String account,
    @ModelField(value = "Ledger index or shortcut to use", defaultValue = "")
    @AnyOf({LedgerShortcut.class, Long.class}) Object ledgerIndex,
    @ModelField(value = "Hash of the ledger version to use", defaultValue = "") String ledgerHash,
    @ModelField(value = "Only return trust lines shared with this counterparty", defaultValue = "") String peer,
    @ModelField(value = "Maximum number of trust lines to return", defaultValue = "") Integer limit,
    @ModelField(value = "Pagination marker from a previous response", defaultValue = "") Object marker,
    @ModelField(value = "Identifier echoed in the response", defaultValue = "") Object id
) implements Request {

    public AccountLines {
        ModelValidationException.check(limit == null || (limit >= 10 && limit <= 400),
            "Limit must be between 10 and 400");
    }
}
