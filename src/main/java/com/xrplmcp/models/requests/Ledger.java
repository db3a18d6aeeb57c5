package com.xrplmcp.models.requests;

import com.xrplmcp.models.AnyOf;
import com.xrplmcp.models.ModelDoc;
import com.xrplmcp.models.ModelField;

@ModelDoc("Retrieves information about a ledger version.")
public record Ledger(
    @ModelField(value = "Ledger index or shortcut to use", defaultValue = "")
    @AnyOf({LedgerShortcut.class, Long.class}) Object ledgerIndex,
    @ModelField(value = "Hash of the ledger version to use", defaultValue = "") String ledgerHash,
    @ModelField(value = "Return the transactions of the ledger", defaultValue = "false") Boolean transactions,
    @ModelField(value = "Return full transactions instead of hashes", defaultValue = "false") Boolean expand,
    @ModelField(value = "Include owner funds for offer transactions", defaultValue = "false") Boolean ownerFunds,
    @ModelField(value = "Return data as hex blobs", defaultValue = "false") Boolean binary,
    @ModelField(value = "Include the queued transactions", defaultValue = "false") Boolean queue,
    @ModelField(value = "Identifier echoed in the response", defaultValue = "") Object id
) implements Request {
}
