package com.xrplmcp.models.requests;

import com.xrplmcp.models.AnyOf;
import com.xrplmcp.models.ModelDoc;
import com.xrplmcp.models.ModelField;

@ModelDoc("Retrieves the ledger objects owned by an account.")
public record AccountObjects(
    @ModelField("Address of the owning account") String account,
    @ModelField(value = "Ledger index or shortcut to use", defaultValue = "")
    @AnyOf({LedgerShortcut.class, Long.class}) Object ledgerIndex,
    @ModelField(value = "Hash of the ledger version to use", defaultValue = "") String ledgerHash,
    @ModelField(value = "Only return objects of this type", defaultValue = "") AccountObjectType type,
    @ModelField(value = "Only return objects that would block deleting the account", defaultValue = "false") Boolean deletionBlockersOnly,
    @ModelField(value = "Maximum number of objects to return", defaultValue = "") Integer limit,
    @ModelField(value = "Pagination marker from a previous response", defaultValue = "") Object marker,
    @ModelField(value = "Identifier echoed in the response", defaultValue = "") Object id
) implements Request {
}
