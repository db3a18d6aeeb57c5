package com.xrplmcp.models.requests;

import java.util.Optional;

import com.xrplmcp.models.AnyOf;
import com.xrplmcp.models.ModelDoc;
import com.xrplmcp.models.ModelField;

@ModelDoc("Retrieves information about an account, its activity and its XRP balance.")
public record AccountInfo(
    @ModelField("Address of the account to look up") String account,
    @ModelField(value = "Ledger index or shortcut to use", defaultValue = "")
    @AnyOf({LedgerShortcut.class, Long.class}) Object ledgerIndex,
    @ModelField(value = "Hash of the ledger version to use", defaultValue = "") String ledgerHash,
    @ModelField("Also return queued transactions sent by this account") Optional<Boolean> queue,
    @ModelField("Also return the account's signer lists") Optional<Boolean> signerLists,
    @ModelField(value = "Accept only an address, not a public key or secret", defaultValue = "true") Boolean strict,
    @ModelField(value = "Identifier echoed in the response", defaultValue = "") Object id
) implements Request {

    public AccountInfo {
        queue = queue == null ? Optional.empty() : queue;
        signerLists = signerLists == null ? Optional.empty() : signerLists;
    }
}
