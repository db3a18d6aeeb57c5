package com.xrplmcp.models.transactions;

import java.util.List;

import com.xrplmcp.models.ModelDoc;
import com.xrplmcp.models.ModelField;
import com.xrplmcp.models.ModelValidationException;

@ModelDoc("Deletes an account and sends its remaining XRP to another account.")
public record AccountDelete(
    @ModelField("The account that sends and signs the transaction") String account,
    @ModelField(value = "Transaction cost in drops of XRP", defaultValue = "") String fee,
    @ModelField(value = "Sequence number of the sending account", defaultValue = "") Long sequence,
    @ModelField(value = "Bit-flags for this transaction", defaultValue = "0") Long flags,
    @ModelField(value = "Highest ledger index this transaction can appear in", defaultValue = "") Long lastLedgerSequence,
    @ModelField(value = "Arbitrary messages attached to the transaction", defaultValue = "") List<Memo> memos,
    @ModelField(value = "Signatures for a multi-signed transaction", defaultValue = "") List<Signer> signers,
    @ModelField(value = "Identifies the sender's reason or hosted user", defaultValue = "") Long sourceTag,
    @ModelField(value = "Ticket to use in place of a sequence number", defaultValue = "") Long ticketSequence,
    @ModelField(value = "Hex public key used to sign the transaction", defaultValue = "") String signingPubKey,
    @ModelField("Account receiving the remaining XRP") String destination,
    @ModelField(value = "Identifies the recipient's reason or hosted user", defaultValue = "") Long destinationTag
) implements Transaction {

    public AccountDelete {
        ModelValidationException.check(destination == null || !destination.equals(account),
            "Destination must differ from Account");
    }
}
