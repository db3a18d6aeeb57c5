package com.xrplmcp.models.transactions;

import java.util.List;

import com.xrplmcp.models.ModelDoc;
import com.xrplmcp.models.ModelField;
import com.xrplmcp.models.ModelValidationException;

@ModelDoc("Sequesters XRP until the escrow is finished or cancelled.")
public record EscrowCreate(
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
    @ModelField("Amount of XRP, in drops, to escrow") String amount,
    @ModelField("Account receiving the escrowed XRP") String destination,
    @ModelField(value = "Identifies the recipient's reason or hosted user", defaultValue = "") Long destinationTag,
    @ModelField(value = "Time after which the escrow can be cancelled, in seconds since the Ripple epoch", defaultValue = "") Long cancelAfter,
    @ModelField(value = "Time after which the escrow can be finished, in seconds since the Ripple epoch", defaultValue = "") Long finishAfter,
    @ModelField(value = "Hex PREIMAGE-SHA-256 crypto-condition", defaultValue = "") String condition
) implements Transaction {

    public EscrowCreate {
        ModelValidationException.check(cancelAfter == null || finishAfter == null || finishAfter < cancelAfter,
            "FinishAfter must be before CancelAfter");
        ModelValidationException.check(finishAfter != null || condition != null,
            "Either FinishAfter or Condition must be specified");
    }
}
