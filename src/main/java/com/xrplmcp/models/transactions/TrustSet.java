package com.xrplmcp.models.transactions;

import java.util.List;

import com.xrplmcp.models.ModelDoc;
import com.xrplmcp.models.ModelField;
import com.xrplmcp.models.amounts.IssuedCurrencyAmount;

@ModelDoc("Creates or modifies a trust line linking two accounts.")
public record TrustSet(
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
    @ModelField("Limit of the trust line: currency, issuer and maximum value") IssuedCurrencyAmount limitAmount,
    @ModelField(value = "Value incoming balances on this trust line at this ratio, in parts per billion", defaultValue = "") Long qualityIn,
    @ModelField(value = "Value outgoing balances on this trust line at this ratio, in parts per billion", defaultValue = "") Long qualityOut
) implements Transaction {
}
