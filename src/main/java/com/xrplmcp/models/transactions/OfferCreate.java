package com.xrplmcp.models.transactions;

import java.util.List;

import com.xrplmcp.models.AnyOf;
import com.xrplmcp.models.ModelDoc;
import com.xrplmcp.models.ModelField;
import com.xrplmcp.models.ModelValidationException;
import com.xrplmcp.models.amounts.Amounts;
import com.xrplmcp.models.amounts.IssuedCurrencyAmount;

@ModelDoc("Places an offer to exchange currencies in the decentralized exchange.")
public record OfferCreate(
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
    @ModelField("Amount the offer creator receives")
    @AnyOf({IssuedCurrencyAmount.class, String.class}) Object takerGets,
    @ModelField("Amount the offer creator pays")
    @AnyOf({IssuedCurrencyAmount.class, String.class}) Object takerPays,
    @ModelField(value = "Time after which the offer is no longer active, in seconds since the Ripple epoch", defaultValue = "") Long expiration,
    @ModelField(value = "Sequence number of an offer to cancel first", defaultValue = "") Long offerSequence
) implements Transaction {

    public OfferCreate {
        ModelValidationException.check(!(Amounts.isXrp(takerGets) && Amounts.isXrp(takerPays)),
            "An offer cannot exchange XRP for XRP");
    }
}
