package com.xrplmcp.models.transactions;

import java.util.List;

import com.xrplmcp.models.AnyOf;
import com.xrplmcp.models.ModelDoc;
import com.xrplmcp.models.ModelField;
import com.xrplmcp.models.ModelValidationException;
import com.xrplmcp.models.amounts.Amounts;
import com.xrplmcp.models.amounts.IssuedCurrencyAmount;
import com.xrplmcp.models.common.PathStep;

@ModelDoc("Transfers XRP or an issued currency from one account to another.")
public record Payment(
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
    @ModelField("Amount to deliver: XRP drops as a string, or an issued currency amount")
    @AnyOf({IssuedCurrencyAmount.class, String.class}) Object amount,
    @ModelField("Address of the account receiving the payment") String destination,
    @ModelField(value = "Identifies the recipient's reason or hosted user", defaultValue = "") Long destinationTag,
    @ModelField(value = "256-bit hash identifying the reason for the payment", defaultValue = "") String invoiceId,
    @ModelField(value = "Payment paths for cross-currency payments", defaultValue = "") List<List<PathStep>> paths,
    @ModelField(value = "Highest amount of source currency to spend", defaultValue = "")
    @AnyOf({IssuedCurrencyAmount.class, String.class}) Object sendMax,
    @ModelField(value = "Lowest amount to deliver for a partial payment", defaultValue = "")
    @AnyOf({IssuedCurrencyAmount.class, String.class}) Object deliverMin
) implements Transaction {

    public Payment {
        boolean crossCurrency = sendMax != null || (paths != null && !paths.isEmpty());
        ModelValidationException.check(destination == null || crossCurrency || !destination.equals(account),
            "Destination must differ from Account unless the payment is cross-currency");
        ModelValidationException.check(!(Amounts.isXrp(amount) && Amounts.isXrp(sendMax)),
            "SendMax must not be set on an XRP-to-XRP payment");
        ModelValidationException.check(!(Amounts.isXrp(amount) && paths != null && !paths.isEmpty() && sendMax == null),
            "An XRP-to-XRP payment cannot contain paths");
        ModelValidationException.check(!(amount instanceof String drops) || Amounts.isDrops(drops),
            "XRP amounts must be a whole number of drops, got '" + amount + "'");
        ModelValidationException.check(deliverMin == null
                || (flags != null && (flags & PaymentFlag.TF_PARTIAL_PAYMENT.value()) != 0),
            "DeliverMin requires the tfPartialPayment flag");
    }
}
