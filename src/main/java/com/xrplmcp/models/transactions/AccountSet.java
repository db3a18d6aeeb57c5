package com.xrplmcp.models.transactions;

import java.util.List;
import java.util.Locale;

import com.xrplmcp.models.ModelDoc;
import com.xrplmcp.models.ModelField;
import com.xrplmcp.models.ModelValidationException;

@ModelDoc("Modifies the properties of an account.")
public record AccountSet(
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
    @ModelField(value = "Account flag to disable", defaultValue = "") AccountSetAsfFlag clearFlag,
    @ModelField(value = "Account flag to enable", defaultValue = "") AccountSetAsfFlag setFlag,
    @ModelField(value = "Hex-encoded domain that owns this account", defaultValue = "") String domain,
    @ModelField(value = "Hash of an email address used for a Gravatar image", defaultValue = "") String emailHash,
    @ModelField(value = "Public key for sending encrypted messages to this account", defaultValue = "") String messageKey,
    @ModelField(value = "Fee charged when users transfer this account's tokens, in billionths", defaultValue = "") Long transferRate,
    @ModelField(value = "Tick size for offers involving this account's tokens", defaultValue = "") Integer tickSize,
    @ModelField(value = "Account allowed to mint NFTokens on this account's behalf", defaultValue = "") String nftokenMinter
) implements Transaction {

    public AccountSet {
        ModelValidationException.check(setFlag == null || setFlag != clearFlag,
            "SetFlag and ClearFlag must not name the same flag");
        ModelValidationException.check(tickSize == null || tickSize == 0 || (tickSize >= 3 && tickSize <= 15),
            "TickSize must be 0 or between 3 and 15");
        ModelValidationException.check(transferRate == null || transferRate == 0
                || (transferRate >= 1_000_000_000L && transferRate <= 2_000_000_000L),
            "TransferRate must be 0 or between 1000000000 and 2000000000");
        ModelValidationException.check(domain == null || domain.equals(domain.toLowerCase(Locale.ROOT)),
            "Domain must be lowercase hex");
        ModelValidationException.check(nftokenMinter == null || setFlag == AccountSetAsfFlag.ASF_AUTHORIZED_NFTOKEN_MINTER,
            "NFTokenMinter requires SetFlag ASF_AUTHORIZED_NFTOKEN_MINTER");
    }
}
