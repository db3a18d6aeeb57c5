package com.xrplmcp.models.transactions;

import java.util.List;

import com.xrplmcp.models.ModelDoc;
import com.xrplmcp.models.ModelField;
import com.xrplmcp.models.ModelValidationException;

@ModelDoc("Mints a non-fungible token.")
public record NFTokenMint(
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
    @ModelField("Taxon grouping related NFTokens of the issuer") Long nftokenTaxon,
    @ModelField(value = "Issuer of the token when minting on another account's behalf", defaultValue = "") String issuer,
    @ModelField(value = "Fee for secondary sales, in units of 1/100000", defaultValue = "") Integer transferFee,
    @ModelField(value = "Hex-encoded URI pointing to the token's data", defaultValue = "") String uri
) implements Transaction {

    public NFTokenMint {
        ModelValidationException.check(issuer == null || !issuer.equals(account),
            "Issuer must not be the same as Account");
        ModelValidationException.check(transferFee == null || (transferFee >= 0 && transferFee <= 50_000),
            "TransferFee must be between 0 and 50000");
        ModelValidationException.check(uri == null || uri.length() <= 512,
            "URI must not be longer than 512 characters");
    }
}
