package com.xrplmcp.models.transactions;

import com.xrplmcp.models.BaseModel;
import com.xrplmcp.models.ModelDoc;
import com.xrplmcp.models.ModelField;

@ModelDoc("One signature of a multi-signed transaction.")
public record Signer(
    @ModelField("Address of the signing account") String account,
    @ModelField("Signature over the transaction") String txnSignature,
    @ModelField("Public key used to create the signature") String signingPubKey
) implements BaseModel {
}
