package com.xrplmcp.mcp.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.xrplmcp.mcp.normalize.FieldNames;
import com.xrplmcp.models.BaseModel;
import com.xrplmcp.models.ModelField;
import com.xrplmcp.models.amounts.IssuedCurrencyAmount;
import com.xrplmcp.models.common.Response;
import com.xrplmcp.models.requests.AccountInfo;
import com.xrplmcp.models.transactions.AccountSet;
import com.xrplmcp.models.transactions.AccountSetAsfFlag;
import com.xrplmcp.models.transactions.Memo;
import com.xrplmcp.models.transactions.NFTokenMint;
import com.xrplmcp.models.transactions.Payment;

class SchemaExtractorTest {

    public record Node(
        @ModelField(value = "label", defaultValue = "") String label,
        @ModelField(value = "next node", defaultValue = "") Node next
    ) implements BaseModel {
    }

    public record Hollow() implements BaseModel {
    }

    public static final class NotARecord implements BaseModel {
    }

    public record Unannotated(String name) implements BaseModel {
    }

    private SchemaExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new SchemaExtractor();
    }

    private static FieldSchema field(final List<FieldSchema> fields, final String name) {
        return fields.stream().filter(f -> f.name().equals(name)).findFirst().orElseThrow();
    }

    @Test
    void testExtract_DeclarationOrder() {
        final List<FieldSchema> fields = extractor.extract(IssuedCurrencyAmount.class);
        assertEquals(List.of("currency", "issuer", "value"), fields.stream().map(FieldSchema::name).toList());
        assertEquals(List.of("Currency", "Issuer", "Value"), fields.stream().map(FieldSchema::key).toList());
    }

    @Test
    void testExtract_RequiredAndDefaults() {
        final List<FieldSchema> fields = extractor.extract(Payment.class);

        assertTrue(field(fields, "account").required());
        assertTrue(field(fields, "amount").required());
        assertTrue(field(fields, "destination").required());
        assertFalse(field(fields, "fee").required());
        assertNull(field(fields, "fee").defaultValue());
        assertEquals("0", field(fields, "flags").defaultValue());
        assertEquals("Address of the account receiving the payment", field(fields, "destination").description());
    }

    @Test
    void testExtract_UnionRecordsCandidatesInOrder() {
        final FieldType amount = field(extractor.extract(Payment.class), "amount").type();

        assertEquals(FieldKind.UNION, amount.kind());
        assertEquals(FieldKind.MODEL, amount.candidates().get(0).kind());
        assertEquals(IssuedCurrencyAmount.class, amount.candidates().get(0).javaType());
        assertEquals(ScalarType.STRING, amount.candidates().get(1).scalar());
        assertEquals("IssuedCurrencyAmount | string", amount.describe());
    }

    @Test
    void testExtract_SequencesOfModels() {
        final List<FieldSchema> fields = extractor.extract(Payment.class);

        final FieldType memos = field(fields, "memos").type();
        assertEquals(FieldKind.SEQUENCE, memos.kind());
        assertEquals(Memo.class, memos.element().javaType());
        assertEquals("list<Memo>", memos.describe());
        assertEquals("list<list<PathStep>>", field(fields, "paths").type().describe());
    }

    @Test
    void testExtract_EnumLegalValues() {
        final FieldType setFlag = field(extractor.extract(AccountSet.class), "set_flag").type();

        assertEquals(FieldKind.ENUM, setFlag.kind());
        assertEquals(AccountSetAsfFlag.values().length, setFlag.enumValues().size());
        assertTrue(setFlag.enumValues().contains("ASF_DEPOSIT_AUTH"));
        assertEquals(AccountSetAsfFlag.ASF_DEPOSIT_AUTH, setFlag.matchEnum(9).orElseThrow().constant());
        assertEquals(AccountSetAsfFlag.ASF_DEPOSIT_AUTH, setFlag.matchEnum("asf_deposit_auth").orElseThrow().constant());
        assertTrue(setFlag.matchEnum(11).isEmpty());
    }

    @Test
    void testExtract_OptionalWrapperIsOptional() {
        final FieldSchema queue = field(extractor.extract(AccountInfo.class), "queue");

        assertFalse(queue.required());
        assertEquals(ScalarType.BOOLEAN, queue.type().scalar());
    }

    @Test
    void testExtract_MapDegradesToOpaque() {
        final List<FieldSchema> fields = extractor.extract(Response.class);

        assertEquals(FieldKind.OPAQUE, field(fields, "result").type().kind());
        assertEquals(FieldKind.ENUM, field(fields, "status").type().kind());
    }

    @Test
    void testExtract_LedgerAbbreviationsInKeys() {
        final List<FieldSchema> fields = extractor.extract(NFTokenMint.class);
        assertEquals("NFTokenTaxon", field(fields, "nftoken_taxon").key());
        assertEquals("URI", field(fields, "uri").key());
        assertEquals("nftokenTaxon", field(fields, "nftoken_taxon").javaName());
    }

    @Test
    void testExtract_SelfReferenceDegradesToOpaque() {
        final FieldType next = field(extractor.extract(Node.class), "next").type();
        assertEquals(FieldKind.OPAQUE, next.kind());
    }

    @Test
    void testExtract_UnannotatedComponentIsRequired() {
        assertTrue(extractor.extract(Unannotated.class).get(0).required());
    }

    @Test
    void testExtract_NoFieldsThrows() {
        assertThrows(SchemaException.class, () -> extractor.extract(Hollow.class));
        final SchemaException e = assertThrows(SchemaException.class, () -> extractor.extract(NotARecord.class));
        assertEquals(NotARecord.class, e.getModelClass());
    }

    @Test
    void testExtract_IsCached() {
        assertSame(extractor.extract(Payment.class), extractor.extract(Payment.class));
    }

    @Test
    void testExtract_IsIdempotentAcrossExtractors() {
        assertEquals(extractor.extract(Payment.class), new SchemaExtractor().extract(Payment.class));
    }

    @Test
    void testExtract_KeysAreDistinctAndRoundTrip() {
        for (final ModelModule module : LedgerModules.all()) {
            for (final Class<?> definition : module.definitions()) {
                if (!ToolRegistry.isModelDefinition(definition)) continue;
                final List<FieldSchema> fields = extractor.extract(definition);
                final Set<String> keys = new HashSet<>();
                for (final FieldSchema f : fields) {
                    assertTrue(keys.add(f.key()), definition.getSimpleName() + " repeats key " + f.key());
                    assertEquals(f.key(), FieldNames.toLedgerKey(f.name()));
                }
            }
        }
    }
}
