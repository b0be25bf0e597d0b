package de.caluga.bson.codec;

import de.caluga.bson.BsonDepthLimitException;
import de.caluga.bson.BsonFormatException;
import de.caluga.bson.config.DecoderSettings;
import de.caluga.bson.types.*;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("codec")
public class BsonDecoderTest {

    private static byte[] bytes(int... values) {
        byte[] ret = new byte[values.length];

        for (int i = 0; i < values.length; i++) {
            ret[i] = (byte) values[i];
        }

        return ret;
    }

    private static byte[] patchInt(byte[] data, int index, int value) {
        byte[] ret = data.clone();
        ByteBuffer.wrap(ret).order(ByteOrder.LITTLE_ENDIAN).putInt(index, value);
        return ret;
    }

    @Test
    public void decodeAllTypes() {
        BsonDocument doc = TestDocuments.allTypes();
        BsonDocument decoded = BsonDecoder.decodeDocument(BsonEncoder.encodeDocument(doc));

        assertThat(decoded).isEqualTo(doc);
        assertThat(decoded.keySet()).containsExactlyElementsOf(doc.keySet());
        assertThat(decoded.get("ref")).isInstanceOf(BsonDbRef.class);
        assertThat(decoded.get("legacyBinary").asBinary().getData()).containsExactly(9, 8, 7);
    }

    @Test
    public void simpleDocument() {
        BsonDocument doc = BsonDecoder.decodeDocument(bytes(0x12, 0, 0, 0, 0x02, 'a', 0, 6, 0, 0, 0, 'h', 'e', 'l', 'l', 'o', 0, 0));
        assertThat(doc.size()).isEqualTo(1);
        assertThat(doc.get("a").asString().getValue()).isEqualTo("hello");
    }

    @Test
    public void emptyDocument() {
        assertThat(BsonDecoder.decodeDocument(bytes(5, 0, 0, 0, 0))).isEmpty();
    }

    @Test
    public void undefinedIsDecoded() {
        BsonDocument doc = BsonDecoder.decodeDocument(bytes(8, 0, 0, 0, 0x06, 'u', 0, 0));
        assertThat(doc.get("u")).isSameAs(BsonUndefined.INSTANCE);
    }

    @Test
    public void arrayKeysAreIgnored() {
        //{"a": ["x" -> 1, "y" -> 2]} with non index keys
        byte[] data = bytes(27, 0, 0, 0,
                            0x04, 'a', 0,
                            19, 0, 0, 0,
                            0x10, 'x', 0, 1, 0, 0, 0,
                            0x10, 'y', 0, 2, 0, 0, 0,
                            0,
                            0);
        BsonDocument doc = BsonDecoder.decodeDocument(data);
        assertThat(doc.get("a").asArray().getValues()).containsExactly(new BsonInt32(1), new BsonInt32(2));
    }

    @Test
    public void decodeFromByteBufferWithOffset() {
        byte[] encoded = BsonEncoder.encodeDocument(BsonDocument.of("x", 42));
        ByteBuffer buffer = ByteBuffer.allocate(encoded.length + 3);
        buffer.position(3);
        buffer.put(encoded);
        buffer.position(3);

        assertThat(new BsonDecoder().decode(buffer)).isEqualTo(BsonDocument.of("x", 42));
    }

    @Test
    public void tooShortForLength() {
        assertThatThrownBy(() -> BsonDecoder.decodeDocument(bytes(1, 0)))
            .isInstanceOf(BsonFormatException.class)
            .hasMessageContaining("too short");
    }

    @Test
    public void sizeBelowMinimum() {
        assertThatThrownBy(() -> BsonDecoder.decodeDocument(bytes(4, 0, 0, 0)))
            .isInstanceOf(BsonFormatException.class)
            .hasMessageContaining("bson size must be >= 5");
    }

    @Test
    public void truncatedBuffer() {
        byte[] encoded = BsonEncoder.encodeDocument(BsonDocument.of("a", "hello"));
        assertThatThrownBy(() -> BsonDecoder.decodeDocument(Arrays.copyOf(encoded, 10)))
            .isInstanceOf(BsonFormatException.class)
            .hasMessageContaining("exceeds");
    }

    @Test
    public void missingTerminator() {
        assertThatThrownBy(() -> BsonDecoder.decodeDocument(bytes(5, 0, 0, 0, 1)))
            .isInstanceOf(BsonFormatException.class)
            .hasMessageContaining("not terminated by 0x00");
    }

    @Test
    public void unknownType() {
        assertThatThrownBy(() -> BsonDecoder.decodeDocument(bytes(8, 0, 0, 0, 0x14, 'a', 0, 0)))
            .isInstanceOf(BsonFormatException.class)
            .hasMessageContaining("unknown BSON type 0x14")
            .hasMessageContaining("\"a\"");
    }

    @Test
    public void unterminatedFieldName() {
        assertThatThrownBy(() -> BsonDecoder.decodeDocument(bytes(8, 0, 0, 0, 0x0a, 'a', 'b', 0)))
            .isInstanceOf(BsonFormatException.class)
            .hasMessageContaining("field name");
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1, 7, 100})
    public void badStringLength(int length) {
        byte[] encoded = BsonEncoder.encodeDocument(BsonDocument.of("a", "hello"));
        assertThatThrownBy(() -> BsonDecoder.decodeDocument(patchInt(encoded, 7, length)))
            .isInstanceOf(BsonFormatException.class)
            .hasMessageContaining("bad string length");
    }

    @Test
    public void stringWithoutNul() {
        byte[] encoded = BsonEncoder.encodeDocument(BsonDocument.of("a", "hello"));
        encoded[16] = 'x';
        assertThatThrownBy(() -> BsonDecoder.decodeDocument(encoded))
            .isInstanceOf(BsonFormatException.class)
            .hasMessageContaining("bad string length");
    }

    @Test
    public void illegalBoolean() {
        assertThatThrownBy(() -> BsonDecoder.decodeDocument(bytes(9, 0, 0, 0, 0x08, 'b', 0, 2, 0)))
            .isInstanceOf(BsonFormatException.class)
            .hasMessageContaining("illegal boolean");
    }

    @Test
    public void valueCrossingTheBoundary() {
        //int64 announced, only 4 bytes left
        assertThatThrownBy(() -> BsonDecoder.decodeDocument(bytes(12, 0, 0, 0, 0x12, 'l', 0, 1, 0, 0, 0, 0)))
            .isInstanceOf(BsonFormatException.class)
            .extracting("offset")
            .isEqualTo(7);
    }

    @Test
    public void documentEndingEarly() {
        //inner document claims 5 bytes, the outer one has 2 more before its terminator
        byte[] data = bytes(15, 0, 0, 0,
                            0x03, 'd', 0,
                            5, 0, 0, 0, 0,
                            0x7f, 0,
                            0);
        assertThat(BsonDecoder.decodeDocument(data).keySet()).containsExactly("d", "");

        byte[] broken = bytes(14, 0, 0, 0,
                              0x03, 'd', 0,
                              5, 0, 0, 0, 0,
                              0, 0);
        assertThatThrownBy(() -> BsonDecoder.decodeDocument(broken)).isInstanceOf(BsonFormatException.class);
    }

    @Test
    public void embeddedDocumentLongerThanParent() {
        byte[] encoded = BsonEncoder.encodeDocument(BsonDocument.of("d", BsonDocument.of("x", 1)));
        assertThatThrownBy(() -> BsonDecoder.decodeDocument(patchInt(encoded, 7, 40)))
            .isInstanceOf(BsonFormatException.class)
            .hasMessageContaining("bad embedded document length");
    }

    @Test
    public void binarySizeChecks() {
        byte[] encoded = BsonEncoder.encodeDocument(BsonDocument.of("b", new BsonBinary(BsonBinary.SUBTYPE_BYTE_ARRAY, new byte[] {1, 2, 3})));

        assertThatThrownBy(() -> BsonDecoder.decodeDocument(patchInt(encoded, 7, -1)))
            .isInstanceOf(BsonFormatException.class)
            .hasMessageContaining("Negative binary type element size");
        assertThatThrownBy(() -> BsonDecoder.decodeDocument(patchInt(encoded, 7, 100)))
            .isInstanceOf(BsonFormatException.class)
            .hasMessageContaining("larger than document size");
        assertThatThrownBy(() -> BsonDecoder.decodeDocument(patchInt(encoded, 12, 4)))
            .isInstanceOf(BsonFormatException.class)
            .hasMessageContaining("too long binary size");
        assertThatThrownBy(() -> BsonDecoder.decodeDocument(patchInt(encoded, 12, 2)))
            .isInstanceOf(BsonFormatException.class)
            .hasMessageContaining("too short binary size");
    }

    @Test
    public void codeWithScopeChecks() {
        byte[] encoded = BsonEncoder.encodeDocument(BsonDocument.of("c", new BsonJavaScript("x", BsonDocument.of("a", 1))));
        BsonJavaScript js = (BsonJavaScript) BsonDecoder.decodeDocument(encoded).get("c");
        assertThat(js.getCode()).isEqualTo("x");
        assertThat(js.getScope()).isEqualTo(BsonDocument.of("a", 1));

        assertThatThrownBy(() -> BsonDecoder.decodeDocument(patchInt(encoded, 7, 13)))
            .isInstanceOf(BsonFormatException.class)
            .hasMessageContaining("shorter minimum");
        assertThatThrownBy(() -> BsonDecoder.decodeDocument(patchInt(encoded, 7, 200)))
            .isInstanceOf(BsonFormatException.class)
            .hasMessageContaining("exceeds document");
        assertThatThrownBy(() -> BsonDecoder.decodeDocument(patchInt(encoded, 7, 21)))
            .isInstanceOf(BsonFormatException.class);
    }

    @Test
    public void dbPointerBecomesDbRef() {
        BsonObjectId oid = BsonObjectId.fromHex("5f1d7a4e8c3b2a1908f7e6d5");
        byte[] ns = "db.coll".getBytes(StandardCharsets.UTF_8);
        ByteBuffer buf = ByteBuffer.allocate(4 + 3 + 4 + ns.length + 1 + 12 + 1).order(ByteOrder.LITTLE_ENDIAN);
        buf.putInt(buf.capacity());
        buf.put((byte) 0x0c).put((byte) 'p').put((byte) 0);
        buf.putInt(ns.length + 1).put(ns).put((byte) 0);
        buf.put(oid.getBytes());
        buf.put((byte) 0);

        BsonValue p = BsonDecoder.decodeDocument(buf.array()).get("p");
        assertThat(p).isEqualTo(new BsonDbRef("db.coll", oid));
    }

    @Test
    public void dbRefPromotion() {
        BsonDocument refShape = new BsonDocument();
        refShape.put("$ref", new BsonString("coll"));
        refShape.put("$id", new BsonInt32(3));
        byte[] encoded = BsonEncoder.encodeDocument(BsonDocument.of("r", refShape));

        assertThat(BsonDecoder.decodeDocument(encoded).get("r")).isEqualTo(new BsonDbRef("coll", new BsonInt32(3)));
        assertThat(new BsonDecoder(new DecoderSettings().setPromoteDbRefs(false)).decode(encoded).get("r")).isEqualTo(refShape);

        //the root document stays a document
        assertThat(BsonDecoder.decodeDocument(BsonEncoder.encodeDocument(refShape))).isEqualTo(refShape);

        BsonDocument noId = BsonDocument.of("$ref", "coll");
        assertThat(BsonDecoder.decodeDocument(BsonEncoder.encodeDocument(BsonDocument.of("r", noId))).get("r")).isEqualTo(noId);

        BsonDocument numericDb = BsonDocument.of("$ref", "coll", "$id", 1, "$db", 5);
        assertThat(BsonDecoder.decodeDocument(BsonEncoder.encodeDocument(BsonDocument.of("r", numericDb))).get("r")).isEqualTo(numericDb);
    }

    @Test
    public void invalidUtf8() {
        byte[] data = bytes(14, 0, 0, 0, 0x02, 's', 0, 2, 0, 0, 0, 0xff, 0, 0);

        assertThatThrownBy(() -> BsonDecoder.decodeDocument(data))
            .isInstanceOf(BsonFormatException.class)
            .hasMessageContaining("Invalid UTF-8");

        BsonDocument lenient = new BsonDecoder(new DecoderSettings().setValidateUtf8(false)).decode(data);
        assertThat(lenient.get("s").asString().getValue()).isEqualTo("\uFFFD");
    }

    @Test
    public void trailingBytes() {
        byte[] encoded = BsonEncoder.encodeDocument(BsonDocument.of("x", 1));
        byte[] padded = Arrays.copyOf(encoded, encoded.length + 8);

        assertThat(BsonDecoder.decodeDocument(padded)).isEqualTo(BsonDocument.of("x", 1));
        assertThatThrownBy(() -> new BsonDecoder(new DecoderSettings().setAllowObjectSmallerThanBufferSize(false)).decode(padded))
            .isInstanceOf(BsonFormatException.class)
            .hasMessageContaining("must be === bson size");
        assertThat(new BsonDecoder(new DecoderSettings().setAllowObjectSmallerThanBufferSize(false)).decode(encoded)).isEqualTo(BsonDocument.of("x", 1));
    }

    @Test
    public void depthLimit() {
        BsonDecoder limited = new BsonDecoder(new DecoderSettings().setMaxDepth(5));
        assertThat(limited.decode(BsonEncoder.encodeDocument(BsonSizeCalculatorTest.nested(5)))).isEqualTo(BsonSizeCalculatorTest.nested(5));
        assertThatThrownBy(() -> limited.decode(BsonEncoder.encodeDocument(BsonSizeCalculatorTest.nested(6))))
            .isInstanceOf(BsonDepthLimitException.class)
            .extracting("maxDepth")
            .isEqualTo(5);
    }

    @Test
    public void stream() {
        byte[] first = BsonEncoder.encodeDocument(BsonDocument.of("n", 1));
        byte[] second = BsonEncoder.encodeDocument(BsonDocument.of("n", "two"));
        ByteBuffer all = ByteBuffer.allocate(3 + first.length + second.length + 5);
        all.put(new byte[] {9, 9, 9}).put(first).put(second);

        List<BsonDocument> result = new ArrayList<>();
        int next = new BsonDecoder().decodeStream(all.array(), 3, 2, result);

        assertThat(next).isEqualTo(3 + first.length + second.length);
        assertThat(result).containsExactly(BsonDocument.of("n", 1), BsonDocument.of("n", "two"));

        List<BsonDocument> tooMany = new ArrayList<>();
        assertThatThrownBy(() -> new BsonDecoder().decodeStream(all.array(), 3, 3, tooMany)).isInstanceOf(BsonFormatException.class);
    }
}
