package de.caluga.bson.codec;

import de.caluga.bson.BsonDepthLimitException;
import de.caluga.bson.BsonException;
import de.caluga.bson.BsonUnsupportedValueException;
import de.caluga.bson.BsonUtils;
import de.caluga.bson.config.EncoderSettings;
import de.caluga.bson.types.*;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("codec")
public class BsonEncoderTest {
    private static final Logger log = LoggerFactory.getLogger(BsonEncoderTest.class);

    @Test
    public void stringDocumentBytes() {
        byte[] bytes = BsonEncoder.encodeDocument(BsonDocument.of("a", "hello"));
        log.info("\n" + BsonUtils.getHex(bytes));

        assertThat(bytes).containsExactly(0x12, 0, 0, 0,
                                          0x02, 'a', 0,
                                          6, 0, 0, 0, 'h', 'e', 'l', 'l', 'o', 0,
                                          0);
    }

    @Test
    public void int32Bytes() {
        byte[] bytes = BsonEncoder.encodeDocument(BsonDocument.of("i", 1));
        assertThat(bytes).containsExactly(0x0c, 0, 0, 0, 0x10, 'i', 0, 1, 0, 0, 0, 0);
    }

    @Test
    public void numberWidthDecidesTheTag() {
        byte[] small = BsonEncoder.encodeDocument(BsonDocument.of("n", BsonValues.number(2147483647d)));
        assertThat(small).hasSize(5 + 3 + 4);
        assertThat(small[4]).isEqualTo(BsonType.INT32.getTag());

        byte[] large = BsonEncoder.encodeDocument(BsonDocument.of("n", BsonValues.number(2147483648d)));
        assertThat(large).hasSize(5 + 3 + 8);
        assertThat(large[4]).isEqualTo(BsonType.DOUBLE.getTag());
        assertThat(ByteBuffer.wrap(large, 7, 8).order(ByteOrder.LITTLE_ENDIAN).getDouble()).isEqualTo(2147483648d);

        byte[] pi = BsonEncoder.encodeDocument(BsonDocument.of("n", BsonValues.number(3.14)));
        assertThat(pi).hasSize(5 + 3 + 8);
        assertThat(pi[4]).isEqualTo(BsonType.DOUBLE.getTag());
    }

    @Test
    public void legacyBinaryHasInnerLength() {
        byte[] bytes = BsonEncoder.encodeDocument(BsonDocument.of("b", new BsonBinary(BsonBinary.SUBTYPE_BYTE_ARRAY, new byte[] {1, 2, 3})));
        assertThat(bytes).containsExactly(20, 0, 0, 0,
                                          0x05, 'b', 0,
                                          7, 0, 0, 0,
                                          0x02,
                                          3, 0, 0, 0,
                                          1, 2, 3,
                                          0);
    }

    @Test
    public void timestampIncrementIsWrittenFirst() {
        byte[] bytes = BsonEncoder.encodeDocument(BsonDocument.of("t", new BsonTimestamp(2, 1)));
        assertThat(Arrays.copyOfRange(bytes, 7, 15)).containsExactly(1, 0, 0, 0, 2, 0, 0, 0);
    }

    @Test
    public void undefinedIsWrittenAsNull() {
        byte[] bytes = BsonEncoder.encodeDocument(BsonDocument.of("u", BsonUndefined.INSTANCE));
        assertThat(bytes).containsExactly(8, 0, 0, 0, 0x0a, 'u', 0, 0);

        byte[] dropped = new BsonEncoder(new EncoderSettings().setIgnoreUndefined(true)).serialize(BsonDocument.of("u", BsonUndefined.INSTANCE));
        assertThat(dropped).containsExactly(5, 0, 0, 0, 0);
    }

    @Test
    public void regexOptionsAreSorted() {
        byte[] bytes = BsonEncoder.encodeDocument(BsonDocument.of("r", new BsonRegularExpression("a", "xmi")));
        assertThat(bytes).containsExactly(14, 0, 0, 0, 0x0b, 'r', 0, 'a', 0, 'i', 'm', 'x', 0, 0);
    }

    @Test
    public void codeWithScopeLayout() {
        byte[] bytes = BsonEncoder.encodeDocument(BsonDocument.of("c", new BsonJavaScript("x", BsonDocument.of("a", 1))));
        ByteBuffer in = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);

        assertThat(bytes[4]).isEqualTo(BsonType.JAVASCRIPT_WITH_SCOPE.getTag());
        //total length covers itself, the string and the scope
        assertThat(in.getInt(7)).isEqualTo(4 + 4 + 2 + 12);
        assertThat(in.getInt(11)).isEqualTo(2);
        assertThat(in.getInt(17)).isEqualTo(12);
    }

    @Test
    public void dbRefIsWrittenAsDocument() {
        BsonDbRef ref = new BsonDbRef("coll", new BsonInt32(5), "db", BsonDocument.of("x", 1));
        byte[] asRef = BsonEncoder.encodeDocument(BsonDocument.of("r", ref));
        byte[] asDoc = BsonEncoder.encodeDocument(BsonDocument.of("r", ref.toDocument()));
        assertThat(asRef).isEqualTo(asDoc);
        assertThat(ref.toDocument().keySet()).containsExactly("$ref", "$id", "x", "$db");
    }

    @Test
    public void functionsAreSkippedUnlessEnabled() {
        BsonDocument doc = BsonDocument.of("f", new BsonFunction("function  (a) { return a; }"), "x", 1);
        assertThat(BsonEncoder.encodeDocument(doc)).isEqualTo(BsonEncoder.encodeDocument(BsonDocument.of("x", 1)));

        byte[] bytes = new BsonEncoder(new EncoderSettings().setSerializeFunctions(true)).serialize(doc);
        BsonDocument decoded = BsonDecoder.decodeDocument(bytes);
        assertThat(decoded.get("f")).isEqualTo(new BsonJavaScript("function (a) { return a; }"));
    }

    @Test
    public void customValuesAreConvertedBeforeEncoding() {
        BsonConvertible money = () -> BsonDocument.of("amount", 5, "currency", "EUR");
        byte[] bytes = BsonEncoder.encodeDocument(BsonDocument.of("price", money));
        assertThat(bytes).isEqualTo(BsonEncoder.encodeDocument(BsonDocument.of("price", BsonDocument.of("amount", 5, "currency", "EUR"))));
        assertThat(new BsonEncoder().serialize(new BsonCustomValue(money))).isEqualTo(BsonEncoder.encodeDocument((BsonDocument) money.toBson()));
    }

    @Test
    public void unsupportedValuesFail() {
        BsonDocument doc = BsonDocument.of("thread", Thread.currentThread());
        assertThat(new BsonSizeCalculator().sizeOf(doc)).isEqualTo(5);
        assertThatThrownBy(() -> BsonEncoder.encodeDocument(doc))
            .isInstanceOf(BsonUnsupportedValueException.class)
            .hasMessageContaining("thread");
    }

    @Test
    public void rootMustBeAContainer() {
        assertThatThrownBy(() -> new BsonEncoder().serialize(new BsonInt32(1))).isInstanceOf(BsonUnsupportedValueException.class);
    }

    @Test
    public void nullBytesInNamesAreRejected() {
        assertThatThrownBy(() -> BsonEncoder.encodeDocument(BsonDocument.of("a\0b", 1)))
            .isInstanceOf(BsonException.class)
            .hasMessageContaining("null bytes");
        assertThatThrownBy(() -> BsonEncoder.encodeDocument(BsonDocument.of("r", new BsonRegularExpression("a\0", ""))))
            .isInstanceOf(BsonException.class);
    }

    @Test
    public void checkKeys() {
        BsonEncoder checking = new BsonEncoder(new EncoderSettings().setCheckKeys(true));
        assertThatThrownBy(() -> checking.serialize(BsonDocument.of("$set", 1))).isInstanceOf(BsonException.class);
        assertThatThrownBy(() -> checking.serialize(BsonDocument.of("sub", BsonDocument.of("a.b", 1)))).isInstanceOf(BsonException.class);
        //db refs carry $ keys by definition
        assertThat(checking.serialize(BsonDocument.of("r", new BsonDbRef("c", new BsonInt32(1))))).isNotEmpty();
        assertThat(BsonEncoder.encodeDocument(BsonDocument.of("$set", 1))).isNotEmpty();
    }

    @Test
    public void encodeAtIndex() {
        BsonDocument doc = BsonDocument.of("a", "hello");
        byte[] buffer = new byte[30];
        int end = new BsonEncoder().encode(doc, buffer, 5);

        assertThat(end).isEqualTo(5 + 18);
        assertThat(Arrays.copyOfRange(buffer, 5, end)).isEqualTo(BsonEncoder.encodeDocument(doc));
        assertThat(Arrays.copyOfRange(buffer, 0, 5)).containsOnly(0);
    }

    @Test
    public void encodeLeavesBufferPositionAlone() {
        ByteBuffer buffer = ByteBuffer.allocate(64);
        new BsonEncoder().encode(BsonDocument.of("a", 1), buffer, 0);
        assertThat(buffer.position()).isEqualTo(0);
        assertThat(buffer.get(0)).isEqualTo((byte) 12);
    }

    @Test
    public void bufferTooSmall() {
        BsonDocument doc = BsonDocument.of("a", "hello");
        assertThatThrownBy(() -> new BsonEncoder().encode(doc, new byte[17], 0))
            .isInstanceOf(BsonException.class)
            .hasMessageContaining("buffer too small");
        assertThatThrownBy(() -> new BsonEncoder().encode(doc, new byte[20], 3))
            .isInstanceOf(BsonException.class);
    }

    @Test
    public void depthLimit() {
        BsonEncoder limited = new BsonEncoder(new EncoderSettings().setMaxDepth(5));
        assertThat(limited.serialize(BsonSizeCalculatorTest.nested(5))).isNotEmpty();
        assertThatThrownBy(() -> limited.serialize(BsonSizeCalculatorTest.nested(6))).isInstanceOf(BsonDepthLimitException.class);
    }

    static Stream<Arguments> settingsAndDocuments() {
        BsonDocument withHostValues = TestDocuments.allTypes();
        withHostValues.put("undefined", BsonUndefined.INSTANCE);
        withHostValues.put("undefinedInArray", BsonArray.of(1, BsonUndefined.INSTANCE, 3));
        withHostValues.put("function", new BsonFunction("function(){ return this.x; }"));
        withHostValues.put("scopedFunction", new BsonFunction("function(){ return y; }", BsonDocument.of("y", 2)));
        withHostValues.put("custom", new BsonCustomValue(() -> BsonArray.of(1, "two")));

        return Stream.of(
                   Arguments.of(new EncoderSettings(), TestDocuments.allTypes()),
                   Arguments.of(new EncoderSettings(), withHostValues),
                   Arguments.of(new EncoderSettings().setIgnoreUndefined(true), withHostValues),
                   Arguments.of(new EncoderSettings().setSerializeFunctions(true), withHostValues),
                   Arguments.of(new EncoderSettings().setSerializeFunctions(true).setIgnoreUndefined(true), withHostValues),
                   Arguments.of(new EncoderSettings(), new BsonDocument())
               );
    }

    @ParameterizedTest
    @MethodSource("settingsAndDocuments")
    public void calculatedSizeMatchesWrittenBytes(EncoderSettings settings, BsonDocument doc) {
        BsonEncoder encoder = new BsonEncoder(settings);
        int size = new BsonSizeCalculator(settings).sizeOf(doc);
        byte[] bytes = encoder.serialize(doc);

        assertThat(bytes).hasSize(size);
        assertThat(ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN).getInt(0)).isEqualTo(size);
        assertThat(bytes[bytes.length - 1]).isEqualTo((byte) 0);
    }
}
