package de.caluga.bson.codec;

import de.caluga.bson.BsonDepthLimitException;
import de.caluga.bson.BsonException;
import de.caluga.bson.BsonUnsupportedValueException;
import de.caluga.bson.config.EncoderSettings;
import de.caluga.bson.types.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * encoding BSON documents into a pre-sized buffer.
 * <p>
 * The output size is computed with {@link BsonSizeCalculator} first, the
 * encoder then walks the tree again and writes through an explicit index.
 * Unlike sizing, encoding fails for values without an encoding rule.
 * All numbers are written little endian.
 **/
public class BsonEncoder {
    private static final Logger log = LoggerFactory.getLogger(BsonEncoder.class);

    private final EncoderSettings settings;
    private final BsonSizeCalculator calculator;

    public BsonEncoder() {
        this(new EncoderSettings());
    }

    public BsonEncoder(EncoderSettings settings) {
        this.settings = settings;
        this.calculator = new BsonSizeCalculator(settings);
    }

    public static byte[] encodeDocument(BsonDocument doc) {
        return new BsonEncoder().serialize(doc);
    }

    public EncoderSettings getSettings() {
        return settings;
    }

    public BsonSizeCalculator getCalculator() {
        return calculator;
    }

    /**
     * @param root document, array, db ref or a custom value converting to one of those
     * @return exactly sized byte array holding the encoded root
     */
    public byte[] serialize(BsonValue root) {
        BsonValue r = resolveRoot(root);
        byte[] ret = new byte[calculator.sizeOf(r)];
        encode(r, ByteBuffer.wrap(ret), 0);
        return ret;
    }

    public int encode(BsonValue root, byte[] destination, int index) {
        return encode(root, ByteBuffer.wrap(destination), index);
    }

    /**
     * writes the root into the destination starting at the given absolute
     * index. The position of the destination is not touched.
     *
     * @return the index after the last byte written
     * @throws BsonException if the destination has not enough room left
     */
    public int encode(BsonValue root, ByteBuffer destination, int index) {
        BsonValue r = resolveRoot(root);
        int size = calculator.sizeOf(r);

        if (index < 0 || destination.limit() - index < size) {
            throw new BsonException("buffer too small - document needs " + size + " bytes at index " + index + " but buffer limit is " + destination.limit());
        }

        ByteBuffer out = destination.duplicate().order(ByteOrder.LITTLE_ENDIAN);
        int end;

        if (r instanceof BsonArray) {
            end = writeArray(out, (BsonArray) r, index, 1, settings.isCheckKeys());
        } else if (r instanceof BsonDbRef) {
            end = writeDocument(out, ((BsonDbRef) r).toDocument(), index, 1, false);
        } else {
            end = writeDocument(out, (BsonDocument) r, index, 1, settings.isCheckKeys());
        }

        if (end - index != size) {
            throw new BsonException("size mismatch - calculated " + size + " bytes but wrote " + (end - index));
        }

        return end;
    }

    private BsonValue resolveRoot(BsonValue root) {
        if (root instanceof BsonCustomValue) {
            root = ((BsonCustomValue) root).resolve();
        }

        if (root instanceof BsonDocument || root instanceof BsonArray || root instanceof BsonDbRef) {
            return root;
        }

        throw new BsonUnsupportedValueException("only documents and arrays can be encoded, got " + (root == null ? "null" : root.getClass().getSimpleName()), null);
    }

    private int writeDocument(ByteBuffer out, BsonDocument doc, int idx, int depth, boolean checkKeys) {
        checkDepth(depth);
        int start = idx;
        idx += 4;

        for (Map.Entry<String, BsonValue> e : doc) {
            if (checkKeys) {
                validateKey(e.getKey());
            }

            idx = writeElement(out, e.getKey(), e.getValue(), idx, false, depth, checkKeys);
        }

        out.put(idx++, BsonType.END_OF_DOCUMENT);
        out.putInt(start, idx - start);
        return idx;
    }

    private int writeArray(ByteBuffer out, BsonArray arr, int idx, int depth, boolean checkKeys) {
        checkDepth(depth);
        int start = idx;
        idx += 4;

        for (int i = 0; i < arr.size(); i++) {
            idx = writeElement(out, Integer.toString(i), arr.get(i), idx, true, depth, checkKeys);
        }

        out.put(idx++, BsonType.END_OF_DOCUMENT);
        out.putInt(start, idx - start);
        return idx;
    }

    private int writeElement(ByteBuffer out, String n, BsonValue v, int idx, boolean inArray, int depth, boolean checkKeys) {
        if (v instanceof BsonCustomValue) {
            v = ((BsonCustomValue) v).resolve();
        }

        if (v instanceof BsonUnsupported) {
            throw new BsonUnsupportedValueException("Unhandled Data type: " + ((BsonUnsupported) v).getTypeName() + " in field " + n, n);
        }

        if (v instanceof BsonFunction) {
            if (!settings.isSerializeFunctions()) {
                log.debug("skipping function in field {}", n);
                return idx;
            }

            v = ((BsonFunction) v).toJavaScript();
        }

        if (v instanceof BsonUndefined) {
            if (!inArray && settings.isIgnoreUndefined()) {
                return idx;
            }

            idx = writeByte(out, idx, BsonType.NULL.getTag());
            return cString(out, idx, n);
        }

        BsonType type = v.getBsonType();
        idx = writeByte(out, idx, type.getTag());
        idx = cString(out, idx, n);

        switch (type) {
            case DOUBLE:
                out.putDouble(idx, v.asDouble().getValue());
                return idx + 8;

            case STRING:
                return string(out, idx, v.asString().getValue());

            case SYMBOL:
                return string(out, idx, ((BsonSymbol) v).getSymbol());

            case DOCUMENT:
                if (v instanceof BsonDbRef) {
                    return writeDocument(out, ((BsonDbRef) v).toDocument(), idx, depth + 1, false);
                }

                return writeDocument(out, v.asDocument(), idx, depth + 1, checkKeys);

            case ARRAY:
                return writeArray(out, v.asArray(), idx, depth + 1, checkKeys);

            case BINARY:
                BsonBinary b = v.asBinary();
                byte[] data = b.getData();

                if (b.getSubType() == BsonBinary.SUBTYPE_BYTE_ARRAY) {
                    out.putInt(idx, data.length + 4);
                    idx = writeByte(out, idx + 4, b.getSubType());
                    out.putInt(idx, data.length);
                    idx += 4;
                } else {
                    out.putInt(idx, data.length);
                    idx = writeByte(out, idx + 4, b.getSubType());
                }

                return writeBytes(out, idx, data);

            case OBJECT_ID:
                return writeBytes(out, idx, ((BsonObjectId) v).getBytes());

            case BOOLEAN:
                return writeByte(out, idx, ((BsonBoolean) v).getValue() ? (byte) 1 : (byte) 0);

            case DATE_TIME:
                out.putLong(idx, ((BsonDateTime) v).getMillis());
                return idx + 8;

            case NULL:
            case MIN_KEY:
            case MAX_KEY:
                return idx;

            case REGULAR_EXPRESSION:
                BsonRegularExpression re = (BsonRegularExpression) v;
                idx = cString(out, idx, re.getPattern());
                return cString(out, idx, re.getOptions());

            case JAVASCRIPT:
                return string(out, idx, ((BsonJavaScript) v).getCode());

            case JAVASCRIPT_WITH_SCOPE:
                //total length | code string | scope document
                BsonJavaScript js = (BsonJavaScript) v;
                int start = idx;
                idx = string(out, idx + 4, js.getCode());
                idx = writeDocument(out, js.getScope(), idx, depth + 1, checkKeys);
                out.putInt(start, idx - start);
                return idx;

            case INT32:
                out.putInt(idx, v.asInt32().getValue());
                return idx + 4;

            case TIMESTAMP:
                out.putLong(idx, ((BsonTimestamp) v).getValue());
                return idx + 8;

            case INT64:
                out.putLong(idx, v.asInt64().getValue());
                return idx + 8;

            case DECIMAL128:
                BsonDecimal128 d = (BsonDecimal128) v;
                out.putLong(idx, d.getLow());
                out.putLong(idx + 8, d.getHigh());
                return idx + 16;

            default:
                throw new BsonUnsupportedValueException("cannot encode values of type " + type + " in field " + n, n);
        }
    }

    private void checkDepth(int depth) {
        if (depth > settings.getMaxDepth()) {
            throw new BsonDepthLimitException(settings.getMaxDepth());
        }
    }

    private static void validateKey(String key) {
        if (key.startsWith("$")) {
            throw new BsonException("key " + key + " must not start with '$'");
        }

        if (key.contains(".")) {
            throw new BsonException("key " + key + " must not contain '.'");
        }
    }

    private static int string(ByteBuffer out, int idx, String s) {
        byte[] b = s.getBytes(StandardCharsets.UTF_8);
        out.putInt(idx, b.length + 1);
        idx = writeBytes(out, idx + 4, b);
        return writeByte(out, idx, (byte) 0);
    }

    private static int cString(ByteBuffer out, int idx, String s) {
        byte[] b = s.getBytes(StandardCharsets.UTF_8);

        for (byte by : b) {
            if (by == 0) {
                throw new BsonException("'" + s.replace("\0", "\\0") + "' must not contain null bytes");
            }
        }

        idx = writeBytes(out, idx, b);
        return writeByte(out, idx, (byte) 0);
    }

    private static int writeBytes(ByteBuffer out, int idx, byte[] data) {
        out.put(idx, data);
        return idx + data.length;
    }

    private static int writeByte(ByteBuffer out, int idx, byte v) {
        out.put(idx, v);
        return idx + 1;
    }
}
