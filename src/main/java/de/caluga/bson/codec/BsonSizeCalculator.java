package de.caluga.bson.codec;

import de.caluga.bson.BsonDepthLimitException;
import de.caluga.bson.config.EncoderSettings;
import de.caluga.bson.types.*;

import java.util.Map;

/**
 * computes the exact number of bytes a document or array occupies when
 * written by {@link BsonEncoder} with the same settings. Nothing is allocated
 * or written.
 * <p>
 * Sizing is lenient: values without an encoding rule ({@link BsonUnsupported})
 * count 0 bytes instead of failing. The encoder rejects them.
 **/
public class BsonSizeCalculator {
    /**
     * length prefix + terminating 0
     */
    static final int DOCUMENT_OVERHEAD = 4 + 1;

    private final EncoderSettings settings;

    public BsonSizeCalculator() {
        this(new EncoderSettings());
    }

    public BsonSizeCalculator(EncoderSettings settings) {
        this.settings = settings;
    }

    public EncoderSettings getSettings() {
        return settings;
    }

    public int sizeOf(BsonDocument doc) {
        return documentSize(doc, 1);
    }

    public int sizeOf(BsonArray arr) {
        return arraySize(arr, 1);
    }

    public int sizeOf(BsonConvertible root) {
        return sizeOf(new BsonCustomValue(root));
    }

    /**
     * size of a root container. Custom values are converted first; anything
     * that is not a document or array counts 0.
     */
    public int sizeOf(BsonValue root) {
        if (root instanceof BsonCustomValue) {
            root = ((BsonCustomValue) root).resolve();
        }

        if (root instanceof BsonDbRef) {
            return documentSize(((BsonDbRef) root).toDocument(), 1);
        } else if (root instanceof BsonDocument) {
            return documentSize((BsonDocument) root, 1);
        } else if (root instanceof BsonArray) {
            return arraySize((BsonArray) root, 1);
        }

        return 0;
    }

    /**
     * size of one element: tag, name and payload.
     *
     * @param name field name, null for an unnamed element (no name bytes)
     */
    public int elementSize(String name, BsonValue value) {
        return elementSize(name, value, false, 1);
    }

    private int documentSize(BsonDocument doc, int depth) {
        checkDepth(depth);
        int totalLength = DOCUMENT_OVERHEAD;

        for (Map.Entry<String, BsonValue> e : doc) {
            totalLength += elementSize(e.getKey(), e.getValue(), false, depth);
        }

        return totalLength;
    }

    private int arraySize(BsonArray arr, int depth) {
        checkDepth(depth);
        int totalLength = DOCUMENT_OVERHEAD;

        for (int i = 0; i < arr.size(); i++) {
            totalLength += elementSize(Integer.toString(i), arr.get(i), true, depth);
        }

        return totalLength;
    }

    private int elementSize(String name, BsonValue value, boolean inArray, int depth) {
        if (value instanceof BsonCustomValue) {
            value = ((BsonCustomValue) value).resolve();
        }

        if (value instanceof BsonUnsupported) {
            return 0;
        }

        if (value instanceof BsonFunction) {
            if (!settings.isSerializeFunctions()) {
                return 0;
            }

            value = ((BsonFunction) value).toJavaScript();
        }

        int nameSize = name == null ? 0 : utf8Length(name) + 1;

        if (value instanceof BsonUndefined) {
            if (!inArray && settings.isIgnoreUndefined()) {
                return 0;
            }

            //written as null
            return nameSize + 1;
        }

        switch (value.getBsonType()) {
            case STRING:
                return nameSize + 1 + 4 + utf8Length(value.asString().getValue()) + 1;

            case SYMBOL:
                return nameSize + 1 + 4 + utf8Length(((BsonSymbol) value).getSymbol()) + 1;

            case INT32:
                return nameSize + 1 + 4;

            case DOUBLE:
            case INT64:
            case DATE_TIME:
            case TIMESTAMP:
                return nameSize + 1 + 8;

            case BOOLEAN:
                return nameSize + 1 + 1;

            case NULL:
            case MIN_KEY:
            case MAX_KEY:
                return nameSize + 1;

            case OBJECT_ID:
                return nameSize + 1 + BsonObjectId.LENGTH;

            case DECIMAL128:
                return nameSize + 1 + 16;

            case BINARY:
                BsonBinary b = value.asBinary();

                if (b.getSubType() == BsonBinary.SUBTYPE_BYTE_ARRAY) {
                    return nameSize + 1 + 4 + 1 + 4 + b.length();
                }

                return nameSize + 1 + 4 + 1 + b.length();

            case REGULAR_EXPRESSION:
                BsonRegularExpression re = (BsonRegularExpression) value;
                return nameSize + 1 + utf8Length(re.getPattern()) + 1 + utf8Length(re.getOptions()) + 1;

            case JAVASCRIPT:
                return nameSize + 1 + 4 + utf8Length(((BsonJavaScript) value).getCode()) + 1;

            case JAVASCRIPT_WITH_SCOPE:
                BsonJavaScript js = (BsonJavaScript) value;
                return nameSize + 1 + 4 + 4 + utf8Length(js.getCode()) + 1 + documentSize(js.getScope(), depth + 1);

            case DOCUMENT:
                if (value instanceof BsonDbRef) {
                    return nameSize + 1 + documentSize(((BsonDbRef) value).toDocument(), depth + 1);
                }

                return nameSize + 1 + documentSize(value.asDocument(), depth + 1);

            case ARRAY:
                return nameSize + 1 + arraySize(value.asArray(), depth + 1);

            default:
                return 0;
        }
    }

    private void checkDepth(int depth) {
        if (depth > settings.getMaxDepth()) {
            throw new BsonDepthLimitException(settings.getMaxDepth());
        }
    }

    /**
     * number of bytes {@code s.getBytes(UTF_8)} returns, without creating
     * them. Unpaired surrogates are replaced by '?' on encoding and count 1.
     */
    public static int utf8Length(String s) {
        int len = 0;
        int n = s.length();

        for (int i = 0; i < n; i++) {
            char c = s.charAt(i);

            if (c < 0x80) {
                len++;
            } else if (c < 0x800) {
                len += 2;
            } else if (Character.isHighSurrogate(c) && i + 1 < n && Character.isLowSurrogate(s.charAt(i + 1))) {
                len += 4;
                i++;
            } else if (Character.isSurrogate(c)) {
                len++;
            } else {
                len += 3;
            }
        }

        return len;
    }
}
