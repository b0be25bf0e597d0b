package de.caluga.bson.codec;

import de.caluga.bson.BsonDepthLimitException;
import de.caluga.bson.BsonFormatException;
import de.caluga.bson.BsonUtils;
import de.caluga.bson.config.DecoderSettings;
import de.caluga.bson.types.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.function.BiConsumer;

/**
 * decoding BSON into {@link BsonDocument}s.
 * <p>
 * Every length prefix is checked against the boundary of the enclosing
 * document before it is followed, and each document has to end exactly on
 * its 0x00 terminator. Any inconsistency raises a {@link BsonFormatException},
 * partially read documents are never returned.
 **/
public class BsonDecoder {
    private static final Logger log = LoggerFactory.getLogger(BsonDecoder.class);

    private static final int MIN_DOCUMENT_SIZE = 5;
    private static final int DUMP_LIMIT = 256;

    private final DecoderSettings settings;

    public BsonDecoder() {
        this(new DecoderSettings());
    }

    public BsonDecoder(DecoderSettings settings) {
        this.settings = settings;
    }

    public static BsonDocument decodeDocument(byte[] in) {
        return new BsonDecoder().decode(in);
    }

    public DecoderSettings getSettings() {
        return settings;
    }

    /**
     * @param input anything {@link BsonBuffers#ensureBuffer(Object)} accepts
     */
    public BsonDocument decode(Object input) {
        ByteBuffer in = BsonBuffers.ensureBuffer(input);

        try {
            int size = readDocumentLength(in, 0);

            if (!settings.isAllowObjectSmallerThanBufferSize() && in.limit() != size) {
                throw new BsonFormatException("buffer length " + in.limit() + " must be === bson size " + size, 0);
            }

            BsonDocument ret = new BsonDocument();
            readInto(in, 0, in.limit(), 1, ret::put);
            return ret;
        } catch (BsonFormatException e) {
            if (log.isDebugEnabled()) {
                log.debug("could not decode document: {}\n{}", e.getMessage(), BsonUtils.getHex(head(in), DUMP_LIMIT));
            }

            throw e;
        }
    }

    /**
     * decodes documents written back to back.
     *
     * @param startIndex         index of the first document
     * @param numberOfDocuments  how many documents to read
     * @param target             decoded documents are added here
     * @return index after the last document read
     */
    public int decodeStream(Object input, int startIndex, int numberOfDocuments, List<BsonDocument> target) {
        ByteBuffer in = BsonBuffers.ensureBuffer(input);
        int index = startIndex;

        for (int i = 0; i < numberOfDocuments; i++) {
            int size = readDocumentLength(in, index);
            BsonDocument doc = new BsonDocument();
            readInto(in, index, in.limit(), 1, doc::put);
            target.add(doc);
            index += size;
        }

        return index;
    }

    private int readDocumentLength(ByteBuffer in, int index) {
        if (index < 0 || in.limit() - index < 4) {
            throw new BsonFormatException("buffer too short to hold a document length", index);
        }

        int size = in.getInt(index);

        if (size < MIN_DOCUMENT_SIZE) {
            throw new BsonFormatException("bson size must be >= " + MIN_DOCUMENT_SIZE + ", is " + size, index);
        }

        if (size > in.limit() - index) {
            throw new BsonFormatException("bson size " + size + " exceeds the " + (in.limit() - index) + " bytes left in buffer", index);
        }

        return size;
    }

    /**
     * reads the elements of the document starting at start and hands them to
     * the sink.
     *
     * @param boundary index the document must end before (exclusive)
     * @return size of the document in bytes
     */
    private int readInto(ByteBuffer in, int start, int boundary, int depth, BiConsumer<String, BsonValue> sink) {
        if (depth > settings.getMaxDepth()) {
            throw new BsonDepthLimitException(settings.getMaxDepth());
        }

        if (boundary - start < 4) {
            throw new BsonFormatException("document length exceeds boundary", start);
        }

        int size = in.getInt(start);

        if (size < MIN_DOCUMENT_SIZE || size > boundary - start) {
            throw new BsonFormatException("bad embedded document length " + size, start);
        }

        int end = start + size;

        if (in.get(end - 1) != BsonType.END_OF_DOCUMENT) {
            throw new BsonFormatException("document is not terminated by 0x00", end - 1);
        }

        //elements have to end before the terminator
        int limit = end - 1;
        int idx = start + 4;

        while (true) {
            byte tag = in.get(idx++);

            if (tag == BsonType.END_OF_DOCUMENT) {
                break;
            }

            int nameEnd = indexOfNul(in, idx, limit);

            if (nameEnd < 0) {
                throw new BsonFormatException("field name is not terminated before end of document", idx);
            }

            String name = utf8(in, idx, nameEnd - idx);
            idx = nameEnd + 1;
            BsonType type = BsonType.forTag(tag);

            if (type == null) {
                throw new BsonFormatException("Detected unknown BSON type 0x" + BsonUtils.getHex(tag) + " for fieldname \"" + name + "\"", idx);
            }

            BsonValue value;

            switch (type) {
                case DOUBLE:
                    need(idx, 8, limit);
                    value = new BsonDouble(in.getDouble(idx));
                    idx += 8;
                    break;

                case STRING:
                    value = new BsonString(readString(in, idx, limit));
                    idx += 4 + in.getInt(idx);
                    break;

                case DOCUMENT:
                    BsonDocument doc = new BsonDocument();
                    idx += readInto(in, idx, limit, depth + 1, doc::put);
                    value = settings.isPromoteDbRefs() && BsonDbRef.isDbRefLike(doc) ? BsonDbRef.fromDocument(doc) : doc;
                    break;

                case ARRAY:
                    BsonArray arr = new BsonArray();
                    idx += readInto(in, idx, limit, depth + 1, (k, v) -> arr.add(v));
                    value = arr;
                    break;

                case BINARY:
                    need(idx, 5, limit);
                    int binarySize = in.getInt(idx);
                    byte subType = in.get(idx + 4);

                    if (binarySize < 0) {
                        throw new BsonFormatException("Negative binary type element size found", idx);
                    }

                    if (binarySize > limit - idx - 5) {
                        throw new BsonFormatException("Binary type size larger than document size", idx);
                    }

                    if (subType == BsonBinary.SUBTYPE_BYTE_ARRAY) {
                        if (binarySize < 4) {
                            throw new BsonFormatException("Binary type with subtype 0x02 is missing its inner size", idx);
                        }

                        int inner = in.getInt(idx + 5);

                        if (inner < 0) {
                            throw new BsonFormatException("Negative binary type element size found for subtype 0x02", idx);
                        }

                        if (inner > binarySize - 4) {
                            throw new BsonFormatException("Binary type with subtype 0x02 contains too long binary size", idx);
                        }

                        if (inner < binarySize - 4) {
                            throw new BsonFormatException("Binary type with subtype 0x02 contains too short binary size", idx);
                        }

                        value = new BsonBinary(subType, bytes(in, idx + 9, inner));
                    } else {
                        value = new BsonBinary(subType, bytes(in, idx + 5, binarySize));
                    }

                    idx += 5 + binarySize;
                    break;

                case UNDEFINED:
                    log.debug("deprecated type undefined in field {}", name);
                    value = BsonUndefined.INSTANCE;
                    break;

                case OBJECT_ID:
                    need(idx, BsonObjectId.LENGTH, limit);
                    value = new BsonObjectId(bytes(in, idx, BsonObjectId.LENGTH));
                    idx += BsonObjectId.LENGTH;
                    break;

                case BOOLEAN:
                    need(idx, 1, limit);
                    byte b = in.get(idx++);

                    if (b != 0 && b != 1) {
                        throw new BsonFormatException("illegal boolean type value " + b, idx - 1);
                    }

                    value = BsonBoolean.valueOf(b == 1);
                    break;

                case DATE_TIME:
                    need(idx, 8, limit);
                    value = new BsonDateTime(in.getLong(idx));
                    idx += 8;
                    break;

                case NULL:
                    value = BsonNull.INSTANCE;
                    break;

                case REGULAR_EXPRESSION:
                    int patternEnd = indexOfNul(in, idx, limit);

                    if (patternEnd < 0) {
                        throw new BsonFormatException("regex pattern is not terminated", idx);
                    }

                    String pattern = utf8(in, idx, patternEnd - idx);
                    idx = patternEnd + 1;
                    int optionsEnd = indexOfNul(in, idx, limit);

                    if (optionsEnd < 0) {
                        throw new BsonFormatException("regex options are not terminated", idx);
                    }

                    String options = utf8(in, idx, optionsEnd - idx);
                    idx = optionsEnd + 1;
                    value = new BsonRegularExpression(pattern, options);
                    break;

                case DB_POINTER:
                    log.debug("deprecated type dbpointer in field {}", name);
                    String namespace = readString(in, idx, limit);
                    idx += 4 + in.getInt(idx);
                    need(idx, BsonObjectId.LENGTH, limit);
                    value = new BsonDbRef(namespace, new BsonObjectId(bytes(in, idx, BsonObjectId.LENGTH)));
                    idx += BsonObjectId.LENGTH;
                    break;

                case JAVASCRIPT:
                    value = new BsonJavaScript(readString(in, idx, limit));
                    idx += 4 + in.getInt(idx);
                    break;

                case SYMBOL:
                    log.debug("deprecated type symbol in field {}", name);
                    value = new BsonSymbol(readString(in, idx, limit));
                    idx += 4 + in.getInt(idx);
                    break;

                case JAVASCRIPT_WITH_SCOPE:
                    value = readCodeWithScope(in, idx, limit, depth);
                    idx += in.getInt(idx);
                    break;

                case INT32:
                    need(idx, 4, limit);
                    value = new BsonInt32(in.getInt(idx));
                    idx += 4;
                    break;

                case TIMESTAMP:
                    need(idx, 8, limit);
                    value = new BsonTimestamp(in.getLong(idx));
                    idx += 8;
                    break;

                case INT64:
                    need(idx, 8, limit);
                    value = new BsonInt64(in.getLong(idx));
                    idx += 8;
                    break;

                case DECIMAL128:
                    need(idx, 16, limit);
                    long low = in.getLong(idx);
                    long high = in.getLong(idx + 8);
                    value = new BsonDecimal128(high, low);
                    idx += 16;
                    break;

                case MIN_KEY:
                    value = BsonMinKey.INSTANCE;
                    break;

                case MAX_KEY:
                    value = BsonMaxKey.INSTANCE;
                    break;

                default:
                    throw new BsonFormatException("Detected unknown BSON type " + type + " for fieldname \"" + name + "\"", idx);
            }

            if (idx > limit) {
                throw new BsonFormatException("element " + name + " runs into the document terminator", idx);
            }

            sink.accept(name, value);
        }

        if (idx != end) {
            throw new BsonFormatException("corrupt bson - document of " + size + " bytes ends at offset " + (idx - start), idx);
        }

        return size;
    }

    /**
     * int32 total | string code | document scope - the total has to match
     * the parts exactly
     */
    private BsonJavaScript readCodeWithScope(ByteBuffer in, int idx, int limit, int depth) {
        need(idx, 4, limit);
        int totalSize = in.getInt(idx);

        if (totalSize < 4 + 4 + 1 + MIN_DOCUMENT_SIZE) {
            throw new BsonFormatException("code_w_scope total size shorter minimum expected length", idx);
        }

        if (totalSize > limit - idx) {
            throw new BsonFormatException("code_w_scope total size exceeds document", idx);
        }

        int codeEnd = idx + totalSize;
        String code = readString(in, idx + 4, codeEnd);
        int stringSize = in.getInt(idx + 4);
        BsonDocument scope = new BsonDocument();
        int scopeSize = readInto(in, idx + 8 + stringSize, codeEnd, depth + 1, scope::put);

        if (4 + 4 + stringSize + scopeSize != totalSize) {
            throw new BsonFormatException("code_w_scope total size " + totalSize + " does not match its contents", idx);
        }

        return new BsonJavaScript(code, scope);
    }

    /**
     * length prefixed, 0 terminated string that has to end before limit
     */
    private String readString(ByteBuffer in, int idx, int limit) {
        need(idx, 4, limit);
        int stringSize = in.getInt(idx);

        if (stringSize <= 0 || stringSize > limit - idx - 4 || in.get(idx + 4 + stringSize - 1) != 0) {
            throw new BsonFormatException("bad string length in bson", idx);
        }

        return utf8(in, idx + 4, stringSize - 1);
    }

    private String utf8(ByteBuffer in, int idx, int len) {
        if (settings.isValidateUtf8()) {
            try {
                return StandardCharsets.UTF_8.newDecoder()
                                             .onMalformedInput(CodingErrorAction.REPORT)
                                             .onUnmappableCharacter(CodingErrorAction.REPORT)
                                             .decode(in.duplicate().limit(idx + len).position(idx))
                                             .toString();
            } catch (CharacterCodingException e) {
                throw new BsonFormatException("Invalid UTF-8 string in BSON document", idx, e);
            }
        }

        if (in.hasArray()) {
            return new String(in.array(), in.arrayOffset() + idx, len, StandardCharsets.UTF_8);
        }

        return new String(bytes(in, idx, len), StandardCharsets.UTF_8);
    }

    private static byte[] bytes(ByteBuffer in, int idx, int len) {
        byte[] ret = new byte[len];
        in.get(idx, ret);
        return ret;
    }

    private static int indexOfNul(ByteBuffer in, int from, int limit) {
        for (int i = from; i < limit; i++) {
            if (in.get(i) == 0) {
                return i;
            }
        }

        return -1;
    }

    private static void need(int idx, int len, int limit) {
        if (limit - idx < len) {
            throw new BsonFormatException("value of " + len + " bytes exceeds document boundary", idx);
        }
    }

    private static byte[] head(ByteBuffer in) {
        return bytes(in, 0, Math.min(in.limit(), DUMP_LIMIT));
    }
}
