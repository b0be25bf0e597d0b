package de.caluga.bson.types;

/**
 * the BSON element types and the tag byte each one is written with.
 * See <a href="https://bsonspec.org/spec.html">bsonspec.org</a>
 **/
public enum BsonType {
    DOUBLE(0x01),
    STRING(0x02),
    DOCUMENT(0x03),
    ARRAY(0x04),
    BINARY(0x05),
    /**
     * deprecated
     */
    UNDEFINED(0x06),
    OBJECT_ID(0x07),
    BOOLEAN(0x08),
    DATE_TIME(0x09),
    NULL(0x0a),
    REGULAR_EXPRESSION(0x0b),
    /**
     * deprecated, only ever read
     */
    DB_POINTER(0x0c),
    JAVASCRIPT(0x0d),
    /**
     * deprecated
     */
    SYMBOL(0x0e),
    JAVASCRIPT_WITH_SCOPE(0x0f),
    INT32(0x10),
    TIMESTAMP(0x11),
    INT64(0x12),
    DECIMAL128(0x13),
    MIN_KEY(0xff),
    MAX_KEY(0x7f);

    public static final byte END_OF_DOCUMENT = 0x00;

    private static final BsonType[] byTag = new BsonType[256];

    static {
        for (BsonType t : values()) {
            byTag[t.tag & 0xff] = t;
        }
    }

    private final byte tag;

    BsonType(int tag) {
        this.tag = (byte) tag;
    }

    public byte getTag() {
        return tag;
    }

    /**
     * @return the type registered for that tag byte, null if unknown
     */
    public static BsonType forTag(byte tag) {
        return byTag[tag & 0xff];
    }
}
