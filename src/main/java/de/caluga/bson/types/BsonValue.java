package de.caluga.bson.types;

/**
 * a single BSON value. The set of subclasses is closed - the constructor is
 * package private - so sizing, encoding and decoding can switch over
 * {@link #getBsonType()} instead of inspecting host objects again and again.
 * <p>
 * Use {@link BsonValues#toBson(Object)} to categorize plain java objects.
 **/
public abstract class BsonValue {

    BsonValue() {
    }

    /**
     * @return the wire type this value is written as
     */
    public abstract BsonType getBsonType();

    public boolean isDocument() {
        return this instanceof BsonDocument;
    }

    public boolean isArray() {
        return this instanceof BsonArray;
    }

    public boolean isNumber() {
        return this instanceof BsonInt32 || this instanceof BsonInt64 || this instanceof BsonDouble;
    }

    public BsonDocument asDocument() {
        return cast(BsonDocument.class);
    }

    public BsonArray asArray() {
        return cast(BsonArray.class);
    }

    public BsonString asString() {
        return cast(BsonString.class);
    }

    public BsonInt32 asInt32() {
        return cast(BsonInt32.class);
    }

    public BsonInt64 asInt64() {
        return cast(BsonInt64.class);
    }

    public BsonDouble asDouble() {
        return cast(BsonDouble.class);
    }

    public BsonBinary asBinary() {
        return cast(BsonBinary.class);
    }

    private <T extends BsonValue> T cast(Class<T> cls) {
        if (!cls.isInstance(this)) {
            throw new ClassCastException("value of type " + getBsonType() + " is not a " + cls.getSimpleName());
        }

        return cls.cast(this);
    }
}
