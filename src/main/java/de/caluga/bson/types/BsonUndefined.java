package de.caluga.bson.types;

/**
 * deprecated undefined value. Written as null unless dropped by
 * {@code ignoreUndefined} inside a document.
 **/
public final class BsonUndefined extends BsonValue {
    public static final BsonUndefined INSTANCE = new BsonUndefined();

    private BsonUndefined() {
    }

    @Override
    public BsonType getBsonType() {
        return BsonType.UNDEFINED;
    }

    @Override
    public String toString() {
        return "undefined";
    }
}
