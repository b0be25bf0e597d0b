package de.caluga.bson.types;

public final class BsonNull extends BsonValue {
    public static final BsonNull INSTANCE = new BsonNull();

    private BsonNull() {
    }

    @Override
    public BsonType getBsonType() {
        return BsonType.NULL;
    }

    @Override
    public String toString() {
        return "null";
    }
}
