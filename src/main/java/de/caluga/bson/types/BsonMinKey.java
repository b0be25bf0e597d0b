package de.caluga.bson.types;

public final class BsonMinKey extends BsonValue {
    public static final BsonMinKey INSTANCE = new BsonMinKey();

    private BsonMinKey() {
    }

    @Override
    public BsonType getBsonType() {
        return BsonType.MIN_KEY;
    }

    @Override
    public String toString() {
        return "MinKey";
    }
}
