package de.caluga.bson.types;

public final class BsonMaxKey extends BsonValue {
    public static final BsonMaxKey INSTANCE = new BsonMaxKey();

    private BsonMaxKey() {
    }

    @Override
    public BsonType getBsonType() {
        return BsonType.MAX_KEY;
    }

    @Override
    public String toString() {
        return "MaxKey";
    }
}
