package de.caluga.bson.types;

public final class BsonInt64 extends BsonValue {
    private final long value;

    public BsonInt64(long value) {
        this.value = value;
    }

    public long getValue() {
        return value;
    }

    @Override
    public BsonType getBsonType() {
        return BsonType.INT64;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof BsonInt64 && ((BsonInt64) o).value == value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return "BsonInt64{" + value + '}';
    }
}
