package de.caluga.bson.types;

public final class BsonInt32 extends BsonValue {
    private final int value;

    public BsonInt32(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    @Override
    public BsonType getBsonType() {
        return BsonType.INT32;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof BsonInt32 && ((BsonInt32) o).value == value;
    }

    @Override
    public int hashCode() {
        return value;
    }

    @Override
    public String toString() {
        return "BsonInt32{" + value + '}';
    }
}
