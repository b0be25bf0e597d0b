package de.caluga.bson.types;

public final class BsonBoolean extends BsonValue {
    public static final BsonBoolean TRUE = new BsonBoolean(true);
    public static final BsonBoolean FALSE = new BsonBoolean(false);

    private final boolean value;

    private BsonBoolean(boolean value) {
        this.value = value;
    }

    public static BsonBoolean valueOf(boolean b) {
        return b ? TRUE : FALSE;
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public BsonType getBsonType() {
        return BsonType.BOOLEAN;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof BsonBoolean && ((BsonBoolean) o).value == value;
    }

    @Override
    public int hashCode() {
        return Boolean.hashCode(value);
    }

    @Override
    public String toString() {
        return Boolean.toString(value);
    }
}
