package de.caluga.bson.types;

import java.util.Objects;

public final class BsonString extends BsonValue {
    private final String value;

    public BsonString(String value) {
        this.value = Objects.requireNonNull(value, "string value must not be null");
    }

    public String getValue() {
        return value;
    }

    @Override
    public BsonType getBsonType() {
        return BsonType.STRING;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof BsonString && ((BsonString) o).value.equals(value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return '"' + value + '"';
    }
}
