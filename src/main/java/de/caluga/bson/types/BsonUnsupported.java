package de.caluga.bson.types;

import de.caluga.bson.BsonUnsupportedValueException;

import java.util.Objects;

/**
 * a host object without an encoding rule. Counts 0 bytes when sizing,
 * encoding it fails.
 **/
public final class BsonUnsupported extends BsonValue {
    private final Object value;

    public BsonUnsupported(Object value) {
        this.value = value;
    }

    public Object getValue() {
        return value;
    }

    public String getTypeName() {
        return value == null ? "null" : value.getClass().getName();
    }

    /**
     * @throws BsonUnsupportedValueException always, there is no wire type
     */
    @Override
    public BsonType getBsonType() {
        throw new BsonUnsupportedValueException("Unhandled Data type: " + getTypeName(), null);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof BsonUnsupported && Objects.equals(((BsonUnsupported) o).value, value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return "BsonUnsupported{" + getTypeName() + '}';
    }
}
