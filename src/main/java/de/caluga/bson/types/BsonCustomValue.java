package de.caluga.bson.types;

import java.util.Objects;

/**
 * places a {@link BsonConvertible} into a document. The conversion is run
 * each time the value is sized or encoded.
 **/
public final class BsonCustomValue extends BsonValue {
    private final BsonConvertible convertible;

    public BsonCustomValue(BsonConvertible convertible) {
        this.convertible = Objects.requireNonNull(convertible, "convertible must not be null");
    }

    public BsonConvertible getConvertible() {
        return convertible;
    }

    /**
     * runs the conversion. Nested custom values are resolved as well.
     */
    public BsonValue resolve() {
        BsonValue v = convertible.toBson();

        while (v instanceof BsonCustomValue) {
            v = ((BsonCustomValue) v).convertible.toBson();
        }

        return v == null ? BsonNull.INSTANCE : v;
    }

    @Override
    public BsonType getBsonType() {
        return resolve().getBsonType();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof BsonCustomValue && ((BsonCustomValue) o).convertible.equals(convertible);
    }

    @Override
    public int hashCode() {
        return convertible.hashCode();
    }

    @Override
    public String toString() {
        return "BsonCustomValue{" + convertible + '}';
    }
}
