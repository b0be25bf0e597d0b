package de.caluga.bson.types;

/**
 * 64bit IEEE 754 floating point. Equality is based on the bit pattern
 * ({@link Double#compare(double, double)}), so NaN equals NaN.
 **/
public final class BsonDouble extends BsonValue {
    private final double value;

    public BsonDouble(double value) {
        this.value = value;
    }

    public double getValue() {
        return value;
    }

    @Override
    public BsonType getBsonType() {
        return BsonType.DOUBLE;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof BsonDouble && Double.compare(((BsonDouble) o).value, value) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(value);
    }

    @Override
    public String toString() {
        return "BsonDouble{" + value + '}';
    }
}
