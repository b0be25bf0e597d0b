package de.caluga.bson.types;

/**
 * internal mongodb timestamp: seconds in the high 32 bits, an increment in
 * the low 32 bits
 **/
public final class BsonTimestamp extends BsonValue implements Comparable<BsonTimestamp> {
    private final long value;

    public BsonTimestamp(long value) {
        this.value = value;
    }

    public BsonTimestamp(int seconds, int increment) {
        this.value = (long) seconds << 32 | (long) increment & 0xffffffffL;
    }

    public long getValue() {
        return value;
    }

    public int getTime() {
        return (int) (value >> 32);
    }

    public int getInc() {
        return (int) value;
    }

    @Override
    public BsonType getBsonType() {
        return BsonType.TIMESTAMP;
    }

    @Override
    public int compareTo(BsonTimestamp ts) {
        return Long.compareUnsigned(value, ts.value);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof BsonTimestamp && ((BsonTimestamp) o).value == value;
    }

    @Override
    public int hashCode() {
        return (int) (value ^ value >>> 32);
    }

    @Override
    public String toString() {
        return "Timestamp{value=" + value + ", seconds=" + getTime() + ", inc=" + getInc() + '}';
    }
}
