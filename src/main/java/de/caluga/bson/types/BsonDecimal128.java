package de.caluga.bson.types;

import org.bson.types.Decimal128;

import java.math.BigDecimal;

/**
 * 128bit IEEE 754-2008 decimal, kept as its two 64bit halves. Conversions
 * from and to {@link BigDecimal} are done by {@link Decimal128}.
 **/
public final class BsonDecimal128 extends BsonValue {
    private final long high;
    private final long low;

    public BsonDecimal128(long high, long low) {
        this.high = high;
        this.low = low;
    }

    public static BsonDecimal128 of(BigDecimal value) {
        Decimal128 d = new Decimal128(value);
        return new BsonDecimal128(d.getHigh(), d.getLow());
    }

    public static BsonDecimal128 parse(String value) {
        Decimal128 d = Decimal128.parse(value);
        return new BsonDecimal128(d.getHigh(), d.getLow());
    }

    public long getHigh() {
        return high;
    }

    public long getLow() {
        return low;
    }

    public Decimal128 toDecimal128() {
        return Decimal128.fromIEEE754BIDEncoding(high, low);
    }

    /**
     * @throws ArithmeticException for NaN and infinity
     */
    public BigDecimal toBigDecimal() {
        return toDecimal128().bigDecimalValue();
    }

    @Override
    public BsonType getBsonType() {
        return BsonType.DECIMAL128;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof BsonDecimal128)) {
            return false;
        }

        BsonDecimal128 d = (BsonDecimal128) o;
        return d.high == high && d.low == low;
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(high) + Long.hashCode(low);
    }

    @Override
    public String toString() {
        return "Decimal128(" + toDecimal128() + ")";
    }
}
