package de.caluga.bson.types;

import java.time.Instant;
import java.util.Date;

/**
 * UTC datetime, milliseconds since the epoch
 **/
public final class BsonDateTime extends BsonValue {
    private final long millis;

    public BsonDateTime(long millis) {
        this.millis = millis;
    }

    public static BsonDateTime of(Date d) {
        return new BsonDateTime(d.getTime());
    }

    public static BsonDateTime of(Instant i) {
        return new BsonDateTime(i.toEpochMilli());
    }

    public long getMillis() {
        return millis;
    }

    public Date toDate() {
        return new Date(millis);
    }

    @Override
    public BsonType getBsonType() {
        return BsonType.DATE_TIME;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof BsonDateTime && ((BsonDateTime) o).millis == millis;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(millis);
    }

    @Override
    public String toString() {
        return "BsonDateTime{" + Instant.ofEpochMilli(millis) + '}';
    }
}
