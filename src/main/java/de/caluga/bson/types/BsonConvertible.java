package de.caluga.bson.types;

/**
 * implemented by caller types that know how to turn themselves into a
 * bson value. Sizing and encoding call {@link #toBson()} before looking at
 * the value, so the codec does not need to know the type.
 **/
public interface BsonConvertible {

    /**
     * @return the value to write instead of this object. A null result is
     * written as null.
     */
    BsonValue toBson();
}
