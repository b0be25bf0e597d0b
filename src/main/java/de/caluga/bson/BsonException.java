package de.caluga.bson;

/**
 * base class of all errors raised while sizing, encoding or decoding BSON
 **/
public class BsonException extends RuntimeException {

    public BsonException(String message) {
        super(message);
    }

    public BsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
