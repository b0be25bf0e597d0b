package de.caluga.bson;

/**
 * an input handed to a boundary operation is not of a supported shape,
 * e.g. something that is not a byte buffer passed to the buffer adapter
 **/
public class BsonTypeException extends BsonException {
    private final Class<?> rejectedType;

    public BsonTypeException(String message, Class<?> rejectedType) {
        super(message);
        this.rejectedType = rejectedType;
    }

    public Class<?> getRejectedType() {
        return rejectedType;
    }
}
