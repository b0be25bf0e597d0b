package de.caluga.bson;

/**
 * framing violation found while decoding. Offset is the position in the
 * decoded buffer where the problem was detected.
 **/
public class BsonFormatException extends BsonException {
    private final int offset;

    public BsonFormatException(String message, int offset) {
        super(message + " (at offset " + offset + ")");
        this.offset = offset;
    }

    public BsonFormatException(String message, int offset, Throwable cause) {
        super(message + " (at offset " + offset + ")", cause);
        this.offset = offset;
    }

    public int getOffset() {
        return offset;
    }
}
