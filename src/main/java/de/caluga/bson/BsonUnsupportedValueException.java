package de.caluga.bson;

/**
 * a value cannot be written - there is no encoding rule for it
 **/
public class BsonUnsupportedValueException extends BsonException {
    private final String fieldName;

    public BsonUnsupportedValueException(String message, String fieldName) {
        super(message);
        this.fieldName = fieldName;
    }

    @SuppressWarnings("unused")
    public String getFieldName() {
        return fieldName;
    }
}
