package de.caluga.bson.types;

/**
 * byte layouts a {@link java.util.UUID} can be stored with inside a binary
 * value. Only STANDARD uses sub-type 4, the legacy drivers all used 3 with
 * their own byte order.
 **/
public enum UUIDRepresentation {

    UNSPECIFIED(-1), STANDARD(4), C_SHARP_LEGACY(3), JAVA_LEGACY(3), PYTHON_LEGACY(3);

    private final int subtype;

    UUIDRepresentation(int s) {
        subtype = s;
    }

    public int getSubtype() {
        return subtype;
    }
}
