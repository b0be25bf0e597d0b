package de.caluga.bson.types;

import java.util.Arrays;
import java.util.Objects;
import java.util.UUID;

/**
 * binary blob with a sub-type byte.
 **/
public final class BsonBinary extends BsonValue {
    public static final byte SUBTYPE_DEFAULT = 0x00;
    public static final byte SUBTYPE_FUNCTION = 0x01;
    /**
     * old generic binary, carries an additional inner length prefix on the wire
     */
    public static final byte SUBTYPE_BYTE_ARRAY = 0x02;
    public static final byte SUBTYPE_UUID_OLD = 0x03;
    public static final byte SUBTYPE_UUID = 0x04;
    public static final byte SUBTYPE_MD5 = 0x05;
    public static final byte SUBTYPE_ENCRYPTED = 0x06;
    public static final byte SUBTYPE_COLUMN = 0x07;
    public static final byte SUBTYPE_USER_DEFINED = (byte) 0x80;

    private static final int UUID_LENGTH = 16;

    private final byte subType;
    private final byte[] data;

    public BsonBinary(byte[] data) {
        this(SUBTYPE_DEFAULT, data);
    }

    public BsonBinary(byte subType, byte[] data) {
        this.subType = subType;
        this.data = Objects.requireNonNull(data, "binary data must not be null").clone();
    }

    /**
     * stores the uuid with the byte order of the given representation
     */
    public static BsonBinary fromUuid(UUID uuid, UUIDRepresentation representation) {
        byte[] b = new byte[UUID_LENGTH];
        long msb = uuid.getMostSignificantBits();
        long lsb = uuid.getLeastSignificantBits();

        switch (representation) {
            case UNSPECIFIED:
                throw new IllegalArgumentException("Cannot encode using UNSPECIFIED representation");

            case STANDARD:
            case PYTHON_LEGACY:
                writeLongBigEndian(b, 0, msb);
                writeLongBigEndian(b, 8, lsb);
                break;

            case JAVA_LEGACY:
                writeLongLittleEndian(b, 0, msb);
                writeLongLittleEndian(b, 8, lsb);
                break;

            case C_SHARP_LEGACY:
                int idx = 0;

                for (int i : new int[] {3, 2, 1, 0, 5, 4, 7, 6}) {
                    b[idx++] = (byte) ((msb >> ((7 - i) * 8)) & 0xff);
                }

                writeLongBigEndian(b, 8, lsb);
                break;

            default:
                throw new IllegalArgumentException("Unknown UUID representation " + representation.name());
        }

        return new BsonBinary((byte) representation.getSubtype(), b);
    }

    /**
     * reads the uuid back assuming the given representation
     *
     * @throws IllegalStateException if this is no 16 byte uuid sub-type value
     */
    public UUID asUuid(UUIDRepresentation representation) {
        if (data.length != UUID_LENGTH || (subType != SUBTYPE_UUID && subType != SUBTYPE_UUID_OLD)) {
            throw new IllegalStateException("binary of subtype " + subType + " and length " + data.length + " is no UUID");
        }

        switch (representation) {
            case STANDARD:
            case PYTHON_LEGACY:
                return new UUID(readLongBigEndian(data, 0), readLongBigEndian(data, 8));

            case JAVA_LEGACY:
                return new UUID(readLongLittleEndian(data, 0), readLongLittleEndian(data, 8));

            case C_SHARP_LEGACY:
                byte[] msb = new byte[8];
                int idx = 0;

                for (int i : new int[] {3, 2, 1, 0, 5, 4, 7, 6}) {
                    msb[i] = data[idx++];
                }

                return new UUID(readLongBigEndian(msb, 0), readLongBigEndian(data, 8));

            default:
                throw new IllegalArgumentException("Cannot decode using " + representation.name() + " representation");
        }
    }

    public byte getSubType() {
        return subType;
    }

    /**
     * @return copy of the payload
     */
    public byte[] getData() {
        return data.clone();
    }

    public int length() {
        return data.length;
    }

    @Override
    public BsonType getBsonType() {
        return BsonType.BINARY;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof BsonBinary)) {
            return false;
        }

        BsonBinary b = (BsonBinary) o;
        return b.subType == subType && Arrays.equals(b.data, data);
    }

    @Override
    public int hashCode() {
        return 31 * subType + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "BsonBinary{subType=" + subType + ", length=" + data.length + '}';
    }

    private static void writeLongBigEndian(byte[] b, int idx, long lng) {
        for (int i = 0; i <= 7; i++) b[idx + i] = (byte) ((lng >> ((7 - i) * 8)) & 0xff);
    }

    private static void writeLongLittleEndian(byte[] b, int idx, long lng) {
        for (int i = 0; i <= 7; i++) b[idx + i] = (byte) ((lng >> (i * 8)) & 0xff);
    }

    private static long readLongBigEndian(byte[] bytes, int idx) {
        long ret = 0;

        for (int i = 0; i <= 7; i++) ret = (ret << 8) | (bytes[idx + i] & 0xFF);

        return ret;
    }

    private static long readLongLittleEndian(byte[] bytes, int idx) {
        long ret = 0;

        for (int i = 7; i >= 0; i--) ret = (ret << 8) | (bytes[idx + i] & 0xFF);

        return ret;
    }
}
