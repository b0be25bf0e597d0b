package de.caluga.bson.types;

import org.bson.types.ObjectId;

import java.util.Arrays;

/**
 * 12 byte object identifier. The codec only carries the bytes, generating
 * and parsing ids is left to {@link ObjectId}.
 **/
public final class BsonObjectId extends BsonValue {
    public static final int LENGTH = 12;

    private final byte[] bytes;

    public BsonObjectId(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("object id needs exactly " + LENGTH + " bytes");
        }

        this.bytes = bytes.clone();
    }

    public BsonObjectId(ObjectId id) {
        this.bytes = id.toByteArray();
    }

    /**
     * new, unique id
     */
    public static BsonObjectId generate() {
        return new BsonObjectId(new ObjectId());
    }

    public static BsonObjectId fromHex(String hex) {
        return new BsonObjectId(new ObjectId(hex));
    }

    /**
     * @return a copy of the 12 id bytes
     */
    public byte[] getBytes() {
        return bytes.clone();
    }

    public ObjectId toObjectId() {
        return new ObjectId(bytes);
    }

    public String toHexString() {
        return toObjectId().toHexString();
    }

    @Override
    public BsonType getBsonType() {
        return BsonType.OBJECT_ID;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof BsonObjectId && Arrays.equals(((BsonObjectId) o).bytes, bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "ObjectId(" + toHexString() + ")";
    }
}
