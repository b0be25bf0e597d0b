package de.caluga.bson;

import de.caluga.bson.codec.BsonDecoder;
import de.caluga.bson.codec.BsonEncoder;
import de.caluga.bson.codec.BsonSizeCalculator;
import de.caluga.bson.config.BsonConfig;
import de.caluga.bson.config.DecoderSettings;
import de.caluga.bson.config.EncoderSettings;
import de.caluga.bson.types.BsonDocument;
import de.caluga.bson.types.BsonValue;
import de.caluga.bson.types.BsonValues;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.Map;

/**
 * entry point for the common cases: size, serialize and deserialize with
 * either default settings or a {@link BsonConfig}.
 * <p>
 * Instances are immutable and can be shared between threads.
 **/
public class Bson {
    private static final Bson DEFAULT = new Bson(new BsonConfig());

    private final BsonConfig config;
    private final BsonSizeCalculator calculator;
    private final BsonEncoder encoder;
    private final BsonDecoder decoder;

    public Bson(BsonConfig config) {
        this.config = config;
        EncoderSettings enc = config.getEncoderSettings().copy();
        DecoderSettings dec = config.getDecoderSettings().copy();
        this.encoder = new BsonEncoder(enc);
        this.calculator = encoder.getCalculator();
        this.decoder = new BsonDecoder(dec);
    }

    public static Bson getDefault() {
        return DEFAULT;
    }

    public static int calculateObjectSize(BsonValue root) {
        return DEFAULT.sizeOf(root);
    }

    public static byte[] encode(Map<String, Object> m) {
        return DEFAULT.serialize(BsonValues.toBson(m, DEFAULT.config.getUuidRepresentation()));
    }

    public static BsonDocument decode(byte[] in) {
        return DEFAULT.deserialize(in);
    }

    public BsonConfig getConfig() {
        return config;
    }

    public int sizeOf(BsonValue root) {
        return calculator.sizeOf(root);
    }

    public byte[] serialize(BsonValue root) {
        return encoder.serialize(root);
    }

    /**
     * converts a java map first, see {@link BsonValues#toBson(Object)}
     */
    public byte[] serialize(Map<String, Object> m) {
        return encoder.serialize(BsonValues.toBson(m, config.getUuidRepresentation()));
    }

    /**
     * @return index after the last byte written
     */
    public int serializeWithBufferAndIndex(BsonValue root, ByteBuffer buffer, int startIndex) {
        return encoder.encode(root, buffer, startIndex);
    }

    public int serializeWithBufferAndIndex(BsonValue root, byte[] buffer, int startIndex) {
        return encoder.encode(root, buffer, startIndex);
    }

    public BsonDocument deserialize(Object input) {
        return decoder.decode(input);
    }

    public int deserializeStream(Object input, int startIndex, int numberOfDocuments, List<BsonDocument> documents) {
        return decoder.decodeStream(input, startIndex, numberOfDocuments, documents);
    }
}
