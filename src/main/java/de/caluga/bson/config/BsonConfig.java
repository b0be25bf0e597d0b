package de.caluga.bson.config;

import de.caluga.bson.types.UUIDRepresentation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * all codec settings in one place. Read from properties like
 * <pre>
 * encoder.ignoreUndefined=true
 * decoder.maxDepth=50
 * uuidRepresentation=JAVA_LEGACY
 * </pre>
 * optionally with an additional prefix in front of every key.
 **/
public class BsonConfig {
    private static final Logger log = LoggerFactory.getLogger(BsonConfig.class);

    public static final String DEFAULT_RESOURCE = "bson.properties";

    private EncoderSettings encoderSettings = new EncoderSettings();
    private DecoderSettings decoderSettings = new DecoderSettings();
    private UUIDRepresentation uuidRepresentation = UUIDRepresentation.STANDARD;

    public BsonConfig() {
    }

    public BsonConfig(String prefix, Properties prop) {
        String p = (prefix == null || prefix.isEmpty()) ? "" : prefix + ".";
        encoderSettings.applyProperties(p + "encoder", prop);
        decoderSettings.applyProperties(p + "decoder", prop);
        String uuid = prop.getProperty(p + "uuidRepresentation");

        if (uuid != null) {
            try {
                uuidRepresentation = UUIDRepresentation.valueOf(uuid.trim());
            } catch (IllegalArgumentException e) {
                log.warn("unknown uuid representation {} - using {}", uuid, uuidRepresentation);
            }
        }
    }

    public static BsonConfig fromProperties(Properties p) {
        return new BsonConfig(null, p);
    }

    public static BsonConfig fromProperties(String prefix, Properties p) {
        return new BsonConfig(prefix, p);
    }

    public static BsonConfig load() {
        return load(DEFAULT_RESOURCE, null);
    }

    /**
     * reads the properties resource from the classpath. If it does not exist,
     * the defaults are used.
     */
    public static BsonConfig load(String resource, String prefix) {
        Properties p = new Properties();

        try (InputStream in = BsonConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                log.debug("no {} on classpath - using defaults", resource);
                return new BsonConfig();
            }

            p.load(in);
        } catch (IOException e) {
            throw new RuntimeException("could not read " + resource, e);
        }

        log.debug("loaded bson settings from {}", resource);
        return new BsonConfig(prefix, p);
    }

    public Properties asProperties() {
        return asProperties(null);
    }

    public Properties asProperties(String prefix) {
        String p = (prefix == null || prefix.isEmpty()) ? "" : prefix + ".";
        Properties ret = new Properties();
        ret.putAll(encoderSettings.asProperties(p + "encoder"));
        ret.putAll(decoderSettings.asProperties(p + "decoder"));

        if (uuidRepresentation != UUIDRepresentation.STANDARD) {
            ret.put(p + "uuidRepresentation", uuidRepresentation.name());
        }

        return ret;
    }

    public EncoderSettings getEncoderSettings() {
        return encoderSettings;
    }

    public BsonConfig setEncoderSettings(EncoderSettings encoderSettings) {
        this.encoderSettings = encoderSettings;
        return this;
    }

    public DecoderSettings getDecoderSettings() {
        return decoderSettings;
    }

    public BsonConfig setDecoderSettings(DecoderSettings decoderSettings) {
        this.decoderSettings = decoderSettings;
        return this;
    }

    public UUIDRepresentation getUuidRepresentation() {
        return uuidRepresentation;
    }

    public BsonConfig setUuidRepresentation(UUIDRepresentation uuidRepresentation) {
        this.uuidRepresentation = uuidRepresentation;
        return this;
    }
}
