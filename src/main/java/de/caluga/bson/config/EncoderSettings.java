package de.caluga.bson.config;

/**
 * options for sizing and encoding
 **/
public class EncoderSettings extends Settings {
    public static final int DEFAULT_MAX_DEPTH = 100;

    private boolean serializeFunctions = false;
    private boolean ignoreUndefined = false;
    private boolean checkKeys = false;
    private int maxDepth = DEFAULT_MAX_DEPTH;

    public boolean isSerializeFunctions() {
        return serializeFunctions;
    }

    /**
     * write function values as javascript code instead of skipping them
     */
    public EncoderSettings setSerializeFunctions(boolean serializeFunctions) {
        this.serializeFunctions = serializeFunctions;
        return this;
    }

    public boolean isIgnoreUndefined() {
        return ignoreUndefined;
    }

    /**
     * drop undefined fields of documents. Array slots are never dropped.
     */
    public EncoderSettings setIgnoreUndefined(boolean ignoreUndefined) {
        this.ignoreUndefined = ignoreUndefined;
        return this;
    }

    public boolean isCheckKeys() {
        return checkKeys;
    }

    /**
     * reject field names starting with '$' or containing '.'
     */
    public EncoderSettings setCheckKeys(boolean checkKeys) {
        this.checkKeys = checkKeys;
        return this;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public EncoderSettings setMaxDepth(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1");
        }

        this.maxDepth = maxDepth;
        return this;
    }
}
