package de.caluga.bson.config;

/**
 * options for decoding
 **/
public class DecoderSettings extends Settings {
    private int maxDepth = EncoderSettings.DEFAULT_MAX_DEPTH;
    private boolean validateUtf8 = true;
    private boolean promoteDbRefs = true;
    private boolean allowObjectSmallerThanBufferSize = true;

    public int getMaxDepth() {
        return maxDepth;
    }

    public DecoderSettings setMaxDepth(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1");
        }

        this.maxDepth = maxDepth;
        return this;
    }

    public boolean isValidateUtf8() {
        return validateUtf8;
    }

    /**
     * fail on malformed utf-8 in names and strings instead of replacing
     */
    public DecoderSettings setValidateUtf8(boolean validateUtf8) {
        this.validateUtf8 = validateUtf8;
        return this;
    }

    public boolean isPromoteDbRefs() {
        return promoteDbRefs;
    }

    /**
     * turn documents shaped like {$ref, $id, $db} into db refs
     */
    public DecoderSettings setPromoteDbRefs(boolean promoteDbRefs) {
        this.promoteDbRefs = promoteDbRefs;
        return this;
    }

    public boolean isAllowObjectSmallerThanBufferSize() {
        return allowObjectSmallerThanBufferSize;
    }

    /**
     * if false, the buffer must hold exactly one document and nothing else
     */
    public DecoderSettings setAllowObjectSmallerThanBufferSize(boolean allowObjectSmallerThanBufferSize) {
        this.allowObjectSmallerThanBufferSize = allowObjectSmallerThanBufferSize;
        return this;
    }
}
