package de.caluga.bson;

/**
 * documents / arrays are nested deeper than the configured maximum
 **/
public class BsonDepthLimitException extends BsonException {
    private final int maxDepth;

    public BsonDepthLimitException(int maxDepth) {
        super("document too deeply nested - maximum depth is " + maxDepth);
        this.maxDepth = maxDepth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
