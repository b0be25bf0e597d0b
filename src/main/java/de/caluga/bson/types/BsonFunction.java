package de.caluga.bson.types;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * a caller side function, given by its source text and an optional scope.
 * Functions are not data: they are skipped when encoding unless
 * {@code serializeFunctions} is switched on, then they are written as
 * javascript code (with scope if the scope is not empty).
 **/
public final class BsonFunction extends BsonValue {
    private static final Pattern FUNCTION_HEAD = Pattern.compile("^function *\\(");

    private final String source;
    private final BsonDocument scope;

    public BsonFunction(String source) {
        this(source, null);
    }

    public BsonFunction(String source, BsonDocument scope) {
        this.source = Objects.requireNonNull(source, "function source must not be null");
        this.scope = scope;
    }

    public String getSource() {
        return source;
    }

    /**
     * source text as written on the wire: {@code function   (} becomes {@code function (}
     */
    public String getNormalizedSource() {
        return FUNCTION_HEAD.matcher(source).replaceFirst("function (");
    }

    public BsonDocument getScope() {
        return scope;
    }

    public boolean hasScope() {
        return scope != null && !scope.isEmpty();
    }

    /**
     * @return the code value this function is written as
     */
    public BsonJavaScript toJavaScript() {
        return new BsonJavaScript(getNormalizedSource(), hasScope() ? scope : null);
    }

    @Override
    public BsonType getBsonType() {
        return hasScope() ? BsonType.JAVASCRIPT_WITH_SCOPE : BsonType.JAVASCRIPT;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof BsonFunction)) {
            return false;
        }

        BsonFunction f = (BsonFunction) o;
        return f.source.equals(source) && Objects.equals(f.scope, scope);
    }

    @Override
    public int hashCode() {
        return 31 * source.hashCode() + Objects.hashCode(scope);
    }

    @Override
    public String toString() {
        return "BsonFunction{" + source + '}';
    }
}
