package de.caluga.bson.types;

import java.util.Objects;

/**
 * javascript code, optionally with a scope document. The scope is only
 * written when it holds at least one field, otherwise the value is plain code.
 **/
public final class BsonJavaScript extends BsonValue {
    private final String code;
    private final BsonDocument scope;

    public BsonJavaScript(String code) {
        this(code, null);
    }

    public BsonJavaScript(String code, BsonDocument scope) {
        this.code = Objects.requireNonNull(code, "code must not be null");
        this.scope = scope;
    }

    public String getCode() {
        return code;
    }

    /**
     * @return the scope, may be null
     */
    public BsonDocument getScope() {
        return scope;
    }

    public boolean hasScope() {
        return scope != null && !scope.isEmpty();
    }

    @Override
    public BsonType getBsonType() {
        return hasScope() ? BsonType.JAVASCRIPT_WITH_SCOPE : BsonType.JAVASCRIPT;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof BsonJavaScript)) {
            return false;
        }

        BsonJavaScript js = (BsonJavaScript) o;
        return js.code.equals(code) && Objects.equals(hasScope() ? scope : null, js.hasScope() ? js.scope : null);
    }

    @Override
    public int hashCode() {
        return 31 * code.hashCode() + (hasScope() ? scope.hashCode() : 0);
    }

    @Override
    public String toString() {
        return "BsonJavaScript{code='" + code + "', scope=" + scope + '}';
    }
}
