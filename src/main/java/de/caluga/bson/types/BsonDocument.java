package de.caluga.bson.types;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * ordered mapping of field names to values. Insertion order is the order
 * fields are written in and equality takes the order into account.
 **/
public final class BsonDocument extends BsonValue implements Iterable<Map.Entry<String, BsonValue>> {
    private final LinkedHashMap<String, BsonValue> fields;

    public BsonDocument() {
        fields = new LinkedHashMap<>();
    }

    public BsonDocument(Map<String, ? extends BsonValue> m) {
        fields = new LinkedHashMap<>();

        if (m != null) {
            for (Map.Entry<String, ? extends BsonValue> e : m.entrySet()) {
                put(e.getKey(), e.getValue());
            }
        }
    }

    public static BsonDocument of() {
        return new BsonDocument();
    }

    public static BsonDocument of(String k1, Object v1) {
        return of().append(k1, v1);
    }

    public static BsonDocument of(String k1, Object v1, String k2, Object v2) {
        return of().append(k1, v1)
                   .append(k2, v2);
    }

    public static BsonDocument of(String k1, Object v1, String k2, Object v2, String k3, Object v3) {
        return of().append(k1, v1)
                   .append(k2, v2)
                   .append(k3, v3);
    }

    public static BsonDocument of(String k1, Object v1, String k2, Object v2, String k3, Object v3, String k4, Object v4) {
        return of().append(k1, v1)
                   .append(k2, v2)
                   .append(k3, v3)
                   .append(k4, v4);
    }

    /**
     * converts a java map, see {@link BsonValues#toBson(Object)}
     */
    public static BsonDocument of(Map<String, ?> map) {
        if (map == null) {
            return new BsonDocument();
        }

        return BsonValues.toBson(map).asDocument();
    }

    /**
     * adds the value after categorizing it with {@link BsonValues#toBson(Object)}
     */
    public BsonDocument append(String k, Object value) {
        put(k, BsonValues.toBson(value));
        return this;
    }

    public BsonDocument appendIfNotNull(String k, Object value) {
        if (value != null) {
            append(k, value);
        }

        return this;
    }

    /**
     * replacing an existing key keeps its position
     */
    public BsonValue put(String key, BsonValue value) {
        Objects.requireNonNull(key, "field name must not be null");
        return fields.put(key, value == null ? BsonNull.INSTANCE : value);
    }

    public BsonValue get(String key) {
        return fields.get(key);
    }

    public boolean containsKey(String key) {
        return fields.containsKey(key);
    }

    public BsonValue remove(String key) {
        return fields.remove(key);
    }

    public int size() {
        return fields.size();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    public Set<String> keySet() {
        return Collections.unmodifiableSet(fields.keySet());
    }

    public Set<Map.Entry<String, BsonValue>> entrySet() {
        return Collections.unmodifiableSet(fields.entrySet());
    }

    @Override
    public Iterator<Map.Entry<String, BsonValue>> iterator() {
        return entrySet().iterator();
    }

    @Override
    public BsonType getBsonType() {
        return BsonType.DOCUMENT;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }

        if (!(o instanceof BsonDocument)) {
            return false;
        }

        BsonDocument other = (BsonDocument) o;

        if (other.size() != size()) {
            return false;
        }

        Iterator<Map.Entry<String, BsonValue>> it = other.fields.entrySet().iterator();

        for (Map.Entry<String, BsonValue> e : fields.entrySet()) {
            Map.Entry<String, BsonValue> oe = it.next();

            if (!e.getKey().equals(oe.getKey()) || !e.getValue().equals(oe.getValue())) {
                return false;
            }
        }

        return true;
    }

    @Override
    public int hashCode() {
        int h = 1;

        for (Map.Entry<String, BsonValue> e : fields.entrySet()) {
            h = 31 * h + e.getKey().hashCode();
            h = 31 * h + e.getValue().hashCode();
        }

        return h;
    }

    @Override
    public String toString() {
        return fields.toString();
    }
}
