package de.caluga.bson.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * ordered list of values, written as a document keyed "0", "1", ...
 **/
public final class BsonArray extends BsonValue implements Iterable<BsonValue> {
    private final List<BsonValue> values;

    public BsonArray() {
        values = new ArrayList<>();
    }

    public BsonArray(List<? extends BsonValue> lst) {
        values = new ArrayList<>(lst.size());

        for (BsonValue v : lst) {
            add(v);
        }
    }

    /**
     * every element is categorized with {@link BsonValues#toBson(Object)}
     */
    public static BsonArray of(Object... elements) {
        BsonArray ret = new BsonArray();

        for (Object o : elements) {
            ret.append(o);
        }

        return ret;
    }

    public BsonArray add(BsonValue v) {
        values.add(v == null ? BsonNull.INSTANCE : v);
        return this;
    }

    public BsonArray append(Object o) {
        return add(BsonValues.toBson(o));
    }

    public BsonValue get(int idx) {
        return values.get(idx);
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public List<BsonValue> getValues() {
        return Collections.unmodifiableList(values);
    }

    @Override
    public Iterator<BsonValue> iterator() {
        return getValues().iterator();
    }

    @Override
    public BsonType getBsonType() {
        return BsonType.ARRAY;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof BsonArray && ((BsonArray) o).values.equals(values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
