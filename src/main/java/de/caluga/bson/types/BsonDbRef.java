package de.caluga.bson.types;

import java.util.Map;
import java.util.Objects;

/**
 * reference to a document in another collection. On the wire this is a
 * plain document {$ref, $id, ...fields, $db}.
 **/
public final class BsonDbRef extends BsonValue {
    public static final String REF = "$ref";
    public static final String ID = "$id";
    public static final String DB = "$db";

    private final String collection;
    private final BsonValue id;
    private final String db;
    private final BsonDocument fields;

    public BsonDbRef(String collection, BsonValue id) {
        this(collection, id, null, null);
    }

    public BsonDbRef(String collection, BsonValue id, String db) {
        this(collection, id, db, null);
    }

    public BsonDbRef(String collection, BsonValue id, String db, BsonDocument fields) {
        this.collection = Objects.requireNonNull(collection, "collection must not be null");
        this.id = id == null ? BsonNull.INSTANCE : id;
        this.db = db;
        this.fields = fields == null ? new BsonDocument() : fields;
    }

    public String getCollection() {
        return collection;
    }

    public BsonValue getId() {
        return id;
    }

    /**
     * @return name of the database, null if the reference is local
     */
    public String getDb() {
        return db;
    }

    public BsonDocument getFields() {
        return fields;
    }

    /**
     * @return the document this reference is written as
     */
    public BsonDocument toDocument() {
        BsonDocument ret = new BsonDocument();
        ret.put(REF, new BsonString(collection));
        ret.put(ID, id);

        for (Map.Entry<String, BsonValue> e : fields) {
            ret.put(e.getKey(), e.getValue());
        }

        if (db != null) {
            ret.put(DB, new BsonString(db));
        }

        return ret;
    }

    /**
     * a document is a db ref if $ref is a string, $id is present and $db is
     * either absent or a string
     */
    public static boolean isDbRefLike(BsonDocument doc) {
        BsonValue ref = doc.get(REF);
        BsonValue dbValue = doc.get(DB);
        return ref instanceof BsonString && doc.containsKey(ID) && !(doc.get(ID) instanceof BsonNull) && !(doc.get(ID) instanceof BsonUndefined)
               && (dbValue == null || dbValue instanceof BsonString);
    }

    public static BsonDbRef fromDocument(BsonDocument doc) {
        BsonDocument extra = new BsonDocument();

        for (Map.Entry<String, BsonValue> e : doc) {
            if (!e.getKey().equals(REF) && !e.getKey().equals(ID) && !e.getKey().equals(DB)) {
                extra.put(e.getKey(), e.getValue());
            }
        }

        BsonValue dbValue = doc.get(DB);
        return new BsonDbRef(((BsonString) doc.get(REF)).getValue(), doc.get(ID),
                             dbValue == null ? null : ((BsonString) dbValue).getValue(), extra);
    }

    /**
     * written as a document
     */
    @Override
    public BsonType getBsonType() {
        return BsonType.DOCUMENT;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof BsonDbRef)) {
            return false;
        }

        BsonDbRef r = (BsonDbRef) o;
        return r.collection.equals(collection) && r.id.equals(id) && Objects.equals(r.db, db) && r.fields.equals(fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(collection, id, db, fields);
    }

    @Override
    public String toString() {
        return "DBRef{" + collection + ", " + id + (db == null ? "" : ", " + db) + '}';
    }
}
