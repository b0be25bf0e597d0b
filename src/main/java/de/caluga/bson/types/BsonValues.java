package de.caluga.bson.types;

import org.bson.types.Decimal128;
import org.bson.types.ObjectId;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Calendar;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * conversion between plain java objects and {@link BsonValue}s. This is the
 * one place where host objects are categorized - sizing and encoding only
 * ever see the resulting values.
 **/
public final class BsonValues {
    /**
     * largest integer a double holds exactly
     */
    public static final double SAFE_INTEGER_MAX = 9007199254740992d;
    public static final double SAFE_INTEGER_MIN = -9007199254740992d;
    public static final int INT32_MAX = Integer.MAX_VALUE;
    public static final int INT32_MIN = Integer.MIN_VALUE;

    private BsonValues() {
    }

    /**
     * numeric width selection for untyped numbers: whole numbers in the safe
     * integer range that also fit into 32 bits become int32, every other
     * number (larger integers, fractions, NaN, infinity) becomes a double.
     */
    public static BsonValue number(double value) {
        if (Math.floor(value) == value && value >= SAFE_INTEGER_MIN && value <= SAFE_INTEGER_MAX) {
            if (value >= INT32_MIN && value <= INT32_MAX) {
                return new BsonInt32((int) value);
            }
        }

        return new BsonDouble(value);
    }

    public static BsonValue toBson(Object v) {
        return toBson(v, UUIDRepresentation.STANDARD);
    }

    /**
     * categorizes a java object. Objects without an encoding rule end up as
     * {@link BsonUnsupported}, they are not rejected before encoding.
     */
    @SuppressWarnings("unchecked")
    public static BsonValue toBson(Object v, UUIDRepresentation uuidRepresentation) {
        if (v == null) {
            return BsonNull.INSTANCE;
        } else if (v instanceof BsonValue) {
            return (BsonValue) v;
        } else if (v instanceof BsonConvertible) {
            return new BsonCustomValue((BsonConvertible) v);
        } else if (v instanceof Float || v instanceof Double) {
            return new BsonDouble(((Number) v).doubleValue());
        } else if (v instanceof String) {
            return new BsonString((String) v);
        } else if (v instanceof Integer || v instanceof Short || v instanceof Byte) {
            return new BsonInt32(((Number) v).intValue());
        } else if (v instanceof Character) {
            return new BsonInt32((Character) v);
        } else if (v instanceof Long) {
            return new BsonInt64((Long) v);
        } else if (v instanceof BigDecimal) {
            return BsonDecimal128.of((BigDecimal) v);
        } else if (v instanceof Decimal128) {
            Decimal128 d = (Decimal128) v;
            return new BsonDecimal128(d.getHigh(), d.getLow());
        } else if (v instanceof Number) {
            return number(((Number) v).doubleValue());
        } else if (v instanceof Boolean) {
            return BsonBoolean.valueOf((Boolean) v);
        } else if (v instanceof UUID) {
            return BsonBinary.fromUuid((UUID) v, uuidRepresentation);
        } else if (v instanceof byte[]) {
            return new BsonBinary((byte[]) v);
        } else if (v instanceof ObjectId) {
            return new BsonObjectId((ObjectId) v);
        } else if (v instanceof Date) {
            return BsonDateTime.of((Date) v);
        } else if (v instanceof Calendar) {
            return new BsonDateTime(((Calendar) v).getTimeInMillis());
        } else if (v instanceof Instant) {
            return BsonDateTime.of((Instant) v);
        } else if (v instanceof Pattern) {
            return BsonRegularExpression.of((Pattern) v);
        } else if (v instanceof Map) {
            BsonDocument doc = new BsonDocument();

            for (Map.Entry<Object, Object> e : ((Map<Object, Object>) v).entrySet()) {
                doc.put(String.valueOf(e.getKey()), toBson(e.getValue(), uuidRepresentation));
            }

            return doc;
        } else if (v instanceof Collection) {
            BsonArray arr = new BsonArray();

            for (Object o : (Collection<Object>) v) {
                arr.add(toBson(o, uuidRepresentation));
            }

            return arr;
        } else if (v.getClass().isArray()) {
            BsonArray arr = new BsonArray();
            int arrayLength = Array.getLength(v);

            for (int i = 0; i < arrayLength; i++) {
                arr.add(toBson(Array.get(v, i), uuidRepresentation));
            }

            return arr;
        } else if (v.getClass().isEnum()) {
            return new BsonString(((Enum<?>) v).name());
        }

        return new BsonUnsupported(v);
    }

    public static Object toJava(BsonValue v) {
        return toJava(v, UUIDRepresentation.STANDARD);
    }

    /**
     * turns a value back into plain java objects: documents become
     * LinkedHashMaps, arrays Lists, uuid binaries UUIDs, other binaries
     * byte[], datetimes Dates and regular expressions Patterns. Types without a
     * java counterpart (min/max key, timestamps, code, ...) are returned as is.
     */
    public static Object toJava(BsonValue v, UUIDRepresentation uuidRepresentation) {
        if (v instanceof BsonCustomValue) {
            v = ((BsonCustomValue) v).resolve();
        }

        if (v == null) {
            return null;
        }

        if (v instanceof BsonUnsupported) {
            return ((BsonUnsupported) v).getValue();
        }

        switch (v.getBsonType()) {
            case NULL:
            case UNDEFINED:
                return null;

            case DOUBLE:
                return v.asDouble().getValue();

            case STRING:
                return v.asString().getValue();

            case INT32:
                return v.asInt32().getValue();

            case INT64:
                return v.asInt64().getValue();

            case BOOLEAN:
                return ((BsonBoolean) v).getValue();

            case DATE_TIME:
                return ((BsonDateTime) v).toDate();

            case OBJECT_ID:
                return ((BsonObjectId) v).toObjectId();

            case DECIMAL128:
                return ((BsonDecimal128) v).toDecimal128();

            case REGULAR_EXPRESSION:
                return ((BsonRegularExpression) v).toPattern();

            case BINARY:
                BsonBinary b = v.asBinary();

                if (b.length() == 16 && (b.getSubType() == BsonBinary.SUBTYPE_UUID
                                         || (b.getSubType() == BsonBinary.SUBTYPE_UUID_OLD && uuidRepresentation.getSubtype() == 3))) {
                    return b.asUuid(b.getSubType() == BsonBinary.SUBTYPE_UUID ? UUIDRepresentation.STANDARD : uuidRepresentation);
                }

                return b.getData();

            case ARRAY:
                List<Object> lst = new ArrayList<>();

                for (BsonValue e : v.asArray()) {
                    lst.add(toJava(e, uuidRepresentation));
                }

                return lst;

            case DOCUMENT:
                if (v instanceof BsonDbRef) {
                    return v;
                }

                Map<String, Object> ret = new LinkedHashMap<>();

                for (Map.Entry<String, BsonValue> e : v.asDocument()) {
                    ret.put(e.getKey(), toJava(e.getValue(), uuidRepresentation));
                }

                return ret;

            default:
                return v;
        }
    }
}
