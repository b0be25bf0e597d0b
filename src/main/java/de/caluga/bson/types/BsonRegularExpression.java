package de.caluga.bson.types;

import java.util.Arrays;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * regular expression as pattern and option characters. Options are kept in
 * alphabetical order, which is how they have to appear on the wire.
 **/
public final class BsonRegularExpression extends BsonValue {
    private final String pattern;
    private final String options;

    public BsonRegularExpression(String pattern) {
        this(pattern, "");
    }

    public BsonRegularExpression(String pattern, String options) {
        this.pattern = Objects.requireNonNull(pattern, "pattern must not be null");
        this.options = sortOptions(options == null ? "" : options);
    }

    /**
     * converts the flags of a java pattern into bson options:
     * i (case insensitive), m (multiline), s (dotall), u (unicode), x (comments)
     */
    public static BsonRegularExpression of(Pattern p) {
        StringBuilder flags = new StringBuilder();
        int f = p.flags();

        if ((f & Pattern.CASE_INSENSITIVE) != 0) {
            flags.append('i');
        }

        if ((f & Pattern.MULTILINE) != 0) {
            flags.append('m');
        }

        if ((f & Pattern.DOTALL) != 0) {
            flags.append('s');
        }

        if ((f & Pattern.UNICODE_CASE) != 0) {
            flags.append('u');
        }

        if ((f & Pattern.COMMENTS) != 0) {
            flags.append('x');
        }

        return new BsonRegularExpression(p.pattern(), flags.toString());
    }

    /**
     * compiles the expression with java semantics. The locale flag 'l' has no
     * java counterpart and is ignored.
     */
    public Pattern toPattern() {
        int flags = 0;

        if (options.contains("i")) {
            flags = flags | Pattern.CASE_INSENSITIVE;
        }

        if (options.contains("m")) {
            flags = flags | Pattern.MULTILINE;
        }

        if (options.contains("s")) {
            flags = flags | Pattern.DOTALL;
        }

        if (options.contains("u")) {
            flags = flags | Pattern.UNICODE_CASE;
        }

        if (options.contains("x")) {
            flags = flags | Pattern.COMMENTS;
        }

        return Pattern.compile(pattern, flags);
    }

    public String getPattern() {
        return pattern;
    }

    public String getOptions() {
        return options;
    }

    @Override
    public BsonType getBsonType() {
        return BsonType.REGULAR_EXPRESSION;
    }

    private static String sortOptions(String options) {
        char[] c = options.toCharArray();
        Arrays.sort(c);
        return new String(c);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof BsonRegularExpression)) {
            return false;
        }

        BsonRegularExpression r = (BsonRegularExpression) o;
        return r.pattern.equals(pattern) && r.options.equals(options);
    }

    @Override
    public int hashCode() {
        return 31 * pattern.hashCode() + options.hashCode();
    }

    @Override
    public String toString() {
        return "/" + pattern + "/" + options;
    }
}
