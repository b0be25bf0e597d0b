package de.caluga.bson.types;

import java.util.Objects;

/**
 * deprecated string-like type, layout is identical to a string
 **/
public final class BsonSymbol extends BsonValue {
    private final String symbol;

    public BsonSymbol(String symbol) {
        this.symbol = Objects.requireNonNull(symbol, "symbol must not be null");
    }

    public String getSymbol() {
        return symbol;
    }

    @Override
    public BsonType getBsonType() {
        return BsonType.SYMBOL;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof BsonSymbol && ((BsonSymbol) o).symbol.equals(symbol);
    }

    @Override
    public int hashCode() {
        return symbol.hashCode();
    }

    @Override
    public String toString() {
        return "BsonSymbol{" + symbol + '}';
    }
}
