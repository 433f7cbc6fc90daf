package io.github.eutro.hlo2shlo.core.types;

import io.github.eutro.hlo2shlo.core.ir.Dialect;

/**
 * The token type used to order side effects. Each HLO dialect defines its own.
 */
public final class TokenType extends Type {
    public static final TokenType MHLO = new TokenType(Dialect.MHLO);
    public static final TokenType STABLEHLO = new TokenType(Dialect.STABLEHLO);

    private final Dialect dialect;

    private TokenType(Dialect dialect) {
        this.dialect = dialect;
    }

    public static TokenType of(Dialect dialect) {
        switch (dialect) {
            case MHLO:
                return MHLO;
            case STABLEHLO:
                return STABLEHLO;
            default:
                throw new IllegalArgumentException("no token type in dialect " + dialect);
        }
    }

    @Override
    public Dialect getDialect() {
        return dialect;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TokenType && ((TokenType) o).dialect == dialect;
    }

    @Override
    public int hashCode() {
        return dialect.hashCode();
    }

    @Override
    public String toString() {
        return "!" + dialect + ".token";
    }
}
