package com.rollupduck.expression;

import com.rollupduck.generator.SQLQuoting;

import java.util.Objects;

/**
 * Expression representing a literal constant value.
 *
 * <p>Supported values are the normalized predicate values: {@link String},
 * {@link Long}, {@link Double} and {@link Boolean}.
 *
 * <pre>
 *   'impression'   -- string literal
 *   42             -- integer literal
 *   3.5            -- double literal
 *   TRUE           -- boolean literal
 * </pre>
 */
public final class Literal implements Expression {

    private final Object value;

    public Literal(Object value) {
        this.value = Objects.requireNonNull(value, "value must not be null");
        if (!(value instanceof String || value instanceof Number || value instanceof Boolean)) {
            throw new IllegalArgumentException("Unsupported literal type: " + value.getClass().getName());
        }
    }

    public static Literal of(Object value) {
        return new Literal(value);
    }

    public Object value() {
        return value;
    }

    @Override
    public String toSQL() {
        if (value instanceof String str) {
            return SQLQuoting.quoteLiteral(str);
        }
        if (value instanceof Boolean) {
            return value.toString().toUpperCase();
        }
        if (value instanceof Double d && (d.isNaN() || d.isInfinite())) {
            return "'" + d + "'::DOUBLE";
        }
        return value.toString();
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Literal that)) return false;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }
}
