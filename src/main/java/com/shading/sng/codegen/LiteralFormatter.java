package com.shading.sng.codegen;

import java.math.BigDecimal;
import java.util.Locale;

import com.shading.sng.model.NodeValue;
import com.shading.sng.model.SocketCoercion;
import com.shading.sng.model.SocketType;

/**
 * Renders stored and default values as backend literals.
 * <p>
 * Pure and total over the socket types: a missing value yields the type's zero, a scalar always
 * carries a decimal point, and vectors are fitted to three components through
 * {@link SocketCoercion#fit}.
 */
public final class LiteralFormatter {
    private final Dialect dialect;

    public LiteralFormatter(Dialect dialect) {
        this.dialect = dialect;
    }

    public String format(SocketType type, NodeValue value) {
        if (value == null)
            return zero(type);
        double[] components = value.components();
        if (type.isVector())
            return vector(SocketCoercion.fit(components, type));
        return scalar(components[0]);
    }

    public String zero(SocketType type) {
        return type.isVector() ? vector(new double[3]) : "0.0";
    }

    public String vector(double[] xyz) {
        return dialect.vec3() + "(" + scalar(xyz[0]) + ", " + scalar(xyz[1]) + ", " + scalar(xyz[2]) + ")";
    }

    /** Vector with exactly {@code decimals} fraction digits per component. */
    public String fixedVector(double[] xyz, int decimals) {
        String fmt = "%." + decimals + "f";
        return dialect.vec3() + "(" + String.format(Locale.ROOT, fmt, finite(xyz[0])) + ", "
                + String.format(Locale.ROOT, fmt, finite(xyz[1])) + ", "
                + String.format(Locale.ROOT, fmt, finite(xyz[2])) + ")";
    }

    /**
     * Float literal: plain decimal notation, never an exponent, always a decimal point. Non-finite
     * values have no literal form and render as {@code 0.0}.
     */
    public static String scalar(double v) {
        if (!Double.isFinite(v))
            return "0.0";
        String plain = BigDecimal.valueOf(v).stripTrailingZeros().toPlainString();
        return plain.indexOf('.') >= 0 ? plain : plain + ".0";
    }

    private static double finite(double v) {
        return Double.isFinite(v) ? v : 0.0;
    }
}
