package com.shading.sng.model;

import java.util.Arrays;

/**
 * A value stored on a node for one of its inputs, used only while that input is unconnected.
 * <p>
 * Either a single scalar or a fixed-size numeric vector. Vectors may carry two components (legacy
 * shorthand for a vector whose third component is zero) or three.
 */
public interface NodeValue {

    /** Components of this value as a fresh array. */
    double[] components();

    static Scalar scalar(double v) {
        return new Scalar(v);
    }

    static Vector vector(double... components) {
        return new Vector(components);
    }

    /** Builds a value from a JSON-ish object: a {@link Number} or a list/array of numbers. */
    static NodeValue of(Object raw) {
        if (raw instanceof NodeValue nv)
            return nv;
        if (raw instanceof Number n)
            return new Scalar(n.doubleValue());
        if (raw instanceof double[] arr)
            return new Vector(arr);
        if (raw instanceof Iterable<?> list) {
            double[] tmp = new double[4];
            int i = 0;
            for (Object o : list) {
                if (i == tmp.length)
                    tmp = Arrays.copyOf(tmp, i * 2);
                tmp[i++] = o instanceof Number n ? n.doubleValue() : Double.parseDouble(o.toString());
            }
            return new Vector(Arrays.copyOf(tmp, i));
        }
        throw new IllegalArgumentException("Unsupported node value: " + raw);
    }

    record Scalar(double value) implements NodeValue {
        @Override
        public double[] components() {
            return new double[] { value };
        }
    }

    record Vector(double[] values) implements NodeValue {
        public Vector {
            if (values == null || values.length < 2 || values.length > 4)
                throw new IllegalArgumentException("Vector value must have 2 to 4 components");
            values = values.clone();
        }

        @Override
        public double[] components() {
            return values.clone();
        }

        public int size() {
            return values.length;
        }

        public double get(int i) {
            return values[i];
        }

        @Override
        public double[] values() {
            return values.clone();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Vector v && Arrays.equals(values, v.values);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(values);
        }

        @Override
        public String toString() {
            return "Vector" + Arrays.toString(values);
        }
    }
}
