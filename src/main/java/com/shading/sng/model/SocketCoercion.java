package com.shading.sng.model;

import java.util.EnumMap;
import java.util.Map;

/**
 * Coercion table keyed by (source type, destination type).
 * <p>
 * One lookup answers both questions the editor and the code generators ask about a pair of types:
 * may an output of the source type feed an input of the destination type, and how many components
 * a literal must carry once it lands in the destination socket. Values with fewer components than
 * the destination expects (legacy two-component vectors) are padded with zeros.
 */
public enum SocketCoercion {
    /** Same type, or the color / vec3 alias pair. */
    IDENTITY(true),
    /** No conversion exists. */
    REJECT(false);

    private static final Map<SocketType, Map<SocketType, SocketCoercion>> TABLE = new EnumMap<>(SocketType.class);

    static {
        for (SocketType from : SocketType.values()) {
            Map<SocketType, SocketCoercion> row = new EnumMap<>(SocketType.class);
            for (SocketType to : SocketType.values())
                row.put(to, REJECT);
            row.put(from, IDENTITY);
            TABLE.put(from, row);
        }
        TABLE.get(SocketType.COLOR).put(SocketType.VEC3, IDENTITY);
        TABLE.get(SocketType.VEC3).put(SocketType.COLOR, IDENTITY);
    }

    private final boolean connectable;

    SocketCoercion(boolean connectable) {
        this.connectable = connectable;
    }

    public boolean connectable() {
        return connectable;
    }

    public static SocketCoercion of(SocketType from, SocketType to) {
        return TABLE.get(from).get(to);
    }

    /**
     * Pads or truncates {@code components} to the arity of {@code destination}. Missing trailing
     * components become 0.
     */
    public static double[] fit(double[] components, SocketType destination) {
        int arity = Math.max(destination.components(), 1);
        double[] out = new double[arity];
        System.arraycopy(components, 0, out, 0, Math.min(components.length, arity));
        return out;
    }
}
