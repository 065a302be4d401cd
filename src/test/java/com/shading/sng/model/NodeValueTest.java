package com.shading.sng.model;

import static org.junit.Assert.*;

import java.util.List;

import org.junit.Test;

public class NodeValueTest {

    @Test
    public void testOfNumberIsScalar() {
        assertEquals(new NodeValue.Scalar(3.0), NodeValue.of(3));
    }

    @Test
    public void testOfListIsVector() {
        NodeValue v = NodeValue.of(List.of(0.5, 1));
        assertTrue(v instanceof NodeValue.Vector);
        assertArrayEquals(new double[] { 0.5, 1.0 }, v.components(), 0.0);
    }

    @Test
    public void testVectorIsDefensivelyCopied() {
        double[] raw = { 1, 2, 3 };
        NodeValue.Vector v = NodeValue.vector(raw);
        raw[0] = 9;
        v.components()[1] = 9;
        assertEquals(NodeValue.vector(1, 2, 3), v);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testSingleComponentVectorRejected() {
        NodeValue.vector(1);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnsupportedRawRejected() {
        NodeValue.of("red");
    }
}
