package com.parametric.nodegraph.util;

import static org.junit.Assert.*;

import org.junit.Test;

import com.parametric.nodegraph.model.Position;

public class BoundsTest {

    @Test
    public void testUnion() {
        Bounds u = new Bounds(0, 0, 10, 10).union(new Bounds(20, -5, 5, 5));
        assertEquals(new Bounds(0, -5, 25, 15), u);
        assertEquals(25, u.maxX(), 0);
        assertEquals(10, u.maxY(), 0);
        assertEquals(new Position(0, -5), u.topLeft());
    }

    @Test
    public void testContainsCentre() {
        Bounds frame = new Bounds(0, 0, 100, 100);
        assertTrue(frame.containsCentreOf(new Bounds(80, 80, 30, 30)));
        assertFalse(frame.containsCentreOf(new Bounds(90, 90, 30, 30)));
    }
}
