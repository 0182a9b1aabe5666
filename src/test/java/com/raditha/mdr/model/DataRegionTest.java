package com.raditha.mdr.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DataRegionTest {

    private static final NodeId TR = new NodeId("tr", 9);

    @Test
    void testEquality() {
        NodeId body = new NodeId("body", 0);
        assertEquals(new DataRegion(body, 3, 5, 9), new DataRegion(body, 3, 5, 9));
        assertNotSame(new DataRegion(body, 3, 5, 9), new DataRegion(body, 3, 5, 9));
    }

    @Test
    void testBinaryFromLastGNode() {
        GNode gnode = new GNode(new NodeId("table", 0), 4, 6);
        DataRegion region = DataRegion.binaryFromLastGNode(gnode);

        assertEquals(gnode.parent(), region.parent());
        assertEquals(gnode.size(), region.gnodeSize());
        assertEquals(gnode.start() - gnode.size(), region.firstGNodeStartIndex());
        assertEquals(2 * gnode.size(), region.nNodesCovered());
        assertEquals(gnode.end() - 1, region.lastCoveredIndex());
        assertEquals(2, region.nGNodes());
        assertTrue(region.contains(4));
        assertTrue(region.contains(5));
        assertFalse(region.contains(6));
    }

    @Test
    void testNGNodesAndLastCoveredIndex() {
        DataRegion region = new DataRegion(TR, 2, 0, 2 * 3);
        assertEquals(3, region.nGNodes());
        assertEquals(5, region.lastCoveredIndex());
    }

    @Test
    void testExtendOneGNode() {
        DataRegion region = new DataRegion(TR, 2, 0, 2 * 3);
        assertEquals(new DataRegion(TR, 2, 0, 2 * 4), region.extendOneGNode());
    }

    @Test
    void testContainsBoundaries() {
        DataRegion region = new DataRegion(TR, 2, 5, 2 * 2);
        assertFalse(region.contains(4));
        assertFalse(region.contains(9));
        for (int i = 5; i < 9; i++) {
            assertTrue(region.contains(i), "index " + i);
        }
    }

    @Test
    void testIterationCoversRangeWithoutGaps() {
        DataRegion region = new DataRegion(TR, 2, 5, 2 * 2);

        List<GNode> gnodes = new ArrayList<>();
        region.forEach(gnodes::add);

        assertEquals(List.of(new GNode(TR, 5, 7), new GNode(TR, 7, 9)), gnodes);
        assertEquals(region.firstGNodeStartIndex(), gnodes.get(0).start());
        assertEquals(region.lastCoveredIndex(), gnodes.get(gnodes.size() - 1).end() - 1);
    }

    @Test
    void testOverlaps() {
        DataRegion left = new DataRegion(TR, 1, 0, 3);
        DataRegion touching = new DataRegion(TR, 1, 3, 2);
        DataRegion crossing = new DataRegion(TR, 2, 2, 4);
        DataRegion elsewhere = new DataRegion(new NodeId("tr", 10), 1, 0, 3);

        assertFalse(left.overlaps(touching));
        assertTrue(left.overlaps(crossing));
        assertFalse(left.overlaps(elsewhere));
    }

    @Test
    void testRejectsBrokenInvariants() {
        assertThrows(IllegalArgumentException.class, () -> new DataRegion(TR, 2, 0, 5));
        assertThrows(IllegalArgumentException.class, () -> new DataRegion(TR, 2, 0, 2));
        assertThrows(IllegalArgumentException.class, () -> new DataRegion(TR, 0, 0, 2));
        assertThrows(IllegalArgumentException.class, () -> new DataRegion(TR, 1, -1, 2));
    }

    @Test
    void testFormatting() {
        DataRegion region = new DataRegion(TR, 2, 0, 6);
        assertEquals("DR(2, 0, 6)", region.toString());
        assertEquals("DR(tr-00009, 2, 0, 6)", region.toLongString());
    }
}
