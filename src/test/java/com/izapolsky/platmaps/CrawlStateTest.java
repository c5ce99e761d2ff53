package com.izapolsky.platmaps;

import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class CrawlStateTest {

    private static final MapId START = MapId.parse("001-01");
    private static final MapId SECOND = MapId.parse("001-02");
    private static final MapId THIRD = MapId.parse("001-03");

    private CrawlState toTest;

    @Before
    public void setUp() {
        toTest = new CrawlState(START);
    }

    @Test
    public void testStartsWithSeedOnly() {
        assertTrue(toTest.hasNext());
        assertEquals(1, toTest.getQueueSize());
        assertTrue(toTest.getProcessed().isEmpty());
        assertTrue(toTest.getFailed().isEmpty());
    }

    @Test
    public void testFifoOrder() {
        toTest.offer(THIRD);
        toTest.offer(SECOND);
        assertEquals(START, toTest.poll());
        assertEquals(THIRD, toTest.poll());
        assertEquals(SECOND, toTest.poll());
        assertNull(toTest.poll());
        assertFalse(toTest.hasNext());
    }

    @Test
    public void testQueuedIdIsNotOfferedTwice() {
        assertTrue(toTest.offer(SECOND));
        assertFalse(toTest.offer(SECOND));
        assertFalse(toTest.offer(START));
        assertEquals(2, toTest.getQueueSize());
    }

    @Test
    public void testSettledIdsAreNotOffered() {
        toTest.poll();
        toTest.markProcessed(START);
        toTest.markFailed(SECOND);
        assertFalse(toTest.offer(START));
        assertFalse(toTest.offer(SECOND));
        assertTrue(toTest.isSettled(START));
        assertTrue(toTest.isSettled(SECOND));
        assertFalse(toTest.hasNext());
    }

    @Test
    public void testPolledIdCanBeOfferedUntilSettled() {
        assertEquals(START, toTest.poll());
        assertFalse(toTest.isQueued(START));
        assertTrue(toTest.offer(START));
    }

    @Test(expected = IllegalStateException.class)
    public void testProcessedAndFailedStayDisjoint() {
        toTest.markFailed(START);
        toTest.markProcessed(START);
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testProcessedIsReadOnly() {
        toTest.getProcessed().add(SECOND);
    }
}
