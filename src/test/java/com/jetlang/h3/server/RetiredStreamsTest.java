package com.jetlang.h3.server;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class RetiredStreamsTest {

    private final RetiredStreams retired = new RetiredStreams();

    @Test
    public void inOrderRetirementHoldsNoIds() {
        for (long id = 0; id < 4000; id += 4) {
            retired.retire(id);
        }
        assertEquals(0, retired.pending());
        assertTrue(retired.isRetired(0));
        assertTrue(retired.isRetired(3996));
        assertFalse(retired.isRetired(4000));
    }

    @Test
    public void outOfOrderIdsCompactOnceTheGapCloses() {
        retired.retire(8);
        retired.retire(4);
        assertEquals(2, retired.pending());
        assertTrue(retired.isRetired(8));
        assertFalse(retired.isRetired(0));

        retired.retire(0);
        assertEquals(0, retired.pending());
        assertTrue(retired.isRetired(4));
        assertFalse(retired.isRetired(12));
    }

    @Test
    public void streamTypesAreTrackedSeparately() {
        retired.retire(0);
        retired.retire(1);
        assertTrue(retired.isRetired(1));
        assertFalse(retired.isRetired(2));
        assertFalse(retired.isRetired(5));
        retired.retire(0);
        assertEquals(0, retired.pending());
    }
}
