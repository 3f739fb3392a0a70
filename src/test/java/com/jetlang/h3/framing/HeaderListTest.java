package com.jetlang.h3.framing;

import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class HeaderListTest {

    @Test
    public void keepsOrderAndDuplicates() {
        HeaderList headers = HeaderList.of("accept", "a", "cookie", "x=1", "cookie", "y=2");
        assertEquals(3, headers.size());
        assertEquals("x=1", headers.get("cookie"));
        assertEquals(Arrays.asList("x=1", "y=2"), headers.getAll("cookie"));
        assertNull(headers.get("missing"));
        assertEquals("accept", headers.getHeaders().get(0).getName());
    }

    @Test
    public void pseudoHeaders() {
        assertTrue(new HeaderList.Header(":path", "/").isPseudoHeader());
        assertFalse(new HeaderList.Header("path", "/").isPseudoHeader());
    }

    @Test(expected = UnsupportedOperationException.class)
    public void unmodifiableView() {
        HeaderList.of("a", "b").unmodifiable().add("c", "d");
    }

    @Test(expected = IllegalArgumentException.class)
    public void oddNumberOfValues() {
        HeaderList.of("a");
    }
}
