/*
Copyright 2025 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.pgrid.property;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class AttributesTest {
    @Test
    public void testDefaults() {
        Attributes a = new Attributes();
        assertEquals("x", a.getOrDefault("x", "missing"));
        assertEquals(3, a.getOrDefault(3, "missing"));
        assertEquals(1.5, a.getOrDefault(1.5, "missing"), 0);
        assertTrue(a.getOrDefault(true, "missing"));
        assertEquals("", a.get("missing"));
    }

    @Test
    public void testTypedValues() {
        Attributes a = new Attributes();
        a.set(true, "flag");
        a.set(2.0, "count");
        a.set("abc", "word");
        assertEquals("1", a.get("flag"));
        assertTrue(a.getBoolean("flag"));
        assertEquals(2, a.getInt("count"));
        assertEquals(7, a.getOrDefault(7, "word"));
        assertEquals(3, a.size());

        a.set(null, "word");
        assertFalse(a.containsKey("word"));
        a.set("", "count");
        assertEquals(9, a.getOrDefault(9, "count"));
    }

    @Test
    public void testMerge() {
        Attributes a = new Attributes();
        a.set("1", "x");
        Attributes b = new Attributes();
        b.set("2", "x");
        b.set("3", "y");
        a.merge(b);
        assertEquals("2", a.get("x"));
        assertEquals("3", a.get("y"));
        for (String key : a) a.clear(key);
        assertTrue(a.isEmpty());
    }
}
