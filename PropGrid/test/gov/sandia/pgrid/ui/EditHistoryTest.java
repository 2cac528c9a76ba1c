/*
Copyright 2025 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.pgrid.ui;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import javax.swing.undo.CannotUndoException;

import org.junit.Before;
import org.junit.Test;

import gov.sandia.pgrid.editor.EditorRegistry;
import gov.sandia.pgrid.property.IntProperty;

public class EditHistoryTest {
    private PropertyGrid grid;
    private IntProperty width;
    private IntProperty height;
    private EditHistory history;

    @Before
    public void setup() {
        grid = new PropertyGrid(EditorRegistry.createDefault(), new GridSettings());
        width = (IntProperty) grid.append(new IntProperty("Width", "width", 10));
        height = (IntProperty) grid.append(new IntProperty("Height", "height", 20));
        history = new EditHistory();
    }

    @Test
    public void testRecordPerformsChange() {
        assertTrue(history.record(new ChangePropertyValue(grid, width, 11, 1)));
        assertEquals(11, width.getValue());
        assertEquals("Undo change Width", history.getUndoPresentationName());
        history.undo();
        assertEquals(10, width.getValue());
        history.redo();
        assertEquals(11, width.getValue());
    }

    @Test
    public void testRecordedValueIsCoerced() {
        ChangePropertyValue change = new ChangePropertyValue(grid, width, "12", 1);
        history.record(change);
        assertEquals(12, change.getValueAfter());
    }

    @Test
    public void testSameSessionMerges() {
        history.record(new ChangePropertyValue(grid, width, 11, 1));
        history.record(new ChangePropertyValue(grid, width, 12, 1));
        assertEquals(1, history.size());
        history.record(new ChangePropertyValue(grid, width, 10, 1));
        assertEquals(10, width.getValue());
        assertEquals(0, history.size());
        assertFalse(history.canUndo());
    }

    @Test
    public void testNoMergeAcrossSessionsOrProperties() {
        history.record(new ChangePropertyValue(grid, width, 11, 1));
        history.record(new ChangePropertyValue(grid, width, 12, 2));
        history.record(new ChangePropertyValue(grid, height, 21, 2));
        assertEquals(3, history.size());
        history.undo();
        assertEquals(20, height.getValue());
        assertEquals(12, width.getValue());
    }

    @Test
    public void testForget() {
        history.record(new ChangePropertyValue(grid, width, 11, 1));
        history.record(new ChangePropertyValue(grid, height, 21, 2));
        history.record(new ChangePropertyValue(grid, width, 12, 3));
        history.forget(width);
        assertEquals(1, history.size());
        history.undo();
        assertEquals(20, height.getValue());
        assertFalse(history.canUndo());
    }

    @Test
    public void testUndoAfterRemoval() {
        history.record(new ChangePropertyValue(grid, width, 11, 1));
        grid.removeProperty(width);
        try {
            history.undo();
            fail("Expected CannotUndoException");
        } catch (CannotUndoException e) {
            assertEquals(11, width.getValue());
        }
    }
}
