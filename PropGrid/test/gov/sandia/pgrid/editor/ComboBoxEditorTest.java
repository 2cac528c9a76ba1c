/*
Copyright 2025 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.pgrid.editor;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.awt.Dimension;
import java.awt.Point;
import java.util.Arrays;

import javax.swing.JComboBox;

import org.junit.Before;
import org.junit.Test;

import gov.sandia.pgrid.property.StringProperty;
import gov.sandia.pgrid.property.ValueHolder;

public class ComboBoxEditorTest {
    private StubHost host;
    private ComboBoxEditor editor;
    private StringProperty fruit;
    private ControlSet controls;
    private JComboBox<?> combo;

    @Before
    public void setup() {
        host = new StubHost();
        editor = new ComboBoxEditor();
        fruit = new StringProperty("Fruit", "fruit", "pear");
        fruit.setSuggestions(Arrays.asList("apple", "pear"));
        controls = editor.createControls(host, fruit, new Point(0, 0), new Dimension(100, 20));
        editor.updateControl(fruit, controls);
        combo = (JComboBox<?>) controls.getPrimary();
    }

    @Test
    public void testUpdateThenGetIsUnchanged() {
        assertTrue(combo.isEditable());
        assertEquals("pear", combo.getEditor().getItem());
        assertFalse(editor.getValueFromControl(new ValueHolder(), fruit, controls));
    }

    @Test
    public void testFreeText() {
        combo.getEditor().setItem("quince");
        assertTrue(editor.onEvent(host, fruit, combo, new EditorEvent(combo, EditorEvent.Type.TEXT_UPDATED)));
        ValueHolder holder = new ValueHolder();
        assertTrue(editor.getValueFromControl(holder, fruit, controls));
        assertEquals("quince", holder.getValue());
    }

    @Test
    public void testUnspecifiedRoundTrip() {
        editor.setValueToUnspecified(fruit, controls);
        ValueHolder holder = new ValueHolder();
        assertTrue(editor.getValueFromControl(holder, fruit, controls));
        assertTrue(holder.isUnspecified());

        editor.setControlStringValue(fruit, combo, "apple");
        holder = new ValueHolder();
        assertTrue(editor.getValueFromControl(holder, fruit, controls));
        assertEquals("apple", holder.getValue());
    }
}
