/*
Copyright 2025 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.pgrid.editor;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.awt.Dimension;
import java.awt.Point;
import java.awt.Rectangle;
import java.awt.event.ActionEvent;

import javax.swing.JTextField;

import org.junit.Before;
import org.junit.Test;

import gov.sandia.pgrid.property.FloatProperty;
import gov.sandia.pgrid.property.IntProperty;
import gov.sandia.pgrid.property.StringProperty;
import gov.sandia.pgrid.property.ValueHolder;

public class TextCtrlEditorTest {
    private StubHost host;
    private TextCtrlEditor editor;
    private IntProperty property;
    private ControlSet controls;
    private JTextField field;

    @Before
    public void setup() {
        host = new StubHost();
        editor = new TextCtrlEditor();
        property = new IntProperty("Count", "count", 5);
        controls = editor.createControls(host, property, new Point(120, 40), new Dimension(100, 20));
        host.controls = controls;
        editor.updateControl(property, controls);
        field = (JTextField) controls.getPrimary();
    }

    @Test
    public void testCreateControls() {
        assertTrue(controls.isValid());
        assertNull(controls.getSecondary());
        assertEquals(new Rectangle(120, 40, 100, 20), field.getBounds());
        assertSame(host.panel, field.getParent());
        assertEquals(ControlIds.SUBID1, ControlIds.get(field));
        assertTrue(host.connected.contains(field));
    }

    @Test
    public void testUpdateThenGetIsUnchanged() {
        assertEquals("5", field.getText());
        ValueHolder holder = new ValueHolder();
        assertFalse(editor.getValueFromControl(holder, property, controls));
        assertEquals(5, holder.getValue());
    }

    @Test
    public void testRoundedDisplayIsUnchanged() {
        FloatProperty pi = new FloatProperty("Pi", "pi", 3.14159265358979);
        ControlSet piControls = editor.createControls(host, pi, new Point(0, 0), new Dimension(100, 20));
        editor.updateControl(pi, piControls);
        assertEquals("3.141593", ((JTextField) piControls.getPrimary()).getText());
        assertFalse(editor.getValueFromControl(new ValueHolder(), pi, piControls));
    }

    @Test
    public void testTyping() {
        field.setText("7");
        assertTrue(editor.onEvent(host, property, field, new EditorEvent(field, EditorEvent.Type.TEXT_UPDATED)));
        ValueHolder holder = new ValueHolder();
        assertTrue(editor.getValueFromControl(holder, property, controls));
        assertEquals(7, holder.getValue());
        assertEquals(5, property.getValue());  // editor never writes the property
    }

    @Test
    public void testInvalidText() {
        field.setText("abc");
        assertFalse(editor.onEvent(host, property, field, new EditorEvent(field, EditorEvent.Type.TEXT_UPDATED)));
        assertFalse(editor.getValueFromControl(new ValueHolder(), property, controls));
    }

    @Test
    public void testOutOfRange() {
        property.setAttribute(IntProperty.MAX, 10);
        field.setText("11");
        assertFalse(editor.onEvent(host, property, field, new EditorEvent(field, EditorEvent.Type.TEXT_ENTER)));
        field.setText("10");
        assertTrue(editor.onEvent(host, property, field, new EditorEvent(field, EditorEvent.Type.TEXT_ENTER)));
    }

    @Test
    public void testUnspecifiedRoundTrip() {
        editor.setValueToUnspecified(property, controls);
        assertEquals("", field.getText());
        ValueHolder holder = new ValueHolder();
        assertTrue(editor.getValueFromControl(holder, property, controls));
        assertTrue(holder.isUnspecified());

        property.setValueToUnspecified();
        editor.updateControl(property, controls);
        holder = new ValueHolder();
        assertFalse(editor.getValueFromControl(holder, property, controls));
        assertTrue(holder.isUnspecified());
    }

    @Test
    public void testTypingReplacesUnspecified() {
        editor.setValueToUnspecified(property, controls);
        assertTrue(EditorBase.isMarkedUnspecified(field));
        field.setText("3");
        assertTrue(editor.onEvent(host, property, field, new EditorEvent(field, EditorEvent.Type.TEXT_UPDATED)));
        assertFalse(EditorBase.isMarkedUnspecified(field));
        ValueHolder holder = new ValueHolder();
        editor.getValueFromControl(holder, property, controls);
        assertEquals(3, holder.getValue());
    }

    @Test
    public void testEmptyStringIsAValue() {
        StringProperty name = new StringProperty("Name", "name", "abc");
        ControlSet nameControls = editor.createControls(host, name, new Point(0, 0), new Dimension(100, 20));
        editor.updateControl(name, nameControls);
        ((JTextField) nameControls.getPrimary()).setText("");
        ValueHolder holder = new ValueHolder();
        assertTrue(editor.getValueFromControl(holder, name, nameControls));
        assertEquals("", holder.getValue());
        assertFalse(holder.isUnspecified());
    }

    @Test
    public void testForeignEventIgnored() {
        field.setText("9");
        JTextField other = new JTextField("9");
        assertFalse(editor.onEvent(host, property, field, new EditorEvent(other, EditorEvent.Type.TEXT_UPDATED)));
    }

    @Test
    public void testSetControlStringValue() {
        editor.setControlStringValue(property, field, "42");
        assertEquals("42", field.getText());
        ValueHolder holder = new ValueHolder();
        assertTrue(editor.getValueFromControl(holder, property, controls));
        assertEquals(42, holder.getValue());
    }

    @Test
    public void testOnFocusSelectsAll() {
        field.setText("12345");
        editor.onFocus(property, field);
        assertEquals(0, field.getSelectionStart());
        assertEquals(5, field.getSelectionEnd());
    }

    @Test
    public void testCancelRestoresValue() {
        field.setText("99");
        field.getActionMap().get("Cancel").actionPerformed(new ActionEvent(field, ActionEvent.ACTION_PERFORMED, "Cancel"));
        assertEquals("5", field.getText());
    }

    @Test
    public void testOptionalOperations() {
        assertEquals(-1, editor.insertItem(field, "x", 0));
        editor.deleteItem(field, 0);
        assertTrue(editor.canContainCustomImage());
    }
}
