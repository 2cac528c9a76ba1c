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
import java.awt.Rectangle;

import javax.swing.JButton;
import javax.swing.JComboBox;
import javax.swing.JTextField;

import org.junit.Test;

import gov.sandia.pgrid.property.BoolProperty;
import gov.sandia.pgrid.property.StringProperty;
import gov.sandia.pgrid.property.ValueHolder;

public class ButtonEditorsTest {
    @Test
    public void testTextCtrlAndButton() {
        StubHost host = new StubHost();
        TextCtrlAndButtonEditor editor = new TextCtrlAndButtonEditor();
        StringProperty path = new StringProperty("Path", "path", "/tmp");
        ControlSet controls = editor.createControls(host, path, new Point(10, 0), new Dimension(100, 20));
        editor.updateControl(path, controls);

        JTextField field = (JTextField) controls.getPrimary();
        JButton button = (JButton) controls.getSecondary();
        assertEquals(new Rectangle(10, 0, 80, 20), field.getBounds());
        assertEquals(new Rectangle(90, 0, 20, 20), button.getBounds());
        assertEquals("...", button.getText());
        assertEquals(ControlIds.SUBID2, ControlIds.get(button));
        assertEquals(2, host.panel.getComponentCount());

        assertFalse(editor.onEvent(host, path, field, new EditorEvent(button, EditorEvent.Type.BUTTON_CLICKED)));
        field.setText("/var");
        assertTrue(editor.onEvent(host, path, field, new EditorEvent(field, EditorEvent.Type.TEXT_UPDATED)));
    }

    @Test
    public void testChoiceAndButton() {
        StubHost host = new StubHost();
        ChoiceAndButtonEditor editor = new ChoiceAndButtonEditor();
        BoolProperty flag = new BoolProperty("Flag", "flag", false);
        ControlSet controls = editor.createControls(host, flag, new Point(0, 0), new Dimension(100, 20));
        editor.updateControl(flag, controls);

        JComboBox<?> combo = (JComboBox<?>) controls.getPrimary();
        JButton button = (JButton) controls.getSecondary();
        assertEquals(80, combo.getWidth());
        assertEquals(80, button.getX());
        assertFalse(editor.getValueFromControl(new ValueHolder(), flag, controls));
        assertFalse(editor.onEvent(host, flag, combo, new EditorEvent(button, EditorEvent.Type.BUTTON_CLICKED)));
    }
}
