/*
Copyright 2025 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.pgrid.editor;

import java.awt.Dimension;
import java.awt.Point;

import javax.swing.JButton;
import javax.swing.JComponent;
import javax.swing.JTextField;

import gov.sandia.pgrid.property.Property;

/**
    Text box with a "..." button at its right end.
    The editor itself does nothing with the button. A property that wants to react to it
    (say, by opening a dialog) overrides Property.onEvent() and looks for BUTTON_CLICKED with id SUBID2.
**/
public class TextCtrlAndButtonEditor extends TextCtrlEditor
{
    public static final String NAME = "TextCtrlAndButton";

    public TextCtrlAndButtonEditor ()
    {
        super (NAME);
    }

    public ControlSet createControls (EditorHost host, Property property, Point position, Dimension size)
    {
        JButton button = generateEditorButton (host, position, size);
        Dimension primarySize = new Dimension (size.width - button.getWidth (), size.height);
        JTextField field = createTextField (host, property, position, primarySize);
        return new ControlSet (field, button);
    }

    public boolean onEvent (EditorHost host, Property property, JComponent primary, EditorEvent event)
    {
        if (event.getType () == EditorEvent.Type.BUTTON_CLICKED) return false;
        return super.onEvent (host, property, primary, event);
    }
}
