/*
Copyright 2025 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.pgrid.editor;

import java.awt.Dimension;
import java.awt.Point;

import javax.swing.JButton;
import javax.swing.JComboBox;
import javax.swing.JComponent;

import gov.sandia.pgrid.property.Property;

/**
    Drop-down with a "..." button at its right end. See TextCtrlAndButtonEditor regarding the button.
**/
public class ChoiceAndButtonEditor extends ChoiceEditor
{
    public static final String NAME = "ChoiceAndButton";

    public ChoiceAndButtonEditor ()
    {
        super (NAME);
    }

    public ControlSet createControls (EditorHost host, Property property, Point position, Dimension size)
    {
        JButton button = generateEditorButton (host, position, size);
        Dimension primarySize = new Dimension (size.width - button.getWidth (), size.height);
        JComboBox<String> combo = createComboBox (host, property, position, primarySize, false);
        return new ControlSet (combo, button);
    }

    public boolean onEvent (EditorHost host, Property property, JComponent primary, EditorEvent event)
    {
        if (event.getType () == EditorEvent.Type.BUTTON_CLICKED) return false;
        return super.onEvent (host, property, primary, event);
    }
}
