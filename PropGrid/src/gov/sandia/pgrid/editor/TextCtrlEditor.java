/*
Copyright 2025 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.pgrid.editor;

import java.awt.Dimension;
import java.awt.Point;
import java.awt.event.ActionEvent;

import javax.swing.AbstractAction;
import javax.swing.JComponent;
import javax.swing.JTextField;

import gov.sandia.pgrid.property.Property;
import gov.sandia.pgrid.property.ValueHolder;
import gov.sandia.pgrid.ui.NTextField;

/**
    Single-line text box. Every change of text that converts to a new value is reported,
    so the property follows along as the user types. Text that fails to convert is simply not reported.
**/
public class TextCtrlEditor extends EditorBase
{
    public static final String NAME = "TextCtrl";

    public TextCtrlEditor ()
    {
        this (NAME);
    }

    protected TextCtrlEditor (String name)
    {
        super (name);
    }

    public ControlSet createControls (EditorHost host, Property property, Point position, Dimension size)
    {
        return new ControlSet (createTextField (host, property, position, size));
    }

    /**
        Builds the text field used as primary control by this editor and its descendants.
        The escape key reloads the field from the property.
    **/
    protected JTextField createTextField (EditorHost host, Property property, Point position, Dimension size)
    {
        final NTextField field = new NTextField (host.getUndoManager ());
        field.getActionMap ().put ("Cancel", new AbstractAction ("Cancel")
        {
            public void actionPerformed (ActionEvent evt)
            {
                updateControl (property, new ControlSet (field));
            }
        });
        placePrimary (host, field, position, size);
        return field;
    }

    public void updateControl (Property property, ControlSet controls)
    {
        if (property.isValueUnspecified ())
        {
            setValueToUnspecified (property, controls);
            return;
        }
        JTextField field = (JTextField) controls.getPrimary ();
        String text = property.getValueAsString ();
        if (! field.getText ().equals (text)) field.setText (text);
        markUnspecified (field, false);
    }

    public boolean onEvent (EditorHost host, Property property, JComponent primary, EditorEvent event)
    {
        if (event.getSource () != primary) return false;
        switch (event.getType ())
        {
            case TEXT_UPDATED:
                markUnspecified (primary, false);  // Any edit by the user replaces the blank state.
                return valueDiffers (property, primary);
            case TEXT_ENTER:
                return valueDiffers (property, primary);
            default:
                return false;
        }
    }

    /**
        Runs the conversion on a scratch holder.
        @return true if the control currently converts to a value different from the property's.
    **/
    protected boolean valueDiffers (Property property, JComponent primary)
    {
        return getValueFromControl (new ValueHolder (), property, new ControlSet (primary));
    }

    public boolean getValueFromControl (ValueHolder result, Property property, ControlSet controls)
    {
        JTextField field = (JTextField) controls.getPrimary ();
        if (isMarkedUnspecified (field))
        {
            result.setUnspecified ();
            return ! property.isValueUnspecified ();
        }
        return property.stringToValue (result, field.getText ());
    }

    public void setValueToUnspecified (Property property, ControlSet controls)
    {
        JTextField field = (JTextField) controls.getPrimary ();
        field.setText ("");
        markUnspecified (field, true);  // after setText(), since the resulting document event would clear the mark
    }

    public void setControlStringValue (Property property, JComponent control, String text)
    {
        ((JTextField) control).setText (text);
        markUnspecified (control, false);
    }

    public void onFocus (Property property, JComponent control)
    {
        ((JTextField) control).selectAll ();
    }

    public boolean canContainCustomImage ()
    {
        return true;
    }
}
