/*
Copyright 2025 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.pgrid.editor;

import java.awt.Dimension;
import java.awt.Point;

import javax.swing.JComboBox;
import javax.swing.JComponent;

import gov.sandia.pgrid.property.Property;
import gov.sandia.pgrid.property.ValueHolder;

/**
    Editable drop-down. The choices are suggestions only. The text in the box is what gets
    converted, through Property.stringToValue().
**/
public class ComboBoxEditor extends ChoiceEditor
{
    public static final String NAME = "ComboBox";

    public ComboBoxEditor ()
    {
        super (NAME);
    }

    public ControlSet createControls (EditorHost host, Property property, Point position, Dimension size)
    {
        return new ControlSet (createComboBox (host, property, position, size, true));
    }

    protected static String getText (JComboBox<String> combo)
    {
        Object item = combo.getEditor ().getItem ();
        if (item == null) return "";
        return item.toString ();
    }

    public void updateControl (Property property, ControlSet controls)
    {
        if (property.isValueUnspecified ())
        {
            setValueToUnspecified (property, controls);
            return;
        }
        JComboBox<String> combo = combo (controls.getPrimary ());
        String text = property.getValueAsString ();
        if (! text.equals (combo.getSelectedItem ())) combo.setSelectedItem (text);
        if (! text.equals (getText (combo)))          combo.getEditor ().setItem (text);
        markUnspecified (combo, false);
    }

    public boolean onEvent (EditorHost host, Property property, JComponent primary, EditorEvent event)
    {
        if (event.getSource () != primary) return false;
        switch (event.getType ())
        {
            case CHOICE_SELECTED:
            case TEXT_UPDATED:
                markUnspecified (primary, false);
                return getValueFromControl (new ValueHolder (), property, new ControlSet (primary));
            case TEXT_ENTER:
                return getValueFromControl (new ValueHolder (), property, new ControlSet (primary));
            default:
                return false;
        }
    }

    public boolean getValueFromControl (ValueHolder result, Property property, ControlSet controls)
    {
        JComboBox<String> combo = combo (controls.getPrimary ());
        if (isMarkedUnspecified (combo))
        {
            result.setUnspecified ();
            return ! property.isValueUnspecified ();
        }
        return property.stringToValue (result, getText (combo));
    }

    public void setControlStringValue (Property property, JComponent control, String text)
    {
        JComboBox<String> combo = combo (control);
        combo.setSelectedItem (text);
        combo.getEditor ().setItem (text);
        markUnspecified (control, false);
    }

    public void setValueToUnspecified (Property property, ControlSet controls)
    {
        JComboBox<String> combo = combo (controls.getPrimary ());
        combo.setSelectedIndex (-1);
        combo.getEditor ().setItem ("");
        markUnspecified (combo, true);
    }
}
