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
    Drop-down list of the property's choices. The selected position is converted with Property.intToValue().
    insertItem() and deleteItem() touch only the list, so they must mirror a change already made to the property's choices.
**/
public class ChoiceEditor extends EditorBase
{
    public static final String NAME = "Choice";

    public ChoiceEditor ()
    {
        this (NAME);
    }

    protected ChoiceEditor (String name)
    {
        super (name);
    }

    public ControlSet createControls (EditorHost host, Property property, Point position, Dimension size)
    {
        return new ControlSet (createComboBox (host, property, position, size, false));
    }

    protected JComboBox<String> createComboBox (EditorHost host, Property property, Point position, Dimension size, boolean editable)
    {
        JComboBox<String> combo = new JComboBox<String> ();
        for (String choice : property.getChoices ()) combo.addItem (choice);
        combo.setEditable (editable);  // must be settled before connect(), which looks at it
        combo.setSelectedIndex (-1);
        placePrimary (host, combo, position, size);
        return combo;
    }

    @SuppressWarnings("unchecked")
    protected static JComboBox<String> combo (JComponent control)
    {
        return (JComboBox<String>) control;
    }

    public void updateControl (Property property, ControlSet controls)
    {
        if (property.isValueUnspecified ())
        {
            setValueToUnspecified (property, controls);
            return;
        }
        JComboBox<String> combo = combo (controls.getPrimary ());
        int index = property.getChoiceSelection ();
        if (combo.getSelectedIndex () != index) combo.setSelectedIndex (index);
        markUnspecified (combo, false);
    }

    public boolean onEvent (EditorHost host, Property property, JComponent primary, EditorEvent event)
    {
        if (event.getSource () != primary) return false;
        if (event.getType () != EditorEvent.Type.CHOICE_SELECTED) return false;
        if (combo (primary).getSelectedIndex () < 0) return false;  // Selection was cleared rather than made.
        markUnspecified (primary, false);
        return getValueFromControl (new ValueHolder (), property, new ControlSet (primary));
    }

    public boolean getValueFromControl (ValueHolder result, Property property, ControlSet controls)
    {
        JComboBox<String> combo = combo (controls.getPrimary ());
        if (isMarkedUnspecified (combo))
        {
            result.setUnspecified ();
            return ! property.isValueUnspecified ();
        }
        int index = combo.getSelectedIndex ();
        if (index < 0) return false;
        return property.intToValue (result, index);
    }

    public void setValueToUnspecified (Property property, ControlSet controls)
    {
        JComboBox<String> combo = combo (controls.getPrimary ());
        combo.setSelectedIndex (-1);
        markUnspecified (combo, true);
    }

    public void setControlStringValue (Property property, JComponent control, String text)
    {
        combo (control).setSelectedItem (text);
        markUnspecified (control, false);
    }

    public void setControlIntValue (Property property, JComponent control, int value)
    {
        combo (control).setSelectedIndex (value);
        markUnspecified (control, false);
    }

    public int insertItem (JComponent control, String label, int index)
    {
        JComboBox<String> combo = combo (control);
        if (index < 0)
        {
            combo.addItem (label);
            return combo.getItemCount () - 1;
        }
        combo.insertItemAt (label, index);
        return index;
    }

    public void deleteItem (JComponent control, int index)
    {
        combo (control).removeItemAt (index);
    }

    public boolean canContainCustomImage ()
    {
        return true;
    }
}
