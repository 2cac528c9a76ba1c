/*
Copyright 2025 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.pgrid.editor;

import java.awt.Dimension;
import java.awt.Graphics;
import java.awt.Point;
import java.awt.Rectangle;

import javax.swing.JCheckBox;
import javax.swing.JComponent;

import gov.sandia.pgrid.property.BoolProperty;
import gov.sandia.pgrid.property.Property;
import gov.sandia.pgrid.property.ValueHolder;

/**
    Check box. Converts through Property.intToValue() with 1 for checked and 0 for clear.
**/
public class CheckBoxEditor extends EditorBase
{
    public static final String NAME = "CheckBox";

    public CheckBoxEditor ()
    {
        super (NAME);
    }

    public ControlSet createControls (EditorHost host, Property property, Point position, Dimension size)
    {
        JCheckBox box = new JCheckBox ();
        box.setOpaque (false);
        placePrimary (host, box, position, size);
        return new ControlSet (box);
    }

    /**
        Interprets the property's value as a boolean. Numbers are true when non-zero.
    **/
    public static boolean isChecked (Property property)
    {
        Object value = property.getValue ();
        if (value == null)              return false;
        if (value instanceof Boolean)   return (Boolean) value;
        if (value instanceof Number)    return ((Number) value).doubleValue () != 0;
        Boolean b = BoolProperty.parse (property.getValueAsString ());
        return b != null  &&  b;
    }

    public void updateControl (Property property, ControlSet controls)
    {
        if (property.isValueUnspecified ())
        {
            setValueToUnspecified (property, controls);
            return;
        }
        JCheckBox box = (JCheckBox) controls.getPrimary ();
        boolean checked = isChecked (property);
        if (box.isSelected () != checked) box.setSelected (checked);
        markUnspecified (box, false);
    }

    public boolean onEvent (EditorHost host, Property property, JComponent primary, EditorEvent event)
    {
        if (event.getSource () != primary) return false;
        if (event.getType () != EditorEvent.Type.CHECKBOX_TOGGLED) return false;
        markUnspecified (primary, false);
        return getValueFromControl (new ValueHolder (), property, new ControlSet (primary));
    }

    public boolean getValueFromControl (ValueHolder result, Property property, ControlSet controls)
    {
        JCheckBox box = (JCheckBox) controls.getPrimary ();
        if (isMarkedUnspecified (box))
        {
            result.setUnspecified ();
            return ! property.isValueUnspecified ();
        }
        return property.intToValue (result, box.isSelected () ? 1 : 0);
    }

    public void setValueToUnspecified (Property property, ControlSet controls)
    {
        JCheckBox box = (JCheckBox) controls.getPrimary ();
        box.setSelected (false);
        markUnspecified (box, true);
    }

    public void setControlIntValue (Property property, JComponent control, int value)
    {
        ((JCheckBox) control).setSelected (value != 0);
        markUnspecified (control, false);
    }

    public void setControlStringValue (Property property, JComponent control, String text)
    {
        Boolean b = BoolProperty.parse (text);
        if (b == null) return;
        setControlIntValue (property, control, b ? 1 : 0);
    }

    /**
        Draws a small box, with a tick if the value is true. Nothing for unspecified.
    **/
    public void drawValue (Graphics g, Rectangle rect, Property property, String text)
    {
        if (property.isValueUnspecified ()) return;
        int side = Math.max (4, Math.min (rect.height - 4, 12));
        int x = rect.x + TEXT_MARGIN;
        int y = rect.y + (rect.height - side) / 2;
        g.drawRect (x, y, side, side);
        if (isChecked (property))
        {
            g.drawLine (x + 2,        y + side / 2, x + side / 2, y + side - 2);
            g.drawLine (x + side / 2, y + side - 2, x + side - 2, y + 2);
        }
    }
}
