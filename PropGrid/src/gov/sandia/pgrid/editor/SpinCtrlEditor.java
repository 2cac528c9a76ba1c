/*
Copyright 2025 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.pgrid.editor;

import java.awt.Dimension;
import java.awt.Point;
import java.awt.event.KeyEvent;

import javax.swing.JComponent;
import javax.swing.JTextField;

import org.apache.log4j.Logger;

import gov.sandia.pgrid.property.NumericProperty;
import gov.sandia.pgrid.property.Property;

/**
    Text box for a number, with "+" and "-" buttons. The up and down arrow keys do the same as the buttons.
    Understands these property attributes:
    <ul>
    <li>Step -- amount added per click (default 1)</li>
    <li>Min, Max -- limits; a step that would cross one stops at it</li>
    <li>Wrap -- if true, crossing one limit jumps to the other instead</li>
    </ul>
    Only works with NumericProperty. For anything else, control creation fails.
**/
public class SpinCtrlEditor extends TextCtrlEditor
{
    private static Logger logger = Logger.getLogger (SpinCtrlEditor.class);

    public static final String NAME = "SpinCtrl";

    public static final int UP   = 0;  // button positions within the cluster
    public static final int DOWN = 1;

    public SpinCtrlEditor ()
    {
        super (NAME);
    }

    public ControlSet createControls (EditorHost host, Property property, Point position, Dimension size)
    {
        if (! (property instanceof NumericProperty))
        {
            logger.warn (NAME + " can't edit non-numeric property " + property.getName ());
            return ControlSet.EMPTY;
        }

        MultiButtonControl buttons = new MultiButtonControl (host, size);
        buttons.add ("+");
        buttons.add ("-");
        JTextField field = createTextField (host, property, position, buttons.getPrimarySize ());
        buttons.finalizePosition (position);
        return new ControlSet (field, buttons);
    }

    public boolean onEvent (EditorHost host, Property property, JComponent primary, EditorEvent event)
    {
        int steps = 0;
        switch (event.getType ())
        {
            case BUTTON_CLICKED:
                int index = buttonIndex (host, event.getId ());
                if      (index == UP)   steps =  1;
                else if (index == DOWN) steps = -1;
                break;
            case KEY_PRESSED:
                if (event.getSource () != primary) return false;
                if      (event.getKeyCode () == KeyEvent.VK_UP)   steps =  1;
                else if (event.getKeyCode () == KeyEvent.VK_DOWN) steps = -1;
                break;
            default:
                return super.onEvent (host, property, primary, event);
        }
        if (steps == 0) return false;

        step (property, (JTextField) primary, steps);
        return valueDiffers (property, primary);
    }

    /**
        Maps a button id to its position in the cluster.
        Falls back on the automatic numbering when the host holds no cluster.
    **/
    protected int buttonIndex (EditorHost host, int id)
    {
        JComponent secondary = host == null ? null : host.getEditorControlSecondary ();
        if (secondary instanceof MultiButtonControl) return ((MultiButtonControl) secondary).indexOf (id);
        return id - ControlIds.SUBID_TEMP1;
    }

    /**
        Adds the given number of steps to the number shown in the field.
        If the field does not hold a number, starts from 0, or from Min if 0 is out of range.
    **/
    public void step (Property property, JTextField field, int steps)
    {
        NumericProperty numeric = (NumericProperty) property;
        double min  = numeric.getMin ();
        double max  = numeric.getMax ();
        double step = property.getAttributes ().getOrDefault (1.0, Property.STEP);
        boolean wrap = property.getAttributes ().getBoolean (Property.WRAP);

        double value;
        Number current = numeric.parse (field.getText ());
        if (current == null) value = Math.max (min, Math.min (max, 0));
        else                 value = current.doubleValue () + steps * step;

        if (value > max) value = wrap  &&  ! Double.isInfinite (min) ? min : max;
        if (value < min) value = wrap  &&  ! Double.isInfinite (max) ? max : min;

        setControlStringValue (property, field, numeric.valueToString (numeric.fromDouble (value)));
    }
}
