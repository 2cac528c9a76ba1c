/*
Copyright 2025 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.pgrid.editor;

import java.awt.Dimension;
import java.awt.FontMetrics;
import java.awt.Graphics;
import java.awt.Insets;
import java.awt.Point;
import java.awt.Rectangle;

import javax.swing.JButton;
import javax.swing.JComponent;
import javax.swing.border.EmptyBorder;

import gov.sandia.pgrid.property.Property;

/**
    Default behavior for the optional parts of the Editor contract, plus utilities shared by the built-in editors.
**/
public abstract class EditorBase implements Editor
{
    public static final int TEXT_MARGIN = 2;  // Horizontal gap between cell edge and text, in pixels.

    protected static final String UNSPECIFIED = "gov.sandia.pgrid.unspecified";

    protected final String name;

    public EditorBase (String name)
    {
        if (name == null  ||  name.isEmpty ()) throw new IllegalArgumentException ("Editor name must not be empty");
        this.name = name;
    }

    public String getName ()
    {
        return name;
    }

    public void drawValue (Graphics g, Rectangle rect, Property property, String text)
    {
        if (text == null  ||  text.isEmpty ()) return;
        FontMetrics fm = g.getFontMetrics ();
        int y = rect.y + (rect.height - fm.getHeight ()) / 2 + fm.getAscent ();
        g.drawString (text, rect.x + TEXT_MARGIN, y);
    }

    public void setControlStringValue (Property property, JComponent control, String text)
    {
    }

    public void setControlIntValue (Property property, JComponent control, int value)
    {
    }

    public int insertItem (JComponent control, String label, int index)
    {
        return -1;
    }

    public void deleteItem (JComponent control, int index)
    {
    }

    public void onFocus (Property property, JComponent control)
    {
    }

    public boolean canContainCustomImage ()
    {
        return false;
    }

    /**
        Records on the control whether it currently shows the blank "unspecified" state.
        This is per-row state, so it lives with the control rather than in the editor.
    **/
    public static void markUnspecified (JComponent control, boolean value)
    {
        control.putClientProperty (UNSPECIFIED, value ? Boolean.TRUE : null);
    }

    public static boolean isMarkedUnspecified (JComponent control)
    {
        return Boolean.TRUE.equals (control.getClientProperty (UNSPECIFIED));
    }

    /**
        Creates the standard square button that sits at the right edge of the value cell.
        The button is added to the host and connected with id SUBID2.
        The caller should shrink its primary control by the button's width.
    **/
    public static JButton generateEditorButton (EditorHost host, Point position, Dimension size)
    {
        int width = Math.min (size.height, size.width);
        JButton button = new JButton (host.getButtonLabel ());
        button.setMargin (new Insets (0, 0, 0, 0));
        button.setFocusable (false);
        button.setBounds (position.x + size.width - width, position.y, width, size.height);
        host.getPanel ().add (button);
        host.connect (button, ControlIds.SUBID2);
        return button;
    }

    /**
        Common setup for a primary control: position, flat border, parenting and event connection.
    **/
    public static void placePrimary (EditorHost host, JComponent control, Point position, Dimension size)
    {
        control.setBounds (position.x, position.y, Math.max (0, size.width), size.height);
        control.setBorder (new EmptyBorder (0, TEXT_MARGIN, 0, 0));
        host.getPanel ().add (control);
        host.connect (control, ControlIds.SUBID1);
    }

    public String toString ()
    {
        return getClass ().getSimpleName () + "(" + name + ")";
    }
}
