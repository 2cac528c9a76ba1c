/*
Copyright 2025 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.pgrid.editor;

import java.awt.Component;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import javax.swing.JComponent;
import javax.swing.SwingUtilities;

/**
    The controls produced by one call to Editor.createControls().
    Once returned, the host owns them. The editor keeps no reference.
**/
public class ControlSet
{
    /**
        Signals that no controls could be created.
    **/
    public static final ControlSet EMPTY = new ControlSet (null, null);

    protected JComponent primary;
    protected JComponent secondary;

    public ControlSet (JComponent primary)
    {
        this (primary, null);
    }

    public ControlSet (JComponent primary, JComponent secondary)
    {
        this.primary   = primary;
        this.secondary = secondary;
    }

    public boolean isValid ()
    {
        return primary != null;
    }

    public JComponent getPrimary ()
    {
        return primary;
    }

    public JComponent getSecondary ()
    {
        return secondary;
    }

    public void setSecondary (JComponent secondary)
    {
        if (this == EMPTY) throw new IllegalStateException ("EMPTY is immutable");
        this.secondary = secondary;
    }

    public List<JComponent> getControls ()
    {
        if (primary == null) return Collections.emptyList ();
        List<JComponent> result = new ArrayList<JComponent> (2);
        result.add (primary);
        if (secondary != null) result.add (secondary);
        return result;
    }

    /**
        Determines if the given component is one of our controls or lives inside one of them.
    **/
    public boolean contains (Component c)
    {
        if (c == null) return false;
        for (JComponent control : getControls ())
        {
            if (c == control  ||  SwingUtilities.isDescendingFrom (c, control)) return true;
        }
        return false;
    }

    public String toString ()
    {
        if (! isValid ()) return "ControlSet(empty)";
        return "ControlSet(" + primary.getClass ().getSimpleName () + (secondary == null ? "" : "," + secondary.getClass ().getSimpleName ()) + ")";
    }
}
