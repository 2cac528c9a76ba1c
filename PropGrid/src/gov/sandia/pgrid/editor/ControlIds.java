/*
Copyright 2025 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.pgrid.editor;

import java.awt.Component;

import javax.swing.JComponent;

/**
    Numeric identities for editor controls.
    The host routes events by these numbers, so every control in one ControlSet must carry a distinct id.
    The id is stored on the component itself as a client property.
**/
public class ControlIds
{
    public static final int AUTO        = -2;  ///< Request for an automatically assigned id.
    public static final int NONE        = -1;  ///< Returned for components that never received an id.
    public static final int SUBID1      = 2;   ///< Primary control.
    public static final int SUBID2      = 3;   ///< Secondary control (a button or a button cluster).
    public static final int SUBID_TEMP1 = 4;   ///< First id handed out automatically inside a button cluster.

    protected static final String KEY = "gov.sandia.pgrid.id";

    public static void set (JComponent control, int id)
    {
        control.putClientProperty (KEY, id);
    }

    public static int get (Component c)
    {
        if (! (c instanceof JComponent)) return NONE;
        Object id = ((JComponent) c).getClientProperty (KEY);
        if (id instanceof Integer) return (Integer) id;
        return NONE;
    }
}
