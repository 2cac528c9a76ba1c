/*
Copyright 2025 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.pgrid.editor;

import java.awt.Component;
import java.util.EventObject;

/**
    Toolkit-neutral description of something that happened on an editor control.
    The source is the control itself. The id is the control's identity (see ControlIds)
    captured when the event was created.
**/
@SuppressWarnings("serial")
public class EditorEvent extends EventObject
{
    public enum Type
    {
        TEXT_UPDATED,      ///< Text content changed, by typing or programmatically.
        TEXT_ENTER,        ///< Enter was pressed in a text control.
        BUTTON_CLICKED,
        CHOICE_SELECTED,
        CHECKBOX_TOGGLED,
        SPIN_CHANGED,      ///< Value of a spinner model changed.
        KEY_PRESSED,
        FOCUS_GAINED,
        FOCUS_LOST
    }

    protected Type type;
    protected int  id;
    protected int  keyCode;

    public EditorEvent (Component source, Type type)
    {
        this (source, type, ControlIds.get (source), 0);
    }

    public EditorEvent (Component source, Type type, int id, int keyCode)
    {
        super (source);
        this.type    = type;
        this.id      = id;
        this.keyCode = keyCode;
    }

    public static EditorEvent keyPressed (Component source, int keyCode)
    {
        return new EditorEvent (source, Type.KEY_PRESSED, ControlIds.get (source), keyCode);
    }

    public Type getType ()
    {
        return type;
    }

    public int getId ()
    {
        return id;
    }

    /**
        @return The java.awt.event.KeyEvent virtual key code. Only meaningful for KEY_PRESSED.
    **/
    public int getKeyCode ()
    {
        return keyCode;
    }

    public Component getComponent ()
    {
        return (Component) getSource ();
    }

    public String toString ()
    {
        return type + "[id=" + id + (type == Type.KEY_PRESSED ? ",key=" + keyCode : "") + "]";
    }
}
