/*
Copyright 2025 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.pgrid.editor;

import java.awt.Container;

import javax.swing.JComponent;
import javax.swing.undo.UndoManager;

/**
    What an editor needs from the grid that owns it.
**/
public interface EditorHost
{
    /**
        @return The container that editor controls should be added to.
    **/
    public Container getPanel ();

    /**
        Assigns the id to the control and arranges for every event on it to come back
        through the host's event routing, and from there to Editor.onEvent().
    **/
    public void connect (JComponent control, int id);

    /**
        @return Primary control of the row currently being edited, or null if none.
    **/
    public JComponent getEditorControl ();

    /**
        @return Secondary control of the row currently being edited, or null if none.
    **/
    public JComponent getEditorControlSecondary ();

    /**
        @return Text to use on the single button of the "...AndButton" editors.
    **/
    public String getButtonLabel ();

    /**
        @return Undo stack that text controls may fall back on once their own history is exhausted. May be null.
    **/
    public UndoManager getUndoManager ();
}
