/*
Copyright 2025 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.pgrid.ui;

import javax.swing.undo.UndoManager;
import javax.swing.undo.UndoableEdit;

import gov.sandia.pgrid.property.Property;

/**
    Undo stack of property value changes for one grid.
**/
@SuppressWarnings("serial")
public class EditHistory extends UndoManager
{
    /**
        Carries out the change, then stores it. A change that continues the previous one is folded into it,
        and if the combined change leaves the value where it started, the step disappears.
        @return false if the edit could not be stored (the history was closed by end()).
    **/
    public synchronized boolean record (ChangePropertyValue change)
    {
        change.perform ();
        if (! addEdit (change)) return false;
        UndoableEdit last = lastEdit ();
        if (last instanceof ChangePropertyValue  &&  ((ChangePropertyValue) last).isNoOp ())
        {
            int index = edits.size () - 1;
            trimEdits (index, index);
        }
        return true;
    }

    public synchronized int size ()
    {
        return edits.size ();
    }

    /**
        Drops every step that changes the given property.
    **/
    public synchronized void forget (Property property)
    {
        for (int i = edits.size () - 1; i >= 0; i--)
        {
            UndoableEdit edit = edits.get (i);
            if (edit instanceof ChangePropertyValue  &&  ((ChangePropertyValue) edit).getProperty () == property) trimEdits (i, i);
        }
    }
}
