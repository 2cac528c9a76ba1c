/*
Copyright 2025 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.pgrid.ui;

import java.util.Objects;

import javax.swing.undo.AbstractUndoableEdit;
import javax.swing.undo.CannotRedoException;
import javax.swing.undo.CannotUndoException;
import javax.swing.undo.UndoableEdit;

import gov.sandia.pgrid.property.Property;

/**
    Replaces the value of one property. A null value means unspecified.
    The change is carried out by perform(), which EditHistory.record() calls once before storing the edit.
**/
@SuppressWarnings("serial")
public class ChangePropertyValue extends AbstractUndoableEdit
{
    protected PropertyGrid grid;
    protected Property     property;
    protected int          session;  // Edits from the same session on the same property merge into one step.
    protected Object       valueBefore;
    protected Object       valueAfter;

    public ChangePropertyValue (PropertyGrid grid, Property property, Object valueAfter, int session)
    {
        this.grid        = grid;
        this.property    = property;
        this.session     = session;
        this.valueBefore = property.getValue ();
        this.valueAfter  = valueAfter;
    }

    public Property getProperty ()
    {
        return property;
    }

    public Object getValueBefore ()
    {
        return valueBefore;
    }

    public Object getValueAfter ()
    {
        return valueAfter;
    }

    /**
        Stores the new value for the first time. Afterward, valueAfter holds the value as coerced by the property.
    **/
    public void perform ()
    {
        grid.applyValue (property, valueAfter);
        valueAfter = property.getValue ();
    }

    public void undo () throws CannotUndoException
    {
        if (! grid.contains (property)) throw new CannotUndoException ();
        super.undo ();
        grid.applyValue (property, valueBefore);
    }

    public void redo () throws CannotRedoException
    {
        if (! grid.contains (property)) throw new CannotRedoException ();
        super.redo ();
        grid.applyValue (property, valueAfter);
    }

    /**
        Absorbs a following change to the same property in the same session, provided it picks up where this one left off.
    **/
    public boolean addEdit (UndoableEdit edit)
    {
        if (! (edit instanceof ChangePropertyValue)) return false;
        ChangePropertyValue next = (ChangePropertyValue) edit;
        if (property != next.property  ||  session != next.session) return false;
        if (! Objects.equals (valueAfter, next.valueBefore)) return false;
        valueAfter = next.valueAfter;
        return true;
    }

    /**
        @return true if the value ends where it started, so the edit can be dropped.
    **/
    public boolean isNoOp ()
    {
        return Objects.equals (valueBefore, valueAfter);
    }

    public String getPresentationName ()
    {
        return "change " + property.getLabel ();
    }
}
