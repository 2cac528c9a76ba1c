/*
Copyright 2025 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.pgrid.property;

/**
    Receives a value proposed by an editor or a conversion routine.
    A freshly constructed holder is empty. Once filled it carries either a concrete value
    or the unspecified marker (null value).
**/
public class ValueHolder
{
    protected Object  value;
    protected boolean filled;

    public void setValue (Object value)
    {
        this.value = value;
        filled     = true;
    }

    public void setUnspecified ()
    {
        setValue (null);
    }

    public Object getValue ()
    {
        return value;
    }

    public boolean isFilled ()
    {
        return filled;
    }

    public boolean isUnspecified ()
    {
        return filled  &&  value == null;
    }

    public void clear ()
    {
        value  = null;
        filled = false;
    }

    public String toString ()
    {
        if (! filled) return "(empty)";
        if (value == null) return "(unspecified)";
        return value.toString ();
    }
}
