/*
Copyright 2025 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.pgrid.property;

public class IntProperty extends NumericProperty
{
    public IntProperty (String name)
    {
        super (name, name);
    }

    public IntProperty (String label, String name, int value)
    {
        super (label, name);
        this.value = value;
    }

    public Number parse (String text)
    {
        try
        {
            return Integer.valueOf (text.trim ());
        }
        catch (NumberFormatException e)
        {
            return null;
        }
    }

    public Number fromDouble (double number)
    {
        if (number >= Integer.MAX_VALUE) return Integer.MAX_VALUE;
        if (number <= Integer.MIN_VALUE) return Integer.MIN_VALUE;
        return (int) Math.round (number);
    }
}
