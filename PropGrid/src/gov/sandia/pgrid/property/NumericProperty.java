/*
Copyright 2025 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.pgrid.property;

/**
    Shared behavior for numbers: parsing, the Min/Max range and arithmetic in double form.
    Empty text converts to unspecified.
**/
public abstract class NumericProperty extends Property
{
    public NumericProperty (String label, String name)
    {
        super (label, name);
    }

    /**
        @return The parsed number in this property's own type, or null if the text is not a number.
    **/
    public abstract Number parse (String text);

    /**
        Converts a double into this property's own number type, rounding if necessary.
    **/
    public abstract Number fromDouble (double number);

    public double getMin ()
    {
        return attributes.getOrDefault (Double.NEGATIVE_INFINITY, MIN);
    }

    public double getMax ()
    {
        return attributes.getOrDefault (Double.POSITIVE_INFINITY, MAX);
    }

    public boolean inRange (double number)
    {
        return number >= getMin ()  &&  number <= getMax ();
    }

    public void setValue (Object value)
    {
        if (value == null)
        {
            this.value = null;
            return;
        }
        Number number;
        if (value instanceof Number) number = fromDouble (((Number) value).doubleValue ());
        else                         number = parse (value.toString ());
        if (number == null) throw new IllegalArgumentException ("Not a number: " + value);
        this.value = number;
    }

    public boolean stringToValue (ValueHolder result, String text)
    {
        if (text == null) return false;
        text = text.trim ();
        if (text.isEmpty ()) return propose (result, null);
        if (value != null  &&  text.equals (getValueAsString ())) return propose (result, value);  // Display form may be rounded, so it would not parse back to the exact value.
        Number number = parse (text);
        if (number == null  ||  ! inRange (number.doubleValue ())) return false;
        return propose (result, number);
    }

    public boolean intToValue (ValueHolder result, int number)
    {
        if (! inRange (number)) return false;
        return propose (result, fromDouble (number));
    }
}
