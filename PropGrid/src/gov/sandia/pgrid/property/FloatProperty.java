/*
Copyright 2025 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.pgrid.property;

/**
    Floating-point number. The Precision attribute (default 6) gives the number of digits
    kept after the decimal point when the value is displayed. -1 shows every digit.
**/
public class FloatProperty extends NumericProperty
{
    public FloatProperty (String name)
    {
        super (name, name);
    }

    public FloatProperty (String label, String name, double value)
    {
        super (label, name);
        this.value = value;
    }

    public Number parse (String text)
    {
        try
        {
            double result = Double.parseDouble (text.trim ());
            if (Double.isNaN (result)) return null;
            return result;
        }
        catch (NumberFormatException e)
        {
            return null;
        }
    }

    public Number fromDouble (double number)
    {
        return number;
    }

    public String valueToString (Object value)
    {
        if (value == null) return "";
        return format (((Number) value).doubleValue (), attributes.getOrDefault (6, PRECISION));
    }

    /**
        Rounds to the given number of decimal places, then drops trailing zeroes
        (and the decimal point itself if nothing remains after it).
        A negative precision means no rounding.
    **/
    public static String format (double value, int precision)
    {
        if (Double.isInfinite (value)) return String.valueOf (value);
        double rounded = value;
        if (precision >= 0)
        {
            double shift = Math.pow (10, precision);
            if (Math.abs (value * shift) < Long.MAX_VALUE) rounded = Math.round (value * shift) / shift;  // Otherwise too large to shift, so keep as is.
        }
        String converted = String.valueOf (rounded);
        if (converted.contains ("E")) return converted;
        int pos = converted.lastIndexOf ('.');
        if (pos >= 0)
        {
            int end = converted.length () - 1;
            if (precision >= 0) end = Math.min (pos + precision, end);
            for (; end >= pos; end--)
            {
                char c = converted.charAt (end);
                if (c != '0'  &&  c != '.') break;
            }
            converted = converted.substring (0, end + 1);
        }
        if (converted.equals ("-0")) converted = "0";
        return converted;
    }
}
