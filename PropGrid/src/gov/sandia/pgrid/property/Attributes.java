/*
Copyright 2025 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.pgrid.property;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
    Flat key-value store with typed accessors.
    Values are kept as strings. An empty string behaves the same as an absent key, so every
    getOrDefault() returns its default in that case.
**/
public class Attributes implements Iterable<String>
{
    protected Map<String,String> values = new LinkedHashMap<String,String> ();

    public synchronized boolean containsKey (String key)
    {
        return values.containsKey (key);
    }

    public synchronized int size ()
    {
        return values.size ();
    }

    public boolean isEmpty ()
    {
        return size () == 0;
    }

    /**
        @return The stored value, with "" as default.
    **/
    public synchronized String get (String key)
    {
        String result = values.get (key);
        if (result == null) return "";
        return result;
    }

    public String getOrDefault (String defaultValue, String key)
    {
        String value = get (key);
        if (value.isEmpty ()) return defaultValue;
        return value;
    }

    public boolean getOrDefault (boolean defaultValue, String key)
    {
        String value = get (key);
        if (value.isEmpty ()) return defaultValue;
        if (value.trim ().equals ("1")) return true;
        return Boolean.parseBoolean (value.trim ());
    }

    public int getOrDefault (int defaultValue, String key)
    {
        String value = get (key).trim ();
        if (value.isEmpty ()) return defaultValue;
        try
        {
            // Going through double also accepts something like "2.0", which fails as an integer.
            return (int) Math.round (Double.parseDouble (value));
        }
        catch (NumberFormatException e)
        {
            return defaultValue;
        }
    }

    public double getOrDefault (double defaultValue, String key)
    {
        String value = get (key).trim ();
        if (value.isEmpty ()) return defaultValue;
        try
        {
            return Double.parseDouble (value);
        }
        catch (NumberFormatException e)
        {
            return defaultValue;
        }
    }

    public boolean getBoolean (String key)
    {
        return getOrDefault (false, key);
    }

    public int getInt (String key)
    {
        return getOrDefault (0, key);
    }

    public double getDouble (String key)
    {
        return getOrDefault (0.0, key);
    }

    /**
        Stores the value in string form. Booleans become "1" or "0".
        Passing null removes the key.
    **/
    public synchronized void set (Object value, String key)
    {
        if (value == null)
        {
            values.remove (key);
            return;
        }
        String stringValue;
        if (value instanceof Boolean) stringValue = (Boolean) value ? "1" : "0";
        else                          stringValue = value.toString ();
        values.put (key, stringValue);
    }

    public synchronized void clear (String key)
    {
        values.remove (key);
    }

    public synchronized void merge (Attributes that)
    {
        for (String key : that) values.put (key, that.get (key));
    }

    public synchronized Iterator<String> iterator ()
    {
        List<String> keys = new ArrayList<String> (values.keySet ());  // copy, so caller may modify during iteration
        return keys.iterator ();
    }

    public synchronized String toString ()
    {
        return values.toString ();
    }
}
