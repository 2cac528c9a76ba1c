/*
Copyright 2025 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.pgrid.property;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import gov.sandia.pgrid.editor.ChoiceEditor;

/**
    One value out of a fixed list. Each entry has a display label and an integer value.
    The property's value is the integer, not the position in the list.
**/
public class EnumProperty extends Property
{
    protected List<String>  labels = new ArrayList<String> ();
    protected List<Integer> values = new ArrayList<Integer> ();

    public EnumProperty (String name)
    {
        super (name);
    }

    /**
        @param values May be null, in which case each label gets its position as value.
    **/
    public EnumProperty (String label, String name, List<String> labels, List<Integer> values, int value)
    {
        super (label, name);
        for (int i = 0; i < labels.size (); i++)
        {
            addChoice (labels.get (i), values == null ? i : values.get (i));
        }
        this.value = value;
    }

    public void addChoice (String label, int value)
    {
        if (values.contains (value)) throw new IllegalArgumentException ("Duplicate choice value " + value + " in " + name);
        labels.add (label);
        values.add (value);
    }

    public void removeChoice (int index)
    {
        labels.remove (index);
        values.remove (index);
    }

    public List<String> getChoices ()
    {
        return Collections.unmodifiableList (labels);
    }

    public int getChoiceSelection ()
    {
        if (value == null) return -1;
        return values.indexOf (value);
    }

    public void setValue (Object value)
    {
        if (value == null)
        {
            this.value = null;
            return;
        }
        int v;
        if (value instanceof Number)
        {
            v = ((Number) value).intValue ();
        }
        else
        {
            int index = labels.indexOf (value.toString ());
            if (index < 0) throw new IllegalArgumentException ("Unknown choice " + value + " for " + name);
            v = values.get (index);
        }
        if (! values.contains (v)) throw new IllegalArgumentException ("Unknown choice value " + v + " for " + name);
        this.value = v;
    }

    public String valueToString (Object value)
    {
        if (value == null) return "";
        int index = values.indexOf (value);
        if (index < 0) return value.toString ();
        return labels.get (index);
    }

    public boolean stringToValue (ValueHolder result, String text)
    {
        if (text == null) return false;
        int index = labels.indexOf (text);
        if (index < 0) index = labels.indexOf (text.trim ());
        if (index < 0) return false;
        return propose (result, values.get (index));
    }

    /**
        @param number Position in the choice list.
    **/
    public boolean intToValue (ValueHolder result, int number)
    {
        if (number < 0  ||  number >= values.size ()) return false;
        return propose (result, values.get (number));
    }

    public String getDefaultEditorName ()
    {
        return ChoiceEditor.NAME;
    }
}
