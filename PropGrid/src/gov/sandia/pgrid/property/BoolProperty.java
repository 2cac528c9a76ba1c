/*
Copyright 2025 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.pgrid.property;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import gov.sandia.pgrid.editor.CheckBoxEditor;
import gov.sandia.pgrid.editor.ChoiceEditor;

/**
    True/false value. Edited with a False/True choice by default, or with a check box
    when the UseCheckbox attribute is set.
**/
public class BoolProperty extends Property
{
    protected static final List<String> labels = Collections.unmodifiableList (Arrays.asList ("False", "True"));

    public BoolProperty (String name)
    {
        super (name);
    }

    public BoolProperty (String label, String name, boolean value)
    {
        super (label, name);
        this.value = value;
    }

    public void setValue (Object value)
    {
        if (value == null)                 this.value = null;
        else if (value instanceof Boolean) this.value = value;
        else if (value instanceof Number)  this.value = ((Number) value).intValue () != 0;
        else
        {
            Boolean b = parse (value.toString ());
            if (b == null) throw new IllegalArgumentException ("Not a boolean: " + value);
            this.value = b;
        }
    }

    public String valueToString (Object value)
    {
        if (value == null) return "";
        return (Boolean) value ? labels.get (1) : labels.get (0);
    }

    /**
        Accepts the display labels (in any case), "1" and "0".
    **/
    public static Boolean parse (String text)
    {
        text = text.trim ();
        if (text.equalsIgnoreCase (labels.get (1))  ||  text.equals ("1")) return Boolean.TRUE;
        if (text.equalsIgnoreCase (labels.get (0))  ||  text.equals ("0")) return Boolean.FALSE;
        return null;
    }

    public boolean stringToValue (ValueHolder result, String text)
    {
        if (text == null) return false;
        if (text.trim ().isEmpty ()) return propose (result, null);
        Boolean b = parse (text);
        if (b == null) return false;
        return propose (result, b);
    }

    public boolean intToValue (ValueHolder result, int number)
    {
        if (number < 0) return false;
        return propose (result, number != 0);
    }

    public List<String> getChoices ()
    {
        return labels;
    }

    public int getChoiceSelection ()
    {
        if (value == null) return -1;
        return (Boolean) value ? 1 : 0;
    }

    public String getDefaultEditorName ()
    {
        if (attributes.getBoolean (USE_CHECKBOX)) return CheckBoxEditor.NAME;
        return ChoiceEditor.NAME;
    }
}
