/*
Copyright 2025 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.pgrid.property;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
    Free text. May carry a list of suggestions, which a ComboBox editor will offer.
    The empty string is an ordinary value, distinct from unspecified.
**/
public class StringProperty extends Property
{
    protected List<String> suggestions = new ArrayList<String> ();

    public StringProperty (String name)
    {
        super (name);
    }

    public StringProperty (String label, String name, String value)
    {
        super (label, name);
        this.value = value;
    }

    public void setValue (Object value)
    {
        if (value == null) this.value = null;
        else               this.value = value.toString ();
    }

    public boolean stringToValue (ValueHolder result, String text)
    {
        if (text == null) return false;
        return propose (result, text);
    }

    public boolean intToValue (ValueHolder result, int number)
    {
        if (number < 0  ||  number >= suggestions.size ()) return false;
        return propose (result, suggestions.get (number));
    }

    public List<String> getChoices ()
    {
        return Collections.unmodifiableList (suggestions);
    }

    public void setSuggestions (List<String> suggestions)
    {
        this.suggestions = new ArrayList<String> (suggestions);
    }
}
