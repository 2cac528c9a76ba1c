/*
Copyright 2025 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.pgrid.property;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

import javax.swing.JComponent;

import gov.sandia.pgrid.editor.EditorEvent;
import gov.sandia.pgrid.editor.EditorHost;
import gov.sandia.pgrid.editor.TextCtrlEditor;

/**
    A named value displayed in one row of the grid.
    Holds the current value and knows how to convert it to and from the forms that editor
    controls work with (text and integer index). A null value means "unspecified".

    Editors never modify a Property. They only read it, and propose new values through
    a ValueHolder. The host is responsible for applying those proposals.
**/
public abstract class Property
{
    // Attribute names understood by the built-in editors
    public static final String MIN          = "Min";
    public static final String MAX          = "Max";
    public static final String STEP         = "Step";
    public static final String WRAP         = "Wrap";
    public static final String PRECISION    = "Precision";
    public static final String DATE_FORMAT  = "DateFormat";
    public static final String USE_CHECKBOX = "UseCheckbox";

    protected String     name;
    protected String     label;
    protected Object     value;
    protected String     editorName;  // Explicit choice of editor. When null, getDefaultEditorName() applies.
    protected Attributes attributes = new Attributes ();

    public Property (String name)
    {
        this (name, name);
    }

    public Property (String label, String name)
    {
        if (name == null  ||  name.isEmpty ()) throw new IllegalArgumentException ("Property name must not be empty");
        this.name  = name;
        this.label = label == null ? name : label;
    }

    public String getName ()
    {
        return name;
    }

    public String getLabel ()
    {
        return label;
    }

    public void setLabel (String label)
    {
        this.label = label;
    }

    public Object getValue ()
    {
        return value;
    }

    /**
        Stores a new value. Subclasses may coerce compatible types, and throw
        IllegalArgumentException for values outside their domain.
        Null makes the value unspecified.
    **/
    public void setValue (Object value)
    {
        this.value = value;
    }

    public boolean isValueUnspecified ()
    {
        return value == null;
    }

    public void setValueToUnspecified ()
    {
        value = null;
    }

    /**
        @return Display form of the current value, or "" when unspecified.
    **/
    public String getValueAsString ()
    {
        if (value == null) return "";
        return valueToString (value);
    }

    public String valueToString (Object value)
    {
        if (value == null) return "";
        return value.toString ();
    }

    /**
        Converts text into this property's value domain.
        @param result Receives the converted value. Left untouched if conversion fails.
        @return true if the converted value differs from the current one. false if it is the same,
        or if the text could not be converted.
    **/
    public abstract boolean stringToValue (ValueHolder result, String text);

    /**
        Converts an integer, usually a choice index, into this property's value domain.
        Default is to treat the number as text.
        @return true if the converted value differs from the current one.
    **/
    public boolean intToValue (ValueHolder result, int number)
    {
        return stringToValue (result, String.valueOf (number));
    }

    /**
        @return Labels to offer in a choice control. Empty if this property has no natural list.
    **/
    public List<String> getChoices ()
    {
        return Collections.emptyList ();
    }

    /**
        @return Position of the current value in getChoices(), or -1 if there is none.
    **/
    public int getChoiceSelection ()
    {
        return getChoices ().indexOf (getValueAsString ());
    }

    /**
        @return Name of the editor used when none was set explicitly.
    **/
    public String getDefaultEditorName ()
    {
        return TextCtrlEditor.NAME;
    }

    public String getEditorName ()
    {
        if (editorName != null) return editorName;
        return getDefaultEditorName ();
    }

    /**
        Selects a specific editor by registry name. Null reverts to the default.
    **/
    public void setEditor (String editorName)
    {
        this.editorName = editorName;
    }

    public Attributes getAttributes ()
    {
        return attributes;
    }

    public String getAttribute (String key)
    {
        return attributes.get (key);
    }

    public void setAttribute (String key, Object value)
    {
        attributes.set (value, key);
    }

    /**
        Called by the host after the editor has processed an event, so the property can add its
        own behavior, for example reacting to a button press.
        Must not modify this property.
        @return true if the control now holds a value that should be committed.
    **/
    public boolean onEvent (EditorHost host, JComponent primary, EditorEvent event)
    {
        return false;
    }

    /**
        Utility for conversion routines: fills the holder and reports whether it differs from the current value.
    **/
    protected boolean propose (ValueHolder result, Object newValue)
    {
        result.setValue (newValue);
        return ! Objects.equals (newValue, value);
    }

    public String toString ()
    {
        return name + "=" + (value == null ? "(unspecified)" : getValueAsString ());
    }
}
