/*
Copyright 2025 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.pgrid.property;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

import gov.sandia.pgrid.editor.DatePickerCtrlEditor;

/**
    Calendar date. Text form follows the DateFormat attribute if present, otherwise ISO-8601 (yyyy-MM-dd).
    Parsing accepts either form.
**/
public class DateProperty extends Property
{
    public DateProperty (String name)
    {
        super (name);
    }

    public DateProperty (String label, String name, LocalDate value)
    {
        super (label, name);
        this.value = value;
    }

    public LocalDate getDate ()
    {
        return (LocalDate) value;
    }

    public void setValue (Object value)
    {
        if (value == null  ||  value instanceof LocalDate)
        {
            this.value = value;
            return;
        }
        LocalDate date = parse (value.toString ());
        if (date == null) throw new IllegalArgumentException ("Not a date: " + value);
        this.value = date;
    }

    /**
        @return The formatter for the DateFormat pattern. Falls back to ISO-8601 if the pattern
        is malformed or asks for fields a plain date doesn't have (such as hours).
    **/
    protected DateTimeFormatter getFormatter ()
    {
        String pattern = attributes.get (DATE_FORMAT);
        if (pattern.isEmpty ()) return DateTimeFormatter.ISO_LOCAL_DATE;
        try
        {
            DateTimeFormatter result = DateTimeFormatter.ofPattern (pattern);
            result.format (LocalDate.of (2000, 1, 1));
            return result;
        }
        catch (IllegalArgumentException | DateTimeException e)
        {
            return DateTimeFormatter.ISO_LOCAL_DATE;
        }
    }

    public String valueToString (Object value)
    {
        if (value == null) return "";
        return getFormatter ().format ((LocalDate) value);
    }

    /**
        @return The date, or null if the text matches neither the DateFormat pattern nor ISO-8601.
    **/
    public LocalDate parse (String text)
    {
        text = text.trim ();
        LocalDate result = parse (text, getFormatter ());
        if (result == null) result = parse (text, DateTimeFormatter.ISO_LOCAL_DATE);
        return result;
    }

    protected static LocalDate parse (String text, DateTimeFormatter formatter)
    {
        try
        {
            return LocalDate.parse (text, formatter);
        }
        catch (DateTimeParseException e)
        {
            return null;
        }
    }

    public boolean stringToValue (ValueHolder result, String text)
    {
        if (text == null) return false;
        if (text.trim ().isEmpty ()) return propose (result, null);
        LocalDate date = parse (text);
        if (date == null) return false;
        return propose (result, date);
    }

    public boolean intToValue (ValueHolder result, int number)
    {
        return false;
    }

    /**
        Proposes a date taken directly from a control, with no text conversion in between.
    **/
    public boolean dateToValue (ValueHolder result, LocalDate date)
    {
        return propose (result, date);
    }

    public String getDefaultEditorName ()
    {
        return DatePickerCtrlEditor.NAME;
    }
}
