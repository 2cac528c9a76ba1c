/*
Copyright 2025 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.pgrid.editor;

import java.awt.Dimension;
import java.awt.Point;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Calendar;
import java.util.Date;

import javax.swing.JComponent;
import javax.swing.JFormattedTextField;
import javax.swing.JSpinner;
import javax.swing.SpinnerDateModel;

import org.apache.log4j.Logger;

import gov.sandia.pgrid.property.DateProperty;
import gov.sandia.pgrid.property.Property;
import gov.sandia.pgrid.property.ValueHolder;

/**
    Date spinner. The DateFormat attribute gives the display pattern (default yyyy-MM-dd).
    Only works with DateProperty. For anything else, control creation fails.
**/
public class DatePickerCtrlEditor extends EditorBase
{
    private static Logger logger = Logger.getLogger (DatePickerCtrlEditor.class);

    public static final String NAME            = "DatePickerCtrl";
    public static final String DEFAULT_PATTERN = "yyyy-MM-dd";

    public DatePickerCtrlEditor ()
    {
        super (NAME);
    }

    public ControlSet createControls (EditorHost host, Property property, Point position, Dimension size)
    {
        if (! (property instanceof DateProperty))
        {
            logger.warn (NAME + " can't edit non-date property " + property.getName ());
            return ControlSet.EMPTY;
        }

        JSpinner spinner = new JSpinner (new SpinnerDateModel (new Date (), null, null, Calendar.DAY_OF_MONTH));
        String pattern = property.getAttributes ().getOrDefault (DEFAULT_PATTERN, Property.DATE_FORMAT);
        try
        {
            spinner.setEditor (new JSpinner.DateEditor (spinner, pattern));
        }
        catch (IllegalArgumentException e)
        {
            logger.warn ("Bad date pattern \"" + pattern + "\" on " + property.getName () + ". Using " + DEFAULT_PATTERN);
            spinner.setEditor (new JSpinner.DateEditor (spinner, DEFAULT_PATTERN));
        }
        placePrimary (host, spinner, position, size);
        return new ControlSet (spinner);
    }

    public static Date toDate (LocalDate date)
    {
        return Date.from (date.atStartOfDay (ZoneId.systemDefault ()).toInstant ());
    }

    public static LocalDate toLocalDate (Date date)
    {
        return date.toInstant ().atZone (ZoneId.systemDefault ()).toLocalDate ();
    }

    protected static JFormattedTextField getTextField (JSpinner spinner)
    {
        return ((JSpinner.DefaultEditor) spinner.getEditor ()).getTextField ();
    }

    public void updateControl (Property property, ControlSet controls)
    {
        if (property.isValueUnspecified ())
        {
            setValueToUnspecified (property, controls);
            return;
        }
        JSpinner spinner = (JSpinner) controls.getPrimary ();
        Date date = toDate (((DateProperty) property).getDate ());
        if (! date.equals (spinner.getValue ())) spinner.setValue (date);
        getTextField (spinner).setValue (spinner.getValue ());  // Restores the text in case it was blanked.
        markUnspecified (spinner, false);
    }

    public boolean onEvent (EditorHost host, Property property, JComponent primary, EditorEvent event)
    {
        if (event.getSource () != primary) return false;
        if (event.getType () != EditorEvent.Type.SPIN_CHANGED) return false;
        markUnspecified (primary, false);
        return getValueFromControl (new ValueHolder (), property, new ControlSet (primary));
    }

    public boolean getValueFromControl (ValueHolder result, Property property, ControlSet controls)
    {
        JSpinner spinner = (JSpinner) controls.getPrimary ();
        if (isMarkedUnspecified (spinner))
        {
            result.setUnspecified ();
            return ! property.isValueUnspecified ();
        }
        LocalDate date = toLocalDate ((Date) spinner.getValue ());
        return ((DateProperty) property).dateToValue (result, date);
    }

    public void setValueToUnspecified (Property property, ControlSet controls)
    {
        JSpinner spinner = (JSpinner) controls.getPrimary ();
        getTextField (spinner).setText ("");
        markUnspecified (spinner, true);
    }

    public void setControlStringValue (Property property, JComponent control, String text)
    {
        ValueHolder holder = new ValueHolder ();
        property.stringToValue (holder, text);
        if (! (holder.getValue () instanceof LocalDate)) return;
        JSpinner spinner = (JSpinner) control;
        spinner.setValue (toDate ((LocalDate) holder.getValue ()));
        getTextField (spinner).setValue (spinner.getValue ());
        markUnspecified (spinner, false);
    }
}
