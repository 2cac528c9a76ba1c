/*
Copyright 2025 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.pgrid.ui;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import org.apache.log4j.Logger;

import gov.sandia.pgrid.property.Attributes;

/**
    Configuration for a PropertyGrid.
    Defaults come from grid.properties next to this class. Any JVM system property whose name starts
    with "pgrid." overrides the key that follows the prefix, for example -Dpgrid.rowHeight=24
**/
public class GridSettings extends Attributes
{
    private static Logger logger = Logger.getLogger (GridSettings.class);

    public static final String RESOURCE = "grid.properties";
    public static final String PREFIX   = "pgrid.";

    public static final String ROW_HEIGHT        = "rowHeight";
    public static final String SPLITTER_POSITION = "splitterPosition";
    public static final String WIDTH             = "width";
    public static final String BUTTON_LABEL      = "buttonLabel";
    public static final String SPIN_STEP         = "spinStep";
    public static final String DATE_FORMAT       = "dateFormat";

    public static GridSettings load ()
    {
        GridSettings result = new GridSettings ();
        try (InputStream stream = GridSettings.class.getResourceAsStream (RESOURCE))
        {
            if (stream == null) logger.warn ("Missing " + RESOURCE + ". Using built-in defaults.");
            else                result.load (stream);
        }
        catch (IOException e)
        {
            logger.warn ("Failed to read " + RESOURCE, e);
        }
        result.override (System.getProperties ());
        return result;
    }

    public void load (InputStream stream) throws IOException
    {
        Properties properties = new Properties ();
        properties.load (stream);
        for (String key : properties.stringPropertyNames ()) set (properties.getProperty (key).trim (), key);
    }

    /**
        Copies every entry whose key starts with PREFIX, minus the prefix.
    **/
    public void override (Properties properties)
    {
        for (String key : properties.stringPropertyNames ())
        {
            if (! key.startsWith (PREFIX)) continue;
            String name = key.substring (PREFIX.length ());
            set (properties.getProperty (key).trim (), name);
            logger.debug ("Setting " + name + " overridden by system property");
        }
    }

    public int getRowHeight ()
    {
        return Math.max (1, getOrDefault (20, ROW_HEIGHT));
    }

    public int getSplitterPosition ()
    {
        return Math.max (0, getOrDefault (120, SPLITTER_POSITION));
    }

    public int getWidth ()
    {
        return Math.max (getSplitterPosition () + 1, getOrDefault (400, WIDTH));
    }

    public String getButtonLabel ()
    {
        return getOrDefault ("...", BUTTON_LABEL);
    }
}
