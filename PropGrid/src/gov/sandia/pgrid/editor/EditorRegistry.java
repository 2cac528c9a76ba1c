/*
Copyright 2025 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.pgrid.editor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import gov.sandia.pgrid.property.Property;

/**
    Maps editor names to editor instances.
    Create one at startup, fill it, and hand it to each grid that needs it.
    Once registered, an editor belongs to the registry, and callers should reach it only through resolve().

    Names of the standard editors are TextCtrl, Choice, ComboBox, CheckBox, TextCtrlAndButton and ChoiceAndButton.
    The additional editors SpinCtrl and DatePickerCtrl require registerAdditionalEditors().
**/
public class EditorRegistry
{
    private static Logger logger = Logger.getLogger (EditorRegistry.class);

    protected Map<String,Editor> editors = new LinkedHashMap<String,Editor> ();  // maps editor name to instance

    /**
        @return A registry holding both the standard and the additional editors.
    **/
    public static EditorRegistry createDefault ()
    {
        EditorRegistry result = new EditorRegistry ();
        result.registerStandardEditors ();
        result.registerAdditionalEditors ();
        return result;
    }

    public void registerStandardEditors ()
    {
        register (new TextCtrlEditor ());
        register (new ChoiceEditor ());
        register (new ComboBoxEditor ());
        register (new CheckBoxEditor ());
        register (new TextCtrlAndButtonEditor ());
        register (new ChoiceAndButtonEditor ());
    }

    public void registerAdditionalEditors ()
    {
        register (new SpinCtrlEditor ());
        register (new DatePickerCtrlEditor ());
    }

    public Editor register (Editor editor)
    {
        return register (editor, editor.getName ());
    }

    /**
        Adds the editor under the given name, replacing any editor already there.
        @param name Must be non-empty and equal to editor.getName().
        @return The registered editor, for use as a handle.
    **/
    public synchronized Editor register (Editor editor, String name)
    {
        if (editor == null) throw new IllegalArgumentException ("Editor must not be null");
        if (name == null  ||  name.isEmpty ()) throw new IllegalArgumentException ("Editor name must not be empty");
        if (! name.equals (editor.getName ())) throw new IllegalArgumentException ("Editor reports name \"" + editor.getName () + "\" but is being registered as \"" + name + "\"");

        Editor previous = editors.put (name, editor);
        if (previous != null  &&  previous != editor) logger.info ("Replacing editor " + name + ": " + previous + " -> " + editor);
        else                                          logger.debug ("Registered editor " + name);
        return editor;
    }

    /**
        @throws EditorNotFoundException if nothing is registered under the name.
    **/
    public synchronized Editor resolve (String name)
    {
        Editor result = editors.get (name);
        if (result == null) throw new EditorNotFoundException (name);
        return result;
    }

    public synchronized boolean contains (String name)
    {
        return editors.containsKey (name);
    }

    public synchronized List<String> getNames ()
    {
        return new ArrayList<String> (editors.keySet ());
    }

    public synchronized int size ()
    {
        return editors.size ();
    }

    /**
        Determines which editor handles the given property.
        An editor chosen explicitly with Property.setEditor() must be registered.
        If the property's default editor is missing, falls back to TextCtrl.
        @throws EditorNotFoundException if neither rule finds an editor.
    **/
    public synchronized Editor editorFor (Property property)
    {
        String name = property.getEditorName ();
        Editor result = editors.get (name);
        if (result != null) return result;
        if (! name.equals (property.getDefaultEditorName ())) throw new EditorNotFoundException (name);

        logger.warn ("Default editor " + name + " for " + property.getName () + " is not registered. Using " + TextCtrlEditor.NAME);
        return resolve (TextCtrlEditor.NAME);
    }
}
