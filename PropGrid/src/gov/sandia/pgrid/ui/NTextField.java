/*
Copyright 2025 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.pgrid.ui;

import java.awt.event.ActionEvent;
import java.awt.event.KeyEvent;

import javax.swing.AbstractAction;
import javax.swing.ActionMap;
import javax.swing.InputMap;
import javax.swing.JTextField;
import javax.swing.KeyStroke;
import javax.swing.undo.CannotRedoException;
import javax.swing.undo.CannotUndoException;
import javax.swing.undo.UndoManager;

import org.apache.log4j.Logger;

/**
    Text field used by the text-based editors.
    Adds undo/redo of typing, and a stub for the cancel action (escape key) that editors replace.
    Once the field's own history is used up, undo/redo passes to the grid's undo stack, if one was given.
**/
@SuppressWarnings("serial")
public class NTextField extends JTextField
{
    private static Logger logger = Logger.getLogger (NTextField.class);

    protected UndoManager undoManager = new UndoManager ();
    protected UndoManager fallback;

    public NTextField ()
    {
        this (null);
    }

    public NTextField (UndoManager fallback)
    {
        this.fallback = fallback;
        getDocument ().addUndoableEditListener (undoManager);

        InputMap inputMap = getInputMap ();
        inputMap.put (KeyStroke.getKeyStroke ("control Z"),           "Undo");  // For Windows and Linux
        inputMap.put (KeyStroke.getKeyStroke ("meta Z"),              "Undo");  // For Mac
        inputMap.put (KeyStroke.getKeyStroke ("control Y"),           "Redo");
        inputMap.put (KeyStroke.getKeyStroke ("meta Y"),              "Redo");
        inputMap.put (KeyStroke.getKeyStroke ("shift control Z"),     "Redo");
        inputMap.put (KeyStroke.getKeyStroke ("shift meta Z"),        "Redo");
        inputMap.put (KeyStroke.getKeyStroke (KeyEvent.VK_ESCAPE, 0), "Cancel");

        ActionMap actionMap = getActionMap ();
        actionMap.put ("Undo", new AbstractAction ("Undo")
        {
            public void actionPerformed (ActionEvent evt)
            {
                try
                {
                    if      (undoManager.canUndo ())                     undoManager.undo ();
                    else if (fallback != null  &&  fallback.canUndo ()) fallback.undo ();
                }
                catch (CannotUndoException e)
                {
                    logger.debug ("Undo failed", e);
                }
            }
        });
        actionMap.put ("Redo", new AbstractAction ("Redo")
        {
            public void actionPerformed (ActionEvent evt)
            {
                try
                {
                    if      (undoManager.canRedo ())                     undoManager.redo ();
                    else if (fallback != null  &&  fallback.canRedo ()) fallback.redo ();
                }
                catch (CannotRedoException e)
                {
                    logger.debug ("Redo failed", e);
                }
            }
        });
        actionMap.put ("Cancel", new AbstractAction ("Cancel")
        {
            public void actionPerformed (ActionEvent evt)
            {
            }
        });
    }

    public void setText (String text)
    {
        super.setText (text);
        if (undoManager != null) undoManager.discardAllEdits ();  // When text is set programmatically, user effectively starts a new edit session.
    }

    public boolean canUndoTyping ()
    {
        return undoManager.canUndo ();
    }
}
