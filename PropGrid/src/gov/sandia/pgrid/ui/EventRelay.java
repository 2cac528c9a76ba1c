/*
Copyright 2025 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.pgrid.ui;

import java.awt.Component;
import java.awt.event.ActionEvent;
import java.awt.event.ActionListener;
import java.awt.event.FocusEvent;
import java.awt.event.FocusListener;
import java.awt.event.KeyAdapter;
import java.awt.event.KeyEvent;

import javax.swing.AbstractButton;
import javax.swing.JCheckBox;
import javax.swing.JComboBox;
import javax.swing.JComponent;
import javax.swing.JSpinner;
import javax.swing.JTextField;
import javax.swing.event.ChangeEvent;
import javax.swing.event.ChangeListener;
import javax.swing.event.DocumentEvent;
import javax.swing.event.DocumentListener;
import javax.swing.text.JTextComponent;

import gov.sandia.pgrid.editor.EditorEvent;
import gov.sandia.pgrid.editor.EditorEvent.Type;

/**
    Listens to the Swing events of editor controls and hands them to the grid as EditorEvents.
**/
public class EventRelay
{
    protected PropertyGrid grid;

    public EventRelay (PropertyGrid grid)
    {
        this.grid = grid;
    }

    public void install (JComponent control)
    {
        if (control instanceof JCheckBox)
        {
            ((JCheckBox) control).addActionListener (relay (control, Type.CHECKBOX_TOGGLED));
        }
        else if (control instanceof AbstractButton)
        {
            ((AbstractButton) control).addActionListener (relay (control, Type.BUTTON_CLICKED));
        }
        else if (control instanceof JTextComponent)
        {
            JTextComponent text = (JTextComponent) control;
            text.getDocument ().addDocumentListener (new TextRelay (control));
            text.addKeyListener (new KeyAdapter ()
            {
                public void keyPressed (KeyEvent e)
                {
                    send (EditorEvent.keyPressed (control, e.getKeyCode ()));
                }
            });
            if (control instanceof JTextField) ((JTextField) control).addActionListener (relay (control, Type.TEXT_ENTER));
        }
        else if (control instanceof JComboBox)
        {
            JComboBox<?> combo = (JComboBox<?>) control;
            combo.addActionListener (relay (control, Type.CHOICE_SELECTED));
            if (combo.isEditable ())
            {
                Component editor = combo.getEditor ().getEditorComponent ();
                if (editor instanceof JTextComponent) ((JTextComponent) editor).getDocument ().addDocumentListener (new TextRelay (control));
            }
        }
        else if (control instanceof JSpinner)
        {
            ((JSpinner) control).addChangeListener (new ChangeListener ()
            {
                public void stateChanged (ChangeEvent e)
                {
                    send (new EditorEvent (control, Type.SPIN_CHANGED));
                }
            });
        }

        control.addFocusListener (new FocusListener ()
        {
            public void focusGained (FocusEvent e)
            {
                send (new EditorEvent (control, Type.FOCUS_GAINED));
            }

            public void focusLost (FocusEvent e)
            {
                send (new EditorEvent (control, Type.FOCUS_LOST));
            }
        });
    }

    protected ActionListener relay (JComponent control, Type type)
    {
        return new ActionListener ()
        {
            public void actionPerformed (ActionEvent e)
            {
                send (new EditorEvent (control, type));
            }
        };
    }

    protected void send (EditorEvent event)
    {
        grid.onCustomEditorEvent (event);
    }

    /**
        Reports every change to a document as TEXT_UPDATED on the given control.
    **/
    protected class TextRelay implements DocumentListener
    {
        protected JComponent control;

        public TextRelay (JComponent control)
        {
            this.control = control;
        }

        public void insertUpdate (DocumentEvent e)
        {
            send (new EditorEvent (control, Type.TEXT_UPDATED));
        }

        public void removeUpdate (DocumentEvent e)
        {
            send (new EditorEvent (control, Type.TEXT_UPDATED));
        }

        public void changedUpdate (DocumentEvent e)
        {
            // Attribute changes only. Plain documents don't fire this.
        }
    }
}
