/*
Copyright 2025 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.pgrid.editor;

import java.awt.Dimension;
import java.awt.Insets;
import java.awt.Point;
import java.util.ArrayList;
import java.util.List;

import javax.swing.AbstractButton;
import javax.swing.Icon;
import javax.swing.JButton;
import javax.swing.JPanel;

/**
    A cluster of buttons that sits at the right end of the value cell, beside the primary control.
    Intended to be returned as the secondary control of a ControlSet.

    Usage inside Editor.createControls():
    <pre>
    MultiButtonControl buttons = new MultiButtonControl (host, size);
    buttons.add ("...");
    buttons.add (someIcon);
    JTextField field = ...;  // sized to buttons.getPrimarySize()
    buttons.finalizePosition (position);
    return new ControlSet (field, buttons);
    </pre>

    Buttons are square, each as wide as the cell is high, and packed left to right with no gaps.
    The space left for the primary control is the cell width minus the total width of the buttons.
    In onEvent(), compare EditorEvent.getId() against getButtonId(i) to tell the buttons apart.
**/
@SuppressWarnings("serial")
public class MultiButtonControl extends JPanel
{
    protected EditorHost           host;
    protected List<AbstractButton> buttons = new ArrayList<AbstractButton> ();
    protected Dimension            fullEditorSize;
    protected int                  buttonsWidth;
    protected boolean              finalized;

    /**
        @param host If not null, receives this panel as a child, and each button is connected to it.
        @param size Full size of the value cell.
    **/
    public MultiButtonControl (EditorHost host, Dimension size)
    {
        super (null);
        if (size == null) throw new IllegalArgumentException ("Cell size is required");
        this.host      = host;
        fullEditorSize = new Dimension (size);
        setOpaque (false);
        setBounds (-100, -100, 0, size.height);  // Out of sight until finalizePosition().
        ControlIds.set (this, ControlIds.SUBID2);
        if (host != null) host.getPanel ().add (this);
    }

    public void add (String label)
    {
        add (label, ControlIds.AUTO);
    }

    /**
        Appends a text button.
        @param id Explicit id for the button, or ControlIds.AUTO.
    **/
    public void add (String label, int id)
    {
        addButton (new JButton (label), id);
    }

    public void add (Icon icon)
    {
        add (icon, ControlIds.AUTO);
    }

    /**
        Appends an image button.
        @param id Explicit id for the button, or ControlIds.AUTO.
    **/
    public void add (Icon icon, int id)
    {
        addButton (new JButton (icon), id);
    }

    protected void addButton (AbstractButton button, int id)
    {
        if (finalized) throw new IllegalStateException ("Buttons can't be added after finalizePosition()");
        id = generateId (id);
        if (id < 0  ||  id == ControlIds.SUBID1  ||  id == ControlIds.SUBID2) throw new IllegalArgumentException ("Reserved button id " + id);
        if (indexOf (id) >= 0) throw new IllegalArgumentException ("Duplicate button id " + id);

        int height = fullEditorSize.height;
        int width  = height;
        button.setMargin (new Insets (0, 0, 0, 0));
        button.setFocusable (false);
        button.setBounds (buttonsWidth, 0, width, height);
        super.add (button);
        buttons.add (button);
        buttonsWidth += width;
        setSize (buttonsWidth, height);

        if (host == null) ControlIds.set (button, id);
        else              host.connect (button, id);
    }

    /**
        Resolves an AUTO request to one more than the largest id used so far.
        The first automatic id is SUBID_TEMP1.
    **/
    protected int generateId (int id)
    {
        if (id != ControlIds.AUTO) return id;
        int result = ControlIds.SUBID_TEMP1 - 1;
        for (AbstractButton b : buttons) result = Math.max (result, ControlIds.get (b));
        return result + 1;
    }

    public AbstractButton getButton (int index)
    {
        return buttons.get (index);
    }

    public int getButtonId (int index)
    {
        return ControlIds.get (buttons.get (index));
    }

    /**
        @return Position of the button with the given id, or -1 if no button has it.
    **/
    public int indexOf (int id)
    {
        for (int i = 0; i < buttons.size (); i++)
        {
            if (ControlIds.get (buttons.get (i)) == id) return i;
        }
        return -1;
    }

    public int getCount ()
    {
        return buttons.size ();
    }

    public int getButtonsWidth ()
    {
        return buttonsWidth;
    }

    public Dimension getFullEditorSize ()
    {
        return new Dimension (fullEditorSize);
    }

    /**
        @return The part of the cell left over for the primary control.
    **/
    public Dimension getPrimarySize ()
    {
        return new Dimension (fullEditorSize.width - buttonsWidth, fullEditorSize.height);
    }

    /**
        Moves the cluster so its right edge lines up with the right edge of the cell.
        Call exactly once, after all buttons are added and the primary control exists.
        @param position Top-left corner of the cell, the same point given to createControls().
    **/
    public void finalizePosition (Point position)
    {
        if (finalized) throw new IllegalStateException ("finalizePosition() already called");
        if (position == null) throw new IllegalArgumentException ("Cell position is required");
        setBounds (position.x + fullEditorSize.width - buttonsWidth, position.y, buttonsWidth, fullEditorSize.height);
        finalized = true;
    }

    public boolean isFinalized ()
    {
        return finalized;
    }
}
