/*
Copyright 2025 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.pgrid.ui;

import java.awt.Color;
import java.awt.Component;
import java.awt.Container;
import java.awt.Dimension;
import java.awt.FontMetrics;
import java.awt.Graphics;
import java.awt.Rectangle;
import java.awt.event.MouseAdapter;
import java.awt.event.MouseEvent;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import javax.swing.JComponent;
import javax.swing.JPanel;
import javax.swing.event.ChangeEvent;
import javax.swing.event.ChangeListener;

import org.apache.log4j.Logger;

import gov.sandia.pgrid.editor.ControlIds;
import gov.sandia.pgrid.editor.ControlSet;
import gov.sandia.pgrid.editor.Editor;
import gov.sandia.pgrid.editor.EditorEvent;
import gov.sandia.pgrid.editor.EditorHost;
import gov.sandia.pgrid.editor.EditorNotFoundException;
import gov.sandia.pgrid.editor.EditorRegistry;
import gov.sandia.pgrid.property.DateProperty;
import gov.sandia.pgrid.property.NumericProperty;
import gov.sandia.pgrid.property.Property;
import gov.sandia.pgrid.property.ValueHolder;

/**
    A two-column list of properties: label on the left, value on the right.
    At most one row is edited at a time. Editing a row asks the registry for the property's editor,
    which places its controls over the value cell. Every value change goes through the undo stack.

    <p>Edit lifecycle:
    <pre>
    INACTIVE --beginEdit--> CREATING --controls bound--> BOUND --endEdit--> DESTROYING --> INACTIVE
    </pre>
    Events reach the editor only in the BOUND state.
**/
@SuppressWarnings("serial")
public class PropertyGrid extends JPanel implements EditorHost
{
    private static Logger logger = Logger.getLogger (PropertyGrid.class);

    public enum State
    {
        INACTIVE,
        CREATING,
        BOUND,
        DESTROYING
    }

    protected EditorRegistry       registry;
    protected GridSettings         settings;
    protected EventRelay           relay           = new EventRelay (this);
    protected EditHistory          history         = new EditHistory ();
    protected List<Property>       properties      = new ArrayList<Property> ();
    protected List<ChangeListener> changeListeners = new ArrayList<ChangeListener> ();

    protected State      state    = State.INACTIVE;
    protected Property   edited;
    protected Editor     editor;
    protected ControlSet controls = ControlSet.EMPTY;
    protected int        session;      // Incremented whenever consecutive changes should no longer merge into one undo step.
    protected boolean    updating;     // Pushing a value into the controls. Events they fire in response are ignored.
    protected boolean    dispatching;  // Inside onCustomEditorEvent(). Blocks re-entry.
    protected boolean    committing;   // The value came from the controls, so they don't need a refresh.

    public PropertyGrid ()
    {
        this (EditorRegistry.createDefault (), GridSettings.load ());
    }

    public PropertyGrid (EditorRegistry registry)
    {
        this (registry, GridSettings.load ());
    }

    public PropertyGrid (EditorRegistry registry, GridSettings settings)
    {
        super (null);
        this.registry = registry;
        this.settings = settings;
        setBackground (Color.white);

        addMouseListener (new MouseAdapter ()
        {
            public void mousePressed (MouseEvent e)
            {
                int row = e.getY () / settings.getRowHeight ();
                if (row >= properties.size ()) return;
                if (e.getX () < settings.getSplitterPosition ())
                {
                    endEdit ();
                    return;
                }
                Property property = properties.get (row);
                if (property != edited) beginEdit (property);
            }
        });
    }

    public EditorRegistry getRegistry ()
    {
        return registry;
    }

    public GridSettings getSettings ()
    {
        return settings;
    }

    // Rows ------------------------------------------------------------------

    /**
        Adds a row at the bottom of the grid.
        Grid-wide defaults (spinStep, dateFormat) are copied into properties that lack their own setting.
        @throws IllegalArgumentException if a property with the same name is already present.
    **/
    public Property append (Property property)
    {
        if (property == null) throw new IllegalArgumentException ("Property must not be null");
        if (getProperty (property.getName ()) != null) throw new IllegalArgumentException ("Duplicate property name: " + property.getName ());

        String step = settings.get (GridSettings.SPIN_STEP);
        if (property instanceof NumericProperty  &&  ! step.isEmpty ()  &&  property.getAttribute (Property.STEP).isEmpty ())
        {
            property.setAttribute (Property.STEP, step);
        }
        String dateFormat = settings.get (GridSettings.DATE_FORMAT);
        if (property instanceof DateProperty  &&  ! dateFormat.isEmpty ()  &&  property.getAttribute (Property.DATE_FORMAT).isEmpty ())
        {
            property.setAttribute (Property.DATE_FORMAT, dateFormat);
        }

        properties.add (property);
        revalidate ();
        repaint ();
        return property;
    }

    public Property getProperty (String name)
    {
        for (Property p : properties) if (p.getName ().equals (name)) return p;
        return null;
    }

    public List<Property> getProperties ()
    {
        return Collections.unmodifiableList (properties);
    }

    public boolean contains (Property property)
    {
        return properties.contains (property);
    }

    public int getRow (Property property)
    {
        return properties.indexOf (property);
    }

    /**
        Removes the row, ending its edit if active, and forgets any undo history that refers to it.
    **/
    public boolean removeProperty (Property property)
    {
        if (! properties.contains (property)) return false;
        if (property == edited) endEdit ();
        properties.remove (property);
        history.forget (property);
        revalidate ();
        repaint ();
        return true;
    }

    // Editing ---------------------------------------------------------------

    public State getState ()
    {
        return state;
    }

    public Property getEditedProperty ()
    {
        return edited;
    }

    public Editor getActiveEditor ()
    {
        return editor;
    }

    public ControlSet getControls ()
    {
        return controls;
    }

    /**
        @return Bounds of the value cell in the given row.
    **/
    public Rectangle getEditorRect (int row)
    {
        int width = getWidth ();
        if (width <= 0) width = settings.getWidth ();
        int x = settings.getSplitterPosition ();
        int h = settings.getRowHeight ();
        return new Rectangle (x, row * h, Math.max (0, width - x), h);
    }

    /**
        Puts the row of the given property into edit mode. Any other row being edited is closed first.
        @return false if the editor could not create its controls. In that case the grid stays inactive.
        @throws IllegalArgumentException if the property is not in this grid.
        @throws EditorNotFoundException if the property names an editor that is not registered.
    **/
    public boolean beginEdit (Property property)
    {
        int row = properties.indexOf (property);
        if (row < 0) throw new IllegalArgumentException ("Property is not in this grid: " + property);
        if (state == State.CREATING  ||  state == State.DESTROYING) throw new IllegalStateException ("Can't begin an edit while " + state);
        if (state == State.BOUND) endEdit ();

        Editor e = registry.editorFor (property);
        Rectangle r = getEditorRect (row);

        state  = State.CREATING;
        edited = property;
        editor = e;
        ControlSet created;
        try
        {
            created = e.createControls (this, property, r.getLocation (), r.getSize ());
        }
        catch (RuntimeException x)
        {
            abandonEdit ();
            throw x;
        }
        if (created == null  ||  ! created.isValid ())
        {
            logger.warn ("Editor " + e.getName () + " could not create controls for " + property.getName ());
            abandonEdit ();
            return false;
        }

        controls = created;
        session++;
        updating = true;
        try
        {
            e.updateControl (property, controls);
        }
        catch (RuntimeException x)
        {
            abandonEdit ();
            throw x;
        }
        finally
        {
            updating = false;
        }
        state = State.BOUND;
        logger.debug ("Editing " + property.getName () + " with " + e.getName ());
        repaint ();
        return true;
    }

    /**
        Clears out whatever a failed createControls() or updateControl() left behind.
    **/
    protected void abandonEdit ()
    {
        removeAll ();  // Only editor controls are ever children of this panel.
        controls = ControlSet.EMPTY;
        editor   = null;
        edited   = null;
        state    = State.INACTIVE;
        repaint ();
    }

    /**
        Destroys the controls of the active row without reading their value.
        Anything not yet committed is discarded.
        @return false if no row was being edited.
    **/
    public boolean endEdit ()
    {
        if (state != State.BOUND) return false;
        state = State.DESTROYING;
        logger.debug ("End edit " + edited.getName ());
        removeAll ();  // Only editor controls are ever children of this panel.
        controls = ControlSet.EMPTY;
        editor   = null;
        edited   = null;
        state    = State.INACTIVE;
        repaint ();
        return true;
    }

    /**
        Entry point for every event from editor controls.
        Passes the event to the editor and then to the property. If either reports a changed value, commits it.
        @return true if a change was committed.
    **/
    public boolean onCustomEditorEvent (EditorEvent event)
    {
        if (state != State.BOUND  ||  updating  ||  dispatching) return false;
        Component source = event.getComponent ();
        if (! controls.contains (source))
        {
            logger.debug ("Ignoring event from control outside the active editor: " + event);
            return false;
        }

        dispatching = true;
        try
        {
            JComponent primary = controls.getPrimary ();
            if (event.getType () == EditorEvent.Type.FOCUS_GAINED)
            {
                if (source == primary) editor.onFocus (edited, primary);
                return false;
            }
            boolean changed = editor.onEvent (this, edited, primary, event);
            if (edited.onEvent (this, primary, event)) changed = true;
            if (! changed) return false;
            return commitChangesFromEditor ();
        }
        finally
        {
            dispatching = false;
        }
    }

    /**
        Reads the value from the active controls and stores it in the property, as an undoable edit.
        @return true if the property value changed.
    **/
    public boolean commitChangesFromEditor ()
    {
        if (state != State.BOUND) return false;
        ValueHolder holder = new ValueHolder ();
        if (! editor.getValueFromControl (holder, edited, controls)) return false;
        if (! holder.isFilled ()) return false;

        committing = true;
        try
        {
            history.record (new ChangePropertyValue (this, edited, holder.getValue (), session));
        }
        finally
        {
            committing = false;
        }
        return true;
    }

    /**
        Sets the value programmatically, as its own undo step.
        @param value New value, or null for unspecified. Subclasses of Property may coerce it.
        @return false if the value is the same as the current one.
        @throws IllegalArgumentException if the property rejects the value.
    **/
    public boolean setPropertyValue (Property property, Object value)
    {
        if (! properties.contains (property)) throw new IllegalArgumentException ("Property is not in this grid: " + property);
        if (Objects.equals (value, property.getValue ())) return false;
        session++;
        history.record (new ChangePropertyValue (this, property, value, session));
        return true;
    }

    /**
        Converts the text with Property.stringToValue() and sets the result as its own undo step.
        @return false if the text does not convert or gives the current value.
    **/
    public boolean setPropertyValueFromString (Property property, String text)
    {
        ValueHolder holder = new ValueHolder ();
        if (! property.stringToValue (holder, text)) return false;
        return setPropertyValue (property, holder.getValue ());
    }

    /**
        Pushes the property's current value into the active controls.
    **/
    public void refreshEditor ()
    {
        if (state != State.BOUND) return;
        updating = true;
        try
        {
            editor.updateControl (edited, controls);
        }
        finally
        {
            updating = false;
        }
    }

    /**
        Called by ChangePropertyValue to store a value.
    **/
    protected void applyValue (Property property, Object value)
    {
        if (value == null) property.setValueToUnspecified ();
        else               property.setValue (value);
        if (property == edited  &&  ! committing) refreshEditor ();
        repaint ();
        notifyChange (property);
    }

    // Undo ------------------------------------------------------------------

    public boolean undo ()
    {
        if (! history.canUndo ()) return false;
        session++;
        history.undo ();
        return true;
    }

    public boolean redo ()
    {
        if (! history.canRedo ()) return false;
        session++;
        history.redo ();
        return true;
    }

    // Change notification ---------------------------------------------------

    /**
        The listener receives a ChangeEvent whose source is the property that changed.
    **/
    public void addChangeListener (ChangeListener listener)
    {
        changeListeners.add (listener);
    }

    public void removeChangeListener (ChangeListener listener)
    {
        changeListeners.remove (listener);
    }

    public void notifyChange (Property property)
    {
        ChangeEvent e = new ChangeEvent (property);
        for (ChangeListener c : new ArrayList<ChangeListener> (changeListeners)) c.stateChanged (e);
    }

    // EditorHost ------------------------------------------------------------

    public Container getPanel ()
    {
        return this;
    }

    public void connect (JComponent control, int id)
    {
        ControlIds.set (control, id);
        relay.install (control);
    }

    public JComponent getEditorControl ()
    {
        return controls.getPrimary ();
    }

    public JComponent getEditorControlSecondary ()
    {
        return controls.getSecondary ();
    }

    public String getButtonLabel ()
    {
        return settings.getButtonLabel ();
    }

    public EditHistory getUndoManager ()
    {
        return history;
    }

    // Painting --------------------------------------------------------------

    public Dimension getPreferredSize ()
    {
        return new Dimension (settings.getWidth (), properties.size () * settings.getRowHeight ());
    }

    public void paintComponent (Graphics g)
    {
        super.paintComponent (g);

        int h        = settings.getRowHeight ();
        int splitter = settings.getSplitterPosition ();
        FontMetrics fm = g.getFontMetrics ();
        int baseline = (h - fm.getHeight ()) / 2 + fm.getAscent ();
        for (int row = 0; row < properties.size (); row++)
        {
            Property p = properties.get (row);
            int y = row * h;

            g.setColor (getForeground ());
            g.drawString (p.getLabel (), 2, y + baseline);
            if (p != edited) paintValue (g, getEditorRect (row), p);

            g.setColor (Color.lightGray);
            g.drawLine (0, y + h - 1, getWidth (), y + h - 1);
        }
        g.setColor (Color.lightGray);
        g.drawLine (splitter - 1, 0, splitter - 1, properties.size () * h);
    }

    protected void paintValue (Graphics g, Rectangle r, Property p)
    {
        g.setColor (getForeground ());
        try
        {
            registry.editorFor (p).drawValue (g, r, p, p.getValueAsString ());
        }
        catch (EditorNotFoundException e)
        {
            FontMetrics fm = g.getFontMetrics ();
            g.drawString (p.getValueAsString (), r.x + 2, r.y + (r.height - fm.getHeight ()) / 2 + fm.getAscent ());
        }
    }
}
