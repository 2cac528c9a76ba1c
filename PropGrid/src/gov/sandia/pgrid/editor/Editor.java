/*
Copyright 2025 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.pgrid.editor;

import java.awt.Dimension;
import java.awt.Graphics;
import java.awt.Point;
import java.awt.Rectangle;

import javax.swing.JComponent;

import gov.sandia.pgrid.property.Property;
import gov.sandia.pgrid.property.ValueHolder;

/**
    Translates between a Property's value and the interactive controls that edit it.

    <p>One instance serves every row that uses it, possibly in several grids at once.
    Therefore an implementation must not keep any per-row state in its own fields.
    All such state belongs in the controls (see ControlSet) and in the Property.
    All methods are called on the event dispatch thread.</p>

    <p>Lifecycle of a row, as driven by the host:</p>
    <ol>
    <li>createControls() builds the widgets inside the value cell.</li>
    <li>updateControl() loads the property's value into them.</li>
    <li>Each event on the controls goes to onEvent(). When it returns true, the host calls
        getValueFromControl() and, if that reports a change, applies the new value.</li>
    <li>The host destroys the controls. No further calls refer to them.</li>
    </ol>

    Only the host ever changes the property. Abandoning an edit by destroying the controls
    without calling getValueFromControl() must leave the property as it was.

    Most implementations should extend EditorBase, which supplies the optional behaviors.
**/
public interface Editor
{
    /**
        @return Unique, non-empty name. Used as the registry key and must never change.
    **/
    public String getName ();

    /**
        Creates the control(s) for editing the given property, adds them to host.getPanel(), and
        connects each one to the host. The primary control receives id ControlIds.SUBID1 and any
        secondary control receives ControlIds.SUBID2.
        @param position Top-left corner of the value cell, in host panel coordinates.
        @param size Size of the value cell. All controls must fit inside it.
        @return The created controls, or ControlSet.EMPTY if they could not be created.
        Never a partially constructed set.
    **/
    public ControlSet createControls (EditorHost host, Property property, Point position, Dimension size);

    /**
        Loads the property's current value into the controls.
        Idempotent. If the property is unspecified, delegates to setValueToUnspecified().
    **/
    public void updateControl (Property property, ControlSet controls);

    /**
        Paints the value in a row that is not being edited.
        @param text The property's value as a string.
    **/
    public void drawValue (Graphics g, Rectangle rect, Property property, String text);

    /**
        Receives every event from the primary control, and from any secondary control this editor created.
        May update the controls, but never the property.
        @return true exactly when the controls now hold a value different from the property's.
    **/
    public boolean onEvent (EditorHost host, Property property, JComponent primary, EditorEvent event);

    /**
        Reads the controls, converts the result into the property's value domain, and stores it in result.
        The conversion is done by the property itself, and a conversion failure simply reports false.
        @return true if the value differs from the property's current value.
    **/
    public boolean getValueFromControl (ValueHolder result, Property property, ControlSet controls);

    /**
        Puts the controls into a blank state that represents "no determinate value".
        A subsequent getValueFromControl() on untouched controls yields unspecified.
    **/
    public void setValueToUnspecified (Property property, ControlSet controls);

    /**
        Sets the displayed text directly, without a full updateControl() cycle.
    **/
    public void setControlStringValue (Property property, JComponent control, String text);

    /**
        Sets the displayed value directly from an integer, for example a choice index.
    **/
    public void setControlIntValue (Property property, JComponent control, int value);

    /**
        Adds an item to a list-like control. Only the control changes. Positions in the control are
        converted through the property's own choices, so the caller must make the same change to the
        property (for example EnumProperty.addChoice()) to keep the two lined up.
        @param index Position to insert at, or -1 to append.
        @return Index of the new item, or -1 if this editor has no list.
    **/
    public int insertItem (JComponent control, String label, int index);

    /**
        Removes an item from a list-like control. As with insertItem(), the property's choices must be changed to match.
    **/
    public void deleteItem (JComponent control, int index);

    /**
        Extra processing when the control gains focus, such as selecting all text.
    **/
    public void onFocus (Property property, JComponent control);

    /**
        @return true if the primary control can show a custom image next to its text.
    **/
    public boolean canContainCustomImage ();
}
