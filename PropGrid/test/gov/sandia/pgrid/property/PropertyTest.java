/*
Copyright 2025 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.pgrid.property;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.time.LocalDate;
import java.util.Arrays;

import org.junit.Test;

import gov.sandia.pgrid.editor.CheckBoxEditor;
import gov.sandia.pgrid.editor.ChoiceEditor;
import gov.sandia.pgrid.editor.DatePickerCtrlEditor;
import gov.sandia.pgrid.editor.TextCtrlEditor;

public class PropertyTest {
    @Test(expected = IllegalArgumentException.class)
    public void testEmptyName() {
        new StringProperty("");
    }

    @Test
    public void testLabelDefaultsToName() {
        StringProperty p = new StringProperty("title");
        assertEquals("title", p.getLabel());
        assertTrue(p.isValueUnspecified());
        assertEquals("", p.getValueAsString());
    }

    @Test
    public void testInt() {
        IntProperty p = new IntProperty("Count", "count", 5);
        ValueHolder holder = new ValueHolder();
        assertFalse(p.stringToValue(holder, "5"));
        assertTrue(holder.isFilled());
        assertTrue(p.stringToValue(holder, " 6 "));
        assertEquals(6, holder.getValue());

        holder.clear();
        assertFalse(p.stringToValue(holder, "6.5"));
        assertFalse(holder.isFilled());

        assertTrue(p.stringToValue(holder, ""));
        assertTrue(holder.isUnspecified());

        p.setValue(7.6);
        assertEquals(8, p.getValue());
        p.setValue("9");
        assertEquals(9, p.getValue());
    }

    @Test
    public void testRange() {
        IntProperty p = new IntProperty("Count", "count", 5);
        p.setAttribute(Property.MIN, 0);
        p.setAttribute(Property.MAX, 10);
        ValueHolder holder = new ValueHolder();
        assertFalse(p.stringToValue(holder, "11"));
        assertFalse(p.stringToValue(holder, "-1"));
        assertTrue(p.stringToValue(holder, "10"));
        assertFalse(p.intToValue(holder, 12));
        assertTrue(p.intToValue(holder, 3));
        assertEquals(3, holder.getValue());
    }

    @Test
    public void testFloatFormat() {
        assertEquals("1", FloatProperty.format(1.0, 6));
        assertEquals("0.5", FloatProperty.format(0.5, 6));
        assertEquals("3.141593", FloatProperty.format(Math.PI, 6));
        assertEquals("3.14", FloatProperty.format(Math.PI, 2));
        assertEquals("0", FloatProperty.format(-0.0000001, 6));
        assertEquals("-2.5", FloatProperty.format(-2.5, 6));

        FloatProperty p = new FloatProperty("Rate", "rate", 0.125);
        p.setAttribute(Property.PRECISION, 2);
        assertEquals("0.13", p.getValueAsString());
    }

    @Test
    public void testFloatWithoutRounding() {
        assertEquals("30", FloatProperty.format(30.0, -1));
        assertEquals("29.5", FloatProperty.format(29.5, -1));
        assertEquals("3.141592653589793", FloatProperty.format(Math.PI, -1));

        FloatProperty p = new FloatProperty("Rate", "rate", 30.0);
        p.setAttribute(Property.PRECISION, -1);
        assertEquals("30", p.getValueAsString());
    }

    @Test
    public void testBool() {
        BoolProperty p = new BoolProperty("Flag", "flag", false);
        assertEquals("False", p.getValueAsString());
        assertEquals(0, p.getChoiceSelection());
        ValueHolder holder = new ValueHolder();
        assertTrue(p.stringToValue(holder, "true"));
        assertEquals(Boolean.TRUE, holder.getValue());
        assertFalse(p.stringToValue(holder, "0"));
        assertFalse(p.intToValue(holder, -1));
        assertTrue(p.intToValue(holder, 1));
        assertEquals(Arrays.asList("False", "True"), p.getChoices());

        assertEquals(ChoiceEditor.NAME, p.getDefaultEditorName());
        p.setAttribute(Property.USE_CHECKBOX, true);
        assertEquals(CheckBoxEditor.NAME, p.getDefaultEditorName());
    }

    @Test
    public void testEnum() {
        EnumProperty p = new EnumProperty("Size", "size", Arrays.asList("Small", "Large"), Arrays.asList(1, 5), 5);
        assertEquals("Large", p.getValueAsString());
        assertEquals(1, p.getChoiceSelection());
        ValueHolder holder = new ValueHolder();
        assertTrue(p.intToValue(holder, 0));
        assertEquals(1, holder.getValue());
        assertFalse(p.intToValue(holder, 2));
        assertTrue(p.stringToValue(holder, "Small"));
        assertFalse(p.stringToValue(holder, "Medium"));

        p.addChoice("Medium", 3);
        assertEquals(3, p.getChoices().size());
        p.removeChoice(2);
        assertEquals(2, p.getChoices().size());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEnumDuplicateValue() {
        EnumProperty p = new EnumProperty("size");
        p.addChoice("Small", 1);
        p.addChoice("Tiny", 1);
    }

    @Test
    public void testString() {
        StringProperty p = new StringProperty("Name", "name", "a");
        p.setSuggestions(Arrays.asList("a", "b"));
        assertEquals(0, p.getChoiceSelection());
        ValueHolder holder = new ValueHolder();
        assertTrue(p.intToValue(holder, 1));
        assertEquals("b", holder.getValue());
        assertFalse(p.intToValue(holder, 2));
        assertEquals(TextCtrlEditor.NAME, p.getEditorName());
        p.setEditor("ComboBox");
        assertEquals("ComboBox", p.getEditorName());
    }

    @Test
    public void testDate() {
        DateProperty p = new DateProperty("Due", "due", LocalDate.of(2024, 2, 29));
        assertEquals("2024-02-29", p.getValueAsString());
        assertEquals(DatePickerCtrlEditor.NAME, p.getDefaultEditorName());

        p.setAttribute(Property.DATE_FORMAT, "dd/MM/yyyy");
        assertEquals("29/02/2024", p.getValueAsString());
        ValueHolder holder = new ValueHolder();
        assertTrue(p.stringToValue(holder, "01/03/2024"));
        assertEquals(LocalDate.of(2024, 3, 1), holder.getValue());
        assertTrue(p.stringToValue(holder, "2024-03-02"));  // ISO always accepted
        assertEquals(LocalDate.of(2024, 3, 2), holder.getValue());
        assertFalse(p.stringToValue(holder, "soon"));
        assertFalse(p.intToValue(holder, 1));
        assertNull(p.parse("31/02/2024x"));
    }

    @Test
    public void testDatePatternWithTimeFallsBack() {
        DateProperty p = new DateProperty("Due", "due", LocalDate.of(2024, 2, 29));
        p.setAttribute(Property.DATE_FORMAT, "yyyy-MM-dd HH:mm");
        assertEquals("2024-02-29", p.getValueAsString());
        ValueHolder holder = new ValueHolder();
        assertTrue(p.stringToValue(holder, "2024-03-01"));
        assertEquals(LocalDate.of(2024, 3, 1), holder.getValue());
    }
}
