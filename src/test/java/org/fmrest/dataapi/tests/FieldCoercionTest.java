package org.fmrest.dataapi.tests;

import org.fmrest.dataapi.model.FieldMetadata;
import org.fmrest.dataapi.rest.ContainerReference;
import org.fmrest.dataapi.rest.DateFormats;
import org.fmrest.dataapi.rest.FieldCoercion;
import org.fmrest.dataapi.rest.FieldType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Conversion of field values between wire strings and typed values, without a server.
 */
public class FieldCoercionTest {

    private static FieldMetadata field(String name, String result) {
        return new FieldMetadata(name, "normal", "editText", result, false, 1);
    }

    private static FieldCoercion coercion(DateFormats formats) {
        return new FieldCoercion(List.of(
            field("name", "text"),
            field("age", "number"),
            field("birthday", "date"),
            field("startTime", "time"),
            field("lastVisit", "timeStamp"),
            field("photo", "container"),
            new FieldMetadata("tags", "normal", "editText", "text", false, 3),
            new FieldMetadata("scores", "normal", "editText", "number", false, 2)
        ), formats);
    }

    private final FieldCoercion coercion = coercion(DateFormats.defaults());

    @Test
    @DisplayName("Result names map to field types, case-insensitively")
    public void testFieldTypes() {
        assertEquals(FieldType.TIMESTAMP, FieldType.of("timeStamp"));
        assertEquals(FieldType.NUMBER, FieldType.of("NUMBER"));
        assertNull(FieldType.of("summary"));
        assertNull(FieldType.of(null));
        assertEquals(LocalDate.class, FieldType.DATE.getJavaClass());
    }

    @Test
    @DisplayName("Wire values are read as typed values")
    public void testFromWire() {
        assertEquals("Alice", coercion.fromWire("name", "Alice"));
        assertEquals(new BigDecimal("42"), coercion.fromWire("age", "42"));
        assertEquals(new BigDecimal("42"), coercion.fromWire("age", 42));
        assertEquals(LocalDate.of(1990, 5, 17), coercion.fromWire("birthday", "05/17/1990"));
        assertEquals(LocalTime.of(8, 15), coercion.fromWire("startTime", "08:15:00"));
        assertEquals(LocalDateTime.of(2024, 3, 1, 14, 30), coercion.fromWire("lastVisit", "03/01/2024 14:30:00"));
        assertEquals(new ContainerReference("https://fms/Streaming/a.png"),
            coercion.fromWire("photo", "https://fms/Streaming/a.png"));
    }

    @Test
    @DisplayName("Empty string is null for every type but text")
    public void testEmptyValues() {
        assertEquals("", coercion.fromWire("name", ""));
        assertNull(coercion.fromWire("age", ""));
        assertNull(coercion.fromWire("birthday", ""));
        assertNull(coercion.fromWire("photo", ""));
        assertEquals("", coercion.toWire("age", null));
        assertEquals("", coercion.toWire("unknown", null));
    }

    @Test
    @DisplayName("Typed values are written in the server formats")
    public void testToWire() {
        assertEquals("Bob", coercion.toWire("name", "Bob"));
        assertEquals(7, coercion.toWire("age", 7));
        assertEquals("12/24/2023", coercion.toWire("birthday", LocalDate.of(2023, 12, 24)));
        assertEquals("23:05:09", coercion.toWire("startTime", LocalTime.of(23, 5, 9)));
        assertEquals("01/02/2024 03:04:05", coercion.toWire("lastVisit", LocalDateTime.of(2024, 1, 2, 3, 4, 5)));
        assertEquals("https://fms/a.png", coercion.toWire("photo", new ContainerReference("https://fms/a.png")));
        assertEquals("17", coercion.toWire("name", 17), "Text fields take any value as a string");
    }

    @Test
    @DisplayName("Wire strings are validated and sent unchanged")
    public void testStringsValidated() {
        assertEquals("05/17/1990", coercion.toWire("birthday", "05/17/1990"));
        assertThrows(IllegalArgumentException.class, () -> coercion.toWire("birthday", "yesterday"));
        assertThrows(IllegalArgumentException.class, () -> coercion.toWire("age", "forty-two"));
    }

    @Test
    @DisplayName("Values of the wrong type are refused")
    public void testWrongTypes() {
        assertThrows(IllegalArgumentException.class, () -> coercion.toWire("age", LocalDate.now()));
        assertThrows(IllegalArgumentException.class, () -> coercion.toWire("birthday", 5));
        assertThrows(IllegalArgumentException.class, () -> coercion.fromWire("birthday", "not a date"));
        assertThrows(IllegalArgumentException.class, () -> coercion.fromWire("age", "abc"));
    }

    @Test
    @DisplayName("Repetitions resolve to the base field up to maxRepeat")
    public void testRepetitions() {
        assertEquals(FieldType.TEXT, coercion.typeOf("tags(2)"));
        assertEquals(FieldType.TEXT, coercion.typeOf("tags(3)"));
        assertNull(coercion.typeOf("tags(4)"));
        assertEquals(new BigDecimal("9"), coercion.fromWire("scores(2)", "9"));
        assertEquals("x", coercion.fromWire("scores(3)", "x"), "Beyond maxRepeat the value passes through");
        assertNull(coercion.typeOf("tags(99999999999)"));
        assertEquals("y", coercion.fromWire("scores(99999999999)", "y"));
    }

    @Test
    @DisplayName("Unknown fields pass through")
    public void testUnknownFields() {
        assertEquals("05/17/1990", coercion.fromWire("Notes", "05/17/1990"));
        assertEquals(3, coercion.toWire("Notes", 3));
        assertEquals("2024-01-02", coercion.toWire("Notes", LocalDate.of(2024, 1, 2)));
        assertNull(coercion.lookup("Notes"));
    }

    @Test
    @DisplayName("Custom server formats")
    public void testCustomFormats() {
        FieldCoercion european = coercion(new DateFormats("dd.MM.yyyy", "HH:mm", "dd.MM.yyyy HH:mm"));

        assertEquals(LocalDate.of(1990, 5, 17), european.fromWire("birthday", "17.05.1990"));
        assertEquals("24.12.2023", european.toWire("birthday", LocalDate.of(2023, 12, 24)));
        assertEquals(LocalTime.of(7, 45), european.fromWire("startTime", "07:45"));
        assertEquals("02.01.2024 03:04", european.toWire("lastVisit", LocalDateTime.of(2024, 1, 2, 3, 4)));
    }

    @Test
    @DisplayName("Whole fieldData maps keep their order")
    public void testMapToWire() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("name", "Carl");
        values.put("birthday", LocalDate.of(2000, 1, 31));
        values.put("age", null);

        Map<String, Object> wire = coercion.toWire(values);

        assertEquals(List.of("name", "birthday", "age"), List.copyOf(wire.keySet()));
        assertEquals("01/31/2000", wire.get("birthday"));
        assertEquals("", wire.get("age"));
    }

    @Test
    @DisplayName("Pass-through coercion keeps wire values")
    public void testPassThrough() {
        FieldCoercion passThrough = FieldCoercion.passThrough();

        assertEquals("42", passThrough.fromWire("age", "42"));
        assertEquals("", passThrough.fromWire("age", ""));
        assertNull(passThrough.typeOf("age"));
    }
}
