package org.apache.calcite.adapter.cdp.tests;

import org.apache.calcite.adapter.cdp.tabular.CdpFieldType;
import org.apache.calcite.adapter.cdp.tabular.ValueConverter;
import org.apache.calcite.adapter.cdp.tabular.exception.CdpException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

public class ValueConverterTest {

    @Test
    @DisplayName("Numbers and booleans are narrowed to the column type")
    public void testNumbersAndBooleans() {
        assertEquals(42, ValueConverter.convert(42L, CdpFieldType.INT));
        assertEquals(42, ValueConverter.convert("42", CdpFieldType.INT));
        assertEquals(7L, ValueConverter.convert(7, CdpFieldType.LONG));
        assertEquals((short) 3, ValueConverter.convert("3", CdpFieldType.SHORT));
        assertEquals(1.5d, ValueConverter.convert("1.5", CdpFieldType.DOUBLE));
        assertEquals(2.5f, ValueConverter.convert(2.5d, CdpFieldType.FLOAT));
        assertEquals(Boolean.TRUE, ValueConverter.convert(true, CdpFieldType.BOOLEAN));
        assertEquals(Boolean.FALSE, ValueConverter.convert("false", CdpFieldType.BOOLEAN));
    }

    @Test
    @DisplayName("Dates, times and timestamps use Calcite's internal representation")
    public void testTemporalValues() {
        assertEquals((int) LocalDate.of(2024, 1, 15).toEpochDay(), ValueConverter.convert("2024-01-15", CdpFieldType.DATE));
        assertEquals((10 * 3600 + 30 * 60) * 1000, ValueConverter.convert("10:30:00", CdpFieldType.TIME));
        assertEquals(LocalDateTime.of(2024, 1, 15, 10, 30).toInstant(ZoneOffset.UTC).toEpochMilli(),
            ValueConverter.convert("2024-01-15T10:30:00", CdpFieldType.TIMESTAMP));
    }

    @Test
    @DisplayName("Nulls and empty values")
    public void testNullsAndEmptyValues() {
        assertNull(ValueConverter.convert(null, CdpFieldType.STRING));
        assertNull(ValueConverter.convert("", CdpFieldType.INT));
        assertNull(ValueConverter.convert("", CdpFieldType.DATE));
        assertEquals("", ValueConverter.convert("", CdpFieldType.STRING));
        assertEquals("12", ValueConverter.convert(12, CdpFieldType.STRING));
    }

    @Test
    @DisplayName("Unparseable values are reported with the column type")
    public void testInvalidValues() {
        CdpException error = assertThrows(CdpException.class, () -> ValueConverter.convert("abc", CdpFieldType.INT));
        assertTrue(error.getMessage().contains("abc"));
        assertTrue(error.getMessage().contains("INT"));
        assertThrows(CdpException.class, () -> ValueConverter.convert("yesterday", CdpFieldType.DATE));
    }
}
