package org.scopeclient.units;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UnitTest {

    @Test
    void prettyPrintUsesSiPrefixes() {
        assertEquals("1.500 kHz", new Unit(Unit.UnitType.HZ).prettyPrint(1500));
        assertEquals("0.000 V", new Unit(Unit.UnitType.VOLTS).prettyPrint(0));
        assertEquals("-250.000 mA", new Unit(Unit.UnitType.AMPS).prettyPrint(-0.25));
        assertEquals("1.000 GS/s", new Unit(Unit.UnitType.SAMPLERATE).prettyPrint(1e9));
    }

    @Test
    void prefixIsChosenAfterRounding() {
        assertEquals("1.000 MHz", new Unit(Unit.UnitType.HZ).prettyPrint(999_999.9996));
        assertEquals("-1.000 kV", new Unit(Unit.UnitType.VOLTS).prettyPrint(-999.9999));
        assertEquals("999.999 Hz", new Unit(Unit.UnitType.HZ).prettyPrint(999.999));
    }

    @Test
    void femtosecondsRenderAsSeconds() {
        assertEquals("2.500 ns", new Unit(Unit.UnitType.FS).prettyPrint(2_500_000));
    }

    @Test
    void unscaledUnitsRenderPlainValue() {
        assertEquals("25.000 %", new Unit(Unit.UnitType.PERCENT).prettyPrint(0.25));
        assertEquals("-3.000 dB", new Unit(Unit.UnitType.DB).prettyPrint(-3));
        assertEquals("42", new Unit(Unit.UnitType.COUNTS).prettyPrint(42));
        assertEquals("2.5", new Unit(Unit.UnitType.COUNTS).prettyPrint(2.5));
    }

    @Test
    void parseStringAcceptsPrefixAndSuffix() {
        assertEquals(1500, new Unit(Unit.UnitType.HZ).parseString("1.500 kHz"), 1e-9);
        assertEquals(1500, new Unit(Unit.UnitType.HZ).parseString("1500"), 1e-9);
        assertEquals(2.5e-4, new Unit(Unit.UnitType.VOLTS).parseString("250 uV"), 1e-12);
        assertEquals(2.5e-4, new Unit(Unit.UnitType.VOLTS).parseString("250 μV"), 1e-12);
        assertEquals(2_500_000, new Unit(Unit.UnitType.FS).parseString("2.5 ns"), 1e-3);
        assertEquals(0.25, new Unit(Unit.UnitType.PERCENT).parseString("25 %"), 1e-12);
    }

    @Test
    void parseStringRejectsGarbage() {
        Unit unit = new Unit(Unit.UnitType.HZ);

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> unit.parseString("fast"));
        assertInstanceOf(NumberFormatException.class, ex.getCause());
    }

    @Test
    void equalityFollowsType() {
        assertEquals(new Unit(Unit.UnitType.OHMS), new Unit(Unit.UnitType.OHMS));
        assertNotEquals(new Unit(Unit.UnitType.OHMS), new Unit(Unit.UnitType.WATTS));
    }
}
