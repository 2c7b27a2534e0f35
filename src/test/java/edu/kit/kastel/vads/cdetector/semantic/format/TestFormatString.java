package edu.kit.kastel.vads.cdetector.semantic.format;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

public class TestFormatString {

    @Test
    public void plainDirectives() {
        List<ConversionSpecifier> specifiers = FormatString.parse("x=%d, name=%s\\n", FormatDirection.OUTPUT);
        assertEquals(2, specifiers.size());
        assertEquals('d', specifiers.get(0).conversion());
        assertEquals('s', specifiers.get(1).conversion());
        assertEquals("%d", specifiers.get(0).text());
    }

    @Test
    public void percentLiteralIsNoDirective() {
        assertEquals(List.of(), FormatString.parse("100%% done", FormatDirection.OUTPUT));
    }

    @DisplayName("flags, widths, precisions and length modifiers of printf")
    @Test
    public void outputModifiers() {
        List<ConversionSpecifier> specifiers = FormatString.parse("%-08.3lf %+lld %zu %#x %Lg",
            FormatDirection.OUTPUT);
        assertEquals(5, specifiers.size());
        assertEquals(LengthModifier.LONG, specifiers.get(0).length());
        assertTrue(specifiers.get(0).isFloating());
        assertEquals(LengthModifier.LONG_LONG, specifiers.get(1).length());
        assertEquals(LengthModifier.SIZE, specifiers.get(2).length());
        assertEquals('x', specifiers.get(3).conversion());
        assertTrue(specifiers.get(3).isInteger());
        assertEquals(LengthModifier.LONG_DOUBLE, specifiers.get(4).length());
    }

    @Test
    public void starsConsumeArguments() {
        ConversionSpecifier specifier = FormatString.parse("%*.*f", FormatDirection.OUTPUT).get(0);
        assertTrue(specifier.starWidth());
        assertTrue(specifier.starPrecision());
        assertEquals(3, specifier.argumentCount());
    }

    @Test
    public void suppressedInputConsumesNothing() {
        List<ConversionSpecifier> specifiers = FormatString.parse("%*d %5s %hhu", FormatDirection.INPUT);
        assertEquals(3, specifiers.size());
        assertTrue(specifiers.get(0).suppressed());
        assertEquals(0, specifiers.get(0).argumentCount());
        assertEquals(1, specifiers.get(1).argumentCount());
        assertEquals(LengthModifier.CHAR, specifiers.get(2).length());
    }

    @DisplayName("a scan set may start with a closing bracket")
    @Test
    public void scanSet() {
        List<ConversionSpecifier> specifiers = FormatString.parse("%[^]x] %d", FormatDirection.INPUT);
        assertEquals(2, specifiers.size());
        assertEquals('[', specifiers.get(0).conversion());
        assertEquals("%[^]x]", specifiers.get(0).text());
        assertTrue(specifiers.get(0).isCharacter());
        assertEquals('d', specifiers.get(1).conversion());
    }

    @Test
    public void malformedDirectiveIsSkipped() {
        List<ConversionSpecifier> specifiers = FormatString.parse("%y %d %", FormatDirection.OUTPUT);
        assertEquals(1, specifiers.size());
        assertFalse(specifiers.get(0).isFloating());
    }
}
