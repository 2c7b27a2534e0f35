package edu.kit.kastel.vads.cdetector.semantic;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.intellij.lang.annotations.Language;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import edu.kit.kastel.vads.cdetector.CommonTest;
import edu.kit.kastel.vads.cdetector.diagnostic.Category;
import edu.kit.kastel.vads.cdetector.diagnostic.Diagnostic;

public class TestIntegerLiteralRangeAnalysis extends CommonTest {

    @Language("C")
    private static final String CHAR_TARGET = """
        int main(void) {
            char c;
            c = 300;
            return 0;
        }
        """;

    @Language("C")
    private static final String INT_TARGET = """
        int main(void) {
            int c;
            c = 300;
            return 0;
        }
        """;

    @DisplayName("300 does not fit a char but fits an int")
    @Test
    public void charVersusInt() {
        List<Diagnostic> diagnostics = analyze(CHAR_TARGET);
        assertEquals(List.of(Category.INTEGER_LITERAL_OVERFLOW), categories(diagnostics));
        assertEquals(List.of(3), lines(diagnostics));
        assertTrue(diagnostics.get(0).message().contains("-128 to 127"));

        assertEquals(List.of(), analyze(INT_TARGET));
    }

    @Language("C")
    private static final String WIDTHS = """
        #include <stdint.h>
        int main(void) {
            unsigned char u = 256;
            unsigned char v = 255;
            signed char s = -129;
            short sh = -32768;
            unsigned int big = 4294967296;
            unsigned int wrap = -1;
            uint8_t b = 256;
            int16_t w = 40000;
            long long ll = 9223372036854775807;
            return 0;
        }
        """;

    @DisplayName("signed, unsigned and fixed-width alias ranges")
    @Test
    public void widths() {
        List<Diagnostic> diagnostics = only(analyze(WIDTHS), Category.INTEGER_LITERAL_OVERFLOW);
        assertEquals(List.of(3, 5, 7, 8, 9, 10), lines(diagnostics));
    }

    @Language("C")
    private static final String ARRAY_ELEMENTS = """
        int main(void) {
            unsigned char bytes[] = {1, 255, 256};
            return bytes[0];
        }
        """;

    @Test
    public void initializerListElements() {
        List<Diagnostic> diagnostics = only(analyze(ARRAY_ELEMENTS), Category.INTEGER_LITERAL_OVERFLOW);
        assertEquals(List.of(2), lines(diagnostics));
        assertTrue(diagnostics.get(0).message().contains("256"));
    }

    @Language("C")
    private static final String NOT_EVALUATED = """
        int main(void) {
            char c = 200 + 100;
            short s;
            s += 70000;
            _Bool flag = 5;
            return c + s + flag;
        }
        """;

    @DisplayName("arithmetic, compound assignment and _Bool targets are not checked")
    @Test
    public void onlyPlainLiteralStores() {
        assertEquals(List.of(), only(analyze(NOT_EVALUATED), Category.INTEGER_LITERAL_OVERFLOW));
    }
}
