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

public class TestFormatCallAnalysis extends CommonTest {

    @Language("C")
    private static final String MISSING_ADDRESS = """
        #include <stdio.h>
        int main(void) {
            int x, y;
            scanf("%d %d", x, y);
            return 0;
        }
        """;

    @DisplayName("each scalar passed by value to scanf is reported")
    @Test
    public void missingAddressOf() {
        List<Diagnostic> diagnostics = only(analyze(MISSING_ADDRESS), Category.MISSING_ADDRESS_OF);
        assertEquals(List.of(4, 4), lines(diagnostics));
        assertTrue(diagnostics.get(0).message().contains("argument 2"));
        assertTrue(diagnostics.get(1).message().contains("argument 3"));
    }

    @Language("C")
    private static final String ARRAY_DESTINATION = """
        #include <stdio.h>
        int main(void) {
            char str[20];
            scanf("%s", str);
            printf("%s\\n", str);
            return 0;
        }
        """;

    @Test
    public void arrayIsAlreadyAnAddress() {
        assertEquals(List.of(), analyze(ARRAY_DESTINATION));
    }

    @Language("C")
    private static final String SPURIOUS_ADDRESS = """
        #include <stdio.h>
        int main(void) {
            char str[20];
            scanf("%s", &str);
            return 0;
        }
        """;

    @Test
    public void spuriousAddressOf() {
        List<Diagnostic> diagnostics = analyze(SPURIOUS_ADDRESS);
        assertEquals(List.of(Category.SPURIOUS_ADDRESS_OF), categories(diagnostics));
        assertEquals(List.of(4), lines(diagnostics));
    }

    @Language("C")
    private static final String TOO_FEW = """
        #include <stdio.h>
        int main(void) {
            int a = 1;
            printf("%d %d\\n", a);
            printf("%d\\n", a, a);
            return 0;
        }
        """;

    @DisplayName("argument count mismatches are reported once per call")
    @Test
    public void argumentCount() {
        List<Diagnostic> diagnostics = analyze(TOO_FEW);
        assertEquals(List.of(Category.ARGUMENT_COUNT_MISMATCH, Category.ARGUMENT_COUNT_MISMATCH),
            categories(diagnostics));
        assertEquals(List.of(4, 5), lines(diagnostics));
        assertTrue(diagnostics.get(0).message().contains("expects 2 arguments but 1 is given"));
    }

    @Language("C")
    private static final String OUTPUT_TYPES = """
        #include <stdio.h>
        int main(void) {
            double ratio = 0.5;
            long big = 5;
            char c = 'a';
            printf("%d\\n", ratio);
            printf("%d\\n", big);
            printf("%ld %c %f\\n", big, c, ratio);
            printf("%s\\n", 42);
            printf("%p\\n", &big);
            return 0;
        }
        """;

    @DisplayName("printf values are checked against the conversion and its length modifier")
    @Test
    public void outputTypes() {
        List<Diagnostic> diagnostics = analyze(OUTPUT_TYPES);
        assertEquals(List.of(Category.FORMAT_TYPE_MISMATCH, Category.FORMAT_TYPE_MISMATCH,
            Category.FORMAT_TYPE_MISMATCH), categories(diagnostics));
        assertEquals(List.of(6, 7, 9), lines(diagnostics));
    }

    @Language("C")
    private static final String INPUT_TYPES = """
        #include <stdio.h>
        int main(void) {
            double d;
            float f;
            short s;
            scanf("%f", &d);
            scanf("%lf %f %hd", &d, &f, &s);
            scanf("%d", &s);
            return 0;
        }
        """;

    @DisplayName("scanf destinations must have exactly the width the directive writes")
    @Test
    public void inputTypes() {
        List<Diagnostic> diagnostics = only(analyze(INPUT_TYPES), Category.FORMAT_TYPE_MISMATCH);
        assertEquals(List.of(6, 8), lines(diagnostics));
    }

    @Language("C")
    private static final String SPECIAL_DIRECTIVES = """
        #include <stdio.h>
        int main(void) {
            int n;
            char word[8];
            printf("100%%\\n");
            printf("%*d|%-5.2f\\n", 6, 42, 3.5);
            scanf("%*s %7s %d", word, &n);
            fprintf(stderr, "%s: %d\\n", word, n);
            return 0;
        }
        """;

    @DisplayName("escaped percent, star width and assignment suppression consume the right arguments")
    @Test
    public void specialDirectives() {
        assertEquals(List.of(), analyze(SPECIAL_DIRECTIVES));
    }

    @Language("C")
    private static final String COMPUTED_FORMAT = """
        #include <stdio.h>
        int main(void) {
            const char *format = "%d";
            printf(format, 1, 2, 3);
            return 0;
        }
        """;

    @DisplayName("a format that is not a literal is left alone")
    @Test
    public void computedFormat() {
        assertEquals(List.of(), analyze(COMPUTED_FORMAT));
    }
}
