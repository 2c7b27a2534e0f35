package edu.kit.kastel.vads.cdetector.semantic;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.intellij.lang.annotations.Language;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import edu.kit.kastel.vads.cdetector.AnalyzerConfiguration;
import edu.kit.kastel.vads.cdetector.CommonTest;
import edu.kit.kastel.vads.cdetector.diagnostic.Category;
import edu.kit.kastel.vads.cdetector.diagnostic.Diagnostic;

public class TestHeaderAnalysis extends CommonTest {

    @Language("C")
    private static final String MISSING = """
        int main(void) {
            printf("hello\\n");
            printf("again\\n");
            return 0;
        }
        """;

    @DisplayName("a missing header is reported once, at the first call")
    @Test
    public void missingHeader() {
        List<Diagnostic> diagnostics = analyze(MISSING);
        assertEquals(List.of(Category.MISSING_HEADER), categories(diagnostics));
        assertEquals(List.of(2), lines(diagnostics));
        assertTrue(diagnostics.get(0).message().contains("<stdio.h>"));
    }

    @Language("C")
    private static final String MISSPELLED = """
        #include <stdoi.h>
        int main(void) {
            printf("hello\\n");
            return 0;
        }
        """;

    @DisplayName("a near miss of the required header is a misspelling, at the directive and at the call")
    @Test
    public void misspelledHeader() {
        List<Diagnostic> diagnostics = analyze(MISSPELLED);
        assertEquals(List.of(Category.MISSPELLED_HEADER, Category.MISSPELLED_HEADER), categories(diagnostics));
        assertEquals(List.of(1, 3), lines(diagnostics));
        assertTrue(diagnostics.get(0).message().contains("did you mean <stdio.h>"));
        assertTrue(diagnostics.get(1).message().contains("<stdoi.h> on line 1"));
    }

    @Test
    public void editDistanceIsConfigurable() {
        AnalyzerConfiguration strict = new AnalyzerConfiguration.Builder().setHeaderEditDistance(0).build();
        List<Diagnostic> diagnostics = analyze(strict, MISSPELLED);
        assertEquals(List.of(Category.MISSING_HEADER), categories(diagnostics));
        assertEquals(List.of(3), lines(diagnostics));
    }

    @Language("C")
    private static final String OTHER_STANDARD_HEADER = """
        #include <stdlib.h>
        int main(void) {
            int *p = malloc(sizeof(int));
            printf("%p\\n", p);
            free(p);
            return 0;
        }
        """;

    @DisplayName("another standard header is never taken for a misspelling")
    @Test
    public void knownHeaderIsNoMisspelling() {
        List<Diagnostic> diagnostics = analyze(OTHER_STANDARD_HEADER);
        assertEquals(List.of(Category.MISSING_HEADER), categories(diagnostics));
        assertEquals(List.of(4), lines(diagnostics));
    }

    @Language("C")
    private static final String INCLUDED_TOO_LATE = """
        int length(const char *text) {
            return strlen(text);
        }
        #include <string.h>
        """;

    @Test
    public void includeMustPrecedeTheCall() {
        List<Diagnostic> diagnostics = only(analyze(INCLUDED_TOO_LATE), Category.MISSING_HEADER);
        assertEquals(List.of(2), lines(diagnostics));
    }

    @Language("C")
    private static final String USER_FUNCTIONS = """
        #include "helpers.h"
        int abs(int value) {
            return value < 0 ? -value : value;
        }
        int main(void) {
            frobnicate(abs(-3));
            return 0;
        }
        """;

    @DisplayName("user functions and unknown names are never matched against headers")
    @Test
    public void userFunctions() {
        assertEquals(List.of(), analyze(USER_FUNCTIONS));
    }
}
