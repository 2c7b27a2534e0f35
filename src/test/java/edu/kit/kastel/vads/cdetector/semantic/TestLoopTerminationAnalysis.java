package edu.kit.kastel.vads.cdetector.semantic;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;

import org.intellij.lang.annotations.Language;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import edu.kit.kastel.vads.cdetector.AnalyzerConfiguration;
import edu.kit.kastel.vads.cdetector.CommonTest;
import edu.kit.kastel.vads.cdetector.diagnostic.Category;
import edu.kit.kastel.vads.cdetector.diagnostic.Diagnostic;

public class TestLoopTerminationAnalysis extends CommonTest {

    @Language("C")
    private static final String REACHABLE_BOUND = """
        int main(void) {
            for (int i = 0; 1; i++) {
                if (i >= 10) break;
            }
            return 0;
        }
        """;

    @Test
    public void counterReachesItsBound() {
        assertEquals(List.of(), analyze(REACHABLE_BOUND));
    }

    @Language("C")
    private static final String UNREACHABLE_BOUND = """
        int main(void) {
            for (int i = 0; 1; i++) {
                if (i < 0) break;
            }
            return 0;
        }
        """;

    @DisplayName("an incremented counter never drops below its start")
    @Test
    public void counterNeverReachesItsBound() {
        List<Diagnostic> diagnostics = analyze(UNREACHABLE_BOUND);
        assertEquals(List.of(Category.INFINITE_LOOP), categories(diagnostics));
        assertEquals(List.of(2), lines(diagnostics));
    }

    @Test
    public void monotonicProofCanBeSwitchedOff() {
        AnalyzerConfiguration configuration = new AnalyzerConfiguration.Builder()
            .setProveMonotonicBounds(false)
            .build();
        assertEquals(List.of(), analyze(configuration, UNREACHABLE_BOUND));
    }

    @Language("C")
    private static final String NO_EXIT = """
        int main(void) {
            int ticks = 0;
            while (1) {
                ticks++;
            }
            return ticks;
        }
        """;

    @Test
    public void loopWithoutExit() {
        List<Diagnostic> diagnostics = analyze(NO_EXIT);
        assertEquals(List.of(Category.INFINITE_LOOP), categories(diagnostics));
        assertEquals(List.of(3), lines(diagnostics));
    }

    @Language("C")
    private static final String UNCHANGED_FLAG = """
        int main(void) {
            int done = 0;
            int work = 0;
            while (1) {
                work++;
                if (done) break;
            }
            return work;
        }
        """;

    @DisplayName("an exit guarded only by a variable the loop never changes")
    @Test
    public void guardNeverChanges() {
        assertEquals(List.of(4), lines(only(analyze(UNCHANGED_FLAG), Category.INFINITE_LOOP)));
    }

    @Language("C")
    private static final String NESTED_BREAKS = """
        int main(void) {
            int mode = 0;
            for (;;) {
                switch (mode) {
                    case 1:
                        break;
                }
                while (mode < 3) {
                    mode++;
                    break;
                }
            }
            return 0;
        }
        """;

    @DisplayName("breaks of a nested switch or loop do not leave the outer loop")
    @Test
    public void nestedBreaksDoNotCount() {
        List<Diagnostic> diagnostics = only(analyze(NESTED_BREAKS), Category.INFINITE_LOOP);
        assertEquals(List.of(3), lines(diagnostics));
    }

    @Language("C")
    private static final String OTHER_EXITS = """
        #include <stdio.h>
        #include <stdlib.h>
        int main(void) {
            int attempts = 0;
            for (;;) {
                return 1;
            }
            while (1) {
                int c = getchar();
                if (c == 'q') break;
            }
            while (1) {
                attempts++;
                if (attempts > 3) exit(1);
            }
        }
        """;

    @DisplayName("return, exit and variables declared in the body make loops finite")
    @Test
    public void otherExits() {
        assertEquals(List.of(), only(analyze(OTHER_EXITS), Category.INFINITE_LOOP));
    }

    @Language("C")
    private static final String CALL_GUARD = """
        int finished(void);
        int main(void) {
            while (1) {
                if (finished()) break;
            }
            return 0;
        }
        """;

    @Test
    public void callsInGuards() {
        assertEquals(List.of(), analyze(CALL_GUARD));

        AnalyzerConfiguration configuration = new AnalyzerConfiguration.Builder()
            .setCallsSatisfyLoopGuards(false)
            .build();
        assertEquals(List.of(3), lines(only(analyze(configuration, CALL_GUARD), Category.INFINITE_LOOP)));
    }

    @Language("C")
    private static final String COUNTDOWN = """
        int main(void) {
            int n = 10;
            do {
                n--;
                if (n > 20) break;
            } while (1);
            int m = 10;
            do {
                m--;
                if (m == 0) break;
            } while (1);
            return 0;
        }
        """;

    @DisplayName("decrementing counters are proved symmetrically")
    @Test
    public void decrementingCounters() {
        assertEquals(List.of(3), lines(only(analyze(COUNTDOWN), Category.INFINITE_LOOP)));
    }

    @Language("C")
    private static final String VARIABLE_GUARD = """
        int main(void) {
            int running = 1;
            while (running) {
            }
            return 0;
        }
        """;

    @DisplayName("a loop whose condition is not constant is never reported")
    @Test
    public void variableGuard() {
        assertEquals(List.of(), analyze(VARIABLE_GUARD));
    }
}
