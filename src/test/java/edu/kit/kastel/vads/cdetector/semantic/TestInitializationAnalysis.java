package edu.kit.kastel.vads.cdetector.semantic;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.intellij.lang.annotations.Language;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import edu.kit.kastel.vads.cdetector.AnalyzerConfiguration;
import edu.kit.kastel.vads.cdetector.CommonTest;
import edu.kit.kastel.vads.cdetector.diagnostic.AnalysisGroup;
import edu.kit.kastel.vads.cdetector.diagnostic.Category;
import edu.kit.kastel.vads.cdetector.diagnostic.Diagnostic;

public class TestInitializationAnalysis extends CommonTest {

    @Language("C")
    private static final String READ_BEFORE_WRITE = """
        #include <stdio.h>
        int main(void) {
            int x;
            printf("%d", x);
            return 0;
        }
        """;

    @DisplayName("reading a declared but unassigned local is reported at the reading line")
    @Test
    public void readBeforeWrite() {
        List<Diagnostic> diagnostics = analyze(READ_BEFORE_WRITE);
        assertEquals(List.of(Category.UNINITIALIZED_USE), categories(diagnostics));
        assertEquals(List.of(4), lines(diagnostics));
        assertTrue(diagnostics.get(0).message().contains("'x'"));
    }

    @Language("C")
    private static final String WRITE_BEFORE_READ = """
        #include <stdio.h>
        int main(void) {
            int x;
            x = 5;
            printf("%d", x);
            return 0;
        }
        """;

    @Test
    public void writeBeforeRead() {
        assertEquals(List.of(), analyze(WRITE_BEFORE_READ));
    }

    @Language("C")
    private static final String TWO_READ_SITES = """
        int main(void) {
            int total;
            int sum = total + 1;
            int twice = total * 2;
            return sum + twice;
        }
        """;

    @DisplayName("every read site is a separate diagnostic")
    @Test
    public void oneDiagnosticPerReadSite() {
        List<Diagnostic> diagnostics = only(analyze(TWO_READ_SITES), Category.UNINITIALIZED_USE);
        assertEquals(List.of(3, 4), lines(diagnostics));
    }

    @Language("C")
    private static final String ADDRESS_TAKEN = """
        #include <stdio.h>
        int main(void) {
            int x;
            char line[32];
            scanf("%d", &x);
            fgets(line, 32, stdin);
            printf("%d %s", x, line);
            return 0;
        }
        """;

    @DisplayName("taking the address and passing an array to a call both initialize")
    @Test
    public void addressAndArrayArguments() {
        assertEquals(List.of(), analyze(ADDRESS_TAKEN));
    }

    @Language("C")
    private static final String NOT_TRACKED = """
        int counter;
        struct point { int x; int y; };
        int next(int step) {
            static int calls;
            calls++;
            return counter + step + calls;
        }
        """;

    @DisplayName("globals, statics and parameters start initialized")
    @Test
    public void untrackedStorage() {
        assertEquals(List.of(), only(analyze(NOT_TRACKED), Category.UNINITIALIZED_USE));
    }

    @Language("C")
    private static final String COMPOUND_ASSIGNMENT = """
        int main(void) {
            int acc;
            acc += 3;
            return acc;
        }
        """;

    @DisplayName("a compound assignment reads its target first")
    @Test
    public void compoundAssignmentReads() {
        List<Diagnostic> diagnostics = only(analyze(COMPOUND_ASSIGNMENT), Category.UNINITIALIZED_USE);
        assertEquals(List.of(3), lines(diagnostics));
    }

    @Language("C")
    private static final String SIZEOF_OPERAND = """
        int main(void) {
            long value;
            int size = sizeof(value);
            return size;
        }
        """;

    @Test
    public void sizeofDoesNotRead() {
        assertEquals(List.of(), analyze(SIZEOF_OPERAND));
    }

    @Language("C")
    private static final String OUT_OF_SCOPE = """
        int main(void) {
            {
                int inner = 1;
            }
            return inner;
        }
        """;

    @DisplayName("a name used after its block closed is a use after scope")
    @Test
    public void useAfterScope() {
        List<Diagnostic> diagnostics = analyze(OUT_OF_SCOPE);
        assertEquals(List.of(Category.USE_AFTER_SCOPE), categories(diagnostics));
        assertEquals(List.of(5), lines(diagnostics));
        assertTrue(diagnostics.get(0).message().contains("line 3"));
    }

    @Test
    public void disabledGroupIsSilent() {
        AnalyzerConfiguration configuration = new AnalyzerConfiguration.Builder()
            .setEnabled(AnalysisGroup.VARIABLE_STATE, false)
            .build();
        assertEquals(List.of(), analyze(configuration, READ_BEFORE_WRITE));
    }

    @Language("C")
    private static final String ONE_BRANCH_WRITES = """
        #include <stdio.h>
        int choose(int c) {
            int x;
            if (c) {
                x = 1;
            }
            printf("%d\\n", x);
            return 0;
        }
        """;

    @DisplayName("a write on only one branch leaves the variable uninitialized after the if")
    @Test
    public void writeOnOneBranch() {
        List<Diagnostic> diagnostics = analyze(ONE_BRANCH_WRITES);
        assertEquals(List.of(Category.UNINITIALIZED_USE), categories(diagnostics));
        assertEquals(List.of(7), lines(diagnostics));
    }

    @Language("C")
    private static final String BOTH_BRANCHES_WRITE = """
        #include <stdio.h>
        int choose(int c) {
            int x;
            if (c) {
                x = 1;
            } else {
                x = 2;
            }
            printf("%d\\n", x);
            return 0;
        }
        """;

    @Test
    public void writeOnBothBranches() {
        assertEquals(List.of(), analyze(BOTH_BRANCHES_WRITE));
    }

    @Language("C")
    private static final String OTHER_BRANCH_RETURNS = """
        #include <stdio.h>
        int choose(int c) {
            int x;
            if (c) {
                x = 1;
            } else {
                return -1;
            }
            printf("%d\\n", x);
            return 0;
        }
        """;

    @DisplayName("a branch that returns does not take part in the merge")
    @Test
    public void otherBranchReturns() {
        assertEquals(List.of(), analyze(OTHER_BRANCH_RETURNS));
    }

    @Language("C")
    private static final String LOOP_WRITES = """
        #include <stdio.h>
        int last(int n) {
            int x;
            while (n > 0) {
                x = n;
                n--;
            }
            printf("%d\\n", x);
            return 0;
        }
        """;

    @DisplayName("a loop body may not run, its writes do not count after the loop")
    @Test
    public void loopBodyWrites() {
        List<Diagnostic> diagnostics = only(analyze(LOOP_WRITES), Category.UNINITIALIZED_USE);
        assertEquals(List.of(7), lines(diagnostics));
    }

    @Language("C")
    private static final String ADDRESS_STORED = """
        #include <stdio.h>
        int main(void) {
            int x;
            int *p = &x;
            printf("%d", x);
            return 0;
        }
        """;

    @DisplayName("storing the address of a variable does not initialize it")
    @Test
    public void addressOutsideCall() {
        List<Diagnostic> diagnostics = only(analyze(ADDRESS_STORED), Category.UNINITIALIZED_USE);
        assertEquals(List.of(5), lines(diagnostics));
    }
}
