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

public class TestPointerLifecycleAnalysis extends CommonTest {

    @Language("C")
    private static final String DOUBLE_FREE = """
        #include <stdlib.h>
        int main(void) {
            int *p = malloc(sizeof(int));
            free(p);
            free(p);
            return 0;
        }
        """;

    @DisplayName("the second free of the same allocation is reported, nothing leaks")
    @Test
    public void doubleFree() {
        List<Diagnostic> diagnostics = analyze(DOUBLE_FREE);
        assertEquals(List.of(Category.DOUBLE_FREE), categories(diagnostics));
        assertEquals(List.of(5), lines(diagnostics));
    }

    @Language("C")
    private static final String LEAK = """
        #include <stdlib.h>
        void fill(void) {
            char *buffer = malloc(64);
            buffer[0] = 'a';
            buffer[1] = 'b';
            buffer[2] = 0;
        }
        """;

    @DisplayName("an allocation that is never freed leaks exactly once")
    @Test
    public void leak() {
        List<Diagnostic> diagnostics = analyze(LEAK);
        assertEquals(List.of(Category.MEMORY_LEAK), categories(diagnostics));
        assertEquals(List.of(3), lines(diagnostics));
    }

    @Language("C")
    private static final String RETURNED = """
        #include <stdlib.h>
        int *make(void) {
            int *p = malloc(sizeof(int));
            if (p == NULL) {
                return NULL;
            }
            *p = 1;
            return p;
        }
        """;

    @DisplayName("returning the allocation hands it to the caller")
    @Test
    public void returnedAllocation() {
        assertEquals(List.of(), analyze(RETURNED));
    }

    @Language("C")
    private static final String HANDED_TO_CALLEE = """
        #include <stdlib.h>
        void consume(int *data);
        void produce(void) {
            int *data = malloc(4 * sizeof(int));
            consume(data);
        }
        """;

    @Test
    public void handedToUserFunction() {
        assertEquals(List.of(), only(analyze(HANDED_TO_CALLEE), Category.MEMORY_LEAK));
    }

    @Language("C")
    private static final String USE_AFTER_FREE = """
        #include <stdlib.h>
        int main(void) {
            int *p = malloc(sizeof(int));
            free(p);
            *p = 3;
            return 0;
        }
        """;

    @Test
    public void useAfterFree() {
        List<Diagnostic> diagnostics = analyze(USE_AFTER_FREE);
        assertEquals(List.of(Category.USE_AFTER_FREE), categories(diagnostics));
        assertEquals(List.of(5), lines(diagnostics));
    }

    @Language("C")
    private static final String WILD = """
        int main(void) {
            int *p;
            *p = 1;
            return 0;
        }
        """;

    @DisplayName("dereferencing a pointer that was never assigned")
    @Test
    public void wildPointer() {
        List<Diagnostic> diagnostics = analyze(WILD);
        assertEquals(List.of(Category.WILD_POINTER), categories(diagnostics));
        assertEquals(List.of(3), lines(diagnostics));
    }

    @Language("C")
    private static final String NULL_DEREFERENCE = """
        int main(void) {
            int *p = NULL;
            *p = 1;
            return 0;
        }
        """;

    @Test
    public void nullDereference() {
        List<Diagnostic> diagnostics = analyze(NULL_DEREFERENCE);
        assertEquals(List.of(Category.NULL_DEREFERENCE), categories(diagnostics));
        assertEquals(List.of(3), lines(diagnostics));
    }

    @Language("C")
    private static final String GUARDED_NULL = """
        int main(void) {
            int *p = NULL;
            if (p != NULL) {
                *p = 1;
            }
            return 0;
        }
        """;

    @DisplayName("a null check guards the dereference")
    @Test
    public void guardedNullPointer() {
        assertEquals(List.of(), analyze(GUARDED_NULL));
    }

    @Language("C")
    private static final String DANGLING = """
        int *local(void) {
            int value = 42;
            return &value;
        }
        """;

    @Test
    public void danglingReturn() {
        List<Diagnostic> diagnostics = analyze(DANGLING);
        assertEquals(List.of(Category.DANGLING_POINTER_RETURN), categories(diagnostics));
        assertEquals(List.of(3), lines(diagnostics));
    }

    @Language("C")
    private static final String DANGLING_ALIAS = """
        char *name(void) {
            char buffer[16];
            char *result = buffer;
            return result;
        }
        """;

    @DisplayName("a pointer to a local array is dangling once returned")
    @Test
    public void danglingThroughAlias() {
        List<Diagnostic> diagnostics = only(analyze(DANGLING_ALIAS), Category.DANGLING_POINTER_RETURN);
        assertEquals(List.of(4), lines(diagnostics));
    }

    @Language("C")
    private static final String REASSIGNED = """
        #include <stdlib.h>
        int main(void) {
            char *p = malloc(10);
            p = malloc(20);
            free(p);
            return 0;
        }
        """;

    @DisplayName("overwriting the only pointer to an allocation leaks it")
    @Test
    public void reassignmentLeak() {
        List<Diagnostic> diagnostics = analyze(REASSIGNED);
        assertEquals(List.of(Category.MEMORY_LEAK), categories(diagnostics));
        assertEquals(List.of(4), lines(diagnostics));
    }

    @Language("C")
    private static final String REALLOCATED = """
        #include <stdlib.h>
        int main(void) {
            int *items = malloc(4 * sizeof(int));
            int *grown = realloc(items, 8 * sizeof(int));
            free(grown);
            return 0;
        }
        """;

    @Test
    public void reallocTakesOverTheBlock() {
        assertEquals(List.of(), analyze(REALLOCATED));
    }

    @Language("C")
    private static final String UNCHECKED = """
        #include <stdlib.h>
        int main(void) {
            int *p = malloc(sizeof(int));
            *p = 1;
            free(p);
            return 0;
        }
        """;

    @DisplayName("unchecked allocations are only reported when asked for")
    @Test
    public void uncheckedAllocation() {
        assertEquals(List.of(), analyze(UNCHECKED));

        AnalyzerConfiguration configuration = new AnalyzerConfiguration.Builder()
            .setReportUncheckedAllocation(true)
            .build();
        List<Diagnostic> diagnostics = analyze(configuration, UNCHECKED);
        assertEquals(List.of(Category.UNCHECKED_ALLOCATION), categories(diagnostics));
        assertEquals(List.of(4), lines(diagnostics));
    }

    @Language("C")
    private static final String EARLY_EXIT = """
        #include <stdlib.h>
        int update(int err) {
            int *p = malloc(sizeof(int));
            if (p == NULL) {
                return -1;
            }
            if (err) {
                free(p);
                return -1;
            }
            *p = 1;
            free(p);
            return 0;
        }
        """;

    @DisplayName("a free on a path that returns does not reach the code after the if")
    @Test
    public void freeBeforeEarlyReturn() {
        assertEquals(List.of(), analyze(EARLY_EXIT));
    }

    @Language("C")
    private static final String BOTH_BRANCHES = """
        #include <stdlib.h>
        void release(int c) {
            int *p = malloc(sizeof(int));
            if (c) {
                free(p);
            } else {
                free(p);
            }
        }
        """;

    @DisplayName("each branch frees the allocation once")
    @Test
    public void freedOnBothBranches() {
        assertEquals(List.of(), analyze(BOTH_BRANCHES));
    }

    @Language("C")
    private static final String FREED_AFTER_BOTH_BRANCHES = """
        #include <stdlib.h>
        void release(int c) {
            int *p = malloc(sizeof(int));
            if (c) {
                free(p);
            } else {
                free(p);
            }
            free(p);
        }
        """;

    @DisplayName("a pointer freed on every path is freed again after the branches meet")
    @Test
    public void freedAgainAfterBothBranches() {
        List<Diagnostic> diagnostics = analyze(FREED_AFTER_BOTH_BRANCHES);
        assertEquals(List.of(Category.DOUBLE_FREE), categories(diagnostics));
        assertEquals(List.of(9), lines(diagnostics));
    }

    @Language("C")
    private static final String FREED_ON_ONE_BRANCH = """
        #include <stdlib.h>
        void release(int c) {
            int *p = malloc(sizeof(int));
            if (c) {
                free(p);
            }
        }
        """;

    @DisplayName("an allocation freed on only one path still leaks on the other")
    @Test
    public void freedOnOneBranch() {
        List<Diagnostic> diagnostics = analyze(FREED_ON_ONE_BRANCH);
        assertEquals(List.of(Category.MEMORY_LEAK), categories(diagnostics));
        assertEquals(List.of(3), lines(diagnostics));
    }

    @Language("C")
    private static final String FAILED_ALLOCATION = """
        #include <stdio.h>
        #include <stdlib.h>
        int main(void) {
            int *p = malloc(sizeof(int));
            if (p != NULL) {
                *p = 7;
                free(p);
            } else {
                printf("out of memory\n");
            }
            return 0;
        }
        """;

    @DisplayName("the branch where the allocation failed has nothing to free")
    @Test
    public void nullBranchOwnsNothing() {
        assertEquals(List.of(), analyze(FAILED_ALLOCATION));
    }
}
