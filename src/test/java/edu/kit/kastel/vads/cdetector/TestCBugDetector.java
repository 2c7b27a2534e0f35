package edu.kit.kastel.vads.cdetector;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.intellij.lang.annotations.Language;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import edu.kit.kastel.vads.cdetector.diagnostic.AnalysisGroup;
import edu.kit.kastel.vads.cdetector.diagnostic.Category;
import edu.kit.kastel.vads.cdetector.diagnostic.Diagnostic;

public class TestCBugDetector extends CommonTest {

    @Language("C")
    private static final String SEVERAL_PASSES = """
        #include <stdio.h>
        #include <stdlib.h>
        int main(void) {
            char *buffer = malloc(8);
            double x;
            printf("%d\\n", x);
            return 0;
        }
        """;

    @DisplayName("diagnostics are ordered by line, then by pass")
    @Test
    public void ordering() {
        List<Diagnostic> diagnostics = analyze(SEVERAL_PASSES);
        assertEquals(List.of(Category.MEMORY_LEAK, Category.UNINITIALIZED_USE, Category.FORMAT_TYPE_MISMATCH),
            categories(diagnostics));
        assertEquals(List.of(4, 6, 6), lines(diagnostics));
        assertTrue(diagnostics.get(0).toString().startsWith("4: error [memory-leak]"));
        assertEquals(Category.MEMORY_LEAK.suggestion(), diagnostics.get(0).suggestion());
    }

    @Test
    public void repeatedRunsAgree() {
        CBugDetector detector = new CBugDetector();
        assertEquals(detector.analyze("test.c", SEVERAL_PASSES), detector.analyze("test.c", SEVERAL_PASSES));
    }

    @DisplayName("running the passes in parallel gives the same report")
    @Test
    public void parallelMatchesSequential() {
        AnalyzerConfiguration parallel = new AnalyzerConfiguration.Builder().setParallel(true).build();
        assertEquals(analyze(SEVERAL_PASSES), analyze(parallel, SEVERAL_PASSES));
    }

    @Test
    public void onlySelectedGroupsRun() {
        AnalyzerConfiguration configuration = new AnalyzerConfiguration.Builder()
            .setOnly(AnalysisGroup.STANDARD_LIBRARY)
            .build();
        assertEquals(List.of(Category.FORMAT_TYPE_MISMATCH), categories(analyze(configuration, SEVERAL_PASSES)));
    }

    @Test
    public void emptyInput() {
        assertEquals(List.of(), analyze(""));
    }

    @Test
    public void directory(@TempDir Path directory) throws IOException {
        Files.writeString(directory.resolve("b.c"), SEVERAL_PASSES);
        Files.writeString(directory.resolve("a.c"), "int main(void) { return 0; }\n");
        Files.writeString(directory.resolve("notes.txt"), "not C");

        Map<Path, List<Diagnostic>> results = new CBugDetector().analyzeDirectory(directory);
        assertEquals(List.of(directory.resolve("a.c"), directory.resolve("b.c")), List.copyOf(results.keySet()));
        assertEquals(List.of(), results.get(directory.resolve("a.c")));
        assertEquals(3, results.get(directory.resolve("b.c")).size());
    }

    @DisplayName("an unreadable source is the only failure that reaches the caller")
    @Test
    public void missingFile(@TempDir Path directory) {
        Path missing = directory.resolve("missing.c");
        SourceReadException e = assertThrows(SourceReadException.class, () -> new CBugDetector().analyze(missing));
        assertTrue(e.getMessage().contains("missing.c"));
    }

    @Language("C")
    private static final String UNCLOSED_COMMENT = """
        #include <stdio.h>
        int main(void) {
            int x;
            printf("%d", x);
            /* the rest of the file is a comment
            return 0;
        }
        """;

    @Language("C")
    private static final String UNCLOSED_BODY = """
        #include <stdio.h>
        int main(void) {
            int x;
            printf("%d", x);
            return 0;
        """;

    @DisplayName("a function cut off by the end of input is still analyzed")
    @Test
    public void truncatedFunction() {
        for (String source : List.of(UNCLOSED_COMMENT, UNCLOSED_BODY)) {
            List<Diagnostic> diagnostics = analyze(source);
            assertEquals(List.of(Category.UNINITIALIZED_USE), categories(diagnostics));
            assertEquals(List.of(4), lines(diagnostics));
        }
    }

    @DisplayName("bytes that are not UTF-8 are replaced instead of failing the read")
    @Test
    public void legacyEncoding(@TempDir Path directory) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        bytes.writeBytes("// r\u00e9sum\u00e9\n".getBytes(StandardCharsets.ISO_8859_1));
        bytes.writeBytes("// \u4f60\u597d\n".getBytes(Charset.forName("GBK")));
        bytes.writeBytes(READ_BEFORE_WRITE.getBytes(StandardCharsets.UTF_8));
        Path file = directory.resolve("legacy.c");
        Files.write(file, bytes.toByteArray());

        List<Diagnostic> diagnostics = new CBugDetector().analyze(file);
        assertEquals(List.of(Category.UNINITIALIZED_USE), categories(diagnostics));
        assertEquals(List.of(6), lines(diagnostics));
    }

    @Language("C")
    private static final String READ_BEFORE_WRITE = """
        #include <stdio.h>
        int main(void) {
            int x;
            printf("%d", x);
            return 0;
        }
        """;

    @DisplayName("correct pointer handling produces no diagnostics")
    @ParameterizedTest
    @ValueSource(strings = {"no_false_positives.c", "no_false_positives_comprehensive.c"})
    public void noFalsePositives(String name) throws URISyntaxException {
        Path file = Path.of(TestCBugDetector.class.getResource("/corpus/" + name).toURI());
        assertEquals(List.of(), new CBugDetector().analyze(file));
    }
}
