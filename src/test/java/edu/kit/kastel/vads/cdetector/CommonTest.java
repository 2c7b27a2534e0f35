package edu.kit.kastel.vads.cdetector;

import java.util.List;

import org.junit.jupiter.api.BeforeAll;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import edu.kit.kastel.vads.cdetector.diagnostic.Category;
import edu.kit.kastel.vads.cdetector.diagnostic.Diagnostic;
import edu.kit.kastel.vads.cdetector.parser.TranslationUnit;

public abstract class CommonTest {

    @BeforeAll
    public static void beforeAll() {
        ((Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME)).setLevel(Level.INFO);
        ((Logger) LoggerFactory.getLogger("edu.kit.kastel.vads.cdetector.semantic")).setLevel(Level.DEBUG);
    }

    protected static List<Diagnostic> analyze(String source) {
        return analyze(AnalyzerConfiguration.DEFAULT, source);
    }

    protected static List<Diagnostic> analyze(AnalyzerConfiguration configuration, String source) {
        return new CBugDetector(configuration).analyze("test.c", source);
    }

    protected static TranslationUnit parse(String source) {
        return CBugDetector.parse("test.c", source);
    }

    protected static List<Diagnostic> only(List<Diagnostic> diagnostics, Category category) {
        return diagnostics.stream().filter(diagnostic -> diagnostic.category() == category).toList();
    }

    protected static List<Integer> lines(List<Diagnostic> diagnostics) {
        return diagnostics.stream().map(Diagnostic::line).toList();
    }

    protected static List<Category> categories(List<Diagnostic> diagnostics) {
        return diagnostics.stream().map(Diagnostic::category).toList();
    }
}
