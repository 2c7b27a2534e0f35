package edu.kit.kastel.vads.cdetector.semantic;

import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.kit.kastel.vads.cdetector.diagnostic.AnalysisGroup;
import edu.kit.kastel.vads.cdetector.diagnostic.Category;
import edu.kit.kastel.vads.cdetector.diagnostic.Reporter;
import edu.kit.kastel.vads.cdetector.parser.StructureIndex;
import edu.kit.kastel.vads.cdetector.parser.TranslationUnit;
import edu.kit.kastel.vads.cdetector.parser.ast.CallTree;
import edu.kit.kastel.vads.cdetector.parser.ast.IdentExpressionTree;
import edu.kit.kastel.vads.cdetector.parser.ast.IncludeTree;

/// Matches the standard functions a unit calls against the headers it includes.
/// Headers are compared by name only, nothing is read from disk.
public class HeaderAnalysis implements Analysis {
    private static final Logger LOGGER = LoggerFactory.getLogger(HeaderAnalysis.class);

    private final int editDistance;

    public HeaderAnalysis(int editDistance) {
        this.editDistance = editDistance;
    }

    @Override
    public AnalysisGroup group() {
        return AnalysisGroup.STANDARD_LIBRARY;
    }

    @Override
    public void analyze(TranslationUnit unit, Reporter reporter) {
        List<IncludeTree> includes = unit.includes();
        checkDirectives(includes, reporter);

        Set<String> userFunctions = unit.index().functions().stream()
            .map(function -> function.name().name().asString())
            .collect(Collectors.toSet());
        Set<String> reported = new HashSet<>();
        List<StructureIndex.Entry<CallTree>> calls = unit.index().calls().stream()
            .sorted(Comparator.comparingInt(entry -> entry.line()))
            .toList();
        for (StructureIndex.Entry<CallTree> entry : calls) {
            if (!(entry.tree().callee() instanceof IdentExpressionTree ident) || ident.symbol() != null) {
                continue;
            }
            String function = ident.name().name().asString();
            String header = StandardLibrary.requiredHeader(function);
            if (header == null || userFunctions.contains(function) || reported.contains(function)) {
                continue;
            }
            int line = entry.line();
            if (isIncludedBefore(includes, header, line)) {
                continue;
            }
            reported.add(function);
            IncludeTree misspelling = misspellingOf(includes, header, line);
            if (misspelling != null) {
                reporter.report(line, Category.MISSPELLED_HEADER, "'" + function + "' needs <" + header
                    + ">, the include of <" + misspelling.header() + "> on line " + misspelling.span().line()
                    + " looks misspelled");
            } else {
                reporter.report(line, Category.MISSING_HEADER, "'" + function + "' is called but <" + header
                    + "> is not included");
            }
        }
    }

    /// Includes of unknown system headers that are close to a standard one.
    private void checkDirectives(List<IncludeTree> includes, Reporter reporter) {
        for (IncludeTree include : includes) {
            if (!include.system() || StandardLibrary.isKnownHeader(include.header())) {
                continue;
            }
            String closest = null;
            int best = Integer.MAX_VALUE;
            for (String known : StandardLibrary.knownHeaders()) {
                int distance = distance(include.header(), known);
                if (distance >= 0 && (distance < best || distance == best && known.compareTo(closest) < 0)) {
                    best = distance;
                    closest = known;
                }
            }
            if (closest == null) {
                LOGGER.debug("<{}> is not a standard header, left alone", include.header());
                continue;
            }
            reporter.report(include.span(), Category.MISSPELLED_HEADER, "<" + include.header()
                + "> is not a standard header, did you mean <" + closest + ">?");
        }
    }

    private static boolean isIncludedBefore(List<IncludeTree> includes, String header, int line) {
        return includes.stream()
            .anyMatch(include -> include.header().equals(header) && include.span().line() < line);
    }

    private @Nullable IncludeTree misspellingOf(List<IncludeTree> includes, String header, int line) {
        for (IncludeTree include : includes) {
            if (include.system() && include.span().line() < line
                && !StandardLibrary.isKnownHeader(include.header())
                && distance(include.header(), header) >= 0) {
                return include;
            }
        }
        return null;
    }

    /// The edit distance if it is within the threshold, -1 otherwise.
    private int distance(String header, String known) {
        return StringUtils.getLevenshteinDistance(header, known, this.editDistance);
    }
}
