package edu.kit.kastel.vads.cdetector.parser;

import java.util.List;

import edu.kit.kastel.vads.cdetector.parser.ast.IncludeTree;
import edu.kit.kastel.vads.cdetector.parser.ast.ProgramTree;
import edu.kit.kastel.vads.cdetector.parser.symbol.ScopeArena;

/// The shared, read-only model every pass runs over.
public record TranslationUnit(
    String fileName,
    ProgramTree program,
    ScopeArena scopes,
    List<IncludeTree> includes,
    List<StaleReference> staleReferences,
    List<ParseProblem> problems,
    StructureIndex index
) {
    public TranslationUnit {
        includes = List.copyOf(includes);
        staleReferences = List.copyOf(staleReferences);
        problems = List.copyOf(problems);
    }
}
