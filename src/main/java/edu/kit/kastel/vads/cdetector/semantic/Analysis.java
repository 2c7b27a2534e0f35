package edu.kit.kastel.vads.cdetector.semantic;

import edu.kit.kastel.vads.cdetector.diagnostic.AnalysisGroup;
import edu.kit.kastel.vads.cdetector.diagnostic.Reporter;
import edu.kit.kastel.vads.cdetector.parser.TranslationUnit;

/// One independent detection pass. Passes only read the translation unit, so any number
/// of them may run over the same unit at once.
public interface Analysis {

    AnalysisGroup group();

    void analyze(TranslationUnit unit, Reporter reporter);
}
