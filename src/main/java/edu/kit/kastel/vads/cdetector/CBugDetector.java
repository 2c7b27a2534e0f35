package edu.kit.kastel.vads.cdetector;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.kit.kastel.vads.cdetector.diagnostic.Diagnostic;
import edu.kit.kastel.vads.cdetector.lexer.Lexer;
import edu.kit.kastel.vads.cdetector.parser.Parser;
import edu.kit.kastel.vads.cdetector.parser.TokenSource;
import edu.kit.kastel.vads.cdetector.parser.TranslationUnit;
import edu.kit.kastel.vads.cdetector.semantic.SemanticAnalysis;

/// Entry point: scans, parses and analyzes C sources and returns their diagnostics ordered by line.
public class CBugDetector {
    private static final Logger LOGGER = LoggerFactory.getLogger(CBugDetector.class);

    private final AnalyzerConfiguration configuration;

    public CBugDetector() {
        this(AnalyzerConfiguration.DEFAULT);
    }

    public CBugDetector(AnalyzerConfiguration configuration) {
        this.configuration = configuration;
    }

    public List<Diagnostic> analyze(Path file) {
        String source;
        try {
            source = decode(Files.readAllBytes(file));
        } catch (IOException e) {
            throw new SourceReadException(file, e);
        }
        return analyze(file.toString(), source);
    }

    /// Bytes that are not UTF-8 become replacement characters, they never fail the read.
    static String decode(byte[] bytes) throws CharacterCodingException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPLACE)
            .onUnmappableCharacter(CodingErrorAction.REPLACE);
        return decoder.decode(ByteBuffer.wrap(bytes)).toString();
    }

    public List<Diagnostic> analyze(String name, String source) {
        TranslationUnit unit = parse(name, source);
        List<Diagnostic> diagnostics = new SemanticAnalysis(this.configuration).analyze(unit);
        LOGGER.info("{}: {} diagnostic(s)", name, diagnostics.size());
        return diagnostics;
    }

    /// Analyzes every {@code .c} file directly inside {@code directory}, in path order.
    public Map<Path, List<Diagnostic>> analyzeDirectory(Path directory) {
        List<Path> files;
        try (Stream<Path> entries = Files.list(directory)) {
            files = entries
                .filter(path -> path.getFileName().toString().endsWith(".c"))
                .filter(Files::isRegularFile)
                .sorted()
                .toList();
        } catch (IOException e) {
            throw new SourceReadException(directory, e);
        }
        LOGGER.info("analyzing {} file(s) in {}", files.size(), directory);
        Map<Path, List<Diagnostic>> results = new LinkedHashMap<>();
        for (Path file : files) {
            results.put(file, analyze(file));
        }
        return results;
    }

    static TranslationUnit parse(String name, String source) {
        Lexer lexer = Lexer.forString(source);
        TokenSource tokenSource = new TokenSource(lexer);
        Parser parser = new Parser(tokenSource);
        TranslationUnit unit = parser.parseTranslationUnit(name);
        if (!unit.problems().isEmpty()) {
            LOGGER.info("{}: recovered from {} malformed construct(s)", name, unit.problems().size());
        }
        return unit;
    }
}
