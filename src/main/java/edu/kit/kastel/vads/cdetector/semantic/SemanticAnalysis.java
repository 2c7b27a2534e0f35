package edu.kit.kastel.vads.cdetector.semantic;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.kit.kastel.vads.cdetector.AnalyzerConfiguration;
import edu.kit.kastel.vads.cdetector.diagnostic.Diagnostic;
import edu.kit.kastel.vads.cdetector.diagnostic.DiagnosticSink;
import edu.kit.kastel.vads.cdetector.parser.TranslationUnit;

/// Runs the enabled passes over one translation unit and collects their diagnostics.
/// A pass that fails is logged and skipped, the others still report.
public class SemanticAnalysis {
    private static final Logger LOGGER = LoggerFactory.getLogger(SemanticAnalysis.class);

    private final AnalyzerConfiguration configuration;
    private final List<Analysis> passes;

    public SemanticAnalysis(AnalyzerConfiguration configuration) {
        this.configuration = configuration;
        // registration order breaks ties between diagnostics on the same line
        this.passes = List.of(
            new InitializationAnalysis(),
            new PointerLifecycleAnalysis(configuration.reportUncheckedAllocation()),
            new FormatCallAnalysis(),
            new HeaderAnalysis(configuration.headerEditDistance()),
            new IntegerLiteralRangeAnalysis(),
            new LoopTerminationAnalysis(configuration.callsSatisfyLoopGuards(), configuration.proveMonotonicBounds())
        );
    }

    public List<Diagnostic> analyze(TranslationUnit unit) {
        DiagnosticSink sink = new DiagnosticSink();
        if (this.configuration.parallel()) {
            runParallel(unit, sink);
        } else {
            for (int order = 0; order < this.passes.size(); order++) {
                run(this.passes.get(order), order, unit, sink);
            }
        }
        return sink.report();
    }

    private void runParallel(TranslationUnit unit, DiagnosticSink sink) {
        ExecutorService executor = Executors.newFixedThreadPool(
            Math.min(this.passes.size(), Runtime.getRuntime().availableProcessors()));
        try {
            List<Future<?>> running = new ArrayList<>();
            for (int order = 0; order < this.passes.size(); order++) {
                Analysis pass = this.passes.get(order);
                int passOrder = order;
                running.add(executor.submit(() -> run(pass, passOrder, unit, sink)));
            }
            for (Future<?> future : running) {
                future.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SemanticException("interrupted while analyzing " + unit.fileName(), e);
        } catch (ExecutionException e) {
            throw new SemanticException("pass failed outside its isolation on " + unit.fileName(), e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    private void run(Analysis pass, int order, TranslationUnit unit, DiagnosticSink sink) {
        if (!this.configuration.isEnabled(pass.group())) {
            return;
        }
        String name = pass.getClass().getSimpleName();
        LOGGER.debug("running {} on {}", name, unit.fileName());
        try {
            pass.analyze(unit, sink.reporter(order));
        } catch (RuntimeException e) {
            LOGGER.error("{} failed on {}, its findings are dropped", name, unit.fileName(), e);
        }
    }
}
