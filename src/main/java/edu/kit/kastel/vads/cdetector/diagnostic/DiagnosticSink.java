package edu.kit.kastel.vads.cdetector.diagnostic;

import java.util.Comparator;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;

/// Append-only collector shared by all passes of one run. Safe to report into from several threads.
public final class DiagnosticSink {
    private static final Comparator<Entry> ORDER = Comparator.comparingInt((Entry entry) -> entry.diagnostic().line())
        .thenComparingInt(Entry::passOrder)
        .thenComparingLong(Entry::sequence);

    private final Queue<Entry> entries = new ConcurrentLinkedQueue<>();
    private final AtomicLong sequence = new AtomicLong();

    /// A reporter for the pass registered at position {@code passOrder}.
    public Reporter reporter(int passOrder) {
        return diagnostic -> this.entries.add(new Entry(diagnostic, passOrder, this.sequence.getAndIncrement()));
    }

    /// Ordered by line, then pass registration order, then emission order.
    public List<Diagnostic> report() {
        return this.entries.stream()
            .sorted(ORDER)
            .map(Entry::diagnostic)
            .toList();
    }

    private record Entry(Diagnostic diagnostic, int passOrder, long sequence) {
    }
}
