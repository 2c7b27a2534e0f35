package edu.kit.kastel.vads.cdetector;

public sealed interface Span {
    Position start();

    Position end();

    Span merge(Span later);

    default int line() {
        return start().line();
    }

    record SimpleSpan(Position start, Position end) implements Span {
        @Override
        public Span merge(Span later) {
            return new SimpleSpan(start(), later.end());
        }

        @Override
        public String toString() {
            return "[" + start() + "|" + end() + "]";
        }
    }
}
