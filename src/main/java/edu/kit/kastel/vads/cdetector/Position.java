package edu.kit.kastel.vads.cdetector;

public sealed interface Position {
    /// 1-based source line
    int line();

    /// 0-based column
    int column();

    record SimplePosition(int line, int column) implements Position {
        @Override
        public String toString() {
            return this.line + ":" + this.column;
        }
    }
}
