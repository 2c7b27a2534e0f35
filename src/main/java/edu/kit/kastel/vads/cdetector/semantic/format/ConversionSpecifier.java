package edu.kit.kastel.vads.cdetector.semantic.format;

/// One conversion directive of a format string, e.g. {@code %-5.2lf}.
///
/// {@code starWidth} and {@code starPrecision} only occur in output formats, {@code suppressed}
/// (assignment suppression, {@code %*d}) only in input formats.
public record ConversionSpecifier(
    String text,
    boolean starWidth,
    boolean starPrecision,
    boolean suppressed,
    LengthModifier length,
    char conversion
) {

    /// Number of call arguments this directive consumes.
    public int argumentCount() {
        if (suppressed()) {
            return 0;
        }
        int count = 1;
        if (starWidth()) {
            count++;
        }
        if (starPrecision()) {
            count++;
        }
        return count;
    }

    public boolean isInteger() {
        return "diuoxX".indexOf(conversion()) >= 0;
    }

    public boolean isFloating() {
        return "fFeEgGaA".indexOf(conversion()) >= 0;
    }

    /// {@code %s}, {@code %c} and scan sets, which all deal in characters.
    public boolean isCharacter() {
        return conversion() == 's' || conversion() == 'c' || conversion() == '[';
    }
}
