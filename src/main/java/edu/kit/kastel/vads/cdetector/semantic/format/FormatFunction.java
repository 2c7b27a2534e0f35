package edu.kit.kastel.vads.cdetector.semantic.format;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.jspecify.annotations.Nullable;

/// The formatted I/O functions whose calls are validated.
public enum FormatFunction {
    PRINTF("printf", 0, FormatDirection.OUTPUT),
    FPRINTF("fprintf", 1, FormatDirection.OUTPUT),
    SPRINTF("sprintf", 1, FormatDirection.OUTPUT),
    SNPRINTF("snprintf", 2, FormatDirection.OUTPUT),
    SCANF("scanf", 0, FormatDirection.INPUT),
    FSCANF("fscanf", 1, FormatDirection.INPUT),
    SSCANF("sscanf", 1, FormatDirection.INPUT);

    private static final Map<String, FormatFunction> BY_NAME = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(FormatFunction::functionName, Function.identity()));

    private final String functionName;
    private final int formatIndex;
    private final FormatDirection direction;

    FormatFunction(String functionName, int formatIndex, FormatDirection direction) {
        this.functionName = functionName;
        this.formatIndex = formatIndex;
        this.direction = direction;
    }

    public static @Nullable FormatFunction forName(String name) {
        return BY_NAME.get(name);
    }

    public String functionName() {
        return functionName;
    }

    /// Position of the format string in the argument list. Conversion arguments follow it.
    public int formatIndex() {
        return formatIndex;
    }

    public FormatDirection direction() {
        return direction;
    }
}
