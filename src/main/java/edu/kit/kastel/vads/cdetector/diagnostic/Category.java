package edu.kit.kastel.vads.cdetector.diagnostic;

public enum Category {
    UNINITIALIZED_USE("uninitialized-use", Severity.WARNING, AnalysisGroup.VARIABLE_STATE,
        "initialize the variable before reading it"),
    USE_AFTER_SCOPE("use-after-scope", Severity.ERROR, AnalysisGroup.VARIABLE_STATE,
        "declare the variable in a scope that encloses every use"),
    WILD_POINTER("wild-pointer", Severity.ERROR, AnalysisGroup.MEMORY_SAFETY,
        "assign the pointer a valid address or NULL before dereferencing it"),
    NULL_DEREFERENCE("null-dereference", Severity.ERROR, AnalysisGroup.MEMORY_SAFETY,
        "check the pointer against NULL before dereferencing it"),
    USE_AFTER_FREE("use-after-free", Severity.ERROR, AnalysisGroup.MEMORY_SAFETY,
        "do not access memory after free, set the pointer to NULL after freeing it"),
    DOUBLE_FREE("double-free", Severity.ERROR, AnalysisGroup.MEMORY_SAFETY,
        "free each allocation exactly once, set the pointer to NULL after freeing it"),
    DANGLING_POINTER_RETURN("dangling-pointer-return", Severity.ERROR, AnalysisGroup.MEMORY_SAFETY,
        "return heap memory or a static object instead of a local address"),
    MEMORY_LEAK("memory-leak", Severity.ERROR, AnalysisGroup.MEMORY_SAFETY,
        "free the allocation or hand it to a caller before it becomes unreachable"),
    UNCHECKED_ALLOCATION("unchecked-allocation", Severity.WARNING, AnalysisGroup.MEMORY_SAFETY,
        "check the result of the allocation against NULL"),
    ARGUMENT_COUNT_MISMATCH("argument-count-mismatch", Severity.ERROR, AnalysisGroup.STANDARD_LIBRARY,
        "pass exactly one argument per conversion specifier"),
    MISSING_ADDRESS_OF("missing-address-of", Severity.ERROR, AnalysisGroup.STANDARD_LIBRARY,
        "pass the address of the variable with '&'"),
    SPURIOUS_ADDRESS_OF("spurious-address-of", Severity.ERROR, AnalysisGroup.STANDARD_LIBRARY,
        "arrays and pointers already are addresses, remove the '&'"),
    FORMAT_TYPE_MISMATCH("format-type-mismatch", Severity.ERROR, AnalysisGroup.STANDARD_LIBRARY,
        "use the conversion specifier matching the argument type"),
    MISSING_HEADER("missing-header", Severity.ERROR, AnalysisGroup.STANDARD_LIBRARY,
        "add the include for the header declaring the function"),
    MISSPELLED_HEADER("misspelled-header", Severity.ERROR, AnalysisGroup.STANDARD_LIBRARY,
        "correct the header name in the include directive"),
    INTEGER_LITERAL_OVERFLOW("integer-literal-overflow", Severity.WARNING, AnalysisGroup.NUMERIC_CONTROL_FLOW,
        "use a wider type or a value within the range of the target type"),
    INFINITE_LOOP("infinite-loop", Severity.WARNING, AnalysisGroup.NUMERIC_CONTROL_FLOW,
        "make sure the loop has a reachable exit");

    private final String tag;
    private final Severity severity;
    private final AnalysisGroup group;
    private final String suggestion;

    Category(String tag, Severity severity, AnalysisGroup group, String suggestion) {
        this.tag = tag;
        this.severity = severity;
        this.group = group;
        this.suggestion = suggestion;
    }

    /// Stable kebab-case identifier of the category.
    public String tag() {
        return tag;
    }

    public Severity severity() {
        return severity;
    }

    public AnalysisGroup group() {
        return group;
    }

    public String suggestion() {
        return suggestion;
    }

    @Override
    public String toString() {
        return tag;
    }
}
