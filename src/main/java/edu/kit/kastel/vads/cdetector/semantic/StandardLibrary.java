package edu.kit.kastel.vads.cdetector.semantic;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import org.jspecify.annotations.Nullable;

/// Repository of the C standard library functions the passes know by name: the header that
/// declares each of them and the few properties the passes rely on.
public final class StandardLibrary {

    private static final Map<String, Entry> CATALOG = new HashMap<>();

    /// Standard and common system headers. Includes of other names are only checked for near misses.
    private static final Set<String> KNOWN_HEADERS = Set.of(
        "stdio.h", "stdlib.h", "string.h", "math.h", "ctype.h", "time.h", "stddef.h", "stdint.h", "stdbool.h",
        "limits.h", "float.h", "assert.h", "errno.h", "signal.h", "setjmp.h", "stdarg.h", "locale.h", "wchar.h",
        "inttypes.h", "iso646.h", "complex.h", "fenv.h", "tgmath.h", "wctype.h", "unistd.h", "pthread.h"
    );

    private enum Property {
        ALLOCATES,
        DEALLOCATES,
        MAY_NOT_RETURN
    }

    private record Entry(String header, Set<Property> properties) {
    }

    static {
        add("stdio.h", "printf", "scanf", "fprintf", "fscanf", "sprintf", "snprintf", "sscanf", "fopen", "fclose",
            "fread", "fwrite", "fgets", "fputs", "fgetc", "fputc", "getc", "putc", "getchar", "putchar", "gets",
            "puts", "perror", "feof", "ferror", "clearerr", "rewind", "fseek", "ftell", "fgetpos", "fsetpos",
            "fflush", "remove", "rename", "tmpfile", "ungetc", "setbuf", "setvbuf", "vprintf", "vfprintf",
            "vsprintf");
        add("stdlib.h", "atexit", "system", "getenv", "rand", "srand", "atoi", "atol", "atoll", "atof", "strtol",
            "strtoul", "strtoll", "strtod", "qsort", "bsearch", "abs", "labs", "div", "ldiv");
        add("stdlib.h", EnumSet.of(Property.ALLOCATES), "malloc", "calloc", "realloc");
        add("stdlib.h", EnumSet.of(Property.DEALLOCATES), "free");
        add("stdlib.h", EnumSet.of(Property.MAY_NOT_RETURN), "exit", "abort", "_Exit");
        add("string.h", "strlen", "strcpy", "strncpy", "strcat", "strncat", "strcmp", "strncmp", "strchr",
            "strrchr", "strstr", "strtok", "strspn", "strcspn", "strpbrk", "memcpy", "memmove", "memcmp", "memchr",
            "memset", "strerror");
        add("string.h", EnumSet.of(Property.ALLOCATES), "strdup");
        add("math.h", "sin", "cos", "tan", "asin", "acos", "atan", "atan2", "sinh", "cosh", "tanh", "exp", "log",
            "log10", "log2", "pow", "sqrt", "cbrt", "ceil", "floor", "round", "trunc", "fabs", "fmod", "frexp",
            "ldexp", "modf", "hypot", "fmax", "fmin");
        add("ctype.h", "isalpha", "isdigit", "isalnum", "isspace", "isupper", "islower", "toupper", "tolower",
            "ispunct", "isprint", "iscntrl", "isgraph", "isxdigit");
        add("time.h", "time", "clock", "difftime", "mktime", "asctime", "ctime", "gmtime", "localtime", "strftime");
        add("assert.h", "assert");
    }

    private StandardLibrary() {
    }

    private static void add(String header, String... functions) {
        add(header, EnumSet.noneOf(Property.class), functions);
    }

    private static void add(String header, Set<Property> properties, String... functions) {
        for (String function : functions) {
            CATALOG.put(function, new Entry(header, properties));
        }
    }

    public static boolean contains(String function) {
        return CATALOG.containsKey(function);
    }

    /// The header declaring {@code function}, or null if the function is not in the catalog.
    public static @Nullable String requiredHeader(String function) {
        Entry entry = CATALOG.get(function);
        return entry == null ? null : entry.header();
    }

    public static boolean isAllocator(String function) {
        return hasProperty(function, Property.ALLOCATES);
    }

    public static boolean isDeallocator(String function) {
        return hasProperty(function, Property.DEALLOCATES);
    }

    /// Calls that end the program, such as {@code exit}.
    public static boolean mayNotReturn(String function) {
        return hasProperty(function, Property.MAY_NOT_RETURN);
    }

    public static boolean isKnownHeader(String header) {
        return KNOWN_HEADERS.contains(header);
    }

    public static Set<String> knownHeaders() {
        return KNOWN_HEADERS;
    }

    private static boolean hasProperty(String function, Property property) {
        Entry entry = CATALOG.get(function);
        return entry != null && entry.properties().contains(property);
    }
}
