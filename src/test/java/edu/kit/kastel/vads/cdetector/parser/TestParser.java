package edu.kit.kastel.vads.cdetector.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.intellij.lang.annotations.Language;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import edu.kit.kastel.vads.cdetector.CommonTest;
import edu.kit.kastel.vads.cdetector.parser.ast.CallTree;
import edu.kit.kastel.vads.cdetector.parser.ast.DeclarationTree;
import edu.kit.kastel.vads.cdetector.parser.ast.ForTree;
import edu.kit.kastel.vads.cdetector.parser.ast.FunctionTree;
import edu.kit.kastel.vads.cdetector.parser.ast.IdentExpressionTree;
import edu.kit.kastel.vads.cdetector.parser.ast.IncludeTree;
import edu.kit.kastel.vads.cdetector.parser.ast.WhileTree;
import edu.kit.kastel.vads.cdetector.parser.symbol.Scope;
import edu.kit.kastel.vads.cdetector.parser.symbol.ScopeKind;
import edu.kit.kastel.vads.cdetector.parser.symbol.Symbol;
import edu.kit.kastel.vads.cdetector.parser.symbol.SymbolKind;
import edu.kit.kastel.vads.cdetector.parser.type.ArrayType;
import edu.kit.kastel.vads.cdetector.parser.type.BasicType;
import edu.kit.kastel.vads.cdetector.parser.type.PointerType;

public class TestParser extends CommonTest {

    @Language("C")
    private static final String INCLUDES = """
        #include <stdio.h>
        #include "list.h"
        int main(void) {
            return 0;
        }
        """;

    @Test
    public void includesKeepTheirKind() {
        List<IncludeTree> includes = parse(INCLUDES).includes();
        assertEquals(2, includes.size());
        assertEquals("stdio.h", includes.get(0).header());
        assertTrue(includes.get(0).system());
        assertEquals("list.h", includes.get(1).header());
        assertFalse(includes.get(1).system());
        assertEquals(2, includes.get(1).span().line());
    }

    @Language("C")
    private static final String DECLARATORS = """
        #include <stdint.h>
        typedef unsigned char byte;
        int main(void) {
            int *p, values[4];
            byte b = 1;
            uint16_t port = 80;
            return 0;
        }
        """;

    @DisplayName("declarators, typedefs and fixed-width aliases resolve to their types")
    @Test
    public void declarators() {
        List<StructureIndex.Entry<DeclarationTree>> declarations = parse(DECLARATORS).index().declarations();
        assertEquals(4, declarations.size());

        Symbol pointer = declarations.get(0).tree().symbol();
        assertEquals("p", pointer.name().asString());
        assertEquals(SymbolKind.POINTER, pointer.kind());
        assertInstanceOf(PointerType.class, pointer.type());
        assertTrue(pointer.isPointer());

        Symbol array = declarations.get(1).tree().symbol();
        assertEquals(SymbolKind.ARRAY, array.kind());
        ArrayType arrayType = assertInstanceOf(ArrayType.class, array.type());
        assertEquals(BasicType.INT, arrayType.element());
        assertFalse(array.isPointer());

        assertEquals(BasicType.UNSIGNED_CHAR, declarations.get(2).tree().symbol().type());
        assertEquals(BasicType.UNSIGNED_SHORT, declarations.get(3).tree().symbol().type());
        assertEquals(6, declarations.get(3).line());
    }

    @Language("C")
    private static final String STRUCTURE = """
        #include <stdio.h>
        int square(int n) {
            return n * n;
        }
        int main(void) {
            int total = 0;
            for (int i = 0; i < 3; i++) {
                total += square(i);
            }
            while (total > 10) {
                total = total - 1;
            }
            printf("%d\\n", total);
            return 0;
        }
        """;

    @DisplayName("the index lists functions, calls, assignments and loops in source order")
    @Test
    public void structureIndex() {
        StructureIndex index = parse(STRUCTURE).index();

        assertEquals(List.of("square", "main"), index.functions().stream()
            .map(function -> function.name().name().asString()).toList());

        List<StructureIndex.Entry<CallTree>> calls = index.calls();
        assertEquals(2, calls.size());
        assertEquals("square", calls.get(0).tree().calleeName());
        assertEquals(8, calls.get(0).line());
        assertEquals("printf", calls.get(1).tree().calleeName());

        assertEquals(2, index.assignments().size());
        assertEquals(List.of(7, 10), index.loops().stream().map(StructureIndex.Entry::line).toList());
        assertInstanceOf(ForTree.class, index.loops().get(0).tree());
        assertInstanceOf(WhileTree.class, index.loops().get(1).tree());
    }

    @Language("C")
    private static final String SCOPES = """
        struct point { int x; int y; };
        int add(int a, int b) {
            int sum = a + b;
            {
                int tmp = sum;
            }
            return sum;
        }
        """;

    @DisplayName("parameters share the function scope, members live in a struct scope, blocks close")
    @Test
    public void scopeArena() {
        List<Scope> scopes = parse(SCOPES).scopes().scopes();
        assertEquals(List.of(ScopeKind.TRANSLATION_UNIT, ScopeKind.STRUCT, ScopeKind.FUNCTION, ScopeKind.BLOCK),
            scopes.stream().map(Scope::kind).toList());
        assertFalse(scopes.get(0).isClosed());
        assertTrue(scopes.stream().skip(1).allMatch(Scope::isClosed));

        assertEquals(List.of("x", "y"), names(scopes.get(1)));
        assertEquals(List.of("a", "b", "sum"), names(scopes.get(2)));
        assertEquals(List.of("tmp"), names(scopes.get(3)));
        assertEquals(2, scopes.get(3).parent());
        assertEquals(SymbolKind.FUNCTION, scopes.get(0).lookup("add").kind());
    }

    private static List<String> names(Scope scope) {
        return scope.symbols().stream().map(symbol -> symbol.name().asString()).toList();
    }

    @Language("C")
    private static final String SHADOWING = """
        int main(void) {
            int x = 1;
            {
                int x = 2;
                x = 3;
            }
            x = 4;
            return x;
        }
        """;

    @DisplayName("names resolve to the innermost visible declaration")
    @Test
    public void shadowing() {
        TranslationUnit unit = parse(SHADOWING);
        List<StructureIndex.Entry<DeclarationTree>> declarations = unit.index().declarations();
        Symbol outer = declarations.get(0).tree().symbol();
        Symbol inner = declarations.get(1).tree().symbol();
        assertNotEquals(outer.scope(), inner.scope());

        IdentExpressionTree first = (IdentExpressionTree) unit.index().assignments().get(0).tree().lValue();
        IdentExpressionTree second = (IdentExpressionTree) unit.index().assignments().get(1).tree().lValue();
        assertEquals(inner, first.symbol());
        assertEquals(outer, second.symbol());
        assertEquals(unit.index().declarationOf(inner), declarations.get(1).tree());
    }

    @Language("C")
    private static final String OUT_OF_SCOPE = """
        int main(void) {
            {
                int inner = 1;
            }
            return inner;
        }
        """;

    @Test
    public void staleReference() {
        TranslationUnit unit = parse(OUT_OF_SCOPE);
        assertEquals(1, unit.staleReferences().size());
        StaleReference stale = unit.staleReferences().get(0);
        assertEquals("inner", stale.symbol().name().asString());
        assertEquals(5, stale.span().line());
        assertEquals(3, stale.symbol().span().line());
    }

    @Language("C")
    private static final String MALFORMED = """
        int main(void) {
            int x = ;
            int y = 2;
            return y;
        }
        int after(void) {
            return 1;
        }
        """;

    @DisplayName("a malformed statement is skipped and parsing continues")
    @Test
    public void recovery() {
        TranslationUnit unit = parse(MALFORMED);
        assertEquals(1, unit.problems().size());
        assertEquals(2, unit.problems().get(0).line());
        List<FunctionTree> functions = unit.index().functions();
        assertEquals(2, functions.size());
        assertNotNull(unit.index().declarations().stream()
            .filter(entry -> entry.tree().symbol().name().asString().equals("y"))
            .findFirst().orElse(null));
    }

    @Language("C")
    private static final String TRUNCATED = """
        int main(void) {
            int x = 1;
            if (x) {
                x = 2;
        """;

    @DisplayName("blocks cut off by the end of input keep their statements")
    @Test
    public void truncatedBlocks() {
        TranslationUnit unit = parse(TRUNCATED);
        assertEquals(List.of(3, 1), unit.problems().stream().map(ParseProblem::line).toList());
        List<FunctionTree> functions = unit.index().functions();
        assertEquals(1, functions.size());
        assertEquals(2, functions.get(0).body().statements().size());
        assertEquals(1, unit.index().assignments().size());
    }
}
