package edu.kit.kastel.vads.cdetector.semantic;

import edu.kit.kastel.vads.cdetector.parser.ast.BlockTree;
import edu.kit.kastel.vads.cdetector.parser.ast.BreakTree;
import edu.kit.kastel.vads.cdetector.parser.ast.CallTree;
import edu.kit.kastel.vads.cdetector.parser.ast.ContinueTree;
import edu.kit.kastel.vads.cdetector.parser.ast.ExpressionStatementTree;
import edu.kit.kastel.vads.cdetector.parser.ast.GotoTree;
import edu.kit.kastel.vads.cdetector.parser.ast.IfTree;
import edu.kit.kastel.vads.cdetector.parser.ast.ReturnTree;
import edu.kit.kastel.vads.cdetector.parser.ast.StatementTree;

final class ControlFlow {

    private ControlFlow() {
    }

    /// Whether control never reaches the statement following {@code statement}.
    static boolean alwaysExits(StatementTree statement) {
        if (statement instanceof ReturnTree || statement instanceof GotoTree
            || statement instanceof BreakTree || statement instanceof ContinueTree) {
            return true;
        }
        if (statement instanceof ExpressionStatementTree expressionStatement
            && expressionStatement.expression() instanceof CallTree call) {
            String name = call.calleeName();
            return name != null && StandardLibrary.mayNotReturn(name);
        }
        if (statement instanceof BlockTree block) {
            return block.statements().stream().anyMatch(ControlFlow::alwaysExits);
        }
        if (statement instanceof IfTree ifTree) {
            return ifTree.elseBranch() != null && alwaysExits(ifTree.thenBranch()) && alwaysExits(ifTree.elseBranch());
        }
        return false;
    }
}
