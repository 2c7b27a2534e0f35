package edu.kit.kastel.vads.cdetector.parser.ast;

public sealed interface StatementTree extends Tree permits BlockTree, BreakTree, CaseTree, ContinueTree,
    DeclarationTree, DoWhileTree, EmptyTree, ExpressionStatementTree, ForTree, GotoTree, IfTree, IncludeTree,
    ReturnTree, SwitchTree, TypeDefinitionTree, WhileTree {
}
