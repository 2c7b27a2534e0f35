package edu.kit.kastel.vads.cdetector.parser.ast;

public sealed interface ExpressionTree extends Tree permits AddressOfTree, AssignmentTree, BinaryOperationTree,
    CallTree, CastTree, CharLiteralTree, DereferenceTree, IdentExpressionTree, IndexTree, InitializerListTree,
    LiteralTree, MemberAccessTree, SizeofTree, StringLiteralTree, TernaryTree, UnaryOperationTree {
}
