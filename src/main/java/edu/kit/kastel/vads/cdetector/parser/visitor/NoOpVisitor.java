package edu.kit.kastel.vads.cdetector.parser.visitor;

import edu.kit.kastel.vads.cdetector.parser.ast.AddressOfTree;
import edu.kit.kastel.vads.cdetector.parser.ast.AssignmentTree;
import edu.kit.kastel.vads.cdetector.parser.ast.BinaryOperationTree;
import edu.kit.kastel.vads.cdetector.parser.ast.BlockTree;
import edu.kit.kastel.vads.cdetector.parser.ast.BreakTree;
import edu.kit.kastel.vads.cdetector.parser.ast.CallTree;
import edu.kit.kastel.vads.cdetector.parser.ast.CaseTree;
import edu.kit.kastel.vads.cdetector.parser.ast.CastTree;
import edu.kit.kastel.vads.cdetector.parser.ast.CharLiteralTree;
import edu.kit.kastel.vads.cdetector.parser.ast.ContinueTree;
import edu.kit.kastel.vads.cdetector.parser.ast.DeclarationTree;
import edu.kit.kastel.vads.cdetector.parser.ast.DereferenceTree;
import edu.kit.kastel.vads.cdetector.parser.ast.DoWhileTree;
import edu.kit.kastel.vads.cdetector.parser.ast.EmptyTree;
import edu.kit.kastel.vads.cdetector.parser.ast.ExpressionStatementTree;
import edu.kit.kastel.vads.cdetector.parser.ast.ForTree;
import edu.kit.kastel.vads.cdetector.parser.ast.FunctionDeclarationTree;
import edu.kit.kastel.vads.cdetector.parser.ast.FunctionTree;
import edu.kit.kastel.vads.cdetector.parser.ast.GotoTree;
import edu.kit.kastel.vads.cdetector.parser.ast.IdentExpressionTree;
import edu.kit.kastel.vads.cdetector.parser.ast.IfTree;
import edu.kit.kastel.vads.cdetector.parser.ast.IncludeTree;
import edu.kit.kastel.vads.cdetector.parser.ast.IndexTree;
import edu.kit.kastel.vads.cdetector.parser.ast.InitializerListTree;
import edu.kit.kastel.vads.cdetector.parser.ast.LiteralTree;
import edu.kit.kastel.vads.cdetector.parser.ast.MemberAccessTree;
import edu.kit.kastel.vads.cdetector.parser.ast.NameTree;
import edu.kit.kastel.vads.cdetector.parser.ast.ParameterTree;
import edu.kit.kastel.vads.cdetector.parser.ast.ProgramTree;
import edu.kit.kastel.vads.cdetector.parser.ast.ReturnTree;
import edu.kit.kastel.vads.cdetector.parser.ast.SizeofTree;
import edu.kit.kastel.vads.cdetector.parser.ast.StringLiteralTree;
import edu.kit.kastel.vads.cdetector.parser.ast.SwitchTree;
import edu.kit.kastel.vads.cdetector.parser.ast.TernaryTree;
import edu.kit.kastel.vads.cdetector.parser.ast.TypeDefinitionTree;
import edu.kit.kastel.vads.cdetector.parser.ast.TypeTree;
import edu.kit.kastel.vads.cdetector.parser.ast.UnaryOperationTree;
import edu.kit.kastel.vads.cdetector.parser.ast.WhileTree;

/// A visitor that does nothing and returns {@link Unit#INSTANCE} by default.
/// This can be used to implement operations only for specific tree types.
public interface NoOpVisitor<T> extends Visitor<T, Unit> {

    @Override
    default Unit visit(AddressOfTree addressOfTree, T data) {
        return Unit.INSTANCE;
    }

    @Override
    default Unit visit(AssignmentTree assignmentTree, T data) {
        return Unit.INSTANCE;
    }

    @Override
    default Unit visit(BinaryOperationTree binaryOperationTree, T data) {
        return Unit.INSTANCE;
    }

    @Override
    default Unit visit(BlockTree blockTree, T data) {
        return Unit.INSTANCE;
    }

    @Override
    default Unit visit(BreakTree breakTree, T data) {
        return Unit.INSTANCE;
    }

    @Override
    default Unit visit(CallTree callTree, T data) {
        return Unit.INSTANCE;
    }

    @Override
    default Unit visit(CaseTree caseTree, T data) {
        return Unit.INSTANCE;
    }

    @Override
    default Unit visit(CastTree castTree, T data) {
        return Unit.INSTANCE;
    }

    @Override
    default Unit visit(CharLiteralTree charLiteralTree, T data) {
        return Unit.INSTANCE;
    }

    @Override
    default Unit visit(ContinueTree continueTree, T data) {
        return Unit.INSTANCE;
    }

    @Override
    default Unit visit(DeclarationTree declarationTree, T data) {
        return Unit.INSTANCE;
    }

    @Override
    default Unit visit(DereferenceTree dereferenceTree, T data) {
        return Unit.INSTANCE;
    }

    @Override
    default Unit visit(DoWhileTree doWhileTree, T data) {
        return Unit.INSTANCE;
    }

    @Override
    default Unit visit(EmptyTree emptyTree, T data) {
        return Unit.INSTANCE;
    }

    @Override
    default Unit visit(ExpressionStatementTree expressionStatementTree, T data) {
        return Unit.INSTANCE;
    }

    @Override
    default Unit visit(ForTree forTree, T data) {
        return Unit.INSTANCE;
    }

    @Override
    default Unit visit(FunctionDeclarationTree functionDeclarationTree, T data) {
        return Unit.INSTANCE;
    }

    @Override
    default Unit visit(FunctionTree functionTree, T data) {
        return Unit.INSTANCE;
    }

    @Override
    default Unit visit(GotoTree gotoTree, T data) {
        return Unit.INSTANCE;
    }

    @Override
    default Unit visit(IdentExpressionTree identExpressionTree, T data) {
        return Unit.INSTANCE;
    }

    @Override
    default Unit visit(IfTree ifTree, T data) {
        return Unit.INSTANCE;
    }

    @Override
    default Unit visit(IncludeTree includeTree, T data) {
        return Unit.INSTANCE;
    }

    @Override
    default Unit visit(IndexTree indexTree, T data) {
        return Unit.INSTANCE;
    }

    @Override
    default Unit visit(InitializerListTree initializerListTree, T data) {
        return Unit.INSTANCE;
    }

    @Override
    default Unit visit(LiteralTree literalTree, T data) {
        return Unit.INSTANCE;
    }

    @Override
    default Unit visit(MemberAccessTree memberAccessTree, T data) {
        return Unit.INSTANCE;
    }

    @Override
    default Unit visit(NameTree nameTree, T data) {
        return Unit.INSTANCE;
    }

    @Override
    default Unit visit(ParameterTree parameterTree, T data) {
        return Unit.INSTANCE;
    }

    @Override
    default Unit visit(ProgramTree programTree, T data) {
        return Unit.INSTANCE;
    }

    @Override
    default Unit visit(ReturnTree returnTree, T data) {
        return Unit.INSTANCE;
    }

    @Override
    default Unit visit(SizeofTree sizeofTree, T data) {
        return Unit.INSTANCE;
    }

    @Override
    default Unit visit(StringLiteralTree stringLiteralTree, T data) {
        return Unit.INSTANCE;
    }

    @Override
    default Unit visit(SwitchTree switchTree, T data) {
        return Unit.INSTANCE;
    }

    @Override
    default Unit visit(TernaryTree ternaryTree, T data) {
        return Unit.INSTANCE;
    }

    @Override
    default Unit visit(TypeDefinitionTree typeDefinitionTree, T data) {
        return Unit.INSTANCE;
    }

    @Override
    default Unit visit(TypeTree typeTree, T data) {
        return Unit.INSTANCE;
    }

    @Override
    default Unit visit(UnaryOperationTree unaryOperationTree, T data) {
        return Unit.INSTANCE;
    }

    @Override
    default Unit visit(WhileTree whileTree, T data) {
        return Unit.INSTANCE;
    }
}
