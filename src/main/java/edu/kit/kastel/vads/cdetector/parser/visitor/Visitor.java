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

public interface Visitor<T, R> {

    R visit(AddressOfTree addressOfTree, T data);

    R visit(AssignmentTree assignmentTree, T data);

    R visit(BinaryOperationTree binaryOperationTree, T data);

    R visit(BlockTree blockTree, T data);

    R visit(BreakTree breakTree, T data);

    R visit(CallTree callTree, T data);

    R visit(CaseTree caseTree, T data);

    R visit(CastTree castTree, T data);

    R visit(CharLiteralTree charLiteralTree, T data);

    R visit(ContinueTree continueTree, T data);

    R visit(DeclarationTree declarationTree, T data);

    R visit(DereferenceTree dereferenceTree, T data);

    R visit(DoWhileTree doWhileTree, T data);

    R visit(EmptyTree emptyTree, T data);

    R visit(ExpressionStatementTree expressionStatementTree, T data);

    R visit(ForTree forTree, T data);

    R visit(FunctionDeclarationTree functionDeclarationTree, T data);

    R visit(FunctionTree functionTree, T data);

    R visit(GotoTree gotoTree, T data);

    R visit(IdentExpressionTree identExpressionTree, T data);

    R visit(IfTree ifTree, T data);

    R visit(IncludeTree includeTree, T data);

    R visit(IndexTree indexTree, T data);

    R visit(InitializerListTree initializerListTree, T data);

    R visit(LiteralTree literalTree, T data);

    R visit(MemberAccessTree memberAccessTree, T data);

    R visit(NameTree nameTree, T data);

    R visit(ParameterTree parameterTree, T data);

    R visit(ProgramTree programTree, T data);

    R visit(ReturnTree returnTree, T data);

    R visit(SizeofTree sizeofTree, T data);

    R visit(StringLiteralTree stringLiteralTree, T data);

    R visit(SwitchTree switchTree, T data);

    R visit(TernaryTree ternaryTree, T data);

    R visit(TypeDefinitionTree typeDefinitionTree, T data);

    R visit(TypeTree typeTree, T data);

    R visit(UnaryOperationTree unaryOperationTree, T data);

    R visit(WhileTree whileTree, T data);
}
