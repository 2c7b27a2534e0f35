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
import edu.kit.kastel.vads.cdetector.parser.ast.Tree;

/// A visitor that traverses a tree in postorder
/// @param <T> a type for additional data
/// @param <R> a type for a return type
public class RecursivePostorderVisitor<T, R> implements Visitor<T, R> {
    private final Visitor<T, R> visitor;

    public RecursivePostorderVisitor(Visitor<T, R> visitor) {
        this.visitor = visitor;
    }

    @Override
    public R visit(AddressOfTree addressOfTree, T data) {
        addressOfTree.operand().accept(this, data);
        return this.visitor.visit(addressOfTree, data);
    }

    @Override
    public R visit(AssignmentTree assignmentTree, T data) {
        assignmentTree.lValue().accept(this, data);
        assignmentTree.expression().accept(this, data);
        return this.visitor.visit(assignmentTree, data);
    }

    @Override
    public R visit(BinaryOperationTree binaryOperationTree, T data) {
        binaryOperationTree.lhs().accept(this, data);
        binaryOperationTree.rhs().accept(this, data);
        return this.visitor.visit(binaryOperationTree, data);
    }

    @Override
    public R visit(BlockTree blockTree, T data) {
        for (Tree child : blockTree.statements()) {
            child.accept(this, data);
        }
        return this.visitor.visit(blockTree, data);
    }

    @Override
    public R visit(BreakTree breakTree, T data) {
        return this.visitor.visit(breakTree, data);
    }

    @Override
    public R visit(CallTree callTree, T data) {
        callTree.callee().accept(this, data);
        for (Tree child : callTree.arguments()) {
            child.accept(this, data);
        }
        return this.visitor.visit(callTree, data);
    }

    @Override
    public R visit(CaseTree caseTree, T data) {
        if (caseTree.label() != null) {
            caseTree.label().accept(this, data);
        }
        return this.visitor.visit(caseTree, data);
    }

    @Override
    public R visit(CastTree castTree, T data) {
        castTree.type().accept(this, data);
        castTree.expression().accept(this, data);
        return this.visitor.visit(castTree, data);
    }

    @Override
    public R visit(CharLiteralTree charLiteralTree, T data) {
        return this.visitor.visit(charLiteralTree, data);
    }

    @Override
    public R visit(ContinueTree continueTree, T data) {
        return this.visitor.visit(continueTree, data);
    }

    @Override
    public R visit(DeclarationTree declarationTree, T data) {
        declarationTree.type().accept(this, data);
        declarationTree.name().accept(this, data);
        if (declarationTree.initializer() != null) {
            declarationTree.initializer().accept(this, data);
        }
        return this.visitor.visit(declarationTree, data);
    }

    @Override
    public R visit(DereferenceTree dereferenceTree, T data) {
        dereferenceTree.operand().accept(this, data);
        return this.visitor.visit(dereferenceTree, data);
    }

    @Override
    public R visit(DoWhileTree doWhileTree, T data) {
        doWhileTree.body().accept(this, data);
        doWhileTree.condition().accept(this, data);
        return this.visitor.visit(doWhileTree, data);
    }

    @Override
    public R visit(EmptyTree emptyTree, T data) {
        return this.visitor.visit(emptyTree, data);
    }

    @Override
    public R visit(ExpressionStatementTree expressionStatementTree, T data) {
        expressionStatementTree.expression().accept(this, data);
        return this.visitor.visit(expressionStatementTree, data);
    }

    @Override
    public R visit(ForTree forTree, T data) {
        if (forTree.initializer() != null) {
            forTree.initializer().accept(this, data);
        }
        if (forTree.condition() != null) {
            forTree.condition().accept(this, data);
        }
        forTree.body().accept(this, data);
        if (forTree.step() != null) {
            forTree.step().accept(this, data);
        }
        return this.visitor.visit(forTree, data);
    }

    @Override
    public R visit(FunctionDeclarationTree functionDeclarationTree, T data) {
        functionDeclarationTree.returnType().accept(this, data);
        functionDeclarationTree.name().accept(this, data);
        for (Tree child : functionDeclarationTree.parameters()) {
            child.accept(this, data);
        }
        return this.visitor.visit(functionDeclarationTree, data);
    }

    @Override
    public R visit(FunctionTree functionTree, T data) {
        functionTree.returnType().accept(this, data);
        functionTree.name().accept(this, data);
        for (Tree child : functionTree.parameters()) {
            child.accept(this, data);
        }
        functionTree.body().accept(this, data);
        return this.visitor.visit(functionTree, data);
    }

    @Override
    public R visit(GotoTree gotoTree, T data) {
        gotoTree.label().accept(this, data);
        return this.visitor.visit(gotoTree, data);
    }

    @Override
    public R visit(IdentExpressionTree identExpressionTree, T data) {
        identExpressionTree.name().accept(this, data);
        return this.visitor.visit(identExpressionTree, data);
    }

    @Override
    public R visit(IfTree ifTree, T data) {
        ifTree.condition().accept(this, data);
        ifTree.thenBranch().accept(this, data);
        if (ifTree.elseBranch() != null) {
            ifTree.elseBranch().accept(this, data);
        }
        return this.visitor.visit(ifTree, data);
    }

    @Override
    public R visit(IncludeTree includeTree, T data) {
        return this.visitor.visit(includeTree, data);
    }

    @Override
    public R visit(IndexTree indexTree, T data) {
        indexTree.array().accept(this, data);
        indexTree.index().accept(this, data);
        return this.visitor.visit(indexTree, data);
    }

    @Override
    public R visit(InitializerListTree initializerListTree, T data) {
        for (Tree child : initializerListTree.elements()) {
            child.accept(this, data);
        }
        return this.visitor.visit(initializerListTree, data);
    }

    @Override
    public R visit(LiteralTree literalTree, T data) {
        return this.visitor.visit(literalTree, data);
    }

    @Override
    public R visit(MemberAccessTree memberAccessTree, T data) {
        memberAccessTree.object().accept(this, data);
        memberAccessTree.member().accept(this, data);
        return this.visitor.visit(memberAccessTree, data);
    }

    @Override
    public R visit(NameTree nameTree, T data) {
        return this.visitor.visit(nameTree, data);
    }

    @Override
    public R visit(ParameterTree parameterTree, T data) {
        parameterTree.type().accept(this, data);
        if (parameterTree.name() != null) {
            parameterTree.name().accept(this, data);
        }
        return this.visitor.visit(parameterTree, data);
    }

    @Override
    public R visit(ProgramTree programTree, T data) {
        for (Tree child : programTree.topLevelTrees()) {
            child.accept(this, data);
        }
        return this.visitor.visit(programTree, data);
    }

    @Override
    public R visit(ReturnTree returnTree, T data) {
        if (returnTree.expression() != null) {
            returnTree.expression().accept(this, data);
        }
        return this.visitor.visit(returnTree, data);
    }

    @Override
    public R visit(SizeofTree sizeofTree, T data) {
        if (sizeofTree.type() != null) {
            sizeofTree.type().accept(this, data);
        }
        if (sizeofTree.expression() != null) {
            sizeofTree.expression().accept(this, data);
        }
        return this.visitor.visit(sizeofTree, data);
    }

    @Override
    public R visit(StringLiteralTree stringLiteralTree, T data) {
        return this.visitor.visit(stringLiteralTree, data);
    }

    @Override
    public R visit(SwitchTree switchTree, T data) {
        switchTree.selector().accept(this, data);
        switchTree.body().accept(this, data);
        return this.visitor.visit(switchTree, data);
    }

    @Override
    public R visit(TernaryTree ternaryTree, T data) {
        ternaryTree.condition().accept(this, data);
        ternaryTree.thenExpression().accept(this, data);
        ternaryTree.elseExpression().accept(this, data);
        return this.visitor.visit(ternaryTree, data);
    }

    @Override
    public R visit(TypeDefinitionTree typeDefinitionTree, T data) {
        return this.visitor.visit(typeDefinitionTree, data);
    }

    @Override
    public R visit(TypeTree typeTree, T data) {
        return this.visitor.visit(typeTree, data);
    }

    @Override
    public R visit(UnaryOperationTree unaryOperationTree, T data) {
        unaryOperationTree.operand().accept(this, data);
        return this.visitor.visit(unaryOperationTree, data);
    }

    @Override
    public R visit(WhileTree whileTree, T data) {
        whileTree.condition().accept(this, data);
        whileTree.body().accept(this, data);
        return this.visitor.visit(whileTree, data);
    }
}
