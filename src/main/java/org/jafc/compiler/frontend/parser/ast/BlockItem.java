package org.jafc.compiler.frontend.parser.ast;

/**
 * An element of a {@link Block}: a declaration, a function declaration or a statement.
 * The set of kinds is closed; every traversal dispatches over all of them in
 * {@link org.jafc.compiler.frontend.BlockWalker}.
 */
public sealed interface BlockItem extends AstNode
        permits Declaration, FunctionDeclaration,
                LabeledStatement, CompoundStatement, ExpressionStatement,
                IfStatement, SwitchStatement, WhileStatement, DoWhileStatement, ForStatement,
                ReturnStatement, CaseStatement, DefaultStatement,
                GotoStatement, ContinueStatement, BreakStatement {
}
