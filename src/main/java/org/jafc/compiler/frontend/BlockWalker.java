package org.jafc.compiler.frontend;

import org.jafc.compiler.frontend.parser.ast.Block;
import org.jafc.compiler.frontend.parser.ast.BlockItem;
import org.jafc.compiler.frontend.parser.ast.BreakStatement;
import org.jafc.compiler.frontend.parser.ast.CaseStatement;
import org.jafc.compiler.frontend.parser.ast.CompoundStatement;
import org.jafc.compiler.frontend.parser.ast.ContinueStatement;
import org.jafc.compiler.frontend.parser.ast.Declaration;
import org.jafc.compiler.frontend.parser.ast.DefaultStatement;
import org.jafc.compiler.frontend.parser.ast.DoWhileStatement;
import org.jafc.compiler.frontend.parser.ast.ExpressionStatement;
import org.jafc.compiler.frontend.parser.ast.ForStatement;
import org.jafc.compiler.frontend.parser.ast.FunctionDeclaration;
import org.jafc.compiler.frontend.parser.ast.GotoStatement;
import org.jafc.compiler.frontend.parser.ast.IfStatement;
import org.jafc.compiler.frontend.parser.ast.LabeledStatement;
import org.jafc.compiler.frontend.parser.ast.ReturnStatement;
import org.jafc.compiler.frontend.parser.ast.SwitchStatement;
import org.jafc.compiler.frontend.parser.ast.WhileStatement;
import org.jafc.compiler.frontend.parser.ast.expr.Expression;

/**
 * The one traversal over block items shared by all analysis passes.
 * <p>
 * The walker owns the recursion and the order in which children are visited;
 * passes only override the hooks. Because type resolution, variable collection
 * and analysis all extend this class, they see declarations in the same order,
 * which keeps the variable indices assigned by one pass valid for the next.
 */
public abstract class BlockWalker {

    /**
     * Walks the items of a block in order, without opening a new scope.
     * @param block The block to walk.
     */
    public void walk(Block block) {
        if (block == null) {
            return;
        }
        for (BlockItem item : block.items()) {
            walkItem(item);
        }
    }

    /**
     * Dispatches a single item to the matching hook and descends into its children.
     * @param item The item, may be null.
     */
    protected void walkItem(BlockItem item) {
        if (item == null) {
            return;
        }
        if (item instanceof Declaration decl) {
            visitDeclaration(decl);
        } else if (item instanceof FunctionDeclaration function) {
            visitFunction(function);
        } else if (item instanceof LabeledStatement labeled) {
            walkItem(labeled.statement());
        } else if (item instanceof CompoundStatement compound) {
            walkNestedBlock(compound.block());
        } else if (item instanceof ExpressionStatement stmt) {
            stmt.setExpression(visitExpression(stmt.expression()));
        } else if (item instanceof IfStatement stmt) {
            stmt.setTest(visitExpression(stmt.test()));
            walkItem(stmt.consequent());
            walkItem(stmt.alternative());
        } else if (item instanceof SwitchStatement stmt) {
            stmt.setExpression(visitExpression(stmt.expression()));
            walkNestedBlock(stmt.body());
        } else if (item instanceof WhileStatement stmt) {
            stmt.setTest(visitExpression(stmt.test()));
            walkItem(stmt.body());
        } else if (item instanceof DoWhileStatement stmt) {
            stmt.setTest(visitExpression(stmt.test()));
            walkItem(stmt.body());
        } else if (item instanceof ForStatement stmt) {
            walkForLoop(stmt);
        } else if (item instanceof ReturnStatement stmt) {
            stmt.setExpression(visitExpression(stmt.expression()));
            visitReturn(stmt);
        } else if (item instanceof CaseStatement stmt) {
            stmt.setValue(visitExpression(stmt.value()));
            walkItem(stmt.statement());
        } else if (item instanceof DefaultStatement stmt) {
            walkItem(stmt.statement());
        } else if (item instanceof GotoStatement || item instanceof ContinueStatement || item instanceof BreakStatement) {
            // nothing to analyze
        } else {
            throw new IllegalStateException("Unhandled block item: " + item.getClass().getSimpleName());
        }
    }

    /**
     * The init clause is walked as a nested block. Its declarations still land in the
     * function's flat variable table; only name lookup is scoped to the loop.
     */
    private void walkForLoop(ForStatement stmt) {
        walkNestedBlock(stmt.init());
        stmt.setTest(visitExpression(stmt.test()));
        stmt.setAfter(visitExpression(stmt.after()));
        walkItem(stmt.body());
    }

    /**
     * Walks a block that forms its own scope. Passes that track scopes override this.
     * @param block The nested block.
     */
    protected void walkNestedBlock(Block block) {
        walk(block);
    }

    /**
     * Called for every declaration statement.
     * @param decl The declaration.
     */
    protected abstract void visitDeclaration(Declaration decl);

    /**
     * Called for every function declaration. Implementations decide whether to descend into the body.
     * @param function The function.
     */
    protected abstract void visitFunction(FunctionDeclaration function);

    /**
     * Called for every expression slot of a statement.
     * @param expr The expression, null for an omitted expression.
     * @return The expression to store back into the slot.
     */
    protected Expression visitExpression(Expression expr) {
        return expr;
    }

    /**
     * Called after the expression of a return statement has been visited.
     * @param stmt The return statement.
     */
    protected void visitReturn(ReturnStatement stmt) {
    }
}
