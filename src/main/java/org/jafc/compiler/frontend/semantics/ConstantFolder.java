package org.jafc.compiler.frontend.semantics;

import org.jafc.compiler.frontend.parser.ast.expr.AssignmentExpression;
import org.jafc.compiler.frontend.parser.ast.expr.BinaryExpression;
import org.jafc.compiler.frontend.parser.ast.expr.BinaryOperator;
import org.jafc.compiler.frontend.parser.ast.expr.CallExpression;
import org.jafc.compiler.frontend.parser.ast.expr.CastExpression;
import org.jafc.compiler.frontend.parser.ast.expr.Expression;
import org.jafc.compiler.frontend.parser.ast.expr.FloatLiteral;
import org.jafc.compiler.frontend.parser.ast.expr.IntLiteral;
import org.jafc.compiler.frontend.parser.ast.expr.MemberExpression;
import org.jafc.compiler.frontend.parser.ast.expr.SequenceExpression;
import org.jafc.compiler.frontend.parser.ast.expr.StringLiteral;
import org.jafc.compiler.frontend.parser.ast.expr.TernaryExpression;
import org.jafc.compiler.frontend.parser.ast.expr.UnaryExpression;

/**
 * Rewrites analyzed expressions into simpler equivalents by evaluating operators
 * whose operands are literals. Works bottom-up and is idempotent.
 * Integer arithmetic wraps at 32 bits; division and modulo by zero are left unfolded.
 */
public class ConstantFolder {

    /**
     * Simplifies an expression tree. Children are replaced in place; the returned node
     * replaces {@code expr} in its parent.
     * @param expr An expression whose types have been derived, may be null.
     * @return The simplified expression.
     */
    public Expression simplify(Expression expr) {
        if (expr == null) {
            return null;
        }
        Expression folded = null;
        if (expr instanceof UnaryExpression unary) {
            unary.setOperand(simplify(unary.operand()));
            folded = foldUnary(unary);
        } else if (expr instanceof BinaryExpression binary) {
            binary.setLhs(simplify(binary.lhs()));
            binary.setRhs(simplify(binary.rhs()));
            folded = foldBinary(binary);
        } else if (expr instanceof AssignmentExpression assign) {
            assign.setRhs(simplify(assign.rhs()));
        } else if (expr instanceof TernaryExpression ternary) {
            ternary.setTest(simplify(ternary.test()));
            ternary.setConsequent(simplify(ternary.consequent()));
            ternary.setAlternative(simplify(ternary.alternative()));
            folded = foldTernary(ternary);
        } else if (expr instanceof CallExpression call) {
            call.arguments().replaceAll(this::simplify);
        } else if (expr instanceof CastExpression cast) {
            cast.setOperand(simplify(cast.operand()));
            folded = foldCast(cast);
        } else if (expr instanceof MemberExpression member) {
            member.setStruct(simplify(member.struct()));
        } else if (expr instanceof SequenceExpression sequence) {
            sequence.setHead(simplify(sequence.head()));
            sequence.setTail(simplify(sequence.tail()));
            if (sequence.head().isLiteral()) {
                folded = sequence.tail();
            }
        }
        if (folded == null || folded == expr) {
            return expr;
        }
        if (folded.sourceInfo() == null) {
            folded.at(expr.sourceInfo());
        }
        return folded;
    }

    private Expression foldUnary(UnaryExpression expr) {
        Expression operand = expr.operand();
        switch (expr.operator()) {
            case PLUS:
                return operand.isLiteral() && !(operand instanceof StringLiteral) ? operand : null;
            case MINUS:
                if (operand instanceof IntLiteral i) return new IntLiteral(-i.value());
                if (operand instanceof FloatLiteral f) return new FloatLiteral(-f.value());
                return null;
            case BIT_NOT:
                return operand instanceof IntLiteral i ? new IntLiteral(~i.value()) : null;
            case LOGICAL_NOT:
                if (operand instanceof IntLiteral i) return bool(i.value() == 0);
                if (operand instanceof FloatLiteral f) return bool(f.value() == 0f);
                return null;
            default:
                return null;
        }
    }

    private Expression foldBinary(BinaryExpression expr) {
        Expression lhs = expr.lhs();
        Expression rhs = expr.rhs();
        if (lhs instanceof IntLiteral a && rhs instanceof IntLiteral b) {
            return foldInt(expr.operator(), a.value(), b.value());
        }
        if (lhs instanceof StringLiteral a && rhs instanceof StringLiteral b) {
            return foldString(expr.operator(), a.value(), b.value());
        }
        if (isNumericLiteral(lhs) && isNumericLiteral(rhs)) {
            return foldFloat(expr.operator(), floatValue(lhs), floatValue(rhs));
        }
        return null;
    }

    private Expression foldInt(BinaryOperator op, int a, int b) {
        return switch (op) {
            case MUL -> new IntLiteral(a * b);
            case DIV -> b == 0 ? null : new IntLiteral(a / b);
            case MOD -> b == 0 ? null : new IntLiteral(a % b);
            case ADD -> new IntLiteral(a + b);
            case SUB -> new IntLiteral(a - b);
            case LSHIFT -> new IntLiteral(a << b);
            case RSHIFT -> new IntLiteral(a >> b);
            case LT -> bool(a < b);
            case GT -> bool(a > b);
            case LTE -> bool(a <= b);
            case GTE -> bool(a >= b);
            case EQ -> bool(a == b);
            case NEQ -> bool(a != b);
            case BIT_AND -> new IntLiteral(a & b);
            case BIT_XOR -> new IntLiteral(a ^ b);
            case BIT_IOR -> new IntLiteral(a | b);
            case LOGICAL_AND -> bool(a != 0 && b != 0);
            case LOGICAL_OR -> bool(a != 0 || b != 0);
        };
    }

    private Expression foldFloat(BinaryOperator op, float a, float b) {
        return switch (op) {
            case MUL -> new FloatLiteral(a * b);
            case DIV -> b == 0f ? null : new FloatLiteral(a / b);
            case ADD -> new FloatLiteral(a + b);
            case SUB -> new FloatLiteral(a - b);
            case LT -> bool(a < b);
            case GT -> bool(a > b);
            case LTE -> bool(a <= b);
            case GTE -> bool(a >= b);
            case EQ -> bool(a == b);
            case NEQ -> bool(a != b);
            case LOGICAL_AND -> bool(a != 0f && b != 0f);
            case LOGICAL_OR -> bool(a != 0f || b != 0f);
            default -> null;
        };
    }

    private Expression foldString(BinaryOperator op, String a, String b) {
        return switch (op) {
            case ADD -> new StringLiteral(a + b);
            case EQ -> bool(a.equals(b));
            case NEQ -> bool(!a.equals(b));
            default -> null;
        };
    }

    private Expression foldTernary(TernaryExpression expr) {
        Expression test = expr.test();
        if (!isNumericLiteral(test)) {
            return null;
        }
        return floatValue(test) != 0f ? expr.consequent() : expr.alternative();
    }

    private Expression foldCast(CastExpression expr) {
        Expression operand = expr.operand();
        return switch (expr.target()) {
            case INT -> {
                if (operand instanceof IntLiteral) yield operand;
                if (operand instanceof FloatLiteral f) yield new IntLiteral((int) f.value());
                yield null;
            }
            case FLOAT -> {
                if (operand instanceof FloatLiteral) yield operand;
                if (operand instanceof IntLiteral i) yield new FloatLiteral(i.value());
                yield null;
            }
            case STRING -> {
                if (operand instanceof StringLiteral) yield operand;
                if (operand instanceof IntLiteral i) yield new StringLiteral(Integer.toString(i.value()));
                yield null;
            }
            default -> null;
        };
    }

    private static boolean isNumericLiteral(Expression expr) {
        return expr instanceof IntLiteral || expr instanceof FloatLiteral;
    }

    private static float floatValue(Expression expr) {
        return expr instanceof IntLiteral i ? i.value() : ((FloatLiteral) expr).value();
    }

    private static IntLiteral bool(boolean value) {
        return new IntLiteral(value ? 1 : 0);
    }
}
