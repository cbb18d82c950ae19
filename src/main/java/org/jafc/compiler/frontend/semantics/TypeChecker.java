package org.jafc.compiler.frontend.semantics;

import org.jafc.ain.AinDataType;
import org.jafc.ain.AinType;
import org.jafc.compiler.api.CompilerErrorCode;
import org.jafc.compiler.diagnostics.SemanticException;
import org.jafc.compiler.frontend.parser.ast.JafType;
import org.jafc.compiler.frontend.parser.ast.expr.CastExpression;
import org.jafc.compiler.frontend.parser.ast.expr.Expression;
import org.jafc.compiler.frontend.parser.ast.expr.FloatLiteral;
import org.jafc.compiler.frontend.parser.ast.expr.IntLiteral;

/**
 * Validates that a value may be stored into a location of a given type, and converts
 * the value to that type where the language converts implicitly.
 * <p>
 * Rules: identical primitive types match; structures match only the same structure;
 * {@code int} converts to {@code float} when implicit conversion is enabled; nothing
 * converts to or from {@code void}.
 * <p>
 * The implicit conversion setting applies to stores only: assignments, initializers,
 * call arguments and return values. Mixed int and float operands of an operator are
 * promoted to float regardless.
 */
public class TypeChecker {

    private final boolean implicitFloatConversion;

    /**
     * @param implicitFloatConversion Whether an int value may be assigned to a float location.
     */
    public TypeChecker(boolean implicitFloatConversion) {
        this.implicitFloatConversion = implicitFloatConversion;
    }

    /**
     * @param from The type of the value.
     * @param to The type of the location.
     * @return {@code true} if a value of type {@code from} may be stored in {@code to}.
     */
    public boolean isAssignable(AinType from, AinType to) {
        if (from == null || to == null) {
            return false;
        }
        if (from.data() == AinDataType.VOID || to.data() == AinDataType.VOID) {
            return false;
        }
        if (from.equals(to)) {
            return true;
        }
        return implicitFloatConversion && from.data() == AinDataType.INT && to.data() == AinDataType.FLOAT;
    }

    /**
     * Checks an analyzed expression against a target type.
     * @param expr The analyzed expression.
     * @param target The required type.
     * @throws SemanticException with {@link CompilerErrorCode#TYPE_MISMATCH} if the types are incompatible.
     */
    public void check(Expression expr, AinType target) {
        if (expr.valueType() == null) {
            throw new IllegalStateException("Expression has not been analyzed: " + expr);
        }
        if (!isAssignable(expr.valueType(), target)) {
            throw new SemanticException(CompilerErrorCode.TYPE_MISMATCH,
                    "Type mismatch: expected " + target + ", got " + expr.valueType() + " in '" + expr + "'",
                    expr.sourceInfo());
        }
    }

    /**
     * Converts a checked expression to the target type. Int literals become float literals,
     * other int values are wrapped in a cast; all other expressions are returned unchanged.
     * @param expr The expression.
     * @param target The type to convert to.
     * @return The converted expression.
     */
    public Expression coerce(Expression expr, AinType target) {
        if (target.data() != AinDataType.FLOAT || expr.valueType() == null || expr.valueType().data() != AinDataType.INT) {
            return expr;
        }
        Expression converted;
        if (expr instanceof IntLiteral literal) {
            converted = new FloatLiteral(literal.value());
        } else {
            converted = new CastExpression(JafType.FLOAT, expr);
            converted.setValueType(AinType.FLOAT);
        }
        return converted.at(expr.sourceInfo());
    }
}
