package org.jafc.compiler.frontend.semantics;

import org.jafc.ain.AinDataType;
import org.jafc.ain.AinFunction;
import org.jafc.ain.AinStruct;
import org.jafc.ain.AinType;
import org.jafc.ain.AinVariable;
import org.jafc.compiler.ain.IObjectModel;
import org.jafc.compiler.api.CompilerErrorCode;
import org.jafc.compiler.api.SourceInfo;
import org.jafc.compiler.diagnostics.SemanticException;
import org.jafc.compiler.frontend.parser.ast.expr.AssignmentExpression;
import org.jafc.compiler.frontend.parser.ast.expr.AssignmentOperator;
import org.jafc.compiler.frontend.parser.ast.expr.BinaryExpression;
import org.jafc.compiler.frontend.parser.ast.expr.BinaryOperator;
import org.jafc.compiler.frontend.parser.ast.expr.CallExpression;
import org.jafc.compiler.frontend.parser.ast.expr.CastExpression;
import org.jafc.compiler.frontend.parser.ast.expr.Expression;
import org.jafc.compiler.frontend.parser.ast.expr.Identifier;
import org.jafc.compiler.frontend.parser.ast.expr.MemberExpression;
import org.jafc.compiler.frontend.parser.ast.expr.SequenceExpression;
import org.jafc.compiler.frontend.parser.ast.expr.TernaryExpression;
import org.jafc.compiler.frontend.parser.ast.expr.UnaryExpression;

import java.util.List;
import java.util.Optional;

/**
 * Derives the type of every node of an expression tree, binds names to variable,
 * function and member indices, and then simplifies the tree with the
 * {@link ConstantFolder} if folding is enabled.
 */
public class ExpressionAnalyzer {

    private final TypeChecker checker;
    private final ConstantFolder folder;

    /**
     * @param checker The checker used for arguments, assignments and operand conversion.
     * @param folder The folder, or null to leave expressions unsimplified.
     */
    public ExpressionAnalyzer(TypeChecker checker, ConstantFolder folder) {
        this.checker = checker;
        this.folder = folder;
    }

    /**
     * Analyzes an expression in the given scope.
     * @param scope The scope names are resolved in.
     * @param expr The expression, may be null for an omitted expression.
     * @return The analyzed, possibly replaced expression.
     * @throws SemanticException on the first error found.
     */
    public Expression analyze(Scope scope, Expression expr) {
        if (expr == null) {
            return null;
        }
        derive(scope, expr);
        return folder != null ? folder.simplify(expr) : expr;
    }

    private void derive(Scope scope, Expression expr) {
        if (expr.isLiteral()) {
            return;
        }
        if (expr instanceof Identifier identifier) {
            deriveIdentifier(scope, identifier);
        } else if (expr instanceof UnaryExpression unary) {
            deriveUnary(scope, unary);
        } else if (expr instanceof BinaryExpression binary) {
            deriveBinary(scope, binary);
        } else if (expr instanceof AssignmentExpression assign) {
            deriveAssignment(scope, assign);
        } else if (expr instanceof TernaryExpression ternary) {
            deriveTernary(scope, ternary);
        } else if (expr instanceof CallExpression call) {
            deriveCall(scope, call);
        } else if (expr instanceof CastExpression cast) {
            deriveCast(scope, cast);
        } else if (expr instanceof MemberExpression member) {
            deriveMember(scope, member);
        } else if (expr instanceof SequenceExpression sequence) {
            derive(scope, sequence.head());
            derive(scope, sequence.tail());
            sequence.setValueType(sequence.tail().valueType());
        } else {
            throw new SemanticException(CompilerErrorCode.UNKNOWN_TYPE,
                    "Cannot derive type of " + expr.getClass().getSimpleName(), expr.sourceInfo());
        }
    }

    private void deriveIdentifier(Scope scope, Identifier identifier) {
        Optional<Scope.Binding> local = scope.resolveLocal(identifier.name());
        if (local.isPresent()) {
            identifier.bind(Identifier.Binding.LOCAL, local.get().varNo());
            identifier.setValueType(local.get().variable().getType());
            return;
        }
        IObjectModel model = scope.model();
        Optional<Integer> globalNo = model.getGlobalNo(identifier.name());
        if (globalNo.isEmpty()) {
            throw new SemanticException(CompilerErrorCode.UNDEFINED_IDENTIFIER,
                    "Undefined identifier '" + identifier.name() + "'", identifier.sourceInfo());
        }
        identifier.bind(Identifier.Binding.GLOBAL, globalNo.get());
        identifier.setValueType(model.getGlobal(globalNo.get()).getType());
    }

    private void deriveUnary(Scope scope, UnaryExpression unary) {
        derive(scope, unary.operand());
        AinType type = unary.operand().valueType();
        switch (unary.operator()) {
            case PLUS, MINUS -> {
                requireNumeric(type, unary);
                unary.setValueType(type);
            }
            case BIT_NOT -> {
                require(type.data() == AinDataType.INT, unary, "int operand");
                unary.setValueType(AinType.INT);
            }
            case LOGICAL_NOT -> {
                requireNumeric(type, unary);
                unary.setValueType(AinType.INT);
            }
            default -> {
                requireLvalue(unary.operand());
                requireNumeric(type, unary);
                unary.setValueType(type);
            }
        }
    }

    private void deriveBinary(Scope scope, BinaryExpression binary) {
        derive(scope, binary.lhs());
        derive(scope, binary.rhs());
        AinType type = binaryResultType(binary.operator(), binary.lhs().valueType(), binary.rhs().valueType(), binary);
        // mixed operands are always promoted; implicit float conversion only governs stores
        if (binary.lhs().valueType().isNumeric() && binary.rhs().valueType().isNumeric()
                && !binary.lhs().valueType().equals(binary.rhs().valueType())) {
            binary.setLhs(checker.coerce(binary.lhs(), AinType.FLOAT));
            binary.setRhs(checker.coerce(binary.rhs(), AinType.FLOAT));
        }
        binary.setValueType(type);
    }

    private AinType binaryResultType(BinaryOperator op, AinType lhs, AinType rhs, Expression where) {
        boolean numeric = lhs.isNumeric() && rhs.isNumeric();
        boolean strings = lhs.data() == AinDataType.STRING && rhs.data() == AinDataType.STRING;
        switch (op.kind()) {
            case ARITHMETIC:
                if (numeric) {
                    return lhs.data() == AinDataType.FLOAT || rhs.data() == AinDataType.FLOAT ? AinType.FLOAT : AinType.INT;
                }
                if (strings && op == BinaryOperator.ADD) {
                    return AinType.STRING;
                }
                break;
            case INTEGER:
                if (lhs.data() == AinDataType.INT && rhs.data() == AinDataType.INT) {
                    return AinType.INT;
                }
                break;
            case EQUALITY:
                if (numeric || strings) {
                    return AinType.INT;
                }
                break;
            case COMPARISON:
            case LOGICAL:
                if (numeric) {
                    return AinType.INT;
                }
                break;
            default:
                break;
        }
        throw new SemanticException(CompilerErrorCode.TYPE_MISMATCH,
                "Invalid operands to '" + op.symbol() + "': " + lhs + " and " + rhs, where.sourceInfo());
    }

    private void deriveAssignment(Scope scope, AssignmentExpression assign) {
        derive(scope, assign.lhs());
        requireLvalue(assign.lhs());
        derive(scope, assign.rhs());
        AinType target = assign.lhs().valueType();
        if (assign.operator() == AssignmentOperator.ASSIGN) {
            checker.check(assign.rhs(), target);
        } else {
            AinType result = binaryResultType(assign.operator().binaryOperator(), target, assign.rhs().valueType(), assign);
            if (!checker.isAssignable(result, target)) {
                throw new SemanticException(CompilerErrorCode.TYPE_MISMATCH,
                        "Cannot store " + result + " result of '" + assign.operator().symbol() + "' in " + target,
                        assign.sourceInfo());
            }
        }
        assign.setRhs(checker.coerce(assign.rhs(), target));
        assign.setValueType(target);
    }

    private void deriveTernary(Scope scope, TernaryExpression ternary) {
        derive(scope, ternary.test());
        requireNumeric(ternary.test().valueType(), ternary.test());
        derive(scope, ternary.consequent());
        derive(scope, ternary.alternative());
        AinType a = ternary.consequent().valueType();
        AinType b = ternary.alternative().valueType();
        if (a.equals(b)) {
            ternary.setValueType(a);
        } else if (a.isNumeric() && b.isNumeric()) {
            ternary.setConsequent(checker.coerce(ternary.consequent(), AinType.FLOAT));
            ternary.setAlternative(checker.coerce(ternary.alternative(), AinType.FLOAT));
            ternary.setValueType(AinType.FLOAT);
        } else {
            throw new SemanticException(CompilerErrorCode.TYPE_MISMATCH,
                    "Incompatible branches of conditional: " + a + " and " + b, ternary.sourceInfo());
        }
    }

    private void deriveCall(Scope scope, CallExpression call) {
        IObjectModel model = scope.model();
        int funcNo = model.getFunctionNo(call.functionName())
                .orElseThrow(() -> new SemanticException(CompilerErrorCode.UNDEFINED_FUNCTION,
                        "Undefined function '" + call.functionName() + "'", call.sourceInfo()));
        AinFunction function = model.getFunction(funcNo);
        List<Expression> args = call.arguments();
        if (args.size() != function.getNrArgs()) {
            throw new SemanticException(CompilerErrorCode.ARGUMENT_COUNT_MISMATCH,
                    "Function '" + function.getName() + "' expects " + function.getNrArgs()
                            + " argument(s), got " + args.size(), call.sourceInfo());
        }
        for (int i = 0; i < args.size(); i++) {
            Expression arg = args.get(i);
            derive(scope, arg);
            AinType paramType = function.getVars().get(i).getType();
            checker.check(arg, paramType);
            args.set(i, checker.coerce(arg, paramType));
        }
        call.setFuncNo(funcNo);
        call.setValueType(function.getReturnType());
    }

    private void deriveCast(Scope scope, CastExpression cast) {
        derive(scope, cast.operand());
        AinType from = cast.operand().valueType();
        AinDataType to = TypeConversions.toDataType(cast.target(), cast.sourceInfo());
        boolean valid = switch (to) {
            case INT, FLOAT -> from.isNumeric();
            case STRING -> from.isNumeric() || from.data() == AinDataType.STRING;
            default -> false;
        };
        if (!valid) {
            throw new SemanticException(CompilerErrorCode.TYPE_MISMATCH,
                    "Invalid cast from " + from + " to " + to.name().toLowerCase(), cast.sourceInfo());
        }
        cast.setValueType(AinType.of(to));
    }

    private void deriveMember(Scope scope, MemberExpression member) {
        derive(scope, member.struct());
        AinType type = member.struct().valueType();
        if (type.data() != AinDataType.STRUCT) {
            throw new SemanticException(CompilerErrorCode.TYPE_MISMATCH,
                    "Member access '" + member.memberName() + "' on non-struct type " + type, member.sourceInfo());
        }
        AinStruct struct = scope.model().getStruct(type.struc());
        List<AinVariable> members = struct.getMembers();
        for (int i = 0; i < members.size(); i++) {
            if (members.get(i).getName().equals(member.memberName())) {
                member.setMemberNo(i);
                member.setValueType(members.get(i).getType());
                return;
            }
        }
        throw new SemanticException(CompilerErrorCode.UNDEFINED_MEMBER,
                "Struct '" + struct.getName() + "' has no member '" + member.memberName() + "'", member.sourceInfo());
    }

    private static void requireLvalue(Expression expr) {
        if (!(expr instanceof Identifier) && !(expr instanceof MemberExpression)) {
            throw new SemanticException(CompilerErrorCode.NOT_AN_LVALUE,
                    "Expression is not assignable: " + expr, expr.sourceInfo());
        }
    }

    private static void requireNumeric(AinType type, Expression where) {
        require(type.isNumeric(), where, "numeric operand");
    }

    private static void require(boolean condition, Expression where, String expected) {
        if (!condition) {
            SourceInfo at = where.sourceInfo();
            throw new SemanticException(CompilerErrorCode.TYPE_MISMATCH, "Expected " + expected + " in '" + where + "'", at);
        }
    }
}
