package org.monkeylang.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.monkeylang.compiler.frontend.parser.ast.BlockStatement;
import org.monkeylang.compiler.frontend.parser.ast.Expression;
import org.monkeylang.compiler.frontend.parser.ast.ExpressionStatement;
import org.monkeylang.compiler.frontend.parser.ast.Identifier;
import org.monkeylang.compiler.frontend.parser.ast.LetStatement;
import org.monkeylang.compiler.frontend.parser.ast.Program;
import org.monkeylang.compiler.frontend.parser.ast.ReturnStatement;
import org.monkeylang.compiler.frontend.parser.ast.Statement;
import org.monkeylang.compiler.frontend.parser.features.call.CallExpression;
import org.monkeylang.compiler.frontend.parser.features.conditional.IfExpression;
import org.monkeylang.compiler.frontend.parser.features.function.FunctionLiteral;
import org.monkeylang.compiler.frontend.parser.features.infix.InfixExpression;
import org.monkeylang.compiler.frontend.parser.features.infix.InfixOperator;
import org.monkeylang.compiler.frontend.parser.features.literal.BooleanLiteral;
import org.monkeylang.compiler.frontend.parser.features.literal.IntegerLiteral;
import org.monkeylang.compiler.frontend.parser.features.prefix.PrefixExpression;
import org.monkeylang.runtime.model.BooleanObject;
import org.monkeylang.runtime.model.Environment;
import org.monkeylang.runtime.model.ErrorObject;
import org.monkeylang.runtime.model.FunctionObject;
import org.monkeylang.runtime.model.IntegerObject;
import org.monkeylang.runtime.model.MonkeyObject;
import org.monkeylang.runtime.model.NullObject;
import org.monkeylang.runtime.model.ObjectType;
import org.monkeylang.runtime.model.ReturnValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A tree-walking evaluator.
 * <p>
 * Evaluation is a recursive walk over the AST against one active {@link Environment}. Early
 * return and runtime errors are plain values ({@link ReturnValue}, {@link ErrorObject}) that stop
 * the walk of the enclosing block and travel upward; a function call and {@link #eval(Program)}
 * unwrap a {@link ReturnValue}. Internally, a {@code null} result means the node produced no value
 * (e.g. {@code if (false) { 1 }}).
 * <p>
 * During a call the active environment is swapped for a fresh scope enclosing the callee's
 * captured environment and restored afterwards on every exit path. Nesting is bounded by
 * {@link EvaluatorOptions#maxCallDepth()}; a program that exhausts the host stack first ends with
 * the same {@code maximum call depth exceeded} error, naming the depth it reached.
 * <p>
 * Instances are not thread-safe.
 */
public class Evaluator {

    private static final Logger LOG = LoggerFactory.getLogger(Evaluator.class);

    private final EvaluatorOptions options;
    private Environment environment;
    private int callDepth = 0;
    private int deepestCall = 0;

    /**
     * Creates an evaluator with default options.
     * @param environment The top-level scope.
     */
    public Evaluator(Environment environment) {
        this(environment, EvaluatorOptions.defaults());
    }

    /**
     * Creates an evaluator.
     * @param environment The top-level scope.
     * @param options     The evaluator tunables.
     */
    public Evaluator(Environment environment, EvaluatorOptions options) {
        this.environment = environment;
        this.options = options;
    }

    /**
     * Evaluates a program. A top-level {@code return} ends the program with its value.
     *
     * @param program The program to evaluate.
     * @return The value of the last evaluated statement, the returned value, or the runtime
     *         error that stopped evaluation; empty if nothing produced a value.
     */
    public Optional<MonkeyObject> eval(Program program) {
        MonkeyObject result = null;

        for (Statement statement : program.statements()) {
            try {
                result = evalStatement(statement);
            } catch (StackOverflowError e) {
                // The host stack ran out below the configured limit; every call frame has
                // already restored its environment on the way out.
                LOG.debug("Host stack exhausted at call depth {}", deepestCall);
                result = new ErrorObject("maximum call depth exceeded: " + deepestCall);
            } finally {
                deepestCall = 0;
            }

            if (result instanceof ReturnValue returnValue) {
                return Optional.of(returnValue.value());
            }
            if (result != null && result.isError()) {
                LOG.debug("Evaluation stopped by runtime error: {}", result.inspect());
                return Optional.of(result);
            }
        }

        return Optional.ofNullable(result);
    }

    /**
     * Returns the currently active scope.
     */
    Environment getEnvironment() {
        return environment;
    }

    private MonkeyObject evalBlock(BlockStatement block) {
        MonkeyObject result = null;

        for (Statement statement : block.statements()) {
            result = evalStatement(statement);

            // Propagate still wrapped, so an enclosing function or program sees the return.
            if (result != null
                    && (result.type() == ObjectType.RETURN_VALUE || result.type() == ObjectType.ERROR)) {
                return result;
            }
        }

        return result;
    }

    private MonkeyObject evalStatement(Statement statement) {
        if (statement instanceof LetStatement let) {
            MonkeyObject value = evalExpression(let.value());
            if (value == null) {
                return null;
            }
            if (value.isError()) {
                return value;
            }
            environment.set(let.name().name(), value);
            return null;
        }
        if (statement instanceof ReturnStatement ret) {
            MonkeyObject value = evalExpression(ret.value());
            if (value == null || value.isError()) {
                return value;
            }
            return new ReturnValue(value);
        }
        if (statement instanceof ExpressionStatement expressionStatement) {
            return evalExpression(expressionStatement.expression());
        }
        if (statement instanceof BlockStatement block) {
            return evalBlock(block);
        }
        throw new IllegalStateException("Unsupported statement: " + statement.getClass().getSimpleName());
    }

    private MonkeyObject evalExpression(Expression expression) {
        if (expression instanceof IntegerLiteral literal) {
            return new IntegerObject(literal.value());
        }
        if (expression instanceof BooleanLiteral literal) {
            return BooleanObject.of(literal.value());
        }
        if (expression instanceof Identifier identifier) {
            return evalIdentifier(identifier);
        }
        if (expression instanceof PrefixExpression prefix) {
            MonkeyObject right = evalExpression(prefix.right());
            if (right == null || right.isError()) {
                return right;
            }
            return evalPrefix(prefix, right);
        }
        if (expression instanceof InfixExpression infix) {
            MonkeyObject left = evalExpression(infix.left());
            if (left != null && left.isError()) {
                return left;
            }
            MonkeyObject right = evalExpression(infix.right());
            if (right != null && right.isError()) {
                return right;
            }
            if (left == null || right == null) {
                return null;
            }
            return evalInfix(infix.operator(), left, right);
        }
        if (expression instanceof IfExpression ifExpression) {
            return evalIf(ifExpression);
        }
        if (expression instanceof FunctionLiteral function) {
            return new FunctionObject(function.parameters(), function.body(), environment);
        }
        if (expression instanceof CallExpression call) {
            return evalCall(call);
        }
        throw new IllegalStateException("Unsupported expression: " + expression.getClass().getSimpleName());
    }

    private MonkeyObject evalIdentifier(Identifier identifier) {
        return environment.get(identifier.name())
                .orElseGet(() -> new ErrorObject("identifier not found: " + identifier.name()));
    }

    private MonkeyObject evalPrefix(PrefixExpression prefix, MonkeyObject right) {
        switch (prefix.operator()) {
            case NOT:
                return BooleanObject.of(!isTruthy(right));
            case NEGATE:
                if (right instanceof IntegerObject integer) {
                    return new IntegerObject(-integer.value());
                }
                return new ErrorObject("unknown operator: -" + right.inspect());
            default:
                throw new IllegalStateException("Unknown prefix operator: " + prefix.operator());
        }
    }

    private MonkeyObject evalInfix(InfixOperator operator, MonkeyObject left, MonkeyObject right) {
        if (left instanceof IntegerObject l && right instanceof IntegerObject r) {
            return evalIntegerInfix(operator, l.value(), r.value());
        }
        if (left instanceof BooleanObject l && right instanceof BooleanObject r) {
            return evalBooleanInfix(operator, l.value(), r.value());
        }
        return new ErrorObject("type mismatch: " + describe(left, operator, right));
    }

    private MonkeyObject evalIntegerInfix(InfixOperator operator, long left, long right) {
        switch (operator) {
            case PLUS: return new IntegerObject(left + right);
            case MINUS: return new IntegerObject(left - right);
            case MULTIPLY: return new IntegerObject(left * right);
            case DIVIDE:
                if (right == 0) {
                    return new ErrorObject("division by zero: " + left + " / " + right);
                }
                return new IntegerObject(left / right);
            case EQUAL: return BooleanObject.of(left == right);
            case NOT_EQUAL: return BooleanObject.of(left != right);
            case LESS_THAN: return BooleanObject.of(left < right);
            case LESS_EQUAL: return BooleanObject.of(left <= right);
            case GREATER_THAN: return BooleanObject.of(left > right);
            case GREATER_EQUAL: return BooleanObject.of(left >= right);
            default:
                throw new IllegalStateException("Unknown infix operator: " + operator);
        }
    }

    private MonkeyObject evalBooleanInfix(InfixOperator operator, boolean left, boolean right) {
        switch (operator) {
            case EQUAL: return BooleanObject.of(left == right);
            case NOT_EQUAL: return BooleanObject.of(left != right);
            default:
                return new ErrorObject("unknown operator: " + left + " " + operator.symbol() + " " + right);
        }
    }

    private MonkeyObject evalIf(IfExpression ifExpression) {
        MonkeyObject condition = evalExpression(ifExpression.condition());
        if (condition == null || condition.isError()) {
            return condition;
        }

        if (isTruthy(condition)) {
            return evalBlock(ifExpression.consequence());
        }
        if (ifExpression.hasAlternative()) {
            return evalBlock(ifExpression.alternative());
        }
        return null;
    }

    private MonkeyObject evalCall(CallExpression call) {
        List<MonkeyObject> arguments = new ArrayList<>(call.arguments().size());
        for (Expression argument : call.arguments()) {
            MonkeyObject value = orNull(evalExpression(argument));
            if (value.isError()) {
                return value;
            }
            arguments.add(value);
        }

        MonkeyObject callee = evalExpression(call.function());
        if (callee == null) {
            return NullObject.INSTANCE;
        }
        if (callee.isError()) {
            return callee;
        }
        if (!(callee instanceof FunctionObject function)) {
            return new ErrorObject(callee.inspect() + " is not valid function");
        }

        if (function.parameters().size() != arguments.size()) {
            return new ErrorObject("wrong number of arguments: " + function.parameters().size()
                    + " expected but " + arguments.size() + " given");
        }
        if (callDepth >= options.maxCallDepth()) {
            return new ErrorObject("maximum call depth exceeded: " + options.maxCallDepth());
        }

        Environment scope = function.environment().enclose();
        for (int i = 0; i < arguments.size(); i++) {
            scope.set(function.parameters().get(i).name(), arguments.get(i));
        }

        Environment caller = environment;
        environment = scope;
        callDepth++;
        deepestCall = Math.max(deepestCall, callDepth);
        try {
            MonkeyObject result = evalBlock(function.body());
            if (result instanceof ReturnValue returnValue) {
                return returnValue.value();
            }
            return orNull(result);
        } finally {
            callDepth--;
            environment = caller;
        }
    }

    private static boolean isTruthy(MonkeyObject value) {
        if (value == null || value == NullObject.INSTANCE) {
            return false;
        }
        if (value instanceof BooleanObject bool) {
            return bool.value();
        }
        return true;
    }

    private static MonkeyObject orNull(MonkeyObject value) {
        return value != null ? value : NullObject.INSTANCE;
    }

    private static String describe(MonkeyObject left, InfixOperator operator, MonkeyObject right) {
        return left.inspect() + " " + operator.symbol() + " " + right.inspect();
    }
}
