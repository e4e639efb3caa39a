package com.dynamoexpr.eval;

import com.dynamoexpr.ast.BetweenExpression;
import com.dynamoexpr.ast.CallExpression;
import com.dynamoexpr.ast.DynamoExpression;
import com.dynamoexpr.ast.Expression;
import com.dynamoexpr.ast.Identifier;
import com.dynamoexpr.ast.InfixExpression;
import com.dynamoexpr.ast.PrefixExpression;
import com.dynamoexpr.exception.EvaluationException;
import com.dynamoexpr.token.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Evaluates a parsed condition expression against an item.
 * <p>
 * Follows DynamoDB semantics: comparing values of different types is false, a missing
 * attribute makes every comparison false except {@code <>}.
 * Only trees parsed without errors can be evaluated.
 */
public class ExpressionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ExpressionEvaluator.class);

    private final OperandResolver resolver;

    public ExpressionEvaluator() {
        this(new DefaultOperandResolver());
    }

    public ExpressionEvaluator(OperandResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * Evaluate an expression against an item.
     *
     * @param expression Parsed expression
     * @param context    Item and placeholders
     * @return true if the item satisfies the condition; an empty expression matches every item
     */
    public boolean evaluate(DynamoExpression expression, ItemContext context) {
        if (expression == null || expression.isEmpty()) {
            return true;
        }

        Expression root = expression.expression()
                .orElseThrow(() -> new EvaluationException("Expression statement is incomplete"));
        boolean result = evaluateCondition(root, context);
        log.debug("Evaluated {} -> {}", expression, result);
        return result;
    }

    private boolean evaluateCondition(Expression expression, ItemContext context) {
        requirePresent(expression);

        if (expression instanceof InfixExpression infix) {
            return evaluateInfix(infix, context);
        }
        if (expression instanceof PrefixExpression prefix) {
            if (prefix.token().type() != TokenType.NOT) {
                throw new EvaluationException("Unsupported prefix operator: " + prefix.operator());
            }
            return !evaluateCondition(prefix.operand(), context);
        }
        if (expression instanceof BetweenExpression between) {
            return evaluateBetween(between, context);
        }
        if (expression instanceof CallExpression call) {
            return evaluateConditionFunction(call, context);
        }
        if (expression instanceof Identifier identifier) {
            Optional<Object> value = resolver.resolve(identifier.name(), context);
            if (value.isPresent() && value.get() instanceof Boolean b) {
                return b;
            }
            throw new EvaluationException("Operand '" + identifier.name() + "' is not a condition");
        }
        throw new EvaluationException("Unsupported expression: " + expression);
    }

    private boolean evaluateInfix(InfixExpression infix, ItemContext context) {
        TokenType operator = infix.token().type();

        if (operator == TokenType.AND) {
            return evaluateCondition(infix.left(), context) && evaluateCondition(infix.right(), context);
        }
        if (operator == TokenType.OR) {
            return evaluateCondition(infix.left(), context) || evaluateCondition(infix.right(), context);
        }

        Optional<Object> left = evaluateOperand(infix.left(), context);
        Optional<Object> right = evaluateOperand(infix.right(), context);

        if (operator == TokenType.NOT_EQ) {
            return left.isEmpty() || right.isEmpty() || !valuesEqual(left.get(), right.get());
        }
        if (left.isEmpty() || right.isEmpty()) {
            return false; // Missing attribute = condition is false
        }

        return switch (operator) {
            case EQ -> valuesEqual(left.get(), right.get());
            case LT -> compare(left.get(), right.get()).map(c -> c < 0).orElse(false);
            case LTE -> compare(left.get(), right.get()).map(c -> c <= 0).orElse(false);
            case GT -> compare(left.get(), right.get()).map(c -> c > 0).orElse(false);
            case GTE -> compare(left.get(), right.get()).map(c -> c >= 0).orElse(false);
            default -> throw new EvaluationException("Unsupported operator: " + infix.operator());
        };
    }

    private boolean evaluateBetween(BetweenExpression between, ItemContext context) {
        Optional<Object> value = evaluateOperand(between.subject(), context);
        Optional<Object> low = evaluateOperand(between.low(), context);
        Optional<Object> high = evaluateOperand(between.high(), context);
        if (value.isEmpty() || low.isEmpty() || high.isEmpty()) {
            return false;
        }

        Optional<Integer> lowerCheck = compare(value.get(), low.get());
        Optional<Integer> upperCheck = compare(value.get(), high.get());
        return lowerCheck.isPresent() && upperCheck.isPresent()
                && lowerCheck.get() >= 0 && upperCheck.get() <= 0;
    }

    private boolean evaluateConditionFunction(CallExpression call, ItemContext context) {
        ConditionFunction function = lookupFunction(call);
        if (!function.isCondition()) {
            throw new EvaluationException(function.getFunctionName() + " cannot be used as a condition");
        }
        List<Expression> args = call.arguments();

        return switch (function) {
            case ATTRIBUTE_EXISTS -> evaluateOperand(pathArgument(call, 0), context).isPresent();
            case ATTRIBUTE_NOT_EXISTS -> evaluateOperand(pathArgument(call, 0), context).isEmpty();
            case ATTRIBUTE_TYPE -> {
                Optional<Object> value = evaluateOperand(pathArgument(call, 0), context);
                Optional<Object> type = evaluateOperand(args.get(1), context);
                yield value.isPresent() && type.isPresent()
                        && typeOf(value.get()).equals(type.get());
            }
            case BEGINS_WITH -> {
                Optional<Object> value = evaluateOperand(pathArgument(call, 0), context);
                Optional<Object> prefix = evaluateOperand(args.get(1), context);
                yield value.isPresent() && prefix.isPresent()
                        && value.get() instanceof String s && prefix.get() instanceof String p
                        && s.startsWith(p);
            }
            case CONTAINS -> {
                Optional<Object> value = evaluateOperand(pathArgument(call, 0), context);
                Optional<Object> operand = evaluateOperand(args.get(1), context);
                yield value.isPresent() && operand.isPresent() && contains(value.get(), operand.get());
            }
            case SIZE -> throw new IllegalStateException("size is not a condition");
        };
    }

    private Optional<Object> evaluateOperand(Expression expression, ItemContext context) {
        requirePresent(expression);

        if (expression instanceof Identifier identifier) {
            return resolver.resolve(identifier.name(), context);
        }
        if (expression instanceof CallExpression call) {
            ConditionFunction function = lookupFunction(call);
            if (function != ConditionFunction.SIZE) {
                throw new EvaluationException(function.getFunctionName() + " cannot be used as an operand");
            }
            return evaluateOperand(pathArgument(call, 0), context).flatMap(this::sizeOf);
        }
        throw new EvaluationException("Expression " + expression + " cannot be used as an operand");
    }

    private ConditionFunction lookupFunction(CallExpression call) {
        ConditionFunction function = ConditionFunction.fromName(call.functionName())
                .orElseThrow(() -> new EvaluationException("Unknown function: " + call.functionName()));
        if (call.arguments().size() != function.getArity()) {
            throw new EvaluationException(function.getFunctionName() + " expects "
                    + function.getArity() + " argument(s), got " + call.arguments().size());
        }
        return function;
    }

    private Expression pathArgument(CallExpression call, int index) {
        Expression argument = call.arguments().get(index);
        requirePresent(argument);
        if (!(argument instanceof Identifier identifier)
                || OperandSource.fromReference(identifier.name()) != OperandSource.ATTRIBUTE_PATH) {
            throw new EvaluationException(call.functionName() + " expects a document path, got " + argument);
        }
        return argument;
    }

    private Optional<Object> sizeOf(Object value) {
        if (value instanceof String s) {
            return Optional.of(BigDecimal.valueOf(s.length()));
        }
        if (value instanceof Collection<?> c) {
            return Optional.of(BigDecimal.valueOf(c.size()));
        }
        if (value instanceof Map<?, ?> m) {
            return Optional.of(BigDecimal.valueOf(m.size()));
        }
        return Optional.empty();
    }

    private boolean contains(Object container, Object operand) {
        if (container instanceof String s && operand instanceof String o) {
            return s.contains(o);
        }
        if (container instanceof Collection<?> c) {
            return c.stream().anyMatch(element -> valuesEqual(element, operand));
        }
        return false;
    }

    private static String typeOf(Object value) {
        if (value instanceof String) {
            return "S";
        }
        if (value instanceof Number) {
            return "N";
        }
        if (value instanceof Boolean) {
            return "BOOL";
        }
        if (value instanceof NullValue) {
            return "NULL";
        }
        if (value instanceof List) {
            return "L";
        }
        if (value instanceof Map) {
            return "M";
        }
        return value.getClass().getSimpleName();
    }

    private static boolean valuesEqual(Object left, Object right) {
        if (left instanceof Number l && right instanceof Number r) {
            return toBigDecimal(l).compareTo(toBigDecimal(r)) == 0;
        }
        if (left instanceof List<?> l && right instanceof List<?> r) {
            if (l.size() != r.size()) {
                return false;
            }
            for (int i = 0; i < l.size(); i++) {
                if (!valuesEqual(l.get(i), r.get(i))) {
                    return false;
                }
            }
            return true;
        }
        if (left instanceof Map<?, ?> l && right instanceof Map<?, ?> r) {
            if (l.size() != r.size()) {
                return false;
            }
            for (Map.Entry<?, ?> entry : l.entrySet()) {
                if (!r.containsKey(entry.getKey()) || !valuesEqual(entry.getValue(), r.get(entry.getKey()))) {
                    return false;
                }
            }
            return true;
        }
        return Objects.equals(left, right);
    }

    private static Optional<Integer> compare(Object left, Object right) {
        if (left instanceof Number l && right instanceof Number r) {
            return Optional.of(toBigDecimal(l).compareTo(toBigDecimal(r)));
        }
        if (left instanceof String l && right instanceof String r) {
            return Optional.of(l.compareTo(r));
        }
        return Optional.empty();
    }

    private static BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal d) {
            return d;
        }
        if (number instanceof Double || number instanceof Float) {
            return BigDecimal.valueOf(number.doubleValue());
        }
        if (number instanceof Long || number instanceof Integer
                || number instanceof Short || number instanceof Byte) {
            return BigDecimal.valueOf(number.longValue());
        }
        return new BigDecimal(number.toString());
    }

    private static void requirePresent(Expression expression) {
        if (expression == null) {
            throw new EvaluationException("Expression contains a node that failed to parse");
        }
    }
}
