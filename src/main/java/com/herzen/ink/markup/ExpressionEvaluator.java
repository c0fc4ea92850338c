package com.herzen.ink.markup;

import com.herzen.ink.markup.InkValue.*;
import com.herzen.ink.markup.MarkupModels.*;

import java.util.Objects;
import java.util.function.LongSupplier;

public class ExpressionEvaluator {

    private ExpressionEvaluator() {}

    public static InkValue evaluate(Expression expression, EvaluationContext context) {
        if (expression instanceof Constant c) {
            return c.value();
        }
        if (expression instanceof Reference r) {
            return context.lookup(r.name());
        }
        if (expression instanceof Unary u) {
            InkValue operand = evaluate(u.operand(), context);
            return switch (u.op()) {
                case NOT -> new Bool(!operand.truthy());
                case NEGATE -> {
                    if (operand instanceof Int i) yield new Int(exact(() -> Math.negateExact(i.value())));
                    if (operand instanceof Decimal d) yield new Decimal(-d.value());
                    throw mismatch("negate", operand, operand);
                }
            };
        }
        Binary b = (Binary) expression;
        if (b.op() == BinaryOp.AND) {
            return new Bool(evaluate(b.left(), context).truthy() && evaluate(b.right(), context).truthy());
        }
        if (b.op() == BinaryOp.OR) {
            return new Bool(evaluate(b.left(), context).truthy() || evaluate(b.right(), context).truthy());
        }
        InkValue left = evaluate(b.left(), context);
        InkValue right = evaluate(b.right(), context);
        return switch (b.op()) {
            case ADD -> add(left, right);
            case SUBTRACT, MULTIPLY, DIVIDE, REMAINDER -> arithmetic(b.op(), left, right);
            case EQUAL -> new Bool(equal(left, right));
            case NOT_EQUAL -> new Bool(!equal(left, right));
            case LESS, LESS_OR_EQUAL, GREATER, GREATER_OR_EQUAL -> compare(b.op(), left, right);
            case AND, OR -> throw new IllegalStateException("handled above");
        };
    }

    public static boolean test(Expression condition, EvaluationContext context) {
        return condition == null || evaluate(condition, context).truthy();
    }

    private static long exact(LongSupplier operation) {
        try {
            return operation.getAsLong();
        } catch (ArithmeticException e) {
            throw overflow();
        }
    }

    private static ExpressionException overflow() {
        return new ExpressionException(ExpressionException.INTEGER_OVERFLOW, "Integer overflow");
    }

    private static InkValue add(InkValue left, InkValue right) {
        if (left instanceof Text || right instanceof Text) {
            return new Text(left.display() + right.display());
        }
        return arithmetic(BinaryOp.ADD, left, right);
    }

    private static InkValue arithmetic(BinaryOp op, InkValue left, InkValue right) {
        if (left instanceof Int l && right instanceof Int r) {
            long a = l.value();
            long b = r.value();
            return switch (op) {
                case ADD -> new Int(exact(() -> Math.addExact(a, b)));
                case SUBTRACT -> new Int(exact(() -> Math.subtractExact(a, b)));
                case MULTIPLY -> new Int(exact(() -> Math.multiplyExact(a, b)));
                case DIVIDE -> {
                    if (b == 0) throw new ExpressionException(ExpressionException.DIVISION_BY_ZERO, "Division by zero");
                    if (a == Long.MIN_VALUE && b == -1) throw overflow();
                    yield new Int(a / b);
                }
                case REMAINDER -> {
                    if (b == 0) throw new ExpressionException(ExpressionException.DIVISION_BY_ZERO, "Division by zero");
                    yield new Int(a % b);
                }
                default -> throw new IllegalArgumentException("Not arithmetic: " + op);
            };
        }
        if (numeric(left) && numeric(right)) {
            double a = asDouble(left);
            double b = asDouble(right);
            return switch (op) {
                case ADD -> new Decimal(a + b);
                case SUBTRACT -> new Decimal(a - b);
                case MULTIPLY -> new Decimal(a * b);
                case DIVIDE -> new Decimal(a / b);
                case REMAINDER -> new Decimal(a % b);
                default -> throw new IllegalArgumentException("Not arithmetic: " + op);
            };
        }
        throw mismatch(op.name().toLowerCase(), left, right);
    }

    private static boolean equal(InkValue left, InkValue right) {
        if (numeric(left) && numeric(right)) {
            return asDouble(left) == asDouble(right);
        }
        if (left.getClass() != right.getClass()) {
            throw mismatch("compare", left, right);
        }
        return Objects.equals(left, right);
    }

    private static InkValue compare(BinaryOp op, InkValue left, InkValue right) {
        int cmp;
        if (numeric(left) && numeric(right)) {
            cmp = Double.compare(asDouble(left), asDouble(right));
        } else if (left instanceof Text l && right instanceof Text r) {
            cmp = l.value().compareTo(r.value());
        } else {
            throw mismatch("compare", left, right);
        }
        return new Bool(switch (op) {
            case LESS -> cmp < 0;
            case LESS_OR_EQUAL -> cmp <= 0;
            case GREATER -> cmp > 0;
            case GREATER_OR_EQUAL -> cmp >= 0;
            default -> throw new IllegalArgumentException("Not a comparison: " + op);
        });
    }

    private static boolean numeric(InkValue value) {
        return value instanceof Int || value instanceof Decimal;
    }

    private static double asDouble(InkValue value) {
        return value instanceof Int i ? i.value() : ((Decimal) value).value();
    }

    private static ExpressionException mismatch(String what, InkValue left, InkValue right) {
        return new ExpressionException(ExpressionException.TYPE_MISMATCH,
                "Cannot " + what + " " + left.typeName() + " and " + right.typeName());
    }
}
