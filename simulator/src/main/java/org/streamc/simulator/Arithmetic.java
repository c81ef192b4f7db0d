package org.streamc.simulator;

import org.streamc.simulator.values.BoolValue;
import org.streamc.simulator.values.DoubleValue;
import org.streamc.simulator.values.FloatValue;
import org.streamc.simulator.values.IValue;
import org.streamc.simulator.values.IntegerValue;
import org.streamc.streamCompiler.compiler.backend.c.ir.expression.CBinaryExpression;

import java.util.List;
import java.util.function.DoubleUnaryOperator;

/** C operators and math library functions on simulated values.
 * Integer operations are computed on 64 bits; results are wrapped when stored. */
final class Arithmetic {
    private Arithmetic() {}

    static boolean isDouble(IValue value) {
        return value.is(DoubleValue.class);
    }

    static boolean isFloat(IValue value) {
        return value.is(FloatValue.class);
    }

    static IValue negate(IValue value) {
        if (isDouble(value))
            return new DoubleValue(-value.to(DoubleValue.class).value);
        if (isFloat(value))
            return new FloatValue(-value.to(FloatValue.class).value);
        return new IntegerValue(-TypeEnvironment.toLong(value));
    }

    static IValue binary(CBinaryExpression.Operator operator, IValue left, IValue right) {
        if (isDouble(left) || isDouble(right))
            return doubles(operator, TypeEnvironment.toDouble(left), TypeEnvironment.toDouble(right));
        if (isFloat(left) || isFloat(right)) {
            IValue result = doubles(operator,
                    (float) TypeEnvironment.toDouble(left), (float) TypeEnvironment.toDouble(right));
            if (result.is(DoubleValue.class))
                return new FloatValue((float) result.to(DoubleValue.class).value);
            return result;
        }
        return longs(operator, TypeEnvironment.toLong(left), TypeEnvironment.toLong(right));
    }

    static IValue doubles(CBinaryExpression.Operator operator, double left, double right) {
        return switch (operator) {
            case ADD -> new DoubleValue(left + right);
            case SUB -> new DoubleValue(left - right);
            case MUL -> new DoubleValue(left * right);
            case DIV -> new DoubleValue(left / right);
            case EQ -> BoolValue.of(left == right);
            case NE -> BoolValue.of(left != right);
            case LT -> BoolValue.of(left < right);
            case GT -> BoolValue.of(left > right);
            case LE -> BoolValue.of(left <= right);
            case GE -> BoolValue.of(left >= right);
            default -> throw new SimulatorException("Operator " + operator + " applied to floating point values");
        };
    }

    static IValue longs(CBinaryExpression.Operator operator, long left, long right) {
        return switch (operator) {
            case ADD -> new IntegerValue(left + right);
            case SUB -> new IntegerValue(left - right);
            case MUL -> new IntegerValue(left * right);
            case DIV -> {
                if (right == 0)
                    throw new SimulatorException("Division by zero");
                yield new IntegerValue(left / right);
            }
            case MOD -> {
                if (right == 0)
                    throw new SimulatorException("Division by zero");
                yield new IntegerValue(left % right);
            }
            case EQ -> BoolValue.of(left == right);
            case NE -> BoolValue.of(left != right);
            case LT -> BoolValue.of(left < right);
            case GT -> BoolValue.of(left > right);
            case LE -> BoolValue.of(left <= right);
            case GE -> BoolValue.of(left >= right);
            case BW_AND -> new IntegerValue(left & right);
            case BW_OR -> new IntegerValue(left | right);
            case BW_XOR -> new IntegerValue(left ^ right);
            case SHIFT_L -> new IntegerValue(left << right);
            case SHIFT_R -> new IntegerValue(left >> right);
            case AND, OR -> throw new SimulatorException("Unexpected operator " + operator);
        };
    }

    static IValue math(List<IValue> arguments, boolean single, DoubleUnaryOperator function) {
        if (arguments.size() != 1)
            throw new SimulatorException("Expected one argument, got " + arguments.size());
        double result = function.applyAsDouble(TypeEnvironment.toDouble(arguments.get(0)));
        if (single)
            return new FloatValue((float) result);
        return new DoubleValue(result);
    }

    /** Evaluate a call to a function of the C standard library. */
    static IValue libraryCall(String name, List<IValue> arguments) {
        boolean single = name.endsWith("f") && !name.equals("fabs");
        String base = single ? name.substring(0, name.length() - 1) : name;
        return switch (base) {
            case "abs", "llabs" -> new IntegerValue(Math.abs(TypeEnvironment.toLong(arguments.get(0))));
            case "fabs" -> math(arguments, single, Math::abs);
            case "exp" -> math(arguments, single, Math::exp);
            case "sqrt" -> math(arguments, single, Math::sqrt);
            case "log" -> math(arguments, single, Math::log);
            case "sin" -> math(arguments, single, Math::sin);
            case "cos" -> math(arguments, single, Math::cos);
            case "tan" -> math(arguments, single, Math::tan);
            case "asin" -> math(arguments, single, Math::asin);
            case "acos" -> math(arguments, single, Math::acos);
            case "atan" -> math(arguments, single, Math::atan);
            case "sinh" -> math(arguments, single, Math::sinh);
            case "cosh" -> math(arguments, single, Math::cosh);
            case "tanh" -> math(arguments, single, Math::tanh);
            case "asinh" -> math(arguments, single, x -> Math.log(x + Math.sqrt(x * x + 1)));
            case "acosh" -> math(arguments, single, x -> Math.log(x + Math.sqrt(x * x - 1)));
            case "atanh" -> math(arguments, single, x -> 0.5 * Math.log((1 + x) / (1 - x)));
            case "ceil" -> math(arguments, single, Math::ceil);
            case "floor" -> math(arguments, single, Math::floor);
            case "pow" -> {
                if (arguments.size() != 2)
                    throw new SimulatorException("pow expects two arguments");
                double result = Math.pow(TypeEnvironment.toDouble(arguments.get(0)),
                        TypeEnvironment.toDouble(arguments.get(1)));
                yield single ? new FloatValue((float) result) : new DoubleValue(result);
            }
            default -> throw new SimulatorException("Call to unknown function " + name);
        };
    }
}
