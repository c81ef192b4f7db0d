/*
 * Copyright 2022 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.streamc.streamCompiler.compiler.visitors.inner;

import org.streamc.streamCompiler.compiler.backend.c.CNames;
import org.streamc.streamCompiler.compiler.backend.c.CTypes;
import org.streamc.streamCompiler.compiler.backend.c.StateLayout;
import org.streamc.streamCompiler.compiler.backend.c.TranslatedExpression;
import org.streamc.streamCompiler.compiler.backend.c.ir.CInitExpression;
import org.streamc.streamCompiler.compiler.backend.c.ir.CInitList;
import org.streamc.streamCompiler.compiler.backend.c.ir.CInitializer;
import org.streamc.streamCompiler.compiler.backend.c.ir.CStorage;
import org.streamc.streamCompiler.compiler.backend.c.ir.CVariableDeclaration;
import org.streamc.streamCompiler.compiler.backend.c.ir.expression.CBinaryExpression;
import org.streamc.streamCompiler.compiler.backend.c.ir.expression.CBoolConstant;
import org.streamc.streamCompiler.compiler.backend.c.ir.expression.CCallExpression;
import org.streamc.streamCompiler.compiler.backend.c.ir.expression.CCastExpression;
import org.streamc.streamCompiler.compiler.backend.c.ir.expression.CCompoundLiteral;
import org.streamc.streamCompiler.compiler.backend.c.ir.expression.CConditionalExpression;
import org.streamc.streamCompiler.compiler.backend.c.ir.expression.CExpression;
import org.streamc.streamCompiler.compiler.backend.c.ir.expression.CFloatConstant;
import org.streamc.streamCompiler.compiler.backend.c.ir.expression.CIdentifier;
import org.streamc.streamCompiler.compiler.backend.c.ir.expression.CIndexExpression;
import org.streamc.streamCompiler.compiler.backend.c.ir.expression.CIntConstant;
import org.streamc.streamCompiler.compiler.backend.c.ir.expression.CMemberExpression;
import org.streamc.streamCompiler.compiler.backend.c.ir.expression.CUnaryExpression;
import org.streamc.streamCompiler.compiler.backend.c.ir.type.CTypeStruct;
import org.streamc.streamCompiler.compiler.errors.InternalCompilerError;
import org.streamc.streamCompiler.compiler.visitors.VisitDecision;
import org.streamc.streamCompiler.ir.expression.SCApplyExpression;
import org.streamc.streamCompiler.ir.expression.SCDropExpression;
import org.streamc.streamCompiler.ir.expression.SCExpression;
import org.streamc.streamCompiler.ir.expression.SCExternExpression;
import org.streamc.streamCompiler.ir.expression.SCLetExpression;
import org.streamc.streamCompiler.ir.expression.SCOpcode;
import org.streamc.streamCompiler.ir.expression.SCVariableExpression;
import org.streamc.streamCompiler.ir.expression.literal.SCArrayLiteral;
import org.streamc.streamCompiler.ir.expression.literal.SCBoolLiteral;
import org.streamc.streamCompiler.ir.expression.literal.SCFloatLiteral;
import org.streamc.streamCompiler.ir.expression.literal.SCIntLiteral;
import org.streamc.streamCompiler.ir.expression.literal.SCLiteral;
import org.streamc.streamCompiler.ir.expression.literal.SCStructLiteral;
import org.streamc.streamCompiler.ir.type.SCType;
import org.streamc.streamCompiler.ir.type.primitive.SCTypeFP;
import org.streamc.streamCompiler.ir.type.primitive.SCTypeInteger;
import org.streamc.util.Linq;
import org.streamc.util.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Translates one stream expression into a C expression.
 * Let bindings and array constants cannot be expressed inline;
 * they become local declarations of the enclosing function.
 * Expressions are translated in postorder, except for lets and
 * literals, which control the traversal of their children.
 */
public class ExpressionTranslator extends TranslateVisitor<CExpression> {
    final StateLayout layout;
    final List<CVariableDeclaration> locals;
    int literalCount;

    public ExpressionTranslator(StateLayout layout) {
        this.layout = layout;
        this.locals = new ArrayList<>();
        this.literalCount = 0;
    }

    public TranslatedExpression translate(SCExpression expression) {
        this.locals.clear();
        this.literalCount = 0;
        this.apply(expression);
        CExpression result = this.get(expression);
        Logger.INSTANCE.belowLevel(this, 2)
                .append("Translated ")
                .append(expression)
                .append(" to ")
                .append(result)
                .newline();
        return new TranslatedExpression(result, new ArrayList<>(this.locals));
    }

    /** A C integer constant with the suffix required by its type. */
    public static CIntConstant integer(SCTypeInteger type, long value) {
        return new CIntConstant(value, !type.signed, type.getWidth() == 64);
    }

    static CExpression number(SCType type, long value) {
        SCTypeFP fp = type.as(SCTypeFP.class);
        if (fp != null)
            return new CFloatConstant(value, fp.isFloat());
        return integer(type.to(SCTypeInteger.class), value);
    }

    /** The C constant for a scalar literal. */
    public static CExpression constant(SCLiteral literal) {
        SCBoolLiteral b = literal.as(SCBoolLiteral.class);
        if (b != null)
            return new CBoolConstant(b.value);
        SCIntLiteral i = literal.as(SCIntLiteral.class);
        if (i != null)
            return integer(i.getIntegerType(), i.value);
        SCFloatLiteral f = literal.as(SCFloatLiteral.class);
        if (f != null)
            return new CFloatConstant(f.value, f.isFloat());
        throw new InternalCompilerError("Not a scalar literal " + literal, literal);
    }

    /** Initializer for a static variable holding the value of a literal. */
    public static CInitializer initializer(SCLiteral literal) {
        SCArrayLiteral array = literal.as(SCArrayLiteral.class);
        if (array != null)
            return new CInitList(Linq.map(array.elements, ExpressionTranslator::initializer));
        SCStructLiteral struct = literal.as(SCStructLiteral.class);
        if (struct != null)
            return new CInitList(Linq.map(struct.values, ExpressionTranslator::initializer));
        return new CInitExpression(constant(literal));
    }

    @Override
    public VisitDecision preorder(SCExpression expression) {
        // Shared subexpressions are translated once
        if (this.maybeGet(expression) != null)
            return VisitDecision.STOP;
        return VisitDecision.CONTINUE;
    }

    @Override
    public void postorder(SCBoolLiteral literal) {
        this.set(literal, constant(literal));
    }

    @Override
    public void postorder(SCIntLiteral literal) {
        this.set(literal, constant(literal));
    }

    @Override
    public void postorder(SCFloatLiteral literal) {
        this.set(literal, constant(literal));
    }

    @Override
    public VisitDecision preorder(SCArrayLiteral literal) {
        if (this.maybeGet(literal) != null)
            return VisitDecision.STOP;
        String name = CNames.literal(this.literalCount++);
        this.locals.add(new CVariableDeclaration(
                CStorage.STATIC, CTypes.translate(literal.getType()), name, initializer(literal)));
        this.set(literal, new CIdentifier(name));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(SCStructLiteral literal) {
        if (this.maybeGet(literal) != null)
            return VisitDecision.STOP;
        CInitializer init = initializer(literal);
        this.set(literal, new CCompoundLiteral(
                new CTypeStruct(literal.getStructType().name), init.to(CInitList.class)));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(SCLetExpression expression) {
        if (this.maybeGet(expression) != null)
            return VisitDecision.STOP;
        expression.initializer.accept(this);
        CExpression init = this.get(expression.initializer);
        this.locals.add(new CVariableDeclaration(CStorage.NONE,
                CTypes.decay(expression.getVariableType()), expression.variable, new CInitExpression(init)));
        expression.body.accept(this);
        this.set(expression, this.get(expression.body));
        return VisitDecision.STOP;
    }

    @Override
    public void postorder(SCVariableExpression expression) {
        this.set(expression, new CIdentifier(expression.variable));
    }

    @Override
    public void postorder(SCExternExpression expression) {
        this.set(expression, new CIdentifier(this.layout.getExternal(expression.name).snapshotName()));
    }

    @Override
    public void postorder(SCDropExpression expression) {
        StateLayout.StreamSlot slot = this.layout.getStream(expression.streamId);
        int offset = slot.offset(expression.depth);
        CExpression index = new CIdentifier(slot.indexName());
        if (offset != 0)
            index = new CBinaryExpression(CBinaryExpression.Operator.MOD,
                    new CBinaryExpression(CBinaryExpression.Operator.ADD, index, new CIntConstant(offset)),
                    new CIntConstant(slot.capacity()));
        this.set(expression, new CIndexExpression(new CIdentifier(slot.bufferName()), index));
    }

    static String mathFunction(String name, SCType operandType) {
        SCTypeFP fp = operandType.as(SCTypeFP.class);
        if (fp != null && fp.isFloat())
            return name + "f";
        return name;
    }

    static CBinaryExpression.Operator binaryOperator(SCOpcode opcode) {
        return switch (opcode) {
            case AND -> CBinaryExpression.Operator.AND;
            case OR -> CBinaryExpression.Operator.OR;
            case ADD -> CBinaryExpression.Operator.ADD;
            case SUB -> CBinaryExpression.Operator.SUB;
            case MUL -> CBinaryExpression.Operator.MUL;
            case MOD -> CBinaryExpression.Operator.MOD;
            case DIV, FDIV -> CBinaryExpression.Operator.DIV;
            case EQ -> CBinaryExpression.Operator.EQ;
            case NE -> CBinaryExpression.Operator.NE;
            case LE -> CBinaryExpression.Operator.LE;
            case GE -> CBinaryExpression.Operator.GE;
            case LT -> CBinaryExpression.Operator.LT;
            case GT -> CBinaryExpression.Operator.GT;
            case BW_AND -> CBinaryExpression.Operator.BW_AND;
            case BW_OR -> CBinaryExpression.Operator.BW_OR;
            case BW_XOR -> CBinaryExpression.Operator.BW_XOR;
            case BW_SHIFT_L -> CBinaryExpression.Operator.SHIFT_L;
            case BW_SHIFT_R -> CBinaryExpression.Operator.SHIFT_R;
            default -> throw new InternalCompilerError("Not a binary operator " + opcode.name());
        };
    }

    CExpression abs(CExpression argument, SCType type) {
        SCTypeFP fp = type.as(SCTypeFP.class);
        if (fp != null)
            return new CCallExpression(fp.isFloat() ? "fabsf" : "fabs", argument);
        SCTypeInteger integer = type.to(SCTypeInteger.class);
        if (!integer.signed)
            return argument;
        if (integer.getWidth() == 64)
            return new CCallExpression("llabs", argument);
        return new CCallExpression("abs", argument);
    }

    CExpression sign(CExpression argument, SCType type) {
        CExpression zero = number(type, 0);
        CExpression positive = new CBinaryExpression(CBinaryExpression.Operator.GT, argument, zero);
        SCTypeInteger integer = type.as(SCTypeInteger.class);
        if (integer != null && !integer.signed)
            return new CConditionalExpression(positive, number(type, 1), number(type, 0));
        CExpression negative = new CBinaryExpression(CBinaryExpression.Operator.LT, argument, number(type, 0));
        return new CConditionalExpression(positive, number(type, 1),
                new CConditionalExpression(negative, number(type, -1), number(type, 0)));
    }

    @Override
    public void postorder(SCApplyExpression expression) {
        List<CExpression> args = Linq.map(expression.arguments, this::get);
        SCOpcode opcode = expression.getOpcode();
        SCType operandType = expression.getArgument(0).getType();
        CExpression result = switch (opcode) {
            case NOT -> new CUnaryExpression(CUnaryExpression.Operator.NOT, args.get(0));
            case BW_NOT -> new CUnaryExpression(CUnaryExpression.Operator.BW_NOT, args.get(0));
            case ABS -> this.abs(args.get(0), operandType);
            case SIGN -> this.sign(args.get(0), operandType);
            case RECIP -> new CBinaryExpression(CBinaryExpression.Operator.DIV,
                    number(operandType, 1), args.get(0));
            case EXP, SQRT, LOG, SIN, TAN, COS, ASIN, ATAN, ACOS, SINH, TANH, COSH,
                 ASINH, ATANH, ACOSH, CEILING, FLOOR, POW ->
                    new CCallExpression(mathFunction(opcode.toString(), operandType), args);
            case LOGB -> {
                // log_a(b)
                String log = mathFunction("log", operandType);
                yield new CBinaryExpression(CBinaryExpression.Operator.DIV,
                        new CCallExpression(log, args.get(1)),
                        new CCallExpression(log, args.get(0)));
            }
            case CAST -> new CCastExpression(CTypes.translate(expression.getType()), args.get(0));
            case GET_FIELD -> new CMemberExpression(args.get(0), expression.operator.getFieldName());
            case INDEX -> new CIndexExpression(args.get(0), args.get(1));
            case MUX -> new CConditionalExpression(args.get(0), args.get(1), args.get(2));
            default -> new CBinaryExpression(binaryOperator(opcode), args.get(0), args.get(1));
        };
        this.set(expression, result);
    }
}
