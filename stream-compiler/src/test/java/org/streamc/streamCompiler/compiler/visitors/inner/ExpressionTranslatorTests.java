package org.streamc.streamCompiler.compiler.visitors.inner;

import org.junit.Assert;
import org.junit.Test;
import org.streamc.streamCompiler.compiler.backend.c.StateLayout;
import org.streamc.streamCompiler.compiler.backend.c.ToCVisitor;
import org.streamc.streamCompiler.compiler.backend.c.TranslatedExpression;
import org.streamc.streamCompiler.compiler.backend.c.ir.CInitList;
import org.streamc.streamCompiler.compiler.errors.InternalCompilerError;
import org.streamc.streamCompiler.ir.SCExternal;
import org.streamc.streamCompiler.ir.expression.SCApplyExpression;
import org.streamc.streamCompiler.ir.expression.SCDropExpression;
import org.streamc.streamCompiler.ir.expression.SCExpression;
import org.streamc.streamCompiler.ir.expression.SCExternExpression;
import org.streamc.streamCompiler.ir.expression.SCLetExpression;
import org.streamc.streamCompiler.ir.expression.SCOpcode;
import org.streamc.streamCompiler.ir.expression.SCOperator;
import org.streamc.streamCompiler.ir.expression.SCVariableExpression;
import org.streamc.streamCompiler.ir.expression.literal.SCArrayLiteral;
import org.streamc.streamCompiler.ir.expression.literal.SCIntLiteral;
import org.streamc.streamCompiler.ir.expression.literal.SCStructLiteral;
import org.streamc.streamCompiler.ir.type.SCType;
import org.streamc.streamCompiler.ir.type.derived.SCTypeArray;
import org.streamc.streamCompiler.ir.type.derived.SCTypeStruct;
import org.streamc.streamCompiler.ir.type.primitive.SCTypeBool;
import org.streamc.streamCompiler.ir.type.primitive.SCTypeFP;
import org.streamc.streamCompiler.ir.type.primitive.SCTypeInteger;

import java.util.List;

public class ExpressionTranslatorTests {
    static final SCTypeInteger INT32 = SCTypeInteger.INT32;

    static SCTypeStruct point() {
        return new SCTypeStruct("point", List.of(
                new SCTypeStruct.Field("x", 0, INT32),
                new SCTypeStruct.Field("coords", 1, new SCTypeArray(INT32, 2))));
    }

    /** Stream 0 holds three int32 values; externals of various types. */
    static StateLayout layout() {
        StateLayout layout = new StateLayout();
        layout.addStream(new StateLayout.StreamSlot(0, INT32, 3, new CInitList(List.of())));
        layout.addStream(new StateLayout.StreamSlot(1, INT32, 1, new CInitList(List.of())));
        layout.addExternal(new SCExternal("f", SCTypeFP.FLOAT));
        layout.addExternal(new SCExternal("d", SCTypeFP.DOUBLE));
        layout.addExternal(new SCExternal("e", SCTypeFP.DOUBLE));
        layout.addExternal(new SCExternal("u", SCTypeInteger.UINT8));
        layout.addExternal(new SCExternal("l", SCTypeInteger.INT64));
        layout.addExternal(new SCExternal("b", SCTypeBool.INSTANCE));
        layout.addExternal(new SCExternal("p", point()));
        return layout;
    }

    static SCExpression extern(String name, SCType type) {
        return new SCExternExpression(type, name);
    }

    static SCExpression drop(int depth) {
        return new SCDropExpression(INT32, depth, 0);
    }

    static String translate(SCExpression expression) {
        ExpressionTranslator translator = new ExpressionTranslator(layout());
        TranslatedExpression result = translator.translate(expression);
        Assert.assertTrue(result.locals().isEmpty());
        return ToCVisitor.toCString(result.expression());
    }

    @Test
    public void dropUsesBufferOffset() {
        Assert.assertEquals("s0[s0_idx]", translate(drop(0)));
        Assert.assertEquals("s0[(s0_idx + 2) % 3]", translate(drop(1)));
        Assert.assertEquals("s0[(s0_idx + 1) % 3]", translate(drop(2)));
        Assert.assertEquals("s1[s1_idx]", translate(new SCDropExpression(INT32, 0, 1)));
    }

    @Test
    public void dropBeyondBufferIsRejected() {
        Assert.assertThrows(InternalCompilerError.class, () -> translate(drop(3)));
    }

    @Test
    public void externReadsSnapshot() {
        Assert.assertEquals("d_cpy", translate(extern("d", SCTypeFP.DOUBLE)));
        Assert.assertEquals("p_cpy.x", translate(new SCApplyExpression(
                INT32, SCOperator.getField("x"), extern("p", point()))));
    }

    @Test
    public void operators() {
        SCExpression sum = new SCApplyExpression(INT32, SCOpcode.ADD, drop(0), new SCIntLiteral(1));
        Assert.assertEquals("s0[s0_idx] + 1", translate(sum));
        SCExpression product = new SCApplyExpression(INT32, SCOpcode.MUL, sum, drop(1));
        Assert.assertEquals("(s0[s0_idx] + 1) * s0[(s0_idx + 2) % 3]", translate(product));
        Assert.assertEquals("(double)s0[s0_idx]",
                translate(new SCApplyExpression(SCTypeFP.DOUBLE, SCOpcode.CAST, drop(0))));
        Assert.assertEquals("b_cpy ? s0[s0_idx] : 1", translate(new SCApplyExpression(
                INT32, SCOpcode.MUX, extern("b", SCTypeBool.INSTANCE), drop(0), new SCIntLiteral(1))));
        Assert.assertEquals("!b_cpy", translate(new SCApplyExpression(
                SCTypeBool.INSTANCE, SCOpcode.NOT, extern("b", SCTypeBool.INSTANCE))));
        Assert.assertEquals("s0[s0_idx] >> 1", translate(new SCApplyExpression(
                INT32, SCOpcode.BW_SHIFT_R, drop(0), new SCIntLiteral(1))));
    }

    @Test
    public void sharedSubexpressionIsTranslatedOnce() {
        SCExpression current = drop(0);
        SCExpression twice = new SCApplyExpression(INT32, SCOpcode.ADD, current, current);
        Assert.assertEquals("s0[s0_idx] + s0[s0_idx]", translate(twice));
    }

    @Test
    public void mathFunctionsFollowOperandWidth() {
        Assert.assertEquals("sqrtf(f_cpy)", translate(
                new SCApplyExpression(SCTypeFP.FLOAT, SCOpcode.SQRT, extern("f", SCTypeFP.FLOAT))));
        Assert.assertEquals("sqrt(d_cpy)", translate(
                new SCApplyExpression(SCTypeFP.DOUBLE, SCOpcode.SQRT, extern("d", SCTypeFP.DOUBLE))));
        Assert.assertEquals("pow(d_cpy, e_cpy)", translate(new SCApplyExpression(SCTypeFP.DOUBLE, SCOpcode.POW,
                extern("d", SCTypeFP.DOUBLE), extern("e", SCTypeFP.DOUBLE))));
        Assert.assertEquals("ceilf(f_cpy)", translate(
                new SCApplyExpression(SCTypeFP.FLOAT, SCOpcode.CEILING, extern("f", SCTypeFP.FLOAT))));
        Assert.assertEquals("log(e_cpy) / log(d_cpy)", translate(new SCApplyExpression(SCTypeFP.DOUBLE,
                SCOpcode.LOGB, extern("d", SCTypeFP.DOUBLE), extern("e", SCTypeFP.DOUBLE))));
        Assert.assertEquals("1.0 / d_cpy", translate(
                new SCApplyExpression(SCTypeFP.DOUBLE, SCOpcode.RECIP, extern("d", SCTypeFP.DOUBLE))));
    }

    @Test
    public void absAndSign() {
        Assert.assertEquals("fabsf(f_cpy)", translate(
                new SCApplyExpression(SCTypeFP.FLOAT, SCOpcode.ABS, extern("f", SCTypeFP.FLOAT))));
        Assert.assertEquals("abs(s0[s0_idx])", translate(new SCApplyExpression(INT32, SCOpcode.ABS, drop(0))));
        Assert.assertEquals("llabs(l_cpy)", translate(new SCApplyExpression(
                SCTypeInteger.INT64, SCOpcode.ABS, extern("l", SCTypeInteger.INT64))));
        // unsigned values are their own absolute value
        Assert.assertEquals("u_cpy", translate(new SCApplyExpression(
                SCTypeInteger.UINT8, SCOpcode.ABS, extern("u", SCTypeInteger.UINT8))));

        Assert.assertEquals("s0[s0_idx] > 0 ? 1 : (s0[s0_idx] < 0 ? -1 : 0)",
                translate(new SCApplyExpression(INT32, SCOpcode.SIGN, drop(0))));
        Assert.assertEquals("u_cpy > 0U ? 1U : 0U", translate(new SCApplyExpression(
                SCTypeInteger.UINT8, SCOpcode.SIGN, extern("u", SCTypeInteger.UINT8))));
        Assert.assertEquals("d_cpy > 0.0 ? 1.0 : (d_cpy < 0.0 ? -1.0 : 0.0)", translate(new SCApplyExpression(
                SCTypeFP.DOUBLE, SCOpcode.SIGN, extern("d", SCTypeFP.DOUBLE))));
    }

    @Test
    public void letBecomesLocal() {
        SCExpression init = new SCApplyExpression(INT32, SCOpcode.ADD, drop(0), new SCIntLiteral(1));
        SCExpression body = new SCApplyExpression(INT32, SCOpcode.MUL,
                new SCVariableExpression("v", INT32), new SCVariableExpression("v", INT32));
        ExpressionTranslator translator = new ExpressionTranslator(layout());
        TranslatedExpression result = translator.translate(new SCLetExpression("v", init, body));
        Assert.assertEquals("v * v", ToCVisitor.toCString(result.expression()));
        Assert.assertEquals(1, result.locals().size());
        Assert.assertEquals("int32_t v = s0[s0_idx] + 1;\n", ToCVisitor.toCString(result.locals().get(0)));
    }

    @Test
    public void arrayLiteralIsHoisted() {
        SCTypeArray triple = new SCTypeArray(INT32, 3);
        SCArrayLiteral array = new SCArrayLiteral(triple,
                List.of(new SCIntLiteral(10), new SCIntLiteral(20), new SCIntLiteral(30)));
        SCExpression element = new SCApplyExpression(INT32, SCOpcode.INDEX, array, new SCIntLiteral(1));
        ExpressionTranslator translator = new ExpressionTranslator(layout());
        TranslatedExpression result = translator.translate(element);
        Assert.assertEquals("lit0[1]", ToCVisitor.toCString(result.expression()));
        Assert.assertEquals(1, result.locals().size());
        Assert.assertEquals("static array_int32_3 lit0 = {10, 20, 30};\n",
                ToCVisitor.toCString(result.locals().get(0)));

        // Numbering restarts for each translated expression
        TranslatedExpression again = translator.translate(element);
        Assert.assertEquals("lit0[1]", ToCVisitor.toCString(again.expression()));
        Assert.assertEquals(1, again.locals().size());
    }

    @Test
    public void structLiteralIsCompoundLiteral() {
        SCTypeStruct point = point();
        SCStructLiteral value = new SCStructLiteral(point, List.of(
                new SCIntLiteral(1),
                new SCArrayLiteral(new SCTypeArray(INT32, 2), List.of(new SCIntLiteral(2), new SCIntLiteral(3)))));
        Assert.assertEquals("(struct point){1, {2, 3}}", translate(value));
    }
}
