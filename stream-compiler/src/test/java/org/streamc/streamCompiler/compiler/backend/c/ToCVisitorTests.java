package org.streamc.streamCompiler.compiler.backend.c;

import org.junit.Assert;
import org.junit.Test;
import org.streamc.streamCompiler.compiler.backend.c.ir.CFunctionDefinition;
import org.streamc.streamCompiler.compiler.backend.c.ir.CParameter;
import org.streamc.streamCompiler.compiler.backend.c.ir.CStorage;
import org.streamc.streamCompiler.compiler.backend.c.ir.expression.CAssignExpression;
import org.streamc.streamCompiler.compiler.backend.c.ir.expression.CBinaryExpression;
import org.streamc.streamCompiler.compiler.backend.c.ir.expression.CConditionalExpression;
import org.streamc.streamCompiler.compiler.backend.c.ir.expression.CExpression;
import org.streamc.streamCompiler.compiler.backend.c.ir.expression.CFloatConstant;
import org.streamc.streamCompiler.compiler.backend.c.ir.expression.CIdentifier;
import org.streamc.streamCompiler.compiler.backend.c.ir.expression.CIntConstant;
import org.streamc.streamCompiler.compiler.backend.c.ir.expression.CUnaryExpression;
import org.streamc.streamCompiler.compiler.backend.c.ir.statement.CReturnStatement;
import org.streamc.streamCompiler.compiler.backend.c.ir.statement.CStatement;
import org.streamc.streamCompiler.compiler.backend.c.ir.type.CTypeArray;
import org.streamc.streamCompiler.compiler.backend.c.ir.type.CTypeName;
import org.streamc.streamCompiler.compiler.backend.c.ir.type.CTypePointer;
import org.streamc.streamCompiler.compiler.backend.c.ir.type.CTypeStruct;

import java.util.ArrayList;
import java.util.List;

public class ToCVisitorTests {
    @Test
    public void declarators() {
        CTypeName int32 = new CTypeName("int32_t");
        Assert.assertEquals("int32_t x", ToCVisitor.declarator(int32, "x"));
        Assert.assertEquals("int32_t *p", ToCVisitor.declarator(new CTypePointer(int32), "p"));
        Assert.assertEquals("int32_t b[4]", ToCVisitor.declarator(new CTypeArray(int32, 4), "b"));
        Assert.assertEquals("struct pt", ToCVisitor.declarator(new CTypeStruct("pt"), ""));
        Assert.assertEquals("int32_t m[2][3]",
                ToCVisitor.declarator(new CTypeArray(new CTypeArray(int32, 3), 2), "m"));
    }

    @Test
    public void constants() {
        Assert.assertEquals("7U", ToCVisitor.toCString(new CIntConstant(7, true, false)));
        Assert.assertEquals("18446744073709551615ULL", ToCVisitor.toCString(new CIntConstant(-1, true, true)));
        Assert.assertEquals("(-9223372036854775807LL - 1)",
                ToCVisitor.toCString(new CIntConstant(Long.MIN_VALUE, false, true)));
        Assert.assertEquals("0.5f", ToCVisitor.toCString(new CFloatConstant(0.5, true)));
        Assert.assertEquals("INFINITY", ToCVisitor.toCString(new CFloatConstant(Double.POSITIVE_INFINITY, false)));
        Assert.assertEquals("NAN", ToCVisitor.toCString(new CFloatConstant(Double.NaN, true)));
    }

    @Test
    public void negativeOperands() {
        CExpression x = new CIdentifier("x");
        CExpression infinity = new CFloatConstant(Double.NEGATIVE_INFINITY, false);
        Assert.assertEquals("-INFINITY", ToCVisitor.toCString(infinity));
        Assert.assertEquals("x - (-INFINITY)", ToCVisitor.toCString(
                new CBinaryExpression(CBinaryExpression.Operator.SUB, x, infinity)));
        Assert.assertEquals("-(-2.5)", ToCVisitor.toCString(
                new CUnaryExpression(CUnaryExpression.Operator.NEG, new CFloatConstant(-2.5, false))));
        Assert.assertEquals("-(-1)", ToCVisitor.toCString(
                new CUnaryExpression(CUnaryExpression.Operator.NEG, new CIntConstant(-1, false, false))));
        Assert.assertEquals("x * 3", ToCVisitor.toCString(
                new CBinaryExpression(CBinaryExpression.Operator.MUL, x, new CIntConstant(3, false, false))));
    }

    @Test
    public void parentheses() {
        CExpression a = new CIdentifier("a");
        CExpression b = new CIdentifier("b");
        CExpression sum = new CBinaryExpression(CBinaryExpression.Operator.ADD, a, b);
        CExpression product = new CBinaryExpression(CBinaryExpression.Operator.MUL, sum, sum);
        Assert.assertEquals("(a + b) * (a + b)", ToCVisitor.toCString(product));
        Assert.assertEquals("-(a + b)",
                ToCVisitor.toCString(new CUnaryExpression(CUnaryExpression.Operator.NEG, sum)));
        CExpression nested = new CConditionalExpression(a,
                new CConditionalExpression(b, a, b), new CConditionalExpression(b, b, a));
        Assert.assertEquals("a ? b ? a : b : (b ? b : a)", ToCVisitor.toCString(nested));
        Assert.assertEquals("a = a + b", ToCVisitor.toCString(new CAssignExpression(a, sum)));
    }

    @Test
    public void functionDefinition() {
        List<CStatement> body = new ArrayList<>();
        body.add(new CReturnStatement(new CIdentifier("x")));
        CFunctionDefinition function = new CFunctionDefinition(CStorage.STATIC,
                new CTypePointer(new CTypeName("double")), "f",
                List.of(new CParameter(new CTypePointer(new CTypeName("double")), "x")),
                new ArrayList<>(), body);
        Assert.assertEquals("static double *f(double *x) {\n    return x;\n}\n", ToCVisitor.toCString(function));
    }
}
