package org.streamc.streamCompiler.compiler.backend.c;

import org.junit.Assert;
import org.junit.Test;
import org.streamc.streamCompiler.compiler.CompilerOptions;
import org.streamc.streamCompiler.compiler.StreamCompiler;
import org.streamc.streamCompiler.compiler.backend.c.ir.CFunctionDefinition;
import org.streamc.streamCompiler.compiler.backend.c.ir.CInitList;
import org.streamc.streamCompiler.ir.SCExternal;
import org.streamc.streamCompiler.ir.SCSpec;
import org.streamc.streamCompiler.ir.SCStream;
import org.streamc.streamCompiler.ir.SCTrigger;
import org.streamc.streamCompiler.ir.expression.SCApplyExpression;
import org.streamc.streamCompiler.ir.expression.SCDropExpression;
import org.streamc.streamCompiler.ir.expression.SCExternExpression;
import org.streamc.streamCompiler.ir.expression.SCOpcode;
import org.streamc.streamCompiler.ir.expression.literal.SCArrayLiteral;
import org.streamc.streamCompiler.ir.expression.literal.SCBoolLiteral;
import org.streamc.streamCompiler.ir.expression.literal.SCIntLiteral;
import org.streamc.streamCompiler.ir.expression.literal.SCLiteral;
import org.streamc.streamCompiler.ir.expression.literal.SCStructLiteral;
import org.streamc.streamCompiler.ir.type.derived.SCTypeArray;
import org.streamc.streamCompiler.ir.type.derived.SCTypeStruct;
import org.streamc.streamCompiler.ir.type.primitive.SCTypeBool;
import org.streamc.streamCompiler.ir.type.primitive.SCTypeInteger;

import java.util.List;

public class StepAssemblerTests {
    static final SCTypeInteger INT32 = SCTypeInteger.INT32;
    static final SCTypeArray PAIR = new SCTypeArray(INT32, 2);

    static String implementation(SCSpec spec) {
        StreamCompiler compiler = new StreamCompiler(new CompilerOptions());
        return new CFileWriter(compiler.compile(spec)).getImplementation();
    }

    static String header(SCSpec spec) {
        StreamCompiler compiler = new StreamCompiler(new CompilerOptions());
        return new CFileWriter(compiler.compile(spec)).getHeader();
    }

    /** A Fibonacci stream feeding a trigger guarded by an external. */
    static SCSpec fibonacci() {
        SCStream fib = new SCStream(0, INT32, List.of(new SCIntLiteral(1), new SCIntLiteral(1)),
                new SCApplyExpression(INT32, SCOpcode.ADD,
                        new SCDropExpression(INT32, 0, 0), new SCDropExpression(INT32, 1, 0)));
        SCTrigger trigger = new SCTrigger("emit",
                new SCExternExpression(SCTypeBool.INSTANCE, "enabled"),
                List.of(new SCDropExpression(INT32, 1, 0)));
        return new SCSpec(List.of(fib), List.of(trigger));
    }

    @Test
    public void phasesAreOrdered() {
        String text = implementation(fibonacci());
        int snapshot = text.indexOf("    enabled_cpy = enabled;\n");
        int fire = text.indexOf("    if (emit_guard()) {\n        emit(emit_arg0());\n    }\n");
        int generate = text.indexOf("    s0_tmp = s0_gen();\n");
        int write = text.indexOf("    s0[s0_idx] = s0_tmp;\n");
        int advance = text.indexOf("    s0_idx = (s0_idx + 1) % 2;\n");
        Assert.assertTrue(text, snapshot > 0);
        Assert.assertTrue(text, fire > snapshot);
        Assert.assertTrue(text, generate > fire);
        Assert.assertTrue(text, write > generate);
        Assert.assertTrue(text, advance > write);
    }

    @Test
    public void generatorsReadTheBuffer() {
        String text = implementation(fibonacci());
        Assert.assertTrue(text, text.contains(
                "static int32_t s0_gen(void) {\n    return s0[s0_idx] + s0[(s0_idx + 1) % 2];\n}\n"));
        Assert.assertTrue(text, text.contains(
                "static bool emit_guard(void) {\n    return enabled_cpy;\n}\n"));
        Assert.assertTrue(text, text.contains(
                "static int32_t emit_arg0(void) {\n    return s0[(s0_idx + 1) % 2];\n}\n"));
        Assert.assertTrue(text, text.contains("static int32_t s0[2] = {1, 1};\n"));
    }

    @Test
    public void generatorOrder() {
        SCSpec spec = fibonacci();
        StateLayout layout = new StateLayout();
        layout.addStream(new StateLayout.StreamSlot(0, INT32, 2,
                new CInitList(List.of())));
        layout.addExternal(new SCExternal("enabled", SCTypeBool.INSTANCE));
        StepAssembler assembler = new StepAssembler(layout, "step");
        List<CFunctionDefinition> generators = assembler.generators(spec);
        Assert.assertEquals(3, generators.size());
        Assert.assertEquals("s0_gen", generators.get(0).name);
        Assert.assertEquals("emit_guard", generators.get(1).name);
        Assert.assertEquals("emit_arg0", generators.get(2).name);
        Assert.assertEquals("void emit(int32_t emit_arg0);\n",
                ToCVisitor.toCString(assembler.handlerPrototypes(spec).get(0)));
        Assert.assertEquals("void step(void);\n", ToCVisitor.toCString(assembler.stepPrototype()));
    }

    @Test
    public void arraysAreCopied() {
        SCLiteral initial = new SCArrayLiteral(PAIR, List.of(new SCIntLiteral(1), new SCIntLiteral(2)));
        SCStream stream = new SCStream(0, PAIR, List.of(initial), new SCExternExpression(PAIR, "v"));
        SCTrigger trigger = new SCTrigger("report", new SCBoolLiteral(true),
                List.of(new SCDropExpression(PAIR, 0, 0)));
        SCSpec spec = new SCSpec(List.of(stream), List.of(trigger));
        String text = implementation(spec);
        Assert.assertTrue(text, text.contains("static array_int32_2 s0[1] = {{1, 2}};\n"));
        Assert.assertTrue(text, text.contains("static array_int32_2 v_cpy;\n"));
        Assert.assertTrue(text, text.contains("static int32_t *s0_gen(void) {\n    return v_cpy;\n}\n"));
        Assert.assertTrue(text, text.contains("    memcpy(v_cpy, v, sizeof(v_cpy));\n"));
        Assert.assertTrue(text, text.contains("static array_int32_2 s0_tmp;\n"));
        Assert.assertTrue(text, text.contains("    memcpy(s0_tmp, s0_gen(), sizeof(s0_tmp));\n"));
        Assert.assertTrue(text, text.contains("    memcpy(s0[s0_idx], s0_tmp, sizeof(s0[s0_idx]));\n"));
        Assert.assertTrue(text, text.contains("static bool report_guard(void) {\n    return true;\n}\n"));

        String header = header(spec);
        Assert.assertTrue(header, header.contains("typedef int32_t array_int32_2[2];\n"));
        Assert.assertTrue(header, header.contains("extern array_int32_2 v;\n"));
        Assert.assertTrue(header, header.contains("void report(array_int32_2 report_arg0);\n"));
    }

    @Test
    public void structsAreAssigned() {
        SCTypeStruct point = new SCTypeStruct("point", List.of(
                new SCTypeStruct.Field("x", 0, INT32),
                new SCTypeStruct.Field("y", 1, INT32)));
        SCLiteral origin = new SCStructLiteral(point, List.of(new SCIntLiteral(0), new SCIntLiteral(0)));
        SCStream stream = new SCStream(0, point, List.of(origin), origin);
        String text = implementation(new SCSpec(List.of(stream), List.of()));
        Assert.assertTrue(text, text.contains("static struct point s0[1] = {{0, 0}};\n"));
        Assert.assertTrue(text, text.contains(
                "static struct point s0_gen(void) {\n    return (struct point){0, 0};\n}\n"));
        Assert.assertTrue(text, text.contains("static struct point s0_tmp;\n"));
        Assert.assertTrue(text, text.contains("    s0_tmp = s0_gen();\n    s0[s0_idx] = s0_tmp;\n"));
    }

    @Test
    public void allGeneratorsRunBeforeAnyWrite() {
        // s1 reads the value s0 had before the tick
        SCStream first = new SCStream(0, INT32, List.of(new SCIntLiteral(10)),
                new SCApplyExpression(INT32, SCOpcode.ADD, new SCDropExpression(INT32, 0, 0), new SCIntLiteral(1)));
        SCStream second = new SCStream(1, INT32, List.of(new SCIntLiteral(0)), new SCDropExpression(INT32, 0, 0));
        String text = implementation(new SCSpec(List.of(first, second), List.of()));
        Assert.assertTrue(text, text.contains("""
                void step(void) {
                    s0_tmp = s0_gen();
                    s1_tmp = s1_gen();
                    s0[s0_idx] = s0_tmp;
                    s1[s1_idx] = s1_tmp;
                    s0_idx = (s0_idx + 1) % 1;
                    s1_idx = (s1_idx + 1) % 1;
                }
                """));
        Assert.assertTrue(text, text.contains("static int32_t s0_tmp;\nstatic int32_t s1_tmp;\n"));
    }
}
