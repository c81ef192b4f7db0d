package org.streamc.streamCompiler.compiler.backend.c;

import org.junit.Assert;
import org.junit.Test;
import org.streamc.streamCompiler.compiler.backend.c.ir.CDeclaration;
import org.streamc.streamCompiler.compiler.backend.c.ir.CStructDeclaration;
import org.streamc.streamCompiler.compiler.backend.c.ir.CTypedefDeclaration;
import org.streamc.streamCompiler.compiler.visitors.inner.ExternalCollector;
import org.streamc.streamCompiler.compiler.visitors.inner.TypeCollector;
import org.streamc.streamCompiler.ir.SCSpec;
import org.streamc.streamCompiler.ir.SCStream;
import org.streamc.streamCompiler.ir.expression.SCDropExpression;
import org.streamc.streamCompiler.ir.expression.SCExternExpression;
import org.streamc.streamCompiler.ir.expression.literal.SCArrayLiteral;
import org.streamc.streamCompiler.ir.expression.literal.SCFloatLiteral;
import org.streamc.streamCompiler.ir.expression.literal.SCIntLiteral;
import org.streamc.streamCompiler.ir.expression.literal.SCLiteral;
import org.streamc.streamCompiler.ir.expression.literal.SCStructLiteral;
import org.streamc.streamCompiler.ir.type.derived.SCTypeArray;
import org.streamc.streamCompiler.ir.type.derived.SCTypeStruct;
import org.streamc.streamCompiler.ir.type.primitive.SCTypeFP;
import org.streamc.streamCompiler.ir.type.primitive.SCTypeInteger;

import java.util.List;

public class DeclarationSynthesizerTests {
    static final SCTypeArray PAIR = new SCTypeArray(SCTypeInteger.INT32, 2);

    static SCTypeStruct point() {
        return new SCTypeStruct("point", List.of(
                new SCTypeStruct.Field("x", 0, SCTypeInteger.INT32),
                new SCTypeStruct.Field("coords", 1, PAIR)));
    }

    static SCLiteral pair(int a, int b) {
        return new SCArrayLiteral(PAIR, List.of(new SCIntLiteral(a), new SCIntLiteral(b)));
    }

    static SynthesizedDeclarations synthesize(SCSpec spec) {
        DeclarationSynthesizer synthesizer = new DeclarationSynthesizer();
        return synthesizer.synthesize(spec,
                new TypeCollector().collect(spec), new ExternalCollector().collect(spec));
    }

    static String text(List<? extends CDeclaration> declarations) {
        StringBuilder builder = new StringBuilder();
        for (CDeclaration declaration: declarations)
            builder.append(ToCVisitor.toCString(declaration));
        return builder.toString();
    }

    @Test
    public void typesAreDeclaredAfterTheirDependencies() {
        SCTypeStruct point = point();
        SCLiteral origin = new SCStructLiteral(point, List.of(new SCIntLiteral(0), pair(1, 2)));
        SCStream stream = new SCStream(0, point, List.of(origin, origin), new SCDropExpression(point, 1, 0));
        SynthesizedDeclarations declarations = synthesize(new SCSpec(List.of(stream), List.of()));

        // the struct is found first, but its field type must be declared before it
        Assert.assertEquals(2, declarations.types().size());
        Assert.assertTrue(declarations.types().get(0).is(CTypedefDeclaration.class));
        Assert.assertTrue(declarations.types().get(1).is(CStructDeclaration.class));
        Assert.assertEquals("typedef int32_t array_int32_2[2];\n" +
                "struct point {\n" +
                "    int32_t x;\n" +
                "    array_int32_2 coords;\n" +
                "};\n", text(declarations.types()));
        Assert.assertEquals("static struct point s0[2] = {{0, {1, 2}}, {0, {1, 2}}};\n",
                text(declarations.buffers()));
        Assert.assertEquals("static size_t s0_idx = 0;\n", text(declarations.indices()));
        Assert.assertEquals("static struct point s0_tmp;\n", text(declarations.temporaries()));
    }

    @Test
    public void nestedArrays() {
        SCTypeArray matrix = new SCTypeArray(PAIR, 3);
        SCLiteral zero = new SCArrayLiteral(matrix, List.of(pair(0, 0), pair(0, 1), pair(1, 0)));
        SCStream stream = new SCStream(4, matrix, List.of(zero), new SCDropExpression(matrix, 0, 4));
        SynthesizedDeclarations declarations = synthesize(new SCSpec(List.of(stream), List.of()));

        Assert.assertEquals("array_array_int32_2_3", CTypes.arrayTypeName(matrix));
        Assert.assertEquals("typedef int32_t array_int32_2[2];\n" +
                "typedef array_int32_2 array_array_int32_2_3[3];\n", text(declarations.types()));
        Assert.assertEquals("static array_array_int32_2_3 s4[1] = {{{0, 0}, {0, 1}, {1, 0}}};\n",
                text(declarations.buffers()));
        Assert.assertEquals(1, declarations.layout().getStream(4).capacity());
    }

    @Test
    public void externalsAndSnapshots() {
        SCStream stream = new SCStream(0, SCTypeFP.DOUBLE,
                List.of(new SCFloatLiteral(1.5)),
                new SCExternExpression(SCTypeFP.DOUBLE, "speed"));
        SynthesizedDeclarations declarations = synthesize(new SCSpec(List.of(stream), List.of()));

        Assert.assertTrue(declarations.types().isEmpty());
        Assert.assertEquals("extern double speed;\n", text(declarations.externs()));
        Assert.assertEquals("static double speed_cpy;\n", text(declarations.snapshots()));
        Assert.assertEquals("static double s0[1] = {1.5};\n", text(declarations.buffers()));
        Assert.assertEquals("speed_cpy", declarations.layout().getExternal("speed").snapshotName());
    }

    @Test
    public void streamsKeepDeclarationOrder() {
        SCStream s2 = new SCStream(2, SCTypeInteger.UINT16, List.of(
                new SCIntLiteral(SCTypeInteger.UINT16, 7), new SCIntLiteral(SCTypeInteger.UINT16, 8)),
                new SCDropExpression(SCTypeInteger.UINT16, 1, 2));
        SCStream s0 = new SCStream(0, SCTypeInteger.INT64, List.of(new SCIntLiteral(SCTypeInteger.INT64, -1)),
                new SCDropExpression(SCTypeInteger.INT64, 0, 0));
        SynthesizedDeclarations declarations = synthesize(new SCSpec(List.of(s2, s0), List.of()));

        Assert.assertEquals("static uint16_t s2[2] = {7U, 8U};\n" +
                "static int64_t s0[1] = {-1LL};\n", text(declarations.buffers()));
        Assert.assertEquals("static size_t s2_idx = 0;\n" +
                "static size_t s0_idx = 0;\n", text(declarations.indices()));
        Assert.assertEquals("static uint16_t s2_tmp;\n" +
                "static int64_t s0_tmp;\n", text(declarations.temporaries()));
        Assert.assertEquals(2, declarations.layout().getStreams().get(0).streamId());
    }
}
