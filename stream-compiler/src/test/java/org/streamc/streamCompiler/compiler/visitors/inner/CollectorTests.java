package org.streamc.streamCompiler.compiler.visitors.inner;

import org.junit.Assert;
import org.junit.Test;
import org.streamc.streamCompiler.compiler.errors.InternalCompilerError;
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
import org.streamc.streamCompiler.ir.expression.literal.SCFloatLiteral;
import org.streamc.streamCompiler.ir.expression.literal.SCIntLiteral;
import org.streamc.streamCompiler.ir.expression.literal.SCLiteral;
import org.streamc.streamCompiler.ir.expression.literal.SCStructLiteral;
import org.streamc.streamCompiler.ir.type.SCType;
import org.streamc.streamCompiler.ir.type.derived.SCTypeArray;
import org.streamc.streamCompiler.ir.type.derived.SCTypeStruct;
import org.streamc.streamCompiler.ir.type.primitive.SCTypeBool;
import org.streamc.streamCompiler.ir.type.primitive.SCTypeFP;
import org.streamc.streamCompiler.ir.type.primitive.SCTypeInteger;

import java.util.List;

public class CollectorTests {
    static SCTypeStruct point() {
        return new SCTypeStruct("point", List.of(
                new SCTypeStruct.Field("x", 0, SCTypeInteger.INT32),
                new SCTypeStruct.Field("coords", 1, new SCTypeArray(SCTypeInteger.INT32, 2))));
    }

    static SCLiteral pointValue(SCTypeStruct type) {
        SCTypeArray pair = new SCTypeArray(SCTypeInteger.INT32, 2);
        return new SCStructLiteral(type, List.of(
                new SCIntLiteral(0),
                new SCArrayLiteral(pair, List.of(new SCIntLiteral(1), new SCIntLiteral(2)))));
    }

    @Test
    public void typesInDiscoveryOrder() {
        SCTypeStruct point = point();
        SCStream stream = new SCStream(0, point, List.of(pointValue(point)), new SCDropExpression(point, 0, 0));
        SCSpec spec = new SCSpec(List.of(stream), List.of());

        TypeCollector collector = new TypeCollector();
        List<SCType> types = collector.collect(spec);
        Assert.assertEquals(3, types.size());
        Assert.assertTrue(types.get(0).sameType(point));
        Assert.assertTrue(types.get(1).sameType(SCTypeInteger.INT32));
        Assert.assertTrue(types.get(2).sameType(new SCTypeArray(SCTypeInteger.INT32, 2)));
        Assert.assertEquals(2, collector.getStructuredTypes().size());
    }

    @Test
    public void structurallyEqualTypesAreCollectedOnce() {
        // Two distinct instances describing the same struct
        SCTypeStruct first = point();
        SCTypeStruct second = point();
        Assert.assertNotSame(first, second);
        SCStream s0 = new SCStream(0, first, List.of(pointValue(first)), new SCDropExpression(first, 0, 0));
        SCStream s1 = new SCStream(1, second, List.of(pointValue(second)), new SCDropExpression(second, 0, 1));
        SCSpec spec = new SCSpec(List.of(s0, s1), List.of());

        TypeCollector collector = new TypeCollector();
        List<SCType> types = collector.collect(spec);
        Assert.assertEquals(3, types.size());
        Assert.assertTrue(collector.contains(second));
        Assert.assertFalse(collector.contains(SCTypeBool.INSTANCE));
    }

    @Test
    public void externalsInFirstReferenceOrder() {
        SCExternExpression limit = new SCExternExpression(SCTypeInteger.INT32, "limit");
        SCExternExpression enabled = new SCExternExpression(SCTypeBool.INSTANCE, "enabled");
        SCExternExpression limitAgain = new SCExternExpression(SCTypeInteger.INT32, "limit");
        SCStream s0 = new SCStream(0, SCTypeInteger.INT32, List.of(new SCIntLiteral(0)),
                new SCApplyExpression(SCTypeInteger.INT32, SCOpcode.ADD, limit, limitAgain));
        SCTrigger trigger = new SCTrigger("notify", enabled, List.of(new SCDropExpression(SCTypeInteger.INT32, 0, 0)));
        SCSpec spec = new SCSpec(List.of(s0), List.of(trigger));

        List<SCExternal> externals = new ExternalCollector().collect(spec);
        Assert.assertEquals(2, externals.size());
        Assert.assertEquals("limit", externals.get(0).name());
        Assert.assertEquals("limit_cpy", externals.get(0).snapshotName());
        Assert.assertTrue(externals.get(0).type().sameType(SCTypeInteger.INT32));
        Assert.assertEquals("enabled", externals.get(1).name());
        Assert.assertEquals("enabled_cpy", externals.get(1).snapshotName());
    }

    @Test
    public void externalWithTwoTypesIsRejected() {
        SCExternExpression asBool = new SCExternExpression(SCTypeBool.INSTANCE, "flag");
        SCExternExpression asDouble = new SCExternExpression(SCTypeFP.DOUBLE, "flag");
        SCStream s0 = new SCStream(0, SCTypeBool.INSTANCE, List.of(new SCBoolLiteral(false)), asBool);
        SCStream s1 = new SCStream(1, SCTypeFP.DOUBLE, List.of(new SCFloatLiteral(0.0)), asDouble);
        SCSpec spec = new SCSpec(List.of(s0, s1), List.of());
        Assert.assertThrows(InternalCompilerError.class, () -> new ExternalCollector().collect(spec));
    }
}
