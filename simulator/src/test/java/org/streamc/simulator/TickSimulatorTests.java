package org.streamc.simulator;

import org.junit.Assert;
import org.junit.Test;
import org.streamc.simulator.values.ArrayValue;
import org.streamc.simulator.values.BoolValue;
import org.streamc.simulator.values.DoubleValue;
import org.streamc.simulator.values.FloatValue;
import org.streamc.simulator.values.IValue;
import org.streamc.simulator.values.IntegerValue;
import org.streamc.simulator.values.StructValue;
import org.streamc.streamCompiler.compiler.CompilerOptions;
import org.streamc.streamCompiler.compiler.StreamCompiler;
import org.streamc.streamCompiler.compiler.backend.c.CProgram;
import org.streamc.streamCompiler.ir.SCSpec;
import org.streamc.streamCompiler.ir.SCStream;
import org.streamc.streamCompiler.ir.SCTrigger;
import org.streamc.streamCompiler.ir.expression.SCApplyExpression;
import org.streamc.streamCompiler.ir.expression.SCDropExpression;
import org.streamc.streamCompiler.ir.expression.SCExpression;
import org.streamc.streamCompiler.ir.expression.SCExternExpression;
import org.streamc.streamCompiler.ir.expression.SCLetExpression;
import org.streamc.streamCompiler.ir.expression.SCOpcode;
import org.streamc.streamCompiler.ir.expression.SCOperator;
import org.streamc.streamCompiler.ir.expression.SCVariableExpression;
import org.streamc.streamCompiler.ir.expression.literal.SCArrayLiteral;
import org.streamc.streamCompiler.ir.expression.literal.SCBoolLiteral;
import org.streamc.streamCompiler.ir.expression.literal.SCFloatLiteral;
import org.streamc.streamCompiler.ir.expression.literal.SCIntLiteral;
import org.streamc.streamCompiler.ir.expression.literal.SCLiteral;
import org.streamc.streamCompiler.ir.expression.literal.SCStructLiteral;
import org.streamc.streamCompiler.ir.type.derived.SCTypeArray;
import org.streamc.streamCompiler.ir.type.derived.SCTypeStruct;
import org.streamc.streamCompiler.ir.type.primitive.SCTypeBool;
import org.streamc.streamCompiler.ir.type.primitive.SCTypeFP;
import org.streamc.streamCompiler.ir.type.primitive.SCTypeInteger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

public class TickSimulatorTests {
    static final SCTypeInteger INT32 = SCTypeInteger.INT32;
    static final SCTypeArray PAIR = new SCTypeArray(INT32, 2);

    static TickSimulator simulate(SCSpec spec, Host host) {
        CProgram program = new StreamCompiler(new CompilerOptions()).compile(spec);
        return new TickSimulator(program, host);
    }

    static SCExpression drop(int depth, int streamId) {
        return new SCDropExpression(INT32, depth, streamId);
    }

    static SCExpression plus(SCExpression left, SCExpression right) {
        return new SCApplyExpression(INT32, SCOpcode.ADD, left, right);
    }

    static SCExpression always() {
        return new SCBoolLiteral(true);
    }

    static IValue integer(long value) {
        return new IntegerValue(value);
    }

    @Test
    public void bufferAndIndex() {
        SCStream stream = new SCStream(0, INT32,
                List.of(new SCIntLiteral(1), new SCIntLiteral(2), new SCIntLiteral(3)),
                plus(drop(1, 0), new SCIntLiteral(1)));
        TickSimulator simulator = simulate(new SCSpec(List.of(stream), List.of()), new Host());
        Assert.assertEquals(0, simulator.getArena().index(0));

        simulator.step();
        // drop 1 at index 0 reads position 2
        Assert.assertEquals(new ArrayValue(integer(4), integer(2), integer(3)), simulator.getArena().buffer(0));
        Assert.assertEquals(1, simulator.getArena().index(0));

        simulator.run(2);
        Assert.assertEquals(new ArrayValue(integer(4), integer(5), integer(6)), simulator.getArena().buffer(0));
        Assert.assertEquals(0, simulator.getArena().index(0));
        Assert.assertEquals(3, simulator.getTick());
    }

    @Test
    public void indexStaysInRange() {
        SCStream stream = new SCStream(0, INT32,
                List.of(new SCIntLiteral(0), new SCIntLiteral(0)), plus(drop(0, 0), new SCIntLiteral(1)));
        TickSimulator simulator = simulate(new SCSpec(List.of(stream), List.of()), new Host());
        for (int i = 0; i < 7; i++) {
            simulator.step();
            long index = simulator.getArena().index(0);
            Assert.assertTrue(index >= 0 && index < 2);
            Assert.assertEquals((i + 1) % 2, index);
        }
    }

    @Test
    public void streamsReadTheStateBeforeTheTick() {
        SCStream counter = new SCStream(0, INT32, List.of(new SCIntLiteral(10)), plus(drop(0, 0), new SCIntLiteral(1)));
        SCStream follower = new SCStream(1, INT32, List.of(new SCIntLiteral(0)), drop(0, 0));
        TickSimulator simulator = simulate(new SCSpec(List.of(counter, follower), List.of()), new Host());
        simulator.step();
        Assert.assertEquals(integer(11), simulator.getArena().buffer(0).get(0));
        Assert.assertEquals(integer(10), simulator.getArena().buffer(1).get(0));
        simulator.step();
        Assert.assertEquals(integer(12), simulator.getArena().buffer(0).get(0));
        Assert.assertEquals(integer(11), simulator.getArena().buffer(1).get(0));
    }

    @Test
    public void fibonacci() {
        SCStream fib = new SCStream(0, INT32, List.of(new SCIntLiteral(1), new SCIntLiteral(1)),
                plus(drop(0, 0), drop(1, 0)));
        SCTrigger trigger = new SCTrigger("value", always(), List.of(drop(0, 0)));
        Host host = new Host();
        TickSimulator simulator = simulate(new SCSpec(List.of(fib), List.of(trigger)), host);
        simulator.run(6);
        List<IValue> values = new ArrayList<>();
        for (Host.Firing firing: host.getFirings("value"))
            values.add(firing.arguments().get(0));
        Assert.assertEquals(List.of(integer(1), integer(1), integer(2), integer(3), integer(5), integer(8)), values);
    }

    @Test
    public void snapshotIsolatesTheTick() {
        // the handler changes the external while the tick is running
        SCStream stream = new SCStream(0, INT32, List.of(new SCIntLiteral(0)), new SCExternExpression(INT32, "x"));
        SCTrigger trigger = new SCTrigger("observe", always(), List.of(new SCExternExpression(INT32, "x")));
        Host host = new Host().setExternal("x", integer(5));
        host.onTrigger("observe", arguments -> host.setExternal("x", integer(100)));
        TickSimulator simulator = simulate(new SCSpec(List.of(stream), List.of(trigger)), host);

        simulator.step();
        Assert.assertEquals(integer(5), host.getFirings().get(0).arguments().get(0));
        Assert.assertEquals(integer(5), simulator.getArena().buffer(0).get(0));
        Assert.assertEquals(integer(5), simulator.getArena().getValue("x_cpy"));

        simulator.step();
        Assert.assertEquals(integer(100), host.getFirings().get(1).arguments().get(0));
        Assert.assertEquals(integer(100), simulator.getArena().buffer(0).get(0));
    }

    @Test
    public void triggersFireInOrderWithOrderedArguments() {
        SCStream flag = new SCStream(0, SCTypeBool.INSTANCE, List.of(new SCBoolLiteral(true)),
                new SCApplyExpression(SCTypeBool.INSTANCE, SCOpcode.NOT, new SCDropExpression(SCTypeBool.INSTANCE, 0, 0)));
        SCExpression current = new SCDropExpression(SCTypeBool.INSTANCE, 0, 0);
        SCTrigger first = new SCTrigger("first", current, List.of(new SCIntLiteral(1), new SCIntLiteral(2)));
        SCTrigger second = new SCTrigger("second", always(),
                List.of(new SCDropExpression(SCTypeBool.INSTANCE, 0, 0), new SCFloatLiteral(2.5)));
        Host host = new Host();
        TickSimulator simulator = simulate(new SCSpec(List.of(flag), List.of(first, second)), host);
        simulator.run(3);

        List<Host.Firing> firings = host.getFirings();
        Assert.assertEquals(5, firings.size());
        Assert.assertEquals("first", firings.get(0).trigger());
        Assert.assertEquals(List.of(integer(1), integer(2)), firings.get(0).arguments());
        Assert.assertEquals("second", firings.get(1).trigger());
        Assert.assertEquals(List.of(BoolValue.TRUE, new DoubleValue(2.5)), firings.get(1).arguments());
        // tick 1: the guard of 'first' is false
        Assert.assertEquals("second", firings.get(2).trigger());
        Assert.assertEquals(1, firings.get(2).tick());
        Assert.assertEquals(BoolValue.FALSE, firings.get(2).arguments().get(0));
        Assert.assertEquals("first", firings.get(3).trigger());
        Assert.assertEquals(2, firings.get(3).tick());
        Assert.assertEquals(2, host.getFirings("first").size());
    }

    @Test
    public void arrayStreamsAreCopied() {
        SCLiteral initial = new SCArrayLiteral(PAIR, List.of(new SCIntLiteral(1), new SCIntLiteral(2)));
        SCStream stream = new SCStream(0, PAIR, List.of(initial), new SCExternExpression(PAIR, "v"));
        SCTrigger trigger = new SCTrigger("report", always(), List.of(new SCDropExpression(PAIR, 0, 0)));
        ArrayValue input = new ArrayValue(integer(3), integer(4));
        Host host = new Host().setExternal("v", input);
        TickSimulator simulator = simulate(new SCSpec(List.of(stream), List.of(trigger)), host);

        simulator.step();
        // the trigger sees the value before the buffer is written
        Assert.assertEquals(new ArrayValue(integer(1), integer(2)), host.getFirings().get(0).arguments().get(0));
        Assert.assertEquals(new ArrayValue(integer(3), integer(4)), simulator.getArena().buffer(0).get(0));

        input.set(0, integer(30));
        Assert.assertEquals(new ArrayValue(integer(3), integer(4)), simulator.getArena().buffer(0).get(0));
        Assert.assertEquals(new ArrayValue(integer(3), integer(4)), simulator.getArena().getValue("v_cpy"));
    }

    @Test
    public void structStreams() {
        SCTypeStruct point = new SCTypeStruct("point", List.of(
                new SCTypeStruct.Field("x", 0, INT32),
                new SCTypeStruct.Field("y", 1, INT32)));
        SCLiteral origin = new SCStructLiteral(point, List.of(new SCIntLiteral(0), new SCIntLiteral(0)));
        SCStream points = new SCStream(0, point, List.of(origin), new SCExternExpression(point, "p"));
        SCStream sum = new SCStream(1, INT32, List.of(new SCIntLiteral(0)), plus(
                new SCApplyExpression(INT32, SCOperator.getField("x"),
                        new SCDropExpression(point, 0, 0)),
                new SCApplyExpression(INT32, SCOperator.getField("y"),
                        new SCExternExpression(point, "p"))));
        LinkedHashMap<String, IValue> fields = new LinkedHashMap<>();
        fields.put("x", integer(1));
        fields.put("y", integer(2));
        Host host = new Host().setExternal("p", new StructValue("point", fields));
        TickSimulator simulator = simulate(new SCSpec(List.of(points, sum), List.of()), host);

        simulator.step();
        Assert.assertEquals(host.getExternal("p"), simulator.getArena().buffer(0).get(0));
        // x of the previous point plus y of the current one
        Assert.assertEquals(integer(2), simulator.getArena().buffer(1).get(0));
        simulator.step();
        Assert.assertEquals(integer(3), simulator.getArena().buffer(1).get(0));
    }

    @Test
    public void unsignedValuesWrap() {
        SCTypeInteger uint8 = SCTypeInteger.UINT8;
        SCStream stream = new SCStream(0, uint8, List.of(new SCIntLiteral(uint8, 250)),
                new SCApplyExpression(uint8, SCOpcode.ADD,
                        new SCDropExpression(uint8, 0, 0), new SCIntLiteral(uint8, 10)));
        TickSimulator simulator = simulate(new SCSpec(List.of(stream), List.of()), new Host());
        simulator.step();
        Assert.assertEquals(integer(4), simulator.getArena().buffer(0).get(0));
    }

    @Test
    public void letsAndArrayConstants() {
        SCStream selector = new SCStream(1, INT32, List.of(new SCIntLiteral(2)), drop(0, 1));
        SCArrayLiteral table = new SCArrayLiteral(new SCTypeArray(INT32, 3),
                List.of(new SCIntLiteral(10), new SCIntLiteral(20), new SCIntLiteral(30)));
        SCExpression element = new SCApplyExpression(INT32, SCOpcode.INDEX, table, drop(0, 1));
        SCExpression doubled = new SCLetExpression("e", element,
                plus(new SCVariableExpression("e", INT32), new SCVariableExpression("e", INT32)));
        SCStream result = new SCStream(0, INT32, List.of(new SCIntLiteral(0)), doubled);
        TickSimulator simulator = simulate(new SCSpec(List.of(result, selector), List.of()), new Host());
        simulator.run(2);
        Assert.assertEquals(integer(60), simulator.getArena().buffer(0).get(0));
        Assert.assertTrue(simulator.getArena().getNames().contains("s0_gen.lit0"));
    }

    @Test
    public void floatingPoint() {
        SCStream half = new SCStream(0, SCTypeFP.FLOAT, List.of(new SCFloatLiteral(SCTypeFP.FLOAT, 1.0)),
                new SCApplyExpression(SCTypeFP.FLOAT, SCOpcode.MUL,
                        new SCDropExpression(SCTypeFP.FLOAT, 0, 0), new SCFloatLiteral(SCTypeFP.FLOAT, 0.5)));
        SCStream root = new SCStream(1, SCTypeFP.DOUBLE, List.of(new SCFloatLiteral(0.0)),
                new SCApplyExpression(SCTypeFP.DOUBLE, SCOpcode.SQRT, new SCExternExpression(SCTypeFP.DOUBLE, "d")));
        SCStream sign = new SCStream(2, INT32, List.of(new SCIntLiteral(0)),
                new SCApplyExpression(INT32, SCOpcode.SIGN, new SCExternExpression(INT32, "n")));
        Host host = new Host()
                .setExternal("d", new DoubleValue(16.0))
                .setExternal("n", integer(-7));
        TickSimulator simulator = simulate(new SCSpec(List.of(half, root, sign), List.of()), host);
        simulator.run(2);
        Assert.assertEquals(new FloatValue(0.25f), simulator.getArena().buffer(0).get(0));
        Assert.assertEquals(new DoubleValue(4.0), simulator.getArena().buffer(1).get(0));
        Assert.assertEquals(integer(-1), simulator.getArena().buffer(2).get(0));
    }

    @Test
    public void divisionByZero() {
        SCStream stream = new SCStream(0, INT32, List.of(new SCIntLiteral(0)),
                new SCApplyExpression(INT32, SCOpcode.DIV, new SCIntLiteral(10), drop(0, 0)));
        TickSimulator simulator = simulate(new SCSpec(List.of(stream), List.of()), new Host());
        Assert.assertThrows(SimulatorException.class, simulator::step);
    }

    @Test
    public void missingExternal() {
        SCStream stream = new SCStream(0, INT32, List.of(new SCIntLiteral(0)), new SCExternExpression(INT32, "x"));
        TickSimulator simulator = simulate(new SCSpec(List.of(stream), List.of()), new Host());
        Assert.assertThrows(SimulatorException.class, simulator::step);
    }
}
