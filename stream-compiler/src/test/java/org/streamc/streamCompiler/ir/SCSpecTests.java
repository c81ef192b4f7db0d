package org.streamc.streamCompiler.ir;

import org.junit.Assert;
import org.junit.Test;
import org.streamc.streamCompiler.ir.expression.SCDropExpression;
import org.streamc.streamCompiler.ir.expression.SCExpression;
import org.streamc.streamCompiler.ir.expression.literal.SCBoolLiteral;
import org.streamc.streamCompiler.ir.expression.literal.SCIntLiteral;
import org.streamc.streamCompiler.ir.expression.literal.SCLiteral;
import org.streamc.streamCompiler.ir.type.primitive.SCTypeInteger;

import java.util.ArrayList;
import java.util.List;

public class SCSpecTests {
    @Test
    public void laterChangesToTheInputListsAreIgnored() {
        SCTypeInteger type = SCTypeInteger.INT32;
        List<SCLiteral> initial = new ArrayList<>(List.of(new SCIntLiteral(1), new SCIntLiteral(2)));
        SCStream stream = new SCStream(0, type, initial, new SCDropExpression(type, 0, 0));
        List<SCExpression> arguments = new ArrayList<>(List.of(new SCDropExpression(type, 1, 0)));
        SCTrigger trigger = new SCTrigger("report", new SCBoolLiteral(true), arguments);
        List<SCStream> streams = new ArrayList<>(List.of(stream));
        List<SCTrigger> triggers = new ArrayList<>(List.of(trigger));
        SCSpec spec = new SCSpec(streams, triggers);

        initial.add(new SCIntLiteral(3));
        arguments.clear();
        streams.clear();
        triggers.clear();

        Assert.assertEquals(1, spec.streams.size());
        Assert.assertEquals(2, spec.streams.get(0).getBufferLength());
        Assert.assertEquals(1, spec.triggers.size());
        Assert.assertEquals(1, spec.triggers.get(0).arguments.size());
        Assert.assertThrows(UnsupportedOperationException.class, () -> spec.streams.add(stream));
    }
}
