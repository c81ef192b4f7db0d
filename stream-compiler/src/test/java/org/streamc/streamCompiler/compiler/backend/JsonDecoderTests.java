package org.streamc.streamCompiler.compiler.backend;

import org.junit.Assert;
import org.junit.Test;
import org.streamc.streamCompiler.compiler.errors.BaseCompilerException;
import org.streamc.streamCompiler.compiler.errors.CompilationError;
import org.streamc.streamCompiler.ir.ISCNode;
import org.streamc.streamCompiler.ir.SCSpec;
import org.streamc.streamCompiler.ir.SCStream;
import org.streamc.streamCompiler.ir.expression.SCApplyExpression;
import org.streamc.streamCompiler.ir.expression.SCDropExpression;
import org.streamc.streamCompiler.ir.expression.SCExpression;
import org.streamc.streamCompiler.ir.expression.SCOpcode;
import org.streamc.streamCompiler.ir.expression.literal.SCIntLiteral;
import org.streamc.streamCompiler.ir.type.derived.SCTypeStruct;
import org.streamc.streamCompiler.ir.type.primitive.SCTypeInteger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

public class JsonDecoderTests {
    static String resource(String name) throws IOException {
        try (InputStream stream = JsonDecoderTests.class.getResourceAsStream("/" + name)) {
            Objects.requireNonNull(stream, name);
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    static <T extends ISCNode> T decode(String json, Class<T> clazz) throws IOException {
        return new JsonDecoder().decode(json, clazz);
    }

    @Test
    public void decodeSpecification() throws IOException {
        SCSpec spec = decode(resource("counter.json"), SCSpec.class);
        Assert.assertEquals(2, spec.streams.size());
        Assert.assertEquals(1, spec.triggers.size());

        SCStream counter = spec.streams.get(0);
        Assert.assertEquals(0, counter.streamId);
        Assert.assertEquals(1, counter.getBufferLength());
        Assert.assertTrue(counter.type.sameType(SCTypeInteger.INT32));
        SCApplyExpression generator = counter.generator.to(SCApplyExpression.class);
        Assert.assertEquals(SCOpcode.ADD, generator.getOpcode());

        // {"node": 101} refers to the object decoded earlier
        SCExpression argument = spec.triggers.get(0).arguments.get(0);
        Assert.assertSame(generator.getArgument(0), argument);
        Assert.assertEquals(0, argument.to(SCDropExpression.class).depth);
        Assert.assertEquals("overheat", spec.triggers.get(0).name);
        Assert.assertNotNull(spec.getStream(1));
        Assert.assertNull(spec.getStream(2));
    }

    @Test
    public void decodeStruct() throws IOException {
        String json = """
                {
                  "class": "SCTypeStruct",
                  "name": "sample",
                  "fields": [
                    { "class": "Field", "name": "id", "index": 0,
                      "type": { "class": "SCTypeInteger", "width": 16, "signed": false } },
                    { "class": "Field", "name": "valid", "index": 1, "type": { "class": "SCTypeBool" } }
                  ]
                }""";
        SCTypeStruct struct = decode(json, SCTypeStruct.class);
        Assert.assertEquals("sample", struct.name);
        Assert.assertEquals(2, struct.fields.size());
        Assert.assertTrue(Objects.requireNonNull(struct.getField("id")).type.sameType(SCTypeInteger.UINT16));
    }

    @Test
    public void unsignedLiteral() throws IOException {
        String json = """
                { "class": "SCIntLiteral",
                  "type": { "class": "SCTypeInteger", "width": 64, "signed": false },
                  "value": "18446744073709551615" }""";
        SCIntLiteral literal = decode(json, SCIntLiteral.class);
        Assert.assertEquals(-1L, literal.value);
        Assert.assertEquals("18446744073709551615", literal.toDecimalString());
    }

    @Test
    public void literalOutOfRange() {
        String json = """
                { "class": "SCIntLiteral",
                  "type": { "class": "SCTypeInteger", "width": 8, "signed": false },
                  "value": 300 }""";
        Assert.assertThrows(CompilationError.class, () -> decode(json, SCIntLiteral.class));
        String negative = json.replace("300", "-1");
        Assert.assertThrows(CompilationError.class, () -> decode(negative, SCIntLiteral.class));
    }

    @Test
    public void errors() {
        Assert.assertThrows(CompilationError.class,
                () -> decode("{ \"class\": \"SCNoSuchNode\" }", SCSpec.class));
        Assert.assertThrows(CompilationError.class,
                () -> decode("{ \"streams\": [] }", SCSpec.class));
        Assert.assertThrows(CompilationError.class,
                () -> decode("{ \"node\": 5 }", SCSpec.class));
        Assert.assertThrows(CompilationError.class,
                () -> decode("{ \"class\": \"SCTypeBool\" }", SCSpec.class));
        Assert.assertThrows(CompilationError.class,
                () -> decode("[1, 2]", SCSpec.class));

        String duplicate = """
                { "class": "SCApplyExpression",
                  "type": { "class": "SCTypeBool", "id": 1 },
                  "operator": { "opcode": "AND" },
                  "arguments": [
                    { "class": "SCBoolLiteral", "value": true, "id": 1 },
                    { "class": "SCBoolLiteral", "value": false }
                  ] }""";
        Assert.assertThrows(CompilationError.class, () -> decode(duplicate, SCApplyExpression.class));

        String opcode = """
                { "class": "SCApplyExpression",
                  "type": { "class": "SCTypeBool" },
                  "operator": { "opcode": "XOR" },
                  "arguments": [] }""";
        Assert.assertThrows(CompilationError.class, () -> decode(opcode, SCApplyExpression.class));
    }

    @Test
    public void inconsistentStream() {
        // the initial value does not have the type of the stream
        String json = """
                { "class": "SCStream", "streamId": 0,
                  "type": { "class": "SCTypeBool" },
                  "initial": [ { "class": "SCIntLiteral",
                                 "type": { "class": "SCTypeInteger", "width": 32, "signed": true },
                                 "value": 1 } ],
                  "generator": { "class": "SCBoolLiteral", "value": true } }""";
        Assert.assertThrows(BaseCompilerException.class, () -> decode(json, SCStream.class));
    }
}
