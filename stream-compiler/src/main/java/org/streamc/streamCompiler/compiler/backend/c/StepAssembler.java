package org.streamc.streamCompiler.compiler.backend.c;

import org.streamc.streamCompiler.compiler.backend.c.ir.CFunctionDeclaration;
import org.streamc.streamCompiler.compiler.backend.c.ir.CFunctionDefinition;
import org.streamc.streamCompiler.compiler.backend.c.ir.CParameter;
import org.streamc.streamCompiler.compiler.backend.c.ir.CStorage;
import org.streamc.streamCompiler.compiler.backend.c.ir.expression.CAssignExpression;
import org.streamc.streamCompiler.compiler.backend.c.ir.expression.CBinaryExpression;
import org.streamc.streamCompiler.compiler.backend.c.ir.expression.CCallExpression;
import org.streamc.streamCompiler.compiler.backend.c.ir.expression.CExpression;
import org.streamc.streamCompiler.compiler.backend.c.ir.expression.CIdentifier;
import org.streamc.streamCompiler.compiler.backend.c.ir.expression.CIndexExpression;
import org.streamc.streamCompiler.compiler.backend.c.ir.expression.CIntConstant;
import org.streamc.streamCompiler.compiler.backend.c.ir.expression.CSizeOfExpression;
import org.streamc.streamCompiler.compiler.backend.c.ir.statement.CExpressionStatement;
import org.streamc.streamCompiler.compiler.backend.c.ir.statement.CIfStatement;
import org.streamc.streamCompiler.compiler.backend.c.ir.statement.CReturnStatement;
import org.streamc.streamCompiler.compiler.backend.c.ir.statement.CStatement;
import org.streamc.streamCompiler.compiler.backend.c.ir.type.CTypeName;
import org.streamc.streamCompiler.compiler.visitors.inner.ExpressionTranslator;
import org.streamc.streamCompiler.ir.SCExternal;
import org.streamc.streamCompiler.ir.SCSpec;
import org.streamc.streamCompiler.ir.SCStream;
import org.streamc.streamCompiler.ir.SCTrigger;
import org.streamc.streamCompiler.ir.expression.SCExpression;
import org.streamc.streamCompiler.ir.type.SCType;
import org.streamc.streamCompiler.ir.type.derived.SCTypeArray;
import org.streamc.util.IWritesLogs;
import org.streamc.util.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Generates the functions of the implementation file: one generator per stream,
 * a guard and one function per argument for each trigger, and the step function.
 */
public class StepAssembler implements IWritesLogs {
    final StateLayout layout;
    final ExpressionTranslator translator;
    final String stepName;

    public StepAssembler(StateLayout layout, String stepName) {
        this.layout = layout;
        this.translator = new ExpressionTranslator(layout);
        this.stepName = stepName;
    }

    /** A function without parameters returning the value of an expression. */
    CFunctionDefinition valueFunction(String name, SCExpression expression, SCType type) {
        TranslatedExpression translated = this.translator.translate(expression);
        List<CStatement> body = new ArrayList<>();
        body.add(new CReturnStatement(translated.expression()));
        return new CFunctionDefinition(CStorage.STATIC, CTypes.decay(type), name,
                new ArrayList<>(), translated.locals(), body);
    }

    /** Generators for all streams, followed by guards and arguments for each trigger. */
    public List<CFunctionDefinition> generators(SCSpec spec) {
        List<CFunctionDefinition> result = new ArrayList<>();
        for (SCStream stream: spec.streams)
            result.add(this.valueFunction(CNames.generator(stream.streamId), stream.generator, stream.type));
        for (SCTrigger trigger: spec.triggers) {
            result.add(this.valueFunction(CNames.guard(trigger.name), trigger.guard, trigger.guard.getType()));
            for (int i = 0; i < trigger.arguments.size(); i++) {
                SCExpression argument = trigger.arguments.get(i);
                result.add(this.valueFunction(CNames.argument(trigger.name, i), argument, argument.getType()));
            }
        }
        return result;
    }

    static CExpression call(String function, CExpression... arguments) {
        return new CCallExpression(function, arguments);
    }

    static CStatement memcpy(CExpression destination, CExpression source) {
        return new CExpressionStatement(call("memcpy", destination, source, new CSizeOfExpression(destination)));
    }

    static CStatement assign(CExpression destination, CExpression source) {
        return new CExpressionStatement(new CAssignExpression(destination, source));
    }

    /** Copy a value: arrays are copied with memcpy, everything else is assigned. */
    static CStatement copy(SCType type, CExpression destination, CExpression source) {
        if (type.is(SCTypeArray.class))
            return memcpy(destination, source);
        return assign(destination, source);
    }

    List<CStatement> snapshotPhase() {
        List<CStatement> result = new ArrayList<>();
        for (SCExternal external: this.layout.getExternals())
            result.add(copy(external.type(),
                    new CIdentifier(external.snapshotName()), new CIdentifier(external.name())));
        return result;
    }

    List<CStatement> triggerPhase(SCSpec spec) {
        List<CStatement> result = new ArrayList<>();
        for (SCTrigger trigger: spec.triggers) {
            List<CExpression> arguments = new ArrayList<>();
            for (int i = 0; i < trigger.arguments.size(); i++)
                arguments.add(call(CNames.argument(trigger.name, i)));
            List<CStatement> fire = new ArrayList<>();
            fire.add(new CExpressionStatement(new CCallExpression(trigger.name, arguments)));
            result.add(new CIfStatement(call(CNames.guard(trigger.name)), fire));
        }
        return result;
    }

    /** All generators run before the first buffer write, so each one reads the state before the tick. */
    List<CStatement> bufferPhase() {
        List<CStatement> result = new ArrayList<>();
        for (StateLayout.StreamSlot slot: this.layout.getStreams())
            result.add(copy(slot.elementType(),
                    new CIdentifier(slot.temporaryName()), call(slot.generatorName())));
        for (StateLayout.StreamSlot slot: this.layout.getStreams()) {
            CExpression current = new CIndexExpression(
                    new CIdentifier(slot.bufferName()), new CIdentifier(slot.indexName()));
            result.add(copy(slot.elementType(), current, new CIdentifier(slot.temporaryName())));
        }
        return result;
    }

    List<CStatement> indexPhase() {
        List<CStatement> result = new ArrayList<>();
        for (StateLayout.StreamSlot slot: this.layout.getStreams()) {
            CExpression index = new CIdentifier(slot.indexName());
            CExpression next = new CBinaryExpression(CBinaryExpression.Operator.MOD,
                    new CBinaryExpression(CBinaryExpression.Operator.ADD, index, new CIntConstant(1)),
                    new CIntConstant(slot.capacity()));
            result.add(assign(index, next));
        }
        return result;
    }

    /** The function executing one tick of the monitor. */
    public CFunctionDefinition step(SCSpec spec) {
        List<CStatement> statements = new ArrayList<>();
        statements.addAll(this.snapshotPhase());
        statements.addAll(this.triggerPhase(spec));
        statements.addAll(this.bufferPhase());
        statements.addAll(this.indexPhase());
        Logger.INSTANCE.belowLevel(this, 1)
                .append("Step function has ")
                .append(statements.size())
                .append(" statements")
                .newline();
        return new CFunctionDefinition(CStorage.NONE, CTypeName.VOID, this.stepName,
                new ArrayList<>(), new ArrayList<>(), statements);
    }

    public CFunctionDeclaration stepPrototype() {
        return new CFunctionDeclaration(CTypeName.VOID, this.stepName, new ArrayList<>());
    }

    /** Prototypes of the handlers the host must implement. */
    public List<CFunctionDeclaration> handlerPrototypes(SCSpec spec) {
        List<CFunctionDeclaration> result = new ArrayList<>();
        for (SCTrigger trigger: spec.triggers) {
            List<CParameter> parameters = new ArrayList<>();
            for (int i = 0; i < trigger.arguments.size(); i++)
                parameters.add(new CParameter(
                        CTypes.translate(trigger.arguments.get(i).getType()), CNames.argument(trigger.name, i)));
            result.add(new CFunctionDeclaration(CTypeName.VOID, trigger.name, parameters));
        }
        return result;
    }
}
