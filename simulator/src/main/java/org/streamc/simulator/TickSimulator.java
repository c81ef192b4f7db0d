package org.streamc.simulator;

import org.streamc.simulator.values.ArrayValue;
import org.streamc.simulator.values.BoolValue;
import org.streamc.simulator.values.DoubleValue;
import org.streamc.simulator.values.FloatValue;
import org.streamc.simulator.values.IValue;
import org.streamc.simulator.values.IntegerValue;
import org.streamc.simulator.values.StructValue;
import org.streamc.streamCompiler.compiler.backend.c.CProgram;
import org.streamc.streamCompiler.compiler.backend.c.ir.CFunctionDeclaration;
import org.streamc.streamCompiler.compiler.backend.c.ir.CFunctionDefinition;
import org.streamc.streamCompiler.compiler.backend.c.ir.CInitExpression;
import org.streamc.streamCompiler.compiler.backend.c.ir.CInitList;
import org.streamc.streamCompiler.compiler.backend.c.ir.CInitializer;
import org.streamc.streamCompiler.compiler.backend.c.ir.CStorage;
import org.streamc.streamCompiler.compiler.backend.c.ir.CVariableDeclaration;
import org.streamc.streamCompiler.compiler.backend.c.ir.expression.CAssignExpression;
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
import org.streamc.streamCompiler.compiler.backend.c.ir.expression.CSizeOfExpression;
import org.streamc.streamCompiler.compiler.backend.c.ir.expression.CUnaryExpression;
import org.streamc.streamCompiler.compiler.backend.c.ir.statement.CExpressionStatement;
import org.streamc.streamCompiler.compiler.backend.c.ir.statement.CIfStatement;
import org.streamc.streamCompiler.compiler.backend.c.ir.statement.CReturnStatement;
import org.streamc.streamCompiler.compiler.backend.c.ir.statement.CStatement;
import org.streamc.streamCompiler.compiler.backend.c.ir.type.CType;
import org.streamc.streamCompiler.compiler.backend.c.ir.type.CTypeArray;
import org.streamc.streamCompiler.compiler.backend.c.ir.type.CTypeName;
import org.streamc.streamCompiler.compiler.backend.c.ir.type.CTypeStruct;
import org.streamc.streamCompiler.compiler.visitors.VisitDecision;
import org.streamc.streamCompiler.compiler.visitors.inner.InnerVisitor;
import org.streamc.util.Logger;

import javax.annotation.Nullable;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Executes the C code generated for a monitor.
 * Expressions are evaluated by the preorder methods, which leave
 * their result in 'value'; statements are executed the same way.
 */
public class TickSimulator extends InnerVisitor {
    final CProgram program;
    final TypeEnvironment types;
    final Arena arena;
    final Host host;
    final Map<String, CFunctionDefinition> functions;
    final Map<String, CFunctionDeclaration> handlers;
    final CFunctionDefinition stepFunction;
    /** Local variables of the functions being executed. */
    final Deque<Map<String, Slot>> frames;
    @Nullable
    IValue value;
    /** Set by a return statement until the function call completes. */
    @Nullable
    IValue returned;
    long tick;

    public TickSimulator(CProgram program, Host host) {
        this.program = program;
        this.host = host;
        this.types = new TypeEnvironment(program.header());
        this.arena = new Arena();
        this.functions = new HashMap<>();
        this.handlers = new HashMap<>();
        this.frames = new ArrayDeque<>();
        this.tick = 0;

        CFunctionDefinition step = null;
        for (CFunctionDefinition function: program.implementation().getDeclarations(CFunctionDefinition.class)) {
            this.functions.put(function.name, function);
            if (function.storage != CStorage.STATIC)
                step = function;
        }
        if (step == null)
            throw new SimulatorException("Program has no step function");
        this.stepFunction = step;
        for (CFunctionDeclaration declaration: program.header().getDeclarations(CFunctionDeclaration.class))
            if (!this.functions.containsKey(declaration.name))
                this.handlers.put(declaration.name, declaration);

        for (CVariableDeclaration declaration: program.implementation().getDeclarations(CVariableDeclaration.class))
            this.arena.allocate(declaration.name, this.allocate(declaration));
    }

    public Arena getArena() {
        return this.arena;
    }

    /** Number of completed ticks. */
    public long getTick() {
        return this.tick;
    }

    Slot allocate(CVariableDeclaration declaration) {
        IValue initial;
        if (declaration.initializer != null)
            initial = this.initialize(declaration.type, declaration.initializer);
        else
            initial = this.types.defaultValue(declaration.type);
        return new Slot(declaration.type, initial);
    }

    IValue initialize(CType type, CInitializer initializer) {
        CInitExpression expression = initializer.as(CInitExpression.class);
        if (expression != null)
            return this.types.convert(this.evaluate(expression.expression), type);
        CInitList list = initializer.to(CInitList.class);
        CType resolved = this.types.resolve(type);
        CTypeArray array = resolved.as(CTypeArray.class);
        if (array != null) {
            if (list.elements.size() != array.size)
                throw new SimulatorException("Initializer has " + list.elements.size()
                        + " elements for an array of size " + array.size);
            List<IValue> elements = new ArrayList<>();
            for (CInitializer element: list.elements)
                elements.add(this.initialize(array.elementType, element));
            return new ArrayValue(elements);
        }
        CTypeStruct struct = resolved.to(CTypeStruct.class);
        List<CVariableDeclaration> fieldDeclarations = this.types.getStruct(struct.name).fields;
        if (list.elements.size() != fieldDeclarations.size())
            throw new SimulatorException("Initializer has " + list.elements.size()
                    + " elements for struct " + struct.name);
        LinkedHashMap<String, IValue> fields = new LinkedHashMap<>();
        for (int i = 0; i < fieldDeclarations.size(); i++) {
            CVariableDeclaration field = fieldDeclarations.get(i);
            fields.put(field.name, this.initialize(field.type, list.elements.get(i)));
        }
        return new StructValue(struct.name, fields);
    }

    /** Execute one tick of the monitor. */
    public void step() {
        this.host.setTick(this.tick);
        Logger.INSTANCE.belowLevel(this, 1)
                .append("Tick ")
                .append(this.tick)
                .newline();
        this.call(this.stepFunction, new ArrayList<>());
        this.tick++;
    }

    public void run(int ticks) {
        for (int i = 0; i < ticks; i++)
            this.step();
    }

    public IValue evaluate(CExpression expression) {
        this.value = null;
        expression.accept(this);
        return Objects.requireNonNull(this.value);
    }

    void execute(List<CStatement> statements) {
        for (CStatement statement: statements) {
            if (this.returned != null)
                return;
            statement.accept(this);
        }
    }

    @Nullable
    IValue call(CFunctionDefinition function, List<IValue> arguments) {
        Map<String, Slot> frame = new HashMap<>();
        for (int i = 0; i < function.parameters.size(); i++) {
            CType type = function.parameters.get(i).type;
            frame.put(function.parameters.get(i).name, new Slot(type, this.types.convert(arguments.get(i), type)));
        }
        this.frames.push(frame);
        for (CVariableDeclaration local: function.locals) {
            if (local.storage == CStorage.STATIC) {
                // Static locals are initialized once
                String name = function.name + "." + local.name;
                Slot slot = this.arena.maybeGet(name);
                if (slot == null) {
                    slot = this.allocate(local);
                    this.arena.allocate(name, slot);
                }
                frame.put(local.name, slot);
            } else {
                frame.put(local.name, this.allocate(local));
            }
        }
        this.returned = null;
        this.execute(function.statements);
        IValue result = this.returned;
        this.returned = null;
        this.frames.pop();
        CTypeName returnName = function.returnType.as(CTypeName.class);
        boolean isVoid = returnName != null && returnName.name.equals(CTypeName.VOID.name);
        if (result != null && !isVoid)
            result = this.types.convert(result, function.returnType);
        return result;
    }

    @Nullable
    Slot lookup(String name) {
        Map<String, Slot> frame = this.frames.peek();
        if (frame != null && frame.containsKey(name))
            return frame.get(name);
        return this.arena.maybeGet(name);
    }

    /** Type of an lvalue. */
    CType typeOf(CExpression expression) {
        CIdentifier identifier = expression.as(CIdentifier.class);
        if (identifier != null) {
            Slot slot = this.lookup(identifier.name);
            if (slot == null)
                throw new SimulatorException("Cannot assign to " + identifier.name);
            return slot.type;
        }
        CIndexExpression index = expression.as(CIndexExpression.class);
        if (index != null)
            return this.types.elementType(this.typeOf(index.array));
        CMemberExpression member = expression.as(CMemberExpression.class);
        if (member != null) {
            CTypeStruct struct = this.types.resolve(this.typeOf(member.record)).to(CTypeStruct.class);
            return this.types.fieldType(struct.name, member.field);
        }
        throw new SimulatorException("Not an lvalue: " + expression);
    }

    void assign(CExpression destination, IValue value) {
        CIdentifier identifier = destination.as(CIdentifier.class);
        if (identifier != null) {
            Slot slot = this.lookup(identifier.name);
            if (slot == null)
                throw new SimulatorException("Cannot assign to " + identifier.name);
            slot.value = this.types.convert(value, slot.type);
            return;
        }
        CType type = this.typeOf(destination);
        CIndexExpression index = destination.as(CIndexExpression.class);
        if (index != null) {
            ArrayValue array = this.evaluate(index.array).to(ArrayValue.class);
            long position = TypeEnvironment.toLong(this.evaluate(index.index));
            array.set(position, this.types.convert(value, type));
            return;
        }
        CMemberExpression member = destination.to(CMemberExpression.class);
        StructValue struct = this.evaluate(member.record).to(StructValue.class);
        struct.set(member.field, this.types.convert(value, type));
    }

    /////////////////// statements

    @Override
    public VisitDecision preorder(CExpressionStatement statement) {
        this.evaluate(statement.expression);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CIfStatement statement) {
        if (this.evaluate(statement.condition).isTrue())
            this.execute(statement.body);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CReturnStatement statement) {
        IValue result = statement.expression != null ? this.evaluate(statement.expression) : BoolValue.FALSE;
        this.returned = result;
        return VisitDecision.STOP;
    }

    /////////////////// expressions

    @Override
    public VisitDecision preorder(CIdentifier expression) {
        Slot slot = this.lookup(expression.name);
        if (slot != null) {
            this.value = slot.value;
        } else {
            IValue external = this.host.getExternal(expression.name);
            if (external == null)
                throw new SimulatorException("Undefined variable " + expression.name);
            this.value = external;
        }
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CBoolConstant expression) {
        this.value = BoolValue.of(expression.value);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CIntConstant expression) {
        this.value = new IntegerValue(expression.value);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CFloatConstant expression) {
        if (expression.single)
            this.value = new FloatValue((float) expression.value);
        else
            this.value = new DoubleValue(expression.value);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CUnaryExpression expression) {
        IValue operand = this.evaluate(expression.operand);
        this.value = switch (expression.operator) {
            case NOT -> BoolValue.of(!operand.isTrue());
            case BW_NOT -> new IntegerValue(~TypeEnvironment.toLong(operand));
            case NEG -> Arithmetic.negate(operand);
        };
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CBinaryExpression expression) {
        IValue left = this.evaluate(expression.left);
        switch (expression.operator) {
            case AND -> {
                this.value = BoolValue.of(left.isTrue() && this.evaluate(expression.right).isTrue());
                return VisitDecision.STOP;
            }
            case OR -> {
                this.value = BoolValue.of(left.isTrue() || this.evaluate(expression.right).isTrue());
                return VisitDecision.STOP;
            }
            default -> {}
        }
        IValue right = this.evaluate(expression.right);
        this.value = Arithmetic.binary(expression.operator, left, right);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CConditionalExpression expression) {
        if (this.evaluate(expression.condition).isTrue())
            this.value = this.evaluate(expression.positive);
        else
            this.value = this.evaluate(expression.negative);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CCallExpression expression) {
        List<IValue> arguments = new ArrayList<>();
        for (CExpression argument: expression.arguments)
            arguments.add(this.evaluate(argument));
        String name = expression.function;

        CFunctionDefinition function = this.functions.get(name);
        if (function != null) {
            IValue result = this.call(function, arguments);
            this.value = result != null ? result : BoolValue.FALSE;
            return VisitDecision.STOP;
        }
        CFunctionDeclaration handler = this.handlers.get(name);
        if (handler != null) {
            List<IValue> converted = new ArrayList<>();
            for (int i = 0; i < arguments.size(); i++)
                converted.add(this.types.convert(arguments.get(i), handler.parameters.get(i).type).copy());
            this.host.fire(name, converted);
            this.value = BoolValue.FALSE;
            return VisitDecision.STOP;
        }
        if (name.equals("memcpy")) {
            ArrayValue destination = arguments.get(0).to(ArrayValue.class);
            ArrayValue source = arguments.get(1).to(ArrayValue.class);
            // The size argument is always the size of the destination
            for (int i = 0; i < destination.size(); i++)
                destination.set(i, source.get(i).copy());
            this.value = destination;
            return VisitDecision.STOP;
        }
        this.value = Arithmetic.libraryCall(name, arguments);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CIndexExpression expression) {
        ArrayValue array = this.evaluate(expression.array).to(ArrayValue.class);
        long index = TypeEnvironment.toLong(this.evaluate(expression.index));
        this.value = array.get(index);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CMemberExpression expression) {
        StructValue struct = this.evaluate(expression.record).to(StructValue.class);
        this.value = struct.get(expression.field);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CCastExpression expression) {
        this.value = this.types.convert(this.evaluate(expression.source), expression.type);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CAssignExpression expression) {
        IValue right = this.evaluate(expression.right);
        this.assign(expression.left, right);
        this.value = right;
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CSizeOfExpression expression) {
        // Only used as the size argument of memcpy
        this.value = new IntegerValue(0);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CCompoundLiteral expression) {
        this.value = this.initialize(expression.type, expression.initializer);
        return VisitDecision.STOP;
    }
}
