package org.streamc.streamCompiler.compiler.backend.c;

import org.streamc.streamCompiler.compiler.backend.c.ir.CDeclaration;
import org.streamc.streamCompiler.compiler.backend.c.ir.CFunctionDeclaration;
import org.streamc.streamCompiler.compiler.backend.c.ir.CFunctionDefinition;
import org.streamc.streamCompiler.compiler.backend.c.ir.CInitExpression;
import org.streamc.streamCompiler.compiler.backend.c.ir.CInitList;
import org.streamc.streamCompiler.compiler.backend.c.ir.CInitializer;
import org.streamc.streamCompiler.compiler.backend.c.ir.CParameter;
import org.streamc.streamCompiler.compiler.backend.c.ir.CStorage;
import org.streamc.streamCompiler.compiler.backend.c.ir.CStructDeclaration;
import org.streamc.streamCompiler.compiler.backend.c.ir.CTranslationUnit;
import org.streamc.streamCompiler.compiler.backend.c.ir.CTypedefDeclaration;
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
import org.streamc.streamCompiler.compiler.backend.c.ir.type.CTypePointer;
import org.streamc.streamCompiler.compiler.backend.c.ir.type.CTypeStruct;
import org.streamc.streamCompiler.compiler.errors.InternalCompilerError;
import org.streamc.streamCompiler.compiler.visitors.VisitDecision;
import org.streamc.streamCompiler.compiler.visitors.inner.InnerVisitor;
import org.streamc.streamCompiler.ir.ISCNode;
import org.streamc.util.IIndentStream;
import org.streamc.util.IndentStream;
import org.streamc.util.IndentStreamBuilder;

import javax.annotation.Nullable;
import java.util.List;

/** Writes the text of C syntax trees. */
public class ToCVisitor extends InnerVisitor {
    protected final IIndentStream builder;

    public ToCVisitor(IIndentStream builder) {
        this.builder = builder;
    }

    /** The declarator of a variable with the specified name and type, e.g. "int32_t s0[3]".
     * An empty name produces an abstract declarator. */
    public static String declarator(CType type, String name) {
        if (type.is(CTypeName.class))
            return withName(type.to(CTypeName.class).name, name);
        if (type.is(CTypeStruct.class))
            return withName("struct " + type.to(CTypeStruct.class).name, name);
        if (type.is(CTypePointer.class))
            return declarator(type.to(CTypePointer.class).base, "*" + name);
        if (type.is(CTypeArray.class)) {
            CTypeArray array = type.to(CTypeArray.class);
            return declarator(array.elementType, name + "[" + array.size + "]");
        }
        throw new InternalCompilerError("Unexpected C type " + type, type);
    }

    static String withName(String type, String name) {
        if (name.isEmpty())
            return type;
        return type + " " + name;
    }

    void type(CType type) {
        this.builder.append(declarator(type, ""));
    }

    /** Write an operand, in parentheses if it is not a primary expression. */
    void operand(CExpression expression) {
        if (expression.isCompound()) {
            this.builder.append("(");
            expression.accept(this);
            this.builder.append(")");
        } else {
            expression.accept(this);
        }
    }

    void arguments(List<? extends ISCNode> nodes) {
        boolean first = true;
        for (ISCNode node: nodes) {
            if (!first)
                this.builder.append(", ");
            first = false;
            node.accept(this);
        }
    }

    /////////////////// types

    @Override
    public VisitDecision preorder(CType type) {
        this.type(type);
        return VisitDecision.STOP;
    }

    /////////////////// expressions

    @Override
    public VisitDecision preorder(CIdentifier expression) {
        this.builder.append(expression.name);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CBoolConstant expression) {
        this.builder.append(expression.value);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CIntConstant expression) {
        this.builder.append(expression.toCString());
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CFloatConstant expression) {
        this.builder.append(expression.toCString());
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CUnaryExpression expression) {
        this.builder.append(expression.operator.toString());
        this.operand(expression.operand);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CBinaryExpression expression) {
        this.operand(expression.left);
        this.builder.append(" ")
                .append(expression.operator.toString())
                .append(" ");
        this.operand(expression.right);
        return VisitDecision.STOP;
    }

    void branch(CExpression expression) {
        if (expression.is(CConditionalExpression.class) || expression.is(CAssignExpression.class))
            this.operand(expression);
        else
            expression.accept(this);
    }

    @Override
    public VisitDecision preorder(CConditionalExpression expression) {
        this.branch(expression.condition);
        this.builder.append(" ? ");
        expression.positive.accept(this);
        this.builder.append(" : ");
        this.branch(expression.negative);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CCallExpression expression) {
        this.builder.append(expression.function)
                .append("(");
        this.arguments(expression.arguments);
        this.builder.append(")");
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CIndexExpression expression) {
        this.operand(expression.array);
        this.builder.append("[");
        expression.index.accept(this);
        this.builder.append("]");
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CMemberExpression expression) {
        this.operand(expression.record);
        this.builder.append(".")
                .append(expression.field);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CCastExpression expression) {
        this.builder.append("(");
        this.type(expression.type);
        this.builder.append(")");
        this.operand(expression.source);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CAssignExpression expression) {
        expression.left.accept(this);
        this.builder.append(" = ");
        expression.right.accept(this);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CSizeOfExpression expression) {
        this.builder.append("sizeof(");
        expression.expression.accept(this);
        this.builder.append(")");
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CCompoundLiteral expression) {
        this.builder.append("(");
        this.type(expression.type);
        this.builder.append(")");
        expression.initializer.accept(this);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CInitExpression initializer) {
        initializer.expression.accept(this);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CInitList initializer) {
        this.builder.append("{");
        this.arguments(initializer.elements);
        this.builder.append("}");
        return VisitDecision.STOP;
    }

    /////////////////// statements

    @Override
    public VisitDecision preorder(CExpressionStatement statement) {
        statement.expression.accept(this);
        this.builder.append(";").newline();
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CIfStatement statement) {
        this.builder.append("if (");
        statement.condition.accept(this);
        this.builder.append(") {").increase();
        for (CStatement s: statement.body)
            s.accept(this);
        this.builder.decrease().append("}").newline();
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CReturnStatement statement) {
        this.builder.append("return");
        if (statement.expression != null) {
            this.builder.append(" ");
            statement.expression.accept(this);
        }
        this.builder.append(";").newline();
        return VisitDecision.STOP;
    }

    /////////////////// declarations

    void storage(CStorage storage) {
        if (storage != CStorage.NONE)
            this.builder.append(storage.toString()).append(" ");
    }

    String parameters(List<CParameter> parameters) {
        if (parameters.isEmpty())
            return "(void)";
        IndentStream stream = new IndentStreamBuilder();
        stream.append("(");
        new ToCVisitor(stream).arguments(parameters);
        return stream.append(")").toString();
    }

    @Override
    public VisitDecision preorder(CParameter parameter) {
        this.builder.append(declarator(parameter.type, parameter.name));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CVariableDeclaration declaration) {
        this.storage(declaration.storage);
        this.builder.append(declarator(declaration.type, declaration.name));
        if (declaration.initializer != null) {
            this.builder.append(" = ");
            declaration.initializer.accept(this);
        }
        this.builder.append(";").newline();
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CFunctionDeclaration declaration) {
        this.builder.append(declarator(declaration.returnType,
                        declaration.name + this.parameters(declaration.parameters)))
                .append(";")
                .newline();
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CFunctionDefinition definition) {
        this.storage(definition.storage);
        this.builder.append(declarator(definition.returnType,
                        definition.name + this.parameters(definition.parameters)))
                .append(" {")
                .increase();
        for (CVariableDeclaration local: definition.locals)
            local.accept(this);
        for (CStatement statement: definition.statements)
            statement.accept(this);
        this.builder.decrease()
                .append("}")
                .newline();
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CStructDeclaration declaration) {
        this.builder.append("struct ")
                .append(declaration.name)
                .append(" {")
                .increase();
        for (CVariableDeclaration field: declaration.fields)
            field.accept(this);
        this.builder.decrease()
                .append("};")
                .newline();
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CTypedefDeclaration declaration) {
        this.builder.append("typedef ")
                .append(declarator(declaration.type, declaration.name))
                .append(";")
                .newline();
        return VisitDecision.STOP;
    }

    /** Consecutive declarations are separated by a blank line unless both are
     * simple declarations of the same kind. */
    static boolean separate(@Nullable CDeclaration previous, CDeclaration current) {
        if (previous == null)
            return false;
        if (previous.getClass() != current.getClass())
            return true;
        return current.is(CFunctionDefinition.class) || current.is(CStructDeclaration.class);
    }

    @Override
    public VisitDecision preorder(CTranslationUnit unit) {
        if (unit.includeGuard != null)
            this.builder.append("#ifndef ")
                    .append(unit.includeGuard)
                    .newline()
                    .append("#define ")
                    .append(unit.includeGuard)
                    .newline()
                    .newline();
        for (String include: unit.systemIncludes)
            this.builder.append("#include <")
                    .append(include)
                    .append(">")
                    .newline();
        if (!unit.localIncludes.isEmpty()) {
            this.builder.newline();
            for (String include : unit.localIncludes)
                this.builder.append("#include \"")
                        .append(include)
                        .append("\"")
                        .newline();
        }
        CDeclaration previous = null;
        for (CDeclaration declaration: unit.declarations) {
            if (previous == null || separate(previous, declaration))
                this.builder.newline();
            declaration.accept(this);
            previous = declaration;
        }
        if (unit.includeGuard != null)
            this.builder.newline()
                    .append("#endif /* ")
                    .append(unit.includeGuard)
                    .append(" */")
                    .newline();
        return VisitDecision.STOP;
    }

    public static String toCString(ISCNode node) {
        IndentStream stream = new IndentStreamBuilder();
        ToCVisitor visitor = new ToCVisitor(stream);
        node.accept(visitor);
        return stream.toString();
    }
}
