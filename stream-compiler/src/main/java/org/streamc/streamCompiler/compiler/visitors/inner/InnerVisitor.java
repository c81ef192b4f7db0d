/*
 * Copyright 2022 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.streamc.streamCompiler.compiler.visitors.inner;

import org.streamc.streamCompiler.compiler.backend.c.ir.CDeclaration;
import org.streamc.streamCompiler.compiler.backend.c.ir.CFunctionDeclaration;
import org.streamc.streamCompiler.compiler.backend.c.ir.CFunctionDefinition;
import org.streamc.streamCompiler.compiler.backend.c.ir.CInitExpression;
import org.streamc.streamCompiler.compiler.backend.c.ir.CInitList;
import org.streamc.streamCompiler.compiler.backend.c.ir.CInitializer;
import org.streamc.streamCompiler.compiler.backend.c.ir.CParameter;
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
import org.streamc.streamCompiler.ir.ISCNode;
import org.streamc.streamCompiler.ir.SCSpec;
import org.streamc.streamCompiler.ir.SCStream;
import org.streamc.streamCompiler.ir.SCTrigger;
import org.streamc.streamCompiler.ir.expression.SCApplyExpression;
import org.streamc.streamCompiler.ir.expression.SCDropExpression;
import org.streamc.streamCompiler.ir.expression.SCExpression;
import org.streamc.streamCompiler.ir.expression.SCExternExpression;
import org.streamc.streamCompiler.ir.expression.SCLetExpression;
import org.streamc.streamCompiler.ir.expression.SCVariableExpression;
import org.streamc.streamCompiler.ir.expression.literal.SCArrayLiteral;
import org.streamc.streamCompiler.ir.expression.literal.SCBoolLiteral;
import org.streamc.streamCompiler.ir.expression.literal.SCFloatLiteral;
import org.streamc.streamCompiler.ir.expression.literal.SCIntLiteral;
import org.streamc.streamCompiler.ir.expression.literal.SCLiteral;
import org.streamc.streamCompiler.ir.expression.literal.SCStructLiteral;
import org.streamc.streamCompiler.ir.type.SCType;
import org.streamc.streamCompiler.ir.type.derived.SCTypeArray;
import org.streamc.streamCompiler.ir.type.derived.SCTypeStruct;
import org.streamc.streamCompiler.ir.type.primitive.SCTypeBaseType;
import org.streamc.streamCompiler.ir.type.primitive.SCTypeBool;
import org.streamc.streamCompiler.ir.type.primitive.SCTypeFP;
import org.streamc.streamCompiler.ir.type.primitive.SCTypeInteger;
import org.streamc.util.IHasId;
import org.streamc.util.IWritesLogs;
import org.streamc.util.Logger;
import org.streamc.util.Utilities;

import java.util.ArrayList;
import java.util.List;

/** Depth-first traversal of an ISCNode hierarchy. */
@SuppressWarnings({"SameReturnValue", "unused"})
public abstract class InnerVisitor implements IWritesLogs, IHasId {
    final long id;
    static long crtId = 0;
    protected final List<ISCNode> context;

    public InnerVisitor() {
        this.id = crtId++;
        this.context = new ArrayList<>();
    }

    @Override
    public long getId() {
        return this.id;
    }

    public void push(ISCNode node) {
        this.context.add(node);
    }

    public void pop(ISCNode node) {
        ISCNode last = Utilities.removeLast(this.context);
        if (node != last)
            throw new InternalCompilerError("Corrupted visitor context: popping " + node
                    + " instead of " + last, node);
    }

    /** Override to initialize before visiting any node. */
    public void startVisit(ISCNode node) {
        Logger.INSTANCE.belowLevel(this, 4)
                .append("Starting ")
                .appendSupplier(this::toString)
                .append(" at ")
                .append(node.getId())
                .newline();
    }

    /** Override to finish after visiting all nodes. */
    public void endVisit() {}

    /************************* PREORDER *****************************/

    // preorder methods return CONTINUE when normal traversal is desired,
    // and STOP when the traversal should stop right away at the current node.
    public VisitDecision preorder(ISCNode ignored) {
        return VisitDecision.CONTINUE;
    }

    // Specification

    public VisitDecision preorder(SCSpec node) {
        return this.preorder((ISCNode) node);
    }

    public VisitDecision preorder(SCStream node) {
        return this.preorder((ISCNode) node);
    }

    public VisitDecision preorder(SCTrigger node) {
        return this.preorder((ISCNode) node);
    }

    // Types

    public VisitDecision preorder(SCType node) {
        return this.preorder((ISCNode) node);
    }

    public VisitDecision preorder(SCTypeBaseType node) {
        return this.preorder((SCType) node);
    }

    public VisitDecision preorder(SCTypeBool node) {
        return this.preorder((SCTypeBaseType) node);
    }

    public VisitDecision preorder(SCTypeInteger node) {
        return this.preorder((SCTypeBaseType) node);
    }

    public VisitDecision preorder(SCTypeFP node) {
        return this.preorder((SCTypeBaseType) node);
    }

    public VisitDecision preorder(SCTypeArray node) {
        return this.preorder((SCType) node);
    }

    public VisitDecision preorder(SCTypeStruct node) {
        return this.preorder((SCType) node);
    }

    public VisitDecision preorder(SCTypeStruct.Field node) {
        return this.preorder((ISCNode) node);
    }

    // Expressions

    public VisitDecision preorder(SCExpression node) {
        return this.preorder((ISCNode) node);
    }

    public VisitDecision preorder(SCLiteral node) {
        return this.preorder((SCExpression) node);
    }

    public VisitDecision preorder(SCBoolLiteral node) {
        return this.preorder((SCLiteral) node);
    }

    public VisitDecision preorder(SCIntLiteral node) {
        return this.preorder((SCLiteral) node);
    }

    public VisitDecision preorder(SCFloatLiteral node) {
        return this.preorder((SCLiteral) node);
    }

    public VisitDecision preorder(SCArrayLiteral node) {
        return this.preorder((SCLiteral) node);
    }

    public VisitDecision preorder(SCStructLiteral node) {
        return this.preorder((SCLiteral) node);
    }

    public VisitDecision preorder(SCLetExpression node) {
        return this.preorder((SCExpression) node);
    }

    public VisitDecision preorder(SCVariableExpression node) {
        return this.preorder((SCExpression) node);
    }

    public VisitDecision preorder(SCDropExpression node) {
        return this.preorder((SCExpression) node);
    }

    public VisitDecision preorder(SCExternExpression node) {
        return this.preorder((SCExpression) node);
    }

    public VisitDecision preorder(SCApplyExpression node) {
        return this.preorder((SCExpression) node);
    }

    // C types

    public VisitDecision preorder(CType node) {
        return this.preorder((ISCNode) node);
    }

    public VisitDecision preorder(CTypeName node) {
        return this.preorder((CType) node);
    }

    public VisitDecision preorder(CTypeStruct node) {
        return this.preorder((CType) node);
    }

    public VisitDecision preorder(CTypePointer node) {
        return this.preorder((CType) node);
    }

    public VisitDecision preorder(CTypeArray node) {
        return this.preorder((CType) node);
    }

    // C expressions

    public VisitDecision preorder(CExpression node) {
        return this.preorder((ISCNode) node);
    }

    public VisitDecision preorder(CIdentifier node) {
        return this.preorder((CExpression) node);
    }

    public VisitDecision preorder(CBoolConstant node) {
        return this.preorder((CExpression) node);
    }

    public VisitDecision preorder(CIntConstant node) {
        return this.preorder((CExpression) node);
    }

    public VisitDecision preorder(CFloatConstant node) {
        return this.preorder((CExpression) node);
    }

    public VisitDecision preorder(CUnaryExpression node) {
        return this.preorder((CExpression) node);
    }

    public VisitDecision preorder(CBinaryExpression node) {
        return this.preorder((CExpression) node);
    }

    public VisitDecision preorder(CConditionalExpression node) {
        return this.preorder((CExpression) node);
    }

    public VisitDecision preorder(CCallExpression node) {
        return this.preorder((CExpression) node);
    }

    public VisitDecision preorder(CIndexExpression node) {
        return this.preorder((CExpression) node);
    }

    public VisitDecision preorder(CMemberExpression node) {
        return this.preorder((CExpression) node);
    }

    public VisitDecision preorder(CCastExpression node) {
        return this.preorder((CExpression) node);
    }

    public VisitDecision preorder(CAssignExpression node) {
        return this.preorder((CExpression) node);
    }

    public VisitDecision preorder(CSizeOfExpression node) {
        return this.preorder((CExpression) node);
    }

    public VisitDecision preorder(CCompoundLiteral node) {
        return this.preorder((CExpression) node);
    }

    // C statements and declarations

    public VisitDecision preorder(CInitializer node) {
        return this.preorder((ISCNode) node);
    }

    public VisitDecision preorder(CInitExpression node) {
        return this.preorder((CInitializer) node);
    }

    public VisitDecision preorder(CInitList node) {
        return this.preorder((CInitializer) node);
    }

    public VisitDecision preorder(CStatement node) {
        return this.preorder((ISCNode) node);
    }

    public VisitDecision preorder(CExpressionStatement node) {
        return this.preorder((CStatement) node);
    }

    public VisitDecision preorder(CIfStatement node) {
        return this.preorder((CStatement) node);
    }

    public VisitDecision preorder(CReturnStatement node) {
        return this.preorder((CStatement) node);
    }

    public VisitDecision preorder(CParameter node) {
        return this.preorder((ISCNode) node);
    }

    public VisitDecision preorder(CDeclaration node) {
        return this.preorder((ISCNode) node);
    }

    public VisitDecision preorder(CVariableDeclaration node) {
        return this.preorder((CDeclaration) node);
    }

    public VisitDecision preorder(CFunctionDeclaration node) {
        return this.preorder((CDeclaration) node);
    }

    public VisitDecision preorder(CFunctionDefinition node) {
        return this.preorder((CDeclaration) node);
    }

    public VisitDecision preorder(CStructDeclaration node) {
        return this.preorder((CDeclaration) node);
    }

    public VisitDecision preorder(CTypedefDeclaration node) {
        return this.preorder((CDeclaration) node);
    }

    public VisitDecision preorder(CTranslationUnit node) {
        return this.preorder((ISCNode) node);
    }

    /************************* POSTORDER *****************************/

    @SuppressWarnings("EmptyMethod")
    public void postorder(ISCNode ignored) {}

    // Specification

    public void postorder(SCSpec node) {
        this.postorder((ISCNode) node);
    }

    public void postorder(SCStream node) {
        this.postorder((ISCNode) node);
    }

    public void postorder(SCTrigger node) {
        this.postorder((ISCNode) node);
    }

    // Types

    public void postorder(SCType node) {
        this.postorder((ISCNode) node);
    }

    public void postorder(SCTypeBaseType node) {
        this.postorder((SCType) node);
    }

    public void postorder(SCTypeBool node) {
        this.postorder((SCTypeBaseType) node);
    }

    public void postorder(SCTypeInteger node) {
        this.postorder((SCTypeBaseType) node);
    }

    public void postorder(SCTypeFP node) {
        this.postorder((SCTypeBaseType) node);
    }

    public void postorder(SCTypeArray node) {
        this.postorder((SCType) node);
    }

    public void postorder(SCTypeStruct node) {
        this.postorder((SCType) node);
    }

    public void postorder(SCTypeStruct.Field node) {
        this.postorder((ISCNode) node);
    }

    // Expressions

    public void postorder(SCExpression node) {
        this.postorder((ISCNode) node);
    }

    public void postorder(SCLiteral node) {
        this.postorder((SCExpression) node);
    }

    public void postorder(SCBoolLiteral node) {
        this.postorder((SCLiteral) node);
    }

    public void postorder(SCIntLiteral node) {
        this.postorder((SCLiteral) node);
    }

    public void postorder(SCFloatLiteral node) {
        this.postorder((SCLiteral) node);
    }

    public void postorder(SCArrayLiteral node) {
        this.postorder((SCLiteral) node);
    }

    public void postorder(SCStructLiteral node) {
        this.postorder((SCLiteral) node);
    }

    public void postorder(SCLetExpression node) {
        this.postorder((SCExpression) node);
    }

    public void postorder(SCVariableExpression node) {
        this.postorder((SCExpression) node);
    }

    public void postorder(SCDropExpression node) {
        this.postorder((SCExpression) node);
    }

    public void postorder(SCExternExpression node) {
        this.postorder((SCExpression) node);
    }

    public void postorder(SCApplyExpression node) {
        this.postorder((SCExpression) node);
    }

    // C types

    public void postorder(CType node) {
        this.postorder((ISCNode) node);
    }

    public void postorder(CTypeName node) {
        this.postorder((CType) node);
    }

    public void postorder(CTypeStruct node) {
        this.postorder((CType) node);
    }

    public void postorder(CTypePointer node) {
        this.postorder((CType) node);
    }

    public void postorder(CTypeArray node) {
        this.postorder((CType) node);
    }

    // C expressions

    public void postorder(CExpression node) {
        this.postorder((ISCNode) node);
    }

    public void postorder(CIdentifier node) {
        this.postorder((CExpression) node);
    }

    public void postorder(CBoolConstant node) {
        this.postorder((CExpression) node);
    }

    public void postorder(CIntConstant node) {
        this.postorder((CExpression) node);
    }

    public void postorder(CFloatConstant node) {
        this.postorder((CExpression) node);
    }

    public void postorder(CUnaryExpression node) {
        this.postorder((CExpression) node);
    }

    public void postorder(CBinaryExpression node) {
        this.postorder((CExpression) node);
    }

    public void postorder(CConditionalExpression node) {
        this.postorder((CExpression) node);
    }

    public void postorder(CCallExpression node) {
        this.postorder((CExpression) node);
    }

    public void postorder(CIndexExpression node) {
        this.postorder((CExpression) node);
    }

    public void postorder(CMemberExpression node) {
        this.postorder((CExpression) node);
    }

    public void postorder(CCastExpression node) {
        this.postorder((CExpression) node);
    }

    public void postorder(CAssignExpression node) {
        this.postorder((CExpression) node);
    }

    public void postorder(CSizeOfExpression node) {
        this.postorder((CExpression) node);
    }

    public void postorder(CCompoundLiteral node) {
        this.postorder((CExpression) node);
    }

    // C statements and declarations

    public void postorder(CInitializer node) {
        this.postorder((ISCNode) node);
    }

    public void postorder(CInitExpression node) {
        this.postorder((CInitializer) node);
    }

    public void postorder(CInitList node) {
        this.postorder((CInitializer) node);
    }

    public void postorder(CStatement node) {
        this.postorder((ISCNode) node);
    }

    public void postorder(CExpressionStatement node) {
        this.postorder((CStatement) node);
    }

    public void postorder(CIfStatement node) {
        this.postorder((CStatement) node);
    }

    public void postorder(CReturnStatement node) {
        this.postorder((CStatement) node);
    }

    public void postorder(CParameter node) {
        this.postorder((ISCNode) node);
    }

    public void postorder(CDeclaration node) {
        this.postorder((ISCNode) node);
    }

    public void postorder(CVariableDeclaration node) {
        this.postorder((CDeclaration) node);
    }

    public void postorder(CFunctionDeclaration node) {
        this.postorder((CDeclaration) node);
    }

    public void postorder(CFunctionDefinition node) {
        this.postorder((CDeclaration) node);
    }

    public void postorder(CStructDeclaration node) {
        this.postorder((CDeclaration) node);
    }

    public void postorder(CTypedefDeclaration node) {
        this.postorder((CDeclaration) node);
    }

    public void postorder(CTranslationUnit node) {
        this.postorder((ISCNode) node);
    }

    @Override
    public String toString() {
        return this.id + " " + this.getClass().getSimpleName();
    }

    public ISCNode apply(ISCNode node) {
        this.startVisit(node);
        node.accept(this);
        this.endVisit();
        return node;
    }
}
