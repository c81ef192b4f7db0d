package org.streamc.streamCompiler.compiler.visitors;

/** Returned by a preorder method: STOP skips the children of the node and its postorder. */
public enum VisitDecision {
    STOP,
    CONTINUE;

    public boolean stop() {
        return this.equals(STOP);
    }
}
