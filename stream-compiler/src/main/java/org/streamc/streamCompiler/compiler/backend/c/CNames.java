package org.streamc.streamCompiler.compiler.backend.c;

/** Names of the C entities generated for streams and triggers. */
public final class CNames {
    private CNames() {}

    public static String buffer(int streamId) {
        return "s" + streamId;
    }

    public static String index(int streamId) {
        return buffer(streamId) + "_idx";
    }

    /** Holds the next value of a stream until all generators have run. */
    public static String temporary(int streamId) {
        return buffer(streamId) + "_tmp";
    }

    public static String generator(int streamId) {
        return buffer(streamId) + "_gen";
    }

    public static String guard(String trigger) {
        return trigger + "_guard";
    }

    /** Name of the function computing an argument, and of the handler parameter. */
    public static String argument(String trigger, int index) {
        return trigger + "_arg" + index;
    }

    /** Name of a static constant holding an array literal. */
    public static String literal(int index) {
        return "lit" + index;
    }
}
