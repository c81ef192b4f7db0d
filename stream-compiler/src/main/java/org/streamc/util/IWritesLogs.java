package org.streamc.util;

/** Marker for classes that write to the {@link Logger}. */
public interface IWritesLogs {
    default String getClassName() {
        return this.getClass().getSimpleName();
    }
}
