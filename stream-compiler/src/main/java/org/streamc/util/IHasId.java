package org.streamc.util;

/** An object with a unique numeric id. */
public interface IHasId {
    long getId();
}
