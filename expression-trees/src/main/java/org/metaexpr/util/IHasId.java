package org.metaexpr.util;

/** An object with a unique id, used for printing and logging. */
public interface IHasId {
    long getId();
}
