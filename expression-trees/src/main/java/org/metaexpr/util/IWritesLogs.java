package org.metaexpr.util;

/** Marker for classes whose log output is controlled through {@link Logger}. */
public interface IWritesLogs {
}
