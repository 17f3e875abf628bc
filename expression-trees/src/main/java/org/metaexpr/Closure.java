package org.metaexpr;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/** Marks a class whose instances hold variables captured by expression trees.
 * A tree reads a captured variable through a field of a constant instance of the class;
 * the class must be private, local, or anonymous. */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface Closure {
}
