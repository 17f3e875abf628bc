package org.metaexpr.util;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.Member;
import java.lang.reflect.Method;

/** Lookup helpers over java.lang.reflect, throwing unchecked exceptions. */
public class Reflection {
    private Reflection() {}

    public static Method method(Class<?> clazz, String name, Class<?>... parameterTypes) {
        try {
            return clazz.getMethod(name, parameterTypes);
        } catch (NoSuchMethodException ex) {
            try {
                return clazz.getDeclaredMethod(name, parameterTypes);
            } catch (NoSuchMethodException inner) {
                throw new IllegalArgumentException("No method " + clazz.getSimpleName() + "." + name, inner);
            }
        }
    }

    public static Field field(Class<?> clazz, String name) {
        try {
            return clazz.getDeclaredField(name);
        } catch (NoSuchFieldException ex) {
            try {
                return clazz.getField(name);
            } catch (NoSuchFieldException inner) {
                throw new IllegalArgumentException("No field " + clazz.getSimpleName() + "." + name, inner);
            }
        }
    }

    public static <T> Constructor<T> constructor(Class<T> clazz, Class<?>... parameterTypes) {
        try {
            return clazz.getDeclaredConstructor(parameterTypes);
        } catch (NoSuchMethodException ex) {
            throw new IllegalArgumentException("No constructor for " + clazz.getSimpleName(), ex);
        }
    }

    /** The type of the value produced by reading a member: a field or a getter method. */
    public static Class<?> memberType(Member member) {
        if (member instanceof Field)
            return ((Field) member).getType();
        if (member instanceof Method)
            return ((Method) member).getReturnType();
        throw new IllegalArgumentException("Member " + member + " is neither a field nor a method");
    }
}
