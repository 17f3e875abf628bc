package org.metaexpr.util;

import com.google.common.collect.ImmutableList;

import javax.annotation.Nullable;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.function.Function;

/** Small collection helpers in the style of C#'s LINQ. */
public class Linq {
    private Linq() {}

    public static <T, S> ImmutableList<S> map(Collection<T> data, Function<T, S> function) {
        ImmutableList.Builder<S> result = ImmutableList.builderWithExpectedSize(data.size());
        for (T d: data)
            result.add(function.apply(d));
        return result.build();
    }

    /** True if the two collections contain the same objects (by reference) in the same order. */
    public static <T> boolean same(@Nullable Collection<T> left, @Nullable Collection<T> right) {
        if (left == right)
            return true;
        if (left == null || right == null)
            return false;
        if (left.size() != right.size())
            return false;
        Iterator<T> r = right.iterator();
        for (T l: left) {
            if (l != r.next())
                return false;
        }
        return true;
    }

    @SafeVarargs
    public static <T> List<T> list(T... data) {
        return ImmutableList.copyOf(data);
    }
}
