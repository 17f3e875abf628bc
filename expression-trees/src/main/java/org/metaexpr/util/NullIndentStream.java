package org.metaexpr.util;

import java.util.Collection;
import java.util.function.Supplier;

/** Discards everything; returned by the {@link Logger} for disabled levels. */
public class NullIndentStream implements IIndentStream {
    @Override
    public IIndentStream appendChar(char c) {
        return this;
    }

    @Override
    public IIndentStream append(String string) {
        return this;
    }

    @Override
    public IIndentStream appendFast(String string) {
        return this;
    }

    @Override
    public <T extends ToIndentableString> IIndentStream append(T value) {
        return this;
    }

    @Override
    public IIndentStream append(Class<?> type) {
        return this;
    }

    @Override
    public IIndentStream appendSupplier(Supplier<String> supplier) {
        return this;
    }

    @Override
    public <T extends ToIndentableString> IIndentStream join(String separator, Collection<T> data) {
        return this;
    }

    @Override
    public <T extends ToIndentableString> IIndentStream intercalate(String separator, Collection<T> data) {
        return this;
    }

    @Override
    public IIndentStream newline() {
        return this;
    }

    @Override
    public IIndentStream increase() {
        return this;
    }

    @Override
    public IIndentStream decrease() {
        return this;
    }

    @Override
    public String toString() {
        return "";
    }
}
