/*
 * Copyright 2024 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.metaexpr.interpreter;

import org.metaexpr.util.Utilities;
import org.metaexpr.visitors.inner.Substitution;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

/** A stack of nested scopes, each mapping variables to values.
 * Inner scopes shadow outer ones.  Keys are compared by reference. */
public class Scopes<K, V> {
    protected final List<Substitution<K, V>> stack;

    public Scopes() {
        this.stack = new ArrayList<>();
    }

    public void newContext() {
        this.stack.add(new Substitution<>());
    }

    public void popContext() {
        Utilities.removeLast(this.stack);
    }

    /** Bind a key in the innermost scope. */
    public void substitute(K key, V value) {
        Utilities.enforce(!this.stack.isEmpty(), "Empty context");
        Utilities.last(this.stack).substitute(key, value);
    }

    public boolean has(K key) {
        for (int i = this.stack.size() - 1; i >= 0; i--) {
            if (this.stack.get(i).containsKey(key))
                return true;
        }
        return false;
    }

    /** The value bound to key in the innermost scope that binds it. */
    public V get(K key) {
        for (int i = this.stack.size() - 1; i >= 0; i--) {
            Substitution<K, V> subst = this.stack.get(i);
            if (subst.containsKey(key))
                return subst.get(key);
        }
        throw new NoSuchElementException("Unbound variable " + key);
    }

    /** Change the value of a key in the innermost scope that binds it. */
    public void assign(K key, V value) {
        for (int i = this.stack.size() - 1; i >= 0; i--) {
            Substitution<K, V> subst = this.stack.get(i);
            if (subst.containsKey(key)) {
                subst.substitute(key, value);
                return;
            }
        }
        throw new NoSuchElementException("Unbound variable " + key);
    }

    /** A new stack sharing the current scopes: assignments through either stack
     * are visible in the other, but new scopes are not. */
    public Scopes<K, V> capture() {
        Scopes<K, V> result = new Scopes<>();
        result.stack.addAll(this.stack);
        return result;
    }

    @Override
    public String toString() {
        return this.stack.toString();
    }
}
