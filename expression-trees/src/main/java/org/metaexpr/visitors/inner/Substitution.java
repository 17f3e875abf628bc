package org.metaexpr.visitors.inner;

import org.metaexpr.util.Utilities;

import java.util.IdentityHashMap;
import java.util.Map;

/** A map from nodes to their replacements.  Keys are compared by reference. */
public class Substitution<K, V> extends IdentityHashMap<K, V> {
    public Substitution() {}

    public Substitution(Map<? extends K, ? extends V> data) {
        data.forEach(this::substitute);
    }

    public void substitute(K key, V value) {
        this.put(key, value);
    }

    /** Add a substitution for a key which must not be already substituted. */
    public void substituteNew(K key, V value) {
        Utilities.putNew(this, key, value);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append("[");
        for (Map.Entry<K, V> entry: this.entrySet())
            builder.append(entry.getKey()).append(" -> ").append(entry.getValue()).append(",");
        builder.append("]");
        return builder.toString();
    }
}
