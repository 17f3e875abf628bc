package org.metaexpr.util;

import java.util.HashMap;
import java.util.Map;

/** A Bijection is a pair of one-to-one maps.
 * Used to pair the bound entities of two trees being compared. */
public class Bijection<L, R> {
    final Map<L, R> left;
    final Map<R, L> right;

    public Bijection() {
        this.left = new HashMap<>();
        this.right = new HashMap<>();
    }

    /** Record the pairing of left and right on first sight of either,
     * and check that both are paired with each other.
     * @return false if either side was previously paired with something else. */
    public boolean pair(L left, R right) {
        this.left.putIfAbsent(left, right);
        this.right.putIfAbsent(right, left);
        return this.left.get(left) == right && this.right.get(right) == left;
    }

    @Override
    public String toString() {
        return this.left.toString();
    }
}
