/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.syntree.graph;

import java.util.List;

import com.google.common.collect.ImmutableList;


/**
 * A path between two tokens through the undirected dependency graph.  Each step
 * is described by the relation that was crossed, prefixed with {@code ↑} when
 * the step moved from a dependent to its head and with {@code ↓} when it moved
 * from a head to a dependent.
 */
public class DependencyPath {

    public static final char UP = '↑';

    public static final char DOWN = '↓';

    private final ImmutableList<Integer> indices;

    private final ImmutableList<String> relations;

    DependencyPath(List<Integer> indices, List<String> relations) {
        if (indices.isEmpty()
                || relations.size() != indices.size() - 1)
            throw new IllegalArgumentException(
                "A path needs one relation per step");
        this.indices = ImmutableList.copyOf(indices);
        this.relations = ImmutableList.copyOf(relations);
    }

    public int source() {
        return indices.get(0);
    }

    public int target() {
        return indices.get(indices.size() - 1);
    }

    /**
     * Returns the token indices on the path, from source to target inclusive.
     */
    public List<Integer> indices() {
        return indices;
    }

    /**
     * Returns the relation crossed by each step.
     */
    public List<String> relations() {
        return relations;
    }

    /**
     * Returns the number of edges on the path.
     */
    public int length() {
        return relations.size();
    }

    @Override public boolean equals(Object o) {
        if (!(o instanceof DependencyPath))
            return false;
        DependencyPath p = (DependencyPath)o;
        return indices.equals(p.indices) && relations.equals(p.relations);
    }

    @Override public int hashCode() {
        return indices.hashCode();
    }

    @Override public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(indices.get(0));
        for (int i = 0; i < relations.size(); ++i)
            sb.append(' ').append(relations.get(i)).append(' ')
                .append(indices.get(i + 1));
        return sb.toString();
    }
}
