package org.dxworks.mathframe.model;

import java.util.List;

/**
 * Ordered grouping of nodes, explicit ({@code <mrow>}) or implied by a pass-through wrapper.
 */
public final class Row extends MathNode {
    public final List<MathNode> children;

    public Row(List<MathNode> children) {
        this.children = List.copyOf(children);
    }

    public static Row empty() {
        return new Row(List.of());
    }

    @Override
    public String flatText() {
        StringBuilder sb = new StringBuilder();
        for (MathNode child : children) {
            sb.append(child.flatText());
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Row)) return false;
        return children.equals(((Row) o).children);
    }

    @Override
    public int hashCode() {
        return children.hashCode();
    }

    @Override
    public String toString() {
        return "Row" + children;
    }
}
