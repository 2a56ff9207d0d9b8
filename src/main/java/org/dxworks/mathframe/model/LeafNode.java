package org.dxworks.mathframe.model;

import java.util.Objects;

/**
 * Base for nodes that hold only text content.
 */
public abstract class LeafNode extends MathNode {
    public final String text;

    protected LeafNode(String text) {
        this.text = text == null ? "" : text;
    }

    @Override
    public String flatText() {
        return text;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return text.equals(((LeafNode) o).text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), text);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + text + ")";
    }
}
