package org.dxworks.mathframe.model;

import java.util.List;

/** {@code <msqrt>}: its children form the radicand. */
public final class SquareRoot extends MathNode {
    public final List<MathNode> children;

    public SquareRoot(List<MathNode> children) {
        this.children = List.copyOf(children);
    }

    @Override
    public String flatText() {
        return "";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SquareRoot)) return false;
        return children.equals(((SquareRoot) o).children);
    }

    @Override
    public int hashCode() {
        return children.hashCode();
    }

    @Override
    public String toString() {
        return "SquareRoot" + children;
    }
}
