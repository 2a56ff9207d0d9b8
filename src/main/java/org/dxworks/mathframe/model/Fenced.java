package org.dxworks.mathframe.model;

import java.util.List;
import java.util.Objects;

/** {@code <mfenced>}: children between an opening and a closing delimiter glyph. */
public final class Fenced extends MathNode {
    public final String openDelim;
    public final String closeDelim;
    public final List<MathNode> children;

    public Fenced(String openDelim, String closeDelim, List<MathNode> children) {
        this.openDelim = Objects.requireNonNull(openDelim, "openDelim");
        this.closeDelim = Objects.requireNonNull(closeDelim, "closeDelim");
        this.children = List.copyOf(children);
    }

    @Override
    public String flatText() {
        return "";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Fenced)) return false;
        Fenced other = (Fenced) o;
        return openDelim.equals(other.openDelim)
                && closeDelim.equals(other.closeDelim)
                && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(openDelim, closeDelim, children);
    }

    @Override
    public String toString() {
        return "Fenced(" + openDelim + ", " + closeDelim + ", " + children + ")";
    }
}
