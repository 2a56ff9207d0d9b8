package org.dxworks.mathframe.model;

import java.util.Objects;

/** {@code <mroot>}: radical with an explicit index. */
public final class Root extends MathNode {
    public final MathNode base;
    public final MathNode index;

    public Root(MathNode base, MathNode index) {
        this.base = Objects.requireNonNull(base, "base");
        this.index = Objects.requireNonNull(index, "index");
    }

    @Override
    public String flatText() {
        return "";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Root)) return false;
        Root other = (Root) o;
        return base.equals(other.base) && index.equals(other.index);
    }

    @Override
    public int hashCode() {
        return Objects.hash(base, index);
    }

    @Override
    public String toString() {
        return "Root(" + base + ", " + index + ")";
    }
}
