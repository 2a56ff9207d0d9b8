package org.dxworks.mathframe.model;

import java.util.Objects;

/** {@code <msub>}. */
public final class Subscript extends MathNode {
    public final MathNode base;
    public final MathNode sub;

    public Subscript(MathNode base, MathNode sub) {
        this.base = Objects.requireNonNull(base, "base");
        this.sub = Objects.requireNonNull(sub, "sub");
    }

    @Override
    public String flatText() {
        return "";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Subscript)) return false;
        Subscript other = (Subscript) o;
        return base.equals(other.base) && sub.equals(other.sub);
    }

    @Override
    public int hashCode() {
        return Objects.hash(base, sub);
    }

    @Override
    public String toString() {
        return "Subscript(" + base + ", " + sub + ")";
    }
}
