package org.dxworks.mathframe.model;

import java.util.Objects;

/** {@code <msup>}. */
public final class Superscript extends MathNode {
    public final MathNode base;
    public final MathNode sup;

    public Superscript(MathNode base, MathNode sup) {
        this.base = Objects.requireNonNull(base, "base");
        this.sup = Objects.requireNonNull(sup, "sup");
    }

    @Override
    public String flatText() {
        return "";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Superscript)) return false;
        Superscript other = (Superscript) o;
        return base.equals(other.base) && sup.equals(other.sup);
    }

    @Override
    public int hashCode() {
        return Objects.hash(base, sup);
    }

    @Override
    public String toString() {
        return "Superscript(" + base + ", " + sup + ")";
    }
}
