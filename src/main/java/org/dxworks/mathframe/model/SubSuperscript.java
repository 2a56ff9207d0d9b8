package org.dxworks.mathframe.model;

import java.util.Objects;

/**
 * {@code <msubsup>}, and the canonical form whenever both scripts apply to one base.
 */
public final class SubSuperscript extends MathNode {
    public final MathNode base;
    public final MathNode sub;
    public final MathNode sup;

    public SubSuperscript(MathNode base, MathNode sub, MathNode sup) {
        this.base = Objects.requireNonNull(base, "base");
        this.sub = Objects.requireNonNull(sub, "sub");
        this.sup = Objects.requireNonNull(sup, "sup");
    }

    @Override
    public String flatText() {
        return "";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SubSuperscript)) return false;
        SubSuperscript other = (SubSuperscript) o;
        return base.equals(other.base) && sub.equals(other.sub) && sup.equals(other.sup);
    }

    @Override
    public int hashCode() {
        return Objects.hash(base, sub, sup);
    }

    @Override
    public String toString() {
        return "SubSuperscript(" + base + ", " + sub + ", " + sup + ")";
    }
}
