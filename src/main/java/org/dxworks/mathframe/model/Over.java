package org.dxworks.mathframe.model;

import java.util.Objects;

/** {@code <mover>}: an accent or an upper limit, decided at serialization. */
public final class Over extends MathNode {
    public final MathNode base;
    public final MathNode overMark;

    public Over(MathNode base, MathNode overMark) {
        this.base = Objects.requireNonNull(base, "base");
        this.overMark = Objects.requireNonNull(overMark, "overMark");
    }

    @Override
    public String flatText() {
        return "";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Over)) return false;
        Over other = (Over) o;
        return base.equals(other.base) && overMark.equals(other.overMark);
    }

    @Override
    public int hashCode() {
        return Objects.hash(base, overMark);
    }

    @Override
    public String toString() {
        return "Over(" + base + ", " + overMark + ")";
    }
}
