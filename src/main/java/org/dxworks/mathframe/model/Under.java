package org.dxworks.mathframe.model;

import java.util.Objects;

/** {@code <munder>}: a lower limit, or an n-ary operator with only a lower bound. */
public final class Under extends MathNode {
    public final MathNode base;
    public final MathNode underMark;

    public Under(MathNode base, MathNode underMark) {
        this.base = Objects.requireNonNull(base, "base");
        this.underMark = Objects.requireNonNull(underMark, "underMark");
    }

    @Override
    public String flatText() {
        return "";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Under)) return false;
        Under other = (Under) o;
        return base.equals(other.base) && underMark.equals(other.underMark);
    }

    @Override
    public int hashCode() {
        return Objects.hash(base, underMark);
    }

    @Override
    public String toString() {
        return "Under(" + base + ", " + underMark + ")";
    }
}
