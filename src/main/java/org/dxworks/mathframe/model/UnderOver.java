package org.dxworks.mathframe.model;

import java.util.Objects;

/** {@code <munderover>}. */
public final class UnderOver extends MathNode {
    public final MathNode base;
    public final MathNode underMark;
    public final MathNode overMark;

    public UnderOver(MathNode base, MathNode underMark, MathNode overMark) {
        this.base = Objects.requireNonNull(base, "base");
        this.underMark = Objects.requireNonNull(underMark, "underMark");
        this.overMark = Objects.requireNonNull(overMark, "overMark");
    }

    @Override
    public String flatText() {
        return "";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UnderOver)) return false;
        UnderOver other = (UnderOver) o;
        return base.equals(other.base) && underMark.equals(other.underMark) && overMark.equals(other.overMark);
    }

    @Override
    public int hashCode() {
        return Objects.hash(base, underMark, overMark);
    }

    @Override
    public String toString() {
        return "UnderOver(" + base + ", " + underMark + ", " + overMark + ")";
    }
}
