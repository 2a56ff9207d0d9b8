package org.dxworks.mathframe.model;

/** Layout-only node produced by {@code <mspace>}. */
public final class Space extends MathNode {

    @Override
    public String flatText() {
        return "";
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Space;
    }

    @Override
    public int hashCode() {
        return Space.class.hashCode();
    }

    @Override
    public String toString() {
        return "Space";
    }
}
