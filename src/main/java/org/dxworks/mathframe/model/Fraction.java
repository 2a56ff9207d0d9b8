package org.dxworks.mathframe.model;

import java.util.Objects;

/** {@code <mfrac>}: numerator over denominator. */
public final class Fraction extends MathNode {
    public final MathNode numerator;
    public final MathNode denominator;

    public Fraction(MathNode numerator, MathNode denominator) {
        this.numerator = Objects.requireNonNull(numerator, "numerator");
        this.denominator = Objects.requireNonNull(denominator, "denominator");
    }

    @Override
    public String flatText() {
        return "";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Fraction)) return false;
        Fraction other = (Fraction) o;
        return numerator.equals(other.numerator) && denominator.equals(other.denominator);
    }

    @Override
    public int hashCode() {
        return Objects.hash(numerator, denominator);
    }

    @Override
    public String toString() {
        return "Fraction(" + numerator + ", " + denominator + ")";
    }
}
