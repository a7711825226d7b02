package org.modal.formula;

import java.util.Objects;

/**
 * Formula con polarità: asserita vera (negated = false) oppure asserita falsa (negated = true)
 * in un mondo del tableaux.
 */
public final class SignedFormula {

    private final Formula formula;
    private final boolean negated;

    public SignedFormula(Formula formula, boolean negated) {
        this.formula = Objects.requireNonNull(formula, "Formula con segno non può essere null");
        this.negated = negated;
    }

    public static SignedFormula positive(Formula formula) {
        return new SignedFormula(formula, false);
    }

    public static SignedFormula negative(Formula formula) {
        return new SignedFormula(formula, true);
    }

    public Formula formula() {
        return formula;
    }

    public boolean negated() {
        return negated;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        SignedFormula other = (SignedFormula) obj;
        return negated == other.negated && formula.equals(other.formula);
    }

    @Override
    public int hashCode() {
        return Objects.hash(formula, negated);
    }

    @Override
    public String toString() {
        return negated ? "¬" + formula : formula.toString();
    }
}
