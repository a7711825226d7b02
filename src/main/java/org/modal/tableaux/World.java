package org.modal.tableaux;

import org.modal.formula.Formula;
import org.modal.formula.SignedFormula;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * MONDO - Punto di valutazione di un ramo del tableaux
 *
 * Mantiene l'insieme delle formule asserite vere e quello delle formule asserite false
 * nel mondo, più il registro delle formule con segno già espanse. Un mondo contiene una
 * contraddizione se e solo se la stessa formula compare in entrambi gli insiemi.
 *
 * INVARIANTI:
 * - L'identificatore è immutabile
 * - Le formule vengono solo aggiunte, mai rimosse
 * - Gli insiemi preservano l'ordine di inserimento (espansione deterministica)
 */
public class World {

    private final int id;

    /** Formule asserite vere nel mondo */
    private final Set<Formula> formulas;

    /** Formule asserite false nel mondo */
    private final Set<Formula> negatedFormulas;

    /** Formule con segno la cui regola è già stata applicata in questo mondo */
    private final Set<SignedFormula> expanded;

    public World(int id) {
        if (id < 0) {
            throw new IllegalArgumentException("ID mondo deve essere >= 0, ricevuto: " + id);
        }
        this.id = id;
        this.formulas = new LinkedHashSet<>();
        this.negatedFormulas = new LinkedHashSet<>();
        this.expanded = new LinkedHashSet<>();
    }

    /**
     * Copia profonda: gli insiemi della copia sono indipendenti da quelli dell'originale.
     * Le formule sono immutabili e vengono condivise.
     */
    public World copy() {
        World copy = new World(id);
        copy.formulas.addAll(formulas);
        copy.negatedFormulas.addAll(negatedFormulas);
        copy.expanded.addAll(expanded);
        return copy;
    }

    //region ASSERZIONI

    /**
     * Asserisce una formula nel mondo.
     *
     * @param formula formula da asserire
     * @param negated true per asserirla falsa
     * @return true se la formula non era già presente con la stessa polarità
     */
    public boolean addFormula(Formula formula, boolean negated) {
        Objects.requireNonNull(formula, "Formula da aggiungere al mondo w" + id + " non può essere null");
        return negated ? negatedFormulas.add(formula) : formulas.add(formula);
    }

    public boolean addFormula(SignedFormula signedFormula) {
        return addFormula(signedFormula.formula(), signedFormula.negated());
    }

    public boolean contains(Formula formula, boolean negated) {
        return negated ? negatedFormulas.contains(formula) : formulas.contains(formula);
    }

    public Set<Formula> getFormulas() {
        return Collections.unmodifiableSet(formulas);
    }

    public Set<Formula> getNegatedFormulas() {
        return Collections.unmodifiableSet(negatedFormulas);
    }

    //endregion

    //region CONTRADDIZIONI

    public boolean hasContradiction() {
        for (Formula formula : formulas) {
            if (negatedFormulas.contains(formula)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return formule asserite sia vere sia false, in ordine di inserimento
     */
    public Set<Formula> getContradictions() {
        Set<Formula> clashes = new LinkedHashSet<>(formulas);
        clashes.retainAll(negatedFormulas);
        return clashes;
    }

    //endregion

    //region REGISTRO ESPANSIONI

    public void markExpanded(SignedFormula signedFormula) {
        expanded.add(signedFormula);
    }

    public boolean isExpanded(SignedFormula signedFormula) {
        return expanded.contains(signedFormula);
    }

    /**
     * @return formule composte non ancora espanse: prima le positive, poi le negate
     */
    public Set<SignedFormula> getPendingFormulas() {
        Set<SignedFormula> pending = new LinkedHashSet<>();
        for (Formula formula : formulas) {
            collectPending(SignedFormula.positive(formula), pending);
        }
        for (Formula formula : negatedFormulas) {
            collectPending(SignedFormula.negative(formula), pending);
        }
        return pending;
    }

    private void collectPending(SignedFormula candidate, Set<SignedFormula> pending) {
        if (!candidate.formula().isAtomic() && !expanded.contains(candidate)) {
            pending.add(candidate);
        }
    }

    //endregion

    public int getId() {
        return id;
    }

    @Override
    public String toString() {
        return "w" + id + " {vere=" + formulas + ", false=" + negatedFormulas + "}";
    }
}
