package org.modal.tableaux;

import org.modal.formula.Formula;
import org.modal.formula.SignedFormula;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * TRACCIA DELLA PROVA - Registro leggibile delle espansioni del tableaux
 *
 * Ogni applicazione di regola aggiunge una riga, nell'ordine in cui le espansioni
 * vengono eseguite. La sequenza è append-only e viene esposta dal risultato come
 * lista immutabile.
 *
 * FORMATO RIGHE:
 * [regola] wN: formula_con_segno ⇒ effetto
 * Ramo chiuso: contraddizione in wN su φ
 */
public class ProofTrace {

    private static final Logger LOGGER = Logger.getLogger(ProofTrace.class.getName());

    private final List<String> steps;

    public ProofTrace() {
        this.steps = new ArrayList<>();
    }

    //region REGISTRAZIONE

    public void recordStart(Formula formula, ModalLogicType logicType) {
        record(String.format("Inizio (logica %s): si assume falsa %s in w0", logicType, formula));
    }

    /**
     * Registra l'applicazione di una regola di espansione.
     *
     * @param ruleName nome della regola applicata
     * @param worldId mondo in cui si trova la formula espansa
     * @param source formula con segno espansa
     * @param effect descrizione dell'effetto della regola
     */
    public void recordExpansion(String ruleName, int worldId, SignedFormula source, String effect) {
        record(String.format("[%s] w%d: %s ⇒ %s", ruleName, worldId, source, effect));
    }

    public void recordClosure(int worldId, Collection<Formula> clashes) {
        String formulas = clashes.stream().map(Object::toString).collect(Collectors.joining(", "));
        record(String.format("Ramo chiuso: contraddizione in w%d su %s", worldId, formulas));
    }

    public void record(String step) {
        if (step == null || step.trim().isEmpty()) {
            throw new IllegalArgumentException("Passo della prova non può essere vuoto");
        }
        steps.add(step);
        LOGGER.fine(step);
    }

    //endregion

    //region LETTURA

    public List<String> getSteps() {
        return List.copyOf(steps);
    }

    //endregion
}
