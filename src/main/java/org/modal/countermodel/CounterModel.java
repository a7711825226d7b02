package org.modal.countermodel;

import org.modal.formula.Formula;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * CONTROMODELLO - Struttura di Kripke che falsifica una formula nel mondo iniziale
 *
 * Immutabile dopo la costruzione: la spiegazione è copiata in una lista immutabile e la
 * struttura viene esposta solo tramite accessori in sola lettura.
 */
public class CounterModel {

    private final Formula formula;
    private final KripkeStructure kripke;
    private final List<String> explanation;

    public CounterModel(Formula formula, KripkeStructure kripke) {
        this(formula, kripke, List.of());
    }

    public CounterModel(Formula formula, KripkeStructure kripke, List<String> explanation) {
        this.formula = Objects.requireNonNull(formula, "Formula del contromodello non può essere null");
        this.kripke = Objects.requireNonNull(kripke, "Struttura di Kripke non può essere null");
        this.explanation = explanation != null ? List.copyOf(explanation) : List.of();
    }

    public Formula getFormula() {
        return formula;
    }

    public KripkeStructure getKripke() {
        return kripke;
    }

    public List<String> getExplanation() {
        return explanation;
    }

    //region SERIALIZZAZIONE

    public Map<String, Object> toMap() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("formula", formula.toString());
        data.put("kripke_structure", kripke.toMap());
        data.put("explanation", explanation);
        return data;
    }

    public String toJson() {
        return JsonSupport.toPrettyJson(toMap());
    }

    /**
     * Riepilogo leggibile: formula, logica, mondi, relazione e valutazione.
     */
    @Override
    public String toString() {
        StringBuilder output = new StringBuilder();
        output.append("Contromodello per: ").append(formula).append("\n");
        output.append("Logica: ").append(kripke.getLogicType()).append("\n");
        output.append("Mondi: ").append(kripke.getWorlds())
                .append(" (iniziale: w").append(kripke.getInitialWorld()).append(")\n");

        output.append("Accessibilità:\n");
        for (Integer world : kripke.getWorlds()) {
            Set<Integer> targets = kripke.getAccessibleWorlds(world);
            output.append("  w").append(world).append(" → ");
            output.append(targets.isEmpty() ? "∅" : formatWorlds(targets)).append("\n");
        }

        output.append("Valutazione:\n");
        for (Integer world : kripke.getWorlds()) {
            Set<String> atoms = kripke.getTrueAtoms(world);
            output.append("  w").append(world).append(": ");
            output.append(atoms.isEmpty() ? "nessun atomo vero" : String.join(", ", atoms)).append("\n");
        }

        if (!explanation.isEmpty()) {
            output.append("Spiegazione:\n");
            explanation.forEach(line -> output.append("  - ").append(line).append("\n"));
        }
        return output.toString();
    }

    private static String formatWorlds(Set<Integer> worlds) {
        StringBuilder text = new StringBuilder();
        for (Integer world : worlds) {
            if (text.length() > 0) {
                text.append(", ");
            }
            text.append("w").append(world);
        }
        return text.toString();
    }

    //endregion
}
