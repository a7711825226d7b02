package org.modal.tableaux;

import org.modal.formula.Formula;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * RISULTATO TABLEAUX - Esito immutabile di una procedura di prova modale
 *
 * Raccoglie verdetto, conteggio dei rami, ramo aperto testimone (per formule non
 * valide), traccia della prova e statistiche di esecuzione.
 *
 * COMPONENTI:
 * - Esito: VALID (tutti i rami chiusi), INVALID (ramo aperto stabile),
 *   INCONCLUSIVE (ramo aperto trovato solo perché i limiti sono stati esauriti)
 * - Ramo aperto: presente se e solo se la formula non è valida
 * - Traccia: righe leggibili, una per regola applicata
 *
 * VALIDAZIONI:
 * - valid ⇒ nessun ramo aperto e non bounded
 * - invalid ⇒ ramo aperto presente e non chiuso
 * - 0 ≤ closedBranches ≤ totalBranches
 */
public class TableauxResult {

    /**
     * Classificazione del verdetto. INCONCLUSIVE corrisponde a isValid() == false
     * con limiti di ricerca esauriti.
     */
    public enum Status {
        VALID,
        INVALID,
        INCONCLUSIVE
    }

    //region ATTRIBUTI

    private final boolean valid;
    private final int closedBranches;
    private final int totalBranches;
    private final TableauxBranch openBranch;
    private final List<String> proofSteps;
    private final boolean bounded;
    private final Formula formula;
    private final ModalLogicType logicType;
    private final TableauxStatistics statistics;

    //endregion

    //region COSTRUZIONE E VALIDAZIONE

    /**
     * @throws IllegalArgumentException se i parametri sono fra loro inconsistenti
     */
    public TableauxResult(boolean valid, int closedBranches, int totalBranches, TableauxBranch openBranch,
                          List<String> proofSteps, boolean bounded, Formula formula,
                          ModalLogicType logicType, TableauxStatistics statistics) {
        validateParameterConsistency(valid, closedBranches, totalBranches, openBranch, bounded);

        this.valid = valid;
        this.closedBranches = closedBranches;
        this.totalBranches = totalBranches;
        this.openBranch = openBranch;
        this.proofSteps = proofSteps != null ? List.copyOf(proofSteps) : List.of();
        this.bounded = bounded;
        this.formula = Objects.requireNonNull(formula, "Formula del risultato non può essere null");
        this.logicType = Objects.requireNonNull(logicType, "Logica del risultato non può essere null");
        this.statistics = statistics != null ? statistics : new TableauxStatistics();
    }

    private static void validateParameterConsistency(boolean valid, int closedBranches, int totalBranches,
                                                     TableauxBranch openBranch, boolean bounded) {
        if (closedBranches < 0 || totalBranches < closedBranches) {
            throw new IllegalArgumentException("Conteggio rami inconsistente: chiusi=" + closedBranches
                    + ", totali=" + totalBranches);
        }
        if (valid) {
            if (openBranch != null) {
                throw new IllegalArgumentException("Risultato valido non può avere un ramo aperto");
            }
            if (bounded) {
                throw new IllegalArgumentException("Risultato valido non può derivare da limiti esauriti");
            }
        } else {
            if (openBranch == null) {
                throw new IllegalArgumentException("Risultato non valido richiede un ramo aperto testimone");
            }
            if (openBranch.isClosed()) {
                throw new IllegalArgumentException("Il ramo testimone di un risultato non valido deve essere aperto");
            }
        }
    }

    //endregion

    //region FACTORY METHODS

    public static TableauxResult valid(Formula formula, ModalLogicType logicType, int totalBranches,
                                       List<String> proofSteps, TableauxStatistics statistics) {
        return new TableauxResult(true, totalBranches, totalBranches, null, proofSteps, false,
                formula, logicType, statistics);
    }

    /**
     * @param openBranch ramo aperto da cui estrarre il contromodello
     * @param bounded true se il ramo è aperto solo perché la ricerca è stata troncata
     */
    public static TableauxResult invalid(Formula formula, ModalLogicType logicType, int closedBranches,
                                         int totalBranches, TableauxBranch openBranch, List<String> proofSteps,
                                         boolean bounded, TableauxStatistics statistics) {
        if (openBranch == null) {
            throw new IllegalArgumentException("Ramo aperto non può essere null per un risultato non valido");
        }
        return new TableauxResult(false, closedBranches, totalBranches, openBranch, proofSteps, bounded,
                formula, logicType, statistics);
    }

    //endregion

    //region ACCESSORS

    public boolean isValid() {
        return valid;
    }

    public Status getStatus() {
        if (valid) {
            return Status.VALID;
        }
        return bounded ? Status.INCONCLUSIVE : Status.INVALID;
    }

    public int getClosedBranches() {
        return closedBranches;
    }

    public int getTotalBranches() {
        return totalBranches;
    }

    public Optional<TableauxBranch> getOpenBranch() {
        return Optional.ofNullable(openBranch);
    }

    public List<String> getProofSteps() {
        return proofSteps;
    }

    public boolean isBounded() {
        return bounded;
    }

    public Formula getFormula() {
        return formula;
    }

    public ModalLogicType getLogicType() {
        return logicType;
    }

    public TableauxStatistics getStatistics() {
        return statistics;
    }

    //endregion

    //region OUTPUT

    @Override
    public String toString() {
        StringBuilder output = new StringBuilder();
        output.append(describeStatus()).append("\n");
        output.append("Formula: ").append(formula).append("\n");
        output.append("Logica: ").append(logicType).append("\n");
        output.append("Rami chiusi: ").append(closedBranches).append("/").append(totalBranches).append("\n");

        if (proofSteps.isEmpty()) {
            output.append("Nessuna regola applicata.\n");
        } else {
            output.append("Traccia della prova:\n");
            for (int i = 0; i < proofSteps.size(); i++) {
                output.append("  ").append(i + 1).append(". ").append(proofSteps.get(i)).append("\n");
            }
        }
        return output.toString();
    }

    private String describeStatus() {
        switch (getStatus()) {
            case VALID:
                return "VALIDA";
            case INVALID:
                return "NON VALIDA";
            default:
                return "NON VALIDA (limiti di ricerca esauriti, verdetto non conclusivo)";
        }
    }

    public String toCompactString() {
        return String.format("TableauxResult{%s, logica=%s, rami=%d/%d, time=%dms}",
                getStatus(), logicType, closedBranches, totalBranches, statistics.getExecutionTimeMs());
    }

    //endregion
}
