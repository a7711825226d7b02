package org.modal.tableaux;

/**
 * STATISTICHE TABLEAUX - Raccolta metriche di esecuzione della procedura di prova
 *
 * Conta round di espansione, applicazioni di regole, biforcazioni, mondi creati e rami
 * chiusi, e misura il tempo di esecuzione dalla creazione fino a {@link #stopTimer()}.
 * Un'istanza appartiene a una singola invocazione di prove().
 */
public class TableauxStatistics {

    //region CONTATORI

    /** Round completati dal ciclo principale */
    private int rounds = 0;

    /** Regole di espansione applicate (una per ramo aperto e round) */
    private int ruleApplications = 0;

    /** Regole che hanno prodotto due rami */
    private int branchSplits = 0;

    /** Mondi creati da regole modali o deontiche, radice esclusa */
    private int worldsCreated = 0;

    /** Rami chiusi per contraddizione */
    private int closedBranches = 0;

    //endregion

    //region TIMING

    private final long startTime;
    private long executionTimeMs = 0;
    private boolean timerStopped = false;

    //endregion

    public TableauxStatistics() {
        this.startTime = System.currentTimeMillis();
    }

    //region INCREMENTO CONTATORI

    public void incrementRounds() {
        rounds++;
    }

    public void incrementRuleApplications() {
        ruleApplications++;
    }

    public void incrementBranchSplits() {
        branchSplits++;
    }

    public void incrementWorldsCreated() {
        worldsCreated++;
    }

    public void incrementClosedBranches() {
        closedBranches++;
    }

    //endregion

    //region TIMING

    /**
     * Ferma il timer. Chiamate successive non modificano il tempo misurato.
     */
    public void stopTimer() {
        if (!timerStopped) {
            executionTimeMs = System.currentTimeMillis() - startTime;
            timerStopped = true;
        }
    }

    public long getExecutionTimeMs() {
        if (!timerStopped) {
            // Timer ancora attivo: tempo parziale
            return System.currentTimeMillis() - startTime;
        }
        return executionTimeMs;
    }

    //endregion

    //region ACCESSORS

    public int getRounds() {
        return rounds;
    }

    public int getRuleApplications() {
        return ruleApplications;
    }

    public int getBranchSplits() {
        return branchSplits;
    }

    public int getWorldsCreated() {
        return worldsCreated;
    }

    public int getClosedBranches() {
        return closedBranches;
    }

    //endregion

    //region OUTPUT

    @Override
    public String toString() {
        StringBuilder output = new StringBuilder();

        output.append("==========================[ TABLEAUX COMPLETATO: STATISTICHE ]==========================\n");
        output.append("    Round:              ").append(rounds).append("\n");
        output.append("    Regole applicate:   ").append(ruleApplications).append("\n");
        output.append("    Biforcazioni:       ").append(branchSplits).append("\n");
        output.append("    Mondi creati:       ").append(worldsCreated).append("\n");
        output.append("    Rami chiusi:        ").append(closedBranches).append("\n");
        output.append("    Tempo:              ").append(getExecutionTimeMs()).append("ms\n");
        output.append("=========================================================================================\n");

        return output.toString();
    }

    public String toCompactString() {
        return String.format("Stats[Round:%d, Regole:%d, Split:%d, Mondi:%d, Chiusi:%d, Time:%dms]",
                rounds, ruleApplications, branchSplits, worldsCreated, closedBranches, getExecutionTimeMs());
    }

    //endregion
}
