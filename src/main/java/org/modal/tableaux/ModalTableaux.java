package org.modal.tableaux;

import org.modal.formula.Formula;
import org.modal.formula.SignedFormula;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * TABLEAUX MODALE - Procedura di decisione per la validità nelle logiche K, T, D, S4, S5
 *
 * Una formula è valida se la sua negazione non ha modelli: si assume la formula falsa
 * nel mondo radice w0 e si espande l'albero finché ogni ramo contiene una contraddizione
 * (formula valida) oppure un ramo aperto non ha più nulla da espandere (contromodello).
 *
 * CICLO PRINCIPALE:
 * 1. Ogni ramo aperto sceglie una formula composta non ancora espansa: priorità della
 *    regola, poi id del mondo più basso, poi ordine di inserimento
 * 2. La regola produce uno o due rami successori
 * 3. Ogni successore con una contraddizione in un qualsiasi mondo viene chiuso
 * 4. Il ciclo termina quando tutti i rami sono chiusi, quando nessun ramo progredisce
 *    oppure dopo maxDepth round
 *
 * LIMITI:
 * Un ramo che ha raggiunto maxWorlds mondi non viene più espanso. Se alla fine l'unico
 * ramo aperto disponibile è stato troncato, il risultato è non valido con flag bounded.
 *
 * L'istanza conserva solo la configurazione: tutto lo stato di una prova è locale
 * alla singola chiamata di {@link #prove(Formula)}.
 */
public class ModalTableaux {

    private static final Logger LOGGER = Logger.getLogger(ModalTableaux.class.getName());

    private final ModalLogicType logicType;
    private final TableauxLimits limits;

    //region INIZIALIZZAZIONE

    public ModalTableaux() {
        this(ModalLogicType.K);
    }

    public ModalTableaux(ModalLogicType logicType) {
        this(logicType, TableauxLimits.defaults());
    }

    public ModalTableaux(ModalLogicType logicType, TableauxLimits limits) {
        this.logicType = Objects.requireNonNull(logicType, "Logica modale non può essere null");
        this.limits = Objects.requireNonNull(limits, "Limiti di ricerca non possono essere null");
    }

    public static TableauxResult proveFormula(Formula formula) {
        return proveFormula(formula, ModalLogicType.K);
    }

    public static TableauxResult proveFormula(Formula formula, ModalLogicType logicType) {
        return new ModalTableaux(logicType).prove(formula);
    }

    //endregion

    //region INTERFACCIA PUBBLICA

    /**
     * Decide la validità della formula nella logica configurata.
     *
     * @param formula formula da provare
     * @return esito con ramo aperto testimone se la formula non è valida
     * @throws NullPointerException se la formula è null
     */
    public TableauxResult prove(Formula formula) {
        Objects.requireNonNull(formula, "Formula da provare non può essere null");
        LOGGER.info("=== AVVIO TABLEAUX " + logicType + " === formula: " + formula);

        TableauxStatistics statistics = new TableauxStatistics();
        ProofTrace trace = new ProofTrace();
        trace.recordStart(formula, logicType);

        List<TableauxBranch> branches = new ArrayList<>();
        branches.add(createInitialBranch(formula));

        int round = 0;
        while (round < limits.maxDepth() && !allClosed(branches)) {
            round++;
            statistics.incrementRounds();

            List<TableauxBranch> nextBranches = new ArrayList<>();
            boolean progress = false;
            for (TableauxBranch branch : branches) {
                Optional<Candidate> candidate = branch.isClosed() || branch.getWorldCount() >= limits.maxWorlds()
                        ? Optional.empty()
                        : selectCandidate(branch);
                if (candidate.isEmpty()) {
                    nextBranches.add(branch);
                    continue;
                }
                progress = true;
                nextBranches.addAll(expand(branch, candidate.get(), trace, statistics));
            }
            branches = nextBranches;

            if (!progress) {
                LOGGER.fine("Nessun ramo espandibile al round " + round);
                break;
            }
        }

        statistics.stopTimer();
        TableauxResult result = buildResult(formula, branches, trace, statistics);
        LOGGER.info("=== TABLEAUX COMPLETATO === " + result.toCompactString());
        return result;
    }

    public ModalLogicType getLogicType() {
        return logicType;
    }

    public TableauxLimits getLimits() {
        return limits;
    }

    //endregion

    //region ESPANSIONE

    private TableauxBranch createInitialBranch(Formula formula) {
        TableauxBranch branch = new TableauxBranch();
        World root = branch.createWorld();
        root.addFormula(formula, true);
        if (logicType.isReflexive()) {
            branch.addAccessibility(root.getId(), root.getId());
        }
        return branch;
    }

    /**
     * Sceglie la prossima formula da espandere nel ramo, se esiste.
     */
    private static Optional<Candidate> selectCandidate(TableauxBranch branch) {
        Candidate best = null;
        for (World world : branch.getWorlds().values()) {
            for (SignedFormula pending : world.getPendingFormulas()) {
                int priority = TableauxExpansion.priorityOf(pending);
                // I mondi sono visitati per id crescente: a parità di priorità vince il primo
                if (best == null || priority < best.priority()) {
                    best = new Candidate(world.getId(), pending, priority);
                }
            }
        }
        return Optional.ofNullable(best);
    }

    private List<TableauxBranch> expand(TableauxBranch branch, Candidate candidate,
                                        ProofTrace trace, TableauxStatistics statistics) {
        // Marcata prima della copia: entrambi i rami di una biforcazione la considerano espansa
        branch.getWorld(candidate.worldId()).markExpanded(candidate.formula());
        statistics.incrementRuleApplications();

        List<TableauxBranch> successors = new TableauxExpansion(
                branch, candidate.worldId(), candidate.formula(), logicType, trace, statistics).apply();

        for (TableauxBranch successor : successors) {
            Optional<World> contradiction = successor.findContradiction();
            if (contradiction.isPresent()) {
                successor.close();
                statistics.incrementClosedBranches();
                trace.recordClosure(contradiction.get().getId(), contradiction.get().getContradictions());
            }
        }
        return successors;
    }

    private static boolean allClosed(List<TableauxBranch> branches) {
        for (TableauxBranch branch : branches) {
            if (!branch.isClosed()) {
                return false;
            }
        }
        return true;
    }

    //endregion

    //region COSTRUZIONE RISULTATO

    /**
     * Il testimone è il primo ramo aperto stabile; in sua assenza il primo ramo aperto,
     * segnalato come bounded perché la ricerca è stata troncata.
     */
    private TableauxResult buildResult(Formula formula, List<TableauxBranch> branches,
                                       ProofTrace trace, TableauxStatistics statistics) {
        int total = branches.size();
        int closed = 0;
        TableauxBranch firstOpen = null;
        TableauxBranch stableOpen = null;

        for (TableauxBranch branch : branches) {
            if (branch.isClosed()) {
                closed++;
                continue;
            }
            if (firstOpen == null) {
                firstOpen = branch;
            }
            if (stableOpen == null && selectCandidate(branch).isEmpty()) {
                stableOpen = branch;
            }
        }

        if (firstOpen == null) {
            return TableauxResult.valid(formula, logicType, total, trace.getSteps(), statistics);
        }

        if (stableOpen != null) {
            return TableauxResult.invalid(formula, logicType, closed, total, stableOpen,
                    trace.getSteps(), false, statistics);
        }

        LOGGER.warning("Limiti di ricerca esauriti (maxWorlds=" + limits.maxWorlds() + ", maxDepth="
                + limits.maxDepth() + "): formula considerata non valida senza ramo aperto completo");
        return TableauxResult.invalid(formula, logicType, closed, total, firstOpen,
                trace.getSteps(), true, statistics);
    }

    //endregion

    private static final class Candidate {

        private final int worldId;
        private final SignedFormula formula;
        private final int priority;

        Candidate(int worldId, SignedFormula formula, int priority) {
            this.worldId = worldId;
            this.formula = formula;
            this.priority = priority;
        }

        int worldId() {
            return worldId;
        }

        SignedFormula formula() {
            return formula;
        }

        int priority() {
            return priority;
        }
    }
}
