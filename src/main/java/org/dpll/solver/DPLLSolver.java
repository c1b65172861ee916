package org.dpll.solver;

import org.dpll.support.Assignment;
import org.dpll.support.Clause;
import org.dpll.support.Formula;
import org.dpll.support.Literal;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * SOLUTORE DPLL - Ricerca ricorsiva Davis-Putnam-Logemann-Loveland
 *
 * Ogni livello della ricorsione:
 * 1. Copia la formula ricevuta (i rami non condividono mai lo stato delle clausole)
 * 2. Propaga le clausole unitarie fino al punto fisso
 * 3. Formula vuota → SAT, l'assegnamento corrente è il testimone
 * 4. Clausola vuota → conflitto, il ramo fallisce
 * 5. Altrimenti sceglie la variabile dominante e prova prima vero, poi falso,
 *    aggiungendo la clausola unitaria corrispondente
 *
 * L'assegnamento è un unico buffer condiviso da tutti i livelli del cammino
 * corrente. I rami falliti non ripristinano i valori scritti: il testimone
 * finale è corretto perché ogni variabile vincolata viene riscritta lungo il
 * cammino che ha successo.
 */
public class DPLLSolver {

    private static final Logger LOGGER = Logger.getLogger(DPLLSolver.class.getName());

    //region STRUTTURE DATI CORE

    /** Formula da risolvere, mai modificata dalla ricerca */
    private final Formula formula;

    /** Numero di variabili implicato dalla formula (massimo indice + 1) */
    private final int variableCount;

    //endregion

    //region STATO ESECUZIONE

    /** Assegnamento condiviso lungo il cammino corrente */
    private Assignment assignment;

    private SATStatistics statistics;

    //endregion

    /**
     * @param formula formula già validata (indici di variabile nel range dichiarato)
     * @throws NullPointerException se formula null
     */
    public DPLLSolver(Formula formula) {
        this.formula = Objects.requireNonNull(formula, "Formula non può essere null");
        this.variableCount = formula.variableCount();

        LOGGER.fine(String.format("DPLLSolver inizializzato: %d clausole, %d variabili",
                formula.size(), variableCount));
    }

    //region INTERFACCIA PUBBLICA

    /**
     * Decide la soddisfacibilità della formula.
     *
     * @param formula formula CNF, non modificata
     * @return testimone se soddisfacibile, vuoto se insoddisfacibile
     */
    public static Optional<Assignment> checkSat(Formula formula) {
        return new DPLLSolver(formula).solve().getAssignment();
    }

    /**
     * Esegue la ricerca completa. Ogni chiamata riparte da uno stato pulito.
     *
     * @return esito con testimone (se SAT) e statistiche
     * @throws IllegalStateException se il testimone trovato non soddisfa la formula
     */
    public SATResult solve() {
        this.statistics = new SATStatistics();
        this.assignment = new Assignment(variableCount);

        boolean satisfiable = search(formula, 0);
        statistics.stopTimer();

        SATResult result;
        if (satisfiable) {
            verifyModel();
            result = SATResult.satisfiable(assignment, statistics);
        } else {
            result = SATResult.unsatisfiable(statistics);
        }

        LOGGER.info("Risoluzione completata: " + result.toCompactString());
        return result;
    }

    public int getVariableCount() {
        return variableCount;
    }

    //endregion

    //region ALGORITMO DPLL

    /**
     * Un livello della ricerca. La formula ricevuta non viene modificata.
     *
     * @param incoming formula del livello chiamante
     * @param depth profondità della ricorsione
     * @return true se il ramo porta a un modello
     */
    private boolean search(Formula incoming, int depth) {
        statistics.recordDepth(depth);

        Formula working = incoming.copy();
        statistics.addPropagations(UnitPropagator.propagate(working, assignment));

        if (working.isEmpty()) {
            return true;
        }

        if (working.hasEmptyClause()) {
            statistics.incrementConflicts();
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Conflitto a profondità " + depth);
            }
            return false;
        }

        int variable = BranchSelector.dominantVariable(working, assignment.size());
        statistics.incrementDecisions();

        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(String.format("Diramazione su variabile %d a profondità %d (%d clausole)",
                    variable, depth, working.size()));
        }

        working.add(Clause.unit(Literal.positive(variable)));
        if (search(working, depth + 1)) {
            return true;
        }

        working.removeLast();
        working.add(Clause.unit(Literal.negated(variable)));
        return search(working, depth + 1);
    }

    //endregion

    /**
     * Il testimone deve soddisfare la formula originale: un fallimento qui
     * indica un errore interno del solutore.
     */
    private void verifyModel() {
        if (!formula.isSatisfiedBy(assignment)) {
            LOGGER.severe("Modello non valido per la formula originale: " + assignment);
            throw new IllegalStateException("Il modello trovato non soddisfa la formula");
        }
    }
}
