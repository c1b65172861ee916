package org.dpll.solver;

import org.dpll.support.Assignment;

import java.util.Objects;
import java.util.Optional;

/**
 * RISULTATO SAT - Esito di una risoluzione DPLL
 *
 * COMPONENTI:
 * • Esito: SAT (soddisfacibile) vs UNSAT (insoddisfacibile)
 * • Modello: assegnamento testimone, presente solo per SAT (anche vuoto, per la formula vuota)
 * • Statistiche: metriche della ricerca, sempre presenti
 */
public class SATResult {

    private final boolean satisfiable;

    /** Testimone per SAT, null per UNSAT */
    private final Assignment assignment;

    private final SATStatistics statistics;

    //region COSTRUZIONE E VALIDAZIONE

    /**
     * @throws IllegalArgumentException se esito e modello sono inconsistenti
     */
    private SATResult(boolean satisfiable, Assignment assignment, SATStatistics statistics) {
        if (satisfiable && assignment == null) {
            throw new IllegalArgumentException("Risultato SAT richiede un assegnamento");
        }
        if (!satisfiable && assignment != null) {
            throw new IllegalArgumentException("Risultato UNSAT non può avere assegnamento variabili");
        }

        this.satisfiable = satisfiable;
        this.assignment = assignment;
        this.statistics = statistics != null ? statistics : new SATStatistics();
    }

    public static SATResult satisfiable(Assignment assignment, SATStatistics statistics) {
        return new SATResult(true, Objects.requireNonNull(assignment, "Modello SAT non può essere null"), statistics);
    }

    public static SATResult unsatisfiable(SATStatistics statistics) {
        return new SATResult(false, null, statistics);
    }

    //endregion

    //region ACCESSORS

    public boolean isSatisfiable() {
        return satisfiable;
    }

    public boolean isUnsatisfiable() {
        return !satisfiable;
    }

    /**
     * @return testimone per SAT, vuoto per UNSAT
     */
    public Optional<Assignment> getAssignment() {
        return Optional.ofNullable(assignment);
    }

    public SATStatistics getStatistics() {
        return statistics;
    }

    //endregion

    /**
     * Riepilogo compatto per il logging.
     */
    public String toCompactString() {
        return String.format("SATResult{%s, vars=%d, %s}",
                satisfiable ? "SAT" : "UNSAT",
                assignment != null ? assignment.size() : 0,
                statistics.toCompactString());
    }

    /**
     * Uguaglianza su esito e modello; le statistiche sono ignorate.
     */
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        SATResult other = (SATResult) obj;
        return satisfiable == other.satisfiable && Objects.equals(assignment, other.assignment);
    }

    @Override
    public int hashCode() {
        return Objects.hash(satisfiable, assignment);
    }

    @Override
    public String toString() {
        return satisfiable ? "SAT " + assignment : "UNSAT";
    }
}
