package org.dpll.support;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * FORMULA CNF - Congiunzione di clausole
 *
 * Rappresentazione mutabile di una formula in Forma Normale Congiuntiva usata
 * come valuta comune tra parser, semplificatore, propagatore e ricerca DPLL.
 * Una formula senza clausole è banalmente vera; una formula che contiene la
 * clausola vuota è insoddisfacibile.
 *
 * INVARIANTI MANTENUTE:
 * • Ordine delle clausole non significativo (rimozione per scambio e troncamento)
 * • {@link #copy()} produce clausole indipendenti: le modifiche su una copia
 *   non sono mai visibili sull'originale
 * • Gli indici delle variabili non vengono rivalidati: la validazione del range
 *   è responsabilità di chi costruisce la formula (parser DIMACS)
 */
public final class Formula implements Iterable<Clause> {

    private static final Logger LOGGER = Logger.getLogger(Formula.class.getName());

    /** Clausole della formula, ordine non significativo */
    private final List<Clause> clauses;

    /**
     * Costruisce una formula vuota (vera).
     */
    public Formula() {
        this.clauses = new ArrayList<>();
    }

    private Formula(List<Clause> clauses) {
        this.clauses = clauses;
    }

    /**
     * Costruisce una formula con le clausole indicate, nell'ordine dato.
     * Le clausole vengono adottate, non copiate.
     */
    public static Formula of(Clause... clauses) {
        Formula formula = new Formula();
        for (Clause clause : clauses) {
            formula.add(clause);
        }
        return formula;
    }

    //region ACCESSO

    public int size() {
        return clauses.size();
    }

    public boolean isEmpty() {
        return clauses.isEmpty();
    }

    public Clause get(int index) {
        return clauses.get(index);
    }

    /**
     * @return true se almeno una clausola è vuota (conflitto)
     */
    public boolean hasEmptyClause() {
        for (Clause clause : clauses) {
            if (clause.isEmpty()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Numero di variabili implicato dalla formula: massimo indice referenziato
     * più uno, zero per la formula senza letterali.
     */
    public int variableCount() {
        int count = 0;
        for (Clause clause : clauses) {
            for (Literal literal : clause) {
                if (literal.variable() >= count) {
                    count = literal.variable() + 1;
                }
            }
        }
        return count;
    }

    /**
     * @return numero totale di occorrenze di letterali
     */
    public int literalCount() {
        int count = 0;
        for (Clause clause : clauses) {
            count += clause.size();
        }
        return count;
    }

    /**
     * Verifica che ogni clausola sia soddisfatta dall'assegnamento.
     *
     * @throws IndexOutOfBoundsException se l'assegnamento non copre una variabile referenziata
     */
    public boolean isSatisfiedBy(Assignment assignment) {
        for (Clause clause : clauses) {
            if (!clause.isSatisfiedBy(assignment)) {
                return false;
            }
        }
        return true;
    }

    //endregion

    //region MODIFICA

    public void add(Clause clause) {
        clauses.add(Objects.requireNonNull(clause, "Clausola null in formula"));
    }

    /**
     * Rimuove e restituisce l'ultima clausola.
     *
     * @throws IllegalStateException se la formula è vuota
     */
    public Clause removeLast() {
        if (clauses.isEmpty()) {
            throw new IllegalStateException("Nessuna clausola da rimuovere");
        }
        return clauses.remove(clauses.size() - 1);
    }

    /**
     * Rimuove la clausola in posizione {@code index} spostando l'ultima al suo posto.
     */
    public void swapRemove(int index) {
        int last = clauses.size() - 1;
        clauses.set(index, clauses.get(last));
        clauses.remove(last);
    }

    /**
     * Copia profonda: ogni clausola viene duplicata.
     */
    public Formula copy() {
        List<Clause> copied = new ArrayList<>(clauses.size() + 1);
        for (Clause clause : clauses) {
            copied.add(clause.copy());
        }
        return new Formula(copied);
    }

    //endregion

    //region STATISTICHE E LOGGING

    /**
     * Registra statistiche sulla formula: clausole, variabili, lunghezza media.
     * La distribuzione delle lunghezze viene calcolata solo a livello FINE.
     */
    public void logStatistics() {
        if (!LOGGER.isLoggable(Level.INFO)) {
            return;
        }

        int totalLiterals = literalCount();
        double avgClauseLength = clauses.isEmpty() ? 0.0 : (double) totalLiterals / clauses.size();

        LOGGER.info(String.format("Formula CNF: %d clausole, %d variabili, %.1f letterali/clausola",
                clauses.size(), variableCount(), avgClauseLength));

        if (LOGGER.isLoggable(Level.FINE)) {
            Map<Integer, Long> lengthDistribution = clauses.stream()
                    .collect(Collectors.groupingBy(Clause::size, Collectors.counting()));
            LOGGER.fine("Distribuzione lunghezza clausole: " + lengthDistribution);

            long unitClauses = clauses.stream().filter(Clause::isUnit).count();
            LOGGER.fine("Clausole unitarie: " + unitClauses + "/" + clauses.size());
        }
    }

    //endregion

    @Override
    public Iterator<Clause> iterator() {
        return clauses.iterator();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        return clauses.equals(((Formula) obj).clauses);
    }

    @Override
    public int hashCode() {
        return clauses.hashCode();
    }

    @Override
    public String toString() {
        return clauses.toString();
    }
}
