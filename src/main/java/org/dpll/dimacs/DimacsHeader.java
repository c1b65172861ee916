package org.dpll.dimacs;

/**
 * Intestazione {@code p cnf <variabili> <clausole>} di un file DIMACS.
 */
public record DimacsHeader(int variables, int clauses) {

    public DimacsHeader {
        if (variables < 0 || clauses < 0) {
            throw new IllegalArgumentException("Conteggi intestazione negativi: " + variables + ", " + clauses);
        }
    }
}
