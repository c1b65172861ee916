package org.dpll.support;

import java.util.Objects;

/**
 * LETTERALE - Variabile proposizionale con polarità
 *
 * Rappresenta una variabile (indice a base zero) in forma positiva o negata.
 * Un letterale positivo è vero quando la variabile è vera, un letterale negato
 * quando la variabile è falsa.
 *
 * INVARIANTI:
 * • Indice variabile sempre ≥ 0
 * • Istanza immutabile: uguaglianza basata su polarità e indice
 */
public final class Literal {

    //region ATTRIBUTI CORE

    /** Indice a base zero della variabile referenziata */
    private final int variable;

    /** true per letterale positivo, false per letterale negato */
    private final boolean positive;

    //endregion

    //region COSTRUZIONE

    private Literal(int variable, boolean positive) {
        if (variable < 0) {
            throw new IllegalArgumentException("Indice variabile deve essere >= 0, ricevuto: " + variable);
        }
        this.variable = variable;
        this.positive = positive;
    }

    /**
     * Crea il letterale positivo della variabile indicata.
     *
     * @param variable indice a base zero (≥ 0)
     * @return letterale vero quando la variabile è vera
     * @throws IllegalArgumentException se indice negativo
     */
    public static Literal positive(int variable) {
        return new Literal(variable, true);
    }

    /**
     * Crea il letterale negato della variabile indicata.
     *
     * @param variable indice a base zero (≥ 0)
     * @return letterale vero quando la variabile è falsa
     * @throws IllegalArgumentException se indice negativo
     */
    public static Literal negated(int variable) {
        return new Literal(variable, false);
    }

    /**
     * Crea il letterale reso vero dall'assegnamento {@code variable = truth}.
     */
    public static Literal of(int variable, boolean truth) {
        return new Literal(variable, truth);
    }

    //endregion

    //region INTERFACCIA PUBBLICA

    /**
     * @return indice a base zero della variabile
     */
    public int variable() {
        return variable;
    }

    /**
     * @return true se letterale positivo, false se negato
     */
    public boolean isPositive() {
        return positive;
    }

    /**
     * @return letterale complementare sulla stessa variabile
     */
    public Literal negate() {
        return new Literal(variable, !positive);
    }

    /**
     * Valuta il letterale dato il valore della sua variabile.
     */
    public boolean isTrueUnder(boolean value) {
        return value == positive;
    }

    /**
     * Converte in letterale DIMACS: intero a base uno, negativo se negato.
     */
    public int toDimacs() {
        return positive ? variable + 1 : -(variable + 1);
    }

    //endregion

    //region OGGETTO

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        Literal other = (Literal) obj;
        return variable == other.variable && positive == other.positive;
    }

    @Override
    public int hashCode() {
        return Objects.hash(variable, positive);
    }

    @Override
    public String toString() {
        return (positive ? "+" : "-") + variable;
    }

    //endregion
}
