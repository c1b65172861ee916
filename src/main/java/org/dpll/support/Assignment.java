package org.dpll.support;

import java.util.Arrays;

/**
 * ASSEGNAMENTO - Valori di verità delle variabili
 *
 * Buffer denso indicizzato dalla variabile (base zero). Le variabili mai
 * assegnate restano a false: il loro valore non ha significato per il chiamante.
 */
public final class Assignment {

    private final boolean[] values;

    /**
     * Alloca un assegnamento di {@code size} variabili, tutte a false.
     *
     * @throws IllegalArgumentException se size negativo
     */
    public Assignment(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("Dimensione assegnamento non può essere negativa: " + size);
        }
        this.values = new boolean[size];
    }

    /**
     * Costruisce un assegnamento con i valori indicati (utile nei test).
     */
    public static Assignment of(boolean... values) {
        Assignment assignment = new Assignment(values.length);
        System.arraycopy(values, 0, assignment.values, 0, values.length);
        return assignment;
    }

    public int size() {
        return values.length;
    }

    /**
     * @throws IllegalArgumentException se la variabile è fuori da [0, size)
     */
    public boolean get(int variable) {
        checkIndex(variable);
        return values[variable];
    }

    /**
     * @throws IllegalArgumentException se la variabile è fuori da [0, size)
     */
    public void set(int variable, boolean value) {
        checkIndex(variable);
        values[variable] = value;
    }

    /**
     * @return copia dei valori in ordine di indice
     */
    public boolean[] toArray() {
        return values.clone();
    }

    private void checkIndex(int variable) {
        if (variable < 0 || variable >= values.length) {
            throw new IllegalArgumentException("Variabile " + variable
                    + " fuori dall'assegnamento di " + values.length + " variabili");
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        return Arrays.equals(values, ((Assignment) obj).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return Arrays.toString(values);
    }
}
