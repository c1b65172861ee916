package org.dpll.support;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * CLAUSOLA - Disgiunzione di letterali
 *
 * Sequenza mutabile di letterali interpretata come OR logico. L'ordine interno
 * non ha significato: la rimozione avviene per scambio con l'ultimo elemento
 * e troncamento, in tempo costante.
 *
 * CASI NOTEVOLI:
 * • Clausola vuota: vincolo falso (formula insoddisfacibile)
 * • Clausola unitaria: forza il valore della sua unica variabile
 * • Letterali duplicati e tautologie sono tollerati, mai eliminati a priori
 */
public final class Clause implements Iterable<Literal> {

    /** Letterali della clausola, ordine non significativo */
    private final List<Literal> literals;

    /**
     * Costruisce una clausola vuota.
     */
    public Clause() {
        this.literals = new ArrayList<>();
    }

    private Clause(List<Literal> literals) {
        this.literals = literals;
    }

    /**
     * Costruisce una clausola con i letterali indicati, nell'ordine dato.
     *
     * @throws NullPointerException se un letterale è null
     */
    public static Clause of(Literal... literals) {
        List<Literal> copy = new ArrayList<>(literals.length);
        for (Literal literal : literals) {
            copy.add(Objects.requireNonNull(literal, "Letterale null in clausola"));
        }
        return new Clause(copy);
    }

    /**
     * Costruisce la clausola unitaria che asserisce il letterale.
     */
    public static Clause unit(Literal literal) {
        return of(literal);
    }

    //region ACCESSO

    public int size() {
        return literals.size();
    }

    public boolean isEmpty() {
        return literals.isEmpty();
    }

    public boolean isUnit() {
        return literals.size() == 1;
    }

    public Literal get(int index) {
        return literals.get(index);
    }

    public boolean contains(Literal literal) {
        return literals.contains(literal);
    }

    //endregion

    //region MODIFICA

    public void add(Literal literal) {
        literals.add(Objects.requireNonNull(literal, "Letterale null in clausola"));
    }

    /**
     * Rimuove il letterale in posizione {@code index} spostando l'ultimo al suo
     * posto. L'ordine dei letterali restanti non è preservato.
     */
    public void swapRemove(int index) {
        int last = literals.size() - 1;
        literals.set(index, literals.get(last));
        literals.remove(last);
    }

    /**
     * @return copia indipendente (i letterali sono immutabili e condivisi)
     */
    public Clause copy() {
        return new Clause(new ArrayList<>(literals));
    }

    //endregion

    /**
     * Verifica se almeno un letterale è vero sotto l'assegnamento dato.
     */
    public boolean isSatisfiedBy(Assignment assignment) {
        for (Literal literal : literals) {
            if (literal.isTrueUnder(assignment.get(literal.variable()))) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Iterator<Literal> iterator() {
        return literals.iterator();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        return literals.equals(((Clause) obj).literals);
    }

    @Override
    public int hashCode() {
        return literals.hashCode();
    }

    @Override
    public String toString() {
        return literals.toString();
    }
}
