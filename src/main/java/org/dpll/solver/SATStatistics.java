package org.dpll.solver;

import java.util.Locale;

/**
 * STATISTICHE DPLL - Metriche di esecuzione della ricerca
 *
 * Raccoglie contatori e tempi durante una singola risoluzione. La ricerca è
 * sequenziale: un'istanza appartiene al thread che esegue il solutore e viene
 * letta solo a risoluzione conclusa.
 */
public class SATStatistics {

    //region CONTATORI METRICHE CORE

    /** Variabili di diramazione scelte dall'euristica */
    private int decisions = 0;

    /** Clausole unitarie risolte dalla propagazione */
    private int propagations = 0;

    /** Rami terminati con una clausola vuota */
    private int conflicts = 0;

    /** Profondità massima raggiunta dalla ricorsione */
    private int maxDepth = 0;

    //endregion

    //region TIMING

    private final long startTime;

    private long executionTimeMs = 0;

    private boolean timerStopped = false;

    //endregion

    /**
     * Inizializza le statistiche e avvia il cronometro.
     */
    public SATStatistics() {
        this.startTime = System.currentTimeMillis();
    }

    //region OPERAZIONI DI INCREMENTO CONTATORI

    public void incrementDecisions() {
        decisions++;
    }

    public void addPropagations(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Numero propagazioni non può essere negativo: " + count);
        }
        propagations += count;
    }

    public void incrementConflicts() {
        conflicts++;
    }

    /**
     * Registra la profondità corrente, conservando il massimo osservato.
     */
    public void recordDepth(int depth) {
        if (depth > maxDepth) {
            maxDepth = depth;
        }
    }

    //endregion

    //region GESTIONE TIMING

    /**
     * Ferma il cronometro. Chiamate successive non hanno effetto.
     */
    public void stopTimer() {
        if (!timerStopped) {
            executionTimeMs = System.currentTimeMillis() - startTime;
            timerStopped = true;
        }
    }

    /**
     * @return tempo finale, oppure parziale se il cronometro è ancora attivo
     */
    public long getExecutionTimeMs() {
        if (!timerStopped) {
            return System.currentTimeMillis() - startTime;
        }
        return executionTimeMs;
    }

    public boolean isTimerStopped() {
        return timerStopped;
    }

    //endregion

    //region ACCESSORS LETTURA METRICHE

    public int getDecisions() {
        return decisions;
    }

    public int getPropagations() {
        return propagations;
    }

    public int getConflicts() {
        return conflicts;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    /**
     * @return rapporto propagazioni/decisioni (0.0 se nessuna decisione)
     */
    public double getPropagationEfficiency() {
        return decisions > 0 ? (double) propagations / decisions : 0.0;
    }

    //endregion

    //region OUTPUT E RAPPRESENTAZIONE

    /**
     * Report su più righe per l'opzione statistiche della linea di comando.
     *
     * @param variableCount numero di variabili della formula
     * @param clauseCount numero di clausole della formula
     * @param result esito ("SAT" o "UNSAT")
     */
    public String toReport(int variableCount, int clauseCount, String result) {
        StringBuilder output = new StringBuilder();

        output.append("=============================[ PROBLEM STATS ]=============================\n");
        output.append("    Variabili:    ").append(variableCount).append('\n');
        output.append("    Clausole:     ").append(clauseCount).append('\n');
        output.append("=============================[ SEARCH STATS ]==============================\n");
        output.append("    Decisioni:    ").append(decisions).append('\n');
        output.append("    Propagazioni: ").append(propagations).append('\n');
        output.append("    Prop/Dec:     ")
                .append(String.format(Locale.ROOT, "%.2f", getPropagationEfficiency())).append('\n');
        output.append("    Conflitti:    ").append(conflicts).append('\n');
        output.append("    Profondità:   ").append(maxDepth).append('\n');
        output.append("    Tempo:        ").append(getExecutionTimeMs()).append("ms\n");
        output.append("    Risultato:    ").append(result).append('\n');
        output.append("===========================================================================\n");

        return output.toString();
    }

    /**
     * Formato su singola riga per il logging.
     */
    public String toCompactString() {
        return String.format("Stats[Dec:%d, Prop:%d, Conf:%d, Depth:%d, Time:%dms]",
                decisions, propagations, conflicts, maxDepth, getExecutionTimeMs());
    }

    @Override
    public String toString() {
        return toCompactString();
    }

    //endregion
}
