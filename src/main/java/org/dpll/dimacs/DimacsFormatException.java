package org.dpll.dimacs;

/**
 * Input DIMACS non valido. Il {@link Kind} identifica la regola violata.
 */
public class DimacsFormatException extends Exception {

    /**
     * Tassonomia degli errori di formato.
     */
    public enum Kind {
        NO_HEADER("intestazione mancante"),
        BAD_HEADER("intestazione non valida"),
        BAD_CLAUSE("clausola non valida"),
        VARIABLE_COUNT("numero di variabili inatteso"),
        CLAUSE_COUNT("numero di clausole inatteso");

        private final String description;

        Kind(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }

    private final Kind kind;

    public DimacsFormatException(Kind kind, String detail) {
        super(detail == null ? kind.getDescription() : kind.getDescription() + ": " + detail);
        this.kind = kind;
    }

    public DimacsFormatException(Kind kind) {
        this(kind, null);
    }

    public Kind getKind() {
        return kind;
    }
}
