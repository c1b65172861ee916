package org.dpll.dimacs;

import org.dpll.support.Clause;
import org.dpll.support.Formula;
import org.dpll.support.Literal;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * PARSER DIMACS CNF - Conversione da testo DIMACS al modello {@link Formula}
 *
 * FORMATO ACCETTATO:
 * • Righe che iniziano con 'c': commenti, ignorate ovunque
 * • Prima riga significativa: {@code p cnf <variabili> <clausole>}
 * • Corpo: interi con segno a base uno, ogni clausola terminata da 0;
 *   una clausola può occupare più righe e una riga può contenere più clausole
 *
 * VALIDAZIONI:
 * • Intestazione assente o malformata
 * • Token non numerici nel corpo
 * • Variabili oltre il numero dichiarato
 * • Numero di clausole diverso da quello dichiarato
 *
 * Il letterale DIMACS {@code k} diventa {@code positive(k-1)}, {@code -k}
 * diventa {@code negated(k-1)}. Eventuali letterali dopo l'ultimo 0 sono scartati.
 */
public class DimacsParser {

    private static final Logger LOGGER = Logger.getLogger(DimacsParser.class.getName());

    //region CONFIGURAZIONE E COSTANTI

    /** Terminatore clausola nel formato DIMACS */
    private static final int CLAUSE_TERMINATOR = 0;

    /** Prefisso delle righe di commento */
    private static final String COMMENT_PREFIX = "c";

    private static final String PROBLEM_TOKEN = "p";

    private static final String FORMAT_TOKEN = "cnf";

    private static final int HEADER_TOKENS = 4;

    //endregion

    //region STATO PARSING

    private final BufferedReader reader;

    /** Numero dell'ultima riga letta, per i messaggi di errore */
    private int lineNumber = 0;

    private DimacsHeader header;

    //endregion

    public DimacsParser(BufferedReader reader) {
        this.reader = reader;
    }

    //region INTERFACCIA PUBBLICA PRINCIPALE

    /**
     * Carica una formula DIMACS dal reader.
     *
     * @throws IOException se la lettura fallisce
     * @throws DimacsFormatException se il contenuto non è DIMACS CNF valido
     */
    public static Formula load(BufferedReader reader) throws IOException, DimacsFormatException {
        return new DimacsParser(reader).parse();
    }

    /**
     * Carica una formula DIMACS da file (UTF-8).
     */
    public static Formula load(Path path) throws IOException, DimacsFormatException {
        LOGGER.fine("Lettura file CNF: " + path);
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return load(reader);
        }
    }

    /**
     * Legge intestazione e corpo. Da chiamare una sola volta per istanza.
     */
    public Formula parse() throws IOException, DimacsFormatException {
        if (header != null) {
            throw new IllegalStateException("Parser già utilizzato");
        }

        DimacsHeader parsedHeader = parseHeader();
        Formula formula = parseFormula(parsedHeader);

        formula.logStatistics();
        return formula;
    }

    /**
     * @return intestazione letta, null prima del parsing
     */
    public DimacsHeader getHeader() {
        return header;
    }

    //endregion

    //region PARSING INTESTAZIONE

    /**
     * Salta commenti e righe vuote e legge l'intestazione {@code p cnf V C}.
     */
    DimacsHeader parseHeader() throws IOException, DimacsFormatException {
        String line;
        while ((line = nextLine()) != null) {
            if (line.startsWith(COMMENT_PREFIX) || line.isBlank()) {
                continue;
            }

            String[] tokens = line.trim().split("\\s+");
            if (!PROBLEM_TOKEN.equals(tokens[0])) {
                break;
            }

            if (tokens.length != HEADER_TOKENS || !FORMAT_TOKEN.equals(tokens[1])) {
                throw new DimacsFormatException(DimacsFormatException.Kind.BAD_HEADER, describeLine(line));
            }

            int variables = parseCount(tokens[2], line);
            int clauses = parseCount(tokens[3], line);

            this.header = new DimacsHeader(variables, clauses);
            LOGGER.fine("Intestazione DIMACS: " + header);
            return header;
        }

        throw new DimacsFormatException(DimacsFormatException.Kind.NO_HEADER);
    }

    private int parseCount(String token, String line) throws DimacsFormatException {
        int value;
        try {
            value = Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw new DimacsFormatException(DimacsFormatException.Kind.BAD_HEADER, describeLine(line));
        }
        if (value < 0) {
            throw new DimacsFormatException(DimacsFormatException.Kind.BAD_HEADER, describeLine(line));
        }
        return value;
    }

    //endregion

    //region PARSING CLAUSOLE

    /**
     * Legge tutti i token numerici del corpo e li raggruppa in clausole.
     * Un token non numerico ha precedenza su qualsiasi altro errore.
     */
    Formula parseFormula(DimacsHeader declared) throws IOException, DimacsFormatException {
        List<Integer> values = readNumericTokens();

        Formula formula = new Formula();
        Clause clause = new Clause();

        for (int value : values) {
            if (value == CLAUSE_TERMINATOR) {
                formula.add(clause);
                clause = new Clause();
                continue;
            }

            if (Math.abs((long) value) > declared.variables()) {
                throw new DimacsFormatException(DimacsFormatException.Kind.VARIABLE_COUNT,
                        "letterale " + value + " con " + declared.variables() + " variabili dichiarate");
            }

            clause.add(value > 0 ? Literal.positive(value - 1) : Literal.negated(-value - 1));
        }

        if (!clause.isEmpty() && LOGGER.isLoggable(Level.WARNING)) {
            LOGGER.warning("Letterali senza terminatore 0 ignorati: " + clause);
        }

        if (formula.size() != declared.clauses()) {
            throw new DimacsFormatException(DimacsFormatException.Kind.CLAUSE_COUNT,
                    "attese " + declared.clauses() + ", trovate " + formula.size());
        }

        return formula;
    }

    private List<Integer> readNumericTokens() throws IOException, DimacsFormatException {
        List<Integer> values = new ArrayList<>();

        String line;
        while ((line = nextLine()) != null) {
            if (line.startsWith(COMMENT_PREFIX) || line.isBlank()) {
                continue;
            }

            for (String token : line.trim().split("\\s+")) {
                try {
                    values.add(Integer.parseInt(token));
                } catch (NumberFormatException e) {
                    throw new DimacsFormatException(DimacsFormatException.Kind.BAD_CLAUSE,
                            "token '" + token + "' alla riga " + lineNumber);
                }
            }
        }

        LOGGER.finest("Token numerici letti: " + values.size());
        return values;
    }

    //endregion

    private String nextLine() throws IOException {
        String line = reader.readLine();
        if (line != null) {
            lineNumber++;
        }
        return line;
    }

    private String describeLine(String line) {
        return "riga " + lineNumber + " '" + line.trim() + "'";
    }
}
