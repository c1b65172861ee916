package org.dpll;

import org.dpll.dimacs.AssignmentFormatter;
import org.dpll.dimacs.DimacsFormatException;
import org.dpll.dimacs.DimacsParser;
import org.dpll.solver.DPLLSolver;
import org.dpll.solver.SATResult;
import org.dpll.support.Formula;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * SOLUTORE SAT DPLL (Davis-Putnam-Logemann-Loveland)
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: formula DIMACS CNF da standard input o da file (-f)
 * 2. PARSING: validazione intestazione, clausole e conteggi dichiarati
 * 3. RISOLUZIONE: ricerca DPLL con propagazione unitaria ed euristica
 *    della variabile più frequente, su un thread con stack ampliato
 * 4. OUTPUT: assegnamento DIMACS su stdout per formule SAT, nessun output
 *    e codice di uscita non nullo per formule UNSAT
 *
 * CODICI DI USCITA:
 * - 0: formula soddisfacibile, modello stampato
 * - 1: formula insoddisfacibile, oppure errore di lettura o di formato
 * - 2: parametri linea di comando non validi
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    /** Logger radice del progetto, trattenuto per non perdere il livello impostato */
    private static final Logger PROJECT_LOGGER = Logger.getLogger("org.dpll");

    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     * */
    private static final String HELP_PARAM = "-h";
    private static final String FILE_PARAM = "-f";
    private static final String STATS_PARAM = "-s";
    private static final String VERBOSE_PARAM = "-v";
    private static final String STACK_PARAM = "-stack";

    /**
     * Codici di uscita
     * */
    static final int EXIT_SAT = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    /**
     * Stack del thread di ricerca: la ricorsione cresce con il numero di variabili
     * */
    private static final int DEFAULT_STACK_MB = 512;
    private static final int MIN_STACK_MB = 1;

    private static final String LOGGING_CONFIG_RESOURCE = "/logging.properties";
    private static final String LOGGING_CONFIG_PROPERTY = "java.util.logging.config.file";

    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    public static void main(String[] args) {
        configureLogging();
        System.exit(run(args, System.in, System.out, System.err));
    }

    /**
     * Esegue il solutore con gli stream indicati.
     *
     * @param args parametri linea di comando
     * @param in sorgente DIMACS quando non è indicato un file
     * @param out destinazione della riga del modello
     * @param err destinazione di errori, help degli errori e statistiche
     * @return codice di uscita
     */
    static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        SolverConfiguration config;
        try {
            config = new ArgumentParser().parse(args);
        } catch (IllegalArgumentException e) {
            err.println("[E] " + e.getMessage());
            err.println("Usa " + HELP_PARAM + " per visualizzare l'help.");
            return EXIT_USAGE;
        }

        if (config == null) {
            printApplicationHelp(out);
            return EXIT_SAT;
        }

        if (config.verbose) {
            PROJECT_LOGGER.setLevel(Level.FINE);
        }

        Formula formula;
        try {
            formula = readFormula(config, in);
        } catch (DimacsFormatException | IOException e) {
            LOGGER.log(Level.FINE, "Lettura formula fallita", e);
            err.println("[E] " + e.getMessage());
            return EXIT_FAILURE;
        }

        DPLLSolver solver = new DPLLSolver(formula);
        SATResult result;
        try {
            result = executeSolving(solver::solve, config.stackSizeMb);
        } catch (SolverFailureException e) {
            LOGGER.log(Level.FINE, "Risoluzione fallita", e);
            err.println("[E] " + e.getMessage());
            return EXIT_FAILURE;
        }

        if (config.showStatistics) {
            err.print(result.getStatistics().toReport(solver.getVariableCount(), formula.size(),
                    result.isSatisfiable() ? "SAT" : "UNSAT"));
        }

        if (result.isUnsatisfiable()) {
            LOGGER.info("Formula insoddisfacibile");
            return EXIT_FAILURE;
        }

        out.println(AssignmentFormatter.format(result.getAssignment().orElseThrow()));
        return EXIT_SAT;
    }

    //endregion

    //region PIPELINE

    private static Formula readFormula(SolverConfiguration config, InputStream in)
            throws IOException, DimacsFormatException {
        if (config.inputPath != null) {
            return DimacsParser.load(Paths.get(config.inputPath));
        }
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        return DimacsParser.load(reader);
    }

    /**
     * Esegue la ricerca su un thread dedicato con lo stack indicato.
     * Non esiste timeout: la ricerca termina con SAT o UNSAT.
     *
     * @param solverTask ricerca da eseguire
     * @param stackSizeMb stack del thread di ricerca in MiB
     * @throws SolverFailureException se la ricerca termina senza esito
     */
    static SATResult executeSolving(Callable<SATResult> solverTask, int stackSizeMb)
            throws SolverFailureException {
        long stackBytes = (long) stackSizeMb * 1024 * 1024;
        ExecutorService executor = Executors.newSingleThreadExecutor(
                task -> new Thread(null, task, "dpll-search", stackBytes));

        try {
            Future<SATResult> future = executor.submit(solverTask);
            return future.get();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SolverFailureException("Risoluzione interrotta", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof StackOverflowError) {
                throw new SolverFailureException("Stack esaurito durante la ricerca, aumentare "
                        + STACK_PARAM + " (attuale: " + stackSizeMb + " MiB)", cause);
            }
            throw new SolverFailureException("Errore durante risoluzione SAT: " + cause, cause);
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Carica la configurazione di logging inclusa nel jar, salvo che l'utente
     * ne abbia indicata una propria.
     */
    private static void configureLogging() {
        if (System.getProperty(LOGGING_CONFIG_PROPERTY) != null) {
            return;
        }
        try (InputStream config = Main.class.getResourceAsStream(LOGGING_CONFIG_RESOURCE)) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
            }
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Configurazione logging non caricata", e);
        }
    }

    //endregion

    //region HELP E DOCUMENTAZIONE

    private static void printApplicationHelp(PrintStream out) {
        out.println("SOLUTORE SAT DPLL");
        out.println();
        out.println("Uso: java -jar solutore-dpll.jar [opzioni] < formula.cnf");
        out.println();
        out.println("Opzioni:");
        out.println("  " + HELP_PARAM + "              mostra questo help");
        out.println("  " + FILE_PARAM + " <file>       legge la formula DIMACS dal file invece che da stdin");
        out.println("  " + STATS_PARAM + "              stampa le statistiche della ricerca su stderr");
        out.println("  " + VERBOSE_PARAM + "              log dettagliato (livello FINE) su stderr");
        out.println("  " + STACK_PARAM + " <MiB>    stack del thread di ricerca (default " + DEFAULT_STACK_MB + ")");
        out.println();
        out.println("Output: una riga di letterali DIMACS (es. '1 -2 3') se la formula è soddisfacibile.");
        out.println("Codici di uscita: 0 = SAT, 1 = UNSAT o errore, 2 = parametri non validi.");
    }

    //endregion

    //region CLASSI DI SUPPORTO E CONFIGURAZIONE

    /**
     * Configurazione validata dell'applicazione.
     */
    private static class SolverConfiguration {
        final String inputPath;
        final boolean showStatistics;
        final boolean verbose;
        final int stackSizeMb;

        SolverConfiguration(String inputPath, boolean showStatistics, boolean verbose, int stackSizeMb) {
            this.inputPath = inputPath;
            this.showStatistics = showStatistics;
            this.verbose = verbose;
            this.stackSizeMb = stackSizeMb;
        }
    }

    /**
     * Parser dei parametri linea di comando.
     */
    private static class ArgumentParser {

        /**
         * @return configurazione validata, null se è stato richiesto l'help
         * @throws IllegalArgumentException se parametri sconosciuti o invalidi
         */
        SolverConfiguration parse(String[] args) {
            String inputPath = null;
            boolean showStatistics = false;
            boolean verbose = false;
            int stackSizeMb = DEFAULT_STACK_MB;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        return null;
                    }
                    case FILE_PARAM -> {
                        inputPath = getNextArgument(args, ++i, "file");
                        validateFileExists(inputPath);
                    }
                    case STATS_PARAM -> showStatistics = true;
                    case VERBOSE_PARAM -> verbose = true;
                    case STACK_PARAM -> stackSizeMb = parseStackSize(getNextArgument(args, ++i, "stack"));
                    default -> throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                }
            }

            return new SolverConfiguration(inputPath, showStatistics, verbose, stackSizeMb);
        }

        private String getNextArgument(String[] args, int index, String argumentType) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Valore mancante per il parametro " + argumentType);
            }
            return args[index];
        }

        private int parseStackSize(String value) {
            int stackSizeMb;
            try {
                stackSizeMb = Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Dimensione stack non valida: " + value, e);
            }
            if (stackSizeMb < MIN_STACK_MB) {
                throw new IllegalArgumentException("Dimensione stack deve essere >= " + MIN_STACK_MB + " MiB");
            }
            return stackSizeMb;
        }

        private void validateFileExists(String filePath) {
            Path path = Paths.get(filePath);
            if (!Files.isRegularFile(path)) {
                throw new IllegalArgumentException("File non esistente: " + filePath);
            }
            if (!Files.isReadable(path)) {
                throw new IllegalArgumentException("File non leggibile: " + filePath);
            }
        }
    }

    /**
     * Fallimento della ricerca non riconducibile all'esito SAT/UNSAT.
     */
    static class SolverFailureException extends Exception {
        SolverFailureException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    //endregion
}
