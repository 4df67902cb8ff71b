package org.dimacs;

import org.dimacs.lexer.ParseError;
import org.dimacs.parser.Dimacs;
import org.dimacs.support.Extensions;
import org.dimacs.support.Instance;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * LETTORE DIMACS - Interfaccia a riga di comando del parser
 *
 * Legge uno o più file .cnf / .sat, ne esegue il parsing e stampa per ogni
 * file un riepilogo dell'istanza oppure l'errore con riga e colonna.
 *
 * MODALITÀ OPERATIVE SUPPORTATE:
 * - File singolo (-f): parsing di un singolo file
 * - Directory batch (-d): parsing di tutti i file .cnf/.sat di una cartella
 * - Log dettagliato (-v): abilita i messaggi FINE del parser
 *
 * Il codice di uscita è 1 se almeno un file non è stato letto correttamente.
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    /** Logger radice del progetto, mantenuto per non perderne il livello */
    private static final Logger ROOT_LOGGER = Logger.getLogger("org.dimacs");

    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    private static final String HELP_PARAM = "-h";
    private static final String FILE_PARAM = "-f";
    private static final String DIR_PARAM = "-d";
    private static final String VERBOSE_PARAM = "-v";

    /** Estensioni dei file elaborati in modalità directory */
    private static final List<String> DIMACS_EXTENSIONS = List.of(".cnf", ".sat");

    /** Configurazione di java.util.logging sul classpath */
    private static final String LOGGING_CONFIG = "/logging.properties";

    private static final int EXIT_OK = 0;
    private static final int EXIT_FAILURE = 1;

    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    public static void main(String[] args) {
        configureLogging();
        int exitCode = run(args, System.out);
        if (exitCode != EXIT_OK) {
            System.exit(exitCode);
        }
    }

    /**
     * Esegue l'applicazione scrivendo l'output su {@code out}.
     *
     * @param args parametri linea di comando
     * @param out destinazione dei messaggi per l'utente
     * @return codice di uscita (0 successo, 1 errore)
     */
    static int run(String[] args, PrintStream out) {
        if (args.length == 0) {
            out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
            return EXIT_FAILURE;
        }

        ReaderConfiguration config;
        try {
            config = new ArgumentParser().parse(args);
        } catch (IllegalArgumentException e) {
            out.println("[E] " + e.getMessage());
            return EXIT_FAILURE;
        }
        if (config == null) {
            printApplicationHelp(out);
            return EXIT_OK;
        }

        if (config.verbose) {
            ROOT_LOGGER.setLevel(Level.FINE);
        }

        try {
            BatchResult result = config.isFileMode
                    ? processSingleFile(Paths.get(config.inputPath), out)
                    : processDirectoryBatch(Paths.get(config.inputPath), out);
            return result.errors == 0 ? EXIT_OK : EXIT_FAILURE;
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "Errore di accesso all'input", e);
            out.println("[E] Errore durante l'accesso a " + config.inputPath + ": " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    /**
     * Carica logging.properties dal classpath, se presente.
     */
    private static void configureLogging() {
        try (InputStream config = Main.class.getResourceAsStream(LOGGING_CONFIG)) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
            }
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Configurazione logging non leggibile, uso i valori predefiniti", e);
        }
    }

    //endregion

    //region ELABORAZIONE FILE

    private static BatchResult processSingleFile(Path file, PrintStream out) {
        BatchResult result = new BatchResult();
        if (parseAndReport(file, out)) {
            result.successes++;
        } else {
            result.errors++;
        }
        return result;
    }

    private static BatchResult processDirectoryBatch(Path dir, PrintStream out) throws IOException {
        List<Path> files = findAllDimacsFiles(dir);
        BatchResult result = new BatchResult();
        if (files.isEmpty()) {
            out.println("[W] Nessun file .cnf o .sat trovato nella directory specificata.");
            return result;
        }

        for (Path file : files) {
            if (parseAndReport(file, out)) {
                result.successes++;
            } else {
                result.errors++;
            }
        }

        out.println("[I] File elaborati: " + files.size()
                + ", letti correttamente: " + result.successes
                + ", con errori: " + result.errors);
        return result;
    }

    private static List<Path> findAllDimacsFiles(Path dir) throws IOException {
        try (Stream<Path> entries = Files.list(dir)) {
            return entries
                    .filter(Files::isRegularFile)
                    .filter(path -> DIMACS_EXTENSIONS.stream()
                            .anyMatch(ext -> path.getFileName().toString().toLowerCase().endsWith(ext)))
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .toList();
        }
    }

    /**
     * Esegue il parsing di un file isolandone gli errori.
     *
     * @return true se il file è stato letto correttamente
     */
    private static boolean parseAndReport(Path file, PrintStream out) {
        String name = file.getFileName().toString();
        try {
            Instance instance = Dimacs.readDimacs(file);
            out.println("[I] " + name + ": " + describe(instance));
            return true;
        } catch (ParseError e) {
            LOGGER.fine((e.getKind().isLexical() ? "Errore lessicale" : "Errore sintattico")
                    + " in " + file + ": " + e.getKind());
            out.println("[E] " + name + ": " + e.getMessage());
            return false;
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "Errore di lettura del file " + file, e);
            out.println("[E] " + name + ": file non leggibile (" + e.getMessage() + ")");
            return false;
        }
    }

    /**
     * Riepilogo in una riga, es. "cnf, 3 variabili, 2 clausole".
     */
    static String describe(Instance instance) {
        return switch (instance.getKind()) {
            case CNF -> "cnf, " + instance.getNumVars() + " variabili, "
                    + instance.getNumClauses() + " clausole";
            case SAT -> Extensions.problemKeyword(instance.getExtensions()) + ", "
                    + instance.getNumVars() + " variabili, formula di "
                    + instance.getFormula().countNodes() + " nodi";
        };
    }

    //endregion

    //region HELP E DOCUMENTAZIONE

    private static void printApplicationHelp(PrintStream out) {
        out.println("\n::>> LETTORE DIMACS <<::");
        out.println("Parser per problemi di soddisfacibilità in formato DIMACS (.cnf e .sat)\n");

        out.println("UTILIZZO:");
        out.println("  java -jar dimacs-parser.jar [opzioni]\n");

        out.println("OPZIONI:");
        out.println("  -f <file>       Legge un singolo file .cnf o .sat");
        out.println("  -d <directory>  Legge tutti i file .cnf e .sat in una directory");
        out.println("  -v              Log dettagliato del parsing");
        out.println("  -h              Mostra questa guida\n");

        out.println("ESEMPI DI UTILIZZO:");
        out.println("  java -jar dimacs-parser.jar -f problema.cnf");
        out.println("  java -jar dimacs-parser.jar -d ./istanze/ -v\n");
    }

    //endregion

    //region CLASSI DI SUPPORTO E CONFIGURAZIONE

    private static class ReaderConfiguration {
        final String inputPath;
        final boolean isFileMode;
        final boolean verbose;

        ReaderConfiguration(String inputPath, boolean isFileMode, boolean verbose) {
            this.inputPath = inputPath;
            this.isFileMode = isFileMode;
            this.verbose = verbose;
        }
    }

    /**
     * Parser dei parametri linea di comando.
     */
    private static class ArgumentParser {

        /**
         * @return configurazione validata, null se è stato richiesto l'help
         * @throws IllegalArgumentException se i parametri non sono validi
         */
        ReaderConfiguration parse(String[] args) {
            String inputPath = null;
            boolean isFileMode = false;
            boolean isDirectoryMode = false;
            boolean verbose = false;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        return null;
                    }

                    case FILE_PARAM -> {
                        validateExclusiveMode(isFileMode || isDirectoryMode);
                        inputPath = getNextArgument(args, ++i, "un file");
                        validateFileExists(inputPath);
                        isFileMode = true;
                    }

                    case DIR_PARAM -> {
                        validateExclusiveMode(isFileMode || isDirectoryMode);
                        inputPath = getNextArgument(args, ++i, "una directory");
                        validateDirectoryExists(inputPath);
                        isDirectoryMode = true;
                    }

                    case VERBOSE_PARAM -> verbose = true;

                    default -> throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                }
            }

            if (inputPath == null) {
                throw new IllegalArgumentException("Specificare input con -f (file) o -d (directory)");
            }
            return new ReaderConfiguration(inputPath, isFileMode, verbose);
        }

        private void validateExclusiveMode(boolean modeAlreadySet) {
            if (modeAlreadySet) {
                throw new IllegalArgumentException("Le modalità file (-f) e directory (-d) sono mutualmente esclusive");
            }
        }

        private String getNextArgument(String[] args, int currentIndex, String argumentType) {
            if (currentIndex >= args.length) {
                throw new IllegalArgumentException("Parametro " + args[currentIndex - 1] +
                        " richiede " + argumentType);
            }
            return args[currentIndex];
        }

        private void validateFileExists(String path) {
            File file = new File(path);
            if (!file.isFile()) {
                throw new IllegalArgumentException("File non esistente: " + path);
            }
        }

        private void validateDirectoryExists(String path) {
            File dir = new File(path);
            if (!dir.isDirectory()) {
                throw new IllegalArgumentException("Directory non esistente: " + path);
            }
        }
    }

    /** Contatori dell'elaborazione */
    private static class BatchResult {
        int successes;
        int errors;
    }

    //endregion
}
