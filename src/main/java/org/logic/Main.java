package org.logic;

import org.logic.formula.Formula;
import org.logic.operators.FormulaReducer;
import org.logic.operators.NotAndOrReducer;
import org.logic.operators.OperatorBasis;
import org.logic.operators.PlaceholderPolicy;
import org.logic.parser.FormulaParser;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * RIDUTTORE DI OPERATORI PROPOSIZIONALI
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: File di testo con una formula per riga (righe vuote e commenti # ignorati)
 * 2. PARSING: Conversione notazione parentesizzata -> albero Formula (ANTLR)
 * 3. RIDUZIONE: Riscrittura verso una o più basi minime di operatori
 *    - not-and-or: {~, &, |}
 *    - not-and: {~, &}
 *    - nand: {-&}
 *    - implies-not: {->, ~}
 *    - implies-false: {->, F}
 * 4. OUTPUT: Una sottodirectory per base con le formule ridotte, riga per riga
 *
 * MODALITÀ OPERATIVE SUPPORTATE:
 * - File singolo (-f): Elaborazione di un singolo file .txt
 * - Directory batch (-d): Elaborazione di tutti i file .txt in una cartella
 * - Selezione basi (-b=<basi>), segnaposto per le costanti (-p=<nome>, -fresh)
 * - Output directory personalizzabile (-o directory)
 */
public final class Main {
    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     * */
    static final String HELP_PARAM = "-h";
    static final String FILE_PARAM = "-f";
    static final String DIR_PARAM = "-d";
    static final String OUTPUT_PARAM = "-o";
    static final String BASIS_PARAM = "-b=";
    static final String PLACEHOLDER_PARAM = "-p=";
    static final String FRESH_PARAM = "-fresh";
    static final String VERBOSE_PARAM = "-v";

    private static final String BASIS_ALL = "all";
    private static final String INPUT_EXTENSION = ".txt";
    private static final String COMMENT_PREFIX = "#";

    /** Nodi massimi dell'albero espanso scritti per una singola formula ridotta */
    static final long MAX_OUTPUT_NODES = 1_000_000L;

    /** Logger radice del progetto, trattenuto per non perdere la configurazione -v */
    private static final Logger PROJECT_LOGGER = Logger.getLogger("org.logic");

    /**
     * Previene istanziazione - classe utility
     * */
    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    /**
     * Punto principale dell'applicazione.
     *
     * @param args parametri linea di comando forniti dall'utente
     */
    public static void main(String[] args) {
        System.out.println("---> AVVIO RIDUTTORE DI OPERATORI <---");

        int exitCode;
        try {
            exitCode = run(args);
        } finally {
            System.out.println("---> FINE ESECUZIONE RIDUTTORE <---");
        }

        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    /**
     * Esegue l'intero flusso e restituisce il codice di uscita.
     *
     * @param args parametri linea di comando
     * @return 0 se tutte le formule sono state ridotte, 1 altrimenti
     */
    static int run(String[] args) {
        if (args.length == 0) {
            System.out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
            return 1;
        }

        ReducerConfiguration config;
        try {
            config = new ArgumentParser().parse(args);
        } catch (IllegalArgumentException e) {
            System.out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            System.out.println("Usa -h per visualizzare l'help completo.");
            return 1;
        }
        if (config == null) {
            return 0; // Help mostrato
        }

        if (config.verbose) {
            enableVerboseLogging();
        }
        displayConfigurationSummary(config);

        try {
            BatchResult result = executeMainPipeline(config);
            return result.errorCount == 0 ? 0 : 1;
        } catch (IOException e) {
            System.out.println("[E] Errore critico nell'applicazione: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Esegue la pipeline sul file singolo o su tutti i file della directory.
     */
    private static BatchResult executeMainPipeline(ReducerConfiguration config) throws IOException {
        Map<OperatorBasis, FormulaReducer> reducers = buildReducers(config);

        if (config.isFileMode) {
            System.out.println("[I] Modalità: Elaborazione file singolo");
            FileResult fileResult = processSingleFile(Paths.get(config.inputPath), config, reducers);
            BatchResult result = new BatchResult(1);
            result.add(fileResult);
            return result;
        }

        System.out.println("[I] Modalità: Elaborazione della directory");
        List<Path> files = findAllTxtFiles(config.inputPath);
        if (files.isEmpty()) {
            System.out.println("[W] Nessun file .txt trovato nella directory specificata.");
        }

        BatchResult result = new BatchResult(files.size());
        for (Path file : files) {
            try {
                result.add(processSingleFile(file, config, reducers));
            } catch (IOException e) {
                System.out.println("[E] Errore nel file " + file.getFileName() + ": " + e.getMessage());
                result.add(FileResult.failed());
            }
            System.out.println();
        }
        displayBatchSummary(result);
        return result;
    }

    /**
     * Costruisce un riduttore per ogni base richiesta, tutti sopra lo stesso riduttore di base.
     */
    private static Map<OperatorBasis, FormulaReducer> buildReducers(ReducerConfiguration config) {
        NotAndOrReducer base = new NotAndOrReducer(config.placeholder, config.placeholderPolicy);
        Map<OperatorBasis, FormulaReducer> reducers = new EnumMap<>(OperatorBasis.class);
        for (OperatorBasis basis : config.bases) {
            reducers.put(basis, basis.createReducer(base));
        }
        return reducers;
    }

    private static void enableVerboseLogging() {
        ConsoleHandler handler = new ConsoleHandler();
        handler.setLevel(Level.FINE);
        PROJECT_LOGGER.addHandler(handler);
        PROJECT_LOGGER.setLevel(Level.FINE);
        PROJECT_LOGGER.setUseParentHandlers(false);
    }

    //endregion

    //region ELABORAZIONE FILE

    /**
     * Elabora un file: ogni riga significativa viene analizzata e ridotta verso ogni base.
     * Gli errori di una riga non interrompono le righe successive.
     *
     * @return conteggi di formule ridotte e righe con errori
     * @throws IOException se il file non è leggibile o l'output non è scrivibile
     */
    static FileResult processSingleFile(Path file, ReducerConfiguration config,
                                        Map<OperatorBasis, FormulaReducer> reducers) throws IOException {
        System.out.println("-->> ELABORAZIONE FILE <<--");
        System.out.println("File: " + file.getFileName());

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        Map<OperatorBasis, List<String>> outputs = new EnumMap<>(OperatorBasis.class);
        for (OperatorBasis basis : reducers.keySet()) {
            outputs.put(basis, new ArrayList<>());
        }

        FileResult result = new FileResult();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty() || line.startsWith(COMMENT_PREFIX)) {
                continue;
            }

            try {
                Formula formula = FormulaParser.parse(line);
                Map<OperatorBasis, String> reduced = new EnumMap<>(OperatorBasis.class);
                for (Map.Entry<OperatorBasis, FormulaReducer> entry : reducers.entrySet()) {
                    reduced.put(entry.getKey(), renderReduced(entry.getKey(), entry.getValue().reduce(formula)));
                }
                for (Map.Entry<OperatorBasis, String> entry : reduced.entrySet()) {
                    outputs.get(entry.getKey()).add(entry.getValue());
                }
                result.formulaCount++;
            } catch (IllegalArgumentException e) {
                System.out.println("[E] Riga " + (i + 1) + ": " + e.getMessage());
                for (List<String> output : outputs.values()) {
                    output.add(COMMENT_PREFIX + " errore alla riga " + (i + 1) + ": " + line);
                }
                result.errorCount++;
            }
        }

        for (Map.Entry<OperatorBasis, List<String>> entry : outputs.entrySet()) {
            saveFormulasToFile(entry.getValue(), file, config, entry.getKey().getDirectoryName());
        }

        System.out.println("[I] Formule ridotte: " + result.formulaCount + ", righe con errori: " + result.errorCount);
        return result;
    }

    /**
     * Testo della formula ridotta, solo se l'albero espanso resta entro {@link #MAX_OUTPUT_NODES}.
     *
     * @throws IllegalArgumentException se la forma testuale sarebbe troppo grande
     */
    private static String renderReduced(OperatorBasis basis, Formula reduced) {
        if (reduced.size() > MAX_OUTPUT_NODES) {
            throw new IllegalArgumentException("Formula ridotta verso " + basis.getCliName() +
                    " troppo grande da scrivere (" +
                    reduced.size() + " nodi, limite " + MAX_OUTPUT_NODES + ")");
        }
        return reduced.toString();
    }

    /**
     * Trova tutti i file .txt nella directory specificata, in ordine di nome.
     */
    private static List<Path> findAllTxtFiles(String dirPath) throws IOException {
        System.out.println("Ricerca file .txt nella directory...");

        List<Path> txtFiles;
        try (Stream<Path> paths = Files.list(Paths.get(dirPath))) {
            txtFiles = paths
                    .filter(path -> path.toString().toLowerCase().endsWith(INPUT_EXTENSION))
                    .filter(Files::isRegularFile)
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .toList();
        }

        System.out.println("Trovati " + txtFiles.size() + " file .txt da elaborare.");
        return txtFiles;
    }

    //endregion

    //region GESTIONE DELL'OUTPUT

    /**
     * Salva le formule ridotte nella sottodirectory della base.
     */
    private static void saveFormulasToFile(List<String> formulas, Path inputFile, ReducerConfiguration config,
                                           String dirName) throws IOException {
        Path outputDir = getOutputDirectory(config, inputFile, dirName);
        Files.createDirectories(outputDir);

        Path outputFilePath = outputDir.resolve(getBaseFileName(inputFile) + INPUT_EXTENSION);
        Files.write(outputFilePath, formulas, StandardCharsets.UTF_8);

        System.out.println("[I] Formule " + dirName + " salvate: " + outputFilePath);
    }

    /**
     * Directory di output: quella indicata con -o, altrimenti quella del file di input.
     */
    private static Path getOutputDirectory(ReducerConfiguration config, Path inputFile, String subdirName) {
        if (config.outputPath != null) {
            return Paths.get(config.outputPath).resolve(subdirName);
        }
        Path parentDir = inputFile.toAbsolutePath().getParent();
        return parentDir != null ? parentDir.resolve(subdirName) : Paths.get(subdirName);
    }

    private static String getBaseFileName(Path filePath) {
        String fileName = filePath.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
    }

    private static void displayConfigurationSummary(ReducerConfiguration config) {
        System.out.println("\n-->> CONFIGURAZIONE RIDUTTORE <<--");
        System.out.println("Input: " + config.inputPath);
        System.out.println("Output: " + (config.outputPath != null ? config.outputPath : "stessa directory dell'input"));
        List<String> names = new ArrayList<>();
        for (OperatorBasis basis : config.bases) {
            names.add(basis.getCliName());
        }
        System.out.println("Basi: " + String.join(", ", names));
        System.out.println("Segnaposto costanti: " + config.placeholder + " (" + config.placeholderPolicy + ")");
        System.out.println("==================================\n");
    }

    private static void displayBatchSummary(BatchResult result) {
        System.out.println("\n-->> RIEPILOGO ELABORAZIONE DIRECTORY <<--");
        System.out.println("File trovati: " + result.totalFiles);
        System.out.println("Formule ridotte: " + result.formulaCount);
        System.out.println("Righe o file con errori: " + result.errorCount);
        System.out.println("=========================================\n");
    }

    //endregion

    //region HELP E DOCUMENTAZIONE

    private static void printApplicationHelp() {
        System.out.println("\n::>> RIDUTTORE DI OPERATORI PROPOSIZIONALI <<::");
        System.out.println("Riscrive formule proposizionali usando solo una base minima di connettivi\n");

        System.out.println("UTILIZZO:");
        System.out.println("  java -jar riduttore_operatori.jar [opzioni]\n");

        System.out.println("OPZIONI:");
        System.out.println("  -f <file>       Elabora un singolo file .txt");
        System.out.println("  -d <directory>  Elabora tutti i file .txt in una directory");
        System.out.println("  -o <directory>  Directory di output (default: stessa di input)");
        System.out.println("  -b=<basi>       Basi separate da virgola oppure all (default: all)");
        System.out.println("                  not-and-or, not-and, nand, implies-not, implies-false");
        System.out.println("  -p=<nome>       Variabile segnaposto per eliminare T e F (default: p)");
        System.out.println("  -fresh          Sceglie un segnaposto non presente nella formula");
        System.out.println("  -v              Log dettagliato delle riduzioni");
        System.out.println("  -h              Mostra questa guida\n");

        System.out.println("FORMATO INPUT:");
        System.out.println("  Una formula per riga, righe vuote e righe che iniziano con # ignorate");
        System.out.println("  Variabili: p, q1, x12   Costanti: T, F   Negazione: ~A");
        System.out.println("  Binari tra parentesi: (A&B) (A|B) (A->B) (A+B) (A<->B) (A-&B) (A-|B)\n");

        System.out.println("ESEMPI DI UTILIZZO:");
        System.out.println("  java -jar riduttore_operatori.jar -f formule.txt");
        System.out.println("  java -jar riduttore_operatori.jar -d ./formule/ -b=nand,implies-false -o ./output/\n");

        System.out.println("OUTPUT GENERATO:");
        System.out.println("  NOT-AND-OR/ NOT-AND/ NAND/ IMPLIES-NOT/ IMPLIES-FALSE/");
        System.out.println("  Una formula ridotta per ogni riga elaborata dell'input\n");
    }

    //endregion

    //region CLASSI DI SUPPORTO E CONFIGURAZIONE

    /**
     * Configurazione validata dell'applicazione.
     */
    static final class ReducerConfiguration {
        final String inputPath;
        final String outputPath;
        final boolean isFileMode;
        final Set<OperatorBasis> bases;
        final String placeholder;
        final PlaceholderPolicy placeholderPolicy;
        final boolean verbose;

        ReducerConfiguration(String inputPath, String outputPath, boolean isFileMode, Set<OperatorBasis> bases,
                             String placeholder, PlaceholderPolicy placeholderPolicy, boolean verbose) {
            this.inputPath = inputPath;
            this.outputPath = outputPath;
            this.isFileMode = isFileMode;
            this.bases = bases;
            this.placeholder = placeholder;
            this.placeholderPolicy = placeholderPolicy;
            this.verbose = verbose;
        }
    }

    /**
     * Parser per parametri linea di comando.
     */
    static final class ArgumentParser {

        /**
         * Processa sequenzialmente tutti i parametri e costruisce la configurazione.
         *
         * @param args parametri da linea comando
         * @return configurazione validata (null se help richiesto)
         * @throws IllegalArgumentException se parametri invalidi
         */
        ReducerConfiguration parse(String[] args) {
            String inputPath = null;
            String outputPath = null;
            boolean isFileMode = false;
            boolean isDirectoryMode = false;
            Set<OperatorBasis> bases = EnumSet.allOf(OperatorBasis.class);
            String placeholder = NotAndOrReducer.DEFAULT_PLACEHOLDER;
            PlaceholderPolicy policy = PlaceholderPolicy.FIXED;
            boolean verbose = false;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        printApplicationHelp();
                        return null;
                    }

                    case FILE_PARAM -> {
                        validateExclusiveMode(isDirectoryMode, "file");
                        inputPath = getNextArgument(args, ++i, "file");
                        validateFileExists(inputPath);
                        isFileMode = true;
                    }

                    case DIR_PARAM -> {
                        validateExclusiveMode(isFileMode, "directory");
                        inputPath = getNextArgument(args, ++i, "directory");
                        validateDirectoryExists(inputPath);
                        isDirectoryMode = true;
                    }

                    case OUTPUT_PARAM -> outputPath = getNextArgument(args, ++i, "directory output");

                    case FRESH_PARAM -> policy = PlaceholderPolicy.FRESH;

                    case VERBOSE_PARAM -> verbose = true;

                    default -> {
                        if (args[i].startsWith(BASIS_PARAM)) {
                            bases = parseBases(args[i].substring(BASIS_PARAM.length()));
                        } else if (args[i].startsWith(PLACEHOLDER_PARAM)) {
                            placeholder = parsePlaceholder(args[i].substring(PLACEHOLDER_PARAM.length()));
                        } else {
                            throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                        }
                    }
                }
            }

            if (inputPath == null) {
                throw new IllegalArgumentException("Specificare input con -f (file) o -d (directory)");
            }

            return new ReducerConfiguration(inputPath, outputPath, isFileMode, bases, placeholder, policy, verbose);
        }

        private void validateExclusiveMode(boolean otherMode, String currentMode) {
            if (otherMode) {
                throw new IllegalArgumentException("Modalità " + currentMode +
                        " non può essere combinata con l'altra (file/directory sono mutualmente esclusive)");
            }
        }

        private Set<OperatorBasis> parseBases(String value) {
            if (value.trim().isEmpty()) {
                throw new IllegalArgumentException("Valore -b vuoto");
            }
            if (value.trim().equalsIgnoreCase(BASIS_ALL)) {
                return EnumSet.allOf(OperatorBasis.class);
            }

            Set<OperatorBasis> bases = EnumSet.noneOf(OperatorBasis.class);
            for (String name : value.split(",")) {
                bases.add(OperatorBasis.fromCliName(name));
            }
            return bases;
        }

        private String parsePlaceholder(String value) {
            // Stessa regola lessicale delle variabili accettate dal parser
            if (!value.matches("[a-z][a-zA-Z0-9]*")) {
                throw new IllegalArgumentException("Nome segnaposto non valido: " + value);
            }
            return value;
        }

        private String getNextArgument(String[] args, int currentIndex, String argumentType) {
            if (currentIndex >= args.length) {
                throw new IllegalArgumentException("Parametro " + args[currentIndex - 1] +
                        " richiede " + argumentType);
            }
            return args[currentIndex];
        }

        private void validateFileExists(String filePath) {
            File file = new File(filePath);
            if (!file.exists()) {
                throw new IllegalArgumentException("File non esistente: " + filePath);
            }
            if (!file.isFile()) {
                throw new IllegalArgumentException("Non è un file: " + filePath);
            }
            if (!file.canRead()) {
                throw new IllegalArgumentException("File non leggibile: " + filePath);
            }
        }

        private void validateDirectoryExists(String dirPath) {
            File dir = new File(dirPath);
            if (!dir.exists()) {
                throw new IllegalArgumentException("Directory non esistente: " + dirPath);
            }
            if (!dir.isDirectory()) {
                throw new IllegalArgumentException("Non è una directory: " + dirPath);
            }
            if (!dir.canRead()) {
                throw new IllegalArgumentException("Directory non leggibile: " + dirPath);
            }
        }
    }

    /**
     * Risultato dell'elaborazione di un singolo file.
     */
    static final class FileResult {
        int formulaCount = 0;
        int errorCount = 0;

        static FileResult failed() {
            FileResult result = new FileResult();
            result.errorCount = 1;
            return result;
        }
    }

    /**
     * Risultato elaborazione batch con statistiche.
     */
    private static final class BatchResult {
        final int totalFiles;
        int formulaCount = 0;
        int errorCount = 0;

        BatchResult(int totalFiles) {
            this.totalFiles = totalFiles;
        }

        void add(FileResult fileResult) {
            formulaCount += fileResult.formulaCount;
            errorCount += fileResult.errorCount;
        }
    }

    //endregion
}
