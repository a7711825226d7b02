package org.modal;

import org.modal.countermodel.CounterModel;
import org.modal.countermodel.CounterModelExtractor;
import org.modal.formula.Formula;
import org.modal.parser.ModalFormulaParser;
import org.modal.tableaux.ModalLogicType;
import org.modal.tableaux.ModalTableaux;
import org.modal.tableaux.TableauxLimits;
import org.modal.tableaux.TableauxResult;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * SOLUTORE MODALE A TABLEAUX
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: una formula modale/deontica per file di testo (.txt)
 * 2. PARSING: notazione infissa -> {@link Formula} (ANTLR)
 * 3. PROVA: tableaux nella logica scelta (K, T, D, S4, S5) con limiti di ricerca
 * 4. OUTPUT: verdetto, traccia della prova, statistiche e contromodello per le formule non valide
 *
 * MODALITÀ OPERATIVE:
 * - File singolo (-f): elaborazione di un singolo file .txt
 * - Directory batch (-d): elaborazione di tutti i file .txt di una cartella
 *
 * ORGANIZZAZIONE DEGLI OUTPUT:
 * - RESULT/: verdetto, traccia e statistiche (.result)
 * - COUNTERMODEL/: contromodello in JSON per le formule non valide (.json)
 */
public final class Main {

    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    private static final String HELP_PARAM = "-h";
    private static final String FILE_PARAM = "-f";
    private static final String DIR_PARAM = "-d";
    private static final String OUTPUT_PARAM = "-o";
    private static final String LOGIC_PARAM = "-l";
    private static final String MAX_WORLDS_PARAM = "-maxw";
    private static final String MAX_DEPTH_PARAM = "-maxd";

    private static final String RESULT_DIR = "RESULT";
    private static final String COUNTERMODEL_DIR = "COUNTERMODEL";

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_FAILURE = 1;

    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    public static void main(String[] args) {
        int exitCode = run(args);
        if (exitCode != EXIT_SUCCESS) {
            System.exit(exitCode);
        }
    }

    /**
     * Esegue l'applicazione senza terminare la JVM.
     *
     * @param args parametri linea di comando
     * @return 0 se tutte le formule sono state elaborate, 1 per errori di parametri o di elaborazione
     */
    static int run(String[] args) {
        System.out.println("---> AVVIO SOLUTORE MODALE <---");

        try {
            if (args == null || args.length == 0) {
                System.out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
                return EXIT_FAILURE;
            }

            SolverConfiguration config;
            try {
                config = new ArgumentParser().parse(args);
            } catch (IllegalArgumentException e) {
                System.out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
                System.out.println("Usa -h per visualizzare l'help completo.");
                return EXIT_FAILURE;
            }
            if (config == null) {
                return EXIT_SUCCESS; // Help mostrato
            }

            displayConfigurationSummary(config);
            return executeMainPipeline(config) ? EXIT_SUCCESS : EXIT_FAILURE;

        } finally {
            System.out.println("---> FINE ESECUZIONE SOLUTORE MODALE <---");
        }
    }

    private static boolean executeMainPipeline(SolverConfiguration config) {
        if (config.isFileMode) {
            System.out.println("[I] Modalità: Elaborazione file singolo");
            return processSingleFile(config);
        }
        System.out.println("[I] Modalità: Elaborazione della directory");
        return processDirectoryBatch(config);
    }

    private static void displayConfigurationSummary(SolverConfiguration config) {
        System.out.println("\n-->> CONFIGURAZIONE SOLUTORE MODALE <<--");
        System.out.println("Modalità: " + (config.isFileMode ? "File singolo" : "Directory"));
        System.out.println("Input: " + config.inputPath);
        System.out.println("Logica: " + config.logicType + " (" + config.logicType.getFrameDescription() + ")");
        System.out.println("Limiti: " + config.limits.maxWorlds() + " mondi, " + config.limits.maxDepth() + " round");
        System.out.println("Output: " + (config.outputPath != null ? config.outputPath : "Directory input"));
        System.out.println("========================================\n");
    }

    //endregion

    //region ELABORAZIONE FILE

    /**
     * Elabora un singolo file: lettura, parsing, prova e salvataggio dei risultati.
     *
     * @return true se il file è stato elaborato senza errori
     */
    private static boolean processSingleFile(SolverConfiguration config) {
        System.out.println("-->> ELABORAZIONE FILE <<--");
        System.out.println("File: " + Paths.get(config.inputPath).getFileName());
        System.out.println("=========================\n");

        try {
            Formula formula = readFormula(config.inputPath);

            ModalTableaux tableaux = new ModalTableaux(config.logicType, config.limits);
            TableauxResult result = tableaux.prove(formula);
            displayVerdict(result);

            saveResult(result, config);
            if (!result.isValid()) {
                CounterModel counterModel = CounterModelExtractor.extractCounterModel(result);
                saveCounterModel(counterModel, config);
            }
            return true;

        } catch (IOException | RuntimeException e) {
            System.out.println("[E] Errore elaborazione del file '" + config.inputPath + "': " + e.getMessage());
            return false;
        }
    }

    private static Formula readFormula(String filePath) throws IOException {
        System.out.println("Lettura formula modale...");
        String content = Files.readString(Path.of(filePath), StandardCharsets.UTF_8).trim();
        System.out.println("[I] Formula letta: " + content);

        Formula formula = ModalFormulaParser.parse(content);
        System.out.println("[I] Formula analizzata: " + formula);
        return formula;
    }

    private static void displayVerdict(TableauxResult result) {
        switch (result.getStatus()) {
            case VALID -> System.out.println("[I] Formula VALIDA in " + result.getLogicType());
            case INVALID -> System.out.println("[I] Formula NON VALIDA in " + result.getLogicType());
            case INCONCLUSIVE -> System.out.println("[W] Limiti di ricerca esauriti: formula considerata NON VALIDA in "
                    + result.getLogicType());
        }
        System.out.println("Rami chiusi: " + result.getClosedBranches() + "/" + result.getTotalBranches());
        System.out.println(result.getStatistics().toCompactString());
    }

    /**
     * Elabora tutti i file .txt della directory. Gli errori su un file non interrompono il batch.
     *
     * @return true se tutti i file sono stati elaborati senza errori
     */
    private static boolean processDirectoryBatch(SolverConfiguration config) {
        System.out.println("[I] Inizio elaborazione directory: " + config.inputPath);

        List<File> txtFiles;
        try {
            txtFiles = findAllTxtFiles(config.inputPath);
        } catch (IOException e) {
            System.out.println("[E] Errore durante l'accesso alla directory: " + e.getMessage());
            return false;
        }
        if (txtFiles.isEmpty()) {
            System.out.println("[W] Nessun file .txt trovato nella directory specificata.");
            return true;
        }

        BatchResult batchResult = new BatchResult(txtFiles.size());
        for (File file : txtFiles) {
            System.out.println("Elaborazione: " + file.getName());
            if (processSingleFile(config.forFile(file))) {
                batchResult.incrementSuccess();
            } else {
                batchResult.incrementError();
            }
            System.out.println();
        }

        displayBatchSummary(batchResult);
        return batchResult.errorCount == 0;
    }

    private static List<File> findAllTxtFiles(String dirPath) throws IOException {
        System.out.println("Ricerca file .txt nella directory...");

        List<File> txtFiles;
        try (Stream<Path> paths = Files.list(Paths.get(dirPath))) {
            txtFiles = paths
                    .filter(path -> path.toString().toLowerCase().endsWith(".txt"))
                    .filter(Files::isRegularFile)
                    .map(Path::toFile)
                    .sorted(Comparator.comparing(File::getName))
                    .collect(Collectors.toList());
        }

        System.out.println("Trovati " + txtFiles.size() + " file .txt da elaborare.");
        return txtFiles;
    }

    private static void displayBatchSummary(BatchResult result) {
        System.out.println("\n-->> RIEPILOGO ELABORAZIONE DIRECTORY <<--");
        System.out.println("File trovati: " + result.totalFiles);
        System.out.println("File elaborati con successo: " + result.successCount);
        System.out.println("File con errori: " + result.errorCount);

        if (result.totalFiles > 0) {
            double successRate = (double) result.successCount / result.totalFiles * 100;
            System.out.printf("Tasso di successo: %.1f%%%n", successRate);
        }
        System.out.println("=========================================\n");
    }

    //endregion

    //region GESTIONE DELL'OUTPUT E SALVATAGGIO DEI FILE

    private static void saveResult(TableauxResult result, SolverConfiguration config) throws IOException {
        Path resultDir = getOutputDirectory(config, RESULT_DIR);
        Files.createDirectories(resultDir);
        Path resultFilePath = resultDir.resolve(getBaseFileName(config.inputPath) + ".result");

        try (FileWriter writer = new FileWriter(resultFilePath.toFile(), StandardCharsets.UTF_8)) {
            writer.write("=== PROVA A TABLEAUX ===\n");
            writer.write("File originale: " + Paths.get(config.inputPath).getFileName() + "\n");
            writer.write("Limiti: " + config.limits.maxWorlds() + " mondi, " + config.limits.maxDepth() + " round\n");
            writer.write("Limiti esauriti: " + (result.isBounded() ? "sì" : "no") + "\n");
            writer.write("\n" + "=".repeat(50) + "\n\n");
            writer.write(result.toString());
            writer.write("\n" + "=".repeat(50) + "\n\n");
            writer.write(result.getStatistics().toString());
        }

        System.out.println("[I] Risultati salvati: " + resultFilePath);
    }

    private static void saveCounterModel(CounterModel counterModel, SolverConfiguration config) throws IOException {
        Path counterModelDir = getOutputDirectory(config, COUNTERMODEL_DIR);
        Files.createDirectories(counterModelDir);
        Path counterModelPath = counterModelDir.resolve(getBaseFileName(config.inputPath) + ".json");

        try (FileWriter writer = new FileWriter(counterModelPath.toFile(), StandardCharsets.UTF_8)) {
            writer.write(counterModel.toJson());
        }

        System.out.println(counterModel);
        System.out.println("[I] Contromodello salvato: " + counterModelPath);
    }

    private static Path getOutputDirectory(SolverConfiguration config, String subdirName) {
        if (config.outputPath != null) {
            return Paths.get(config.outputPath).resolve(subdirName);
        }
        Path parentDir = Paths.get(config.inputPath).toAbsolutePath().getParent();
        return parentDir != null ? parentDir.resolve(subdirName) : Paths.get(subdirName);
    }

    private static String getBaseFileName(String filePath) {
        String fileName = Paths.get(filePath).getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
    }

    //endregion

    //region HELP

    private static void printApplicationHelp() {
        System.out.println("\n::>> SOLUTORE MODALE A TABLEAUX <<::");
        System.out.println("Decide la validità di formule modali e deontiche nelle logiche K, T, D, S4, S5");
        System.out.println("e costruisce un contromodello di Kripke per le formule non valide\n");

        System.out.println("UTILIZZO:");
        System.out.println("  java -jar solutore_modale.jar [opzioni]\n");

        System.out.println("OPZIONI:");
        System.out.println("  -f <file>       Elabora un singolo file .txt");
        System.out.println("  -d <directory>  Elabora tutti i file .txt in una directory");
        System.out.println("  -o <directory>  Directory di output (default: stessa di input)");
        System.out.println("  -l <logica>     Logica modale: K, T, D, S4, S5 (default: K)");
        System.out.println("  -maxw <n>       Numero massimo di mondi per ramo (default: " + TableauxLimits.DEFAULT_MAX_WORLDS + ")");
        System.out.println("  -maxd <n>       Numero massimo di round di espansione (default: " + TableauxLimits.DEFAULT_MAX_DEPTH + ")");
        System.out.println("  -h              Mostra questa guida\n");

        System.out.println("SINTASSI DELLE FORMULE:");
        System.out.println("  NOT: ! ~ ¬    AND: & ∧    OR: | ∨    IMPLIES: -> →    IFF: <-> ↔");
        System.out.println("  BOX: [] □     DIAMOND: <> ◊");
        System.out.println("  OBBLIGO: OBL(φ)    PERMESSO: PERM(φ)    DIVIETO: FORB(φ)");
        System.out.println("  Atomi: P, Q, Paga(x, y)\n");

        System.out.println("ESEMPI DI UTILIZZO:");
        System.out.println("  java -jar solutore_modale.jar -f assioma_t.txt -l T");
        System.out.println("  java -jar solutore_modale.jar -d ./formule/ -l S4 -maxw 50 -o ./output/\n");

        System.out.println("OUTPUT GENERATO:");
        System.out.println("  RESULT/        Verdetto, traccia della prova e statistiche");
        System.out.println("  COUNTERMODEL/  Contromodello JSON per le formule non valide\n");

        System.out.println("===============================================\n");
    }

    //endregion

    //region CLASSI DI SUPPORTO E CONFIGURAZIONE

    /**
     * Configurazione validata dell'applicazione.
     */
    private static final class SolverConfiguration {
        final String inputPath;
        final String outputPath;
        final boolean isFileMode;
        final ModalLogicType logicType;
        final TableauxLimits limits;

        SolverConfiguration(String inputPath, String outputPath, boolean isFileMode,
                            ModalLogicType logicType, TableauxLimits limits) {
            this.inputPath = inputPath;
            this.outputPath = outputPath;
            this.isFileMode = isFileMode;
            this.logicType = logicType;
            this.limits = limits;
        }

        /**
         * Configurazione per un singolo file di un batch; l'output resta quello del batch
         * oppure, se assente, la directory di input.
         */
        SolverConfiguration forFile(File file) {
            String batchOutput = outputPath != null ? outputPath : inputPath;
            return new SolverConfiguration(file.getAbsolutePath(), batchOutput, true, logicType, limits);
        }
    }

    /**
     * Parser dei parametri da linea di comando.
     */
    private static final class ArgumentParser {

        /**
         * @return configurazione validata, null se è stato richiesto l'help
         * @throws IllegalArgumentException se i parametri non sono validi
         */
        SolverConfiguration parse(String[] args) {
            String inputPath = null;
            String outputPath = null;
            boolean isFileMode = false;
            boolean isDirectoryMode = false;
            ModalLogicType logicType = ModalLogicType.K;
            int maxWorlds = TableauxLimits.DEFAULT_MAX_WORLDS;
            int maxDepth = TableauxLimits.DEFAULT_MAX_DEPTH;

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
                    case OUTPUT_PARAM -> {
                        outputPath = getNextArgument(args, ++i, "directory output");
                        validateOrCreateOutputDirectory(outputPath);
                    }
                    case LOGIC_PARAM -> logicType = ModalLogicType.fromName(getNextArgument(args, ++i, "logica"));
                    case MAX_WORLDS_PARAM -> maxWorlds = parsePositiveInt(args, ++i, "numero massimo di mondi");
                    case MAX_DEPTH_PARAM -> maxDepth = parsePositiveInt(args, ++i, "numero massimo di round");
                    default -> throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                }
            }

            if (inputPath == null) {
                throw new IllegalArgumentException("Specificare input con -f (file) o -d (directory)");
            }
            return new SolverConfiguration(inputPath, outputPath, isFileMode, logicType,
                    new TableauxLimits(maxWorlds, maxDepth));
        }

        private void validateExclusiveMode(boolean otherMode, String currentMode) {
            if (otherMode) {
                throw new IllegalArgumentException("Modalità " + currentMode
                        + " non può essere combinata con altre modalità (file/directory sono mutualmente esclusive)");
            }
        }

        private String getNextArgument(String[] args, int currentIndex, String argumentType) {
            if (currentIndex >= args.length) {
                throw new IllegalArgumentException("Parametro " + args[currentIndex - 1] + " richiede " + argumentType);
            }
            return args[currentIndex];
        }

        private int parsePositiveInt(String[] args, int currentIndex, String argumentType) {
            String value = getNextArgument(args, currentIndex, argumentType);
            int parsed;
            try {
                parsed = Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Valore non valido per " + argumentType + ": " + value, e);
            }
            if (parsed <= 0) {
                throw new IllegalArgumentException("Il " + argumentType + " deve essere > 0, ricevuto: " + parsed);
            }
            return parsed;
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
        }

        private void validateOrCreateOutputDirectory(String dirPath) {
            File dir = new File(dirPath);
            if (!dir.exists()) {
                System.out.println("Creazione directory output: " + dirPath);
                if (!dir.mkdirs()) {
                    throw new IllegalArgumentException("Impossibile creare directory: " + dirPath);
                }
            } else if (!dir.isDirectory()) {
                throw new IllegalArgumentException("Percorso non è una directory: " + dirPath);
            }
        }
    }

    /**
     * Esito aggregato dell'elaborazione di una directory.
     */
    private static final class BatchResult {
        final int totalFiles;
        int successCount = 0;
        int errorCount = 0;

        BatchResult(int totalFiles) {
            this.totalFiles = totalFiles;
        }

        void incrementSuccess() {
            successCount++;
        }

        void incrementError() {
            errorCount++;
        }
    }

    //endregion
}
