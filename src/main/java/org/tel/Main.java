package org.tel;

import org.tel.formula.FormulaParser;
import org.tel.formula.StagedProgram;
import org.tel.horizon.HorizonExtension;
import org.tel.horizon.HorizonManager;
import org.tel.support.AtomRegistry;
import org.tel.support.GroundRule;
import org.tel.translation.TranslationException;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * TRADUTTORE DI FORMULE TEMPORALI E DINAMICHE
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: Programma temporale da file .tel (istruzioni "#stadio formula.")
 * 2. PARSING: Conversione in formule immutabili tramite la grammatica ANTLR
 * 3. SROTOLAMENTO: Estensione dell'orizzonte passo per passo con il gestore dell'orizzonte
 * 4. CHIUSURA: Traduzione dello stadio finale all'ultimo passo (salvo -open)
 * 5. OUTPUT: Regole ground in sintassi ASP e statistiche di traduzione
 *
 * MODALITÀ OPERATIVE SUPPORTATE:
 * - File singolo (-f): Traduzione di un singolo file .tel
 * - Directory batch (-d): Traduzione di tutti i file .tel in una cartella
 * - Numero di passi configurabile (-n) e orizzonte lasciato aperto (-open)
 * - Timeout configurabile per ogni file (-t secondi)
 * - Output directory personalizzabile (-o directory)
 *
 * ORGANIZZAZIONE DEGLI OUTPUT:
 * - RULES/: Regole per passo, regole di chiusura, esterni liberi e scelte sugli atomi
 * - STATS/: Statistiche di traduzione
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     */
    private static final String HELP_PARAM = "-h";
    private static final String FILE_PARAM = "-f";
    private static final String DIR_PARAM = "-d";
    private static final String OUTPUT_PARAM = "-o";
    private static final String STEPS_PARAM = "-n";
    private static final String TIMEOUT_PARAM = "-t";
    private static final String OPEN_PARAM = "-open";

    private static final String INPUT_EXTENSION = ".tel";

    /**
     * Valori di default e limiti
     */
    private static final int DEFAULT_STEPS = 3;
    private static final int MIN_STEPS = 1;
    private static final int MAX_STEPS = 10_000;
    private static final int DEFAULT_TIMEOUT_SECONDS = 10;
    private static final int MIN_TIMEOUT_SECONDS = 1;

    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    /**
     * Punto principale del traduttore.
     *
     * @param args parametri linea di comando forniti dall'utente
     */
    public static void main(String[] args) {
        System.out.println("---> AVVIO TRADUTTORE TEMPORALE <---");

        try {
            if (args.length == 0) {
                System.out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
                return;
            }

            TranslatorConfiguration config = parseAndValidateArguments(args);
            if (config == null) return; // Help mostrato o errore

            displayConfigurationSummary(config);

            if (config.isFileMode) {
                System.out.println("[I] Modalità: Elaborazione file singolo");
                processSingleFile(config);
            } else {
                System.out.println("[I] Modalità: Elaborazione della directory");
                processDirectoryBatch(config);
            }

        } catch (Exception e) {
            handleGlobalError(e);
        } finally {
            System.out.println("---> FINE ESECUZIONE TRADUTTORE TEMPORALE <---");
        }
    }

    private static void handleGlobalError(Exception e) {
        LOGGER.log(Level.SEVERE, "Errore critico nell'applicazione", e);
        System.out.println("[E] Errore critico nell'applicazione: " + e.getMessage());
        System.out.println("Controllare i log per dettagli completi.");
        System.exit(1);
    }

    //endregion

    //region PARSING E VALIDAZIONE PARAMETRI

    private static TranslatorConfiguration parseAndValidateArguments(String[] args) {
        try {
            return new ArgumentParser().parse(args);
        } catch (IllegalArgumentException e) {
            System.out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            System.out.println("Usa -h per visualizzare l'help completo.");
            return null;
        }
    }

    private static void displayConfigurationSummary(TranslatorConfiguration config) {
        System.out.println("\n-->> CONFIGURAZIONE TRADUTTORE <<--");
        System.out.println("Modalità: " + (config.isFileMode ? "File singolo" : "Directory"));
        System.out.println("Input: " + config.inputPath);
        System.out.println("Passi: " + config.steps + (config.leaveOpen ? " (orizzonte aperto)" : " (orizzonte chiuso)"));
        System.out.println("Timeout: " + config.timeoutSeconds + " secondi");
        System.out.println("Output: " + (config.outputPath != null ? config.outputPath : "Directory input"));
        System.out.println("====================================\n");
    }

    //endregion

    //region ELABORAZIONE DEL SINGOLO FILE

    /**
     * Traduce un singolo file: lettura, parsing, srotolamento con timeout e salvataggio.
     */
    private static void processSingleFile(TranslatorConfiguration config) {
        System.out.println("-->> ELABORAZIONE FILE <<--");
        System.out.println("File: " + Paths.get(config.inputPath).getFileName());
        System.out.println("=========================\n");

        try {
            StagedProgram program = readProgramFromFile(config.inputPath);
            HorizonManager manager = executeTranslationWithTimeout(program, config);

            if (manager == null) {
                saveTimeoutReport(config);
                return;
            }

            saveToOutput(renderRules(manager, config), config, "RULES", ".lp");
            saveToOutput(manager.statistics().toString(), config, "STATS", ".stats");
            System.out.println(manager.statistics());

        } catch (TranslationException e) {
            System.out.println("[E] Traduzione fallita per " + config.inputPath + ": " + e.getMessage());
            LOGGER.log(Level.WARNING, "Traduzione fallita", e);
            throw e;
        } catch (IOException e) {
            System.out.println("[E] Errore di accesso ai file per " + config.inputPath + ": " + e.getMessage());
            throw new IllegalStateException("Errore di I/O su " + config.inputPath, e);
        }
    }

    private static StagedProgram readProgramFromFile(String filePath) throws IOException {
        System.out.println("Lettura programma temporale...");
        String content = Files.readString(Path.of(filePath));
        StagedProgram program = FormulaParser.parseProgram(content);
        System.out.println("[I] Programma letto: " + program.size() + " formule");
        return program;
    }

    /**
     * Srotola l'orizzonte in un thread separato, interrotto allo scadere del timeout.
     *
     * @return il gestore con l'orizzonte srotolato, oppure null se il timeout scade
     */
    private static HorizonManager executeTranslationWithTimeout(StagedProgram program, TranslatorConfiguration config) {
        System.out.println("Srotolamento di " + config.steps + " passi (timeout: " + config.timeoutSeconds + "s)...");

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Callable<HorizonManager> task = () -> unrollHorizon(program, config);
            Future<HorizonManager> future = executor.submit(task);
            return future.get(config.timeoutSeconds, TimeUnit.SECONDS);

        } catch (TimeoutException e) {
            System.out.println("[W] Timeout raggiunto dopo " + config.timeoutSeconds + " secondi");
            return null;
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw new IllegalStateException("Errore durante la traduzione", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Traduzione interrotta", e);
        } finally {
            executor.shutdownNow();
        }
    }

    private static HorizonManager unrollHorizon(StagedProgram program, TranslatorConfiguration config) {
        HorizonManager manager = new HorizonManager(program);

        for (int i = 0; i < config.steps; i++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new IllegalStateException("Srotolamento interrotto al passo " + i);
            }
            HorizonExtension extension = manager.extendHorizon();
            System.out.println("[I] Passo " + extension.step() + ": " + extension.rules().size()
                    + " regole, " + extension.externals().size() + " esterni liberi");
        }

        if (!config.leaveOpen) {
            HorizonExtension closing = manager.markFinal(manager.horizon());
            System.out.println("[I] Orizzonte chiuso: " + closing.rules().size() + " regole di chiusura");
        } else {
            manager.statistics().stopTimer();
        }
        return manager;
    }

    //endregion

    //region ELABORAZIONE DELLA DIRECTORY

    private static void processDirectoryBatch(TranslatorConfiguration config) {
        System.out.println("[I] Inizio elaborazione directory: " + config.inputPath);

        try {
            List<File> files = findAllInputFiles(config.inputPath);
            if (files.isEmpty()) {
                System.out.println("[W] Nessun file " + INPUT_EXTENSION + " trovato nella directory specificata.");
                return;
            }

            int success = 0;
            for (File file : files) {
                try {
                    System.out.println("Elaborazione: " + file.getName());
                    processSingleFile(config.forFile(file));
                    success++;
                } catch (RuntimeException e) {
                    System.out.println("[E] Errore nel file " + file.getName() + ": " + e.getMessage());
                }
                System.out.println();
            }

            System.out.println("\n-->> RIEPILOGO ELABORAZIONE DIRECTORY <<--");
            System.out.println("File trovati: " + files.size());
            System.out.println("File tradotti con successo: " + success);
            System.out.println("File con errori: " + (files.size() - success));
            System.out.printf("Tasso di successo: %.1f%%%n", (double) success / files.size() * 100);
            System.out.println("=========================================\n");

        } catch (IOException e) {
            System.out.println("[E] Errore durante l'accesso alla directory: " + e.getMessage());
        }
    }

    private static List<File> findAllInputFiles(String dirPath) throws IOException {
        System.out.println("Ricerca file " + INPUT_EXTENSION + " nella directory...");

        try (Stream<Path> paths = Files.list(Paths.get(dirPath))) {
            List<File> files = paths
                    .filter(path -> path.toString().toLowerCase().endsWith(INPUT_EXTENSION))
                    .map(Path::toFile)
                    .sorted(Comparator.comparing(File::getName))
                    .toList();
            System.out.println("Trovati " + files.size() + " file da elaborare.");
            return files;
        }
    }

    //endregion

    //region GESTIONE DELL'OUTPUT

    /**
     * Rende le regole in sintassi ASP: un blocco per passo, la chiusura, gli
     * esterni ancora liberi e una scelta libera sugli atomi del programma.
     */
    static String renderRules(HorizonManager manager, TranslatorConfiguration config) {
        AtomRegistry atoms = manager.atoms();
        StringBuilder output = new StringBuilder();

        output.append("% Programma tradotto da ").append(Paths.get(config.inputPath).getFileName()).append("\n");
        for (int step = 0; step <= manager.horizon(); step++) {
            output.append("\n% passo ").append(step).append("\n");
            appendRules(output, manager.rulesAt(step), atoms);
        }

        if (!manager.finalRules().isEmpty()) {
            output.append("\n% chiusura al passo ").append(manager.horizon()).append("\n");
            appendRules(output, manager.finalRules(), atoms);
        }

        if (!manager.openExternals().isEmpty()) {
            output.append("\n% esterni di frontiera liberi\n");
            for (int external : manager.openExternals().keySet()) {
                output.append("#external ").append(atoms.symbol(external)).append(".\n");
            }
        }

        List<Integer> userAtoms = atoms.userAtoms();
        if (!userAtoms.isEmpty()) {
            output.append("\n% atomi del programma\n");
            output.append(userAtoms.stream().map(atoms::symbol).collect(Collectors.joining("; ", "{ ", " }.\n")));
        }
        return output.toString();
    }

    private static void appendRules(StringBuilder output, List<GroundRule> rules, AtomRegistry atoms) {
        for (GroundRule rule : rules) {
            output.append(rule.render(atoms::symbol)).append("\n");
        }
    }

    private static void saveToOutput(String content, TranslatorConfiguration config,
                                     String dirName, String extension) throws IOException {
        Path outputDir = getOutputDirectory(config, dirName);
        Files.createDirectories(outputDir);

        Path outputFilePath = outputDir.resolve(getBaseFileName(config.inputPath) + extension);
        try (FileWriter writer = new FileWriter(outputFilePath.toFile())) {
            writer.write(content);
        }

        System.out.println("[I] " + dirName + " salvato: " + outputFilePath);
    }

    private static void saveTimeoutReport(TranslatorConfiguration config) throws IOException {
        String report = "TIMEOUT\n"
                + "File: " + config.inputPath + "\n"
                + "Passi richiesti: " + config.steps + "\n"
                + "Timeout: " + config.timeoutSeconds + " secondi\n";
        saveToOutput(report, config, "STATS", ".stats");
    }

    private static Path getOutputDirectory(TranslatorConfiguration config, String subdirName) {
        if (config.outputPath != null) {
            return Paths.get(config.outputPath).resolve(subdirName);
        }
        Path parentDir = Paths.get(config.inputPath).getParent();
        return parentDir != null ? parentDir.resolve(subdirName) : Paths.get(subdirName);
    }

    private static String getBaseFileName(String filePath) {
        String fileName = Paths.get(filePath).getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
    }

    //endregion

    //region HELP E DOCUMENTAZIONE

    private static void printApplicationHelp() {
        System.out.println("\n::>> TRADUTTORE TEMPORALE <<::");
        System.out.println("Traduce programmi di logica temporale e dinamica in regole ground");
        System.out.println("per un risolutore ASP, un passo alla volta\n");

        System.out.println("UTILIZZO:");
        System.out.println("  java -jar solutore-tel.jar [opzioni]\n");

        System.out.println("OPZIONI:");
        System.out.println("  -f <file>       Traduce un singolo file .tel");
        System.out.println("  -d <directory>  Traduce tutti i file .tel in una directory");
        System.out.println("  -o <directory>  Directory di output (default: stessa di input)");
        System.out.println("  -n <passi>      Numero di passi da srotolare (min: " + MIN_STEPS
                + ", default: " + DEFAULT_STEPS + ")");
        System.out.println("  -t <secondi>    Timeout per file (min: " + MIN_TIMEOUT_SECONDS
                + ", default: " + DEFAULT_TIMEOUT_SECONDS + ")");
        System.out.println("  -open           Non chiude l'orizzonte: gli obblighi futuri restano esterni liberi");
        System.out.println("  -h              Mostra questa guida\n");

        System.out.println("SINTASSI DEL PROGRAMMA:");
        System.out.println("  #initial|#dynamic|#always|#final <formula>.   % commento");
        System.out.println("  Booleani:  ~f  f & g  f | g  f -> g  f <- g  f <> g");
        System.out.println("  Passato:   <f  <:f  <?f  <*f  f <? g  f <* g  <<f  f <; g  f <:; g");
        System.out.println("  Futuro:    >f  >:f  >?f  >*f  f >? g  f >* g  >>f  f ;> g  f ;>: g");
        System.out.println("  Dinamici:  [p].>? f  [p].>* f   con p ::= &true | ?f | p ;; p | p + p | *p | atomo");
        System.out.println("  Contati:   n <f  n <:f  n >f  n >:f   (n passi, 0 >f equivale a f)");
        System.out.println("  Costanti:  &true  &false  &initial  &final");
        System.out.println("  Nota: <> è sempre l'equivalenza, il precedente del successivo si scrive < >f o <(>f)");
        System.out.println("  I nomi che iniziano con __ sono riservati agli atomi ausiliari\n");

        System.out.println("ESEMPI DI UTILIZZO:");
        System.out.println("  java -jar solutore-tel.jar -f programma.tel -n 5");
        System.out.println("  java -jar solutore-tel.jar -d ./programmi/ -o ./output/ -t 30 -open\n");

        System.out.println("OUTPUT GENERATO:");
        System.out.println("  RULES/        Regole ground per passo in sintassi ASP");
        System.out.println("  STATS/        Statistiche di traduzione\n");

        System.out.println("===============================================\n");
    }

    //endregion

    //region CLASSI DI SUPPORTO E CONFIGURAZIONE

    /**
     * Configurazione validata dell'applicazione.
     */
    static final class TranslatorConfiguration {
        final String inputPath;
        final String outputPath;
        final boolean isFileMode;
        final int steps;
        final int timeoutSeconds;
        final boolean leaveOpen;

        TranslatorConfiguration(String inputPath, String outputPath, boolean isFileMode,
                                int steps, int timeoutSeconds, boolean leaveOpen) {
            this.inputPath = inputPath;
            this.outputPath = outputPath;
            this.isFileMode = isFileMode;
            this.steps = steps;
            this.timeoutSeconds = timeoutSeconds;
            this.leaveOpen = leaveOpen;
        }

        /** Configurazione per un file del batch, con le stesse opzioni. */
        TranslatorConfiguration forFile(File file) {
            return new TranslatorConfiguration(file.getAbsolutePath(), outputPath, true,
                    steps, timeoutSeconds, leaveOpen);
        }
    }

    /**
     * Parser dei parametri della linea di comando.
     */
    static final class ArgumentParser {

        /**
         * @param args parametri da linea di comando
         * @return configurazione validata, oppure null se è stato richiesto l'help
         * @throws IllegalArgumentException se i parametri non sono validi
         */
        TranslatorConfiguration parse(String[] args) {
            String inputPath = null;
            String outputPath = null;
            boolean isFileMode = false;
            boolean isDirectoryMode = false;
            boolean leaveOpen = false;
            int steps = DEFAULT_STEPS;
            int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;

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
                    case STEPS_PARAM -> steps = parseBoundedInteger(args, ++i, "numero passi", MIN_STEPS, MAX_STEPS);
                    case TIMEOUT_PARAM -> timeoutSeconds = parseBoundedInteger(args, ++i, "numero secondi",
                            MIN_TIMEOUT_SECONDS, Integer.MAX_VALUE);
                    case OPEN_PARAM -> leaveOpen = true;
                    default -> throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                }
            }

            if (inputPath == null) {
                throw new IllegalArgumentException("Specificare input con -f (file) o -d (directory)");
            }
            return new TranslatorConfiguration(inputPath, outputPath, isFileMode, steps, timeoutSeconds, leaveOpen);
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

        private int parseBoundedInteger(String[] args, int currentIndex, String argumentType, int min, int max) {
            String text = getNextArgument(args, currentIndex, argumentType);
            int value;
            try {
                value = Integer.parseInt(text);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Valore non valido per " + args[currentIndex - 1] + ": " + text);
            }
            if (value < min || value > max) {
                throw new IllegalArgumentException("Valore per " + args[currentIndex - 1] + " fuori dall'intervallo ["
                        + min + ", " + max + "]: " + value);
            }
            return value;
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
            if (!dir.canWrite()) {
                throw new IllegalArgumentException("Directory non scrivibile: " + dirPath);
            }
        }
    }

    //endregion
}
