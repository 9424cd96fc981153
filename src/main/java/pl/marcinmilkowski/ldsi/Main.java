package pl.marcinmilkowski.ldsi;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.ldsi.api.LdsiApiServer;
import pl.marcinmilkowski.ldsi.audit.AuditEntry;
import pl.marcinmilkowski.ldsi.audit.AuditLogger;
import pl.marcinmilkowski.ldsi.audit.SummaryReport;
import pl.marcinmilkowski.ldsi.batch.BatchOutcome;
import pl.marcinmilkowski.ldsi.batch.BatchScorer;
import pl.marcinmilkowski.ldsi.calibration.CalibrationResult;
import pl.marcinmilkowski.ldsi.calibration.CoefficientOptimizer;
import pl.marcinmilkowski.ldsi.calibration.TrainingCase;
import pl.marcinmilkowski.ldsi.cleaning.TextCleaner;
import pl.marcinmilkowski.ldsi.config.LdsiCoefficients;
import pl.marcinmilkowski.ldsi.config.LdsiConfig;
import pl.marcinmilkowski.ldsi.config.LdsiConfigLoader;
import pl.marcinmilkowski.ldsi.entropy.EntropyAnalyzer;
import pl.marcinmilkowski.ldsi.entropy.EntropyMeasurement;
import pl.marcinmilkowski.ldsi.entropy.WordTokenizer;
import pl.marcinmilkowski.ldsi.graph.CooccurrenceGraph;
import pl.marcinmilkowski.ldsi.graph.CooccurrenceGraphBuilder;
import pl.marcinmilkowski.ldsi.graph.StructuralScoring;
import pl.marcinmilkowski.ldsi.graph.TopologyAnalyzer;
import pl.marcinmilkowski.ldsi.graph.TopologyMetrics;
import pl.marcinmilkowski.ldsi.ncd.CompressionMeasurement;
import pl.marcinmilkowski.ldsi.ncd.NcdCalculator;
import pl.marcinmilkowski.ldsi.scoring.LdsiResult;
import pl.marcinmilkowski.ldsi.scoring.LdsiScorer;
import pl.marcinmilkowski.ldsi.scoring.Verdict;
import pl.marcinmilkowski.ldsi.viz.GraphSvgRenderer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;

/**
 * Command-line entry point for LDSI scoring.
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        if (args.length == 0) {
            showUsage();
            return;
        }

        try {
            String command = args[0].toLowerCase(Locale.ROOT);

            switch (command) {
                case "analyze":
                    handleAnalyzeCommand(args);
                    break;
                case "ncd":
                    handleNcdCommand(args);
                    break;
                case "entropy":
                    handleEntropyCommand(args);
                    break;
                case "topology":
                    handleTopologyCommand(args);
                    break;
                case "batch":
                    handleBatchCommand(args);
                    break;
                case "calibrate":
                    handleCalibrateCommand(args);
                    break;
                case "server":
                    handleServerCommand(args);
                    break;
                case "info":
                    showInfo();
                    break;
                case "help":
                    showUsage();
                    break;
                default:
                    logger.error("Unknown command: {}", command);
                    showUsage();
            }
        } catch (Exception e) {
            logger.error("Application error", e);
            System.err.println("Error: " + e.getMessage());
            System.err.println("Use 'help' command for usage information.");
            System.exit(1);
        }
    }

    private static void handleAnalyzeCommand(String[] args) throws IOException {
        String textA = null;
        String textB = null;
        String configPath = null;
        String output = null;
        String scoring = null;
        Double alpha = null;
        Double beta = null;
        Double gamma = null;
        boolean clean = false;
        boolean json = false;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--text-a":
                case "-a":
                    textA = args[++i];
                    break;
                case "--text-b":
                case "-b":
                    textB = args[++i];
                    break;
                case "--config":
                    configPath = args[++i];
                    break;
                case "--output":
                case "-o":
                    output = args[++i];
                    break;
                case "--scoring":
                    scoring = args[++i];
                    break;
                case "--alpha":
                    alpha = Double.parseDouble(args[++i]);
                    break;
                case "--beta":
                    beta = Double.parseDouble(args[++i]);
                    break;
                case "--gamma":
                    gamma = Double.parseDouble(args[++i]);
                    break;
                case "--clean":
                case "-c":
                    clean = true;
                    break;
                case "--json":
                    json = true;
                    break;
                default:
                    System.err.println("Unknown option: " + args[i]);
            }
        }

        if (textA == null || textB == null) {
            System.err.println("Error: --text-a and --text-b are required");
            System.err.println("Usage: java -jar ldsi.jar analyze -a <file|text> -b <file|text> [--clean] [--output <audit.json>]");
            return;
        }

        LdsiConfig config = LdsiConfigLoader.loadOrDefault(configPath);
        LdsiCoefficients base = config.coefficients();
        if (alpha != null || beta != null || gamma != null) {
            config = config.withCoefficients(new LdsiCoefficients(
                alpha != null ? alpha : base.alpha(),
                beta != null ? beta : base.beta(),
                gamma != null ? gamma : base.gamma()));
        }
        if (scoring != null) {
            config = config.withStructuralScoring(StructuralScoring.parse(scoring));
        }

        long start = System.currentTimeMillis();
        String contentA = loadText(textA);
        String contentB = loadText(textB);
        if (clean) {
            TextCleaner cleaner = new TextCleaner();
            contentA = cleaner.clean(contentA);
            contentB = cleaner.clean(contentB);
            if (!json) {
                System.out.println("Texts cleaned (stopwords removed)");
            }
        }

        LdsiResult result = LdsiScorer.score(contentA, contentB, config);
        long duration = System.currentTimeMillis() - start;

        if (json) {
            System.out.println(result.toJson().toJSONString(JSONWriter.Feature.PrettyFormat));
        } else {
            printResult(result);
        }

        if (output != null) {
            AuditEntry entry = AuditEntry.create("local-analysis", textA, textB, contentA, contentB, result, duration);
            AuditLogger.appendSingle(entry, Paths.get(output));
            if (!json) {
                System.out.println();
                System.out.println("Audit entry " + entry.testId() + " appended to " + output);
                System.out.print(SummaryReport.from(entry).format());
            }
        }
    }

    private static void handleNcdCommand(String[] args) {
        if (args.length < 3) {
            System.err.println("Usage: java -jar ldsi.jar ncd <file|text> <file|text>");
            return;
        }
        CompressionMeasurement ncd = NcdCalculator.compute(loadText(args[1]), loadText(args[2]));

        System.out.println("=== Normalized Compression Distance ===");
        System.out.printf(Locale.ROOT, "  raw:            %.4f%n", ncd.raw());
        System.out.printf(Locale.ROOT, "  damping factor: %.4f%n", ncd.dampingFactor());
        System.out.printf(Locale.ROOT, "  corrected:      %.4f%n", ncd.corrected());
        System.out.printf(Locale.ROOT, "  C(A)=%d  C(B)=%d  C(AB)=%d  bytes: %d + %d%n",
            ncd.sizeA(), ncd.sizeB(), ncd.sizeCombined(), ncd.rawSizeA(), ncd.rawSizeB());
    }

    private static void handleEntropyCommand(String[] args) {
        String text = null;
        int ngram = 0;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--ngram":
                case "-n":
                    ngram = Integer.parseInt(args[++i]);
                    break;
                default:
                    if (text == null) {
                        text = args[i];
                    } else {
                        System.err.println("Unknown option: " + args[i]);
                    }
            }
        }
        if (text == null) {
            System.err.println("Usage: java -jar ldsi.jar entropy <file|text> [--ngram <n>]");
            return;
        }

        List<String> tokens = WordTokenizer.tokenize(loadText(text));
        EntropyMeasurement m = EntropyAnalyzer.analyze(tokens);

        System.out.println("=== Lexical Entropy ===");
        System.out.printf(Locale.ROOT, "  Shannon entropy: %.4f bits%n", m.shannon());
        System.out.printf(Locale.ROOT, "  type/token:      %.4f%n", m.ttr());
        System.out.printf(Locale.ROOT, "  hapax ratio:     %.4f%n", m.hapaxRatio());
        System.out.printf(Locale.ROOT, "  tokens: %d  unique: %d  hapax: %d%n",
            m.totalTokens(), m.uniqueTokens(), m.hapaxCount());
        if (ngram > 1) {
            System.out.printf(Locale.ROOT, "  %d-gram entropy:  %.4f bits%n", ngram, EntropyAnalyzer.ngramEntropy(tokens, ngram));
        }
    }

    private static void handleTopologyCommand(String[] args) throws IOException {
        String text = null;
        String svgPath = null;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--svg":
                    svgPath = args[++i];
                    break;
                default:
                    if (text == null) {
                        text = args[i];
                    } else {
                        System.err.println("Unknown option: " + args[i]);
                    }
            }
        }
        if (text == null) {
            System.err.println("Usage: java -jar ldsi.jar topology <file|text> [--svg <output.svg>]");
            return;
        }

        CooccurrenceGraph graph = CooccurrenceGraphBuilder.build(WordTokenizer.tokenize(loadText(text)));
        TopologyMetrics t = TopologyAnalyzer.analyze(graph);

        System.out.println("=== Co-occurrence Topology ===");
        System.out.printf(Locale.ROOT, "  nodes: %d  edges: %d  components: %d  LCC: %d%n",
            t.nodeCount(), t.edgeCount(), t.components(), t.lccSize());
        System.out.printf(Locale.ROOT, "  density:            %.4f%n", t.density());
        System.out.printf(Locale.ROOT, "  LCC ratio:          %.4f%n", t.lccRatio());
        System.out.printf(Locale.ROOT, "  clustering:         %.4f%n", t.clustering());
        System.out.printf(Locale.ROOT, "  avg path length:    %.4f%n", t.avgPathLength());
        System.out.printf(Locale.ROOT, "  small-world index:  %.4f%n", t.smallWorldIndex());
        System.out.printf(Locale.ROOT, "  avg degree:         %.4f%n", t.avgDegree());
        System.out.printf(Locale.ROOT, "  structural quality: %.4f%n", t.structuralQuality());

        if (svgPath != null) {
            Path out = Paths.get(svgPath);
            if (out.toAbsolutePath().getParent() != null) {
                Files.createDirectories(out.toAbsolutePath().getParent());
            }
            Files.writeString(out, GraphSvgRenderer.render(graph, 900, 700));
            System.out.println("SVG written: " + out.toAbsolutePath());
        }
    }

    private static void handleBatchCommand(String[] args) throws IOException {
        String input = null;
        String output = null;
        String configPath = null;
        int threads = Runtime.getRuntime().availableProcessors();

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--input":
                case "-i":
                    input = args[++i];
                    break;
                case "--output":
                case "-o":
                    output = args[++i];
                    break;
                case "--config":
                    configPath = args[++i];
                    break;
                case "--threads":
                case "-t":
                    threads = Integer.parseInt(args[++i]);
                    break;
                default:
                    System.err.println("Unknown option: " + args[i]);
            }
        }
        if (input == null) {
            System.err.println("Error: --input is required");
            System.err.println("Usage: java -jar ldsi.jar batch --input <pairs.json> [--output <results.json>] [--threads <n>]");
            return;
        }

        BatchScorer scorer = new BatchScorer(LdsiConfigLoader.loadOrDefault(configPath), threads);
        List<BatchOutcome> outcomes = scorer.scoreFile(Paths.get(input));

        JSONArray results = new JSONArray();
        for (BatchOutcome outcome : outcomes) {
            results.add(outcome.toJson());
            if (outcome.succeeded()) {
                System.out.printf(Locale.ROOT, "%-20s lambda=%.4f  %s%n",
                    outcome.id(), outcome.result().lambda(), outcome.result().verdict());
            } else {
                System.out.printf(Locale.ROOT, "%-20s FAILED: %s%n", outcome.id(), outcome.error());
            }
        }

        if (output != null) {
            Files.writeString(Paths.get(output), results.toJSONString(JSONWriter.Feature.PrettyFormat));
            System.out.println("Results written: " + output);
        }
    }

    private static void handleCalibrateCommand(String[] args) throws IOException {
        String dataset = null;
        String configPath = null;
        double step = CoefficientOptimizer.DEFAULT_STEP;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--dataset":
                case "-d":
                    dataset = args[++i];
                    break;
                case "--config":
                    configPath = args[++i];
                    break;
                case "--step":
                    step = Double.parseDouble(args[++i]);
                    break;
                default:
                    System.err.println("Unknown option: " + args[i]);
            }
        }

        List<TrainingCase> cases = dataset == null
            ? CoefficientOptimizer.loadGoldenDataset()
            : CoefficientOptimizer.loadDataset(Paths.get(dataset));
        System.out.println("Calibrating on " + cases.size() + " cases"
            + (dataset == null ? " (golden dataset)" : " from " + dataset));

        CalibrationResult result = new CoefficientOptimizer(LdsiConfigLoader.loadOrDefault(configPath), step)
            .optimize(cases);

        LdsiCoefficients best = result.best();
        System.out.println();
        System.out.println("=== Best coefficients ===");
        System.out.printf(Locale.ROOT, "  alpha (NCD):      %.2f%n", best.alpha());
        System.out.printf(Locale.ROOT, "  beta (entropy):   %.2f%n", best.beta());
        System.out.printf(Locale.ROOT, "  gamma (topology): %.2f%n", best.gamma());
        System.out.printf(Locale.ROOT, "  sum:              %.2f%n", best.sum());
        System.out.printf(Locale.ROOT, "  squared error:    %.4f over %d combinations%n",
            result.totalError(), result.combinations());
        System.out.println();
        for (CalibrationResult.CaseFit fit : result.fits()) {
            System.out.printf(Locale.ROOT, "  %-16s expected=%.2f predicted=%.4f%n",
                fit.name(), fit.expectedLambda(), fit.predictedLambda());
        }
    }

    private static void handleServerCommand(String[] args) throws IOException {
        String configPath = null;
        int port = 8080;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--port":
                case "-p":
                    port = Integer.parseInt(args[++i]);
                    break;
                case "--config":
                    configPath = args[++i];
                    break;
                default:
                    System.err.println("Unknown option: " + args[i]);
            }
        }

        LdsiApiServer server = new LdsiApiServer(LdsiConfigLoader.loadOrDefault(configPath), port);
        server.start();
        System.out.println("LDSI API listening on http://localhost:" + server.getPort());
        System.out.println("Press Ctrl+C to stop the server.");

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            System.out.println("\nShutting down...");
            server.stop();
        }));

        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Reads {@code arg} as a file when one exists at that path, otherwise
     * takes it as the literal text.
     */
    static String loadText(String arg) {
        try {
            Path path = Paths.get(arg);
            if (Files.isRegularFile(path)) {
                return Files.readString(path);
            }
        } catch (InvalidPathException e) {
            logger.trace("Not a path, using literal text: {}", e.getMessage());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + arg, e);
        }
        return arg;
    }

    private static void printResult(LdsiResult result) {
        Verdict verdict = result.verdict();
        System.out.println("==========================================");
        System.out.printf(Locale.ROOT, "  VERDICT: %s%n", verdict.name());
        System.out.printf(Locale.ROOT, "  %s%n", verdict.getDescription());
        System.out.println("==========================================");
        System.out.printf(Locale.ROOT, "  lambda:             %.4f%n", result.lambda());
        System.out.printf(Locale.ROOT, "  NCD (corrected):    %.4f  (raw %.4f, damping %.4f)%n",
            result.ncdCorrected(), result.ncd().raw(), result.ncd().dampingFactor());
        System.out.printf(Locale.ROOT, "  entropy ratio:      %.4f  (term %.4f)%n",
            result.entropyRatio(), result.entropy().term());
        System.out.printf(Locale.ROOT, "  structural quality: %.4f  (delta %.4f, using %s)%n",
            result.structuralQuality(), result.topology().delta(), result.topology().scoring());
        LdsiCoefficients c = result.coefficients();
        System.out.printf(Locale.ROOT, "  coefficients:       alpha=%.2f beta=%.2f gamma=%.2f%n",
            c.alpha(), c.beta(), c.gamma());
    }

    private static void showInfo() {
        System.out.println("LDSI " + LdsiScorer.VERSION);
        System.out.println("Deterministic divergence index for pairs of language-model responses.");
        System.out.println();
        System.out.println("  lambda = alpha * NCD + beta * entropy term + gamma * structural quality");
        System.out.println("  NCD:        zstd level " + NcdCalculator.COMPRESSION_LEVEL + ", length-damped below "
            + NcdCalculator.DAMPING_REFERENCE_LENGTH + " bytes");
        System.out.println("  entropy:    Shannon entropy of word unigrams, ratio H(B)/H(A)");
        System.out.println("  topology:   co-occurrence graph, window " + CooccurrenceGraphBuilder.MAX_WINDOW);
        System.out.println();
        System.out.println("Default configuration:");
        System.out.println(LdsiConfig.DEFAULT.toJson().toJSONString(JSONWriter.Feature.PrettyFormat));
    }

    private static void showUsage() {
        System.out.println("Usage: java -jar ldsi.jar <command> [options]");
        System.out.println();
        System.out.println("Available commands:");
        System.out.println("  analyze    - Score text B against reference text A");
        System.out.println("  ncd        - Normalized compression distance of two texts");
        System.out.println("  entropy    - Lexical entropy of one text");
        System.out.println("  topology   - Co-occurrence graph metrics of one text");
        System.out.println("  batch      - Score every pair of a JSON file");
        System.out.println("  calibrate  - Grid-search coefficients against rated pairs");
        System.out.println("  server     - Start the REST API server");
        System.out.println("  info       - Show version and formula");
        System.out.println("  help       - Show this help message");
        System.out.println();
        System.out.println("Text arguments are read as files when the path exists, otherwise used literally.");
        System.out.println();
        System.out.println("Analyze command:");
        System.out.println("  java -jar ldsi.jar analyze -a <file|text> -b <file|text> [--clean] [--json]");
        System.out.println("    [--alpha <a>] [--beta <b>] [--gamma <g>] [--scoring ABSOLUTE_QUALITY|REFERENCE_DELTA]");
        System.out.println("    [--config <ldsi.json>] [--output <audit.jsonl>]");
        System.out.println();
        System.out.println("Batch command:");
        System.out.println("  java -jar ldsi.jar batch --input <pairs.json> [--output <results.json>] [--threads <n>]");
        System.out.println();
        System.out.println("Calibrate command:");
        System.out.println("  java -jar ldsi.jar calibrate [--dataset <cases.json>] [--step 0.05]");
        System.out.println();
        System.out.println("Server command:");
        System.out.println("  java -jar ldsi.jar server [--port <port>] [--config <ldsi.json>]");
    }
}
