package pl.marcinmilkowski.ldsi.calibration;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.ldsi.config.LdsiCoefficients;
import pl.marcinmilkowski.ldsi.config.LdsiConfig;
import pl.marcinmilkowski.ldsi.exception.InvalidInputException;
import pl.marcinmilkowski.ldsi.scoring.LdsiScorer;
import pl.marcinmilkowski.ldsi.scoring.LdsiSignals;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Grid search for the alpha, beta and gamma that best reproduce a set of
 * human-rated pairs.
 *
 * <p>Every coefficient runs over {@code {0, step, 2*step, ..., 1}}; the
 * objective is the summed squared error between predicted and expected
 * lambda. The signals of a case do not depend on the coefficients, so each
 * case is scored once and every candidate triple only re-runs
 * {@link LdsiScorer#combine}.</p>
 */
public class CoefficientOptimizer {

    private static final Logger logger = LoggerFactory.getLogger(CoefficientOptimizer.class);

    public static final double DEFAULT_STEP = 0.05;
    public static final String GOLDEN_DATASET_RESOURCE = "golden-dataset.json";

    private final LdsiConfig baseConfig;
    private final int stepsPerUnit;

    public CoefficientOptimizer() {
        this(LdsiConfig.DEFAULT, DEFAULT_STEP);
    }

    /**
     * @param baseConfig supplies the structural scoring variant used to compute signals
     * @param step       grid spacing; 1/step must be a whole number
     */
    public CoefficientOptimizer(LdsiConfig baseConfig, double step) {
        if (baseConfig == null) {
            throw InvalidInputException.missing("config");
        }
        if (!(step > 0.0 && step <= 1.0)) {
            throw InvalidInputException.invalidParameter("step", step, "in (0, 1]");
        }
        long steps = Math.round(1.0 / step);
        if (Math.abs(steps * step - 1.0) > 1e-9) {
            throw InvalidInputException.invalidParameter("step", step, "a divisor of 1 such as 0.05 or 0.1");
        }
        this.baseConfig = baseConfig;
        this.stepsPerUnit = (int) steps;
    }

    public CalibrationResult optimize(List<TrainingCase> cases) {
        if (cases == null || cases.isEmpty()) {
            throw InvalidInputException.invalidParameter("cases", cases == null ? null : "[]", "a non-empty dataset");
        }

        List<LdsiSignals> signals = new ArrayList<>(cases.size());
        for (TrainingCase c : cases) {
            signals.add(LdsiScorer.score(c.textA(), c.textB(), baseConfig).signals());
        }

        LdsiCoefficients best = null;
        double minError = Double.MAX_VALUE;
        int combinations = 0;

        for (int a = 0; a <= stepsPerUnit; a++) {
            for (int b = 0; b <= stepsPerUnit; b++) {
                for (int g = 0; g <= stepsPerUnit; g++) {
                    LdsiCoefficients candidate = new LdsiCoefficients(
                        (double) a / stepsPerUnit, (double) b / stepsPerUnit, (double) g / stepsPerUnit);
                    double error = totalError(cases, signals, candidate);
                    combinations++;
                    if (error < minError) {
                        minError = error;
                        best = candidate;
                        logger.debug("New best: error={} alpha={} beta={} gamma={}",
                            error, candidate.alpha(), candidate.beta(), candidate.gamma());
                    }
                }
            }
        }

        List<CalibrationResult.CaseFit> fits = new ArrayList<>(cases.size());
        for (int i = 0; i < cases.size(); i++) {
            TrainingCase c = cases.get(i);
            fits.add(new CalibrationResult.CaseFit(c.name(), c.expectedLambda(),
                LdsiScorer.combine(signals.get(i), best)));
        }

        logger.info("Calibrated on {} cases over {} combinations: error={} ({})",
            cases.size(), combinations, minError, best);
        return new CalibrationResult(best, minError, combinations, fits);
    }

    static double totalError(List<TrainingCase> cases, List<LdsiSignals> signals, LdsiCoefficients coefficients) {
        double total = 0.0;
        for (int i = 0; i < cases.size(); i++) {
            double diff = LdsiScorer.combine(signals.get(i), coefficients) - cases.get(i).expectedLambda();
            total += diff * diff;
        }
        return total;
    }

    /** The four reference cases bundled with the engine. */
    public static List<TrainingCase> loadGoldenDataset() throws IOException {
        try (InputStream in = CoefficientOptimizer.class.getClassLoader()
                .getResourceAsStream(GOLDEN_DATASET_RESOURCE)) {
            if (in == null) {
                throw new IOException("Golden dataset not found on classpath: " + GOLDEN_DATASET_RESOURCE);
            }
            return parseDataset(new String(in.readAllBytes(), StandardCharsets.UTF_8), GOLDEN_DATASET_RESOURCE);
        }
    }

    /** A JSON array of {@code {"name", "text_a", "text_b", "expected_lambda"}} objects. */
    public static List<TrainingCase> loadDataset(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Dataset file not found: " + path);
        }
        return parseDataset(Files.readString(path), path.toString());
    }

    static List<TrainingCase> parseDataset(String json, String source) {
        JSONArray array;
        try {
            array = JSON.parseArray(json);
        } catch (JSONException e) {
            throw new InvalidInputException("Malformed dataset " + source + ": " + e.getMessage(), e);
        }
        if (array == null) {
            throw new InvalidInputException("Empty dataset: " + source);
        }
        List<TrainingCase> cases = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            try {
                cases.add(TrainingCase.fromJson(array.getJSONObject(i), "case-" + i));
            } catch (RuntimeException e) {
                logger.warn("Skipping case {} of {}: {}", i, source, e.getMessage());
            }
        }
        if (cases.isEmpty()) {
            throw new InvalidInputException("No valid training case in " + source);
        }
        if (cases.size() < array.size()) {
            logger.info("Loaded {} of {} cases from {}", cases.size(), array.size(), source);
        }
        return cases;
    }
}
