package pl.marcinmilkowski.ldsi.batch;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.ldsi.config.LdsiConfig;
import pl.marcinmilkowski.ldsi.exception.InvalidInputException;
import pl.marcinmilkowski.ldsi.scoring.LdsiResult;
import pl.marcinmilkowski.ldsi.scoring.LdsiScorer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Scores many independent pairs, optionally in parallel.
 *
 * <p>Each pair is scored on its own; a pair that fails is reported in its
 * {@link BatchOutcome} and the rest of the batch continues. Outcomes come
 * back in input order regardless of the thread count.</p>
 */
public class BatchScorer {

    private static final Logger logger = LoggerFactory.getLogger(BatchScorer.class);

    private static final int QUEUE_SIZE = 1000;

    private final LdsiConfig config;
    private final int numThreads;

    public BatchScorer(LdsiConfig config) {
        this(config, 1);
    }

    public BatchScorer(LdsiConfig config, int numThreads) {
        if (config == null) {
            throw InvalidInputException.missing("config");
        }
        if (numThreads < 1) {
            throw InvalidInputException.invalidParameter("threads", numThreads, ">= 1");
        }
        this.config = config;
        this.numThreads = numThreads;
    }

    public List<BatchOutcome> scoreAll(List<TextPair> pairs) {
        if (pairs == null) {
            throw InvalidInputException.missing("pairs");
        }
        long start = System.currentTimeMillis();
        List<BatchOutcome> outcomes = numThreads == 1 || pairs.size() < 2
            ? scoreSequential(pairs)
            : scoreParallel(pairs);

        long failed = outcomes.stream().filter(o -> !o.succeeded()).count();
        logger.info("Scored {} pairs in {} ms ({} failed, {} threads)",
            pairs.size(), System.currentTimeMillis() - start, failed, numThreads);
        return outcomes;
    }

    private List<BatchOutcome> scoreSequential(List<TextPair> pairs) {
        List<BatchOutcome> outcomes = new ArrayList<>(pairs.size());
        for (int i = 0; i < pairs.size(); i++) {
            outcomes.add(scoreOne(i, pairs.get(i)));
        }
        return outcomes;
    }

    private List<BatchOutcome> scoreParallel(List<TextPair> pairs) {
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
            numThreads, numThreads,
            60L, TimeUnit.SECONDS,
            new ArrayBlockingQueue<Runnable>(QUEUE_SIZE),
            new ThreadPoolExecutor.CallerRunsPolicy()
        );
        try {
            List<Future<BatchOutcome>> futures = new ArrayList<>(pairs.size());
            for (int i = 0; i < pairs.size(); i++) {
                final int index = i;
                futures.add(executor.submit(() -> scoreOne(index, pairs.get(index))));
            }

            List<BatchOutcome> outcomes = new ArrayList<>(pairs.size());
            for (int i = 0; i < futures.size(); i++) {
                outcomes.add(await(i, pairs.get(i), futures.get(i)));
            }
            return outcomes;
        } finally {
            executor.shutdown();
        }
    }

    private BatchOutcome await(int index, TextPair pair, Future<BatchOutcome> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return BatchOutcome.failure(index, idOf(index, pair), "interrupted");
        } catch (ExecutionException e) {
            // scoreOne catches everything it can; this is an Error from the task
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.error("Pair {} aborted", idOf(index, pair), cause);
            return BatchOutcome.failure(index, idOf(index, pair), String.valueOf(cause.getMessage()));
        }
    }

    BatchOutcome scoreOne(int index, TextPair pair) {
        String id = idOf(index, pair);
        try {
            if (pair == null) {
                throw InvalidInputException.missing("pair");
            }
            LdsiResult result = LdsiScorer.score(pair.textA(), pair.textB(), config);
            return BatchOutcome.success(index, id, result);
        } catch (RuntimeException e) {
            logger.warn("Pair {} failed: {}", id, e.getMessage());
            return BatchOutcome.failure(index, id, e.getMessage());
        }
    }

    private static String idOf(int index, TextPair pair) {
        return pair != null && pair.id() != null ? pair.id() : "pair-" + index;
    }

    /**
     * Scores a JSON array of {@code {"id", "text_a", "text_b"}} objects.
     * An entry that is not a valid pair becomes a failed outcome at its
     * position; the remaining entries are scored as usual.
     *
     * @throws InvalidInputException if the file is not a JSON array
     */
    public List<BatchOutcome> scoreFile(Path path) throws IOException {
        JSONArray array = readArray(path);
        List<TextPair> pairs = new ArrayList<>(array.size());
        Map<Integer, BatchOutcome> rejected = new LinkedHashMap<>();
        for (int i = 0; i < array.size(); i++) {
            try {
                pairs.add(TextPair.fromJson(array.getJSONObject(i), "pair-" + i));
            } catch (RuntimeException e) {
                logger.warn("Entry {} of {} is not a valid pair: {}", i, path, e.getMessage());
                pairs.add(null);
                rejected.put(i, BatchOutcome.failure(i, entryId(array.get(i), i), e.getMessage()));
            }
        }

        List<BatchOutcome> outcomes = new ArrayList<>(scoreAll(pairs));
        for (Map.Entry<Integer, BatchOutcome> entry : rejected.entrySet()) {
            outcomes.set(entry.getKey(), entry.getValue());
        }
        return outcomes;
    }

    private static String entryId(Object raw, int index) {
        if (raw instanceof JSONObject obj && obj.get("id") != null) {
            return String.valueOf(obj.get("id"));
        }
        return "pair-" + index;
    }

    private static JSONArray readArray(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Batch file not found: " + path);
        }
        JSONArray array;
        try {
            array = JSON.parseArray(Files.readString(path));
        } catch (JSONException e) {
            throw new InvalidInputException("Malformed batch file " + path + ": " + e.getMessage(), e);
        }
        if (array == null) {
            throw new InvalidInputException("Empty batch file: " + path);
        }
        return array;
    }
}
