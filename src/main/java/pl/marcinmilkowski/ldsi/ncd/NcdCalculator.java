package pl.marcinmilkowski.ldsi.ncd;

import com.github.luben.zstd.ZstdCompressCtx;
import com.github.luben.zstd.ZstdException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.ldsi.exception.CompressionException;
import pl.marcinmilkowski.ldsi.exception.InvalidInputException;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Normalized Compression Distance with short-text damping.
 *
 * <pre>
 * NCD(a,b) = (C(ab) - min(C(a), C(b))) / max(C(a), C(b))
 * </pre>
 *
 * <p>C is Zstandard at level {@value #COMPRESSION_LEVEL}. All three sizes are
 * measured with the same window, wide enough to cover the whole concatenation,
 * so a long B can still reference A. Level and window are fixed: any other
 * setting yields different sizes and breaks reproducibility.</p>
 *
 * <p>Compressors carry a fixed frame overhead that dominates short inputs and
 * inflates the distance. Below {@value #DAMPING_REFERENCE_LENGTH} combined
 * bytes the raw value is scaled by {@code ln(len) / ln(1024)}.</p>
 */
public final class NcdCalculator {

    private static final Logger logger = LoggerFactory.getLogger(NcdCalculator.class);

    public static final int COMPRESSION_LEVEL = 3;
    public static final int MIN_WINDOW_LOG = 10;
    public static final int MAX_WINDOW_LOG = 31;
    public static final int DAMPING_REFERENCE_LENGTH = 1024;

    private static final double LN_REFERENCE = Math.log(DAMPING_REFERENCE_LENGTH);

    private NcdCalculator() {
    }

    /**
     * Distance between the UTF-8 encodings of two texts.
     */
    public static CompressionMeasurement compute(String a, String b) {
        if (a == null) throw InvalidInputException.missing("text A");
        if (b == null) throw InvalidInputException.missing("text B");
        return compute(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Distance between two byte strings.
     *
     * @throws InvalidInputException if either buffer is null
     * @throws CompressionException  if the compressor fails
     */
    public static CompressionMeasurement compute(byte[] a, byte[] b) {
        if (a == null) throw InvalidInputException.missing("bytes of A");
        if (b == null) throw InvalidInputException.missing("bytes of B");

        byte[] combined = new byte[a.length + b.length];
        System.arraycopy(a, 0, combined, 0, a.length);
        System.arraycopy(b, 0, combined, a.length, b.length);

        int windowLog = windowLogFor(combined.length);
        int sizeA = compressedSize(a, windowLog);
        int sizeB = compressedSize(b, windowLog);
        int sizeCombined = compressedSize(combined, windowLog);

        double raw;
        if (a.length > 0 && Arrays.equals(a, b)) {
            // C(xx) > C(x) by the frame overhead; identity is distance 0 by definition
            raw = 0.0;
        } else {
            raw = rawDistance(sizeA, sizeB, sizeCombined);
        }

        double factor = dampingFactor(combined.length);
        double corrected = clamp(raw * factor, 0.0, 1.0);

        logger.debug("NCD window_log={} C(A)={} C(B)={} C(AB)={} raw={} factor={} corrected={}",
            windowLog, sizeA, sizeB, sizeCombined, raw, factor, corrected);

        return new CompressionMeasurement(sizeA, sizeB, sizeCombined, a.length, b.length,
            raw, factor, corrected);
    }

    /**
     * Raw distance from compressed sizes; 0 when both sizes are 0.
     */
    static double rawDistance(int sizeA, int sizeB, int sizeCombined) {
        int max = Math.max(sizeA, sizeB);
        if (max == 0) {
            return 0.0;
        }
        int min = Math.min(sizeA, sizeB);
        return (sizeCombined - min) / (double) max;
    }

    /**
     * Short-text correction. 1.0 from 1024 bytes on, 0 below 2 bytes
     * (ln(0) and ln(1) are not usable), logarithmic in between.
     */
    public static double dampingFactor(int combinedLength) {
        if (combinedLength >= DAMPING_REFERENCE_LENGTH) {
            return 1.0;
        }
        if (combinedLength < 2) {
            return 0.0;
        }
        return Math.log(combinedLength) / LN_REFERENCE;
    }

    /**
     * Smallest window (as log2) covering {@code size} bytes, within the
     * limits zstd accepts.
     */
    static int windowLogFor(int size) {
        if (size <= 0) {
            return MIN_WINDOW_LOG;
        }
        int bitsNeeded = Integer.SIZE - Integer.numberOfLeadingZeros(size);
        return Math.max(MIN_WINDOW_LOG, Math.min(MAX_WINDOW_LOG, bitsNeeded));
    }

    static int compressedSize(byte[] input, int windowLog) {
        try (ZstdCompressCtx ctx = new ZstdCompressCtx()) {
            ctx.setLevel(COMPRESSION_LEVEL);
            ctx.setWindowLog(windowLog);
            ctx.setChecksum(false);
            ctx.setContentSize(true);
            return ctx.compress(input).length;
        } catch (ZstdException e) {
            throw new CompressionException(
                "Zstandard failed on " + input.length + " bytes (window_log=" + windowLog + ")", e);
        }
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
