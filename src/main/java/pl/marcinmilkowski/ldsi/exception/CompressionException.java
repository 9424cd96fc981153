package pl.marcinmilkowski.ldsi.exception;

/**
 * The pinned compressor failed on a byte buffer. This never happens for valid
 * input and is not recoverable by the scoring pipeline.
 */
public class CompressionException extends RuntimeException {

    public CompressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
