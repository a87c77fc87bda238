package app.taxguide.ask.answer.service;

/**
 * An external generation or translation call did not produce usable text. Timeouts included.
 */
public class GenerationException extends RuntimeException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
