package io.github.vishalmysore.bkdetect.text;

/**
 * A language resource required by the pipeline configuration could not be
 * loaded from any of its sources.
 */
public class ResourceUnavailableException extends RuntimeException {

    public ResourceUnavailableException(String message) {
        super(message);
    }

    public ResourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
