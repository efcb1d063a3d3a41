package mgnrega.tracker.service;

/**
 * A required query parameter is missing or malformed.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
