package io.mediator;

import java.util.List;

/**
 * Thrown when resolution finds more than one handler where exactly one is required.
 *
 * <p>This is a wiring defect. It is reported when the affected request type is
 * dispatched; the mediator never picks one of the candidates.
 */
public final class HandlerAmbiguityException extends MediatorException {
    private final Class<?> requestType;
    private final List<String> candidates;

    public HandlerAmbiguityException(Class<?> requestType, List<String> candidates) {
        super(candidates.size() + " handlers registered for request type "
                + requestType.getName() + ": " + candidates);
        this.requestType = requestType;
        this.candidates = List.copyOf(candidates);
    }

    public Class<?> requestType() {
        return requestType;
    }

    /**
     * Returns a description of every conflicting registration.
     *
     * @return the candidate descriptions, never empty
     */
    public List<String> candidates() {
        return candidates;
    }
}
