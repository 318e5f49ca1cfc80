package io.mediator;

import java.util.List;

/**
 * Thrown when one or more notification handlers failed.
 *
 * <p>Publishing waits for every handler before reporting. The first failure is the
 * cause; every failure, in handler order, is available from {@link #failures()} and
 * the remaining ones are attached as suppressed exceptions.
 */
public final class PublishException extends MediatorException {
    private final Class<?> notificationType;
    private final int handlerCount;
    private final List<Throwable> failures;

    public PublishException(Class<?> notificationType, int handlerCount, List<Throwable> failures) {
        super(failures.size() + " of " + handlerCount + " handlers failed for notification "
                + notificationType.getName(), failures.get(0));
        this.notificationType = notificationType;
        this.handlerCount = handlerCount;
        this.failures = List.copyOf(failures);
        for (int i = 1; i < this.failures.size(); i++) {
            addSuppressed(this.failures.get(i));
        }
    }

    public Class<?> notificationType() {
        return notificationType;
    }

    public int handlerCount() {
        return handlerCount;
    }

    public List<Throwable> failures() {
        return failures;
    }
}
