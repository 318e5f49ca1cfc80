package io.mediator.strategy;

import io.mediator.Mediator;
import io.mediator.Request;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.IntFunction;

/**
 * Strategy sending a fixed list of follow-up requests, one after another.
 *
 * <p>Each request is awaited before the next is sent; the first failure stops the
 * sequence and is reported as the strategy's failure. Responses are discarded.
 *
 * <pre>{@code
 * // sends Ping1 and Ping2
 * Strategy strategy = SendRequestsStrategy.repeat(2, i -> new Ping("Ping" + i));
 * }</pre>
 */
public final class SendRequestsStrategy implements Strategy {
    private final List<Request<?>> requests;

    private SendRequestsStrategy(List<Request<?>> requests) {
        this.requests = List.copyOf(requests);
    }

    /**
     * Creates a strategy sending the given requests in order.
     *
     * @param requests the follow-up requests
     * @return the strategy
     */
    public static SendRequestsStrategy of(Request<?>... requests) {
        return new SendRequestsStrategy(List.of(requests));
    }

    /**
     * Creates a strategy sending {@code count} requests built by {@code factory}
     * for the indices {@code 1..count}.
     *
     * @param count   number of requests, &ge; 0
     * @param factory builds the request for a 1-based index
     * @return the strategy
     */
    public static SendRequestsStrategy repeat(int count, IntFunction<? extends Request<?>> factory) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0");
        }
        Objects.requireNonNull(factory, "factory");
        List<Request<?>> requests = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            requests.add(Objects.requireNonNull(factory.apply(i), "factory returned null"));
        }
        return new SendRequestsStrategy(requests);
    }

    public List<Request<?>> requests() {
        return requests;
    }

    @Override
    public void apply(Mediator mediator) {
        for (Request<?> request : requests) {
            mediator.send(request);
        }
    }
}
