package io.mediator.dispatch;

import io.mediator.spi.MetricsExporter;

import java.util.concurrent.atomic.AtomicInteger;

final class RecordingMetrics implements MetricsExporter {
    final AtomicInteger sendSuccess = new AtomicInteger();
    final AtomicInteger sendFailure = new AtomicInteger();
    final AtomicInteger sendUnhandled = new AtomicInteger();
    final AtomicInteger publishSuccess = new AtomicInteger();
    final AtomicInteger publishFailure = new AtomicInteger();
    final AtomicInteger handlerDurations = new AtomicInteger();
    final AtomicInteger lastFanOut = new AtomicInteger(-1);

    @Override
    public void incrementSendSuccess() {
        sendSuccess.incrementAndGet();
    }

    @Override
    public void incrementSendFailure() {
        sendFailure.incrementAndGet();
    }

    @Override
    public void incrementSendUnhandled() {
        sendUnhandled.incrementAndGet();
    }

    @Override
    public void incrementPublishSuccess() {
        publishSuccess.incrementAndGet();
    }

    @Override
    public void incrementPublishFailure() {
        publishFailure.incrementAndGet();
    }

    @Override
    public void recordHandlerDurationMs(long durationMs) {
        handlerDurations.incrementAndGet();
    }

    @Override
    public void recordPublishFanOut(int handlerCount) {
        lastFanOut.set(handlerCount);
    }
}
