package io.mediator.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the mediator.
 *
 * @see MediatorAutoConfiguration
 */
@ConfigurationProperties(prefix = "mediator")
public class MediatorProperties {

    private final Publish publish = new Publish();
    private final StrategyHandler strategyHandler = new StrategyHandler();
    private final Metrics metrics = new Metrics();

    public Publish getPublish() {
        return publish;
    }

    public StrategyHandler getStrategyHandler() {
        return strategyHandler;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Publish {
        /**
         * Worker threads invoking notification handlers concurrently. 0 invokes them on
         * the publishing thread.
         */
        private int parallelism = 0;

        /**
         * How long closing the mediator waits for running notification handlers.
         */
        private long shutdownTimeoutMs = 5000;

        public int getParallelism() {
            return parallelism;
        }

        public void setParallelism(int parallelism) {
            this.parallelism = parallelism;
        }

        public long getShutdownTimeoutMs() {
            return shutdownTimeoutMs;
        }

        public void setShutdownTimeoutMs(long shutdownTimeoutMs) {
            this.shutdownTimeoutMs = shutdownTimeoutMs;
        }
    }

    public static class StrategyHandler {
        /**
         * Whether to register a handler applying the strategy of every StrategyNotification.
         */
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "mediator";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
