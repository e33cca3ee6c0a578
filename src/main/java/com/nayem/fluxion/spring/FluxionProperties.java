package com.nayem.fluxion.spring;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.hibernate.validator.constraints.time.DurationMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Configuration properties for the Fluxion dispatcher.
 * <p>
 * These properties can be configured in {@code application.yml} under the
 * {@code fluxion} prefix.
 * </p>
 */
@ConfigurationProperties(prefix = "fluxion")
@Validated
public class FluxionProperties {

    /**
     * Prefix of the tokens handed out by the dispatcher.
     */
    @NotBlank
    private String tokenPrefix = "ID_";

    /**
     * Type of the global broadcast sent when an action fails.
     */
    @NotBlank
    private String failedEventType = "ACTION_FAILED";

    /**
     * Configuration for dispatcher metrics.
     */
    @Valid
    private Metrics metrics = new Metrics();

    /**
     * Configuration for the {@link Action} layer.
     */
    @Valid
    private ActionLayer action = new ActionLayer();

    public String getTokenPrefix() {
        return tokenPrefix;
    }

    public void setTokenPrefix(String tokenPrefix) {
        this.tokenPrefix = tokenPrefix;
    }

    public String getFailedEventType() {
        return failedEventType;
    }

    public void setFailedEventType(String failedEventType) {
        this.failedEventType = failedEventType;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public void setMetrics(Metrics metrics) {
        this.metrics = metrics;
    }

    public ActionLayer getAction() {
        return action;
    }

    public void setAction(ActionLayer action) {
        this.action = action;
    }

    public static class Metrics {
        /**
         * Whether meters are registered when a MeterRegistry is available.
         */
        private boolean enabled = true;

        /**
         * Value of the {@code dispatcher} tag on every meter.
         */
        @NotBlank
        private String name = "fluxion";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }
    }

    public static class ActionLayer {
        /**
         * Whether {@link Action} methods are intercepted.
         */
        private boolean enabled = true;

        /**
         * How long a non-async {@link Action} method blocks its caller.
         */
        @NotNull
        @DurationMin(millis = 1)
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration blockTimeout = Duration.ofSeconds(30);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getBlockTimeout() {
            return blockTimeout;
        }

        public void setBlockTimeout(Duration blockTimeout) {
            this.blockTimeout = blockTimeout;
        }
    }
}
