package com.driftsentinel.core.config;

import com.driftsentinel.core.model.SentimentLabel;
import com.driftsentinel.core.model.ValidationException;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JavaBean mirror of the monitor YAML file, populated by SnakeYAML.
 *
 * <p>
 * Every property is optional; absent values keep the {@link MonitorConfig}
 * defaults. Durations accept ISO-8601 ({@code PT15M}, {@code P7D}) or a plain
 * number of seconds.
 * </p>
 *
 * <pre>
 * window:
 *   capacity: 100
 *   maxAge: PT1H
 * baseline:
 *   distribution: { Negative: 0.33, Neutral: 0.34, Positive: 0.33 }
 *   meanConfidence: 0.8
 * drift:
 *   metric: psi
 *   minSamples: 30
 *   warnThreshold: 0.1
 *   criticalThreshold: 0.25
 * alerts:
 *   confidenceDropThreshold: 0.2
 *   criticalConfidenceDropThreshold: 0.3
 *   cooldown: PT15M
 *   recentLimit: 10
 * retrain:
 *   criticalAlertThreshold: 3
 *   evaluationPeriod: P7D
 *   maxStaleness: P30D
 * </pre>
 *
 * @since 1.0.0
 */
public class MonitorConfigFile {

    private Window window = new Window();
    private Baseline baseline;
    private Drift drift = new Drift();
    private Alerts alerts = new Alerts();
    private Retrain retrain = new Retrain();

    /**
     * Convert into a validated {@link MonitorConfig}.
     *
     * @return the immutable configuration
     * @throws ValidationException if a value cannot be parsed or fails
     *                             validation
     */
    public MonitorConfig toConfig() {
        List<String> errors = new ArrayList<>();
        MonitorConfig.Builder b = MonitorConfig.builder();

        if (window != null) {
            if (window.capacity != null) {
                b.windowCapacity(window.capacity);
            }
            Duration maxAge = parseDuration("window.maxAge", window.maxAge, errors);
            if (maxAge != null) {
                b.maxAge(maxAge);
            }
        }

        if (baseline != null) {
            try {
                b.baseline(baseline.toBaseline(errors));
            } catch (ValidationException e) {
                errors.addAll(e.getViolations());
            }
        }

        if (drift != null) {
            if (drift.metric != null) {
                b.distanceMetric(drift.metric);
            }
            if (drift.minSamples != null) {
                b.minSamples(drift.minSamples);
            }
            if (drift.warnThreshold != null) {
                b.warnThreshold(drift.warnThreshold);
            }
            if (drift.criticalThreshold != null) {
                b.criticalThreshold(drift.criticalThreshold);
            }
        }

        if (alerts != null) {
            if (alerts.confidenceDropThreshold != null) {
                b.confidenceDropThreshold(alerts.confidenceDropThreshold);
            }
            if (alerts.criticalConfidenceDropThreshold != null) {
                b.criticalConfidenceDropThreshold(alerts.criticalConfidenceDropThreshold);
            }
            Duration cooldown = parseDuration("alerts.cooldown", alerts.cooldown, errors);
            if (cooldown != null) {
                b.alertCooldown(cooldown);
            }
            if (alerts.recentLimit != null) {
                b.recentAlertLimit(alerts.recentLimit);
            }
        }

        if (retrain != null) {
            if (retrain.criticalAlertThreshold != null) {
                b.criticalAlertThreshold(retrain.criticalAlertThreshold);
            }
            Duration period = parseDuration("retrain.evaluationPeriod", retrain.evaluationPeriod, errors);
            if (period != null) {
                b.retrainEvaluationPeriod(period);
            }
            Duration staleness = parseDuration("retrain.maxStaleness", retrain.maxStaleness, errors);
            if (staleness != null) {
                b.maxStaleness(staleness);
            }
        }

        if (!errors.isEmpty()) {
            throw new ValidationException("Invalid monitor configuration file", errors);
        }
        return b.build();
    }

    static Duration parseDuration(String name, String raw, List<String> errors) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim();
        try {
            if (value.chars().allMatch(Character::isDigit)) {
                return Duration.ofSeconds(Long.parseLong(value));
            }
            return Duration.parse(value);
        } catch (DateTimeParseException | NumberFormatException e) {
            errors.add(name + " is not a valid duration: '" + raw + "'");
            return null;
        }
    }

    // ---------------------------------------------------------------
    // Sections
    // ---------------------------------------------------------------

    public static class Window {
        private Integer capacity;
        private String maxAge;

        public Integer getCapacity() {
            return capacity;
        }

        public void setCapacity(Integer capacity) {
            this.capacity = capacity;
        }

        public String getMaxAge() {
            return maxAge;
        }

        public void setMaxAge(String maxAge) {
            this.maxAge = maxAge;
        }
    }

    public static class Baseline {
        /** Label name to proportion. Values are left untyped so integers are accepted. */
        private Map<String, Object> distribution = new LinkedHashMap<>();
        private Double meanConfidence;

        BaselineDistribution toBaseline(List<String> errors) {
            BaselineDistribution defaults = BaselineDistribution.defaults();
            Map<SentimentLabel, Double> proportions = new EnumMap<>(SentimentLabel.class);
            if (distribution == null || distribution.isEmpty()) {
                proportions.putAll(defaults.getProportions());
            } else {
                for (Map.Entry<String, Object> entry : distribution.entrySet()) {
                    SentimentLabel label = SentimentLabel.fromName(entry.getKey()).orElse(null);
                    if (label == null) {
                        errors.add("baseline.distribution has unknown label '" + entry.getKey() + "'");
                    } else if (entry.getValue() instanceof Number n) {
                        proportions.put(label, n.doubleValue());
                    } else {
                        errors.add("baseline.distribution." + entry.getKey() + " must be numeric");
                    }
                }
            }
            double mean = meanConfidence != null ? meanConfidence : defaults.getMeanConfidence();
            return new BaselineDistribution(proportions, mean);
        }

        public Map<String, Object> getDistribution() {
            return distribution;
        }

        public void setDistribution(Map<String, Object> distribution) {
            this.distribution = distribution;
        }

        public Double getMeanConfidence() {
            return meanConfidence;
        }

        public void setMeanConfidence(Double meanConfidence) {
            this.meanConfidence = meanConfidence;
        }
    }

    public static class Drift {
        private String metric;
        private Integer minSamples;
        private Double warnThreshold;
        private Double criticalThreshold;

        public String getMetric() {
            return metric;
        }

        public void setMetric(String metric) {
            this.metric = metric;
        }

        public Integer getMinSamples() {
            return minSamples;
        }

        public void setMinSamples(Integer minSamples) {
            this.minSamples = minSamples;
        }

        public Double getWarnThreshold() {
            return warnThreshold;
        }

        public void setWarnThreshold(Double warnThreshold) {
            this.warnThreshold = warnThreshold;
        }

        public Double getCriticalThreshold() {
            return criticalThreshold;
        }

        public void setCriticalThreshold(Double criticalThreshold) {
            this.criticalThreshold = criticalThreshold;
        }
    }

    public static class Alerts {
        private Double confidenceDropThreshold;
        private Double criticalConfidenceDropThreshold;
        private String cooldown;
        private Integer recentLimit;

        public Double getConfidenceDropThreshold() {
            return confidenceDropThreshold;
        }

        public void setConfidenceDropThreshold(Double confidenceDropThreshold) {
            this.confidenceDropThreshold = confidenceDropThreshold;
        }

        public Double getCriticalConfidenceDropThreshold() {
            return criticalConfidenceDropThreshold;
        }

        public void setCriticalConfidenceDropThreshold(Double criticalConfidenceDropThreshold) {
            this.criticalConfidenceDropThreshold = criticalConfidenceDropThreshold;
        }

        public String getCooldown() {
            return cooldown;
        }

        public void setCooldown(String cooldown) {
            this.cooldown = cooldown;
        }

        public Integer getRecentLimit() {
            return recentLimit;
        }

        public void setRecentLimit(Integer recentLimit) {
            this.recentLimit = recentLimit;
        }
    }

    public static class Retrain {
        private Integer criticalAlertThreshold;
        private String evaluationPeriod;
        private String maxStaleness;

        public Integer getCriticalAlertThreshold() {
            return criticalAlertThreshold;
        }

        public void setCriticalAlertThreshold(Integer criticalAlertThreshold) {
            this.criticalAlertThreshold = criticalAlertThreshold;
        }

        public String getEvaluationPeriod() {
            return evaluationPeriod;
        }

        public void setEvaluationPeriod(String evaluationPeriod) {
            this.evaluationPeriod = evaluationPeriod;
        }

        public String getMaxStaleness() {
            return maxStaleness;
        }

        public void setMaxStaleness(String maxStaleness) {
            this.maxStaleness = maxStaleness;
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required by SnakeYAML)
    // ---------------------------------------------------------------

    public Window getWindow() {
        return window;
    }

    public void setWindow(Window window) {
        this.window = window;
    }

    public Baseline getBaseline() {
        return baseline;
    }

    public void setBaseline(Baseline baseline) {
        this.baseline = baseline;
    }

    public Drift getDrift() {
        return drift;
    }

    public void setDrift(Drift drift) {
        this.drift = drift;
    }

    public Alerts getAlerts() {
        return alerts;
    }

    public void setAlerts(Alerts alerts) {
        this.alerts = alerts;
    }

    public Retrain getRetrain() {
        return retrain;
    }

    public void setRetrain(Retrain retrain) {
        this.retrain = retrain;
    }
}
