package com.funnelscope.service.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "funnelscope")
public class FunnelProperties {
    private Engine engine = new Engine();
    private Breakdown breakdown = new Breakdown();
    private ConversionTimes conversionTimes = new ConversionTimes();
    private Steps steps = new Steps();

    public Engine getEngine() {
        return engine;
    }

    public void setEngine(Engine engine) {
        this.engine = engine;
    }

    public Breakdown getBreakdown() {
        return breakdown;
    }

    public void setBreakdown(Breakdown breakdown) {
        this.breakdown = breakdown;
    }

    public ConversionTimes getConversionTimes() {
        return conversionTimes;
    }

    public void setConversionTimes(ConversionTimes conversionTimes) {
        this.conversionTimes = conversionTimes;
    }

    public Steps getSteps() {
        return steps;
    }

    public void setSteps(Steps steps) {
        this.steps = steps;
    }

    public static class Engine {
        /** 0 means one worker per available processor. */
        private int workers = 0;

        private int batchSize = 500;
        private String timeout = "60s";

        public int getWorkers() {
            return workers;
        }

        public void setWorkers(int workers) {
            this.workers = workers;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public String getTimeout() {
            return timeout;
        }

        public void setTimeout(String timeout) {
            this.timeout = timeout;
        }

        public int effectiveWorkers() {
            return workers > 0 ? workers : Runtime.getRuntime().availableProcessors();
        }
    }

    public static class Breakdown {
        private int defaultLimit = 25;

        public int getDefaultLimit() {
            return defaultLimit;
        }

        public void setDefaultLimit(int defaultLimit) {
            this.defaultLimit = defaultLimit;
        }
    }

    public static class ConversionTimes {
        private String medianMode = "auto";
        private int exactSampleLimit = 1_000_000;
        private double relativeAccuracy = 0.01d;

        public String getMedianMode() {
            return medianMode;
        }

        public void setMedianMode(String medianMode) {
            this.medianMode = medianMode;
        }

        public int getExactSampleLimit() {
            return exactSampleLimit;
        }

        public void setExactSampleLimit(int exactSampleLimit) {
            this.exactSampleLimit = exactSampleLimit;
        }

        public double getRelativeAccuracy() {
            return relativeAccuracy;
        }

        public void setRelativeAccuracy(double relativeAccuracy) {
            this.relativeAccuracy = relativeAccuracy;
        }
    }

    public static class Steps {
        public static final int HARD_MAX = 64;

        private int max = 20;

        public int getMax() {
            return max;
        }

        public void setMax(int max) {
            this.max = max;
        }

        public int effectiveMax() {
            return Math.min(Math.max(1, max), HARD_MAX);
        }
    }
}
