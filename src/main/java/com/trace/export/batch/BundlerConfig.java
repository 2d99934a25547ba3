package com.trace.export.batch;

import java.time.Duration;

/**
 * Configuration for {@link Bundler}.
 */
public class BundlerConfig {

    public static final int DEFAULT_BUNDLE_COUNT_THRESHOLD = 10;
    public static final Duration DEFAULT_DELAY_THRESHOLD = Duration.ofSeconds(1);
    public static final long DEFAULT_BUFFERED_ITEM_LIMIT = 1_000_000L;

    private final int bundleCountThreshold;
    private final Duration delayThreshold;
    private final long bufferedItemLimit;

    private BundlerConfig(Builder builder) {
        this.bundleCountThreshold = builder.bundleCountThreshold;
        this.delayThreshold = builder.delayThreshold;
        this.bufferedItemLimit = builder.bufferedItemLimit;
    }

    /** Number of items at which a pending bundle is handed off. */
    public int getBundleCountThreshold() { return bundleCountThreshold; }
    /** Maximum age of a non-empty pending bundle before it is handed off. */
    public Duration getDelayThreshold() { return delayThreshold; }
    /** Maximum total weight buffered and not yet taken by the worker. */
    public long getBufferedItemLimit() { return bufferedItemLimit; }

    public static BundlerConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int bundleCountThreshold = DEFAULT_BUNDLE_COUNT_THRESHOLD;
        private Duration delayThreshold = DEFAULT_DELAY_THRESHOLD;
        private long bufferedItemLimit = DEFAULT_BUFFERED_ITEM_LIMIT;

        public Builder bundleCountThreshold(int bundleCountThreshold) {
            if (bundleCountThreshold <= 0) throw new IllegalArgumentException("bundleCountThreshold must be > 0");
            this.bundleCountThreshold = bundleCountThreshold;
            return this;
        }

        public Builder delayThreshold(Duration delayThreshold) {
            if (delayThreshold == null || delayThreshold.isNegative() || delayThreshold.isZero()) {
                throw new IllegalArgumentException("delayThreshold must be positive");
            }
            this.delayThreshold = delayThreshold;
            return this;
        }

        /**
         * Sets the buffered item limit; 0 selects {@link #DEFAULT_BUFFERED_ITEM_LIMIT}.
         */
        public Builder bufferedItemLimit(long bufferedItemLimit) {
            if (bufferedItemLimit < 0) throw new IllegalArgumentException("bufferedItemLimit must be >= 0");
            this.bufferedItemLimit = bufferedItemLimit == 0 ? DEFAULT_BUFFERED_ITEM_LIMIT : bufferedItemLimit;
            return this;
        }

        public BundlerConfig build() {
            return new BundlerConfig(this);
        }
    }

    @Override
    public String toString() {
        return "BundlerConfig{" +
                "bundleCountThreshold=" + bundleCountThreshold +
                ", delayThreshold=" + delayThreshold +
                ", bufferedItemLimit=" + bufferedItemLimit +
                '}';
    }
}
