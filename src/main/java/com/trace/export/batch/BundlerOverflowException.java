package com.trace.export.batch;

/**
 * Runtime exception thrown by {@link Bundler#add} when accepting an item would exceed the
 * buffered item limit. The item is not buffered.
 */
public class BundlerOverflowException extends RuntimeException {

    private final long bufferedWeight;
    private final long limit;

    public BundlerOverflowException(long bufferedWeight, long limit) {
        super("Bundler buffer full (buffered=" + bufferedWeight + ", limit=" + limit + ")");
        this.bufferedWeight = bufferedWeight;
        this.limit = limit;
    }

    public long getBufferedWeight() {
        return bufferedWeight;
    }

    public long getLimit() {
        return limit;
    }
}
