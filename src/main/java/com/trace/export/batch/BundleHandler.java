package com.trace.export.batch;

import java.util.List;

/**
 * Receives completed bundles from a {@link Bundler}. Invoked on the bundler's worker thread,
 * one bundle at a time.
 */
@FunctionalInterface
public interface BundleHandler<T> {

    void handle(List<T> bundle);
}
