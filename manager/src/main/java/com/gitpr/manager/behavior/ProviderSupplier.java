package com.gitpr.manager.behavior;

/**
 * An outbound provider call producing a result.
 */
@FunctionalInterface
public interface ProviderSupplier<T> {

    T get() throws Exception;
}
