package com.gitpr.manager.behavior;

/**
 * An outbound provider call without a result.
 */
@FunctionalInterface
public interface ProviderCall {

    void call() throws Exception;
}
