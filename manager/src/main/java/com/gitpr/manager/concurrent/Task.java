package com.gitpr.manager.concurrent;

/**
 * A unit of work for {@link BoundedExecutor}. Tasks report their outcome through
 * their own result slot; a thrown exception is logged and does not affect sibling
 * tasks.
 */
@FunctionalInterface
public interface Task {

    void run() throws Exception;
}
