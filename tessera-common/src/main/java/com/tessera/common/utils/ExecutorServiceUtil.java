/*
 * Copyright (c) 2024-2025 Tessera
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.tessera.common.utils;

import com.tessera.common.TesseraException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Utility class for shutting down the {@link ExecutorService} instances a client owns.
 */
public class ExecutorServiceUtil {
    private static final Logger LOGGER = LoggerFactory.getLogger(ExecutorServiceUtil.class);

    /**
     * Default time granted to running tasks to observe their interruption.
     */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    /**
     * Shuts the executor down, waiting at most {@link #DEFAULT_TIMEOUT}.
     *
     * @see #shutdownNowThenAwaitTermination(String, ExecutorService, Duration)
     */
    public static boolean shutdownNowThenAwaitTermination(String name, ExecutorService executor) {
        return shutdownNowThenAwaitTermination(name, executor, DEFAULT_TIMEOUT);
    }

    /**
     * Immediately initiates shutdown and waits for termination.
     *
     * <p>Calls {@link ExecutorService#shutdownNow()} to interrupt running tasks and
     * drop the queued ones, then blocks until the worker threads exit or the timeout
     * expires. Dropped tasks are logged at DEBUG level, an executor outliving the
     * timeout at WARN level.
     *
     * @param name     a label for the executor in log messages, e.g. {@code "HTTP"}
     * @param executor the executor service to shut down; if null or already terminated, returns true immediately
     * @param timeout  how long to wait for termination
     * @return true if the executor terminated within the timeout, false otherwise
     * @throws TesseraException if the waiting thread is interrupted
     */
    public static boolean shutdownNowThenAwaitTermination(String name, ExecutorService executor, Duration timeout) {
        if (executor == null || executor.isTerminated()) {
            return true;
        }

        List<Runnable> dropped = executor.shutdownNow();
        if (!dropped.isEmpty()) {
            LOGGER.debug("{} executor dropped {} queued task(s)", name, dropped.size());
        }
        try {
            if (executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                return true;
            }
            LOGGER.warn("{} executor did not terminate within {}", name, timeout);
            return false;
        } catch (InterruptedException exp) {
            Thread.currentThread().interrupt();
            throw new TesseraException(exp);
        }
    }
}
