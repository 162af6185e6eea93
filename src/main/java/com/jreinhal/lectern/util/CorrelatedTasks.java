package com.jreinhal.lectern.util;

import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.MDC;

/**
 * Carries the caller's MDC (correlation id) onto pool threads.
 */
public final class CorrelatedTasks {
    private CorrelatedTasks() {
    }

    public static <T> Supplier<T> wrap(Supplier<T> task) {
        Map<String, String> context = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            if (context != null) {
                MDC.setContextMap(context);
            } else {
                MDC.clear();
            }
            try {
                return task.get();
            }
            finally {
                if (previous != null) {
                    MDC.setContextMap(previous);
                } else {
                    MDC.clear();
                }
            }
        };
    }
}
