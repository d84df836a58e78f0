package com.deviceagents.screen;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Suspends the caller until a dispatched gesture completes or is cancelled.
 */
public final class Gestures {
    private static final Logger logger = LogManager.getLogger(Gestures.class);

    private Gestures() {
    }

    /**
     * @return true only when the gesture completed within {@code timeoutMs}
     */
    public static boolean await(CompletableFuture<Boolean> gesture, long timeoutMs) {
        if (gesture == null) {
            return false;
        }
        try {
            return Boolean.TRUE.equals(gesture.get(Math.max(1L, timeoutMs), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            gesture.cancel(true);
            logger.warn("Gesture did not complete within {} ms", timeoutMs);
            return false;
        } catch (CancellationException e) {
            return false;
        } catch (ExecutionException e) {
            logger.warn("Gesture dispatch failed: {}", e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
