package com.shortphrase.infrastructure.ai;

/**
 * Waits between retry attempts.
 */
@FunctionalInterface
public interface BackoffSleeper {

    /**
     * @return false if the wait was interrupted; the interrupt flag is then set again
     */
    boolean sleep(long millis);

    BackoffSleeper THREAD_SLEEP = millis -> {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    };

    BackoffSleeper NO_WAIT = millis -> true;
}
