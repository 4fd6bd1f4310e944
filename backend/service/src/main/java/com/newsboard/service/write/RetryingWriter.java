package com.newsboard.service.write;

import java.time.Duration;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.function.DoubleSupplier;
import java.util.logging.Logger;

public class RetryingWriter {
    private static final Logger LOGGER = Logger.getLogger(RetryingWriter.class.getName());

    private final WritePolicy policy;
    private final Sleeper sleeper;
    private final DoubleSupplier jitter;

    public RetryingWriter(WritePolicy policy) {
        this(policy, Sleeper.SYSTEM, new Random()::nextDouble);
    }

    /**
     * @param jitter source of uniform values in {@code [0, 1)}, scaled by the policy's maximum jitter
     */
    public RetryingWriter(WritePolicy policy, Sleeper sleeper, DoubleSupplier jitter) {
        this.policy = policy;
        this.sleeper = sleeper;
        this.jitter = jitter;
    }

    public WritePolicy policy() {
        return policy;
    }

    public <T> T execute(String label, Callable<T> call) {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return call.call();
            } catch (Exception e) {
                boolean transientFailure = ErrorClassifier.isTransient(e);
                if (!transientFailure || attempt >= policy.maxAttempts()) {
                    throw new WriteFailedException(
                            label,
                            attempt,
                            transientFailure,
                            ErrorClassifier.isOutageLike(e),
                            FailureDiagnostics.compact(e, policy.diagnosticLimit()),
                            e
                    );
                }
                Duration delay = delayFor(attempt);
                LOGGER.warning("Write " + label + " failed on attempt " + attempt + "/" + policy.maxAttempts()
                        + ", retrying in " + delay.toMillis() + "ms: " + FailureDiagnostics.compact(e, policy.diagnosticLimit()));
                pause(label, attempt, delay, e);
            }
        }
    }

    public void run(String label, Runnable call) {
        execute(label, () -> {
            call.run();
            return null;
        });
    }

    Duration delayFor(int attempt) {
        long jitterMillis = Math.round(jitter.getAsDouble() * policy.maxJitter().toMillis());
        return policy.backoff(attempt).plusMillis(jitterMillis);
    }

    private void pause(String label, int attempt, Duration delay, Exception cause) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw new WriteFailedException(label, attempt, true, false, "interrupted while backing off", cause);
        }
    }
}
