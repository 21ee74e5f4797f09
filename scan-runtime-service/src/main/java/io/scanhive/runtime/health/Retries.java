package io.scanhive.runtime.health;

import java.util.Objects;
import java.util.function.Predicate;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generic retry loop. It never raises once the budget is spent: the last observed value is the
 * verdict. Exceptions thrown by the operation itself are not caught here.
 */
public final class Retries {

    private static final Logger log = LoggerFactory.getLogger(Retries.class);

    private Retries() {
    }

    public static <T> T retryWithBackoff(Supplier<T> operation,
                                         RetryPolicy policy,
                                         Predicate<? super T> accept,
                                         Sleeper sleeper) {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(accept, "accept");
        Objects.requireNonNull(sleeper, "sleeper");
        T last = null;
        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            last = operation.get();
            if (accept.test(last)) {
                return last;
            }
            if (attempt == policy.maxAttempts()) {
                break;
            }
            try {
                sleeper.sleep(policy.backoffAfter(attempt));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("retry interrupted after {} attempt(s)", attempt);
                return last;
            }
        }
        log.debug("retry budget of {} attempt(s) exhausted", policy.maxAttempts());
        return last;
    }

    public static boolean retryUntilTrue(Supplier<Boolean> check, RetryPolicy policy, Sleeper sleeper) {
        Boolean verdict = retryWithBackoff(check, policy, Boolean.TRUE::equals, sleeper);
        return Boolean.TRUE.equals(verdict);
    }
}
