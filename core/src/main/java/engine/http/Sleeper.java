package engine.http;

import java.time.Duration;

/**
 * Точка приостановки потока для задержек между запросами.
 * Тесты подменяют ее, чтобы проверять задержки без реального ожидания.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper system() {
        return duration -> {
            if (!duration.isZero() && !duration.isNegative()) {
                Thread.sleep(duration.toMillis());
            }
        };
    }
}
