package engine.http;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Token bucket: не более {@code permitsPerSecond} запросов в секунду,
 * с запасом не более одной секунды накопленных разрешений.
 *
 * <p>Один экземпляр разделяется всеми потоками одного {@link NetworkClient}.
 */
public final class RateLimiter {
    private final double permitsPerSecond;
    private final double maxPermits;
    private final Sleeper sleeper;
    private final LongSupplier nanoClock;

    private double storedPermits;
    private long lastRefillNanos;

    public RateLimiter(int permitsPerSecond) {
        this(permitsPerSecond, Sleeper.system(), System::nanoTime);
    }

    RateLimiter(int permitsPerSecond, Sleeper sleeper, LongSupplier nanoClock) {
        if (permitsPerSecond <= 0) {
            throw new IllegalArgumentException("permitsPerSecond must be positive: " + permitsPerSecond);
        }
        this.permitsPerSecond = permitsPerSecond;
        this.maxPermits = permitsPerSecond;
        this.sleeper = sleeper;
        this.nanoClock = nanoClock;
        this.storedPermits = permitsPerSecond;
        this.lastRefillNanos = nanoClock.getAsLong();
    }

    /**
     * Блокирует вызывающий поток до получения разрешения.
     */
    public void acquire() throws InterruptedException {
        Duration wait = reserve();
        if (!wait.isZero()) {
            sleeper.sleep(wait);
        }
    }

    public double getPermitsPerSecond() {
        return permitsPerSecond;
    }

    /**
     * Резервирует разрешение и возвращает время ожидания до его наступления.
     * Долг по разрешениям учитывается, поэтому конкурентные вызовы выстраиваются в очередь.
     */
    synchronized Duration reserve() {
        long now = nanoClock.getAsLong();
        double elapsedSeconds = (now - lastRefillNanos) / 1_000_000_000.0;
        storedPermits = Math.min(maxPermits, storedPermits + elapsedSeconds * permitsPerSecond);
        lastRefillNanos = now;

        storedPermits -= 1.0;
        if (storedPermits >= 0) {
            return Duration.ZERO;
        }
        long waitNanos = (long) Math.ceil(-storedPermits / permitsPerSecond * 1_000_000_000.0);
        return Duration.ofNanos(waitNanos);
    }
}
