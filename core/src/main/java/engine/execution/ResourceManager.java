package engine.execution;

import engine.ScanException;
import engine.config.EngineConfig;

/**
 * Учет памяти и числа одновременных выполнений в пределах лимитов песочницы.
 *
 * <p>Потокобезопасен.
 */
public final class ResourceManager {
    private static final long BYTES_PER_MB = 1024L * 1024L;

    private final long maxMemoryBytes;
    private final int maxCpuPercent;
    private final int maxConcurrent;

    private long currentMemoryBytes;
    private int currentConcurrent;

    public ResourceManager(int maxMemoryMb, int maxCpuPercent, int maxConcurrent) {
        this.maxMemoryBytes = maxMemoryMb * BYTES_PER_MB;
        this.maxCpuPercent = maxCpuPercent;
        this.maxConcurrent = maxConcurrent;
    }

    public static ResourceManager from(EngineConfig config) {
        return new ResourceManager(
            config.getSandbox().getMemoryLimitMb(),
            config.getSandbox().getCpuLimitPercent(),
            config.getExecution().getParallelTemplates());
    }

    public synchronized boolean canAllocate(long memoryBytes) {
        return currentMemoryBytes + memoryBytes <= maxMemoryBytes && currentConcurrent < maxConcurrent;
    }

    /**
     * Резервирует память и один слот выполнения.
     *
     * @throws ScanException типа RESOURCE_LIMIT, если лимит памяти или параллелизма исчерпан
     */
    public synchronized void allocate(long memoryBytes) throws ScanException {
        if (!canAllocate(memoryBytes)) {
            throw new ScanException(ScanException.ErrorType.RESOURCE_LIMIT, String.format(
                "memory or concurrency limit reached: limit %d MB, current %d MB, %d/%d slots in use",
                maxMemoryMb(), currentMemoryMb(), currentConcurrent, maxConcurrent));
        }
        currentMemoryBytes += memoryBytes;
        currentConcurrent++;
    }

    /**
     * Освобождает ресурсы. Счетчики не опускаются ниже нуля.
     */
    public synchronized void release(long memoryBytes) {
        currentMemoryBytes = Math.max(0, currentMemoryBytes - memoryBytes);
        currentConcurrent = Math.max(0, currentConcurrent - 1);
    }

    public synchronized long currentMemoryMb() {
        return currentMemoryBytes / BYTES_PER_MB;
    }

    public long maxMemoryMb() {
        return maxMemoryBytes / BYTES_PER_MB;
    }

    public synchronized int currentConcurrent() {
        return currentConcurrent;
    }

    public int maxConcurrent() {
        return maxConcurrent;
    }

    public int maxCpuPercent() {
        return maxCpuPercent;
    }
}
