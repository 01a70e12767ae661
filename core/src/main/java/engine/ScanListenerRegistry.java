package engine;

import model.Finding;
import model.ScanResults;
import model.Target;

import java.util.Iterator;
import java.util.List;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Реестр слушателей сканирования, рассылающий события всем зарегистрированным слушателям.
 *
 * <p>Слушатели регистрируются явно через {@link #register(ScanListener)} или находятся через
 * {@link ServiceLoader}: имена классов перечисляются в
 * {@code META-INF/services/engine.ScanListener}. Исключение одного слушателя записывается
 * в лог и не мешает остальным. Пустой реестр ничего не делает.
 */
public final class ScanListenerRegistry implements ScanListener {
    private static final Logger logger = Logger.getLogger(ScanListenerRegistry.class.getName());

    private final List<ScanListener> listeners = new CopyOnWriteArrayList<>();

    public void register(ScanListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("Listener cannot be null");
        }
        listeners.add(listener);
        logger.fine("Registered scan listener: " + listener.getClass().getName());
    }

    public void unregister(ScanListener listener) {
        listeners.remove(listener);
    }

    public List<ScanListener> getListeners() {
        return List.copyOf(listeners);
    }

    /**
     * Регистрирует слушателей, найденных в classpath.
     *
     * @return число зарегистрированных слушателей
     */
    public int discover() {
        return discover(Thread.currentThread().getContextClassLoader());
    }

    public int discover(ClassLoader classLoader) {
        int count = 0;
        ServiceLoader<ScanListener> serviceLoader = ServiceLoader.load(ScanListener.class, classLoader);
        Iterator<ScanListener> iterator = serviceLoader.iterator();
        while (true) {
            try {
                if (!iterator.hasNext()) {
                    break;
                }
                ScanListener listener = iterator.next();
                register(listener);
                count++;
                logger.info("Discovered scan listener: " + listener.getClass().getName());
            } catch (ServiceConfigurationError e) {
                logger.log(Level.WARNING, "Failed to load scan listener: " + e.getMessage(), e);
            }
        }
        return count;
    }

    @Override
    public void onScanStart(ScanJob job) {
        dispatch("onScanStart", listener -> listener.onScanStart(job));
    }

    @Override
    public void onFinding(Finding finding) {
        dispatch("onFinding", listener -> listener.onFinding(finding));
    }

    @Override
    public void onScanComplete(ScanResults results) {
        dispatch("onScanComplete", listener -> listener.onScanComplete(results));
    }

    @Override
    public void onError(String templateId, Target target, ScanException error) {
        dispatch("onError", listener -> listener.onError(templateId, target, error));
    }

    private void dispatch(String event, Consumer<ScanListener> call) {
        for (ScanListener listener : listeners) {
            try {
                call.accept(listener);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Scan listener " + listener.getClass().getName()
                    + " failed on " + event, e);
            }
        }
    }
}
