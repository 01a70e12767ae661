package engine;

import model.Finding;
import model.ScanResults;
import model.Target;

/**
 * Слушатель событий сканирования.
 * Вызывается из рабочих потоков, поэтому реализации должны быть потокобезопасны.
 */
public interface ScanListener {

    /**
     * Вызывается перед выполнением задания.
     *
     * @param job задание сканирования
     */
    void onScanStart(ScanJob job);

    /**
     * Вызывается для каждой находки сразу после ее получения.
     */
    void onFinding(Finding finding);

    /**
     * Вызывается после завершения задания с итоговыми результатами.
     */
    void onScanComplete(ScanResults results);

    /**
     * Вызывается при ошибке выполнения шаблона против цели.
     *
     * @param templateId идентификатор шаблона
     * @param target цель
     * @param error ошибка выполнения
     */
    void onError(String templateId, Target target, ScanException error);

    /**
     * Пустая реализация без операций.
     */
    static ScanListener noOp() {
        return new ScanListener() {
            @Override
            public void onScanStart(ScanJob job) {}

            @Override
            public void onFinding(Finding finding) {}

            @Override
            public void onScanComplete(ScanResults results) {}

            @Override
            public void onError(String templateId, Target target, ScanException error) {}
        };
    }
}
