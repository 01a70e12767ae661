package engine.template;

import engine.ScanException;
import model.Finding;
import model.Protocol;
import model.ScanContext;
import model.Target;
import model.TemplateMetadata;

import java.util.List;

/**
 * Загруженный шаблон проверки: метаданные и исполнимая логика.
 *
 * <p>Реализации должны быть потокобезопасны: один шаблон выполняется
 * параллельно против разных целей.
 */
public interface Template {

    TemplateMetadata getMetadata();

    default String getId() {
        return getMetadata().getId();
    }

    /**
     * Выполняет шаблон против цели.
     *
     * @return находки; пустой список, если совпадений нет
     * @throws ScanException при ошибке шаблона или сети, не позволяющей завершить проверку
     */
    List<Finding> execute(Target target, ScanContext context) throws ScanException;

    /**
     * Проверяет структуру шаблона до выполнения.
     *
     * @throws ScanException типа TEMPLATE_VALIDATION при некорректном шаблоне
     */
    void validate() throws ScanException;

    List<Protocol> getSupportedProtocols();
}
