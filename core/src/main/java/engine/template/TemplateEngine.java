package engine.template;

import engine.ScanException;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Движок, загружающий шаблоны одного формата.
 */
public interface TemplateEngine {

    String getName();

    /**
     * @return расширения файлов без точки, в нижнем регистре
     */
    List<String> getSupportedExtensions();

    Template loadTemplate(Path path) throws ScanException;

    default boolean supportsFile(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        return dot >= 0 && getSupportedExtensions().contains(name.substring(dot + 1));
    }
}
