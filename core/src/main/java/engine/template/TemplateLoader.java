package engine.template;

import engine.ScanException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Рекурсивно загружает шаблоны из каталогов через зарегистрированные движки.
 *
 * <p>Каталоги обходятся в переданном порядке, файлы внутри каталога - в лексикографическом.
 * Шаблон с уже встречавшимся идентификатором пропускается: побеждает первый загруженный.
 * Файл, который не удалось загрузить или проверить, пропускается с предупреждением.
 */
public final class TemplateLoader {
    private static final Logger logger = Logger.getLogger(TemplateLoader.class.getName());

    private final List<TemplateEngine> engines;

    public TemplateLoader(List<TemplateEngine> engines) {
        this.engines = List.copyOf(Objects.requireNonNull(engines, "engines cannot be null"));
    }

    public List<Template> loadFromDirectories(List<Path> directories) throws ScanException {
        Map<String, Template> byId = new LinkedHashMap<>();
        for (Path directory : directories) {
            for (Template template : loadFromDirectory(directory)) {
                Template existing = byId.putIfAbsent(template.getId(), template);
                if (existing != null) {
                    logger.warning("Duplicate template id " + template.getId() + " in "
                        + template.getMetadata().getFilePath().map(Path::toString).orElse("<unknown>")
                        + ", keeping the first one");
                }
            }
        }
        logger.info("Loaded " + byId.size() + " templates from " + directories.size() + " directories");
        return new ArrayList<>(byId.values());
    }

    /**
     * Загружает все поддерживаемые файлы каталога и его подкаталогов.
     *
     * @throws ScanException типа TEMPLATE_NOT_FOUND, если каталога нет, или IO при ошибке обхода
     */
    public List<Template> loadFromDirectory(Path directory) throws ScanException {
        if (!Files.isDirectory(directory)) {
            throw new ScanException(ScanException.ErrorType.TEMPLATE_NOT_FOUND,
                "Template directory not found: " + directory);
        }

        List<Path> files;
        try (Stream<Path> walk = Files.walk(directory)) {
            files = walk.filter(Files::isRegularFile)
                .filter(file -> findEngine(file).isPresent())
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new ScanException(ScanException.ErrorType.IO,
                "Failed to walk template directory " + directory + ": " + e.getMessage(), e);
        }

        List<Template> templates = new ArrayList<>();
        for (Path file : files) {
            try {
                templates.add(loadFile(file));
            } catch (ScanException e) {
                logger.log(Level.WARNING, "Skipping template " + file + ": " + e.getMessage(), e);
            }
        }
        return templates;
    }

    /**
     * Загружает и проверяет один файл шаблона.
     */
    public Template loadFile(Path file) throws ScanException {
        TemplateEngine engine = findEngine(file)
            .orElseThrow(() -> new ScanException(ScanException.ErrorType.TEMPLATE,
                "No template engine supports " + file));
        Template template = engine.loadTemplate(file);
        template.validate();
        return template;
    }

    private Optional<TemplateEngine> findEngine(Path file) {
        return engines.stream().filter(engine -> engine.supportsFile(file)).findFirst();
    }
}
