package engine.template;

import engine.ScanException;
import engine.config.EngineConfig;
import engine.http.HttpClientFactory;
import engine.http.NetworkClient;
import engine.session.SessionManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class TemplateLoaderTest {

    @TempDir
    Path root;

    private NetworkClient networkClient;
    private TemplateLoader loader;

    @BeforeEach
    void setUp() {
        EngineConfig config = EngineConfig.defaults();
        networkClient = new NetworkClient(HttpClientFactory.createClient(config.getNetwork()), config,
            new SessionManager());
        loader = new TemplateLoader(List.of(new YamlTemplateEngine(networkClient)));
    }

    @AfterEach
    void tearDown() {
        networkClient.close();
    }

    private static void write(Path file, String content) throws Exception {
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    private static String template(String id, String name) {
        return "id: " + id + "\nname: " + name + "\nhttp:\n  - path: /\n";
    }

    private static List<String> ids(List<Template> templates) {
        return templates.stream().map(Template::getId).collect(Collectors.toList());
    }

    @Test
    void testRecursiveLoadInPathOrder() throws Exception {
        Path dir = root.resolve("local");
        write(dir.resolve("b.yaml"), template("b", "B"));
        write(dir.resolve("a/nested.yml"), template("nested", "Nested"));
        write(dir.resolve("README.md"), "# not a template");
        write(dir.resolve("script.py"), "print('x')");

        assertEquals(List.of("nested", "b"), ids(loader.loadFromDirectory(dir)));
    }

    @Test
    void testBrokenFilesAreSkipped() throws Exception {
        Path dir = root.resolve("mixed");
        write(dir.resolve("good.yaml"), template("good", "Good"));
        write(dir.resolve("no-id.yaml"), "name: missing id\nhttp:\n  - path: /\n");
        write(dir.resolve("empty-checks.yaml"), "id: empty\n");
        write(dir.resolve("syntax.yaml"), "id: [unclosed\n");

        assertEquals(List.of("good"), ids(loader.loadFromDirectory(dir)));
    }

    @Test
    void testDuplicateIdsKeepFirstDirectory() throws Exception {
        Path local = root.resolve("local");
        Path system = root.resolve("system");
        write(local.resolve("shared.yaml"), template("shared", "Local version"));
        write(system.resolve("shared.yaml"), template("shared", "System version"));
        write(system.resolve("extra.yaml"), template("extra", "Extra"));

        List<Template> templates = loader.loadFromDirectories(List.of(local, system));

        assertEquals(List.of("shared", "extra"), ids(templates));
        assertEquals("Local version", templates.get(0).getMetadata().getName());
    }

    @Test
    void testMissingDirectory() {
        ScanException error = assertThrows(ScanException.class,
            () -> loader.loadFromDirectory(root.resolve("absent")));

        assertEquals(ScanException.ErrorType.TEMPLATE_NOT_FOUND, error.getErrorType());
    }

    @Test
    void testLoadFileValidates() throws Exception {
        Path file = root.resolve("empty.yaml");
        write(file, "id: empty\n");

        ScanException invalid = assertThrows(ScanException.class, () -> loader.loadFile(file));
        assertEquals(ScanException.ErrorType.TEMPLATE_VALIDATION, invalid.getErrorType());

        ScanException unsupported = assertThrows(ScanException.class, () -> loader.loadFile(root.resolve("x.txt")));
        assertEquals(ScanException.ErrorType.TEMPLATE, unsupported.getErrorType());
    }
}
