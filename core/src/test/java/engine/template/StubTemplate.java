package engine.template;

import engine.ScanException;
import model.Evidence;
import model.Finding;
import model.Protocol;
import model.ScanContext;
import model.Severity;
import model.Target;
import model.TemplateMetadata;

import java.util.Collections;
import java.util.List;

/**
 * Шаблон для тестов с подменяемым поведением выполнения.
 */
public final class StubTemplate implements Template {

    @FunctionalInterface
    public interface Body {
        List<Finding> run(Target target) throws Exception;
    }

    private final TemplateMetadata metadata;
    private final Body body;

    public StubTemplate(TemplateMetadata metadata, Body body) {
        this.metadata = metadata;
        this.body = body;
    }

    public static StubTemplate of(String id, Severity severity, Body body) {
        return new StubTemplate(TemplateMetadata.builder().id(id).severity(severity).build(), body);
    }

    public static StubTemplate silent(String id, Severity severity) {
        return of(id, severity, target -> Collections.emptyList());
    }

    /**
     * Шаблон, возвращающий одну находку для каждой цели.
     */
    public static StubTemplate finding(String id, Severity severity) {
        return of(id, severity, target -> List.of(Finding.builder()
            .target(target.url())
            .templateId(id)
            .severity(severity)
            .evidence(Evidence.builder().addMatch("stub").build())
            .build()));
    }

    @Override
    public TemplateMetadata getMetadata() {
        return metadata;
    }

    @Override
    public List<Finding> execute(Target target, ScanContext context) throws ScanException {
        try {
            return body.run(target);
        } catch (ScanException | RuntimeException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ScanException(ScanException.ErrorType.EXECUTION, "interrupted", e);
        } catch (Exception e) {
            throw new ScanException(ScanException.ErrorType.TEMPLATE_EXECUTION, e.getMessage(), e);
        }
    }

    @Override
    public void validate() {
    }

    @Override
    public List<Protocol> getSupportedProtocols() {
        return List.of(Protocol.HTTP, Protocol.HTTPS);
    }
}
