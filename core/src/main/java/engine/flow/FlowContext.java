package engine.flow;

import engine.session.SessionManager;
import model.ScanContext;
import model.Target;

import java.util.*;

/**
 * Изменяемое состояние одного выполнения потоков шаблона против одной цели.
 * Не потокобезопасен: используется одним потоком выполнения шаблона.
 */
public final class FlowContext {
    private final Target target;
    private final SessionManager session;
    private final ScanContext scanContext;
    private final Map<String, String> variables = new LinkedHashMap<>();

    public FlowContext(Target target, SessionManager session, ScanContext scanContext) {
        this.target = Objects.requireNonNull(target, "target cannot be null");
        this.session = Objects.requireNonNull(session, "session cannot be null");
        this.scanContext = Objects.requireNonNull(scanContext, "scanContext cannot be null");
        this.variables.putAll(scanContext.getVariables());
    }

    public Target getTarget() {
        return target;
    }

    public SessionManager getSession() {
        return session;
    }

    public ScanContext getScanContext() {
        return scanContext;
    }

    public void setVariable(String name, String value) {
        variables.put(name, value);
    }

    public Optional<String> getVariable(String name) {
        return Optional.ofNullable(variables.get(name));
    }

    public Map<String, String> getVariables() {
        return Collections.unmodifiableMap(variables);
    }

    /**
     * Подставляет {@code {{name}}} для всех переменных, затем встроенные
     * {@code {{Hostname}}}, {@code {{Port}}} (только если у цели есть порт) и {@code {{BaseURL}}}.
     * Неизвестные плейсхолдеры остаются как есть.
     */
    public String replaceVariables(String input) {
        if (input == null) {
            return null;
        }
        String result = input;
        for (Map.Entry<String, String> entry : variables.entrySet()) {
            result = result.replace("{{" + entry.getKey() + "}}", entry.getValue());
        }

        result = result.replace("{{Hostname}}", target.getAddress());
        Optional<Integer> port = target.getPort();
        if (port.isPresent()) {
            result = result.replace("{{Port}}", String.valueOf(port.get()));
        }
        return result.replace("{{BaseURL}}", target.url());
    }
}
