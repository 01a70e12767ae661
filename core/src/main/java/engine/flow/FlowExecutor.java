package engine.flow;

import engine.ScanException;
import engine.http.NetworkClient;
import engine.http.Sleeper;
import engine.model.ProbeRequest;
import engine.model.ProbeResponse;
import model.Finding;
import util.StringUtils;

import java.time.Duration;
import java.util.*;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Выполняет потоки шаблона: шаги строго по порядку, с общим {@link FlowContext}.
 *
 * <p>Ошибка шага прерывает обязательный поток и передается вызывающему. Для необязательного
 * потока ошибка записывается в лог, а оставшиеся шаги пропускаются.
 */
public final class FlowExecutor {
    private static final Logger logger = Logger.getLogger(FlowExecutor.class.getName());

    private final NetworkClient networkClient;
    private final Sleeper sleeper;

    public FlowExecutor(NetworkClient networkClient) {
        this(networkClient, Sleeper.system());
    }

    public FlowExecutor(NetworkClient networkClient, Sleeper sleeper) {
        this.networkClient = Objects.requireNonNull(networkClient, "networkClient cannot be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper cannot be null");
    }

    /**
     * Выполняет потоки в порядке объявления.
     *
     * <p>Зависимости {@code depends_on} не переупорядочивают выполнение: для невыполненной
     * зависимости пишется предупреждение, и поток выполняется.
     *
     * @return находки потоков (сами потоки находок не создают, список пуст)
     * @throws ScanException при ошибке обязательного потока
     */
    public List<Finding> executeFlows(List<Flow> flows, FlowContext context) throws ScanException {
        List<Finding> findings = new ArrayList<>();
        Set<String> executed = new HashSet<>();

        for (Flow flow : flows) {
            if (executed.contains(flow.getName())) {
                continue;
            }

            for (String dependency : flow.getDependsOn()) {
                if (!executed.contains(dependency)) {
                    logger.warning("Flow " + flow.getName() + " depends on " + dependency
                        + ", which hasn't executed");
                }
            }

            findings.addAll(executeFlow(flow, context));
            executed.add(flow.getName());
        }
        return findings;
    }

    /**
     * Выполняет один поток. Поток с ложным условием пропускается.
     */
    public List<Finding> executeFlow(Flow flow, FlowContext context) throws ScanException {
        logger.fine("Executing flow: " + flow.getName());

        Optional<String> condition = flow.getCondition();
        if (condition.isPresent() && !evaluateCondition(condition.get(), context)) {
            logger.fine("Flow " + flow.getName() + " skipped due to condition");
            return Collections.emptyList();
        }

        List<FlowStep> steps = flow.getSteps();
        for (int i = 0; i < steps.size(); i++) {
            FlowStep step = steps.get(i);
            logger.fine("Executing step " + (i + 1) + " (" + step + ") in flow " + flow.getName());
            try {
                executeStep(step, context);
            } catch (ScanException e) {
                if (!flow.isOptional()) {
                    throw e;
                }
                logger.warning("Optional flow " + flow.getName() + " step " + (i + 1)
                    + " failed, skipping rest of flow: " + e.getMessage());
                return Collections.emptyList();
            }
        }
        return Collections.emptyList();
    }

    void executeStep(FlowStep step, FlowContext context) throws ScanException {
        switch (step.getKind()) {
            case HTTP_REQUEST -> executeHttpRequest((FlowStep.HttpRequest) step, context);
            case SET_VARIABLE -> {
                FlowStep.SetVariable set = (FlowStep.SetVariable) step;
                context.setVariable(set.getName(), context.replaceVariables(set.getValue()));
            }
            case EXTRACT -> executeExtract((FlowStep.Extract) step, context);
            case CHECK -> {
                FlowStep.Check check = (FlowStep.Check) step;
                if (evaluateCondition(check.getCondition(), context)) {
                    logger.info("Check passed: " + check.getMessage().orElse("condition met"));
                }
            }
            case WAIT -> executeWait((FlowStep.Wait) step);
        }
    }

    private void executeHttpRequest(FlowStep.HttpRequest step, FlowContext context) throws ScanException {
        String url = context.getTarget().url() + context.replaceVariables(step.getPath());
        String method = context.replaceVariables(step.getMethod());
        logger.fine("HTTP " + method + " " + url);

        ProbeRequest.Builder request = ProbeRequest.builder()
            .url(url)
            .method(method);
        step.getHeaders().forEach((name, value) -> request.addHeader(name, context.replaceVariables(value)));
        step.getBody().ifPresent(body -> request.body(context.replaceVariables(body)));

        // Cookies, the default JWT and Set-Cookie ingestion are handled by NetworkClient
        ProbeResponse response = networkClient.execute(request.build());

        step.getStore().ifPresent(name -> context.setVariable(name, response.getBodyAsString()));
    }

    private static void executeExtract(FlowStep.Extract step, FlowContext context) throws ScanException {
        Pattern pattern;
        try {
            pattern = Pattern.compile(step.getPattern());
        } catch (PatternSyntaxException e) {
            throw new ScanException(ScanException.ErrorType.PARSE, "Invalid regex: " + e.getMessage(), e);
        }

        Optional<String> source = context.getVariable(step.getFrom());
        if (source.isEmpty()) {
            return;
        }

        Matcher matcher = pattern.matcher(source.get());
        if (matcher.find() && matcher.groupCount() >= 1 && matcher.group(1) != null) {
            context.setVariable(step.getStore(), matcher.group(1));
            logger.fine("Extracted " + step.getStore() + " = " + StringUtils.maskSensitive(matcher.group(1)));
        }
    }

    private void executeWait(FlowStep.Wait step) throws ScanException {
        try {
            sleeper.sleep(Duration.ofMillis(step.getDurationMs()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ScanException(ScanException.ErrorType.EXECUTION, "Interrupted during wait step", e);
        }
    }

    /**
     * Вычисляет условие после подстановки переменных.
     *
     * <p>Формы {@code var != "literal"} и {@code var == "literal"} сравнивают переменную
     * с литералом (ложь, если переменной нет). Иначе условие истинно, если переменная
     * с таким именем существует и не пуста.
     */
    public boolean evaluateCondition(String condition, FlowContext context) {
        String resolved = context.replaceVariables(condition);

        if (resolved.contains("!=")) {
            String[] parts = resolved.split("!=", -1);
            if (parts.length == 2) {
                Optional<String> value = context.getVariable(parts[0].trim());
                if (value.isPresent()) {
                    return !value.get().equals(trimLiteral(parts[1]));
                }
            }
        } else if (resolved.contains("==")) {
            String[] parts = resolved.split("==", -1);
            if (parts.length == 2) {
                Optional<String> value = context.getVariable(parts[0].trim());
                if (value.isPresent()) {
                    return value.get().equals(trimLiteral(parts[1]));
                }
            }
        }

        return context.getVariable(resolved).map(value -> !value.isEmpty()).orElse(false);
    }

    private static String trimLiteral(String literal) {
        String trimmed = literal.trim();
        int start = 0;
        int end = trimmed.length();
        while (start < end && trimmed.charAt(start) == '"') {
            start++;
        }
        while (end > start && trimmed.charAt(end - 1) == '"') {
            end--;
        }
        return trimmed.substring(start, end);
    }
}
