package engine.template;

import engine.ScanException;
import engine.flow.Flow;
import engine.flow.FlowContext;
import engine.flow.FlowExecutor;
import engine.flow.FlowStep;
import engine.http.ConnectionErrors;
import engine.http.NetworkClient;
import engine.http.RawSocketClient;
import engine.matcher.MatcherEngine;
import engine.matcher.MatcherException;
import engine.matcher.MatcherType;
import engine.model.ProbeResponse;
import model.*;

import java.util.*;
import java.util.logging.Logger;

/**
 * Шаблон, загруженный из YAML.
 *
 * <p>Выполнение идет в порядке: потоки, сетевые запросы, HTTP запросы. Для HTTP запросов
 * сначала пробуется схема, выведенная из порта цели; вторая схема пробуется только после
 * ошибки уровня соединения. Неизменяем и потокобезопасен.
 */
final class YamlTemplate implements Template {
    private static final Logger logger = Logger.getLogger(YamlTemplate.class.getName());

    private final TemplateMetadata metadata;
    private final List<HttpRequestSpec> http;
    private final List<NetworkRequestSpec> network;
    private final List<MatcherType> matchers;
    private final MatcherType.MatchCondition matchersCondition;
    private final List<Flow> flows;
    private final NetworkClient networkClient;
    private final RawSocketClient rawSocketClient;
    private final FlowExecutor flowExecutor;

    YamlTemplate(TemplateMetadata metadata,
                 List<HttpRequestSpec> http,
                 List<NetworkRequestSpec> network,
                 List<MatcherType> matchers,
                 MatcherType.MatchCondition matchersCondition,
                 List<Flow> flows,
                 NetworkClient networkClient,
                 RawSocketClient rawSocketClient,
                 FlowExecutor flowExecutor) {
        this.metadata = Objects.requireNonNull(metadata, "metadata cannot be null");
        this.http = http != null ? List.copyOf(http) : null;
        this.network = network != null ? List.copyOf(network) : null;
        this.matchers = matchers != null ? List.copyOf(matchers) : null;
        this.matchersCondition = matchersCondition;
        this.flows = flows != null ? List.copyOf(flows) : null;
        this.networkClient = networkClient;
        this.rawSocketClient = rawSocketClient;
        this.flowExecutor = flowExecutor;
    }

    @Override
    public TemplateMetadata getMetadata() {
        return metadata;
    }

    @Override
    public List<Finding> execute(Target target, ScanContext context) throws ScanException {
        logger.fine("Executing YAML template " + getId() + " against " + target.getAddress());

        List<Finding> findings = new ArrayList<>();

        if (flows != null) {
            FlowContext flowContext = new FlowContext(target, networkClient.getSessionManager(), context);
            findings.addAll(flowExecutor.executeFlows(flows, flowContext));
        }

        if (network != null) {
            for (NetworkRequestSpec spec : network) {
                findings.addAll(executeNetworkRequest(spec, target));
            }
        }

        if (http != null) {
            for (HttpRequestSpec spec : http) {
                findings.addAll(executeHttpRequest(spec, target));
            }
        }

        return findings;
    }

    @Override
    public void validate() throws ScanException {
        if (http == null && network == null && flows == null) {
            throw new ScanException(ScanException.ErrorType.TEMPLATE_VALIDATION,
                "Template " + getId() + " must have either 'http', 'network', or 'flows' defined");
        }
    }

    /**
     * Протоколы, выведенные из содержимого шаблона. Шаблон без признаков протокола
     * считается HTTP(S).
     */
    @Override
    public List<Protocol> getSupportedProtocols() {
        Set<Protocol> protocols = new LinkedHashSet<>();

        if (http != null) {
            protocols.add(Protocol.HTTP);
            protocols.add(Protocol.HTTPS);
        }
        if (network != null) {
            for (NetworkRequestSpec spec : network) {
                protocols.add(Protocol.fromName(spec.protocol()));
            }
        }
        if (flows != null) {
            boolean sendsHttp = flows.stream()
                .flatMap(flow -> flow.getSteps().stream())
                .anyMatch(step -> step.getKind() == FlowStep.Kind.HTTP_REQUEST);
            if (sendsHttp) {
                protocols.add(Protocol.HTTP);
                protocols.add(Protocol.HTTPS);
            }
        }

        if (protocols.isEmpty()) {
            logger.warning("Template " + getId() + " has no protocol indicators, defaulting to HTTP/HTTPS");
            protocols.add(Protocol.HTTP);
            protocols.add(Protocol.HTTPS);
        }
        return new ArrayList<>(protocols);
    }

    private List<Finding> executeHttpRequest(HttpRequestSpec spec, Target target) throws ScanException {
        List<Target> variants;
        if (target.getProtocol().isHttpFamily()) {
            Protocol first = target.inferScheme().equals(Protocol.HTTPS) ? Protocol.HTTPS : Protocol.HTTP;
            Protocol second = first.equals(Protocol.HTTPS) ? Protocol.HTTP : Protocol.HTTPS;
            variants = List.of(target.withProtocol(first), target.withProtocol(second));
        } else {
            variants = List.of(target);
        }

        ScanException lastConnectionError = null;
        for (Target variant : variants) {
            try {
                List<Finding> findings = executeHttpRequestOn(variant, spec);
                logger.fine(variant.getProtocol() + " scheme connected for " + variant.getAddress()
                    + " with " + findings.size() + " findings, skipping fallback");
                return findings;
            } catch (ScanException e) {
                if (!ConnectionErrors.isConnectionLevel(e)) {
                    throw e;
                }
                logger.fine(variant.getProtocol() + " scheme failed for " + variant.url() + " ("
                    + e.getMessage() + "), trying fallback scheme");
                lastConnectionError = e;
            }
        }
        throw lastConnectionError;
    }

    private List<Finding> executeHttpRequestOn(Target target, HttpRequestSpec spec) throws ScanException {
        List<Finding> findings = new ArrayList<>();
        String method = spec.method().toUpperCase(Locale.ROOT);

        for (String path : spec.paths()) {
            String url = target.url() + path;
            logger.fine(method + " " + url);

            ProbeResponse response;
            switch (method) {
                case "GET":
                    response = networkClient.get(url, spec.headers());
                    break;
                case "POST":
                    response = networkClient.post(url, spec.body() != null ? spec.body() : "", spec.headers());
                    break;
                default:
                    logger.warning("Unsupported HTTP method in template " + getId() + ": " + spec.method());
                    continue;
            }

            List<MatcherType> effective = spec.matchers() != null ? spec.matchers() : matchers;
            MatcherType.MatchCondition condition = effectiveCondition(spec.matchersCondition());
            if (effective == null || !matches(effective, response, condition)) {
                continue;
            }

            Evidence.Builder evidence = Evidence.builder()
                .request(method + " " + url + "\n" + (spec.body() != null ? spec.body() : ""))
                .response(response.getBodyAsString());
            collectMatchedPatterns(effective, response, evidence, "status:" + response.getStatusCode());
            evidence.addData("status_code", response.getStatusCode())
                .addData("response_time_ms", response.getResponseTime().toMillis())
                .addData("method", method)
                .addData("url", url);

            findings.add(finding(target.url(), evidence.build()));
            logger.info("Template " + getId() + " matched for target " + target.getAddress());
        }
        return findings;
    }

    private List<Finding> executeNetworkRequest(NetworkRequestSpec spec, Target target) throws ScanException {
        int port = target.getPort().orElse(spec.port());
        String address = target.getAddress() + ":" + port;
        logger.fine(spec.protocol().toUpperCase(Locale.ROOT) + " " + address);

        Optional<ProbeResponse> exchanged = rawSocketClient.exchange(target.getAddress(), port, spec.payloads());
        if (exchanged.isEmpty()) {
            return Collections.emptyList();
        }
        ProbeResponse response = exchanged.get();
        networkClient.recordRawExchange(response.getBodyLength());

        List<MatcherType> effective = spec.matchers() != null ? spec.matchers() : matchers;
        MatcherType.MatchCondition condition = effectiveCondition(spec.matchersCondition());
        logger.fine("Evaluating " + (effective != null ? effective.size() : 0)
            + " matchers with condition " + condition);
        if (effective == null || !matches(effective, response, condition)) {
            return Collections.emptyList();
        }

        Evidence.Builder evidence = Evidence.builder()
            .request(String.join("\n", spec.payloads()))
            .response(response.getBodyAsString());
        collectMatchedPatterns(effective, response, evidence, "status_match");
        evidence.addData("protocol", spec.protocol())
            .addData("port", port)
            .addData("response_length", response.getBodyLength());

        logger.info("Template " + getId() + " matched for target " + address);
        return List.of(finding(address, evidence.build()));
    }

    private MatcherType.MatchCondition effectiveCondition(MatcherType.MatchCondition requestCondition) {
        if (requestCondition != null) {
            return requestCondition;
        }
        return matchersCondition != null ? matchersCondition : MatcherType.MatchCondition.OR;
    }

    private boolean matches(List<MatcherType> effective, ProbeResponse response,
                            MatcherType.MatchCondition condition) throws ScanException {
        try {
            return MatcherEngine.matchAll(effective, response, condition);
        } catch (MatcherException e) {
            throw new ScanException(ScanException.ErrorType.MATCHER,
                "Template " + getId() + ": " + e.getMessage(), e);
        }
    }

    private void collectMatchedPatterns(List<MatcherType> effective, ProbeResponse response,
                                        Evidence.Builder evidence, String statusPattern) throws ScanException {
        String body = response.getBodyAsString();
        for (MatcherType matcher : effective) {
            boolean matched;
            try {
                matched = MatcherEngine.evaluate(matcher, response);
            } catch (MatcherException e) {
                throw new ScanException(ScanException.ErrorType.MATCHER,
                    "Template " + getId() + ": " + e.getMessage(), e);
            }
            if (!matched) {
                continue;
            }
            switch (matcher.getKind()) {
                case WORD:
                    ((MatcherType.Word) matcher).getWords().stream()
                        .filter(body::contains)
                        .forEach(evidence::addMatch);
                    break;
                case REGEX:
                    ((MatcherType.Regex) matcher).getPatterns().forEach(evidence::addMatch);
                    break;
                case STATUS:
                    evidence.addMatch(statusPattern);
                    break;
                default:
                    break;
            }
        }
    }

    private Finding finding(String findingTarget, Evidence evidence) {
        return Finding.builder()
            .target(findingTarget)
            .templateId(getId())
            .severity(metadata.getSeverity())
            .title(metadata.getName())
            .description(metadata.getDescription())
            .confidence(metadata.getConfidence().orElse(Finding.DEFAULT_CONFIDENCE))
            .cveIds(metadata.getCveIds())
            .cweIds(metadata.getCweIds())
            .cvssScore(metadata.getCvssScore().orElse(null))
            .tags(metadata.getTags())
            .evidence(evidence)
            .build();
    }

    record HttpRequestSpec(String method, List<String> paths, Map<String, String> headers, String body,
                           List<MatcherType> matchers, MatcherType.MatchCondition matchersCondition) {
    }

    record NetworkRequestSpec(String protocol, int port, List<String> payloads,
                              List<MatcherType> matchers, MatcherType.MatchCondition matchersCondition) {
    }
}
