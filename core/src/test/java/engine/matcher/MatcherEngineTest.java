package engine.matcher;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import engine.model.ProbeResponse;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MatcherEngineTest {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private static ProbeResponse response(int status, String body) {
        return ProbeResponse.builder()
            .statusCode(status)
            .addHeader("Server", "nginx/1.18.0")
            .body(body)
            .responseTime(Duration.ofMillis(120))
            .build();
    }

    @Test
    void testStatusMatcher() throws Exception {
        ProbeResponse ok = response(200, "hello");

        assertTrue(MatcherEngine.evaluate(MatcherType.status(200, 302), ok));
        assertFalse(MatcherEngine.evaluate(MatcherType.status(404), ok));
    }

    @Test
    void testWordMatcherConditions() throws Exception {
        ProbeResponse ok = response(200, "admin panel login");

        MatcherType anyWord = MatcherType.words(MatcherType.MatchCondition.OR, MatcherType.ResponsePart.BODY,
            "missing", "admin");
        MatcherType allWords = MatcherType.words(MatcherType.MatchCondition.AND, MatcherType.ResponsePart.BODY,
            "missing", "admin");

        assertTrue(MatcherEngine.evaluate(anyWord, ok));
        assertFalse(MatcherEngine.evaluate(allWords, ok));
    }

    @Test
    void testWordMatcherOnHeaders() throws Exception {
        ProbeResponse ok = response(200, "body");

        MatcherType headerWord = MatcherType.words(null, MatcherType.ResponsePart.HEADER, "nginx");
        MatcherType bodyWord = MatcherType.words(null, MatcherType.ResponsePart.BODY, "nginx");

        assertTrue(MatcherEngine.evaluate(headerWord, ok));
        assertFalse(MatcherEngine.evaluate(bodyWord, ok));
    }

    @Test
    void testRegexMatcherWithGroup() throws Exception {
        ProbeResponse ok = response(200, "version: 2.4.1");

        assertTrue(MatcherEngine.evaluate(MatcherType.regex("version: (\\d+)\\.(\\d+)"), ok));
        assertTrue(MatcherEngine.evaluate(new MatcherType.Regex(List.of("version: (\\d+)"), 1), ok));
        assertFalse(MatcherEngine.evaluate(new MatcherType.Regex(List.of("version: (\\d+)"), 3), ok));
    }

    @Test
    void testInvalidRegexIsReported() {
        ProbeResponse ok = response(200, "anything");

        assertThrows(MatcherException.class, () -> MatcherEngine.evaluate(MatcherType.regex("(unclosed"), ok));
    }

    @Test
    void testBinaryMatcher() throws Exception {
        ProbeResponse ok = ProbeResponse.builder()
            .statusCode(200)
            .body(new byte[]{0x00, (byte) 0xCA, (byte) 0xFE, 0x01})
            .build();

        assertTrue(MatcherEngine.evaluate(new MatcherType.Binary(List.of("0xcafe")), ok));
        assertFalse(MatcherEngine.evaluate(new MatcherType.Binary(List.of("beef")), ok));
        assertThrows(MatcherException.class,
            () -> MatcherEngine.evaluate(new MatcherType.Binary(List.of("abc")), ok));
    }

    @Test
    void testTimeAndSizeMatchers() throws Exception {
        ProbeResponse ok = response(200, "12345");

        assertTrue(MatcherEngine.evaluate(
            new MatcherType.Time(MatcherType.TimeCondition.GREATER, Duration.ofMillis(100)), ok));
        assertFalse(MatcherEngine.evaluate(
            new MatcherType.Time(MatcherType.TimeCondition.LESS, Duration.ofMillis(100)), ok));
        assertTrue(MatcherEngine.evaluate(new MatcherType.Size(MatcherType.SizeCondition.EQUAL, 5), ok));
        assertTrue(MatcherEngine.evaluate(new MatcherType.Size(MatcherType.SizeCondition.LESS, 6), ok));
    }

    @Test
    void testHashMatcher() throws Exception {
        ProbeResponse ok = response(200, "abc");

        MatcherType sha256 = new MatcherType.Hash(MatcherType.HashAlgorithm.SHA256,
            "BA7816BF8F01CFEA414140DE5DAE2223B00361A396177A9CB410FF61F20015AD");
        MatcherType md5 = new MatcherType.Hash(MatcherType.HashAlgorithm.MD5, "900150983cd24fb0d6963f7d28e17f72");
        MatcherType blake3 = new MatcherType.Hash(MatcherType.HashAlgorithm.BLAKE3, "00");

        assertTrue(MatcherEngine.evaluate(sha256, ok));
        assertTrue(MatcherEngine.evaluate(md5, ok));
        assertThrows(MatcherException.class, () -> MatcherEngine.evaluate(blake3, ok));
    }

    @Test
    void testDiffMatcher() throws Exception {
        ProbeResponse ok = response(200, "abcd");

        assertFalse(MatcherEngine.evaluate(new MatcherType.Diff("abcd", 10), ok));
        assertTrue(MatcherEngine.evaluate(new MatcherType.Diff("abxx", 50), ok));
    }

    @Test
    void testSimilarity() {
        assertEquals(100, MatcherEngine.similarity("", ""));
        assertEquals(0, MatcherEngine.similarity("abc", ""));
        assertEquals(50, MatcherEngine.similarity("abcd", "abxx"));
        assertEquals(75, MatcherEngine.similarity("abc", "abcd"));
    }

    @Test
    void testCustomMatcherIsRejected() {
        ProbeResponse ok = response(200, "x");

        assertThrows(MatcherException.class,
            () -> MatcherEngine.evaluate(new MatcherType.Custom("python", "return True"), ok));
    }

    @Test
    void testMatchAllCombination() throws Exception {
        ProbeResponse ok = response(200, "welcome");
        List<MatcherType> matchers = List.of(MatcherType.status(200), MatcherType.regex("denied"));

        assertTrue(MatcherEngine.matchAll(matchers, ok, MatcherType.MatchCondition.OR));
        assertFalse(MatcherEngine.matchAll(matchers, ok, MatcherType.MatchCondition.AND));
        assertFalse(MatcherEngine.matchAll(List.of(), ok, MatcherType.MatchCondition.OR));
    }

    @Test
    void testMatchAllSurfacesErrorsEvenWhenShortCircuitPossible() {
        ProbeResponse ok = response(200, "welcome");
        List<MatcherType> matchers = List.of(MatcherType.status(200), MatcherType.regex("[broken"));

        assertThrows(MatcherException.class,
            () -> MatcherEngine.matchAll(matchers, ok, MatcherType.MatchCondition.OR));
    }

    @Test
    void testParseMatchersFromYaml() throws Exception {
        String yaml = String.join("\n",
            "- type: status",
            "  status: [200, 204]",
            "- type: word",
            "  words: [\"root:\"]",
            "  condition: and",
            "  part: header",
            "- type: time",
            "  condition: greater",
            "  time: 2s",
            "- type: size",
            "  condition: equal",
            "  size: 10");

        List<MatcherType> matchers = MatcherParser.parseList(YAML_MAPPER.readTree(yaml));

        assertEquals(4, matchers.size());
        assertEquals(List.of(200, 204), ((MatcherType.Status) matchers.get(0)).getCodes());
        MatcherType.Word word = (MatcherType.Word) matchers.get(1);
        assertEquals(MatcherType.MatchCondition.AND, word.getCondition());
        assertEquals(MatcherType.ResponsePart.HEADER, word.getPart());
        assertEquals(Duration.ofSeconds(2), ((MatcherType.Time) matchers.get(2)).getThreshold());
        assertEquals(10, ((MatcherType.Size) matchers.get(3)).getSize());
    }

    @Test
    void testParseRejectsUnknownType() throws Exception {
        assertThrows(MatcherException.class,
            () -> MatcherParser.parse(YAML_MAPPER.readTree("type: telepathy")));
        assertThrows(MatcherException.class,
            () -> MatcherParser.parse(YAML_MAPPER.readTree("words: [a]")));
    }
}
