package engine.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import model.Severity;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JwtTokenTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static String segment(String json) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(json.getBytes(StandardCharsets.UTF_8));
    }

    static String token(String headerJson, String payloadJson) {
        return segment(headerJson) + "." + segment(payloadJson) + ".c2lnbmF0dXJl";
    }

    private static JsonNode decode(String segment) throws Exception {
        return MAPPER.readTree(Base64.getUrlDecoder().decode(segment));
    }

    @Test
    void testParseDecodesHeaderAndPayload() throws Exception {
        JwtToken jwt = JwtToken.parse(token(
            "{\"alg\":\"RS256\",\"typ\":\"JWT\",\"kid\":\"k1\"}",
            "{\"iss\":\"auth\",\"sub\":\"42\",\"aud\":\"api\",\"exp\":4102444800,\"role\":\"user\"}"));

        JwtToken.Header header = jwt.getHeader().orElseThrow();
        assertEquals("RS256", header.alg());
        assertEquals("JWT", header.typ());
        assertEquals("k1", header.kid());

        JwtToken.Payload payload = jwt.getPayload().orElseThrow();
        assertEquals("auth", payload.iss());
        assertEquals("42", payload.sub());
        assertEquals(List.of("api"), payload.aud());
        assertEquals(4102444800L, payload.exp());
        assertEquals("user", payload.custom().get("role").asText());
        assertFalse(jwt.isExpired());
        assertEquals("Bearer", jwt.getTokenType());
        assertTrue(jwt.toAuthorizationHeader().startsWith("Bearer ey"));
    }

    @Test
    void testAudienceAsArray() throws Exception {
        JwtToken jwt = JwtToken.parse(token("{\"alg\":\"HS256\"}", "{\"aud\":[\"a\",\"b\"]}"));

        assertEquals(List.of("a", "b"), jwt.getPayload().orElseThrow().aud());
    }

    @Test
    void testWrongSegmentCountIsRejected() {
        assertThrows(SessionException.class, () -> JwtToken.parse("only.two"));
        assertThrows(SessionException.class, () -> JwtToken.parse("a.b.c.d"));
        assertThrows(SessionException.class, () -> JwtToken.parse(null));
    }

    @Test
    void testUndecodableSegmentsAreTolerated() throws Exception {
        JwtToken jwt = JwtToken.parse("!!!.???.sig");

        assertTrue(jwt.getHeader().isEmpty());
        assertTrue(jwt.getPayload().isEmpty());
        assertTrue(jwt.analyzeSecurity().isEmpty());
        assertTrue(jwt.generateAttackPayloads().isEmpty());
    }

    @Test
    void testExpiredToken() throws Exception {
        long past = Instant.now().minusSeconds(60).getEpochSecond();
        JwtToken jwt = JwtToken.parse(token("{\"alg\":\"HS256\"}", "{\"exp\":" + past + "}"));

        assertTrue(jwt.isExpired());
    }

    @Test
    void testSecurityAnalysisFlagsNoneAlgorithmAndMissingClaims() throws Exception {
        JwtToken jwt = JwtToken.parse(token("{\"alg\":\"none\"}", "{\"sub\":\"1\"}"));

        List<JwtSecurityIssue> issues = jwt.analyzeSecurity();

        assertEquals(3, issues.size());
        assertEquals(JwtSecurityIssue.Type.WEAK_ALGORITHM, issues.get(0).type());
        assertEquals(Severity.CRITICAL, issues.get(0).severity());
        assertEquals("exp", issues.get(1).subject());
        assertEquals(Severity.MEDIUM, issues.get(1).severity());
        assertEquals("iss", issues.get(2).subject());
        assertEquals(Severity.LOW, issues.get(2).severity());
    }

    @Test
    void testSecurityAnalysisFlagsKeyConfusion() throws Exception {
        JwtToken jwt = JwtToken.parse(token("{\"alg\":\"HS256\",\"kid\":\"../../dev/null\"}",
            "{\"iss\":\"a\",\"exp\":4102444800}"));

        List<JwtSecurityIssue> issues = jwt.analyzeSecurity();

        assertEquals(1, issues.size());
        assertEquals(JwtSecurityIssue.Type.KEY_CONFUSION, issues.get(0).type());
        assertEquals(Severity.HIGH, issues.get(0).severity());
    }

    @Test
    void testAttackPayloads() throws Exception {
        String original = token("{\"alg\":\"RS256\",\"typ\":\"JWT\"}", "{\"sub\":\"42\",\"exp\":1000}");
        String[] originalParts = original.split("\\.");

        List<JwtAttackPayload> payloads = JwtToken.parse(original).generateAttackPayloads();

        assertEquals(4, payloads.size());

        JwtAttackPayload none = payloads.get(0);
        assertEquals("None Algorithm Bypass", none.name());
        assertTrue(none.token().endsWith("."));
        String[] noneParts = none.token().split("\\.", -1);
        assertEquals("none", decode(noneParts[0]).get("alg").asText());
        assertEquals(originalParts[1], noneParts[1]);
        assertFalse(noneParts[0].contains("="));

        JwtAttackPayload confusion = payloads.get(1);
        assertEquals("HS256", decode(confusion.token().split("\\.")[0]).get("alg").asText());
        assertTrue(confusion.token().endsWith(".SIGNATURE_PLACEHOLDER"));

        JwtAttackPayload expiration = payloads.get(2);
        assertEquals(Severity.HIGH, expiration.severity());
        long exp = decode(expiration.token().split("\\.")[1]).get("exp").asLong();
        assertTrue(exp > Instant.now().plusSeconds(360L * 24 * 3600).getEpochSecond());

        JwtAttackPayload escalation = payloads.get(3);
        assertEquals(Severity.CRITICAL, escalation.severity());
        JsonNode claims = decode(escalation.token().split("\\.")[1]);
        assertEquals("admin", claims.get("role").asText());
        assertTrue(claims.get("is_admin").asBoolean());
        assertEquals("superuser", claims.get("permissions").get(1).asText());
        assertEquals("42", claims.get("sub").asText());
    }
}
