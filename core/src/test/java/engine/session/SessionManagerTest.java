package engine.session;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SessionManagerTest {

    private static final String JWT = JwtTokenTest.token(
        "{\"alg\":\"HS256\",\"typ\":\"JWT\"}", "{\"sub\":\"42\"}");

    private SessionManager session;

    @BeforeEach
    void setUp() {
        session = new SessionManager();
    }

    @Test
    void testStoreCookieReplacesSameName() {
        session.storeCookie(Cookie.of("a", "1", "example.com"));
        session.storeCookie(Cookie.of("b", "2", "example.com"));
        session.storeCookie(Cookie.of("a", "3", "example.com"));

        assertEquals("b=2; a=3", session.getCookieHeader("example.com").orElseThrow());
        assertTrue(session.getCookieHeader("other.com").isEmpty());
    }

    @Test
    void testExpiredCookiesAreNotReturned() {
        session.storeCookie(Cookie.builder("old", "x", "example.com")
            .expires(Instant.now().minusSeconds(1)).build());

        assertTrue(session.getCookies("example.com").isEmpty());
        assertTrue(session.getCookieHeader("example.com").isEmpty());
    }

    @Test
    void testParseSetCookieAttributes() {
        session.parseSetCookie("example.com",
            "sessionid=abc123; Path=/app; Secure; HttpOnly; SameSite=Strict");

        List<Cookie> cookies = session.getCookies("example.com");
        assertEquals(1, cookies.size());
        Cookie cookie = cookies.get(0);
        assertEquals("sessionid", cookie.getName());
        assertEquals("abc123", cookie.getValue());
        assertEquals("/app", cookie.getPath());
        assertTrue(cookie.isSecure());
        assertTrue(cookie.isHttpOnly());
        assertEquals(Cookie.SameSite.STRICT, cookie.getSameSite().orElseThrow());
    }

    @Test
    void testMaxAgeTakesPrecedenceOverExpires() {
        session.parseSetCookie("example.com",
            "token=v; Max-Age=3600; Expires=Wed, 21 Oct 2015 07:28:00 GMT");

        Instant expires = session.getCookies("example.com").get(0).getExpires().orElseThrow();
        assertTrue(expires.isAfter(Instant.now().plusSeconds(3000)));
    }

    @Test
    void testOutOfRangeMaxAgeIsClamped() {
        session.parseSetCookie("example.com", "sid=abc; Max-Age=99999999999999999");
        session.parseSetCookie("example.com", "old=x; Max-Age=-99999999999999999");

        List<Cookie> cookies = session.getCookies("example.com");
        assertEquals(1, cookies.size());
        assertEquals("sid", cookies.get(0).getName());
        assertEquals(Instant.MAX, cookies.get(0).getExpires().orElseThrow());
    }

    @Test
    void testPastExpiresHidesCookie() {
        session.parseSetCookie("example.com", "token=v; Expires=Wed, 21 Oct 2015 07:28:00 GMT");

        assertTrue(session.getCookies("example.com").isEmpty());
    }

    @Test
    void testMalformedSetCookieIsIgnored() {
        session.parseSetCookie("example.com", "novalue");
        session.parseSetCookie("example.com", "  ");
        session.parseSetCookie("example.com", null);

        assertTrue(session.getCookies("example.com").isEmpty());
    }

    @Test
    void testJwtStorage() throws Exception {
        session.setJwt("default", JWT);

        assertEquals("Bearer " + JWT, session.getJwtHeader("default").orElseThrow());
        assertTrue(session.getJwtHeader("missing").isEmpty());
        assertThrows(SessionException.class, () -> session.setJwt("bad", "not-a-jwt"));
    }

    @Test
    void testSecurityAnalysisAggregates() throws Exception {
        session.setJwt("default", JWT);
        session.storeCookie(Cookie.of("sessionid", "1", "example.com"));
        session.storeCookie(Cookie.builder("pref", "x", "safe.com").sameSite(Cookie.SameSite.LAX).build());

        Map<String, List<JwtSecurityIssue>> jwtIssues = session.analyzeJwtSecurity();
        assertEquals(2, jwtIssues.get("default").size());

        Map<String, List<CookieSecurityIssue>> cookieIssues = session.analyzeCookieSecurity();
        assertTrue(cookieIssues.containsKey("example.com"));
        assertFalse(cookieIssues.containsKey("safe.com"));
    }

    @Test
    void testVariables() {
        session.setVariable("b", "2");
        session.setVariable("a", "1");

        assertEquals("1", session.getVariable("a").orElseThrow());
        assertEquals(List.of("a", "b"), List.copyOf(session.getVariables().keySet()));
        assertThrows(UnsupportedOperationException.class, () -> session.getVariables().put("c", "3"));

        session.clear();
        assertTrue(session.getVariables().isEmpty());
    }

    @Test
    void testSaveAndLoadFile(@TempDir Path dir) throws Exception {
        Instant expires = Instant.parse("2099-01-01T00:00:00Z");
        session.storeCookie(Cookie.builder("sid", "v1", "example.com")
            .secure(true).sameSite(Cookie.SameSite.NONE).expires(expires).build());
        session.setJwt("default", JWT);
        session.setVariable("csrf", "t0k3n");

        Path file = dir.resolve("session.json");
        session.saveToFile(file);
        String json = Files.readString(file);
        assertTrue(json.contains("\"cookies\""));
        assertTrue(json.contains("\"jwt_tokens\""));
        assertTrue(json.contains("\"variables\""));

        SessionManager restored = new SessionManager();
        restored.loadFromFile(file);

        Cookie cookie = restored.getCookies("example.com").get(0);
        assertEquals("v1", cookie.getValue());
        assertTrue(cookie.isSecure());
        assertEquals(Cookie.SameSite.NONE, cookie.getSameSite().orElseThrow());
        assertEquals(expires, cookie.getExpires().orElseThrow());
        assertEquals(JWT, restored.getJwt("default").orElseThrow().getToken());
        assertEquals("t0k3n", restored.getVariable("csrf").orElseThrow());
    }

    @Test
    void testLoadMissingFileFails(@TempDir Path dir) {
        assertThrows(SessionException.class, () -> session.loadFromFile(dir.resolve("absent.json")));
    }

    @Test
    void testEncryptedRoundTrip() throws Exception {
        session.setVariable("api_key", "secret");
        session.setJwt("default", JWT);

        String exported = session.exportEncrypted("pass");
        assertFalse(exported.contains("secret"));

        SessionManager restored = new SessionManager();
        restored.importEncrypted(exported, "pass");

        assertEquals("secret", restored.getVariable("api_key").orElseThrow());
        assertTrue(restored.getJwt("default").isPresent());
    }

    @Test
    void testWrongPassphraseIsRejected() throws Exception {
        session.setVariable("api_key", "secret");
        String exported = session.exportEncrypted("pass");

        SessionManager restored = new SessionManager();

        assertThrows(SessionException.class, () -> restored.importEncrypted(exported, "wrong"));
        assertThrows(SessionException.class, () -> restored.importEncrypted("%%%", "pass"));
        assertTrue(restored.getVariables().isEmpty());
    }
}
