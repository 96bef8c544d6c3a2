package io.checkin4j.request;

import io.checkin4j.core.RequestDescriptor;
import io.checkin4j.core.SpecParseException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RequestSpecParserTest {

    private final RequestSpecParser parser = new RequestSpecParser();

    @Test
    void parseShouldReadBrowserCopiedCommand() {
        String raw = "curl 'https://example.com/api/checkin?x=1' \\\n"
                + "  -H 'accept: application/json' \\\n"
                + "  -H 'Authorization: Bearer xyz' \\\n"
                + "  -b 'session=abcdefgh; id=12' \\\n"
                + "  -A 'Mozilla/5.0' \\\n"
                + "  -e 'https://example.com/' \\\n"
                + "  --compressed";

        RequestDescriptor d = parser.parse(raw);

        assertEquals("GET", d.method());
        assertEquals("https://example.com/api/checkin?x=1", d.url());
        assertThat(d.headers()).containsExactly(
                Map.entry("accept", "application/json"),
                Map.entry("Authorization", "Bearer xyz"),
                Map.entry("User-Agent", "Mozilla/5.0"),
                Map.entry("Referer", "https://example.com/"));
        assertThat(d.cookies()).containsExactly(Map.entry("session", "abcdefgh"), Map.entry("id", "12"));
        assertNull(d.body());
    }

    @Test
    void bodyWithoutExplicitMethodShouldBePost() {
        for (String flag : List.of("-d", "--data", "--data-raw", "--data-binary", "--data-urlencode", "-F", "--form")) {
            RequestDescriptor d = parser.parse("curl https://example.com " + flag + " 'a=1'");
            assertEquals("POST", d.method(), flag);
            assertEquals("a=1", d.body(), flag);
        }
    }

    @Test
    void explicitMethodShouldWinOverBody() {
        RequestDescriptor d = parser.parse("curl -X put https://example.com -d 'a=1'");
        assertEquals("PUT", d.method());
    }

    @Test
    void repeatedBodyFlagsShouldJoinWithAmpersand() {
        RequestDescriptor d = parser.parse("curl https://example.com -d a=1 --data-raw 'b=2' -F c=3");
        assertEquals("a=1&b=2&c=3", d.body());
    }

    @Test
    void laterHeaderShouldOverwriteEarlier() {
        RequestDescriptor d = parser.parse("curl https://example.com -H 'X-Token: one' -H 'X-Token:two'");
        assertEquals(Map.of("X-Token", "two"), d.headers());
    }

    @Test
    void headerValueShouldSplitAtFirstColon() {
        RequestDescriptor d = parser.parse("curl https://example.com -H 'Referer: https://a.example/x'");
        assertEquals("https://a.example/x", d.headers().get("Referer"));
    }

    @Test
    void invocationKeywordShouldBeOptional() {
        RequestDescriptor d = parser.parse("-X POST https://example.com/sign");
        assertEquals("POST", d.method());
        assertEquals("https://example.com/sign", d.url());
    }

    @Test
    void urlFlagShouldBeAccepted() {
        RequestDescriptor d = parser.parse("curl --url https://example.com/a -H 'A: b'");
        assertEquals("https://example.com/a", d.url());
    }

    @Test
    void firstBareUrlShouldWin() {
        RequestDescriptor d = parser.parse("curl https://first.example https://second.example");
        assertEquals("https://first.example", d.url());
    }

    @Test
    void attachedShortFlagValuesShouldBeRead() {
        RequestDescriptor d = parser.parse("curl -XPOST -H'A: b' -bk=v https://example.com");
        assertEquals("POST", d.method());
        assertEquals(Map.of("A", "b"), d.headers());
        assertEquals(Map.of("k", "v"), d.cookies());
    }

    @Test
    void argumentsOfUnmodelledOptionsShouldNotBecomeUrl() {
        RequestDescriptor d = parser.parse("curl -x http://proxy.local:8080 --connect-timeout 5 -sSL https://example.com");
        assertEquals("https://example.com", d.url());
    }

    @Test
    void unknownFlagsShouldBeIgnored() {
        RequestDescriptor d = parser.parse("curl --compressed -k -v --http2 https://example.com");
        assertEquals("GET", d.method());
        assertThat(d.headers()).isEmpty();
    }

    @Test
    void duplicateCookieShouldKeepLastValue() {
        RequestDescriptor d = parser.parse("curl https://example.com -b 'a=1; b=2' --cookie 'a=3'");
        assertEquals(Map.of("a", "3", "b", "2"), d.cookies());
    }

    @Test
    void cookieValueShouldSplitAtFirstEquals() {
        RequestDescriptor d = parser.parse("curl https://example.com -b 'token=abc==; x=y'");
        assertEquals("abc==", d.cookies().get("token"));
    }

    @Test
    void missingUrlShouldFail() {
        SpecParseException e = assertThrows(SpecParseException.class, () -> parser.parse("curl -H 'A: b' example.com"));
        assertEquals(SpecParseException.Reason.MISSING_URL, e.reason());

        SpecParseException empty = assertThrows(SpecParseException.class, () -> parser.parse("   "));
        assertEquals(SpecParseException.Reason.MISSING_URL, empty.reason());
    }

    @Test
    void malformedQuotingShouldFail() {
        SpecParseException e = assertThrows(SpecParseException.class,
                () -> parser.parse("curl 'https://example.com -H 'A: b'"));
        assertEquals(SpecParseException.Reason.MALFORMED_QUOTING, e.reason());
    }

    @Test
    void oversizedSpecShouldFailBeforeTokenizing() {
        String raw = "curl 'https://example.com/" + "a".repeat(RequestSpecParser.MAX_SPEC_LENGTH);
        SpecParseException e = assertThrows(SpecParseException.class, () -> parser.parse(raw));
        assertEquals(SpecParseException.Reason.SPEC_TOO_LONG, e.reason());
    }

    @Test
    void parseShouldBeDeterministic() {
        String raw = "curl https://example.com -H 'B: 2' -H 'A: 1' -b 'z=1; y=2' -d x=1";
        assertEquals(parser.parse(raw), parser.parse(raw));
    }
}
