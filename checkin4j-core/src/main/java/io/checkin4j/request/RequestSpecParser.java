package io.checkin4j.request;

import io.checkin4j.core.RequestDescriptor;
import io.checkin4j.core.SpecParseException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Parses a curl-style command line into a {@link RequestDescriptor}.
 * <p>
 * Supported options:
 * <ul>
 *   <li>URL: first bare {@code http(s)://} word, or {@code --url VALUE}</li>
 *   <li>{@code -X/--request METHOD}</li>
 *   <li>{@code -H/--header "Name: value"} (repeatable, later wins)</li>
 *   <li>{@code -A/--user-agent}, {@code -e/--referer}</li>
 *   <li>{@code -b/--cookie "k=v; k2=v2"}</li>
 *   <li>{@code -d/--data/--data-raw/--data-binary/--data-urlencode} and {@code -F/--form}
 *       (repeatable, joined with {@code &})</li>
 * </ul>
 * The leading {@code curl} is optional and anything else is ignored. Parsing is pure: the same
 * input always yields an equal descriptor.
 */
public class RequestSpecParser {

    public static final int MAX_SPEC_LENGTH = 50_000;

    private static final String INVOCATION = "curl";

    private enum Option {
        URL, METHOD, HEADER, USER_AGENT, REFERER, COOKIE, DATA, FORM, IGNORED_WITH_ARG
    }

    private static final Map<String, Option> OPTIONS = Map.ofEntries(
            Map.entry("--url", Option.URL),
            Map.entry("-X", Option.METHOD),
            Map.entry("--request", Option.METHOD),
            Map.entry("-H", Option.HEADER),
            Map.entry("--header", Option.HEADER),
            Map.entry("-A", Option.USER_AGENT),
            Map.entry("--user-agent", Option.USER_AGENT),
            Map.entry("-e", Option.REFERER),
            Map.entry("--referer", Option.REFERER),
            Map.entry("-b", Option.COOKIE),
            Map.entry("--cookie", Option.COOKIE),
            Map.entry("-d", Option.DATA),
            Map.entry("--data", Option.DATA),
            Map.entry("--data-raw", Option.DATA),
            Map.entry("--data-binary", Option.DATA),
            Map.entry("--data-urlencode", Option.DATA),
            Map.entry("-F", Option.FORM),
            Map.entry("--form", Option.FORM),
            // curl options whose argument must not be mistaken for the URL
            Map.entry("-o", Option.IGNORED_WITH_ARG),
            Map.entry("--output", Option.IGNORED_WITH_ARG),
            Map.entry("-x", Option.IGNORED_WITH_ARG),
            Map.entry("--proxy", Option.IGNORED_WITH_ARG),
            Map.entry("-U", Option.IGNORED_WITH_ARG),
            Map.entry("--proxy-user", Option.IGNORED_WITH_ARG),
            Map.entry("-u", Option.IGNORED_WITH_ARG),
            Map.entry("--user", Option.IGNORED_WITH_ARG),
            Map.entry("-m", Option.IGNORED_WITH_ARG),
            Map.entry("--max-time", Option.IGNORED_WITH_ARG),
            Map.entry("--connect-timeout", Option.IGNORED_WITH_ARG),
            Map.entry("--retry", Option.IGNORED_WITH_ARG),
            Map.entry("-w", Option.IGNORED_WITH_ARG),
            Map.entry("--write-out", Option.IGNORED_WITH_ARG),
            Map.entry("-T", Option.IGNORED_WITH_ARG),
            Map.entry("--upload-file", Option.IGNORED_WITH_ARG),
            Map.entry("--resolve", Option.IGNORED_WITH_ARG),
            Map.entry("-E", Option.IGNORED_WITH_ARG),
            Map.entry("--cert", Option.IGNORED_WITH_ARG),
            Map.entry("--cacert", Option.IGNORED_WITH_ARG),
            Map.entry("--key", Option.IGNORED_WITH_ARG),
            Map.entry("--interface", Option.IGNORED_WITH_ARG)
    );

    // short options that may carry their value in the same word, e.g. -XPOST
    private static final Set<String> ATTACHABLE = Set.of("-X", "-H", "-A", "-e", "-b", "-d", "-F", "-o", "-x", "-u", "-m", "-w");

    public RequestDescriptor parse(String raw) {
        Objects.requireNonNull(raw, "raw must not be null");
        if (raw.length() > MAX_SPEC_LENGTH) {
            throw new SpecParseException(SpecParseException.Reason.SPEC_TOO_LONG,
                    "Request spec is too long: " + raw.length() + " characters (max " + MAX_SPEC_LENGTH + ")");
        }

        List<String> words = ShellTokenizer.tokenize(raw);
        int i = (!words.isEmpty() && INVOCATION.equals(words.get(0))) ? 1 : 0;

        String url = null;
        String explicitMethod = null;
        Map<String, String> headers = new LinkedHashMap<>();
        Map<String, String> cookies = new LinkedHashMap<>();
        List<String> bodyParts = new ArrayList<>();

        while (i < words.size()) {
            String word = words.get(i);
            Option option = OPTIONS.get(word);
            String value = null;

            if (option != null) {
                if (i + 1 >= words.size()) {
                    break;
                }
                value = words.get(i + 1);
                i += 2;
            } else if (isAttached(word)) {
                option = OPTIONS.get(word.substring(0, 2));
                value = word.substring(2);
                i++;
            } else {
                if (url == null && isHttpUrl(word)) {
                    url = word;
                }
                i++;
                continue;
            }

            switch (option) {
                case URL -> {
                    if (url == null) {
                        url = value;
                    }
                }
                case METHOD -> explicitMethod = value.trim().toUpperCase(Locale.ROOT);
                case HEADER -> putHeader(headers, value);
                case USER_AGENT -> headers.put("User-Agent", value);
                case REFERER -> headers.put("Referer", value);
                case COOKIE -> putCookies(cookies, value);
                case DATA, FORM -> bodyParts.add(value);
                case IGNORED_WITH_ARG -> {
                    // argument consumed, nothing to record
                }
            }
        }

        if (url == null || url.isBlank()) {
            throw new SpecParseException(SpecParseException.Reason.MISSING_URL,
                    "Request spec has no URL; include a full http:// or https:// address");
        }

        String method;
        if (explicitMethod != null && !explicitMethod.isEmpty()) {
            method = explicitMethod;
        } else {
            method = bodyParts.isEmpty() ? "GET" : "POST";
        }
        String body = bodyParts.isEmpty() ? null : String.join("&", bodyParts);

        return new RequestDescriptor(method, url, headers, cookies, body);
    }

    private static boolean isAttached(String word) {
        return word.length() > 2
                && word.charAt(0) == '-'
                && word.charAt(1) != '-'
                && ATTACHABLE.contains(word.substring(0, 2));
    }

    private static boolean isHttpUrl(String word) {
        String lower = word.toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://");
    }

    private static void putHeader(Map<String, String> headers, String line) {
        int colon = line.indexOf(':');
        if (colon <= 0) {
            return;
        }
        String name = line.substring(0, colon).trim();
        if (name.isEmpty()) {
            return;
        }
        headers.put(name, line.substring(colon + 1).trim());
    }

    private static void putCookies(Map<String, String> cookies, String list) {
        for (String item : list.split(";")) {
            String pair = item.trim();
            int eq = pair.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            cookies.put(pair.substring(0, eq).trim(), pair.substring(eq + 1).trim());
        }
    }
}
