package uk.gegc.cooksnap.features.scrape.application;

import java.net.IDN;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns browser-style URL strings into {@link URI}s.
 * <p>
 * Internationalized host names are converted to their ASCII form and characters that
 * {@link URI} does not allow in the path, query or fragment are percent-encoded. Existing
 * escapes are kept as they are. Works for absolute URLs and for relative redirect targets.
 */
public final class TargetUrlParser {

    // RFC 3986, appendix B
    private static final Pattern REFERENCE =
            Pattern.compile("^(?:([^:/?#]+):)?(?://([^/?#]*))?([^?#]*)(?:\\?([^#]*))?(?:#(.*))?$", Pattern.DOTALL);

    private static final String SAFE_PUNCTUATION = "-._~!$&'()*+,;=:@/?";
    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private TargetUrlParser() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static URI parse(String url) throws URISyntaxException {
        String trimmed = url.trim();
        Matcher matcher = REFERENCE.matcher(trimmed);
        if (!matcher.matches()) {
            throw new URISyntaxException(trimmed, "Unrecognised URL");
        }
        String scheme = matcher.group(1);
        String authority = matcher.group(2);
        String path = matcher.group(3);
        String query = matcher.group(4);
        String fragment = matcher.group(5);

        StringBuilder rebuilt = new StringBuilder(trimmed.length() + 16);
        if (scheme != null) {
            rebuilt.append(scheme).append(':');
        }
        if (authority != null) {
            rebuilt.append("//").append(asciiAuthority(trimmed, authority));
        }
        rebuilt.append(encodeIllegal(path));
        if (query != null) {
            rebuilt.append('?').append(encodeIllegal(query));
        }
        if (fragment != null) {
            rebuilt.append('#').append(encodeIllegal(fragment));
        }
        return new URI(rebuilt.toString());
    }

    private static String asciiAuthority(String input, String authority) throws URISyntaxException {
        int at = authority.lastIndexOf('@');
        String userInfo = at >= 0 ? authority.substring(0, at + 1) : "";
        String hostAndPort = authority.substring(at + 1);
        if (hostAndPort.startsWith("[")) {
            return encodeIllegal(userInfo) + hostAndPort;
        }

        int colon = hostAndPort.indexOf(':');
        String host = colon >= 0 ? hostAndPort.substring(0, colon) : hostAndPort;
        String port = colon >= 0 ? hostAndPort.substring(colon) : "";
        if (!isAscii(host)) {
            try {
                host = IDN.toASCII(host, IDN.ALLOW_UNASSIGNED);
            } catch (IllegalArgumentException ex) {
                throw new URISyntaxException(input, "Invalid internationalized host name");
            }
        }
        return encodeIllegal(userInfo) + host + port;
    }

    private static String encodeIllegal(String component) {
        StringBuilder out = null;
        int length = component.length();
        for (int i = 0; i < length; i++) {
            char c = component.charAt(i);
            if (isAllowed(c) || (c == '%' && isEscape(component, i))) {
                if (out != null) {
                    out.append(c);
                }
                continue;
            }
            if (out == null) {
                out = new StringBuilder(length + 16).append(component, 0, i);
            }
            int end = Character.isHighSurrogate(c) && i + 1 < length ? i + 2 : i + 1;
            for (byte b : component.substring(i, end).getBytes(StandardCharsets.UTF_8)) {
                out.append('%').append(HEX[(b >> 4) & 0x0F]).append(HEX[b & 0x0F]);
            }
            i = end - 1;
        }
        return out == null ? component : out.toString();
    }

    private static boolean isAllowed(char c) {
        return (c >= 'a' && c <= 'z')
                || (c >= 'A' && c <= 'Z')
                || (c >= '0' && c <= '9')
                || SAFE_PUNCTUATION.indexOf(c) >= 0;
    }

    private static boolean isEscape(String component, int index) {
        return index + 2 < component.length()
                && Character.digit(component.charAt(index + 1), 16) >= 0
                && Character.digit(component.charAt(index + 2), 16) >= 0;
    }

    private static boolean isAscii(String value) {
        for (int i = 0; i < value.length(); i++) {
            if (value.charAt(i) > 0x7F) {
                return false;
            }
        }
        return true;
    }
}
