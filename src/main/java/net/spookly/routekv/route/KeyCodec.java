package net.spookly.routekv.route;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Maps routespecs and targets to flat key paths and back.
 * <p>
 * Escaping keeps {@code [A-Za-z0-9]} as is and writes every other character as its UTF-8
 * bytes, each one as {@code _} followed by two upper-case hex digits. The separator {@code /}
 * and the escape character itself are never left unescaped, so an escaped segment can be
 * joined into a key path and split back without ambiguity. Every process reading the same
 * store must use the same scheme; bump {@link #SCHEME_VERSION} if it ever changes.
 */
public final class KeyCodec {
    public static final int SCHEME_VERSION = 1;
    public static final String SEPARATOR = "/";
    public static final char ESCAPE_CHAR = '_';

    static final String ROUTES = "routes";
    static final String TARGETS = "targets";

    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private KeyCodec() {
    }

    /**
     * Escape one key segment.
     *
     * @throws IllegalArgumentException if the value holds an unpaired surrogate, which has no
     *                                  UTF-8 encoding
     */
    public static String escape(String value) {
        StringBuilder builder = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); ) {
            int codePoint = value.codePointAt(i);
            int width = Character.charCount(codePoint);
            if (Character.isSurrogate((char) codePoint) && width == 1) {
                throw new IllegalArgumentException("Unpaired surrogate at offset " + i + " in: " + value);
            }
            if (isSafe(codePoint)) {
                builder.append((char) codePoint);
            } else {
                byte[] encoded = value.substring(i, i + width).getBytes(StandardCharsets.UTF_8);
                for (byte b : encoded) {
                    builder.append(ESCAPE_CHAR)
                            .append(HEX[(b >> 4) & 0x0F])
                            .append(HEX[b & 0x0F]);
                }
            }
            i += width;
        }
        return builder.toString();
    }

    /**
     * Reverse {@link #escape(String)}.
     *
     * @throws DecodeException if the segment was not produced by {@code escape}
     */
    public static String unescape(String segment) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(segment.length());
        int i = 0;
        while (i < segment.length()) {
            char c = segment.charAt(i);
            if (c == ESCAPE_CHAR) {
                if (i + 2 >= segment.length()) {
                    throw new DecodeException("Dangling escape at offset " + i + " in: " + segment);
                }
                int high = hexValue(segment.charAt(i + 1));
                int low = hexValue(segment.charAt(i + 2));
                if (high < 0 || low < 0) {
                    throw new DecodeException("Malformed escape at offset " + i + " in: " + segment);
                }
                bytes.write((high << 4) | low);
                i += 3;
                continue;
            }
            if (!isSafe(c)) {
                throw new DecodeException("Unescaped character '" + c + "' at offset " + i + " in: " + segment);
            }
            bytes.write(c);
            i++;
        }
        return decodeUtf8(bytes.toByteArray(), "escaped segment " + segment);
    }

    /**
     * Decode a stored value as strict UTF-8.
     *
     * @throws DecodeException if the bytes are not valid UTF-8
     */
    public static String decodeValue(byte[] value, String key) {
        return decodeUtf8(value, "value of " + key);
    }

    public static String join(String... segments) {
        return String.join(SEPARATOR, segments);
    }

    public static String routeKey(String jupyterhubPrefix, String routespec) {
        return join(jupyterhubPrefix, ROUTES, escape(routespec));
    }

    public static String targetKey(String jupyterhubPrefix, String target) {
        return join(jupyterhubPrefix, TARGETS, escape(target));
    }

    /**
     * Prefix shared by every route key, including the trailing separator.
     */
    public static String routesPrefix(String jupyterhubPrefix) {
        return join(jupyterhubPrefix, ROUTES) + SEPARATOR;
    }

    public static String targetsPrefix(String jupyterhubPrefix) {
        return join(jupyterhubPrefix, TARGETS) + SEPARATOR;
    }

    /**
     * Recover the routespec from a route key and locate the data key of its target.
     *
     * @throws DecodeException if the key is not a route key under the prefix
     */
    public static DecodedRoute decodeRouteEntry(String rawKey, byte[] rawValue, String jupyterhubPrefix) {
        String prefix = routesPrefix(jupyterhubPrefix);
        if (rawKey == null || !rawKey.startsWith(prefix)) {
            throw new DecodeException("Key is not under " + prefix + ": " + rawKey);
        }
        String escapedRoutespec = rawKey.substring(prefix.length());
        if (escapedRoutespec.isEmpty()) {
            throw new DecodeException("Route key has an empty routespec: " + rawKey);
        }
        String routespec = unescape(escapedRoutespec);
        String target = decodeValue(rawValue, rawKey);
        return new DecodedRoute(routespec, target, targetKey(jupyterhubPrefix, target));
    }

    private static boolean isSafe(int codePoint) {
        return (codePoint >= 'a' && codePoint <= 'z')
                || (codePoint >= 'A' && codePoint <= 'Z')
                || (codePoint >= '0' && codePoint <= '9');
    }

    private static int hexValue(char c) {
        if (c >= '0' && c <= '9') {
            return c - '0';
        }
        if (c >= 'A' && c <= 'F') {
            return c - 'A' + 10;
        }
        return -1;
    }

    private static String decodeUtf8(byte[] bytes, String source) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            throw new DecodeException("Invalid UTF-8 in " + source, e);
        }
    }

    /**
     * Routespec and target recovered from a route key, plus the key holding the target's data.
     */
    public record DecodedRoute(String routespec, String target, String targetKey) {
    }
}
