package io.governor.util;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Zero-dependency {@link JsonCodec} for flat objects.
 */
public final class DefaultJsonCodec implements JsonCodec {
    static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

    DefaultJsonCodec() {
    }

    @Override
    public String toJson(Map<String, String> fields) {
        if (fields == null || fields.isEmpty()) {
            return "{}";
        }
        StringBuilder sb = new StringBuilder();
        sb.append('{');
        boolean first = true;
        for (Map.Entry<String, String> entry : fields.entrySet()) {
            if (entry.getKey() == null) {
                throw new IllegalArgumentException("fields cannot contain null keys");
            }
            if (entry.getValue() == null) {
                continue;
            }
            if (!first) {
                sb.append(',');
            }
            first = false;
            sb.append('"').append(escape(entry.getKey())).append("\":\"")
                    .append(escape(entry.getValue())).append('"');
        }
        return sb.append('}').toString();
    }

    @Override
    public Map<String, String> parseObject(String json) {
        if (json == null) {
            throw new IllegalArgumentException("Expected JSON object, got null");
        }
        Parser parser = new Parser(json);
        Map<String, String> result = parser.object();
        parser.skipWhitespace();
        if (!parser.atEnd()) {
            throw new IllegalArgumentException("Trailing characters after JSON object");
        }
        return result;
    }

    private static final class Parser {
        private final String input;
        private int pos;

        private Parser(String input) {
            this.input = input;
        }

        Map<String, String> object() {
            skipWhitespace();
            expect('{');
            Map<String, String> result = new LinkedHashMap<>();
            skipWhitespace();
            if (peek() == '}') {
                pos++;
                return result;
            }
            while (true) {
                skipWhitespace();
                expect('"');
                String key = string();
                skipWhitespace();
                expect(':');
                skipWhitespace();
                String value = scalar();
                if (value != null) {
                    result.put(key, value);
                }
                skipWhitespace();
                char next = next();
                if (next == '}') {
                    return result;
                }
                if (next != ',') {
                    throw new IllegalArgumentException("Expected ',' or '}' at " + (pos - 1));
                }
            }
        }

        private String scalar() {
            char c = peek();
            if (c == '"') {
                pos++;
                return string();
            }
            if (input.startsWith("null", pos)) {
                pos += 4;
                return null;
            }
            if (input.startsWith("true", pos)) {
                pos += 4;
                return "true";
            }
            if (input.startsWith("false", pos)) {
                pos += 5;
                return "false";
            }
            if (c == '-' || Character.isDigit(c)) {
                int start = pos;
                while (!atEnd() && "+-.eE0123456789".indexOf(input.charAt(pos)) >= 0) {
                    pos++;
                }
                return input.substring(start, pos);
            }
            throw new IllegalArgumentException("Unsupported JSON value at " + pos);
        }

        private String string() {
            StringBuilder sb = new StringBuilder();
            while (true) {
                char c = next();
                if (c == '"') {
                    return sb.toString();
                }
                if (c != '\\') {
                    sb.append(c);
                    continue;
                }
                char esc = next();
                switch (esc) {
                    case '"', '\\', '/' -> sb.append(esc);
                    case 'b' -> sb.append('\b');
                    case 'f' -> sb.append('\f');
                    case 'n' -> sb.append('\n');
                    case 'r' -> sb.append('\r');
                    case 't' -> sb.append('\t');
                    case 'u' -> {
                        if (pos + 4 > input.length()) {
                            throw new IllegalArgumentException("Invalid unicode escape");
                        }
                        try {
                            sb.append((char) Integer.parseInt(input.substring(pos, pos + 4), 16));
                        } catch (NumberFormatException e) {
                            throw new IllegalArgumentException("Invalid unicode escape", e);
                        }
                        pos += 4;
                    }
                    default -> throw new IllegalArgumentException("Unsupported escape sequence: \\" + esc);
                }
            }
        }

        void skipWhitespace() {
            while (!atEnd() && Character.isWhitespace(input.charAt(pos))) {
                pos++;
            }
        }

        boolean atEnd() {
            return pos >= input.length();
        }

        private char peek() {
            if (atEnd()) {
                throw new IllegalArgumentException("Unexpected end of JSON");
            }
            return input.charAt(pos);
        }

        private char next() {
            char c = peek();
            pos++;
            return c;
        }

        private void expect(char expected) {
            char c = next();
            if (c != expected) {
                throw new IllegalArgumentException("Expected '" + expected + "' at " + (pos - 1));
            }
        }
    }

    private static String escape(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.toString();
    }
}
