package io.penguin.metrics.config;

import java.util.regex.Pattern;

/**
 * Shell-style wildcard pattern ({@code *}, {@code ?}, {@code [abc]}, {@code [!abc]}) matched
 * against a whole name, as used by auto-discovery {@code filter} and {@code exclude}.
 */
public final class Glob {

    private final String pattern;
    private final Pattern regex;

    private Glob(String pattern) {
        this.pattern = pattern;
        this.regex = Pattern.compile(toRegex(pattern), Pattern.DOTALL);
    }

    public static Glob of(String pattern) {
        return new Glob(pattern);
    }

    public boolean matches(String name) {
        return name != null && regex.matcher(name).matches();
    }

    public String pattern() {
        return pattern;
    }

    static String toRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i++);
            switch (c) {
                case '*' -> regex.append(".*");
                case '?' -> regex.append('.');
                case '[' -> {
                    int close = glob.indexOf(']', i + 1);
                    if (close < 0) {
                        regex.append("\\[");
                        break;
                    }
                    String body = glob.substring(i, close);
                    i = close + 1;
                    regex.append('[');
                    if (body.startsWith("!")) {
                        regex.append('^');
                        body = body.substring(1);
                    }
                    regex.append(body.replace("\\", "\\\\").replace("[", "\\["));
                    regex.append(']');
                }
                default -> regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return regex.toString();
    }

    @Override
    public String toString() {
        return pattern;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Glob other && other.pattern.equals(pattern);
    }

    @Override
    public int hashCode() {
        return pattern.hashCode();
    }
}
