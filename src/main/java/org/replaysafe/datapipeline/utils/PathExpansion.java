package org.replaysafe.datapipeline.utils;

/**
 * Expands {@code ${VAR}} placeholders in configured paths and JDBC URLs.
 * <p>
 * Java system properties are checked first, then environment variables, so
 * {@code -Duser.home=...} style overrides win over the environment.
 * <pre>
 * expandPath("jdbc:h2:${user.home}/replaysafe/merge")  → "jdbc:h2:/home/user/replaysafe/merge"
 * expandPath("${DATA_DIR}/events.jsonl")                → "/var/lib/replaysafe/events.jsonl"
 * </pre>
 */
public final class PathExpansion {

    private PathExpansion() {
        // utility class
    }

    /**
     * @param path A string possibly containing {@code ${VAR}} placeholders, may be {@code null}.
     * @return The string with all placeholders replaced.
     * @throws IllegalArgumentException if a placeholder is unclosed or refers to an undefined variable.
     */
    public static String expandPath(String path) {
        if (path == null || !path.contains("${")) {
            return path;
        }

        StringBuilder result = new StringBuilder();
        int pos = 0;
        while (pos < path.length()) {
            int startVar = path.indexOf("${", pos);
            if (startVar == -1) {
                result.append(path, pos, path.length());
                break;
            }
            result.append(path, pos, startVar);

            int endVar = path.indexOf('}', startVar + 2);
            if (endVar == -1) {
                throw new IllegalArgumentException("Unclosed variable in path: " + path);
            }

            String varName = path.substring(startVar + 2, endVar);
            String value = resolveVariable(varName);
            if (value == null) {
                throw new IllegalArgumentException("Undefined variable '${" + varName + "}' in path: " + path
                        + ". Define it as system property or environment variable.");
            }
            result.append(value);
            pos = endVar + 1;
        }
        return result.toString();
    }

    private static String resolveVariable(String varName) {
        String value = System.getProperty(varName);
        return value != null ? value : System.getenv(varName);
    }
}
