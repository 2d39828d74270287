package ai.codetrace.patcher.verify;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds which of the verified files a tool's output blames, from {@code path:line[:column]} locations.
 */
final class ErrorLocationParser {

    private static final Pattern LOCATION = Pattern.compile("([^\\s:'\"()\\[\\]<>,]+):(\\d+)(?::\\d+)?");

    private ErrorLocationParser() {
    }

    /**
     * Returns the candidates named in the output, or every candidate when none is named.
     */
    static List<String> implicated(String output, List<String> candidates, Path projectRoot) {
        Set<String> found = new LinkedHashSet<>();
        Matcher matcher = LOCATION.matcher(output == null ? "" : output);
        while (matcher.find()) {
            String location = matcher.group(1);
            for (String candidate : candidates) {
                if (matches(location, candidate, projectRoot)) {
                    found.add(candidate);
                }
            }
        }
        return found.isEmpty() ? List.copyOf(candidates) : List.copyOf(found);
    }

    private static boolean matches(String location, String candidate, Path projectRoot) {
        try {
            Path reported = Path.of(location).normalize();
            Path absolute = projectRoot.resolve(candidate).toAbsolutePath().normalize();
            if (reported.isAbsolute()) {
                return reported.equals(absolute);
            }
            return !reported.toString().isEmpty() && absolute.endsWith(reported);
        } catch (InvalidPathException ex) {
            return false;
        }
    }
}
