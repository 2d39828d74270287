package ai.codetrace.patcher.apply;

import ai.codetrace.patcher.store.Checksums;
import ai.codetrace.patcher.store.TransformationRecord;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Symbols excluded from application. Rules containing {@code /} are full paths (relative ones are
 * resolved against the project root); any other rule matches a symbol name in every file. Both
 * forms accept shell-style wildcards. Checksums are matched as 8-digit lowercase hex.
 */
public final class SkipSet {

    private static final Logger LOGGER = LoggerFactory.getLogger(SkipSet.class);

    private final Path projectRoot;
    private final List<Rule> fullPathRules;
    private final List<Rule> nameRules;
    private final Set<String> checksums;

    private SkipSet(Path projectRoot, List<Rule> fullPathRules, List<Rule> nameRules, Set<String> checksums) {
        this.projectRoot = projectRoot;
        this.fullPathRules = List.copyOf(fullPathRules);
        this.nameRules = List.copyOf(nameRules);
        this.checksums = Set.copyOf(checksums);
    }

    public static SkipSet empty(Path projectRoot) {
        return of(projectRoot, List.of(), List.of());
    }

    public static SkipSet of(Path projectRoot, Collection<String> rules, Collection<String> crc32Values) {
        Path root = Objects.requireNonNull(projectRoot, "projectRoot").toAbsolutePath().normalize();
        List<Rule> fullPath = new ArrayList<>();
        List<Rule> names = new ArrayList<>();
        for (String raw : rules == null ? List.<String>of() : rules) {
            if (raw == null || raw.isBlank()) {
                LOGGER.warn("Ignoring blank skip rule");
                continue;
            }
            String rule = raw.trim();
            boolean hasPath = rule.contains("/");
            String normalized = hasPath ? toFullPath(root, rule) : "*/" + rule;
            Optional<Pattern> pattern = compileGlob(normalized);
            if (pattern.isEmpty()) {
                LOGGER.warn("Ignoring malformed skip rule '{}'", rule);
                continue;
            }
            (hasPath ? fullPath : names).add(new Rule(rule, pattern.get()));
        }
        Set<String> hexes = new LinkedHashSet<>();
        for (String raw : crc32Values == null ? List.<String>of() : crc32Values) {
            normalizeHex(raw).ifPresentOrElse(hexes::add,
                    () -> LOGGER.warn("Ignoring malformed CRC32 skip value '{}'", raw));
        }
        return new SkipSet(root, fullPath, names, hexes);
    }

    /**
     * Returns the rule that excludes the record, described as it should appear in a skip reason.
     */
    public Optional<String> match(TransformationRecord record) {
        String fullPath = record.key().fullPath(projectRoot);
        for (Rule rule : fullPathRules) {
            if (rule.pattern().matcher(fullPath).matches()) {
                return Optional.of(rule.raw());
            }
        }
        for (Rule rule : nameRules) {
            if (rule.pattern().matcher(fullPath).matches()) {
                return Optional.of(rule.raw());
            }
        }
        String hex = Checksums.toHex(record.checksum());
        if (checksums.contains(hex)) {
            return Optional.of("crc32:" + hex);
        }
        return Optional.empty();
    }

    public boolean isEmpty() {
        return fullPathRules.isEmpty() && nameRules.isEmpty() && checksums.isEmpty();
    }

    static String toFullPath(Path root, String rule) {
        String slashed = rule.replace('\\', '/');
        if (slashed.startsWith("./")) {
            slashed = slashed.substring(2);
        }
        if (slashed.startsWith("/") || slashed.matches("^[A-Za-z]:/.*")) {
            return slashed;
        }
        return root.toString().replace('\\', '/') + "/" + slashed;
    }

    static Optional<String> normalizeHex(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        if (value.startsWith("0x")) {
            value = value.substring(2);
        }
        if (value.isEmpty() || value.length() > 8 || !value.matches("[0-9a-f]+")) {
            return Optional.empty();
        }
        return Optional.of("0".repeat(8 - value.length()) + value);
    }

    /**
     * Translates an fnmatch-style glob to a regex: {@code *} and {@code ?} also cross {@code /}.
     * An unterminated character class makes the glob malformed.
     */
    static Optional<Pattern> compileGlob(String glob) {
        StringBuilder regex = new StringBuilder();
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i++);
            if (c == '*') {
                regex.append(".*");
            } else if (c == '?') {
                regex.append('.');
            } else if (c == '[') {
                int close = glob.indexOf(']', i + 1);
                if (close < 0) {
                    return Optional.empty();
                }
                String body = glob.substring(i, close);
                i = close + 1;
                StringBuilder cls = new StringBuilder("[");
                int j = 0;
                if (body.startsWith("!")) {
                    cls.append('^');
                    j = 1;
                }
                for (; j < body.length(); j++) {
                    char b = body.charAt(j);
                    if (b == '\\' || b == '[' || b == ']' || b == '^' || b == '&') {
                        cls.append('\\');
                    }
                    cls.append(b);
                }
                regex.append(cls).append(']');
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Optional.of(Pattern.compile(regex.toString(), Pattern.DOTALL));
    }

    private record Rule(String raw, Pattern pattern) {
    }
}
