package ai.codetrace.patcher.store;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Identity of a symbol inside a run: the file it lives in and its name.
 */
public record SymbolKey(String filePath, String symbolName) {

    public SymbolKey {
        Objects.requireNonNull(filePath, "filePath");
        Objects.requireNonNull(symbolName, "symbolName");
    }

    /**
     * Full-path form {@code /abs/path/to/file/symbol} used by skip rules, resolved against {@code baseDirectory}.
     */
    public String fullPath(Path baseDirectory) {
        Path absolute = baseDirectory.resolve(filePath).toAbsolutePath().normalize();
        return absolute.toString().replace('\\', '/') + "/" + symbolName;
    }

    @Override
    public String toString() {
        return filePath + "/" + symbolName;
    }
}
