package ai.codetrace.patcher.symbol;

import java.nio.file.Path;
import java.util.List;

/**
 * Source of symbol boundaries for a file. Results are treated as ground truth.
 */
@FunctionalInterface
public interface SymbolExtractor {

    List<SymbolSpan> extract(Path file);
}
