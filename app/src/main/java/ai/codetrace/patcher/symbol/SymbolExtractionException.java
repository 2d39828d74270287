package ai.codetrace.patcher.symbol;

/**
 * Raised when the symbol index for a file cannot be read.
 */
public class SymbolExtractionException extends RuntimeException {

    public SymbolExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
