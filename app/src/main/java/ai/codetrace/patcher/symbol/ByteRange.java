package ai.codetrace.patcher.symbol;

/**
 * Half-open byte span {@code [start, end)} inside a UTF-8 encoded source file.
 */
public record ByteRange(int start, int end) {

    public ByteRange {
        if (start < 0) {
            throw new IllegalArgumentException("start must be zero or greater");
        }
        if (end < start) {
            throw new IllegalArgumentException("end must not precede start");
        }
    }

    public int length() {
        return end - start;
    }

    public boolean overlaps(ByteRange other) {
        return start < other.end && other.start < end;
    }
}
