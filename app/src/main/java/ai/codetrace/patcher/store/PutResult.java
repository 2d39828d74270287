package ai.codetrace.patcher.store;

/**
 * Outcome of {@link TransformationStore#put(TransformationRecord)}; rejected records carry a reason.
 */
public record PutResult(boolean accepted, String reason, TransformationRecord record) {

    static PutResult accepted(TransformationRecord record) {
        return new PutResult(true, null, record);
    }

    static PutResult rejected(String reason, TransformationRecord record) {
        return new PutResult(false, reason, record);
    }
}
