package ai.codetrace.patcher.verify;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes apply-and-verify stages when the verification command inspects the whole tree, since
 * such a command would otherwise observe the in-flight edits of other files.
 */
public final class VerificationGate {

    private final ReentrantLock lock = new ReentrantLock(true);
    private final boolean exclusive;

    public VerificationGate(boolean exclusive) {
        this.exclusive = exclusive;
    }

    public static VerificationGate forCommand(String verifyCommand) {
        boolean treeWide = verifyCommand != null && !verifyCommand.isBlank()
                && !verifyCommand.contains(Verifier.FILES_PLACEHOLDER);
        return new VerificationGate(treeWide);
    }

    public boolean isExclusive() {
        return exclusive;
    }

    public <T> T run(Supplier<T> stage) {
        if (!exclusive) {
            return stage.get();
        }
        lock.lock();
        try {
            return stage.get();
        } finally {
            lock.unlock();
        }
    }
}
