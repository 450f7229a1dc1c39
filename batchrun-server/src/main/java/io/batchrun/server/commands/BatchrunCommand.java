package io.batchrun.server.commands;

import io.batchrun.core.exception.BatchrunException;
import java.util.concurrent.Callable;

/// Minimal abstract base for all batch-run commands.
///
/// Owns the {@link #call()} / {@link #execute()} contract: validation failures and
/// unknown identifiers are reported on stderr with exit code {@link #EXIT_FAILURE}
/// instead of a stack trace.
public abstract class BatchrunCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_INTERRUPTED = 130;

    @Override
    public final Integer call() {
        try {
            return execute();
        } catch (BatchrunException | IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            System.err.println("Interrupted");
            return EXIT_INTERRUPTED;
        }
    }

    /// @return the process exit code
    /// @throws InterruptedException if interrupted while waiting
    protected abstract int execute() throws InterruptedException;
}
