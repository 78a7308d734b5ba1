package io.github.manjago.netscript.engine;

/**
 * Completes a process's completion future exceptionally.
 */
public class ProcessFailedException extends RuntimeException {

    private final transient ProcessFailure failure;

    public ProcessFailedException(ProcessFailure failure) {
        super(failure.toString(), null, false, false);
        this.failure = failure;
    }

    public ProcessFailure getFailure() {
        return failure;
    }
}
