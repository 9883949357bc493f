package dk.cloudcreate.essentials.micro.kernel;

/**
 * Base exception for the failures detected by the kernel itself (as opposed to failures
 * reported by the event store or snapshot store collaborators)
 */
public class MicroKernelException extends RuntimeException {
    public MicroKernelException(String message) {
        super(message);
    }

    public MicroKernelException(String message, Throwable cause) {
        super(message, cause);
    }
}
