package dk.cloudcreate.essentials.micro.kernel;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown when a collaborator factory (e.g. an {@link EventStoreFactory}) doesn't return a usable collaborator
 */
public class BadCollaboratorFactoryException extends MicroKernelException {
    public BadCollaboratorFactoryException(String factoryName, Class<?> expectedType) {
        super(msg("{} did not return an instance of {}", factoryName, expectedType.getName()));
    }
}
