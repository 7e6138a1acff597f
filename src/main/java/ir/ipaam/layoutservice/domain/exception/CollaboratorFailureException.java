package ir.ipaam.layoutservice.domain.exception;

/**
 * A font-metrics or hyphenation collaborator failed. Never retried.
 */
public class CollaboratorFailureException extends LayoutException {

    private final String collaborator;

    public CollaboratorFailureException(String collaborator, String message, Throwable cause) {
        super(collaborator + " failed: " + message, cause);
        this.collaborator = collaborator;
    }

    public String getCollaborator() {
        return collaborator;
    }
}
