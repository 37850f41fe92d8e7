package io.hearthwarrio.autoapply.core.session;

public class JobQueueException extends RuntimeException {

    public JobQueueException(String message) {
        super(message);
    }

    public JobQueueException(String message, Throwable cause) {
        super(message, cause);
    }
}
