package io.agenthub.error;

public class HubException extends RuntimeException {
    private final ErrorKind kind;

    public HubException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public HubException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
