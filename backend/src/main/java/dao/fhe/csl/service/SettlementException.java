package dao.fhe.csl.service;

import lombok.Getter;

/**
 * Raised by every rejected operation. Thrown before any state is touched, so callers can
 * fix the precondition named by {@link #getKind()} and retry with a new call. The one
 * exception is a decryption callback that rejects its settlement request for good; that
 * request is then recorded as REJECTED.
 */
@Getter
public class SettlementException extends RuntimeException {

    private final ErrorKind kind;

    public SettlementException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public SettlementException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
