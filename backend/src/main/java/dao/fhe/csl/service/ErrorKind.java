package dao.fhe.csl.service;

public enum ErrorKind {
    UNAUTHORIZED(403),
    PAUSED_STATE(423),
    COOLDOWN_ACTIVE(429),
    BATCH_NOT_OPEN(409),
    BATCH_ALREADY_OPEN(409),
    BATCH_NOT_CLOSED(409),
    BATCH_NOT_FOUND(404),
    EMPTY_BATCH(409),
    ALREADY_SETTLED(409),
    UNKNOWN_TOKEN(404),
    REPLAY_REJECTED(409),
    INTEGRITY_MISMATCH(422),
    INVALID_AUTHENTICITY_PROOF(401),
    INVALID_INPUT(400);

    private final int httpStatus;

    ErrorKind(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
