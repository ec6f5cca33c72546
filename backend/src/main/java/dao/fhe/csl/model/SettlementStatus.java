package dao.fhe.csl.model;

public enum SettlementStatus {
    /** Decryption requested, no callback honored yet. */
    REQUESTED,
    /** Callback verified and applied. Terminal. */
    FINALIZED,
    /** Batch no longer matches the commitment, or was settled through another token. Terminal. */
    REJECTED
}
