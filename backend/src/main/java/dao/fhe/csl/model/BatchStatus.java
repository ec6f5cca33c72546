package dao.fhe.csl.model;

public enum BatchStatus {
    OPEN,
    CLOSED
}
