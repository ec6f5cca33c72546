package dao.fhe.csl.model;

import lombok.Value;

@Value
public class Contribution {

    long batchId;
    /** Zero-based append position inside the owning batch. */
    int index;
    String provider;
    CiphertextHandle handle;
    long cost;
    long budget;
    long submittedAt; // unix seconds
}
