package dao.fhe.csl.service;

import dao.fhe.csl.model.CiphertextHandle;

/**
 * Homomorphic composition of ciphertext handles, provided by the computation backend.
 * Implementations must be pure: the same operands always yield the same handle.
 */
public interface HomomorphicEvaluator {

    CiphertextHandle add(CiphertextHandle a, CiphertextHandle b);
}
