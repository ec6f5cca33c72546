package dao.fhe.csl.service;

import dao.fhe.csl.model.CiphertextHandle;

import java.math.BigInteger;
import java.util.List;

/**
 * Asynchronous decryption service. The result arrives later through
 * {@link SettlementCoordinator#onDecryptionResult}; at most one result per token is honored.
 */
public interface DecryptionOracleClient {

    /**
     * Start decrypting {@code handles}. Returns immediately with the token the callback will carry.
     */
    String requestDecryption(List<CiphertextHandle> handles);

    /**
     * Whether {@code proof} attests that {@code cleartext} is the genuine decryption for {@code token}.
     */
    boolean verifyAuthenticity(String token, BigInteger cleartext, String proof);
}
