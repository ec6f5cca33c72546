package dao.fhe.csl.service;

import dao.fhe.csl.config.OracleProperties;
import dao.fhe.csl.event.SettlementFinalizedEvent;
import dao.fhe.csl.event.SettlementRejectedEvent;
import dao.fhe.csl.model.CiphertextHandle;
import dao.fhe.csl.util.HexUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.web3j.crypto.Hash;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.security.SignatureException;
import java.time.Clock;
import java.util.*;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Decryption oracle reached through an external relayer.
 * <p>
 * {@link #requestDecryption} queues a {@link DecryptionTask}; the relayer polls
 * {@link #pendingTasks()}, has the key-management service decrypt the handles, and posts the
 * signed result back to the settlement callback. Tasks leave the queue once their request is
 * finalized or rejected.
 * <p>
 * Authenticity proof: 65-byte r||s||v ECDSA signature, Ethereum signed-message prefix, over
 * keccak256(uint256(token) || uint256(cleartext)). Accepted iff the recovered signer is one of
 * {@code oracle.signers}.
 */
@Slf4j
@Service
public class RelayedDecryptionOracle implements DecryptionOracleClient {

    private static final int UINT256_BYTES = 32;

    private final Set<String> signers;
    private final Clock clock;
    private final AtomicLong tokenSeq = new AtomicLong(1);
    private final Map<String, DecryptionTask> tasks = new LinkedHashMap<>();

    public RelayedDecryptionOracle(OracleProperties props, Clock clock) {
        this.signers = new LinkedHashSet<>(HexUtil.normalizeActors(props.getSigners()));
        this.clock = clock;
        if (signers.isEmpty()) {
            log.warn("RelayedDecryptionOracle: no oracle.signers configured, every authenticity proof will be rejected.");
        }
        log.info("RelayedDecryptionOracle initialized: signers={}", signers);
    }

    @Override
    public synchronized String requestDecryption(List<CiphertextHandle> handles) {
        if (handles == null || handles.isEmpty()) {
            throw new IllegalArgumentException("Nothing to decrypt");
        }
        String token = String.valueOf(tokenSeq.getAndIncrement());
        List<String> hex = new ArrayList<>(handles.size());
        for (CiphertextHandle h : handles) {
            hex.add(h.toHex());
        }
        tasks.put(token, new DecryptionTask(token, List.copyOf(hex), clock.instant().getEpochSecond()));
        log.info("Decryption requested: token={}, handles={}", token, hex);
        return token;
    }

    @Override
    public boolean verifyAuthenticity(String token, BigInteger cleartext, String proof) {
        try {
            byte[] digest = authenticityDigest(token, cleartext);
            byte[] sig = HexUtil.fromHex(proof);
            if (sig.length != 65) {
                log.debug("Authenticity proof for token {} has length {}", token, sig.length);
                return false;
            }
            byte v = sig[64];
            if (v < 27) {
                v += 27;
            }
            Sign.SignatureData data = new Sign.SignatureData(
                    v,
                    Arrays.copyOfRange(sig, 0, 32),
                    Arrays.copyOfRange(sig, 32, 64)
            );
            BigInteger publicKey = Sign.signedPrefixedMessageToKey(digest, data);
            String signer = "0x" + Keys.getAddress(publicKey);
            boolean ok = signers.contains(signer.toLowerCase(Locale.ROOT));
            if (!ok) {
                log.debug("Authenticity proof for token {} signed by unknown signer {}", token, signer);
            }
            return ok;
        } catch (SignatureException | IllegalArgumentException e) {
            log.debug("Authenticity proof for token {} could not be verified: {}", token, e.getMessage());
            return false;
        }
    }

    /**
     * Digest the key-management signers sign: keccak256(uint256(token) || uint256(cleartext)).
     */
    public static byte[] authenticityDigest(String token, BigInteger cleartext) {
        BigInteger tokenValue;
        try {
            tokenValue = new BigInteger(token);
        } catch (NumberFormatException | NullPointerException e) {
            throw new IllegalArgumentException("Token is not an unsigned integer: " + token);
        }
        byte[] packed = new byte[UINT256_BYTES * 2];
        System.arraycopy(uint256ToBytes(tokenValue), 0, packed, 0, UINT256_BYTES);
        System.arraycopy(uint256ToBytes(cleartext), 0, packed, UINT256_BYTES, UINT256_BYTES);
        return Hash.sha3(packed);
    }

    public synchronized List<DecryptionTask> pendingTasks() {
        return new ArrayList<>(tasks.values());
    }

    @EventListener
    public synchronized void onSettlementFinalized(SettlementFinalizedEvent event) {
        if (tasks.remove(event.token()) != null) {
            log.debug("Decryption task {} completed", event.token());
        }
    }

    @EventListener
    public synchronized void onSettlementRejected(SettlementRejectedEvent event) {
        if (tasks.remove(event.token()) != null) {
            log.debug("Decryption task {} dropped: {}", event.token(), event.reason());
        }
    }

    private static byte[] uint256ToBytes(BigInteger value) {
        if (value == null) {
            throw new IllegalArgumentException("uint256 value is null");
        }
        if (value.signum() < 0) {
            throw new IllegalArgumentException("uint256 cannot be negative");
        }
        if (value.bitLength() > 256) {
            throw new IllegalArgumentException("uint256 value too large");
        }
        return Numeric.toBytesPadded(value, UINT256_BYTES);
    }
}
