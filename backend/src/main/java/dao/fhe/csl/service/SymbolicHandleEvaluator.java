package dao.fhe.csl.service;

import dao.fhe.csl.model.CiphertextHandle;
import dao.fhe.csl.util.KeccakUtil;
import org.springframework.stereotype.Service;

/**
 * Derives result handles symbolically, the way a coprocessor-backed FHE runtime does:
 * the handle of {@code a + b} is a digest of the operation and its operands, and the
 * coprocessor later resolves it to the actual ciphertext.
 * <p>
 * handle(a + b) = keccak256(OP_ADD || min(a, b) || max(a, b))
 * <p>
 * Operands are sorted, so the result does not depend on argument order.
 */
@Service
public class SymbolicHandleEvaluator implements HomomorphicEvaluator {

    static final byte OP_ADD = 0x01;

    @Override
    public CiphertextHandle add(CiphertextHandle a, CiphertextHandle b) {
        if (a == null || b == null) {
            throw new IllegalArgumentException("add requires two handles");
        }
        byte[] left = a.encoded();
        byte[] right = b.encoded();
        byte[] op = new byte[]{ OP_ADD };

        byte[] packed = KeccakUtil.compareBytes(left, right) <= 0
                ? KeccakUtil.concat(op, left, right)
                : KeccakUtil.concat(op, right, left);
        return CiphertextHandle.of(KeccakUtil.keccak256(packed));
    }
}
