package dao.fhe.csl.model;

import dao.fhe.csl.util.HexUtil;

import java.util.Arrays;

/**
 * Opaque reference to an encrypted value.
 * <p>
 * The settlement core never looks inside a handle: it only composes handles through a
 * {@link dao.fhe.csl.service.HomomorphicEvaluator}, compares them, and feeds their 32-byte
 * encoding into commitments.
 */
public final class CiphertextHandle {

    public static final int LENGTH = 32;

    private final byte[] value;

    private CiphertextHandle(byte[] value) {
        this.value = value;
    }

    public static CiphertextHandle of(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("Ciphertext handle must be " + LENGTH + " bytes");
        }
        return new CiphertextHandle(bytes.clone());
    }

    public static CiphertextHandle fromHex(String hex) {
        return of(HexUtil.fromHex(hex));
    }

    /**
     * Encoding used for hashing. Always a fresh copy.
     */
    public byte[] encoded() {
        return value.clone();
    }

    public String toHex() {
        return HexUtil.toHex0x(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CiphertextHandle)) return false;
        return Arrays.equals(value, ((CiphertextHandle) o).value);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
