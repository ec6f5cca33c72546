package dao.fhe.csl.util;

import org.bouncycastle.jcajce.provider.digest.Keccak;

public final class KeccakUtil {
    private KeccakUtil() {}

    public static byte[] keccak256(byte[] data) {
        Keccak.Digest256 digest = new Keccak.Digest256();
        digest.update(data, 0, data.length);
        return digest.digest();
    }

    public static byte[] concat(byte[]... parts) {
        int len = 0;
        for (byte[] p : parts) len += p.length;
        byte[] out = new byte[len];
        int pos = 0;
        for (byte[] p : parts) {
            System.arraycopy(p, 0, out, pos, p.length);
            pos += p.length;
        }
        return out;
    }

    public static int compareBytes(byte[] a, byte[] b) {
        int len = Math.min(a.length, b.length);
        for (int i = 0; i < len; i++) {
            int ai = a[i] & 0xff;
            int bi = b[i] & 0xff;
            if (ai != bi) return ai - bi;
        }
        return a.length - b.length;
    }
}
