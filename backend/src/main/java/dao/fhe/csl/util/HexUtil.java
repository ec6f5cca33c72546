package dao.fhe.csl.util;

import org.web3j.utils.Numeric;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Hex and identity helpers shared by the guard, commitments and the oracle client.
 */
public final class HexUtil {
    private HexUtil() {}

    public static String toHex0x(byte[] bytes) {
        return Numeric.toHexString(bytes);
    }

    public static byte[] fromHex(String hex) {
        if (hex == null || hex.isBlank()) {
            throw new IllegalArgumentException("Hex value is empty");
        }
        String clean = cleanHex(hex.trim());
        if (clean.length() % 2 != 0 || !clean.matches("[0-9a-fA-F]*")) {
            throw new IllegalArgumentException("Malformed hex value: " + hex);
        }
        return Numeric.hexStringToByteArray(clean);
    }

    public static String cleanHex(String value) {
        if (value == null) return "";
        return (value.startsWith("0x") || value.startsWith("0X"))
                ? value.substring(2)
                : value;
    }

    /**
     * Canonical form of an actor identity: trimmed, lower-case, 0x-prefixed.
     * Returns null for null/blank input.
     */
    public static String normalizeActor(String actor) {
        if (actor == null || actor.isBlank()) return null;
        String s = actor.trim().toLowerCase(Locale.ROOT);
        return s.startsWith("0x") ? s : "0x" + s;
    }

    /**
     * Spring may bind a list property either as a real list or as a single comma-separated
     * string (e.g. from env). Flatten, trim, drop empties and normalize each entry.
     */
    public static List<String> normalizeActors(List<String> configured) {
        List<String> out = new ArrayList<>();
        if (configured == null) return out;
        for (String entry : configured) {
            if (entry == null) continue;
            for (String part : entry.split(",")) {
                String p = normalizeActor(part);
                if (p != null && !out.contains(p)) out.add(p);
            }
        }
        return out;
    }
}
