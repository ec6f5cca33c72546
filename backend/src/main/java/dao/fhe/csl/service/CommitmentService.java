package dao.fhe.csl.service;

import dao.fhe.csl.config.SettlementProperties;
import dao.fhe.csl.model.CiphertextHandle;
import dao.fhe.csl.model.Contribution;
import dao.fhe.csl.util.HexUtil;
import dao.fhe.csl.util.KeccakUtil;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class CommitmentService {

    public static final int IDENTITY_LENGTH = 20;

    private final byte[] systemIdentity;

    public CommitmentService(SettlementProperties props) {
        String identity = props.getSystemIdentity();
        if (identity == null || identity.isBlank()) {
            throw new IllegalStateException("settlement.system-identity is not configured");
        }
        byte[] raw = HexUtil.fromHex(identity);
        if (raw.length != IDENTITY_LENGTH) {
            throw new IllegalStateException("settlement.system-identity must be " + IDENTITY_LENGTH + " bytes, got " + raw.length);
        }
        this.systemIdentity = raw;
    }

    /**
     * State commitment binding a settlement request to the exact handles it covers.
     * <p>
     * stateHash = keccak256(handle_0 || handle_1 || ... || handle_n-1 || systemIdentity)
     * <p>
     * Handles are 32 bytes each, packed without padding, in contribution index order.
     */
    public String stateHash(List<CiphertextHandle> orderedHandles) {
        if (orderedHandles == null || orderedHandles.isEmpty()) {
            throw new IllegalArgumentException("No handles to commit to");
        }
        byte[][] parts = new byte[orderedHandles.size() + 1][];
        for (int i = 0; i < orderedHandles.size(); i++) {
            parts[i] = orderedHandles.get(i).encoded();
        }
        parts[orderedHandles.size()] = systemIdentity.clone();
        return HexUtil.toHex0x(KeccakUtil.keccak256(KeccakUtil.concat(parts)));
    }

    public String stateHashOf(List<Contribution> contributions) {
        return stateHash(orderedHandles(contributions));
    }

    public static List<CiphertextHandle> orderedHandles(List<Contribution> contributions) {
        List<CiphertextHandle> handles = new ArrayList<>(contributions.size());
        for (Contribution c : contributions) {
            handles.add(c.getHandle());
        }
        return handles;
    }
}
