package dao.fhe.csl.model;

import java.util.List;

public record RegistrySnapshot(
        String admin,
        List<String> providers,
        List<String> relayers,
        boolean paused,
        long cooldownSeconds
) {}
