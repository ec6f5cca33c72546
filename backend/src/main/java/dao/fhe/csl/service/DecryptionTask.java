package dao.fhe.csl.service;

import java.util.List;

/**
 * Work item handed to the external relayer: decrypt these handles and call back with {@code token}.
 */
public record DecryptionTask(
        String token,
        List<String> handles,
        long requestedAt
) {}
