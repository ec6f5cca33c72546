package dao.fhe.csl.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

import java.math.BigInteger;

@Data
public class DecryptionCallbackRequest {

    @NotBlank
    private String token;

    @NotNull
    @PositiveOrZero
    private BigInteger cleartext;

    @NotBlank
    private String proof;           // 0x-prefixed r||s||v signature
}
