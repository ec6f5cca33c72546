package dao.fhe.csl.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

@Data
public class ContributionRequest {

    @NotNull
    @PositiveOrZero
    private Long cost;

    @NotNull
    @PositiveOrZero
    private Long budget;

    @NotBlank
    private String handle;          // 0x-prefixed 32-byte hex
}
