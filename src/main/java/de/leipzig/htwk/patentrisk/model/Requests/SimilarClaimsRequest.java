package de.leipzig.htwk.patentrisk.model.Requests;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;

@Data
public class SimilarClaimsRequest {

    @NotBlank(message = "Claim text is required")
    private String claimText;

    @Positive(message = "Limit must be positive")
    private Integer limit;

    private String excludePatentId;
}
