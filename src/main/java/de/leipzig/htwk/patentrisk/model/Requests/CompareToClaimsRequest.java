package de.leipzig.htwk.patentrisk.model.Requests;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class CompareToClaimsRequest {

    @NotBlank(message = "Invention description is required")
    private String inventionDescription;

    @NotBlank(message = "Patent ID is required")
    private String patentId;
}
