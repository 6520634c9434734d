package de.leipzig.htwk.patentrisk.model.Requests;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;

@Data
public class PriorArtSearchRequest {

    @NotBlank(message = "Invention description is required")
    private String inventionDescription;

    @Positive(message = "Limit must be positive")
    private Integer limit;

    private Boolean includeAnalysis = Boolean.TRUE;
}
