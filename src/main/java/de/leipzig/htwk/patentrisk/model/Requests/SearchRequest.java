package de.leipzig.htwk.patentrisk.model.Requests;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;

@Data
public class SearchRequest {

    @NotBlank(message = "Query is required")
    private String query;

    @Positive(message = "Limit must be positive")
    private Integer limit;

    // Clamped to [0,1], never rejected
    private Double vectorWeight;
}
