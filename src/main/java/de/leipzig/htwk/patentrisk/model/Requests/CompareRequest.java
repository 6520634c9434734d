package de.leipzig.htwk.patentrisk.model.Requests;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class CompareRequest {

    @NotBlank(message = "Source patent ID is required")
    private String sourcePatentId;

    @NotBlank(message = "Target patent ID is required")
    private String targetPatentId;
}
