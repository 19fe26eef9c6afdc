package com.marketloop.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Body of a recommendation denial. The reason is kept on the recommendation. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DenyRequest {

    @NotBlank
    private String reason;
}
