package com.github.stormino.relay.model;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One object to relay, as submitted by a client.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TransferRequest {

    @NotBlank
    private String url;

    /**
     * Original file name on the source; only its extension is used.
     */
    private String originalFilename;
}
