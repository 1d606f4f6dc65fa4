package com.github.stormino.relay.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BatchTransferRequest {

    /**
     * Series or collection the episodes belong to.
     */
    private String groupContext;

    @NotEmpty
    private List<@Valid TransferRequest> episodes;
}
