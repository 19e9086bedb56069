package com.nosota.mescrow.api.request;

import com.nosota.mescrow.api.model.Status;
import jakarta.validation.constraints.NotNull;

/**
 * A participant's vote. Only ACCEPTED and REJECTED are valid vote values.
 *
 * @param status Side the caller votes for
 */
public record ReviewRequest(
        @NotNull(message = "Status is required")
        Status status
) {
}
