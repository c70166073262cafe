package com.triagedesk.support.desk.api;

import jakarta.validation.constraints.NotBlank;

public record UpdateStatusRequest(
        @NotBlank(message = "status_required") String status,
        String actor_id
) {
}
