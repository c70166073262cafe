package com.triagedesk.support.desk.api;

import jakarta.validation.constraints.NotBlank;

public record EscalateRequest(
        @NotBlank(message = "work_item_id_required") String work_item_id,
        @NotBlank(message = "reason_required") String reason,
        String target_agent_id
) {
}
