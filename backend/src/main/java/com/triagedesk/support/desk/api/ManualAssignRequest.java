package com.triagedesk.support.desk.api;

import jakarta.validation.constraints.NotBlank;

public record ManualAssignRequest(
        @NotBlank(message = "work_item_id_required") String work_item_id,
        @NotBlank(message = "agent_id_required") String agent_id,
        String actor_id
) {
}
