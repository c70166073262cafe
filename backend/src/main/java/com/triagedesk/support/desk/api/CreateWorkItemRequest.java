package com.triagedesk.support.desk.api;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateWorkItemRequest(
        @NotBlank(message = "channel_required") String channel,
        @Email(message = "invalid_sender_email") String sender_email,
        String sender_name,
        String sender_id,
        @NotBlank(message = "subject_required") @Size(max = 500, message = "subject_too_long") String subject,
        @NotBlank(message = "content_required") String content
) {
}
