package com.triagedesk.support.desk.model;

public record NewWorkItem(
        Channel channel,
        String senderEmail,
        String senderName,
        String senderId,
        String subject,
        String content
) {
}
