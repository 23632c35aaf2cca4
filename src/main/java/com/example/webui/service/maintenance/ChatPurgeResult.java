package com.example.webui.service.maintenance;

public record ChatPurgeResult(long chatsDeleted, long messagesDeleted) {}
