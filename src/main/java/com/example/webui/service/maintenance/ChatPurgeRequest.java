package com.example.webui.service.maintenance;

/**
 * Which chats an automated cleanup may delete.
 */
public record ChatPurgeRequest(
    int maxAgeDays,
    boolean preservePinned,
    boolean preserveArchived
) {}
