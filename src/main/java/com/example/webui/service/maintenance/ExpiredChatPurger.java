package com.example.webui.service.maintenance;

/**
 * Deletes chats past their lifetime. Implemented by the persistence layer.
 * <p>
 * Implementations should delete in batches and check {@link JobContext#shouldContinue()}
 * before each batch.
 */
public interface ExpiredChatPurger {

  ChatPurgeResult purgeExpiredChats(ChatPurgeRequest request, JobContext context);
}
