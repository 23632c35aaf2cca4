package com.example.webui.service.maintenance;

import com.example.webui.properties.ApplicationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * Deletes chats older than the configured lifetime. Scheduled daily; guarded by the
 * {@code chat_cleanup_job} lock so only one instance purges at a time.
 */
@Slf4j
@Component
public class ChatLifetimeCleanupJob {

  public static final String JOB_ID = "chat_lifetime_cleanup";

  private final MaintenanceJobRunner jobRunner;
  private final ObjectProvider<ExpiredChatPurger> purgerProvider;
  private final ApplicationProperties.MaintenanceProperties.ChatCleanupProperties settings;

  public ChatLifetimeCleanupJob(MaintenanceJobRunner jobRunner,
                                ObjectProvider<ExpiredChatPurger> purgerProvider,
                                ApplicationProperties properties) {
    this.jobRunner = jobRunner;
    this.purgerProvider = purgerProvider;
    this.settings = properties.maintenance().chatCleanup();
  }

  public JobOutcome run() {
    if (!settings.enabled()) {
      log.info("Chat lifetime is disabled - skipping automated cleanup");
      return JobOutcome.SKIPPED_DISABLED;
    }

    ExpiredChatPurger purger = purgerProvider.getIfAvailable();
    if (purger == null) {
      log.warn("No chat purger is registered - skipping automated cleanup");
      return JobOutcome.SKIPPED_DISABLED;
    }

    ChatPurgeRequest request = new ChatPurgeRequest(
        settings.lifetimeDays(), settings.preservePinned(), settings.preserveArchived());
    log.info("Starting automated chat cleanup (age > {} days, preservePinned={}, preserveArchived={})",
             request.maxAgeDays(), request.preservePinned(), request.preserveArchived());

    return jobRunner.run(JOB_ID, settings.lockName(), context -> {
      ChatPurgeResult result = purger.purgeExpiredChats(request, context);
      log.info("Automated chat cleanup removed {} chats and {} messages",
               result.chatsDeleted(), result.messagesDeleted());
    });
  }
}
