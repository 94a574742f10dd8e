/*
 * どこで: reminder アプリ設定
 * 何を: チャネル呼び出しと lifecycle 送信用の上限付き Executor
 * なぜ: 応答しないチャネルで sweep スレッドを占有せず、lifecycle 送信をリクエスト経路から外すため
 */
package com.example.reminder.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class DispatchExecutorConfig {

  public static final String CHANNEL_EXECUTOR = "channelExecutor";
  public static final String LIFECYCLE_EXECUTOR = "lifecycleExecutor";

  @Bean(name = CHANNEL_EXECUTOR)
  public ThreadPoolTaskExecutor channelExecutor(NotificationDispatchProperties properties) {
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.channelPoolSize());
    executor.setMaxPoolSize(properties.channelPoolSize());
    // チャネル呼び出しは常に呼び出し元が待つため、プールを超えるキューは持たない
    executor.setQueueCapacity(0);
    executor.setThreadNamePrefix("notification-channel-");
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(
        (int) Math.max(1, properties.channelTimeout().toSeconds()));
    return executor;
  }

  @Bean(name = LIFECYCLE_EXECUTOR)
  public ThreadPoolTaskExecutor lifecycleExecutor(NotificationDispatchProperties properties) {
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.lifecyclePoolSize());
    executor.setMaxPoolSize(properties.lifecyclePoolSize());
    executor.setQueueCapacity(properties.lifecycleQueueCapacity());
    executor.setThreadNamePrefix("notification-lifecycle-");
    // 拒否された送信は PENDING のまま残り、リース切れ後に retry sweep が拾う
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    return executor;
  }
}
