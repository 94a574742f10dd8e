/*
 * どこで: reminder サービス層
 * 何を: 送信リース保持時に locked_by へ記録するプロセス名
 */
package com.example.reminder.service;

import com.google.common.annotations.VisibleForTesting;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.UUID;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class WorkerIdentity {

  private static final Logger logger = LoggerFactory.getLogger(WorkerIdentity.class);
  private static final String HOSTNAME_ENV = "HOSTNAME";
  private static final String DEFAULT_HOSTNAME = "unknown-host";

  private final String name;

  public WorkerIdentity() {
    this(System::getenv);
  }

  @VisibleForTesting
  WorkerIdentity(Function<String, String> env) {
    // 同一ホスト上の別プロセスをサフィックスで区別する
    this.name = resolveHostname(env) + "-" + UUID.randomUUID().toString().substring(0, 8);
  }

  public String name() {
    return name;
  }

  private static String resolveHostname(Function<String, String> env) {
    final String fromEnv = env.apply(HOSTNAME_ENV);
    if (fromEnv != null && !fromEnv.isBlank()) {
      return fromEnv;
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException | SecurityException ex) {
      logger.warn("failed to resolve hostname; fallback to {}", DEFAULT_HOSTNAME, ex);
      return DEFAULT_HOSTNAME;
    }
  }
}
