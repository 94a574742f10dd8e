/*
 * どこで: Common 共通設定
 * 何を: Clock を DI 可能にする
 * なぜ: sweep は現在時刻からウィンドウを計算し、テストでは固定時計に差し替えるため
 */
package com.example.common.config;

import java.time.Clock;
import java.time.ZoneId;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock(@Value("${app.clock.zone:UTC}") String zone) {
    return Clock.system(ZoneId.of(zone));
  }
}
