/*
 * どこで: reminder アプリのエントリポイント
 * 何を: スケジューリングと ConfigurationProperties 走査を有効にして Spring を起動する
 */
package com.example.reminder;

import com.example.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class ReminderApplication {

  public static void main(String[] args) {
    SpringApplication.run(ReminderApplication.class, args);
  }
}
