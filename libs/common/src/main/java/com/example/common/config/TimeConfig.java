/*
 * どこで: Common 共通設定
 * 何を: UTC の Clock を Bean として提供する
 * なぜ: 所要時間の計測をテストで固定時刻へ差し替えられるようにするため
 */
package com.example.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
