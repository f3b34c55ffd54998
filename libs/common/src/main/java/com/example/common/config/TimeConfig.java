/*
 * どこで: Common 共通設定
 * 何を: UTC の Clock を Bean として公開する
 * なぜ: TTL/経過時間の計算をテストで固定時刻に差し替えられるようにするため
 */
package com.example.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration(proxyBeanMethods = false)
public class TimeConfig {

  @Bean
  public Clock systemClock() {
    return Clock.systemUTC();
  }
}
