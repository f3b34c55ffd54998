/*
 * どこで: Arena インフラ設定
 * 何を: ルーム/キュー操作で共有する StringRedisTemplate を提供する
 * なぜ: Repository が文字列シリアライザで Lua スクリプトへ引数を渡せるようにするため
 */
package com.example.arena.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
public class RedisConfig {

  @Bean
  StringRedisTemplate stringRedisTemplate(RedisConnectionFactory connectionFactory) {
    return new StringRedisTemplate(connectionFactory);
  }
}
