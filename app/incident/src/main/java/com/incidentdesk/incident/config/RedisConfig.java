/*
 * どこで: Incident インフラ設定
 * 何を: リマインダー保存で利用する StringRedisTemplate を提供する
 * なぜ: Lua スクリプトの引数/戻り値を文字列で統一するため
 */
package com.incidentdesk.incident.config;

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
