/*
 * どこで: Incident アプリのエントリポイント
 * 何を: Spring Boot の起動と設定スキャンを行う
 * なぜ: 設定クラスとリマインダーワーカーのスケジュールをまとめて有効化するため
 */
package com.incidentdesk.incident;

import com.incidentdesk.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class IncidentApplication {

  public static void main(String[] args) {
    SpringApplication.run(IncidentApplication.class, args);
  }
}
