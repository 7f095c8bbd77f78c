package org.mailpulse.alert.engine.datamodel.rule.source;

import com.typesafe.config.Config;

public class AlertDefinitionSourceProvider {
  private static final String SOURCE_TYPE = "type";
  private static final String SOURCE_TYPE_FS = "fs";

  public static AlertDefinitionSource getProvider(Config sourceConfig) {
    String sourceType = sourceConfig.getString(SOURCE_TYPE);
    switch (sourceType) {
      case SOURCE_TYPE_FS:
        return new FSAlertDefinitionSource(sourceConfig.getConfig(SOURCE_TYPE_FS));
      default:
        throw new RuntimeException(
            String.format("Invalid alert definition source type:%s", sourceType));
    }
  }
}
