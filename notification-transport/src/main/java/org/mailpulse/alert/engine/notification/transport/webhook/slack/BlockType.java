package org.mailpulse.alert.engine.notification.transport.webhook.slack;

public enum BlockType {
  SECTION,
  DIVIDER,
  CONTEXT
}
