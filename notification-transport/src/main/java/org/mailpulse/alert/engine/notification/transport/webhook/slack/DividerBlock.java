package org.mailpulse.alert.engine.notification.transport.webhook.slack;

public class DividerBlock implements Block {
  public static final String TYPE = BlockType.DIVIDER.name().toLowerCase();

  @Override
  public String getType() {
    return TYPE;
  }
}
