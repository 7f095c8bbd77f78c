package org.mailpulse.alert.engine.notification.transport.webhook.slack;

/** A Slack layout block. Serialized with its {@code type} discriminator. */
public interface Block {
  String getType();
}
