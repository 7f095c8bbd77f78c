package org.mailpulse.alert.engine.notification.transport.webhook.slack;

import java.util.List;

/** Small print under a message, holding up to ten text elements. */
public class ContextBlock implements Block {
  public static final String TYPE = BlockType.CONTEXT.name().toLowerCase();
  private List<Text> elements;

  public ContextBlock(List<Text> elements) {
    this.elements = elements;
  }

  @Override
  public String getType() {
    return TYPE;
  }

  public List<Text> getElements() {
    return elements;
  }

  public void setElements(List<Text> elements) {
    this.elements = elements;
  }
}
