package org.mailpulse.alert.engine.notification.transport.webhook.slack;

import java.util.List;

/** POJO to serialize a Slack attachment, the colored bar next to the blocks. */
public class Attachment {
  public static final String RED = "#d41729";
  public static final String ORANGE = "#f2760a";
  public static final String YELLOW = "#f2c744";
  public static final String GREY = "#9e9e9e";
  private String color;
  private List<Block> blocks;

  public Attachment() {}

  public Attachment(String color, List<Block> blocks) {
    this.color = color;
    this.blocks = blocks;
  }

  public String getColor() {
    return color;
  }

  public void setColor(String color) {
    this.color = color;
  }

  public List<Block> getBlocks() {
    return blocks;
  }

  public void setBlocks(List<Block> blocks) {
    this.blocks = blocks;
  }
}
