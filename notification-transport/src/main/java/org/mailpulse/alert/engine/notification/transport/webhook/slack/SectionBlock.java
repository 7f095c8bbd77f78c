package org.mailpulse.alert.engine.notification.transport.webhook.slack;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public class SectionBlock implements Block {
  public static final String TYPE = BlockType.SECTION.name().toLowerCase();
  private String type;
  private Text text;
  private String blockId;
  private List<Text> fields;

  public SectionBlock() {
    this.type = TYPE;
  }

  public static SectionBlock ofText(Text text) {
    SectionBlock sectionBlock = new SectionBlock();
    sectionBlock.setText(text);
    return sectionBlock;
  }

  public static SectionBlock ofFields(List<Text> fields) {
    SectionBlock sectionBlock = new SectionBlock();
    sectionBlock.setFields(fields);
    return sectionBlock;
  }

  @Override
  public String getType() {
    return type;
  }

  public void setType(String type) {
    this.type = type;
  }

  public Text getText() {
    return text;
  }

  public void setText(Text text) {
    this.text = text;
  }

  @JsonProperty("block_id")
  public String getBlockId() {
    return blockId;
  }

  public void setBlockId(String blockId) {
    this.blockId = blockId;
  }

  public List<Text> getFields() {
    return fields;
  }

  public void setFields(List<Text> fields) {
    this.fields = fields;
  }
}
