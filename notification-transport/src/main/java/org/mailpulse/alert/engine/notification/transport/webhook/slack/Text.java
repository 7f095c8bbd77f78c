package org.mailpulse.alert.engine.notification.transport.webhook.slack;

public class Text {
  public static final String MARKDOWN_TYPE = "mrkdwn";
  public static final String PLAINTEXT_TYPE = "plain_text";
  private String type;
  private String text;

  public Text(String type, String text) {
    this.type = type;
    this.text = text;
  }

  public static Text markdown(String text) {
    return new Text(MARKDOWN_TYPE, text);
  }

  /** A bold label over its value, the layout of a section field. */
  public static Text field(String label, String value) {
    return markdown("*" + label + ":*\n" + value);
  }

  public String getType() {
    return type;
  }

  public void setType(String type) {
    this.type = type;
  }

  public String getText() {
    return text;
  }

  public void setText(String text) {
    this.text = text;
  }
}
