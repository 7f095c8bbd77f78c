package org.mailpulse.alert.engine.notification.service.notification;

import static org.mailpulse.alert.engine.notification.service.notification.SlackMessage.addIfNotEmpty;
import static org.mailpulse.alert.engine.notification.service.notification.SlackMessage.addTimestamp;
import static org.mailpulse.alert.engine.notification.service.notification.SlackMessage.getTitleBlock;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.mailpulse.alert.engine.datamodel.Contributor;
import org.mailpulse.alert.engine.datamodel.Severity;
import org.mailpulse.alert.engine.notification.transport.webhook.slack.Attachment;
import org.mailpulse.alert.engine.notification.transport.webhook.slack.Block;
import org.mailpulse.alert.engine.notification.transport.webhook.slack.ContextBlock;
import org.mailpulse.alert.engine.notification.transport.webhook.slack.SectionBlock;
import org.mailpulse.alert.engine.notification.transport.webhook.slack.Text;

public class AlertSlackEvent implements SlackMessage {

  public static final String EVALUATED_AT = "Evaluated At";
  public static final String SEVERITY = "Severity";
  public static final String ALERT_KIND = "Alert Kind";
  public static final String CURRENT_VALUE = "Current Value";
  public static final String BASELINE_VALUE = "Baseline";
  public static final String TOP_CONTRIBUTORS = "Top Contributors";
  private final List<Attachment> attachments;

  public AlertSlackEvent(List<Attachment> attachments) {
    this.attachments = attachments;
  }

  public static AlertSlackEvent getMessage(AlertWebhookEvent alertWebhookEvent) {
    String titleMessage =
        String.format(
            "*MailPulse alert triggered: %s*\n%s",
            alertWebhookEvent.getAlertName() != null
                ? alertWebhookEvent.getAlertName()
                : alertWebhookEvent.getAlertId(),
            alertWebhookEvent.getReason());

    List<Text> metadataFields = new ArrayList<>();
    addTimestamp(metadataFields, alertWebhookEvent.getEvaluatedAt(), EVALUATED_AT);
    addIfNotEmpty(metadataFields, alertWebhookEvent.getSeverity(), SEVERITY);
    addIfNotEmpty(metadataFields, alertWebhookEvent.getAlertKind(), ALERT_KIND);
    addIfNotEmpty(
        metadataFields, String.format("%.2f", alertWebhookEvent.getCurrentValue()), CURRENT_VALUE);
    addIfNotEmpty(
        metadataFields,
        String.format("%.2f", alertWebhookEvent.getBaselineValue()),
        BASELINE_VALUE);

    List<Block> blocks = new ArrayList<>();
    blocks.add(getTitleBlock(titleMessage));
    blocks.add(SectionBlock.ofFields(metadataFields));
    String contributors = getContributors(alertWebhookEvent.getTopContributors());
    if (!contributors.isEmpty()) {
      blocks.add(new ContextBlock(List.of(Text.field(TOP_CONTRIBUTORS, contributors))));
    }

    return new AlertSlackEvent(
        List.of(new Attachment(getColor(alertWebhookEvent.getSeverity()), blocks)));
  }

  public List<Attachment> getAttachments() {
    return attachments;
  }

  private static String getContributors(List<Contributor> topContributors) {
    if (topContributors == null) {
      return "";
    }
    return topContributors.stream()
        .map(contributor -> contributor.getKey() + " (" + contributor.getCount() + ")")
        .collect(Collectors.joining(", "));
  }

  static String getColor(String severity) {
    if (severity == null) {
      return Attachment.GREY;
    }
    switch (Severity.valueOf(severity)) {
      case CRITICAL:
      case HIGH:
        return Attachment.RED;
      case MEDIUM:
        return Attachment.ORANGE;
      case LOW:
        return Attachment.YELLOW;
      default:
        throw new UnsupportedOperationException("Unsupported severity: " + severity);
    }
  }
}
