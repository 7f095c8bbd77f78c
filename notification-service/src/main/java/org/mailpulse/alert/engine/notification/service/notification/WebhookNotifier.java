package org.mailpulse.alert.engine.notification.service.notification;

import java.time.Instant;
import java.util.List;
import org.mailpulse.alert.engine.datamodel.AlertSummary;
import org.mailpulse.alert.engine.datamodel.EvaluationResult;
import org.mailpulse.alert.engine.notification.service.NotificationChannel;
import org.mailpulse.alert.engine.notification.service.NotificationChannel.WebFormatNotificationChannelConfig;
import org.mailpulse.alert.engine.notification.transport.webhook.WebhookSender;

public class WebhookNotifier {

  private final WebhookSender webhookSender;

  public WebhookNotifier(WebhookSender webhookSender) {
    this.webhookSender = webhookSender;
  }

  /** @return whether every webhook of the channel accepted the message, false without webhooks */
  public boolean notify(
      AlertSummary alertSummary,
      EvaluationResult evaluationResult,
      NotificationChannel notificationChannel) {
    List<WebFormatNotificationChannelConfig> webhookConfigs =
        notificationChannel.getWebhookConfigs();
    if (webhookConfigs.isEmpty()) {
      return false;
    }

    AlertWebhookEvent message = convert(alertSummary, evaluationResult);
    SlackMessage slackMessage = AlertSlackEvent.getMessage(message);
    boolean delivered = true;
    for (WebFormatNotificationChannelConfig webhookConfig : webhookConfigs) {
      boolean sent =
          webhookConfig.isSlack()
              ? webhookSender.send(webhookConfig.getUrl(), slackMessage)
              : webhookSender.send(webhookConfig.getUrl(), message);
      delivered &= sent;
    }
    return delivered;
  }

  static AlertWebhookEvent convert(AlertSummary alertSummary, EvaluationResult evaluationResult) {
    return AlertWebhookEvent.builder()
        .eventTimestamp(Instant.now().toString())
        .evaluatedAt(
            evaluationResult.getEvaluatedAt() != null
                ? evaluationResult.getEvaluatedAt().toString()
                : null)
        .alertId(alertSummary.getAlertId())
        .alertName(alertSummary.getAlertName())
        .severity(alertSummary.getSeverity() != null ? alertSummary.getSeverity().name() : null)
        .alertKind(alertSummary.getKindCase() != null ? alertSummary.getKindCase().name() : null)
        .reason(evaluationResult.getReason())
        .currentValue(evaluationResult.getCurrentValue())
        .baselineValue(evaluationResult.getBaselineValue())
        .score(evaluationResult.getScore())
        .percentageChange(evaluationResult.getPercentageChange())
        .anomalyType(
            evaluationResult.getAnomalyType() != null
                ? evaluationResult.getAnomalyType().name()
                : null)
        .alertsToday(evaluationResult.getAlertsToday())
        .topContributors(evaluationResult.getTopContributors())
        .build();
  }
}
