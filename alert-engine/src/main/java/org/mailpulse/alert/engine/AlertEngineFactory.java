package org.mailpulse.alert.engine;

import static org.mailpulse.alert.engine.AlertEngineConstants.ALERT_DEFINITION_SOURCE;
import static org.mailpulse.alert.engine.AlertEngineConstants.NOTIFICATION_CHANNELS_SOURCE;

import com.typesafe.config.Config;
import java.io.IOException;
import java.util.List;
import org.mailpulse.alert.engine.anomaly.detector.evaluator.AlertDefinitionEvaluator;
import org.mailpulse.alert.engine.datamodel.AlertDefinition;
import org.mailpulse.alert.engine.datamodel.rule.source.AlertDefinitionSourceProvider;
import org.mailpulse.alert.engine.datamodel.store.AlertRepository;
import org.mailpulse.alert.engine.datamodel.store.EventStore;
import org.mailpulse.alert.engine.datamodel.store.InMemoryAlertRepository;
import org.mailpulse.alert.engine.datamodel.store.NotificationSink;
import org.mailpulse.alert.engine.datamodel.store.SemanticMatcher;
import org.mailpulse.alert.engine.notification.service.WebhookNotificationSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Wires an {@link AlertEngine} from the application config and the storage collaborators. */
public class AlertEngineFactory {
  private static final Logger LOGGER = LoggerFactory.getLogger(AlertEngineFactory.class);

  public static AlertEngine create(
      Config appConfig, EventStore eventStore, SemanticMatcher semanticMatcher)
      throws IOException {
    return new AlertEngine(
        loadRepository(appConfig),
        new AlertDefinitionEvaluator(appConfig, eventStore, semanticMatcher),
        notificationSink(appConfig));
  }

  static AlertRepository loadRepository(Config appConfig) throws IOException {
    if (!appConfig.hasPath(ALERT_DEFINITION_SOURCE)) {
      LOGGER.info("No alert definition source configured, starting without definitions");
      return new InMemoryAlertRepository();
    }
    List<AlertDefinition> alertDefinitions =
        AlertDefinitionSourceProvider.getProvider(appConfig.getConfig(ALERT_DEFINITION_SOURCE))
            .getAllDefinitions();
    LOGGER.info("Loaded {} alert definition(s)", alertDefinitions.size());
    return new InMemoryAlertRepository(alertDefinitions);
  }

  static NotificationSink notificationSink(Config appConfig) {
    if (!appConfig.hasPath(NOTIFICATION_CHANNELS_SOURCE)) {
      LOGGER.info("No notification channels configured, triggers stay undelivered");
      return (alertSummary, evaluationResult) -> false;
    }
    return new WebhookNotificationSink(appConfig.getConfig(NOTIFICATION_CHANNELS_SOURCE));
  }
}
