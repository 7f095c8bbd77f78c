package org.mailpulse.alert.engine.datamodel.rule.source;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import org.mailpulse.alert.engine.datamodel.AlertDefinition;
import org.mailpulse.alert.engine.datamodel.AlertKind.KindCase;
import org.mailpulse.alert.engine.datamodel.DetectionAlgorithm;
import org.mailpulse.alert.engine.datamodel.MetricType;
import org.mailpulse.alert.engine.datamodel.Severity;
import org.mailpulse.alert.engine.datamodel.ThresholdOperator;
import org.mailpulse.alert.engine.datamodel.WindowUnit;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class FSAlertDefinitionSourceTest {

  @Test
  void testReadDefinitionsFromFile() throws IOException {
    Config config = ConfigFactory.load().getConfig("alertDefinitionSource");
    List<AlertDefinition> definitions =
        AlertDefinitionSourceProvider.getProvider(config).getAllDefinitions();

    Assertions.assertEquals(3, definitions.size());

    AlertDefinition highVolume = definitions.get(0);
    Assertions.assertEquals("high-volume", highVolume.getId());
    Assertions.assertEquals(Severity.HIGH, highVolume.getSeverity());
    Assertions.assertEquals(MetricType.EMAIL_VOLUME, highVolume.getMetric());
    Assertions.assertEquals(KindCase.STATIC, highVolume.getKind().getKindCase());
    Assertions.assertEquals(
        ThresholdOperator.GREATER_THAN, highVolume.getKind().getThreshold().getOperator());
    Assertions.assertEquals(100, highVolume.getKind().getThreshold().getValue());
    Assertions.assertEquals(WindowUnit.HOURS, highVolume.getTimeWindow().getUnit());
    Assertions.assertEquals(30, highVolume.getCooldown().getCooldownMinutes());
    Assertions.assertEquals(5, highVolume.getCooldown().getMaxAlertsPerDay());
    Assertions.assertEquals(1, highVolume.getCooldown().getConsecutiveAnomalies());

    AlertDefinition senderAnomaly = definitions.get(1);
    Assertions.assertEquals(
        DetectionAlgorithm.EWMA, senderAnomaly.getKind().getAnomaly().getAlgorithm());
    Assertions.assertEquals(5, senderAnomaly.getKind().getAnomaly().getEwmaSpan());
    Assertions.assertEquals(List.of("enron.com"), senderAnomaly.getFilter().getSenderDomains());
    Assertions.assertEquals(Severity.MEDIUM, senderAnomaly.getSeverity());

    AlertDefinition fraudTalk = definitions.get(2);
    Assertions.assertFalse(fraudTalk.isEnabled());
    Assertions.assertEquals(KindCase.SEMANTIC_MATCH, fraudTalk.getKind().getKindCase());
    Assertions.assertEquals(
        DetectionAlgorithm.DBSCAN, fraudTalk.getKind().getAnomaly().getAlgorithm());
    Assertions.assertEquals(0.8, fraudTalk.getKind().getSemanticQuery().getSimilarityThreshold());
  }

  @Test
  void testFileWithoutArrayIsRejected() {
    Config fsConfig =
        ConfigFactory.parseMap(Map.of("path", "src/test/resources/not-an-array.json"));
    Assertions.assertThrows(
        IOException.class, () -> new FSAlertDefinitionSource(fsConfig).getAllDefinitions());
  }
}
