package org.mailpulse.alert.engine.datamodel.rule.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import org.mailpulse.alert.engine.datamodel.AlertDefinition;
import org.mailpulse.alert.engine.datamodel.InvalidConfigurationException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class AlertDefinitionParserTest {
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
  private final AlertDefinitionParser parser = new AlertDefinitionParser();

  @Test
  void testUnknownAlgorithmIsInvalidConfiguration() throws IOException {
    JsonNode node =
        OBJECT_MAPPER.readTree(
            "{\"id\": \"a1\", \"kind\": {\"type\": \"anomaly\", \"anomaly\": {\"algorithm\": \"prophet\"}}}");
    InvalidConfigurationException e =
        Assertions.assertThrows(InvalidConfigurationException.class, () -> parser.parse(node));
    Assertions.assertEquals("a1", e.getAlertId());
    Assertions.assertTrue(e.getMessage().contains("prophet"));
  }

  @Test
  void testStaticAlertWithoutThresholdIsRejected() throws IOException {
    JsonNode node = OBJECT_MAPPER.readTree("{\"id\": \"a2\", \"kind\": {\"type\": \"static\"}}");
    Assertions.assertThrows(InvalidConfigurationException.class, () -> parser.parse(node));
  }

  @Test
  void testNonNumericThresholdIsRejected() throws IOException {
    JsonNode node =
        OBJECT_MAPPER.readTree(
            "{\"id\": \"a3\", \"kind\": {\"type\": \"static\", \"threshold\": {\"value\": \"lots\"}}}");
    Assertions.assertThrows(InvalidConfigurationException.class, () -> parser.parse(node));
  }

  @Test
  void testSemanticMatchNeedsClusteringAlgorithm() throws IOException {
    JsonNode node =
        OBJECT_MAPPER.readTree(
            "{\"id\": \"a4\", \"kind\": {\"type\": \"semantic_match\", \"query\": \"q\","
                + " \"anomaly\": {\"algorithm\": \"zscore\"}}}");
    Assertions.assertThrows(InvalidConfigurationException.class, () -> parser.parse(node));
  }

  @Test
  void testPercentileOutOfRangeIsRejected() throws IOException {
    JsonNode node =
        OBJECT_MAPPER.readTree(
            "{\"id\": \"a5\", \"kind\": {\"type\": \"anomaly\","
                + " \"anomaly\": {\"algorithm\": \"kmeans\", \"percentile\": 0}}}");
    Assertions.assertThrows(InvalidConfigurationException.class, () -> parser.parse(node));
  }

  @Test
  void testDefaultsApplied() throws IOException {
    JsonNode node =
        OBJECT_MAPPER.readTree("{\"id\": \"a6\", \"kind\": {\"type\": \"anomaly\"}}");
    AlertDefinition alertDefinition = parser.parse(node);
    Assertions.assertEquals("a6", alertDefinition.getName());
    Assertions.assertTrue(alertDefinition.isEnabled());
    Assertions.assertEquals(2.5, alertDefinition.getKind().getAnomaly().getZscoreThreshold());
    Assertions.assertEquals(7, alertDefinition.getTimeWindow().getBaselineDays());
    Assertions.assertEquals(60, alertDefinition.getCooldown().getCooldownMinutes());
    Assertions.assertEquals(10, alertDefinition.getCooldown().getMaxAlertsPerDay());
    Assertions.assertNull(alertDefinition.getKind().getAnomaly().getEwmaThresholdScale());
  }
}
