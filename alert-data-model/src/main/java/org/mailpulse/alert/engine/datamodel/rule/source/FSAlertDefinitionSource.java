package org.mailpulse.alert.engine.datamodel.rule.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.Config;
import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;
import org.mailpulse.alert.engine.datamodel.AlertDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Reads alert definitions from a JSON file holding an array of definitions. */
public class FSAlertDefinitionSource implements AlertDefinitionSource {
  private static final Logger LOGGER = LoggerFactory.getLogger(FSAlertDefinitionSource.class);
  private static final String PATH_CONFIG = "path";
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
  private final Config fsConfig;
  private final AlertDefinitionParser parser = new AlertDefinitionParser();

  public FSAlertDefinitionSource(Config fsConfig) {
    this.fsConfig = fsConfig;
  }

  @Override
  public List<AlertDefinition> getAllDefinitions() throws IOException {
    return getJsonNodes(fsConfig.getString(PATH_CONFIG)).stream()
        .map(parser::parse)
        .collect(Collectors.toUnmodifiableList());
  }

  private List<JsonNode> getJsonNodes(String fsPath) throws IOException {
    LOGGER.debug("Reading alert definitions from file path:{}", fsPath);
    JsonNode jsonNode = OBJECT_MAPPER.readTree(new File(fsPath).getAbsoluteFile());
    if (!jsonNode.isArray()) {
      throw new IOException("File should contain an array of alert definitions");
    }

    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug("Reading document  {}", jsonNode.toPrettyString());
    }
    return StreamSupport.stream(jsonNode.spliterator(), false)
        .collect(Collectors.toUnmodifiableList());
  }
}
