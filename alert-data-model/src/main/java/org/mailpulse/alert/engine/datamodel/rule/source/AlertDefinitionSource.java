package org.mailpulse.alert.engine.datamodel.rule.source;

import java.io.IOException;
import java.util.List;
import org.mailpulse.alert.engine.datamodel.AlertDefinition;

public interface AlertDefinitionSource {
  List<AlertDefinition> getAllDefinitions() throws IOException;
}
