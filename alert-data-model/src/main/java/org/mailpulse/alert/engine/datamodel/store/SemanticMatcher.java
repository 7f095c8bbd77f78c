package org.mailpulse.alert.engine.datamodel.store;

import java.util.List;

public interface SemanticMatcher {
  List<String> matchingIds(String query, double similarityThreshold);
}
