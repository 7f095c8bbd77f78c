package org.mailpulse.alert.engine.datamodel;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** A sender or entity ranked by how much it contributed to a window's volume. */
@AllArgsConstructor
@Getter
@ToString
@EqualsAndHashCode
public class Contributor {
  private final String key;
  private final long count;
}
