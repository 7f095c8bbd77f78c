package org.mailpulse.alert.engine.datamodel;

public enum WindowUnit {
  MINUTES(1),
  HOURS(60),
  DAYS(1440);

  private final int minutes;

  WindowUnit(int minutes) {
    this.minutes = minutes;
  }

  public long toMinutes(long size) {
    return size * minutes;
  }
}
