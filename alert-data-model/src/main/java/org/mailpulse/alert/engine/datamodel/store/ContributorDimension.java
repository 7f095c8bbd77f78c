package org.mailpulse.alert.engine.datamodel.store;

public enum ContributorDimension {
  SENDER,
  ENTITY
}
