package com.bottlespin.application.port;

public interface ConnectionLiveness {
  boolean isConnected(String connectionId);
}
