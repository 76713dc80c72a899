package com.bottlespin.application.port;

import com.bottlespin.domain.GameBroadcast;

/** Outbound side of the transport: addressed delivery plus room group membership. */
public interface GamePublisher {
  void publish(GameBroadcast b);

  void joinGroup(String roomCode, String connectionId);

  void releaseConnection(String connectionId);
}
