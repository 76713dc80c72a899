package com.bottlespin.application;

final class RoomCodes {
  private RoomCodes() {}

  /** Six characters, all from {@link RoomCodeGenerator#ALPHABET}. */
  static boolean wellFormed(String code) {
    if (code == null || code.length() != RoomCodeGenerator.CODE_LENGTH) return false;
    for (int i = 0; i < code.length(); i++) {
      if (RoomCodeGenerator.ALPHABET.indexOf(code.charAt(i)) < 0) return false;
    }
    return true;
  }
}
