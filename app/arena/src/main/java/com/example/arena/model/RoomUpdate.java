package com.example.arena.model;

/** 作成者による部分更新。null のフィールドは変更しない。 */
public record RoomUpdate(String name, String type, Integer maxPlayers, GameSettings gameSettings) {

  public boolean isEmpty() {
    return name == null && type == null && maxPlayers == null && gameSettings == null;
  }
}
