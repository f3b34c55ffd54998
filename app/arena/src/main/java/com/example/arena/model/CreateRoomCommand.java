package com.example.arena.model;

import java.util.List;

/**
 * ルーム作成要求。members の先頭が作成者になる。
 *
 * @param roomId null なら UUID を採番する
 * @param readyAll true ならマッチング成立ルームとして全員 ready で作成し、2 名以上ならカウントダウンを開始する
 */
public record CreateRoomCommand(
    String roomId,
    String name,
    String type,
    Integer maxPlayers,
    GameSettings gameSettings,
    List<TeamMember> members,
    boolean readyAll) {

  public CreateRoomCommand {
    members = members == null ? List.of() : List.copyOf(members);
  }
}
