package com.example.arena.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.arena.api.request.QueueJoinRequest;
import com.example.arena.api.response.QueueCancelResponse;
import com.example.arena.api.response.QueueJoinResponse;
import com.example.arena.api.response.QueueStatisticsResponse;
import com.example.arena.api.response.QueueStatusResponse;
import com.example.arena.service.MatchmakingService;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(MatchmakingController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class MatchmakingControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private MatchmakingService matchmakingService;

  @Test
  void joinReturnsQueuedPosition() throws Exception {
    when(matchmakingService.join(eq("u1"), any(QueueJoinRequest.class)))
        .thenReturn(
            new QueueJoinResponse(
                "queued", null, List.of(), new QueueStatusResponse("queued", 1, 1, 0, 1200, null)));

    mockMvc
        .perform(
            post("/v1/matchmaking/queue")
                .header("X-User-Id", "u1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"username":"alice","skill_level":1200,"mode":"quick"}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.outcome").value("queued"))
        .andExpect(jsonPath("$.queue.position").value(1))
        .andExpect(jsonPath("$.queue.skill_level").value(1200));
  }

  @Test
  void joinWithUnknownModeIs400() throws Exception {
    mockMvc
        .perform(
            post("/v1/matchmaking/queue")
                .header("X-User-Id", "u1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"mode\":\"arcade\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
        .andExpect(jsonPath("$.message").value("mode must be quick or ranked"));
    verifyNoInteractions(matchmakingService);
  }

  @Test
  void teamMemberWithoutSkillIs400() throws Exception {
    mockMvc
        .perform(
            post("/v1/matchmaking/queue")
                .header("X-User-Id", "u1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"mode":"ranked","team":[{"user_id":"u2"}]}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("team member skill_level is required"));
  }

  @Test
  void joinWhileTeammateIsQueuedIs409() throws Exception {
    when(matchmakingService.join(eq("u1"), any(QueueJoinRequest.class)))
        .thenThrow(
            new SessionConflictException(
                ApiErrorCode.ALREADY_QUEUED, "a member of this request is already queued"));

    mockMvc
        .perform(
            post("/v1/matchmaking/queue")
                .header("X-User-Id", "u1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"mode":"quick","team":[{"user_id":"u2","skill_level":1100}]}
                    """))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("ALREADY_QUEUED"));
  }

  @Test
  void cancelReportsRemoval() throws Exception {
    when(matchmakingService.cancel("u1")).thenReturn(new QueueCancelResponse("u1", true));

    mockMvc
        .perform(delete("/v1/matchmaking/queue").header("X-User-Id", "u1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.user_id").value("u1"))
        .andExpect(jsonPath("$.removed").value(true));
  }

  @Test
  void statusReturnsMatchedSession() throws Exception {
    when(matchmakingService.status("u1"))
        .thenReturn(new QueueStatusResponse("matched", 0, 0, 0, 0, "room-7"));

    mockMvc
        .perform(get("/v1/matchmaking/queue").header("X-User-Id", "u1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.state").value("matched"))
        .andExpect(jsonPath("$.session_id").value("room-7"));
  }

  @Test
  void statisticsNeedsNoUser() throws Exception {
    when(matchmakingService.statistics())
        .thenReturn(new QueueStatisticsResponse(4, 1150.5, 12, 40));

    mockMvc
        .perform(get("/v1/matchmaking/statistics"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.total_players").value(4))
        .andExpect(jsonPath("$.longest_wait_seconds").value(40));
  }
}
