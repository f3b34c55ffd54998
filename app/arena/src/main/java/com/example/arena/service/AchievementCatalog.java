package com.example.arena.service;

import com.example.arena.config.AchievementProperties;
import com.example.arena.model.AchievementDefinition;
import com.example.arena.repository.AchievementRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** 実績定義のキャッシュ。catalog-ttl を過ぎたら次の参照で DB から読み直す。 */
@Component
public class AchievementCatalog {

  private static final Logger logger = LoggerFactory.getLogger(AchievementCatalog.class);

  private final AchievementRepository achievementRepository;
  private final AchievementProperties properties;
  private final Clock clock;
  private final AtomicReference<Snapshot> snapshot = new AtomicReference<>();

  public AchievementCatalog(
      AchievementRepository achievementRepository, AchievementProperties properties, Clock clock) {
    this.achievementRepository = achievementRepository;
    this.properties = properties;
    this.clock = clock;
  }

  public List<AchievementDefinition> definitions() {
    final Snapshot current = snapshot.get();
    final Instant now = Instant.now(clock);
    if (current != null && now.isBefore(current.loadedAt().plus(properties.catalogTtl()))) {
      return current.definitions();
    }
    return refresh(now);
  }

  public void invalidate() {
    snapshot.set(null);
  }

  private List<AchievementDefinition> refresh(Instant now) {
    final List<AchievementDefinition> loaded =
        List.copyOf(achievementRepository.findAllDefinitions());
    snapshot.set(new Snapshot(loaded, now));
    logger.debug("achievement catalog reloaded size={}", loaded.size());
    return loaded;
  }

  private record Snapshot(List<AchievementDefinition> definitions, Instant loadedAt) {}
}
