package io.b2mash.timeledger.session;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface WorkSessionRepository extends JpaRepository<WorkSession, UUID> {

  @Query("SELECT s FROM WorkSession s WHERE s.userId = :userId AND s.endedAt IS NULL")
  Optional<WorkSession> findActiveByUserId(@Param("userId") UUID userId);

  @Query(
      """
      SELECT s FROM WorkSession s
      WHERE s.userId = :userId
        AND s.endedAt IS NOT NULL
      ORDER BY s.endedAt DESC
      """)
  List<WorkSession> findFinishedByUserId(@Param("userId") UUID userId);

  @Query("SELECT COUNT(s) FROM WorkSession s WHERE s.userId = :userId AND s.endedAt IS NULL")
  long countActiveByUserId(@Param("userId") UUID userId);

  List<WorkSession> findByLegacySecondsTrue();
}
