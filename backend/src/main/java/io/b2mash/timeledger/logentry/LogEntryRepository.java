package io.b2mash.timeledger.logentry;

import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface LogEntryRepository extends JpaRepository<LogEntry, Long> {

  /** Newest first. The page size carries the caller's limit. */
  @Query("SELECT l FROM LogEntry l WHERE l.userId = :userId ORDER BY l.id DESC")
  List<LogEntry> findRecentByUserId(@Param("userId") UUID userId, Pageable pageable);

  List<LogEntry> findByUserIdAndKindOrderByIdAsc(UUID userId, LogKind kind);

  List<LogEntry> findByLegacySecondsTrue();
}
