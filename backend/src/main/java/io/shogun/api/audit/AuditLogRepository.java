package io.shogun.api.audit;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Limit;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AuditLogRepository extends JpaRepository<AuditLog, UUID> {

  /** Typed projection for grouped count aggregation. */
  interface LabelCount {
    String getLabel();

    long getCount();
  }

  /**
   * Multi-parameter JPQL query with nullable filters. Each parameter uses the nullable pattern
   * {@code (:param IS NULL OR l.field = :param)}; the time range is {@code [from, to)}.
   */
  @Query(
      """
      SELECT l FROM AuditLog l
      WHERE (:userId IS NULL OR l.userId = :userId)
        AND (CAST(:entityType AS string) IS NULL OR l.entityType = :entityType)
        AND (CAST(:action AS string) IS NULL OR l.action = :action)
        AND (CAST(:from AS timestamp) IS NULL OR l.createdAt >= :from)
        AND (CAST(:to AS timestamp) IS NULL OR l.createdAt < :to)
      """)
  Page<AuditLog> findByFilter(
      @Param("userId") Long userId,
      @Param("entityType") String entityType,
      @Param("action") String action,
      @Param("from") Instant from,
      @Param("to") Instant to,
      Pageable pageable);

  Page<AuditLog> findByEntityTypeAndEntityId(
      String entityType, String entityId, Pageable pageable);

  // --- Retention batch selects, one per log category ---

  List<AuditLog> findByCreatedAtBeforeAndActionIn(
      Instant cutoff, Collection<String> actions, Limit limit);

  List<AuditLog> findByCreatedAtBeforeAndErrorMessageIsNotNullAndActionNotIn(
      Instant cutoff, Collection<String> excludedActions, Limit limit);

  List<AuditLog> findByCreatedAtBeforeAndActionInAndErrorMessageIsNull(
      Instant cutoff, Collection<String> actions, Limit limit);

  List<AuditLog> findByCreatedAtBeforeAndActionNotInAndErrorMessageIsNull(
      Instant cutoff, Collection<String> excludedActions, Limit limit);

  // --- Retention counts, same predicates as the selects above ---

  long countByCreatedAtBeforeAndActionIn(Instant cutoff, Collection<String> actions);

  long countByCreatedAtBeforeAndErrorMessageIsNotNullAndActionNotIn(
      Instant cutoff, Collection<String> excludedActions);

  long countByCreatedAtBeforeAndActionInAndErrorMessageIsNull(
      Instant cutoff, Collection<String> actions);

  long countByCreatedAtBeforeAndActionNotInAndErrorMessageIsNull(
      Instant cutoff, Collection<String> excludedActions);

  // --- Statistics ---

  long countByCreatedAtGreaterThanEqualAndCreatedAtLessThan(Instant from, Instant to);

  @Query(
      """
      SELECT l.action AS label, COUNT(l) AS count FROM AuditLog l
      WHERE l.createdAt >= :from AND l.createdAt < :to
      GROUP BY l.action ORDER BY COUNT(l) DESC
      """)
  List<LabelCount> countByAction(@Param("from") Instant from, @Param("to") Instant to);

  @Query(
      """
      SELECT COALESCE(l.entityType, 'Unknown') AS label, COUNT(l) AS count FROM AuditLog l
      WHERE l.createdAt >= :from AND l.createdAt < :to
      GROUP BY l.entityType ORDER BY COUNT(l) DESC
      """)
  List<LabelCount> countByEntityType(@Param("from") Instant from, @Param("to") Instant to);

  @Query(
      """
      SELECT COALESCE(CAST(l.userId AS string), 'anonymous') AS label, COUNT(l) AS count
      FROM AuditLog l
      WHERE l.createdAt >= :from AND l.createdAt < :to
      GROUP BY l.userId ORDER BY COUNT(l) DESC
      """)
  List<LabelCount> countByUser(@Param("from") Instant from, @Param("to") Instant to);
}
