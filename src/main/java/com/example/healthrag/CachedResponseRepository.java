package com.example.healthrag;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

public interface CachedResponseRepository extends JpaRepository<CachedResponse, String> {

    Optional<CachedResponse> findFirstByOwnerIdAndEndpointAndTimeFrameAndQueryHashAndExpiresAtGreaterThanOrderByCreatedAtDesc(
            String ownerId, String endpoint, String timeFrame, String queryHash, long now);

    // one statement, so readers never see a half-invalidated owner
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("update CachedResponse c set c.expiresAt = :now where c.ownerId = :ownerId"
            + " and (:endpoint is null or c.endpoint = :endpoint)"
            + " and (:timeFrame is null or c.timeFrame = :timeFrame)"
            + " and c.expiresAt > :now")
    int expireMatching(@Param("ownerId") String ownerId, @Param("endpoint") String endpoint,
                       @Param("timeFrame") String timeFrame, @Param("now") long now);
}
