package com.example.healthrag;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface UserMemoryRepository extends JpaRepository<UserMemory, String> {

    @Transactional
    @Modifying
    @Query("delete from UserMemory m where m.lastUpdated < :cutoff")
    int deleteNotUpdatedSince(@Param("cutoff") long cutoff);
}
