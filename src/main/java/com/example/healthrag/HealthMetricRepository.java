package com.example.healthrag;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface HealthMetricRepository extends JpaRepository<HealthMetricRecord, String>,
        JpaSpecificationExecutor<HealthMetricRecord> {

    List<HealthMetricRecord> findByOwnerIdAndIdIn(String ownerId, Collection<String> ids);

    @Query("select distinct r.category from HealthMetricRecord r where r.ownerId = :ownerId order by r.category")
    List<String> findDistinctCategories(@Param("ownerId") String ownerId);
}
