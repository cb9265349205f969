package com.example.healthrag;

import org.springframework.data.jpa.domain.Specification;

import java.time.LocalDate;

/**
 * Typed, parameterized filters over {@link HealthMetricRecord}. Null arguments mean "no filter".
 */
public final class HealthMetricSpecifications {

    private HealthMetricSpecifications() {}

    public static Specification<HealthMetricRecord> ownedBy(String ownerId) {
        return (root, query, cb) -> cb.equal(root.get("ownerId"), ownerId);
    }

    public static Specification<HealthMetricRecord> inCategory(String category) {
        return (root, query, cb) -> category == null ? null : cb.equal(root.get("category"), category);
    }

    public static Specification<HealthMetricRecord> onOrAfter(LocalDate start) {
        return (root, query, cb) -> start == null ? null : cb.greaterThanOrEqualTo(root.<LocalDate>get("recordDate"), start);
    }

    public static Specification<HealthMetricRecord> onOrBefore(LocalDate end) {
        return (root, query, cb) -> end == null ? null : cb.lessThanOrEqualTo(root.<LocalDate>get("recordDate"), end);
    }

    public static Specification<HealthMetricRecord> matching(String ownerId, String category, LocalDate start, LocalDate end) {
        return Specification.where(ownedBy(ownerId))
                .and(inCategory(category))
                .and(onOrAfter(start))
                .and(onOrBefore(end));
    }
}
