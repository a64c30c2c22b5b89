package com.logimatrix.tracking.repository;

import com.logimatrix.tracking.dto.AlertQuery;
import com.logimatrix.tracking.entity.TrackingAlert;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the dynamic WHERE clause of alert-log queries. Every filter of
 * {@link AlertQuery} is optional; absent filters match everything.
 */
public final class TrackingAlertSpecifications {

    private TrackingAlertSpecifications() {
    }

    public static Specification<TrackingAlert> matching(AlertQuery query) {
        return (root, criteriaQuery, cb) -> {
            List<Predicate> predicates = new ArrayList<>();

            if (query.tenantId() != null) {
                predicates.add(cb.equal(root.get("tenantId"), query.tenantId()));
            }
            if (query.vehicleId() != null) {
                predicates.add(cb.equal(root.get("vehicleId"), query.vehicleId()));
            }
            if (query.driverId() != null) {
                predicates.add(cb.equal(root.get("driverId"), query.driverId()));
            }
            if (query.severity() != null) {
                predicates.add(cb.equal(root.get("severity"), query.severity()));
            }
            if (query.alertType() != null) {
                predicates.add(cb.equal(root.get("alertType"), query.alertType()));
            }
            if (query.status() != null) {
                predicates.add(cb.equal(root.get("status"), query.status()));
            }
            if (query.from() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.get("emittedAt"), query.from()));
            }
            if (query.to() != null) {
                predicates.add(cb.lessThanOrEqualTo(root.get("emittedAt"), query.to()));
            }

            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
