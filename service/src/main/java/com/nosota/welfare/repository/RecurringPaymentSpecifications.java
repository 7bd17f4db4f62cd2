package com.nosota.welfare.repository;

import com.nosota.welfare.api.model.RecurringPaymentStatus;
import com.nosota.welfare.api.request.ForecastFilter;
import com.nosota.welfare.model.RecurringPayment;
import org.springframework.data.jpa.domain.Specification;

import java.time.LocalDate;
import java.util.Collection;

/**
 * Query fragments for read-side filtering of recurring payments.
 *
 * <p>Null arguments produce a {@code null} specification, which Spring Data treats
 * as "no restriction" when combined with {@code and}.
 */
public final class RecurringPaymentSpecifications {

    private RecurringPaymentSpecifications() {
    }

    public static Specification<RecurringPayment> statusIn(Collection<RecurringPaymentStatus> statuses) {
        return (root, query, cb) -> root.get("status").in(statuses);
    }

    public static Specification<RecurringPayment> scheduledBetween(LocalDate from, LocalDate to) {
        return (root, query, cb) -> cb.between(root.get("scheduledDate"), from, to);
    }

    public static Specification<RecurringPayment> scheduledOnOrBefore(LocalDate date) {
        return (root, query, cb) -> cb.lessThanOrEqualTo(root.get("scheduledDate"), date);
    }

    public static Specification<RecurringPayment> dueBefore(LocalDate date) {
        return (root, query, cb) -> cb.lessThan(root.get("dueDate"), date);
    }

    /**
     * Restricts by scheme, project, state and district when the filter sets them.
     */
    public static Specification<RecurringPayment> matching(ForecastFilter filter) {
        if (filter == null) {
            return null;
        }
        return Specification.where(equalTo("schemeId", filter.schemeId()))
                .and(equalTo("projectId", filter.projectId()))
                .and(equalTo("stateId", filter.stateId()))
                .and(equalTo("districtId", filter.districtId()));
    }

    private static Specification<RecurringPayment> equalTo(String attribute, Object value) {
        if (value == null) {
            return null;
        }
        return (root, query, cb) -> cb.equal(root.get(attribute), value);
    }
}
