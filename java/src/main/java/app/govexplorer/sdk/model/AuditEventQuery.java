package app.govexplorer.sdk.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Filter sent to the audit trail endpoint. Events come back already sorted as requested by {@code sort}.
 */
public final class AuditEventQuery {

    public static final String SORT_NEWEST_FIRST = "-timestamp";
    public static final int DEFAULT_LIMIT = 500;

    private final String targetType;
    private final String targetId;
    private final int limit;
    private final String sort;
    private final String since;
    private final String until;

    private AuditEventQuery(Builder builder) {
        this.targetType = builder.targetType;
        this.targetId = builder.targetId;
        this.limit = builder.limit > 0 ? builder.limit : DEFAULT_LIMIT;
        this.sort = builder.sort == null || builder.sort.isBlank() ? SORT_NEWEST_FIRST : builder.sort;
        this.since = builder.since;
        this.until = builder.until;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Query for every event targeting a single governance bundle, newest first.
     */
    public static Builder forBundle(String bundleId) {
        return new Builder()
            .targetType(EntityRef.GOVERNANCE_BUNDLE)
            .targetId(bundleId);
    }

    public String getTargetType() {
        return targetType;
    }

    public String getTargetId() {
        return targetId;
    }

    public int getLimit() {
        return limit;
    }

    public String getSort() {
        return sort;
    }

    public String getSince() {
        return since;
    }

    public String getUntil() {
        return until;
    }

    /**
     * @return request parameters in a stable order; unset optional parameters are omitted.
     */
    public Map<String, String> toQueryParameters() {
        Map<String, String> params = new LinkedHashMap<>();
        if (targetType != null) {
            params.put("targetType", targetType);
        }
        if (targetId != null) {
            params.put("targetId", targetId);
        }
        params.put("limit", Integer.toString(limit));
        params.put("sort", sort);
        if (since != null) {
            params.put("since", since);
        }
        if (until != null) {
            params.put("until", until);
        }
        return params;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AuditEventQuery)) {
            return false;
        }
        AuditEventQuery that = (AuditEventQuery) o;
        return limit == that.limit
            && Objects.equals(targetType, that.targetType)
            && Objects.equals(targetId, that.targetId)
            && Objects.equals(sort, that.sort)
            && Objects.equals(since, that.since)
            && Objects.equals(until, that.until);
    }

    @Override
    public int hashCode() {
        return Objects.hash(targetType, targetId, limit, sort, since, until);
    }

    @Override
    public String toString() {
        return "AuditEventQuery" + toQueryParameters();
    }

    public static final class Builder {
        private String targetType;
        private String targetId;
        private int limit;
        private String sort;
        private String since;
        private String until;

        public Builder targetType(String targetType) {
            this.targetType = targetType;
            return this;
        }

        public Builder targetId(String targetId) {
            this.targetId = targetId;
            return this;
        }

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public Builder sort(String sort) {
            this.sort = sort;
            return this;
        }

        public Builder since(String since) {
            this.since = since;
            return this;
        }

        public Builder until(String until) {
            this.until = until;
            return this;
        }

        public AuditEventQuery build() {
            return new AuditEventQuery(this);
        }
    }
}
