package com.attribute.resolution.api;

import com.attribute.resolution.core.model.ColumnNames;
import com.attribute.resolution.filter.FilterCriteria;

import java.util.Arrays;
import java.util.List;

/**
 * Options for a resolution request: the target values to filter on and how to treat
 * studies and uncertain entities.
 *
 * <p>Without target values no filtering takes place and every input row is returned
 * with its resolved value. The message column is {@code UNCERTAIN_MSG} when filtering with
 * {@code includeUncertain}, {@code NOT_VALID_MSG} when not filtering with
 * {@code reportUncertainIfNoFilter}, and absent otherwise.</p>
 */
public class FilterOptions {

    private final FilterCriteria criteria;
    private final boolean reportUncertainIfNoFilter;

    private FilterOptions(Builder builder) {
        this.criteria = new FilterCriteria(builder.targetValues, builder.exclusively,
                builder.matchAll, builder.includeUncertain);
        this.reportUncertainIfNoFilter = builder.reportUncertainIfNoFilter;
    }

    public List<String> getTargetValues() {
        return criteria.targetValues();
    }

    public boolean isIncludeUncertain() {
        return criteria.includeUncertain();
    }

    public boolean isExclusively() {
        return criteria.exclusively();
    }

    public boolean isMatchAll() {
        return criteria.matchAll();
    }

    public boolean isReportUncertainIfNoFilter() {
        return reportUncertainIfNoFilter;
    }

    public boolean isFilterActive() {
        return criteria.isActive();
    }

    public FilterCriteria toCriteria() {
        return criteria;
    }

    /**
     * Returns the message column the result carries, or {@code null} for none.
     */
    public String messageColumn() {
        if (isFilterActive()) {
            return criteria.includeUncertain() ? ColumnNames.UNCERTAIN_MSG : null;
        }
        return reportUncertainIfNoFilter ? ColumnNames.NOT_VALID_MSG : null;
    }

    /**
     * Entity-level defaults: no filter, uncertainties reported.
     */
    public static FilterOptions defaults() {
        return builder().build();
    }

    /**
     * Options for filtering animals on the given values, with entity-level defaults.
     */
    public static FilterOptions of(String... targetValues) {
        return builder().targetValues(targetValues).build();
    }

    /**
     * Builder with entity-level defaults ({@code exclusively=false}).
     */
    public static Builder builder() {
        return new Builder(false);
    }

    /**
     * Builder with study-level defaults ({@code exclusively=true}).
     */
    public static Builder groupBuilder() {
        return new Builder(true);
    }

    public static class Builder {
        private List<String> targetValues = List.of();
        private boolean includeUncertain = false;
        private boolean exclusively;
        private boolean matchAll = false;
        private boolean reportUncertainIfNoFilter = true;

        private Builder(boolean exclusively) {
            this.exclusively = exclusively;
        }

        public Builder targetValues(List<String> targetValues) {
            this.targetValues = targetValues != null ? targetValues : List.of();
            return this;
        }

        public Builder targetValues(String... targetValues) {
            return targetValues(Arrays.asList(targetValues));
        }

        public Builder includeUncertain(boolean includeUncertain) {
            this.includeUncertain = includeUncertain;
            return this;
        }

        public Builder exclusively(boolean exclusively) {
            this.exclusively = exclusively;
            return this;
        }

        public Builder matchAll(boolean matchAll) {
            this.matchAll = matchAll;
            return this;
        }

        public Builder reportUncertainIfNoFilter(boolean reportUncertainIfNoFilter) {
            this.reportUncertainIfNoFilter = reportUncertainIfNoFilter;
            return this;
        }

        public FilterOptions build() {
            return new FilterOptions(this);
        }
    }

    @Override
    public String toString() {
        return "FilterOptions{" +
                "targetValues=" + criteria.targetValues() +
                ", includeUncertain=" + criteria.includeUncertain() +
                ", exclusively=" + criteria.exclusively() +
                ", matchAll=" + criteria.matchAll() +
                ", reportUncertainIfNoFilter=" + reportUncertainIfNoFilter +
                '}';
    }
}
