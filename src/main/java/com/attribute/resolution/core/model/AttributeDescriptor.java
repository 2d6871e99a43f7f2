package com.attribute.resolution.core.model;

import com.attribute.resolution.validation.InputValidator;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Describes where an attribute is recorded and how its uncertainties are worded.
 * One generic resolution engine serves every attribute through its descriptor.
 */
public final class AttributeDescriptor {

    /**
     * Route of administration: EXROUTE per animal, TS parameter ROUTE per study.
     */
    public static final AttributeDescriptor ROUTE = builder()
            .name("ROUTE")
            .mode(ResolutionMode.ENTITY_AND_GROUP_LEVEL)
            .fineSource("EX", "EXROUTE")
            .coarseParameter("ROUTE")
            .codelist("ROUTE")
            .message(UncertaintyCondition.MULTIPLE_FINE_VALUES, "Multiple values for EXROUTE found")
            .message(UncertaintyCondition.MULTIPLE_COARSE_VALUES,
                    "Multiple TS parameters ROUTE found and EX rows with EXROUTE values are missing")
            .message(UncertaintyCondition.NO_VALUES,
                    "TS parameters ROUTE and EX rows with EXROUTE values are missing")
            .message(UncertaintyCondition.INVALID_FINE_VALUE, "EXROUTE does not contain a valid CT value")
            .message(UncertaintyCondition.INVALID_COARSE_VALUE,
                    "TS parameter ROUTE does not contain a valid CT value")
            .message(UncertaintyCondition.SOURCE_MISMATCH, "Mismatch in values of TS parameter ROUTE and EXROUTE")
            .build();

    /**
     * Study design: TS parameter SDESIGN per study.
     */
    public static final AttributeDescriptor STUDY_DESIGN = builder()
            .name("SDESIGN")
            .mode(ResolutionMode.GROUP_LEVEL_ONLY)
            .coarseParameter("SDESIGN")
            .codelist("DESIGN")
            .message(UncertaintyCondition.MULTIPLE_COARSE_VALUES, "Multiple TS parameters SDESIGN found")
            .message(UncertaintyCondition.NO_VALUES, "TS parameter SDESIGN is missing")
            .message(UncertaintyCondition.INVALID_COARSE_VALUE,
                    "TS parameter SDESIGN does not contain a valid CT value")
            .build();

    private final String name;
    private final String resolvedColumn;
    private final ResolutionMode mode;
    private final String fineDomain;
    private final String fineVariable;
    private final String coarseParameter;
    private final String codelist;
    private final Map<UncertaintyCondition, String> messages;

    private AttributeDescriptor(Builder builder) {
        this.name = builder.name;
        this.resolvedColumn = builder.resolvedColumn != null ? builder.resolvedColumn : builder.name;
        this.mode = builder.mode;
        this.fineDomain = builder.fineDomain;
        this.fineVariable = builder.fineVariable;
        this.coarseParameter = builder.coarseParameter;
        this.codelist = builder.codelist;
        this.messages = new EnumMap<>(builder.messages);
    }

    public String getName() {
        return name;
    }

    public String getResolvedColumn() {
        return resolvedColumn;
    }

    public ResolutionMode getMode() {
        return mode;
    }

    public String getFineDomain() {
        return fineDomain;
    }

    public String getFineVariable() {
        return fineVariable;
    }

    public String getCoarseParameter() {
        return coarseParameter;
    }

    public String getCodelist() {
        return codelist;
    }

    /**
     * Returns the wording of a condition for this attribute.
     */
    public String describe(UncertaintyCondition condition) {
        return messages.getOrDefault(condition, condition.getDefaultMessage());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AttributeDescriptor that = (AttributeDescriptor) o;
        return Objects.equals(name, that.name) && mode == that.mode;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, mode);
    }

    @Override
    public String toString() {
        return "AttributeDescriptor{" +
                "name='" + name + '\'' +
                ", mode=" + mode +
                ", codelist='" + codelist + '\'' +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String resolvedColumn;
        private ResolutionMode mode = ResolutionMode.ENTITY_AND_GROUP_LEVEL;
        private String fineDomain;
        private String fineVariable;
        private String coarseParameter;
        private String codelist;
        private final Map<UncertaintyCondition, String> messages = new EnumMap<>(UncertaintyCondition.class);

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        /**
         * Output column for the resolved value. Defaults to the attribute name.
         */
        public Builder resolvedColumn(String resolvedColumn) {
            this.resolvedColumn = resolvedColumn;
            return this;
        }

        public Builder mode(ResolutionMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder fineSource(String domain, String variable) {
            this.fineDomain = domain;
            this.fineVariable = variable;
            return this;
        }

        public Builder coarseParameter(String coarseParameter) {
            this.coarseParameter = coarseParameter;
            return this;
        }

        public Builder codelist(String codelist) {
            this.codelist = codelist;
            return this;
        }

        public Builder message(UncertaintyCondition condition, String message) {
            this.messages.put(condition, message);
            return this;
        }

        public AttributeDescriptor build() {
            InputValidator.validateIdentifier(name, "Attribute name");
            if (resolvedColumn != null) {
                InputValidator.validateIdentifier(resolvedColumn, "Resolved column");
            }
            Objects.requireNonNull(mode, "mode is required");
            InputValidator.validateIdentifier(coarseParameter, "Coarse parameter");
            Objects.requireNonNull(codelist, "codelist is required");
            if (mode.hasEntityLevelSource()) {
                InputValidator.validateIdentifier(fineDomain, "Fine source domain");
                InputValidator.validateIdentifier(fineVariable, "Fine source variable");
            } else if (fineDomain != null || fineVariable != null) {
                throw new IllegalArgumentException("A group-level only attribute cannot have a fine source");
            }
            return new AttributeDescriptor(this);
        }
    }
}
