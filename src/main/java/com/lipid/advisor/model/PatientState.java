package com.lipid.advisor.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Normalized patient attributes used by the eligibility evaluator.
 * Instances are immutable; use {@link #builder()} or {@link #toBuilder()} to derive new ones.
 */
public final class PatientState {
    private final Integer age;
    private final Sex sex;
    private final Double ldlMgdl;
    private final Set<ClinicalFlag> flags;

    private PatientState(Builder builder) {
        this.age = builder.age;
        this.sex = builder.sex;
        this.ldlMgdl = builder.ldlMgdl;
        this.flags = Collections.unmodifiableSet(EnumSet.copyOf(builder.flags));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static PatientState empty() {
        return builder().build();
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
                .sex(sex);
        builder.age = age;
        builder.ldlMgdl = ldlMgdl;
        builder.flags.addAll(flags);
        return builder;
    }

    /**
     * @return Age in years, or empty when unknown
     */
    public Optional<Integer> getAge() {
        return Optional.ofNullable(age);
    }

    public Sex getSex() {
        return sex;
    }

    /**
     * @return LDL-C in mg/dL, or empty when unknown
     */
    public Optional<Double> getLdlMgdl() {
        return Optional.ofNullable(ldlMgdl);
    }

    public Set<ClinicalFlag> getFlags() {
        return flags;
    }

    public boolean has(ClinicalFlag flag) {
        return flags.contains(flag);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PatientState other)) {
            return false;
        }
        return Objects.equals(age, other.age)
                && sex == other.sex
                && Objects.equals(ldlMgdl, other.ldlMgdl)
                && flags.equals(other.flags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(age, sex, ldlMgdl, flags);
    }

    @Override
    public String toString() {
        return "PatientState{age=" + age + ", sex=" + sex + ", ldlMgdl=" + ldlMgdl + ", flags=" + flags + "}";
    }

    public static final class Builder {
        private Integer age;
        private Sex sex = Sex.UNKNOWN;
        private Double ldlMgdl;
        private final Set<ClinicalFlag> flags = EnumSet.noneOf(ClinicalFlag.class);

        private Builder() {
        }

        /**
         * Set the age; negative values are treated as unknown
         */
        public Builder age(Integer age) {
            this.age = age != null && age >= 0 ? age : null;
            return this;
        }

        public Builder sex(Sex sex) {
            this.sex = sex != null ? sex : Sex.UNKNOWN;
            return this;
        }

        /**
         * Set LDL-C in mg/dL; non-finite values are treated as unknown
         */
        public Builder ldlMgdl(Double ldlMgdl) {
            this.ldlMgdl = ldlMgdl != null && Double.isFinite(ldlMgdl) ? ldlMgdl : null;
            return this;
        }

        public Builder flag(ClinicalFlag flag, boolean present) {
            if (present) {
                flags.add(flag);
            } else {
                flags.remove(flag);
            }
            return this;
        }

        public Builder flag(ClinicalFlag flag) {
            return flag(flag, true);
        }

        public PatientState build() {
            return new PatientState(this);
        }
    }
}
