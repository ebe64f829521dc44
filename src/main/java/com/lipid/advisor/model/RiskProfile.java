package com.lipid.advisor.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Clinical fields consumed by the cardiovascular risk classifier.
 * Numeric fields that are absent or non-finite are unknown.
 */
public final class RiskProfile {
    private final boolean ascvd;
    private final boolean diabetes;
    private final boolean diabetesTargetOrganDamage;
    private final Integer majorRiskFactorCount;
    private final boolean longDurationType1Diabetes;
    private final Double egfr;
    private final Double systolicBp;
    private final Double ldlMgdl;
    private final boolean familialHypercholesterolemia;
    private final RiskCategory score2Category;
    private final boolean hypertension;
    private final boolean smoking;
    private final boolean familyHistoryPrematureAscvd;
    private final boolean obesity;
    private final boolean metabolicSyndrome;
    private final Double lipoproteinA;

    private RiskProfile(Builder builder) {
        this.ascvd = builder.ascvd;
        this.diabetes = builder.diabetes;
        this.diabetesTargetOrganDamage = builder.diabetesTargetOrganDamage;
        this.majorRiskFactorCount = builder.majorRiskFactorCount;
        this.longDurationType1Diabetes = builder.longDurationType1Diabetes;
        this.egfr = builder.egfr;
        this.systolicBp = builder.systolicBp;
        this.ldlMgdl = builder.ldlMgdl;
        this.familialHypercholesterolemia = builder.familialHypercholesterolemia;
        this.score2Category = builder.score2Category;
        this.hypertension = builder.hypertension;
        this.smoking = builder.smoking;
        this.familyHistoryPrematureAscvd = builder.familyHistoryPrematureAscvd;
        this.obesity = builder.obesity;
        this.metabolicSyndrome = builder.metabolicSyndrome;
        this.lipoproteinA = builder.lipoproteinA;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Derive a risk profile from an extracted patient state.
     * ACS, PCI or CABG history counts as established ASCVD; hypertension covers
     * both the diagnosis and anti-hypertensive medication.
     * @param state The patient state
     * @return Builder pre-populated from the state, ready for further clinical fields
     */
    public static Builder from(PatientState state) {
        return builder()
                .ascvd(state.has(ClinicalFlag.ACS_HISTORY)
                        || state.has(ClinicalFlag.PCI_HISTORY)
                        || state.has(ClinicalFlag.CABG_HISTORY))
                .diabetes(state.has(ClinicalFlag.DIABETES))
                .hypertension(state.has(ClinicalFlag.HYPERTENSION)
                        || state.has(ClinicalFlag.ANTIHYPERTENSIVE_MEDICATION))
                .smoking(state.has(ClinicalFlag.CURRENT_SMOKER))
                .familyHistoryPrematureAscvd(state.has(ClinicalFlag.FAMILY_HISTORY_PREMATURE_ASCVD))
                .ldlMgdl(state.getLdlMgdl().orElse(null));
    }

    public boolean isAscvd() {
        return ascvd;
    }

    public boolean isDiabetes() {
        return diabetes;
    }

    public boolean isDiabetesTargetOrganDamage() {
        return diabetesTargetOrganDamage;
    }

    public Optional<Integer> getMajorRiskFactorCount() {
        return Optional.ofNullable(majorRiskFactorCount);
    }

    public boolean isLongDurationType1Diabetes() {
        return longDurationType1Diabetes;
    }

    public Optional<Double> getEgfr() {
        return Optional.ofNullable(egfr);
    }

    public Optional<Double> getSystolicBp() {
        return Optional.ofNullable(systolicBp);
    }

    public Optional<Double> getLdlMgdl() {
        return Optional.ofNullable(ldlMgdl);
    }

    public boolean isFamilialHypercholesterolemia() {
        return familialHypercholesterolemia;
    }

    public Optional<RiskCategory> getScore2Category() {
        return Optional.ofNullable(score2Category);
    }

    public boolean isHypertension() {
        return hypertension;
    }

    public boolean isSmoking() {
        return smoking;
    }

    public boolean isFamilyHistoryPrematureAscvd() {
        return familyHistoryPrematureAscvd;
    }

    public boolean isObesity() {
        return obesity;
    }

    public boolean isMetabolicSyndrome() {
        return metabolicSyndrome;
    }

    /**
     * Lipoprotein(a) in mg/dL. Carried for reporting only; it never changes the risk category.
     */
    public Optional<Double> getLipoproteinA() {
        return Optional.ofNullable(lipoproteinA);
    }

    /**
     * @return true when any generic risk-enhancing factor is present
     */
    public boolean hasRiskEnhancer() {
        return hypertension || smoking || familyHistoryPrematureAscvd || obesity || metabolicSyndrome;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RiskProfile other)) {
            return false;
        }
        return ascvd == other.ascvd
                && diabetes == other.diabetes
                && diabetesTargetOrganDamage == other.diabetesTargetOrganDamage
                && Objects.equals(majorRiskFactorCount, other.majorRiskFactorCount)
                && longDurationType1Diabetes == other.longDurationType1Diabetes
                && Objects.equals(egfr, other.egfr)
                && Objects.equals(systolicBp, other.systolicBp)
                && Objects.equals(ldlMgdl, other.ldlMgdl)
                && familialHypercholesterolemia == other.familialHypercholesterolemia
                && score2Category == other.score2Category
                && hypertension == other.hypertension
                && smoking == other.smoking
                && familyHistoryPrematureAscvd == other.familyHistoryPrematureAscvd
                && obesity == other.obesity
                && metabolicSyndrome == other.metabolicSyndrome
                && Objects.equals(lipoproteinA, other.lipoproteinA);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ascvd, diabetes, diabetesTargetOrganDamage, majorRiskFactorCount,
                longDurationType1Diabetes, egfr, systolicBp, ldlMgdl, familialHypercholesterolemia,
                score2Category, hypertension, smoking, familyHistoryPrematureAscvd, obesity,
                metabolicSyndrome, lipoproteinA);
    }

    private static Double finiteOrNull(Double value) {
        return value != null && Double.isFinite(value) ? value : null;
    }

    public static final class Builder {
        private boolean ascvd;
        private boolean diabetes;
        private boolean diabetesTargetOrganDamage;
        private Integer majorRiskFactorCount;
        private boolean longDurationType1Diabetes;
        private Double egfr;
        private Double systolicBp;
        private Double ldlMgdl;
        private boolean familialHypercholesterolemia;
        private RiskCategory score2Category;
        private boolean hypertension;
        private boolean smoking;
        private boolean familyHistoryPrematureAscvd;
        private boolean obesity;
        private boolean metabolicSyndrome;
        private Double lipoproteinA;

        private Builder() {
        }

        public Builder ascvd(boolean ascvd) {
            this.ascvd = ascvd;
            return this;
        }

        public Builder diabetes(boolean diabetes) {
            this.diabetes = diabetes;
            return this;
        }

        public Builder diabetesTargetOrganDamage(boolean diabetesTargetOrganDamage) {
            this.diabetesTargetOrganDamage = diabetesTargetOrganDamage;
            return this;
        }

        public Builder majorRiskFactorCount(Integer majorRiskFactorCount) {
            this.majorRiskFactorCount = majorRiskFactorCount;
            return this;
        }

        public Builder longDurationType1Diabetes(boolean longDurationType1Diabetes) {
            this.longDurationType1Diabetes = longDurationType1Diabetes;
            return this;
        }

        public Builder egfr(Double egfr) {
            this.egfr = finiteOrNull(egfr);
            return this;
        }

        public Builder systolicBp(Double systolicBp) {
            this.systolicBp = finiteOrNull(systolicBp);
            return this;
        }

        public Builder ldlMgdl(Double ldlMgdl) {
            this.ldlMgdl = finiteOrNull(ldlMgdl);
            return this;
        }

        public Builder familialHypercholesterolemia(boolean familialHypercholesterolemia) {
            this.familialHypercholesterolemia = familialHypercholesterolemia;
            return this;
        }

        public Builder score2Category(RiskCategory score2Category) {
            this.score2Category = score2Category;
            return this;
        }

        public Builder hypertension(boolean hypertension) {
            this.hypertension = hypertension;
            return this;
        }

        public Builder smoking(boolean smoking) {
            this.smoking = smoking;
            return this;
        }

        public Builder familyHistoryPrematureAscvd(boolean familyHistoryPrematureAscvd) {
            this.familyHistoryPrematureAscvd = familyHistoryPrematureAscvd;
            return this;
        }

        public Builder obesity(boolean obesity) {
            this.obesity = obesity;
            return this;
        }

        public Builder metabolicSyndrome(boolean metabolicSyndrome) {
            this.metabolicSyndrome = metabolicSyndrome;
            return this;
        }

        public Builder lipoproteinA(Double lipoproteinA) {
            this.lipoproteinA = finiteOrNull(lipoproteinA);
            return this;
        }

        public RiskProfile build() {
            return new RiskProfile(this);
        }
    }
}
