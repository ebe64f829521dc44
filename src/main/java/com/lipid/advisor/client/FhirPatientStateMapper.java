package com.lipid.advisor.client;

import com.lipid.advisor.extractor.ClinicalVocabulary;
import com.lipid.advisor.extractor.TextNormalizer;
import com.lipid.advisor.model.ClinicalFlag;
import com.lipid.advisor.model.PatientResources;
import com.lipid.advisor.model.PatientState;
import com.lipid.advisor.model.RiskProfile;
import com.lipid.advisor.model.Sex;
import org.hl7.fhir.r4.model.CodeableConcept;
import org.hl7.fhir.r4.model.Condition;
import org.hl7.fhir.r4.model.MedicationStatement;
import org.hl7.fhir.r4.model.Observation;
import org.hl7.fhir.r4.model.Procedure;
import org.hl7.fhir.r4.model.Quantity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Maps FHIR R4 resources onto the structured records consumed by the risk classifier
 * and the eligibility evaluator. Coded data is matched by SNOMED CT and LOINC codes;
 * uncoded or locally coded resources fall back to the narrative vocabulary applied to
 * their display text.
 */
public class FhirPatientStateMapper {

    private static final Logger logger = LoggerFactory.getLogger(FhirPatientStateMapper.class);

    // SNOMED CT
    private static final List<String> SNOMED_ACS = List.of(
        "394659003",  // Acute coronary syndrome
        "22298006",   // Myocardial infarction
        "4557003",    // Preinfarction syndrome (unstable angina)
        "401303003",  // Acute ST segment elevation myocardial infarction
        "401314000"   // Acute non-ST segment elevation myocardial infarction
    );
    private static final List<String> SNOMED_PCI = List.of(
        "415070008",  // Percutaneous coronary intervention
        "36969009"    // Placement of stent in coronary artery
    );
    private static final List<String> SNOMED_CABG = List.of("232717009");
    private static final List<String> SNOMED_HYPERTENSION = List.of("38341003", "59621000");
    private static final List<String> SNOMED_DIABETES = List.of("44054006", "46635009", "73211009");
    private static final List<String> SNOMED_FAMILIAL_HYPERCHOLESTEROLEMIA = List.of("398036000");
    private static final List<String> SNOMED_OBESITY = List.of("414916001");
    private static final List<String> SNOMED_METABOLIC_SYNDROME = List.of("237602007");
    private static final List<String> SNOMED_CURRENT_SMOKER = List.of(
        "449868002",        // Smokes tobacco daily
        "428041000124106",  // Occasional tobacco smoker
        "77176002"          // Smoker
    );

    // LOINC
    private static final String[] LOINC_LDL = {"13457-7", "18262-5", "2089-1"};
    private static final String[] LOINC_EGFR = {"33914-3", "48642-3", "62238-1"};
    private static final String LOINC_SYSTOLIC_BP = "8480-6";
    private static final String LOINC_BP_PANEL = "85354-9";
    private static final String LOINC_LPA_MASS = "10835-7";
    private static final String LOINC_BMI = "39156-5";
    private static final String LOINC_TOBACCO_STATUS = "72166-2";

    static final double LDL_MMOL_TO_MGDL = 38.67;
    private static final double OBESITY_BMI = 30.0;

    /**
     * Build the patient state used for reimbursement eligibility
     * @param resources FHIR resources for one patient
     * @return PatientState with demographics, latest LDL-C in mg/dL and clinical flags
     */
    public PatientState toPatientState(PatientResources resources) {
        if (resources == null) {
            throw new IllegalArgumentException("PatientResources cannot be null");
        }

        PatientState.Builder state = PatientState.builder()
            .age(resources.getAge().orElse(null))
            .sex(mapSex(resources))
            .ldlMgdl(latestLdlMgdl(resources).orElse(null));

        List<String> conditionTexts = describeConditions(resources.getConditions());
        List<String> procedureTexts = describeProcedures(resources.getProcedures());
        List<String> medicationTexts = describeMedications(resources.getMedications());

        state.flag(ClinicalFlag.ACS_HISTORY,
            hasCondition(resources, SNOMED_ACS) || matchesAny(ClinicalFlag.ACS_HISTORY, conditionTexts));
        state.flag(ClinicalFlag.PCI_HISTORY,
            hasProcedure(resources, SNOMED_PCI) || matchesAny(ClinicalFlag.PCI_HISTORY, procedureTexts));
        state.flag(ClinicalFlag.CABG_HISTORY,
            hasProcedure(resources, SNOMED_CABG) || matchesAny(ClinicalFlag.CABG_HISTORY, procedureTexts));
        state.flag(ClinicalFlag.HYPERTENSION,
            hasCondition(resources, SNOMED_HYPERTENSION) || matchesAny(ClinicalFlag.HYPERTENSION, conditionTexts));
        state.flag(ClinicalFlag.ANTIHYPERTENSIVE_MEDICATION,
            matchesAny(ClinicalFlag.ANTIHYPERTENSIVE_MEDICATION, medicationTexts));
        state.flag(ClinicalFlag.DIABETES,
            hasCondition(resources, SNOMED_DIABETES)
                || matchesAny(ClinicalFlag.DIABETES, conditionTexts)
                || matchesAny(ClinicalFlag.DIABETES, medicationTexts));
        state.flag(ClinicalFlag.CURRENT_SMOKER, isCurrentSmoker(resources));
        state.flag(ClinicalFlag.FAMILY_HISTORY_PREMATURE_ASCVD,
            matchesAny(ClinicalFlag.FAMILY_HISTORY_PREMATURE_ASCVD, conditionTexts));

        PatientState result = state.build();
        logger.debug("Mapped patient {} to {}", resources.getPatientId(), result);
        return result;
    }

    /**
     * Build the risk profile used for cardiovascular risk classification
     * @param resources FHIR resources for one patient
     * @return RiskProfile combining the patient state with renal function, blood pressure,
     *         lipoprotein(a) and metabolic findings
     */
    public RiskProfile toRiskProfile(PatientResources resources) {
        PatientState state = toPatientState(resources);

        return RiskProfile.from(state)
            .egfr(latestValue(resources, LOINC_EGFR).orElse(null))
            .systolicBp(latestSystolicBp(resources).orElse(null))
            .lipoproteinA(latestValue(resources, LOINC_LPA_MASS).orElse(null))
            .familialHypercholesterolemia(hasCondition(resources, SNOMED_FAMILIAL_HYPERCHOLESTEROLEMIA))
            .obesity(hasCondition(resources, SNOMED_OBESITY)
                || latestValue(resources, LOINC_BMI).map(bmi -> bmi >= OBESITY_BMI).orElse(false))
            .metabolicSyndrome(hasCondition(resources, SNOMED_METABOLIC_SYNDROME))
            .build();
    }

    private Sex mapSex(PatientResources resources) {
        if (resources.getPatient() == null || !resources.getPatient().hasGender()) {
            return Sex.UNKNOWN;
        }
        return switch (resources.getPatient().getGender()) {
            case MALE -> Sex.M;
            case FEMALE -> Sex.F;
            default -> Sex.UNKNOWN;
        };
    }

    /**
     * Latest LDL-C converted to mg/dL
     */
    private Optional<Double> latestLdlMgdl(PatientResources resources) {
        return resources.getLatestObservation(LOINC_LDL)
            .filter(Observation::hasValueQuantity)
            .flatMap(obs -> quantityValue(obs.getValueQuantity())
                .map(value -> isMillimolar(obs.getValueQuantity()) ? value * LDL_MMOL_TO_MGDL : value));
    }

    private boolean isMillimolar(Quantity quantity) {
        String unit = quantity.hasUnit() ? quantity.getUnit().toLowerCase() : "";
        String code = quantity.hasCode() ? quantity.getCode().toLowerCase() : "";
        return unit.contains("mmol") || code.contains("mmol");
    }

    private Optional<Double> latestValue(PatientResources resources, String... loincCodes) {
        return resources.getLatestObservation(loincCodes)
            .filter(Observation::hasValueQuantity)
            .flatMap(obs -> quantityValue(obs.getValueQuantity()));
    }

    /**
     * Systolic pressure is recorded either as its own observation or as a component
     * of the blood pressure panel
     */
    private Optional<Double> latestSystolicBp(PatientResources resources) {
        Optional<Double> standalone = latestValue(resources, LOINC_SYSTOLIC_BP);
        if (standalone.isPresent()) {
            return standalone;
        }
        return resources.getLatestObservation(LOINC_BP_PANEL)
            .flatMap(panel -> panel.getComponent().stream()
                .filter(component -> PatientResources.hasAnyCode(component.getCode(), List.of(LOINC_SYSTOLIC_BP)))
                .filter(Observation.ObservationComponentComponent::hasValueQuantity)
                .findFirst()
                .flatMap(component -> quantityValue(component.getValueQuantity())));
    }

    private Optional<Double> quantityValue(Quantity quantity) {
        if (quantity == null || !quantity.hasValue()) {
            return Optional.empty();
        }
        return Optional.of(quantity.getValue().doubleValue());
    }

    private boolean isCurrentSmoker(PatientResources resources) {
        Optional<Observation> status = resources.getLatestObservation(LOINC_TOBACCO_STATUS);
        if (status.isPresent() && status.get().hasValueCodeableConcept()) {
            return PatientResources.hasAnyCode(status.get().getValueCodeableConcept(), SNOMED_CURRENT_SMOKER);
        }
        return hasCondition(resources, SNOMED_CURRENT_SMOKER);
    }

    private boolean hasCondition(PatientResources resources, List<String> codes) {
        return resources.getConditions().stream()
            .filter(this::isAsserted)
            .anyMatch(condition -> PatientResources.hasAnyCode(condition.getCode(), codes));
    }

    private boolean hasProcedure(PatientResources resources, List<String> codes) {
        return resources.getProcedures().stream()
            .filter(procedure -> procedure.getStatus() != Procedure.ProcedureStatus.ENTEREDINERROR)
            .anyMatch(procedure -> PatientResources.hasAnyCode(procedure.getCode(), codes));
    }

    /**
     * Conditions recorded in error or refuted do not count as history
     */
    private boolean isAsserted(Condition condition) {
        if (!condition.hasVerificationStatus()) {
            return true;
        }
        return !PatientResources.hasAnyCode(condition.getVerificationStatus(), List.of("entered-in-error", "refuted"));
    }

    private List<String> describeConditions(List<Condition> conditions) {
        List<String> texts = new ArrayList<>();
        for (Condition condition : conditions) {
            if (isAsserted(condition)) {
                addDescription(texts, condition.getCode());
            }
        }
        return texts;
    }

    private List<String> describeProcedures(List<Procedure> procedures) {
        List<String> texts = new ArrayList<>();
        for (Procedure procedure : procedures) {
            if (procedure.getStatus() != Procedure.ProcedureStatus.ENTEREDINERROR) {
                addDescription(texts, procedure.getCode());
            }
        }
        return texts;
    }

    private List<String> describeMedications(List<MedicationStatement> medications) {
        List<String> texts = new ArrayList<>();
        for (MedicationStatement medication : medications) {
            if (medication.hasMedicationCodeableConcept()) {
                addDescription(texts, medication.getMedicationCodeableConcept());
            }
        }
        return texts;
    }

    private void addDescription(List<String> texts, CodeableConcept concept) {
        String text = TextNormalizer.normalize(PatientResources.describe(concept));
        if (!text.isEmpty()) {
            texts.add(text);
        }
    }

    private boolean matchesAny(ClinicalFlag flag, List<String> texts) {
        return texts.stream().anyMatch(ClinicalVocabulary.termsFor(flag)::matches);
    }
}
