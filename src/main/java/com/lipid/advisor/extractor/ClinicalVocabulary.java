package com.lipid.advisor.extractor;

import com.lipid.advisor.model.ClinicalFlag;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Keyword configuration for narrative extraction: English and Traditional Chinese
 * synonyms plus common drug names for each clinical flag, and LDL-C label variants.
 * Drug-name lists are best-effort and will miss brands not listed here.
 */
public final class ClinicalVocabulary {

    /** LDL-C labels, most specific first; the first label found in the text wins */
    public static final List<String> LDL_LABELS = List.of(
        "ldl-c",
        "ldl c",
        "ldl",
        "low-density lipoprotein",
        "low density lipoprotein",
        "低密度膽固醇",
        "低密度"
    );

    private static final Map<ClinicalFlag, TermSet> FLAG_TERMS;

    static {
        Map<ClinicalFlag, TermSet> terms = new EnumMap<>(ClinicalFlag.class);

        terms.put(ClinicalFlag.ACS_HISTORY, TermSet.builder()
            .words("acs")
            .literals("acute coronary syndrome", "unstable angina")
            .words("stemi", "nstemi")
            .literals("myocardial infarction")
            .words("ami")
            .literals("acute mi", "急性冠心症", "心肌梗塞")
            .build());

        terms.put(ClinicalFlag.PCI_HISTORY, TermSet.builder()
            .words("pci")
            .literals("stent", "ptca", "percutaneous coronary intervention", "支架")
            .build());

        terms.put(ClinicalFlag.CABG_HISTORY, TermSet.builder()
            .words("cabg")
            .literals("coronary artery bypass", "bypass surgery", "繞道手術")
            .build());

        terms.put(ClinicalFlag.HYPERTENSION, TermSet.builder()
            .words("htn")
            .literals("hypertension", "high blood pressure", "高血壓")
            .build());

        terms.put(ClinicalFlag.ANTIHYPERTENSIVE_MEDICATION, TermSet.builder()
            // calcium channel blockers
            .literals("amlodipine", "norvasc")
            // ARBs
            .literals("losartan", "valsartan", "candesartan", "telmisartan", "olmesartan", "irbesartan")
            // ACE inhibitors
            .literals("enalapril", "lisinopril", "ramipril", "perindopril")
            // beta blockers
            .literals("bisoprolol", "carvedilol", "metoprolol", "nebivolol")
            // diuretics and MRAs
            .literals("hctz", "hydrochlorothiazide", "indapamide", "chlorthalidone", "spironolactone", "eplerenone")
            .literals("降壓藥")
            .build());

        terms.put(ClinicalFlag.DIABETES, TermSet.builder()
            .words("dm")
            .literals("diabetes", "type 2 diabetes", "type 1 diabetes", "糖尿病")
            .literals("metformin", "glucophage", "sitagliptin", "linagliptin",
                "empagliflozin", "dapagliflozin", "canagliflozin",
                "liraglutide", "semaglutide", "insulin", "lantus", "humalog")
            .build());

        terms.put(ClinicalFlag.CURRENT_SMOKER, TermSet.builder()
            .literals("smoker", "smoking", "current smoker", "cigarette", "pack-year", "抽菸", "吸菸")
            .build());

        terms.put(ClinicalFlag.FAMILY_HISTORY_PREMATURE_ASCVD, TermSet.builder()
            .literals("family history of premature", "fh premature", "premature cad in family",
                "早發心血管家族史", "早發心臟病家族史", "家族史 早發")
            .build());

        FLAG_TERMS = Collections.unmodifiableMap(terms);
    }

    private ClinicalVocabulary() {
    }

    /**
     * @param flag The clinical flag
     * @return Configured terms for the flag
     */
    public static TermSet termsFor(ClinicalFlag flag) {
        return FLAG_TERMS.get(flag);
    }
}
