package com.healthtwin.service;

import com.healthtwin.model.enums.ChangeDirection;
import com.healthtwin.model.enums.DrugClass;
import com.healthtwin.model.medication.MedicationEffect;
import com.healthtwin.model.medication.MedicationImpact;
import com.healthtwin.model.parameter.Parameter;
import com.healthtwin.model.parameter.ParameterSnapshot;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class MedicationImpactServiceTest {

    private final MedicationImpactService service = new MedicationImpactService();

    private final ParameterSnapshot baseline = ParameterSnapshot.builder()
        .set(Parameter.TOTAL_CHOLESTEROL, 240)
        .set(Parameter.LDL, 150)
        .set(Parameter.ALT, 30)
        .set(Parameter.POTASSIUM, 4.2)
        .set(Parameter.BLOOD_PRESSURE_SYSTOLIC, 150)
        .set(Parameter.TSH, 6.0)
        .build();

    @Test
    void statin_lowersLipids_andRaisesAlt() {
        MedicationImpact impact = service.predict(baseline, "Atorvastatin 20mg");

        assertThat(impact.drugClass()).isEqualTo(DrugClass.STATIN);
        assertThat(impact.effects()).containsOnlyKeys(Parameter.TOTAL_CHOLESTEROL, Parameter.LDL, Parameter.ALT);

        MedicationEffect ldl = impact.effects().get(Parameter.LDL);
        assertThat(ldl.after()).isEqualTo(100.0);
        assertThat(ldl.percentageChange()).isEqualTo(-33.3);
        assertThat(ldl.formattedChange()).isEqualTo("-33.3%");
        assertThat(ldl.confidence()).isEqualTo(90);

        MedicationEffect alt = impact.effects().get(Parameter.ALT);
        assertThat(alt.after()).isEqualTo(36.0);
        assertThat(alt.direction()).isEqualTo(ChangeDirection.POSITIVE);
        assertThat(alt.formattedChange()).isEqualTo("+20.0%");
    }

    @Test
    void thyroidReplacement_normalizesTsh() {
        MedicationEffect tsh = service.predict(baseline, "levothyroxine").effects().get(Parameter.TSH);

        assertThat(tsh.after()).isEqualTo(2.5);
        assertThat(tsh.direction()).isEqualTo(ChangeDirection.NORMALIZE);
    }

    @Test
    void potassiumSparingDiuretic_raisesPotassium_othersLowerIt() {
        assertThat(service.predict(baseline, "spironolactone").effects().get(Parameter.POTASSIUM).after())
            .isEqualTo(4.6);
        assertThat(service.predict(baseline, "furosemide").effects().get(Parameter.POTASSIUM).after())
            .isEqualTo(3.9);
    }

    @Test
    void unknownDrug_returnsNoteInsteadOfPredictions() {
        MedicationImpact impact = service.predict(baseline, "ibuprofen");

        assertThat(impact.hasPredictions()).isFalse();
        assertThat(impact.drugClass()).isNull();
        assertThat(impact.note()).contains("ibuprofen");
        assertThat(impact.noteConfidence()).isEqualTo(50);
    }

    @Test
    void knownDrugWithoutRelevantBaselineFields_alsoReturnsNote() {
        MedicationImpact impact = service.predict(baseline, "metformin");

        assertThat(impact.drugClass()).isEqualTo(DrugClass.METFORMIN);
        assertThat(impact.hasPredictions()).isFalse();
    }
}
