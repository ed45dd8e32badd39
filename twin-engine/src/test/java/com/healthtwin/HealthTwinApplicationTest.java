package com.healthtwin;

import com.healthtwin.model.enums.Gender;
import com.healthtwin.model.parameter.DemographicProfile;
import com.healthtwin.service.BaselineGeneratorService;
import com.healthtwin.service.SimulationService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Clock;
import java.time.ZoneId;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@SpringBootTest(properties = {
    "twin.clock.zone=Europe/Berlin",
    "twin.baseline.seed=1234"
})
class HealthTwinApplicationTest {

    @Autowired
    private Clock clock;

    @Autowired
    private BaselineGeneratorService baselineGeneratorService;

    @Autowired
    private SimulationService simulationService;

    @Test
    void contextLoads_withConfiguredClockAndSeed() {
        assertThat(simulationService).isNotNull();
        assertThat(clock.getZone()).isEqualTo(ZoneId.of("Europe/Berlin"));

        DemographicProfile profile = DemographicProfile.of(35, Gender.FEMALE, List.of());
        assertThat(baselineGeneratorService.generate(profile)).isEqualTo(baselineGeneratorService.generate(profile));
    }
}
