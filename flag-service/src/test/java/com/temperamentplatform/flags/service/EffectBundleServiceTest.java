package com.temperamentplatform.flags.service;

import com.temperamentplatform.common.model.Discipline;
import com.temperamentplatform.common.model.FlagValence;
import com.temperamentplatform.flags.FlagServiceFixtures;
import com.temperamentplatform.flags.dto.BreedingRequest;
import com.temperamentplatform.flags.dto.CompetitionRequest;
import com.temperamentplatform.flags.dto.FlagDefinitionSummary;
import com.temperamentplatform.flags.dto.TrainingRequest;
import com.temperamentplatform.flags.exception.SubjectNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static com.temperamentplatform.flags.FlagServiceFixtures.subject;
import static org.junit.jupiter.api.Assertions.*;

class EffectBundleServiceTest {

    private FlagServiceFixtures fx;
    private EffectBundleService service;

    @BeforeEach
    void setUp() {
        fx = new FlagServiceFixtures();
        service = fx.effectService();
        fx.subjects.put(subject(1L, "brave"));
        fx.subjects.put(subject(2L, "fearful"));
        fx.subjects.put(subject(3L, "brave", "legacy"));
    }

    @Test
    @DisplayName("effects aggregate the subject's held flags")
    void effects() {
        StepVerifier.create(service.effectsFor(1L))
            .assertNext(bundle -> {
                assertEquals(List.of("brave"), bundle.activeFlags());
                assertEquals(2.0, bundle.bonusFor(Discipline.SHOW_JUMPING), 1e-9);
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("undefined flags are excluded from effects")
    void unknownFlagExcluded() {
        StepVerifier.create(service.effectsFor(3L))
            .assertNext(bundle -> {
                assertEquals(List.of("brave"), bundle.activeFlags());
                assertEquals(List.of("legacy"), bundle.unknownFlags());
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("competition adjustment applies bonus and stress resistance")
    void competition() {
        StepVerifier.create(service.competition(1L, new CompetitionRequest(Discipline.SHOW_JUMPING, 50)))
            .assertNext(adj -> assertEquals(52.6, adj.modifiedScore(), 1e-9))
            .verifyComplete();
    }

    @Test
    @DisplayName("training adjustment never drops below the minimum effectiveness")
    void training() {
        StepVerifier.create(service.training(2L, new TrainingRequest(0.0, null)))
            .assertNext(adj -> assertTrue(adj.modifiedEffectiveness() >= 0.1))
            .verifyComplete();
    }

    @Test
    @DisplayName("breeding prediction halves changes when parents conflict")
    void breedingWithConflict() {
        StepVerifier.create(service.breeding(new BreedingRequest(1L, 2L, Map.of("fearless", 0.2))))
            .assertNext(prediction -> {
                assertTrue(prediction.parentConflicts().hasConflicts());
                double fearless = prediction.traitProbabilities().get("fearless");
                assertEquals(0.2 + 0.15 * 0.5, fearless, 1e-9);
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("missing parent errors with SubjectNotFoundException")
    void missingParent() {
        StepVerifier.create(service.breeding(new BreedingRequest(1L, 42L, Map.of())))
            .expectError(SubjectNotFoundException.class)
            .verify();
    }

    @Test
    @DisplayName("definitions list every registered flag in registry order")
    void definitions() {
        List<FlagDefinitionSummary> definitions = service.definitions();

        assertEquals(13, definitions.size());
        assertEquals("brave", definitions.get(0).name());
        assertEquals(FlagValence.POSITIVE, definitions.get(0).valence());
        assertEquals(List.of("fearful", "insecure"), definitions.get(0).conflictsWith());
        assertTrue(definitions.get(0).specializedRule());
        assertFalse(definitions.stream().filter(d -> d.name().equals("curious")).findFirst()
            .orElseThrow().specializedRule());
    }
}
