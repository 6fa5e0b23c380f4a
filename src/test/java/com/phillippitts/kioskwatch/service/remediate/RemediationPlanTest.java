package com.phillippitts.kioskwatch.service.remediate;

import com.phillippitts.kioskwatch.domain.ErrorKind;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class RemediationPlanTest {

    @Test
    void shouldMapEveryKindToAPlan() {
        assertThat(Arrays.stream(ErrorKind.values()).map(RemediationPlan::forKind)).doesNotContainNull();
    }

    @Test
    void shouldLeaveOnlyPermissionAndResourceErrorsWithoutStrategy() {
        assertThat(Arrays.stream(ErrorKind.values()).filter(k -> RemediationPlan.forKind(k) == RemediationPlan.NONE))
                .containsExactlyInAnyOrder(ErrorKind.PERMISSION_ERROR, ErrorKind.RESOURCE_ERROR);
    }

    @Test
    void shouldRestartForMemoryOnOutOfMemoryAndLeak() {
        assertThat(RemediationPlan.forKind(ErrorKind.OUT_OF_MEMORY)).isEqualTo(RemediationPlan.RESTART_FOR_MEMORY);
        assertThat(RemediationPlan.forKind(ErrorKind.POTENTIAL_MEMORY_LEAK)).isEqualTo(RemediationPlan.RESTART_FOR_MEMORY);
    }
}
