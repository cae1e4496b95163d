package com.phillippitts.huevoice.service.health;

import com.phillippitts.huevoice.service.pipeline.CaptureMode;
import com.phillippitts.huevoice.service.pipeline.StageState;
import com.phillippitts.huevoice.service.supervisor.PipelineSupervisor;
import com.phillippitts.huevoice.service.supervisor.SupervisorState;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Health indicator for the voice pipeline.
 *
 * <ul>
 *   <li>UP: supervisor running in gated mode with every stage running</li>
 *   <li>DEGRADED: restarting, running without wake word (continuous fallback), or a stage not running</li>
 *   <li>DOWN: supervisor failed</li>
 *   <li>UNKNOWN: pipeline not started or stopped</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class PipelineHealthIndicator implements HealthIndicator {

    private final PipelineSupervisor supervisor;

    public PipelineHealthIndicator(PipelineSupervisor supervisor) {
        this.supervisor = supervisor;
    }

    @Override
    public Health health() {
        SupervisorState state = supervisor.state();
        Map<String, StageState> stages = supervisor.stageStates();
        CaptureMode mode = supervisor.mode();

        Health.Builder builder = switch (state) {
            case FAILED -> Health.down();
            case NEW, STOPPED -> Health.unknown();
            case RESTARTING -> Health.status("DEGRADED");
            case RUNNING -> allRunning(stages) && mode == CaptureMode.GATED
                    ? Health.up()
                    : Health.status("DEGRADED");
        };
        return builder
                .withDetail("supervisor", state)
                .withDetail("mode", mode == null ? "none" : mode)
                .withDetail("stages", stages)
                .withDetail("restarts", supervisor.restartCount())
                .build();
    }

    private static boolean allRunning(Map<String, StageState> stages) {
        return stages.values().stream().allMatch(s -> s == StageState.RUNNING);
    }
}
