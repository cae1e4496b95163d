package com.phillippitts.huevoice.service.supervisor;

import com.phillippitts.huevoice.service.pipeline.CaptureMode;
import com.phillippitts.huevoice.service.pipeline.PipelineStage;

import java.util.List;

/**
 * Builds a fresh, unstarted set of stages for one pipeline generation.
 */
public interface PipelineFactory {

    /**
     * @return stages ordered upstream to downstream
     */
    List<PipelineStage> create(CaptureMode mode);
}
