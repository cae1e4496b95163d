/**
 * Stage plumbing: the {@link com.phillippitts.huevoice.service.pipeline.PipelineStage} lifecycle,
 * bounded channels between stages and the error taxonomy the supervisor acts on.
 */
package com.phillippitts.huevoice.service.pipeline;
