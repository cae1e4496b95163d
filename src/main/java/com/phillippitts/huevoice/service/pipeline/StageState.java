package com.phillippitts.huevoice.service.pipeline;

/**
 * Lifecycle of a single {@link PipelineStage} instance. Instances are not restarted;
 * the supervisor builds fresh ones.
 *
 * <pre>
 * NEW → RUNNING → STOPPED
 *          ↘ FAILED
 * </pre>
 */
public enum StageState { NEW, RUNNING, STOPPED, FAILED }
