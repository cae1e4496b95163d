/**
 * User feedback: sound cues, spoken acknowledgements and notifications with a console fallback.
 *
 * <p>Every call is fire-and-forget. Failures are logged and never reach the pipeline.
 */
package com.phillippitts.huevoice.service.feedback;
