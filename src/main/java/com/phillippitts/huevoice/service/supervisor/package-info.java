/**
 * Pipeline supervision: stage generations, error policies, restart with backoff.
 */
package com.phillippitts.huevoice.service.supervisor;
