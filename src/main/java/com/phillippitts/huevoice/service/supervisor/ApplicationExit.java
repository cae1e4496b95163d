package com.phillippitts.huevoice.service.supervisor;

/**
 * Terminates the process with a status code. Replaced in tests.
 */
@FunctionalInterface
public interface ApplicationExit {

    void exit(int status);
}
