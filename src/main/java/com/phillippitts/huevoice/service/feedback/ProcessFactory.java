package com.phillippitts.huevoice.service.feedback;

import java.io.IOException;
import java.util.List;

/**
 * Abstraction over {@link ProcessBuilder} so feedback helpers can be tested without spawning
 * {@code say}, {@code afplay} or {@code osascript}.
 */
interface ProcessFactory {

    /**
     * @param command full command line, with the executable as the first element
     * @return started {@link Process}
     * @throws IOException if the executable cannot be started
     */
    Process start(List<String> command) throws IOException;
}
