package com.example.filesearch;

import java.io.IOException;
import java.util.List;

/**
 * Starts external processes; replaced in tests with a runner handing out fake processes.
 */
public interface ProcessRunner {
    Process start(List<String> command) throws IOException;
}
