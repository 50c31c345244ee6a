package io.github.drompincen.acpbridge.runtime.external;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Starts external command line tools for sessions that can only be continued outside this process.
 */
public interface CliLauncher {

    boolean isOnPath(String executable);

    void launch(List<String> command, Path workingDirectory) throws IOException;
}
