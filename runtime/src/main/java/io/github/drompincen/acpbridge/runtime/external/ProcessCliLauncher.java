package io.github.drompincen.acpbridge.runtime.external;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Launches commands detached, optionally inside a terminal emulator given as a command prefix
 * (for example {@code x-terminal-emulator -e}).
 */
@Component
public class ProcessCliLauncher implements CliLauncher {

    private static final Logger log = LoggerFactory.getLogger(ProcessCliLauncher.class);

    private final List<String> terminalPrefix;

    public ProcessCliLauncher(@Value("${acpbridge.providers.terminal-command:}") String terminalCommand) {
        this.terminalPrefix = terminalCommand == null || terminalCommand.isBlank()
                ? List.of()
                : Arrays.asList(terminalCommand.trim().split("\\s+"));
    }

    @Override
    public boolean isOnPath(String executable) {
        String path = System.getenv("PATH");
        if (path == null) return false;
        for (String dir : path.split(File.pathSeparator)) {
            if (dir.isEmpty()) continue;
            Path candidate = Path.of(dir, executable);
            if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public void launch(List<String> command, Path workingDirectory) throws IOException {
        List<String> full = new ArrayList<>(terminalPrefix);
        full.addAll(command);
        ProcessBuilder pb = new ProcessBuilder(full)
                .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                .redirectError(ProcessBuilder.Redirect.DISCARD);
        if (workingDirectory != null && Files.isDirectory(workingDirectory)) {
            pb.directory(workingDirectory.toFile());
        }
        pb.start();
        log.info("Launched {} in {}", full, workingDirectory);
    }
}
