/*
 *  Copyright (C) 2020-2025 Lucas Nishimura <lucas.nishimura at gmail.com>
 *
 *  This program is free software: you can redistribute it and/or modify
 *  it under the terms of the GNU General Public License as published by
 *  the Free Software Foundation, either version 3 of the License, or
 *  (at your option) any later version.
 *
 *  This program is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied warranty of
 *  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *  GNU General Public License for more details.
 *
 *  You should have received a copy of the GNU General Public License
 *  along with this program.  If not, see <https://www.gnu.org/licenses/>
 */

package dev.nishisan.vinfo.probe;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}. Standard error is discarded.
 * <p>
 * Standard output goes to a temporary file so the timeout bounds the whole run, including
 * commands that keep their output open. A command still running when the timeout expires is
 * killed.
 */
public final class ProcessCommandRunner implements CommandRunner {
    private static final Logger LOGGER = Logger.getLogger(ProcessCommandRunner.class.getName());

    private final Duration timeout;

    public ProcessCommandRunner(Duration timeout) {
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    @Override
    public CommandResult run(List<String> command) throws ProbeException {
        LOGGER.fine(() -> "Running " + String.join(" ", command));
        Path output;
        try {
            output = Files.createTempFile("vinfo-cmd-", ".out");
        } catch (IOException e) {
            throw new ProbeException("Failed to create output file for " + command.get(0), e);
        }
        try {
            return runTo(command, output);
        } finally {
            try {
                Files.deleteIfExists(output);
            } catch (IOException e) {
                LOGGER.log(Level.WARNING, "Failed to delete command output " + output, e);
            }
        }
    }

    private CommandResult runTo(List<String> command, Path output) throws ProbeException {
        Process process;
        try {
            process = new ProcessBuilder(command)
                    .redirectOutput(output.toFile())
                    .redirectError(ProcessBuilder.Redirect.DISCARD)
                    .start();
        } catch (IOException e) {
            throw new ProbeException("Failed to start " + command.get(0), e);
        }
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new ProbeException(command.get(0) + " did not finish within " + timeout);
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new ProbeException("Interrupted while waiting for " + command.get(0), e);
        }
        try {
            return new CommandResult(process.exitValue(), new String(Files.readAllBytes(output), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ProbeException("Failed to read output of " + command.get(0), e);
        }
    }
}
