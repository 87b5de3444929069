package me.golemcore.coder.port.outbound;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.nio.file.Path;

/**
 * Runs a shell command in a directory and returns its combined output.
 * Implementations throw {@link CommandExecutionException} when the command
 * cannot be run or exits non-zero.
 */
public interface CommandExecutionPort {

    String execute(String command, Path workingDirectory);

    class CommandExecutionException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        private final String output;

        public CommandExecutionException(String message, String output) {
            super(message);
            this.output = output;
        }

        public String getOutput() {
            return output;
        }
    }
}
