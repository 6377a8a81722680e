/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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
 */

package dev.mars.gantry.workflow.run;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognises workflow commands in step output. The grammar is strictly line based: a
 * command must occupy the whole line.
 *
 * <pre>
 * ::set-output name=&lt;identifier&gt;::&lt;value&gt;
 * ::add-mask::&lt;value&gt;
 * </pre>
 *
 * <p>Values unescape {@code %0D}, {@code %0A} and {@code %25}. A malformed
 * {@code set-output} is ignored with a warning; other lines, including unknown
 * commands, are plain output.</p>
 */
public final class WorkflowCommandParser {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowCommandParser.class);

    private static final String SET_OUTPUT = "::set-output";
    private static final String ADD_MASK = "::add-mask::";
    private static final Pattern SET_OUTPUT_PATTERN =
            Pattern.compile("^::set-output name=([A-Za-z_][A-Za-z0-9_-]*)::(.*)$");

    public enum CommandType {
        SET_OUTPUT, ADD_MASK
    }

    public static final class Command {
        private final CommandType type;
        private final String name;
        private final String value;

        private Command(CommandType type, String name, String value) {
            this.type = type;
            this.name = name;
            this.value = value;
        }

        public CommandType getType() {
            return type;
        }

        /**
         * Output name; {@code null} for {@code add-mask}.
         */
        public String getName() {
            return name;
        }

        public String getValue() {
            return value;
        }
    }

    private WorkflowCommandParser() {
    }

    /**
     * Parses one output line.
     *
     * @return the command, or {@code null} if the line is not a recognised command
     */
    public static Command parse(String line) {
        if (line == null || !line.startsWith("::")) {
            return null;
        }

        if (line.startsWith(ADD_MASK)) {
            String value = unescape(line.substring(ADD_MASK.length()));
            return value.isEmpty() ? null : new Command(CommandType.ADD_MASK, null, value);
        }

        if (line.startsWith(SET_OUTPUT)) {
            Matcher matcher = SET_OUTPUT_PATTERN.matcher(line);
            if (!matcher.matches()) {
                logger.warn("Ignoring malformed set-output command");
                return null;
            }
            return new Command(CommandType.SET_OUTPUT, matcher.group(1), unescape(matcher.group(2)));
        }

        return null;
    }

    static String unescape(String value) {
        return value.replace("%0D", "\r").replace("%0A", "\n").replace("%25", "%");
    }
}
