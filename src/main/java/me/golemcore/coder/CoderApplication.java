package me.golemcore.coder;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Coder.
 *
 * <p>
 * GolemCore Coder is the execution engine behind a coding assistant: it
 * triages a request, plans tagged steps, lets the model call tools, gates
 * risky calls behind an approval policy, executes tools inside file
 * transactions, verifies the result and reports.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters) with a phase state machine:
 *
 * <pre>
 * Domain Layer       → CodingAgentGraph, phase nodes, approval policy, services
 * Ports              → LlmPort, ToolTransportPort, CommandExecutionPort, ActivityLogPort
 * Infrastructure     → langchain4j adapter, builtin tools, activity log
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.yml} under the {@code coder.*}
 * prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class CoderApplication {

    public static void main(String[] args) {
        SpringApplication.run(CoderApplication.class, args);
    }

}
