/**
 * Run configuration, read from YAML with SnakeYAML.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * hosts:
 *   - name: host-01
 *     url: http://10.0.0.11:11434
 *     type: ollama
 *   - name: host-02
 *     url: http://10.0.0.12:8080
 *     type: llama.cpp
 * jobs:
 *   - llama3.2:1b
 *   - qwen3:1.7b
 * iterations: 3
 * dispatch:
 *   unloadBetweenBatches: true
 * }</pre>
 */
package fr.lapetina.inferencebench.infrastructure.config;
