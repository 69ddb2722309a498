/**
 * PromptRelay source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.promptrelay.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.promptrelay.cli.PromptRelayCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.promptrelay.runtime.PromptRelayRuntime} wires documents, handlers, events and the executor.</li>
 *   <li>{@code io.promptrelay.execution.PromptExecutor} runs prompts step by step with retries and timeouts.</li>
 *   <li>{@code io.promptrelay.command.CommandGateway} authenticates and answers inbound automation commands.</li>
 * </ul>
 */
package io.promptrelay;
