/**
 * Runtime wiring package.
 *
 * <p>{@link io.promptrelay.runtime.PromptRelayRuntime} builds one owned instance of every
 * component from a single config and shuts the executor and event bus down on close.
 */
package io.promptrelay.runtime;
