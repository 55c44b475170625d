/**
 * Runtime composition package.
 *
 * <p>{@link io.agenthub.runtime.AgentHubRuntime} wires the store, the lock manager, the state and
 * transaction layers, the message bus and the router together, and owns the background sweeps
 * used by the CLI and by embedding applications.
 */
package io.agenthub.runtime;
