/**
 * Tool agents: signal handling and the request lifecycle around a single tool.
 *
 * <p>Key classes:
 * <ul>
 *   <li>{@code ToolRequestLifecycleManager} - rate limit, cache, queue, dispatch, metrics</li>
 *   <li>{@code BaseToolAgent} - signal routing and agent hooks</li>
 *   <li>{@code Tool} / {@code ToolInvoker} - the work itself and the boundary to it</li>
 *   <li>{@code ToolAgentRegistry} - agent lookup by name</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.purchasingpower.toolagent.agent;
