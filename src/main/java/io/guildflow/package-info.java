/**
 * GuildFlow source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.guildflow.Main} bootstraps the operator CLI.</li>
 *   <li>{@code io.guildflow.engine.GuildFlowEngine} gates platform events and routes them to one workflow.</li>
 *   <li>{@code io.guildflow.engine.CommandRouter} maps slash commands to workflow calls.</li>
 *   <li>{@code io.guildflow.storage.RecordSet} is the authoritative persistence layer.</li>
 * </ul>
 */
package io.guildflow;
