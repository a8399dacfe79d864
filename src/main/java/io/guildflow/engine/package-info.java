/**
 * Event dispatch package.
 *
 * <p>{@link io.guildflow.engine.GuildFlowEngine} owns the worker pool and message handling,
 * {@link io.guildflow.engine.CommandRouter} the command table. Workflows return
 * {@link io.guildflow.engine.SideEffect} lists that {@link io.guildflow.engine.SideEffectExecutor}
 * carries out once state is persisted.
 */
package io.guildflow.engine;
