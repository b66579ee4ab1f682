/**
 * RelayPipes source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.relaypipes.session.PipesSession} is the handle user code opens, reports through and closes.</li>
 *   <li>{@code io.relaypipes.params.ParamsLoader} locates and decodes the launcher's bootstrap blobs.</li>
 *   <li>{@code io.relaypipes.context.ContextLoader} builds the immutable run context.</li>
 *   <li>{@code io.relaypipes.writer.MessageWriter} opens the channel messages are appended to.</li>
 *   <li>{@code io.relaypipes.Main} bootstraps the developer CLI.</li>
 * </ul>
 */
package io.relaypipes;
