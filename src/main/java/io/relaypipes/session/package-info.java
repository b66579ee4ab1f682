/**
 * Session facade.
 *
 * <p>{@link io.relaypipes.session.PipesSession} composes a params loader, a context loader and a
 * message writer, owns the process-wide session slot, and guarantees the {@code closed} message
 * when the handle is closed.
 */
package io.relaypipes.session;
