/**
 * Explicit session object replacing process-wide mutable state.
 */
package ca.gc.cra.kafkarecon.application.session;
