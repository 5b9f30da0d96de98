/**
 * Connection lifecycle: builds and releases the admin and consumer handles of a session.
 */
package ca.gc.cra.kafkarecon.application.connect;
