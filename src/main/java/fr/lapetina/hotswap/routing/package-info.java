/**
 * Request routing from the HTTP layer to worker slots.
 */
package fr.lapetina.hotswap.routing;
