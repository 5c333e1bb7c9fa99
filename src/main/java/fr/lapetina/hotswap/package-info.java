/**
 * Model hot-swap controller: an HTTP façade in front of supervised model workers that
 * promotes newly uploaded artifacts between two slots per model without losing requests.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.hotswap.ControllerFactory} - Wires the controller stack from YAML configuration</li>
 *   <li>{@link fr.lapetina.hotswap.HotSwapApplication} - Standalone HTTP server</li>
 *   <li>{@link fr.lapetina.hotswap.lifecycle.LifecycleController} - Per-model promotion state machine</li>
 *   <li>{@link fr.lapetina.hotswap.routing.RequestRouter} - Forwards or holds inference requests</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (ControllerFactory factory = ControllerFactory.create("config.yaml").start()) {
 *     ModelRequest request = ModelRequest.ofJson("greeter", "/webhooks/rest/webhook",
 *             "{\"sender\":\"u1\",\"message\":\"hello\"}");
 *     ModelResponse response = factory.getRouter().route("greeter", request).get();
 *     System.out.println(response.bodyAsString());
 * }
 * }</pre>
 *
 * @see fr.lapetina.hotswap.ControllerFactory
 * @see fr.lapetina.hotswap.lifecycle.LifecycleController
 */
package fr.lapetina.hotswap;
