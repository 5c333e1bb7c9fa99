package fr.lapetina.hotswap.lifecycle;

/**
 * Everything the service keeps for one model name.
 */
public record ModelEntry(String name, ModelSlotPair slots, RequestQueue queue, LifecycleController controller) {
}
