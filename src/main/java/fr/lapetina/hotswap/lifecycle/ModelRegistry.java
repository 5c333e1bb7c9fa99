package fr.lapetina.hotswap.lifecycle;

import fr.lapetina.hotswap.domain.model.SlotId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Registry of model entries, one per model name.
 *
 * Entries are created on first use and never removed; concurrent first uses of the
 * same name observe the same entry.
 */
public final class ModelRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ModelRegistry.class);

    private final Map<String, ModelEntry> entries = new ConcurrentHashMap<>();
    private final Function<String, ModelEntry> entryFactory;

    public ModelRegistry(Function<String, ModelEntry> entryFactory) {
        this.entryFactory = entryFactory;
    }

    /**
     * Returns the entry for a model, creating it if needed.
     */
    public ModelEntry getOrCreate(String modelName) {
        return entries.computeIfAbsent(modelName, name -> {
            ModelEntry entry = entryFactory.apply(name);
            log.info("Model registered: name={}, slotA={}, slotB={}", name,
                    entry.slots().handle(SlotId.A).getBaseUrl(),
                    entry.slots().handle(SlotId.B).getBaseUrl());
            return entry;
        });
    }

    /**
     * Looks up an entry without creating one.
     */
    public Optional<ModelEntry> find(String modelName) {
        return Optional.ofNullable(entries.get(modelName));
    }

    /**
     * Gets all registered entries, sorted by name.
     */
    public List<ModelEntry> all() {
        List<ModelEntry> result = new ArrayList<>(entries.values());
        result.sort(Comparator.comparing(ModelEntry::name));
        return result;
    }

    public List<String> names() {
        return all().stream().map(ModelEntry::name).toList();
    }

    public int size() {
        return entries.size();
    }

    @Override
    public void close() {
        for (ModelEntry entry : entries.values()) {
            try {
                entry.controller().close();
            } catch (Exception e) {
                log.warn("Error closing controller: model={}", entry.name(), e);
            }
        }
    }
}
