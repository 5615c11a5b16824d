package de.anton.spectral.analyser.spectral_analyzer.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Ordered collection of the maps derived from one dataset.
 * Names may repeat. The creation counter only ever grows, removals do not decrement it.
 */
public class MapRegistry {

    private static final Logger logger = LoggerFactory.getLogger(MapRegistry.class);

    private final List<DerivedMap> maps = new ArrayList<>();
    private int createdCount = 0;

    public void add(DerivedMap map) {
        Objects.requireNonNull(map, "Map cannot be null.");
        maps.add(map);
        createdCount++;
        logger.debug("Map '{}' added to registry ({} maps, {} created).", map.getName(), maps.size(), createdCount);
    }

    /**
     * Removes the map at the given position.
     *
     * @return the removed map, or empty if the index is out of range
     */
    public Optional<DerivedMap> removeAt(int index) {
        if (index < 0 || index >= maps.size()) {
            logger.warn("Cannot remove map at index {}: registry holds {} maps.", index, maps.size());
            return Optional.empty();
        }
        DerivedMap removed = maps.remove(index);
        logger.debug("Map '{}' removed from registry at index {}.", removed.getName(), index);
        return Optional.of(removed);
    }

    /**
     * Removes every map whose name equals the given name exactly.
     *
     * @return number of maps removed
     */
    public int removeByName(String name) {
        int before = maps.size();
        maps.removeIf(m -> m.getName().equals(name));
        int removed = before - maps.size();
        logger.debug("Removed {} map(s) named '{}'.", removed, name);
        return removed;
    }

    public List<String> namesInOrder() {
        return maps.stream().map(DerivedMap::getName).collect(Collectors.toUnmodifiableList());
    }

    public int countCreated() { return createdCount; }

    public DerivedMap get(int index) { return maps.get(index); }

    /** @return the first map with the given name, if any. */
    public Optional<DerivedMap> findByName(String name) {
        return maps.stream().filter(m -> m.getName().equals(name)).findFirst();
    }

    public List<DerivedMap> getMaps() { return Collections.unmodifiableList(maps); }

    public int size() { return maps.size(); }

    public boolean isEmpty() { return maps.isEmpty(); }
}
