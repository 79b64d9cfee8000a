package ai.eigloo.workgraph.engine.spi;

import ai.eigloo.workgraph.graph.model.Dependency;
import ai.eigloo.workgraph.graph.model.DependencyKey;

import java.util.List;

/**
 * Durable edge storage behind the dependency graph store. Every method either completes
 * or throws; the store updates its index only after a call returns.
 */
public interface DependencyPersistence {

    void insert(Dependency dependency);

    /**
     * Replaces the metadata of an existing edge.
     */
    void update(Dependency dependency);

    void delete(DependencyKey key);

    List<Dependency> loadAll();
}
