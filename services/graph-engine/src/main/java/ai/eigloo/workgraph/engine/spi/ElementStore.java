package ai.eigloo.workgraph.engine.spi;

import ai.eigloo.workgraph.graph.model.Element;
import ai.eigloo.workgraph.graph.model.ElementType;

import java.util.List;
import java.util.Optional;

/**
 * Storage collaborator for elements. Lookups return soft-deleted elements too; callers
 * decide whether {@link Element#isDeleted()} matters.
 */
public interface ElementStore {

    Optional<Element> findById(String id);

    /**
     * Returns every stored element of a type, soft-deleted ones included.
     */
    List<Element> findAll(ElementType type);

    /**
     * Inserts or replaces an element.
     */
    Element save(Element element);

    /**
     * Removes an element permanently. Removing an absent element is a no-op.
     */
    void hardDelete(String id);
}
