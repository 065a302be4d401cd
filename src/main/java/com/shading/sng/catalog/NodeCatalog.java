package com.shading.sng.catalog;

import java.util.List;
import java.util.Optional;

/**
 * Read-only source of node definitions keyed by definition id.
 */
public interface NodeCatalog {

    Optional<NodeDefinition> getDefinition(String definitionId);

    List<NodeDefinition> allDefinitions();

    List<String> categories();

    List<NodeDefinition> definitionsByCategory(String category);

    /** Case-insensitive match over name, description and category. */
    List<NodeDefinition> search(String query);
}
