package com.nzila.api.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Maps action type keys to their schema, policy rule and tool adapter.
 * New action types are added by declaring another {@link ActionTypeDefinition} bean.
 */
@Component
public class ActionTypeRegistry {

    private static final Logger log = LoggerFactory.getLogger(ActionTypeRegistry.class);

    private final Map<String, ActionTypeDefinition> definitions = new TreeMap<>();

    public ActionTypeRegistry(List<ActionTypeDefinition> definitions) {
        for (ActionTypeDefinition definition : definitions) {
            if (this.definitions.putIfAbsent(definition.key(), definition) != null) {
                throw new IllegalStateException("Duplicate action type registration: " + definition.key());
            }
        }
        log.info("Registered action types {}", this.definitions.keySet());
    }

    public Optional<ActionTypeDefinition> find(String actionType) {
        return Optional.ofNullable(actionType).map(definitions::get);
    }

    public ActionTypeDefinition require(String actionType) {
        return find(actionType).orElseThrow(() -> new UnknownActionTypeException(actionType));
    }

    public Set<String> keys() {
        return Set.copyOf(definitions.keySet());
    }
}
