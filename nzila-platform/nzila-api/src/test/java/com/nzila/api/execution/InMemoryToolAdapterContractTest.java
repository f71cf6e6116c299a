package com.nzila.api.execution;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The idempotency contract against a minimal keyed adapter.
 */
class InMemoryToolAdapterContractTest extends ToolAdapterContract {

    private final UUID actionId = UUID.randomUUID();
    private final KeyedAdapter adapter = new KeyedAdapter();

    @Override
    protected ToolAdapter adapter() {
        return adapter;
    }

    @Override
    protected ToolInvocation invocation() {
        return new ToolInvocation(actionId, UUID.randomUUID(), UUID.randomUUID(), "test.keyed", "f".repeat(64),
                Map.of("key", "monthly-close"), 1, "tester");
    }

    @Override
    protected int sideEffects() {
        return adapter.writes.get();
    }

    static class KeyedAdapter implements ToolAdapter {
        private final Map<String, ArtifactRef> stored = new ConcurrentHashMap<>();
        private final AtomicInteger writes = new AtomicInteger();

        @Override
        public ToolResult invoke(ToolInvocation invocation) {
            String key = invocation.string("key");
            ArtifactRef existing = stored.get(key);
            if (existing != null) {
                return new ToolResult(List.of(existing), List.of(), BigDecimal.ZERO);
            }
            writes.incrementAndGet();
            ArtifactRef artifact = new ArtifactRef(UUID.randomUUID(), "keyed/" + key, "test", "e".repeat(64));
            stored.put(key, artifact);
            return new ToolResult(List.of(artifact), List.of(), BigDecimal.ONE);
        }
    }
}
