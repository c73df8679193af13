package io.colframe.runtime.dispatch;

import io.colframe.core.ColumnType;
import io.colframe.core.UnsupportedKindException;
import io.colframe.core.UnsupportedShapeException;
import io.colframe.runtime.KeyHandler;
import io.colframe.runtime.KeyHandlerRegistry;
import io.colframe.runtime.KeyPlan;
import io.colframe.storage.DataFrameView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves the runtime types of up to three key columns into a typed
 * {@link KeyPlan}.
 * <p>
 * Resolution walks the key columns in order: the kind of the first unresolved
 * column selects its handler, then resolution descends into the next column with
 * the handlers resolved so far as type parameters. The arity cap of three bounds
 * the number of distinct plans to one per kind tuple (7<sup>3</sup> scalar
 * tuples at the cap). Every failure happens here, before any row is read.
 * <p>
 * Resolved plans are cached by (kind tuple, usage).
 */
public final class KeyDispatcher {

    /**
     * Largest number of key columns a plan can have.
     */
    public static final int MAX_KEY_COLUMNS = 3;

    private static final Logger LOG = LoggerFactory.getLogger(KeyDispatcher.class);

    private final KeyHandlerRegistry registry;
    private final boolean cacheEnabled;
    private final Map<PlanSignature, KeyPlan<?>> cache = new ConcurrentHashMap<>();

    public KeyDispatcher(KeyHandlerRegistry registry, boolean cacheEnabled) {
        if (registry == null) {
            throw new IllegalArgumentException("registry required");
        }
        this.registry = registry;
        this.cacheEnabled = cacheEnabled;
    }

    public static KeyDispatcher defaultDispatcher() {
        return new KeyDispatcher(KeyHandlerRegistry.getDefault(), true);
    }

    /**
     * Resolve the plan for the key columns of a view.
     *
     * @throws IllegalArgumentException   if a column index is out of range
     * @throws UnsupportedShapeException  if the arity is not 1..3 or a vector key is not allowed
     * @throws UnsupportedKindException   if a column kind has no handler
     */
    public KeyPlan<?> resolve(DataFrameView view, int[] keyColumns, KeyUsage usage) {
        checkArity(keyColumns == null ? 0 : keyColumns.length, usage);
        var types = new ColumnType[keyColumns.length];
        for (var i = 0; i < keyColumns.length; i++) {
            types[i] = view.columnType(keyColumns[i]);
        }
        return resolve(types, usage);
    }

    /**
     * Resolve the plan for a tuple of key column types.
     */
    public KeyPlan<?> resolve(ColumnType[] types, KeyUsage usage) {
        checkArity(types == null ? 0 : types.length, usage);
        if (!cacheEnabled) {
            return resolveFirst(types, usage);
        }
        var signature = new PlanSignature(List.of(types), usage);
        var plan = cache.get(signature);
        if (plan == null) {
            plan = resolveFirst(types, usage);
            var existing = cache.putIfAbsent(signature, plan);
            if (existing != null) {
                plan = existing;
            } else {
                LOG.debug("Cached {} key plan for {}", usage, signature.types());
            }
        }
        return plan;
    }

    /**
     * Number of cached plans.
     */
    public int cachedPlanCount() {
        return cache.size();
    }

    private static void checkArity(int arity, KeyUsage usage) {
        if (arity == 0) {
            throw new UnsupportedShapeException(usage.operationName() + " requires at least one key column");
        }
        if (arity > MAX_KEY_COLUMNS) {
            throw new UnsupportedShapeException(usage.operationName() + " is not implemented for "
                    + arity + " columns, at most " + MAX_KEY_COLUMNS + " key columns are supported");
        }
    }

    private KeyPlan<?> resolveFirst(ColumnType[] types, KeyUsage usage) {
        KeyHandler<?> first = handler(types[0], usage);
        if (types.length == 1) {
            return KeyPlans.plan(first);
        }
        return resolveSecond(first, types, usage);
    }

    private <A> KeyPlan<?> resolveSecond(KeyHandler<A> first, ColumnType[] types, KeyUsage usage) {
        KeyHandler<?> second = handler(types[1], usage);
        if (types.length == 2) {
            return KeyPlans.plan(first, second);
        }
        return resolveThird(first, second, types, usage);
    }

    private <A, B> KeyPlan<?> resolveThird(KeyHandler<A> first, KeyHandler<B> second,
            ColumnType[] types, KeyUsage usage) {
        KeyHandler<?> third = handler(types[2], usage);
        LOG.debug("Resolved {} key plan for {}", usage, List.of(types));
        return KeyPlans.plan(first, second, third);
    }

    private KeyHandler<?> handler(ColumnType type, KeyUsage usage) {
        if (type.isVector() && !usage.vectorKeysAllowed()) {
            throw new UnsupportedShapeException(usage.operationName()
                    + " is not implemented for vector key column of type '" + type + "'");
        }
        KeyHandler<?> handler = registry.getHandler(type);
        if (handler == null) {
            throw new UnsupportedKindException(usage.operationName(), type);
        }
        return handler;
    }

    private record PlanSignature(List<ColumnType> types, KeyUsage usage) {
    }
}
