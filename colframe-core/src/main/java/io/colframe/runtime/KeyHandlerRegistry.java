package io.colframe.runtime;

import io.colframe.core.ColumnType;
import io.colframe.core.TypeCodes;
import io.colframe.runtime.handler.BooleanKeyHandler;
import io.colframe.runtime.handler.DoubleKeyHandler;
import io.colframe.runtime.handler.FloatKeyHandler;
import io.colframe.runtime.handler.IntKeyHandler;
import io.colframe.runtime.handler.LongKeyHandler;
import io.colframe.runtime.handler.StringKeyHandler;
import io.colframe.runtime.handler.UIntKeyHandler;
import io.colframe.runtime.handler.VectorKeyHandler;

import java.util.Arrays;

/**
 * Registry for key handlers.
 *
 * <p>Maps column types to the handler that reads and orders them. Scalar and
 * vector handlers live in two tables indexed by type code, so a lookup is a
 * direct array access.
 *
 * <p>Example usage:
 * <pre>
 * KeyHandlerRegistry registry = KeyHandlerRegistry.getDefault();
 * KeyHandler&lt;?&gt; handler = registry.getHandler(ColumnType.LONG);
 * </pre>
 *
 * <p>The default registry knows the seven scalar kinds and vectors of those
 * kinds. Int16, and vectors of Int16, have no handler.
 */
public class KeyHandlerRegistry {

    private final KeyHandler<?>[] scalarHandlers = new KeyHandler<?>[TypeCodes.TYPE_COUNT];
    private final KeyHandler<?>[] vectorHandlers = new KeyHandler<?>[TypeCodes.TYPE_COUNT];

    /**
     * Create a new registry with default handlers registered.
     */
    public KeyHandlerRegistry() {
        this(true);
    }

    private KeyHandlerRegistry(boolean registerDefaults) {
        if (registerDefaults) {
            registerDefaultHandlers();
        }
    }

    /**
     * Create an empty registry (no default handlers).
     */
    public static KeyHandlerRegistry empty() {
        return new KeyHandlerRegistry(false);
    }

    /**
     * Get the default shared registry instance.
     */
    public static KeyHandlerRegistry getDefault() {
        return DefaultHolder.INSTANCE;
    }

    private void registerDefaultHandlers() {
        registerHandler(new BooleanKeyHandler());
        registerHandler(new IntKeyHandler());
        registerHandler(new UIntKeyHandler());
        registerHandler(new LongKeyHandler());
        registerHandler(new FloatKeyHandler());
        registerHandler(new DoubleKeyHandler());
        registerHandler(new StringKeyHandler());
        for (var itemTypeCode = 0; itemTypeCode < TypeCodes.TYPE_COUNT; itemTypeCode++) {
            if (TypeCodes.isKeyable((byte) itemTypeCode)) {
                registerHandler(new VectorKeyHandler((byte) itemTypeCode));
            }
        }
    }

    /**
     * Register a key handler, replacing any handler for the same column type.
     *
     * @param <T> the type the handler supports
     * @param handler the handler to register
     */
    public synchronized <T> void registerHandler(KeyHandler<T> handler) {
        var type = handler.getColumnType();
        table(type)[type.itemTypeCode()] = handler;
    }

    /**
     * Get the handler for a column type.
     *
     * @param type the column type
     * @return the handler, or null if none is registered
     */
    @SuppressWarnings("unchecked")
    public <T> KeyHandler<T> getHandler(ColumnType type) {
        return (KeyHandler<T>) table(type)[type.itemTypeCode()];
    }

    public boolean hasHandler(ColumnType type) {
        return getHandler(type) != null;
    }

    /**
     * Clear all registered handlers.
     */
    public synchronized void clear() {
        Arrays.fill(scalarHandlers, null);
        Arrays.fill(vectorHandlers, null);
    }

    private KeyHandler<?>[] table(ColumnType type) {
        return type.isVector() ? vectorHandlers : scalarHandlers;
    }

    private static final class DefaultHolder {
        private static final KeyHandlerRegistry INSTANCE = new KeyHandlerRegistry();
    }
}
