package io.oidcendpoint.server.core;

import io.oidcendpoint.server.spi.EndpointContext;
import io.oidcendpoint.server.spi.ExtraArgs;
import io.oidcendpoint.server.spi.Hook;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable, ordered sequence of {@link Hook}s run at one extension point.
 *
 * <p>{@link #run} folds the value through the hooks in configuration order. An empty chain
 * returns its input.
 */
public final class HookChain<V, A> {

    private final List<Hook<V, A>> hooks;

    private HookChain(List<Hook<V, A>> hooks) {
        this.hooks = hooks;
    }

    public static <V, A> HookChain<V, A> empty() {
        return new HookChain<>(List.of());
    }

    public static <V, A> HookChain<V, A> of(List<? extends Hook<V, A>> hooks) {
        Objects.requireNonNull(hooks, "hooks");
        List<Hook<V, A>> copy = new ArrayList<>(hooks.size());
        for (Hook<V, A> h : hooks) {
            copy.add(Objects.requireNonNull(h, "hook"));
        }
        return new HookChain<>(List.copyOf(copy));
    }

    /** Returns a chain running this chain's hooks followed by {@code hook}. */
    public HookChain<V, A> then(Hook<V, A> hook) {
        List<Hook<V, A>> copy = new ArrayList<>(hooks);
        copy.add(Objects.requireNonNull(hook, "hook"));
        return new HookChain<>(List.copyOf(copy));
    }

    /**
     * @throws NullPointerException if a hook returns null
     */
    public V run(EndpointContext context, V initial, A arg, ExtraArgs extra) {
        V value = initial;
        for (int i = 0; i < hooks.size(); i++) {
            int index = i;
            value = Objects.requireNonNull(hooks.get(i).apply(context, value, arg, extra),
                    () -> "Hook #" + index + " returned null");
        }
        return value;
    }

    public int size() {
        return hooks.size();
    }

    public boolean isEmpty() {
        return hooks.isEmpty();
    }
}
