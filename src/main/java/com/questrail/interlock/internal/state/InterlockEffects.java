package com.questrail.interlock.internal.state;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * InterlockEffects
 * -----------------------------------------------------------------------------
 * Ordered, immutable list of {@link InterlockEffect}s produced by one
 * reduction.
 *
 * <p>Order matters: effects are executed in the order the reducer emitted
 * them, so a lock write precedes the watchdog that supervises it.</p>
 */
public final class InterlockEffects
{
    private static final InterlockEffects NONE = new InterlockEffects(List.of());

    private final List<InterlockEffect> effects;

    private InterlockEffects(List<InterlockEffect> effects) {
        this.effects = List.copyOf(effects);
    }

    public static InterlockEffects none() {
        return NONE;
    }

    public List<InterlockEffect> asList() {
        return effects;
    }

    public boolean isEmpty() {
        return effects.isEmpty();
    }

    public int size() {
        return effects.size();
    }

    /**
     * Returns the effects of one type, in emission order.
     */
    public <T extends InterlockEffect> List<T> ofType(Class<T> type) {
        Objects.requireNonNull(type, "type");
        List<T> out = new ArrayList<>();
        for (InterlockEffect e : effects) {
            if (type.isInstance(e)) {
                out.add(type.cast(e));
            }
        }
        return out;
    }

    public boolean contains(InterlockEffect effect) {
        return effects.contains(effect);
    }

    @Override
    public String toString() {
        return "InterlockEffects" + effects;
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<InterlockEffect> effects = new ArrayList<>();

        private Builder() {}

        public Builder add(InterlockEffect effect) {
            effects.add(Objects.requireNonNull(effect, "effect"));
            return this;
        }

        public InterlockEffects build() {
            return effects.isEmpty() ? NONE : new InterlockEffects(effects);
        }
    }
}
