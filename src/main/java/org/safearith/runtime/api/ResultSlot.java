package org.safearith.runtime.api;

import org.safearith.runtime.model.TypedValue;

import java.util.Objects;

/**
 * A single-value destination for checked operations.
 * Operations write the slot only after they have succeeded completely, so a refused operation
 * leaves the previous content (or the empty state) untouched.
 * <p>
 * A slot is not thread-safe; it belongs to the caller that passes it in.
 */
public final class ResultSlot {

    private TypedValue value;

    /**
     * Creates an empty slot.
     */
    public ResultSlot() {
    }

    /**
     * Creates a slot holding an initial value.
     * @param initial The initial content.
     */
    public ResultSlot(TypedValue initial) {
        this.value = Objects.requireNonNull(initial, "initial");
    }

    /**
     * @return {@code true} if the slot holds a value.
     */
    public boolean isPresent() {
        return value != null;
    }

    /**
     * @return The current content.
     * @throws IllegalStateException if the slot is empty.
     */
    public TypedValue get() {
        if (value == null) {
            throw new IllegalStateException("Result slot is empty.");
        }
        return value;
    }

    /**
     * @return The payload of the current content.
     * @throws IllegalStateException if the slot is empty.
     */
    public long longValue() {
        return get().payload();
    }

    /**
     * Replaces the content of the slot.
     * @param newValue The new content.
     */
    public void set(TypedValue newValue) {
        this.value = Objects.requireNonNull(newValue, "newValue");
    }

    @Override
    public String toString() {
        return "ResultSlot[" + (value == null ? "empty" : value) + "]";
    }
}
