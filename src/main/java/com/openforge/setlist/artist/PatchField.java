package com.openforge.setlist.artist;

import java.util.function.Consumer;

/**
 * One field of a partial update. Distinguishes "not sent" from "sent as
 * null": an absent field leaves the stored value alone, a present null
 * clears it.
 */
public final class PatchField<T> {

    private final boolean present;
    private final T       value;

    private PatchField(boolean present, T value) {
        this.present = present;
        this.value   = value;
    }

    public static <T> PatchField<T> absent() {
        return new PatchField<>(false, null);
    }

    /** A field that was sent; {@code value} may be null to clear. */
    public static <T> PatchField<T> of(T value) {
        return new PatchField<>(true, value);
    }

    public boolean isPresent() {
        return present;
    }

    public T value() {
        return value;
    }

    public void applyTo(Consumer<? super T> setter) {
        if (present) {
            setter.accept(value);
        }
    }

    @Override
    public String toString() {
        return present ? "PatchField[" + value + "]" : "PatchField[absent]";
    }
}
